package io.intellixity.quire.persistence.pagination;

import io.intellixity.quire.persistence.config.PaginationSettings;
import io.intellixity.quire.persistence.query.InvalidParametersException;
import io.intellixity.quire.persistence.query.SortField;
import io.intellixity.quire.persistence.query.pipeline.*;
import io.intellixity.quire.persistence.spi.DocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Pages an aggregation pipeline in one round trip: the caller's stages, then a sort, then a
 * facet producing the page window and the total side by side.
 */
public final class AggregationPaginator {
  private static final Logger log = LoggerFactory.getLogger(AggregationPaginator.class);

  static final String DATA = "data";
  static final String COUNT = "count";
  static final String TOTAL = "total";

  private final DocumentStore store;
  private final PaginationSettings settings;

  public AggregationPaginator(DocumentStore store, PaginationSettings settings) {
    this.store = Objects.requireNonNull(store, "store");
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  public PaginationResult<Map<String, Object>> paginate(String collection, List<Stage> pipeline,
                                                        PaginationParams params) {
    return paginate(collection, pipeline, params, DocumentReader.identity());
  }

  public <T> PaginationResult<T> paginate(String collection, List<Stage> pipeline, PaginationParams params,
                                          DocumentReader<T> reader) {
    Objects.requireNonNull(collection, "collection");
    Objects.requireNonNull(params, "params");
    Objects.requireNonNull(reader, "reader");
    long start = System.nanoTime();

    int page = params.page();
    int limit = settings.clampLimit(params.limit());
    List<SortField> sort = params.sort().isEmpty()
        ? List.of(SortField.asc(settings.idField()))
        : SortField.withTieBreaker(params.sort(), settings.idField());
    long skip = (long) (page - 1) * limit;
    if (skip > Integer.MAX_VALUE) {
      throw new InvalidParametersException("page " + page + " is beyond the addressable range for limit " + limit);
    }

    List<Stage> full = new ArrayList<>(pipeline == null ? List.of() : pipeline);
    full.add(Pipelines.sort(sort));
    full.add(Pipelines.facet(
        DATA, List.of(Pipelines.skip((int) skip), Pipelines.limit(limit)),
        COUNT, List.of(Pipelines.count(TOTAL))));

    List<Map<String, Object>> rows;
    try {
      rows = store.aggregate(collection, full);
    } catch (RuntimeException e) {
      log.error("quire.pagination op=aggregate collection={} page={} failed", collection, page, e);
      throw e;
    }

    Map<String, Object> facet = rows.isEmpty() ? Map.of() : rows.get(0);
    List<T> out = new ArrayList<>();
    if (facet.get(DATA) instanceof List<?> data) {
      for (Object o : data) out.add(reader.read(asDocument(o)));
    }
    long total = 0;
    if (facet.get(COUNT) instanceof List<?> counts && !counts.isEmpty()
        && asDocument(counts.get(0)).get(TOTAL) instanceof Number n) {
      total = n.longValue();
    }

    PerformanceInfo perf = PerformanceInfo.since(start, total);
    log.debug("quire.pagination_done op=aggregate collection={} page={} limit={} total={} durationMs={}",
        collection, page, limit, total, perf.executionTimeMs());
    return new PaginationResult<>(out, OffsetPageInfo.of(page, limit, total), perf);
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> asDocument(Object o) {
    if (o instanceof Map<?, ?> m) return (Map<String, Object>) m;
    throw new IllegalStateException("Expected a document in facet output but got " + o);
  }
}
