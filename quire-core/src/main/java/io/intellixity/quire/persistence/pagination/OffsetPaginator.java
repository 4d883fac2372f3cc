package io.intellixity.quire.persistence.pagination;

import io.intellixity.quire.persistence.config.PaginationSettings;
import io.intellixity.quire.persistence.query.*;
import io.intellixity.quire.persistence.spi.CollectionStats;
import io.intellixity.quire.persistence.spi.DocumentStore;
import io.intellixity.quire.persistence.util.Futures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Page-number paging: the page query and the total count run concurrently.\n
 *
 * Past {@link PaginationSettings#approxCountSkipThreshold()} the total is approximated from
 * collection statistics minus the skip; when statistics fail the exact count is used instead.
 */
public final class OffsetPaginator {
  private static final Logger log = LoggerFactory.getLogger(OffsetPaginator.class);

  private final DocumentStore store;
  private final Executor executor;
  private final PaginationSettings settings;

  public OffsetPaginator(DocumentStore store, Executor executor, PaginationSettings settings) {
    this.store = Objects.requireNonNull(store, "store");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  public PaginationResult<Map<String, Object>> paginate(String collection, QueryElement filter, PaginationParams params) {
    return paginate(collection, filter, params, DocumentReader.identity());
  }

  public <T> PaginationResult<T> paginate(String collection, QueryElement filter, PaginationParams params,
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
    if (page > settings.deepPageWarnThreshold()) {
      log.warn("quire.pagination op=offset collection={} page={} deep offset page; prefer cursor pagination",
          collection, page);
    }

    Query q = Query.of(filter).withSort(sort).withPage(OffsetPage.of((int) skip, limit));
    CompletableFuture<List<Map<String, Object>>> data =
        CompletableFuture.supplyAsync(() -> store.find(collection, q), executor);
    CompletableFuture<Long> total =
        CompletableFuture.supplyAsync(() -> count(collection, filter, skip), executor);

    List<Map<String, Object>> docs;
    long count;
    try {
      docs = Futures.join(data);
      count = Futures.join(total);
    } catch (RuntimeException e) {
      log.error("quire.pagination op=offset collection={} page={} failed", collection, page, e);
      throw e;
    }

    List<T> out = new ArrayList<>(docs.size());
    for (Map<String, Object> d : docs) out.add(reader.read(d));

    PerformanceInfo perf = PerformanceInfo.since(start, skip + docs.size());
    log.debug("quire.pagination_done op=offset collection={} page={} limit={} total={} durationMs={}",
        collection, page, limit, count, perf.executionTimeMs());
    return new PaginationResult<>(out, OffsetPageInfo.of(page, limit, count), perf);
  }

  private long count(String collection, QueryElement filter, long skip) {
    if (skip <= settings.approxCountSkipThreshold()) {
      return store.count(collection, filter);
    }
    try {
      CollectionStats stats = store.stats(collection);
      long approx = Math.max(stats.approxCount() - skip, 0);
      log.info("quire.pagination op=offset_count collection={} skip={} approximate total={} from collection stats",
          collection, skip, approx);
      return approx;
    } catch (RuntimeException e) {
      log.info("quire.pagination op=offset_count collection={} stats unavailable, falling back to exact count: {}",
          collection, e.toString());
      return store.count(collection, filter);
    }
  }
}
