package io.intellixity.quire.persistence.pagination;

import io.intellixity.quire.persistence.config.PaginationSettings;
import io.intellixity.quire.persistence.query.*;
import io.intellixity.quire.persistence.spi.DocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Keyset paging. The requested sort gets the identifier appended as a tie-breaker, one extra
 * record is fetched to detect more results, and backward pages are read in inverted order and
 * flipped back before returning.
 */
public final class CursorPaginator {
  private static final Logger log = LoggerFactory.getLogger(CursorPaginator.class);

  private final DocumentStore store;
  private final PaginationSettings settings;
  private final CursorCodec codec;

  public CursorPaginator(DocumentStore store, PaginationSettings settings, CursorCodec codec) {
    this.store = Objects.requireNonNull(store, "store");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.codec = Objects.requireNonNull(codec, "codec");
  }

  public CursorPaginationResult<Map<String, Object>> paginate(String collection, QueryElement filter,
                                                             CursorPaginationParams params) {
    return paginate(collection, filter, params, DocumentReader.identity());
  }

  public <T> CursorPaginationResult<T> paginate(String collection, QueryElement filter,
                                                CursorPaginationParams params, DocumentReader<T> reader) {
    Objects.requireNonNull(collection, "collection");
    Objects.requireNonNull(params, "params");
    Objects.requireNonNull(reader, "reader");
    long start = System.nanoTime();

    int limit = settings.clampLimit(params.limit());
    List<SortField> sort = SortField.withTieBreaker(params.sort(), settings.idField());
    boolean backward = params.direction() == CursorPaginationParams.Direction.BACKWARD;
    CursorValues cursor = (params.cursor() == null) ? null : codec.decode(params.cursor(), sort);

    List<SortField> querySort = backward ? SortField.reverse(sort) : sort;
    QueryElement keyset = (cursor == null) ? null : KeysetPredicates.after(querySort, cursor);
    Query q = Query.of(QueryFilters.allOf(filter, keyset))
        .withSort(querySort)
        .withPage(OffsetPage.of(0, limit + 1));

    List<Map<String, Object>> docs;
    try {
      docs = store.find(collection, q);
    } catch (RuntimeException e) {
      log.error("quire.pagination op=cursor collection={} direction={} failed", collection, params.direction(), e);
      throw e;
    }

    boolean more = docs.size() > limit;
    List<Map<String, Object>> page = new ArrayList<>(more ? docs.subList(0, limit) : docs);
    if (backward) Collections.reverse(page);

    // a cursor means there is something on the side we came from
    boolean hasNext = backward ? cursor != null : more;
    boolean hasPrev = backward ? more : cursor != null;
    String next = null;
    String prev = null;
    if (!page.isEmpty()) {
      if (hasNext) next = codec.encode(page.get(page.size() - 1), sort, false);
      if (hasPrev) prev = codec.encode(page.get(0), sort, true);
    }

    List<T> out = new ArrayList<>(page.size());
    for (Map<String, Object> d : page) out.add(reader.read(d));

    PerformanceInfo perf = PerformanceInfo.since(start, docs.size());
    log.debug("quire.pagination_done op=cursor collection={} direction={} limit={} returned={} durationMs={}",
        collection, params.direction(), limit, out.size(), perf.executionTimeMs());
    return new CursorPaginationResult<>(out, new CursorPageInfo(limit, hasNext, hasPrev, next, prev), perf);
  }
}
