package io.intellixity.quire.persistence.pagination;

import io.intellixity.quire.persistence.config.PaginationSettings;
import io.intellixity.quire.persistence.query.QueryElement;
import io.intellixity.quire.persistence.query.SortField;
import io.intellixity.quire.persistence.query.pipeline.Stage;
import io.intellixity.quire.persistence.spi.DocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Entry point for paging a collection: offset, cursor and aggregation strategies, plus
 * {@link #smartPaginate} which picks between offset and cursor paging per request.
 */
public final class PaginationOptimizer {
  private static final Logger log = LoggerFactory.getLogger(PaginationOptimizer.class);

  private final PaginationSettings settings;
  private final CursorCodec codec;
  private final OffsetPaginator offset;
  private final CursorPaginator cursor;
  private final AggregationPaginator aggregation;

  public PaginationOptimizer(DocumentStore store, Executor executor, PaginationSettings settings) {
    this(store, executor, settings, CursorCodec.withDiscoveredAdapters(settings.idField()));
  }

  public PaginationOptimizer(DocumentStore store, Executor executor, PaginationSettings settings, CursorCodec codec) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.offset = new OffsetPaginator(store, executor, settings);
    this.cursor = new CursorPaginator(store, settings, codec);
    this.aggregation = new AggregationPaginator(store, settings);
  }

  public CursorCodec codec() { return codec; }

  public PaginationResult<Map<String, Object>> paginateWithOffset(String collection, QueryElement filter,
                                                                  PaginationParams params) {
    return offset.paginate(collection, filter, params);
  }

  public <T> PaginationResult<T> paginateWithOffset(String collection, QueryElement filter, PaginationParams params,
                                                    DocumentReader<T> reader) {
    return offset.paginate(collection, filter, params, reader);
  }

  public CursorPaginationResult<Map<String, Object>> paginateWithCursor(String collection, QueryElement filter,
                                                                        CursorPaginationParams params) {
    return cursor.paginate(collection, filter, params);
  }

  public <T> CursorPaginationResult<T> paginateWithCursor(String collection, QueryElement filter,
                                                          CursorPaginationParams params, DocumentReader<T> reader) {
    return cursor.paginate(collection, filter, params, reader);
  }

  public PaginationResult<Map<String, Object>> paginateAggregation(String collection, List<Stage> pipeline,
                                                                   PaginationParams params) {
    return aggregation.paginate(collection, pipeline, params);
  }

  public <T> PaginationResult<T> paginateAggregation(String collection, List<Stage> pipeline, PaginationParams params,
                                                     DocumentReader<T> reader) {
    return aggregation.paginate(collection, pipeline, params, reader);
  }

  public PageResult<Map<String, Object>> smartPaginate(String collection, QueryElement filter, PaginationParams params) {
    return smartPaginate(collection, filter, params, DocumentReader.identity());
  }

  /**
   * Cursor paging when the request carries a cursor or asks for a page past
   * {@link PaginationSettings#cursorPreferenceThreshold()}; offset paging otherwise.\n
   *
   * A cursor minted as a previous-page cursor continues backward.
   */
  public <T> PageResult<T> smartPaginate(String collection, QueryElement filter, PaginationParams params,
                                         DocumentReader<T> reader) {
    Objects.requireNonNull(params, "params");
    boolean useCursor = params.cursor() != null || params.page() > settings.cursorPreferenceThreshold();
    if (!useCursor) {
      return offset.paginate(collection, filter, params, reader);
    }

    List<SortField> sort = params.sort().isEmpty() ? List.of(SortField.asc(settings.idField())) : params.sort();
    CursorPaginationParams.Direction direction = CursorPaginationParams.Direction.FORWARD;
    if (params.cursor() != null && codec.decode(params.cursor()).reverse()) {
      direction = CursorPaginationParams.Direction.BACKWARD;
    }
    log.debug("quire.pagination op=smart collection={} page={} strategy=cursor direction={}",
        collection, params.page(), direction);
    return cursor.paginate(collection, filter,
        new CursorPaginationParams(params.limit(), params.cursor(), sort, direction), reader);
  }
}
