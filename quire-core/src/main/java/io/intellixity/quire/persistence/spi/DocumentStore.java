package io.intellixity.quire.persistence.spi;

import io.intellixity.quire.persistence.query.Query;
import io.intellixity.quire.persistence.query.QueryElement;
import io.intellixity.quire.persistence.query.pipeline.Stage;

import java.util.List;
import java.util.Map;

/**
 * Query side of a document store, as consumed by the paginators and loaders.
 * <p>
 * Calls block until the store answers. Failures surface as {@link UpstreamQueryException};
 * callers in this library never retry them.
 */
public interface DocumentStore {
  /** Filter, sort, skip/limit and projection from {@code query}; a null filter matches everything. */
  List<Map<String, Object>> find(String collection, Query query);

  /** Exact number of documents matching {@code filter}. */
  long count(String collection, QueryElement filter);

  List<Map<String, Object>> aggregate(String collection, List<Stage> pipeline);

  /** Collection-level statistics; may be approximate and may fail independently of queries. */
  CollectionStats stats(String collection);
}
