package io.intellixity.quire.persistence.mongo;

import com.mongodb.MongoException;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import io.intellixity.quire.persistence.query.Query;
import io.intellixity.quire.persistence.query.QueryElement;
import io.intellixity.quire.persistence.query.pipeline.Stage;
import io.intellixity.quire.persistence.spi.CollectionStats;
import io.intellixity.quire.persistence.spi.DocumentStore;
import io.intellixity.quire.persistence.spi.UpstreamQueryException;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * {@link DocumentStore} on the MongoDB sync driver. Returned documents are {@link Document}s,
 * which are plain maps; driver failures surface as {@link UpstreamQueryException}.
 */
public final class MongoDocumentStore implements DocumentStore {
  private static final Logger log = LoggerFactory.getLogger(MongoDocumentStore.class);

  private final MongoHandle handle;
  private final MongoDatabase db;

  public MongoDocumentStore(MongoHandle handle) {
    this.handle = Objects.requireNonNull(handle, "handle");
    this.db = handle.database();
  }

  @Override
  public List<Map<String, Object>> find(String collection, Query query) {
    Query q = (query == null) ? new Query() : query;
    Document filter = MongoQueryRenderer.toBson(q.filter());
    Document sort = MongoQueryRenderer.sort(q.sort());
    log.debug("quire.mongo op=find handleId={} collection={} filter={} sort={} page={}",
        handle.id(), collection, filter.toJson(), sort.toJson(), q.page());

    return call("find", collection, () -> {
      FindIterable<Document> find = col(collection).find(filter);
      if (!sort.isEmpty()) find = find.sort(sort);
      if (q.page() != null) {
        if (q.page().offset() > 0) find = find.skip(q.page().offset());
        if (!q.page().unbounded()) find = find.limit(q.page().limit());
      }
      if (!q.projection().isEmpty()) find = find.projection(MongoQueryRenderer.projection(q.projection()));
      return rows(find);
    });
  }

  @Override
  public long count(String collection, QueryElement filter) {
    Document bson = MongoQueryRenderer.toBson(filter);
    log.debug("quire.mongo op=count handleId={} collection={} filter={}", handle.id(), collection, bson.toJson());
    return call("count", collection, () -> col(collection).countDocuments(bson));
  }

  @Override
  public List<Map<String, Object>> aggregate(String collection, List<Stage> pipeline) {
    List<Document> stages = MongoPipelineRenderer.toBson(pipeline);
    log.debug("quire.mongo op=aggregate handleId={} collection={} stages={}", handle.id(), collection, stages.size());
    return call("aggregate", collection, () -> rows(col(collection).aggregate(stages)));
  }

  /** Uses collection metadata, not a scan; the figure may lag recent writes. */
  @Override
  public CollectionStats stats(String collection) {
    long n = call("stats", collection, () -> col(collection).estimatedDocumentCount());
    return new CollectionStats(collection, n);
  }

  private MongoCollection<Document> col(String collection) {
    return db.getCollection(Objects.requireNonNull(collection, "collection"));
  }

  private static List<Map<String, Object>> rows(Iterable<Document> docs) {
    List<Map<String, Object>> out = new ArrayList<>();
    for (Document d : docs) out.add(d);
    return out;
  }

  private <T> T call(String op, String collection, Supplier<T> body) {
    long start = System.nanoTime();
    try {
      T out = body.get();
      log.debug("quire.mongo_done op={} handleId={} collection={} durationMs={}",
          op, handle.id(), collection, (System.nanoTime() - start) / 1_000_000);
      return out;
    } catch (MongoException e) {
      throw new UpstreamQueryException("Mongo " + op + " on " + collection + " failed: " + e.getMessage(), e);
    }
  }
}
