package io.intellixity.quire.persistence.relation;

import io.intellixity.quire.persistence.config.RelationSettings;
import io.intellixity.quire.persistence.memory.InMemoryDocumentStore;
import io.intellixity.quire.persistence.memory.InMemoryKeyValueCache;
import io.intellixity.quire.persistence.query.InvalidParametersException;
import io.intellixity.quire.persistence.query.SortField;
import io.intellixity.quire.persistence.query.pipeline.Pipelines;
import io.intellixity.quire.persistence.query.pipeline.Stage;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static io.intellixity.quire.persistence.query.QueryFilters.*;
import static io.intellixity.quire.persistence.relation.Blog.*;
import static org.junit.jupiter.api.Assertions.*;

final class RelationOptimizerTest {
  private static final QueryOptions BY_ID = QueryOptions.none().withSort(List.of(SortField.asc("_id")));
  private static final RelationConfig AUTHOR = Relations.of("users", "authorId", "_id", "author");

  @SuppressWarnings("unchecked")
  private static List<Map<String, Object>> related(Map<String, Object> rec, String field) {
    return (List<Map<String, Object>>) rec.get(field);
  }

  private static RelationOptimizer optimizer(InMemoryDocumentStore store, RelationSettings settings) {
    return new RelationOptimizer(store, new InMemoryKeyValueCache(100), DIRECT, settings);
  }

  @Test
  void join_dropsRecordsWithoutMatches() {
    RelationOptimizer o = optimizer(store(), RelationSettings.defaults());

    LoadResult<Map<String, Object>> r = o.findWithRelations("posts", null, List.of(AUTHOR), BY_ID);

    assertEquals(List.of("p1", "p2"), ids(r.data()));
    assertEquals("ann", related(r.data().get(0), "author").get(0).get("name"));
    assertFalse(r.fromCache());
    assertNull(r.batchInfo());
  }

  @Test
  void join_keepsUnmatchedRecords_whenAsked() {
    RelationOptimizer o = optimizer(store(), RelationSettings.defaults());

    LoadResult<Map<String, Object>> r = o.findWithRelations("posts", null,
        List.of(AUTHOR.withPreserveEmptyMatches(true)), BY_ID);

    assertEquals(List.of("p1", "p2", "p3"), ids(r.data()));
    assertTrue(related(r.data().get(2), "author").isEmpty());
  }

  @Test
  void join_appliesFilterWindowAndJoinProjection() {
    RelationOptimizer o = optimizer(store(), RelationSettings.defaults());
    QueryOptions options = QueryOptions.none().withSort(List.of(SortField.desc("_id"))).withLimit(1);

    LoadResult<Map<String, Object>> r = o.findWithRelations("posts", in("_id", List.of("p1", "p2")),
        List.of(Relations.projected("users", "authorId", "author", "name")), options);

    assertEquals(List.of("p2"), ids(r.data()));
    Map<String, Object> author = related(r.data().get(0), "author").get(0);
    assertEquals("bob", author.get("name"));
    assertFalse(author.containsKey("team"));
  }

  @Test
  void cachedRelation_servesRepeatQueriesFromCache() {
    InMemoryDocumentStore store = store();
    RelationOptimizer o = optimizer(store, RelationSettings.defaults());
    List<RelationConfig> relations = List.of(AUTHOR.withCache("posts-with-authors", 60L));

    LoadResult<Map<String, Object>> first = o.findWithRelations("posts", null, relations, BY_ID);
    LoadResult<Map<String, Object>> second = o.findWithRelations("posts", null, relations, BY_ID);

    assertFalse(first.fromCache());
    assertTrue(second.fromCache());
    assertEquals(first.data(), second.data());
    assertEquals(1, store.aggregateCalls());
  }

  @Test
  void uncachedRelation_alwaysHitsTheStore() {
    InMemoryDocumentStore store = store();
    RelationOptimizer o = optimizer(store, RelationSettings.defaults());

    o.findWithRelations("posts", null, List.of(AUTHOR), BY_ID);
    o.findWithRelations("posts", null, List.of(AUTHOR), BY_ID);

    assertEquals(2, store.aggregateCalls());
  }

  @Test
  void batchStrategy_attachesEveryRelation_andKeepsUnmatched() {
    RelationOptimizer o = optimizer(store(), RelationSettings.defaults());
    QueryOptions options = QueryOptions.none().withSort(List.of(SortField.desc("_id"))).withLimit(2);

    LoadResult<Map<String, Object>> r = o.executeBatchStrategy("posts", null,
        List.of(AUTHOR, Relations.of("tags", "tagIds", "_id", "tags")), options);

    assertEquals(List.of("p3", "p2"), ids(r.data()));
    assertTrue(related(r.data().get(0), "author").isEmpty());
    assertEquals(List.of(2), ids(related(r.data().get(1), "author")));
    assertEquals(List.of("t2"), ids(related(r.data().get(1), "tags")));
  }

  @Test
  void smartQuery_joinsSimpleRequests() {
    InMemoryDocumentStore store = store();
    RelationOptimizer o = optimizer(store, RelationSettings.defaults());

    LoadResult<Map<String, Object>> r = o.smartRelationQuery("posts", eq("authorId", 1), List.of(AUTHOR), BY_ID);

    assertEquals(List.of("p1"), ids(r.data()));
    assertEquals(1, store.aggregateCalls());
    assertEquals(0, store.findCalls());
  }

  @Test
  void smartQuery_batchesAboveTheThreshold() {
    InMemoryDocumentStore store = store();
    RelationOptimizer o = optimizer(store, RelationSettings.defaults().withComplexityThreshold(0.1));

    LoadResult<Map<String, Object>> r = o.smartRelationQuery("posts",
        or(gt("authorId", 1), in("_id", List.of("p1"))), List.of(AUTHOR), BY_ID);

    assertEquals(List.of("p1", "p2", "p3"), ids(r.data()));
    assertEquals(0, store.aggregateCalls());
    assertEquals(2, store.findCalls());
  }

  @Test
  void pipelineCacheKey_isStableAndContentAddressed() {
    RelationOptimizer o = optimizer(store(), RelationSettings.defaults());
    List<Stage> a = o.relationPipeline(eq("authorId", 1), List.of(AUTHOR), BY_ID);
    List<Stage> b = o.relationPipeline(eq("authorId", 1), List.of(AUTHOR), BY_ID);
    List<Stage> c = o.relationPipeline(eq("authorId", 2), List.of(AUTHOR), BY_ID);

    String key = RelationOptimizer.cacheKey("posts", a);
    assertTrue(key.matches("relation:posts:[0-9a-f]{16}"), key);
    assertEquals(key, RelationOptimizer.cacheKey("posts", b));
    assertNotEquals(key, RelationOptimizer.cacheKey("posts", c));
  }

  @Test
  void relationPipeline_layout() {
    RelationOptimizer o = optimizer(store(), RelationSettings.defaults());

    List<Stage> p = o.relationPipeline(eq("status", "x"),
        List.of(AUTHOR, AUTHOR.withPreserveEmptyMatches(true)), QueryOptions.none().withSkip(5).withLimit(5));

    assertEquals(List.of("$match", "$lookup", "$match", "$lookup", "$skip", "$limit"),
        p.stream().map(Stage::name).toList());
  }

  @Test
  void relationConfig_reportsEveryProblem() {
    InvalidParametersException e = assertThrows(InvalidParametersException.class,
        () -> new RelationConfig("", null, "_id", " ", null, false, null, 0L));

    assertTrue(e.getMessage().contains("from must not be blank"));
    assertTrue(e.getMessage().contains("localField must not be blank"));
    assertTrue(e.getMessage().contains("as must not be blank"));
    assertTrue(e.getMessage().contains("cacheTtlSeconds must be > 0"));
  }

  @Test
  void relationsShorthand_fillsDefaults() {
    RelationConfig r = Relations.of("users", "authorId");

    assertEquals("_id", r.foreignField());
    assertEquals("usersData", r.as());
    assertTrue(r.joinPipeline().isEmpty());
    assertFalse(r.preserveEmptyMatches());
    assertFalse(r.cached());
    assertEquals(List.of(Pipelines.project("name")),
        Relations.projected("users", "authorId", "author", "name").joinPipeline());
  }
}
