package io.intellixity.quire.persistence.relation;

import io.intellixity.quire.persistence.memory.InMemoryKeyValueCache;
import io.intellixity.quire.persistence.memory.ScriptedDocumentStore;
import io.intellixity.quire.persistence.query.Condition;
import io.intellixity.quire.persistence.spi.KeyValueCache;
import io.intellixity.quire.persistence.spi.UpstreamQueryException;
import io.intellixity.quire.persistence.util.QuireExecutors;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.function.Function;

import static io.intellixity.quire.persistence.relation.Blog.*;
import static org.junit.jupiter.api.Assertions.*;

final class BatchLoaderTest {
  private static final BatchLoadConfig NO_CACHE = BatchLoadConfig.defaults().withCacheResults(false);

  @Test
  void missingKeys_areSkipped_andEveryChunkIsQueried() {
    ScriptedDocumentStore store = new ScriptedDocumentStore(store());
    BatchLoader loader = new BatchLoader(store, KeyValueCache.none(), DIRECT);

    LoadResult<Map<String, Object>> r = loader.batchLoad("users", List.of(1, 2, 999), "_id",
        NO_CACHE.withBatchSize(1).withMaxConcurrency(1));

    assertEquals(List.of(1, 2), ids(r.data()));
    assertFalse(r.fromCache());
    assertEquals(new LoadResult.BatchInfo(1, 3, 2), r.batchInfo());
    assertEquals(3, store.finds().size());
  }

  @Test
  void emptyKeys_doNotTouchTheStore() {
    ScriptedDocumentStore store = new ScriptedDocumentStore(store());
    BatchLoader loader = new BatchLoader(store, KeyValueCache.none(), DIRECT);

    LoadResult<Map<String, Object>> r = loader.batchLoad("users", List.of(), "_id", NO_CACHE);

    assertTrue(r.data().isEmpty());
    assertEquals(LoadResult.BatchInfo.EMPTY, r.batchInfo());
    assertTrue(store.finds().isEmpty());
  }

  @Test
  void duplicateKeys_areQueriedOnce_acrossNumericTypes() {
    ScriptedDocumentStore store = new ScriptedDocumentStore(store());
    BatchLoader loader = new BatchLoader(store, KeyValueCache.none(), DIRECT);

    LoadResult<Map<String, Object>> r = loader.batchLoad("users", List.of(2, 1, 2L, new BigDecimal("1.0")), "_id", NO_CACHE);

    assertEquals(List.of(2, 1), ids(r.data()));
    assertEquals(1, store.finds().size());
    Condition in = (Condition) store.finds().get(0).filter();
    assertEquals(2, ((List<?>) in.value()).size());
  }

  @Test
  void cachedKeys_areServedFromCache_andOnlyTheRestIsQueried() {
    ScriptedDocumentStore store = new ScriptedDocumentStore(store());
    BatchLoader loader = new BatchLoader(store, new InMemoryKeyValueCache(100), DIRECT);
    BatchLoadConfig config = BatchLoadConfig.defaults();

    LoadResult<Map<String, Object>> first = loader.batchLoad("users", List.of(1, 2), "_id", config);
    LoadResult<Map<String, Object>> second = loader.batchLoad("users", List.of(2, 3), "_id", config);

    assertFalse(first.fromCache());
    assertTrue(second.fromCache());
    assertEquals(List.of(2, 3), ids(second.data()));
    assertEquals(2, store.finds().size());
    Condition in = (Condition) store.finds().get(1).filter();
    assertEquals(List.of(3), in.value());

    LoadResult<Map<String, Object>> uncached = new BatchLoader(store(), KeyValueCache.none(), DIRECT)
        .batchLoad("users", List.of(2, 3), "_id", NO_CACHE);
    assertEquals(uncached.data(), second.data());
  }

  @Test
  void cachedRecords_areIsolatedFromCallerMutation() {
    BatchLoader loader = new BatchLoader(store(), new InMemoryKeyValueCache(100), DIRECT);
    BatchLoadConfig config = BatchLoadConfig.defaults();

    loader.batchLoad("users", List.of(1), "_id", config).data().get(0).put("name", "changed");

    assertEquals("ann", loader.batchLoad("users", List.of(1), "_id", config).data().get(0).get("name"));
  }

  @Test
  void arrayValuedKeyField_returnsEachRecordOnce() {
    BatchLoader loader = new BatchLoader(store(), KeyValueCache.none(), DIRECT);

    LoadResult<Map<String, Object>> r = loader.batchLoad("posts", List.of("t2", "t1"), "tagIds", NO_CACHE);

    assertEquals(List.of("p1", "p2"), ids(r.data()));
    assertEquals(2, r.batchInfo().totalItems());
  }

  @Test
  void storeFailure_propagates() {
    ScriptedDocumentStore store = new ScriptedDocumentStore(store()).failFindOn("users");
    BatchLoader loader = new BatchLoader(store, KeyValueCache.none(), DIRECT);

    assertThrows(UpstreamQueryException.class,
        () -> loader.batchLoad("users", List.of(1, 2), "_id", NO_CACHE.withBatchSize(1)));
  }

  @Test
  void inFlightChunks_neverExceedMaxConcurrency() {
    ScriptedDocumentStore store = new ScriptedDocumentStore(store()).slowFinds(30);
    ExecutorService pool = QuireExecutors.fixedDaemonPool("batch-test", 4);
    try {
      BatchLoader loader = new BatchLoader(store, KeyValueCache.none(), pool);

      LoadResult<Map<String, Object>> r = loader.batchLoad("users", List.of(1, 2, 3, 4, 5, 6), "_id",
          NO_CACHE.withBatchSize(1).withMaxConcurrency(2));

      assertEquals(List.of(1, 2, 3), ids(r.data()));
      assertEquals(6, store.finds().size());
      assertTrue(store.maxConcurrentFinds() <= 2, "max in flight " + store.maxConcurrentFinds());
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void dataLoader_keepsKeyOrder() {
    BatchLoader loader = new BatchLoader(store(), KeyValueCache.none(), DIRECT);
    Function<List<?>, List<Map<String, Object>>> users = loader.dataLoader("users", "_id", NO_CACHE);

    assertEquals(List.of(3, 1), ids(users.apply(List.of(3, 1))));
  }

  @Test
  void cacheKey_normalizesNumbers() {
    assertEquals("batch:users:_id:1", BatchLoader.cacheKey("users", "_id", 1));
    assertEquals(BatchLoader.cacheKey("users", "_id", 1L), BatchLoader.cacheKey("users", "_id", new BigDecimal("1.00")));
    assertEquals("batch:users:_id:100", BatchLoader.cacheKey("users", "_id", 100));
  }
}
