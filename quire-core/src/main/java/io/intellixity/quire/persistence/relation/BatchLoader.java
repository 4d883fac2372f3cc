package io.intellixity.quire.persistence.relation;

import io.intellixity.quire.persistence.memory.Documents;
import io.intellixity.quire.persistence.query.InvalidParametersException;
import io.intellixity.quire.persistence.query.Query;
import io.intellixity.quire.persistence.query.QueryFilters;
import io.intellixity.quire.persistence.spi.DocumentStore;
import io.intellixity.quire.persistence.spi.KeyValueCache;
import io.intellixity.quire.persistence.util.Futures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Function;

/**
 * Dataloader-style batch lookup: many single-key lookups become a few {@code keyField IN (...)}
 * queries.\n
 *
 * Keys are deduplicated, then served from the cache where possible. The rest is split into
 * chunks of {@code batchSize}; up to {@code maxConcurrency} chunks run at once and windows run
 * one after another. Loaded records are cached per key under
 * {@code batch:<collection>:<keyField>:<key>}, so a later single-key lookup can hit. Results come
 * back in key order; a record reachable through several keys (array-valued key fields) is
 * returned once.
 */
public final class BatchLoader {
  private static final Logger log = LoggerFactory.getLogger(BatchLoader.class);

  private final DocumentStore store;
  private final KeyValueCache cache;
  private final Executor executor;
  private final String idField;

  public BatchLoader(DocumentStore store, KeyValueCache cache, Executor executor) {
    this(store, cache, executor, "_id");
  }

  public BatchLoader(DocumentStore store, KeyValueCache cache, Executor executor, String idField) {
    this.store = Objects.requireNonNull(store, "store");
    this.cache = (cache == null) ? KeyValueCache.none() : cache;
    this.executor = Objects.requireNonNull(executor, "executor");
    this.idField = Objects.requireNonNull(idField, "idField");
  }

  public static String cacheKey(String collection, String keyField, Object key) {
    Object k = Documents.normalizeKey(key);
    String text = (k instanceof BigDecimal bd) ? bd.toPlainString() : String.valueOf(k);
    return "batch:" + collection + ":" + keyField + ":" + text;
  }

  public LoadResult<Map<String, Object>> batchLoad(String collection, Collection<?> keys, String keyField,
                                                   BatchLoadConfig config) {
    Objects.requireNonNull(collection, "collection");
    Objects.requireNonNull(keys, "keys");
    Objects.requireNonNull(config, "config");
    if (keyField == null || keyField.isBlank()) throw new InvalidParametersException("keyField must not be blank");
    long start = System.nanoTime();

    if (keys.isEmpty()) {
      return new LoadResult<>(List.of(), false, elapsedMs(start), LoadResult.BatchInfo.EMPTY);
    }

    // normalized key -> first-seen raw key
    Map<Object, Object> unique = new LinkedHashMap<>();
    for (Object k : keys) {
      if (k != null) unique.putIfAbsent(Documents.normalizeKey(k), k);
    }

    Map<Object, List<Map<String, Object>>> byKey = new HashMap<>();
    List<Object> uncached = new ArrayList<>();
    boolean anyCached = false;
    for (Map.Entry<Object, Object> e : unique.entrySet()) {
      List<Map<String, Object>> hit = config.cacheResults() ? cachedRecords(collection, keyField, e.getValue()) : null;
      if (hit != null) {
        byKey.put(e.getKey(), hit);
        anyCached = true;
      } else {
        uncached.add(e.getValue());
      }
    }

    List<List<Object>> chunks = partition(uncached, config.batchSize());
    List<Map<String, Object>> fresh = new ArrayList<>();
    try {
      for (List<List<Object>> window : partition(chunks, config.maxConcurrency())) {
        List<CompletableFuture<List<Map<String, Object>>>> inFlight = new ArrayList<>(window.size());
        for (List<Object> chunk : window) {
          Query q = Query.of(QueryFilters.in(keyField, chunk));
          inFlight.add(CompletableFuture.supplyAsync(() -> store.find(collection, q), executor));
        }
        for (List<Map<String, Object>> rows : Futures.joinAll(inFlight)) fresh.addAll(rows);
      }
    } catch (RuntimeException e) {
      log.error("quire.relation op=batch_load collection={} keyField={} keyCount={} failed",
          collection, keyField, unique.size(), e);
      throw e;
    }

    Map<Object, List<Map<String, Object>>> freshByKey = group(fresh, keyField);
    for (Object k : uncached) {
      Object nk = Documents.normalizeKey(k);
      List<Map<String, Object>> rows = freshByKey.get(nk);
      if (rows == null) continue;
      byKey.put(nk, rows);
      if (config.cacheResults()) {
        List<Map<String, Object>> copies = new ArrayList<>(rows.size());
        for (Map<String, Object> r : rows) copies.add(Documents.copy(r));
        cache.set(cacheKey(collection, keyField, k), copies, config.cacheTtlSeconds());
      }
    }

    List<Map<String, Object>> out = new ArrayList<>();
    Set<Object> seenIds = new HashSet<>();
    for (Object nk : unique.keySet()) {
      for (Map<String, Object> rec : byKey.getOrDefault(nk, List.of())) {
        Object id = Documents.get(rec, idField);
        if (id == null || seenIds.add(Documents.normalizeKey(id))) out.add(rec);
      }
    }

    LoadResult.BatchInfo info = new LoadResult.BatchInfo(config.batchSize(), chunks.size(), out.size());
    long ms = elapsedMs(start);
    log.debug("quire.relation_done op=batch_load collection={} keyField={} keys={} cached={} batches={} items={} durationMs={}",
        collection, keyField, unique.size(), unique.size() - uncached.size(), chunks.size(), out.size(), ms);
    return new LoadResult<>(out, anyCached, ms, info);
  }

  /** Adapter for callers that only want the records. */
  public Function<List<?>, List<Map<String, Object>>> dataLoader(String collection, String keyField,
                                                                 BatchLoadConfig config) {
    Objects.requireNonNull(config, "config");
    return keys -> batchLoad(collection, keys, keyField, config).data();
  }

  private List<Map<String, Object>> cachedRecords(String collection, String keyField, Object key) {
    Object v = cache.get(cacheKey(collection, keyField, key));
    if (!(v instanceof List<?> list) || list.isEmpty()) return null;
    List<Map<String, Object>> out = new ArrayList<>(list.size());
    for (Object o : list) {
      if (!(o instanceof Map<?, ?>)) return null;
      @SuppressWarnings("unchecked")
      Map<String, Object> doc = (Map<String, Object>) o;
      out.add(Documents.copy(doc));
    }
    return out;
  }

  /** Groups records under every normalized value of {@code field}; array values count once per element. */
  static Map<Object, List<Map<String, Object>>> group(List<Map<String, Object>> records, String field) {
    Map<Object, List<Map<String, Object>>> out = new LinkedHashMap<>();
    for (Map<String, Object> rec : records) {
      for (Object k : keyValues(Documents.get(rec, field))) {
        out.computeIfAbsent(Documents.normalizeKey(k), x -> new ArrayList<>()).add(rec);
      }
    }
    return out;
  }

  /** Non-null key values of one field: the elements of an array, or the value itself. */
  static List<Object> keyValues(Object v) {
    if (v == null) return List.of();
    if (v instanceof Collection<?> c) {
      List<Object> out = new ArrayList<>(c.size());
      for (Object x : c) if (x != null) out.add(x);
      return out;
    }
    return List.of(v);
  }

  private static <T> List<List<T>> partition(List<T> items, int size) {
    List<List<T>> out = new ArrayList<>();
    for (int i = 0; i < items.size(); i += size) {
      out.add(List.copyOf(items.subList(i, Math.min(items.size(), i + size))));
    }
    return out;
  }

  private static long elapsedMs(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000;
  }
}
