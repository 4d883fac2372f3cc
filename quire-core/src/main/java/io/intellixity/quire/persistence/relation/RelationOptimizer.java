package io.intellixity.quire.persistence.relation;

import io.intellixity.quire.persistence.config.RelationSettings;
import io.intellixity.quire.persistence.memory.Documents;
import io.intellixity.quire.persistence.query.*;
import io.intellixity.quire.persistence.query.pipeline.*;
import io.intellixity.quire.persistence.spi.DocumentStore;
import io.intellixity.quire.persistence.spi.KeyValueCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.*;
import java.util.concurrent.Executor;

/**
 * Loads primary records together with their relations, either as one join pipeline or as a
 * primary query followed by batch preloading, picked per call by {@link ComplexityAnalyzer}.
 */
public final class RelationOptimizer {
  private static final Logger log = LoggerFactory.getLogger(RelationOptimizer.class);

  private final DocumentStore store;
  private final KeyValueCache cache;
  private final RelationSettings settings;
  private final BatchLoader batchLoader;
  private final RelationPreloader preloader;
  private final ComplexityAnalyzer analyzer;

  public RelationOptimizer(DocumentStore store, KeyValueCache cache, Executor executor, RelationSettings settings) {
    this.store = Objects.requireNonNull(store, "store");
    this.cache = (cache == null) ? KeyValueCache.none() : cache;
    this.settings = Objects.requireNonNull(settings, "settings");
    this.batchLoader = new BatchLoader(store, this.cache, executor);
    this.preloader = new RelationPreloader(batchLoader, settings.defaultBatch());
    this.analyzer = new ComplexityAnalyzer(settings);
  }

  public BatchLoader batchLoader() { return batchLoader; }
  public RelationPreloader preloader() { return preloader; }
  public ComplexityAnalyzer analyzer() { return analyzer; }

  public LoadResult<Map<String, Object>> batchLoad(String collection, Collection<?> keys, String keyField) {
    return batchLoader.batchLoad(collection, keys, keyField, settings.defaultBatch());
  }

  public LoadResult<Map<String, Object>> batchLoad(String collection, Collection<?> keys, String keyField,
                                                   BatchLoadConfig config) {
    return batchLoader.batchLoad(collection, keys, keyField, config);
  }

  public List<Map<String, Object>> preloadRelations(List<Map<String, Object>> records, List<RelationMapping> mappings) {
    return preloader.preloadRelations(records, mappings);
  }

  public LoadResult<Map<String, Object>> smartRelationQuery(String collection, QueryElement filter,
                                                            List<RelationConfig> relations, QueryOptions options) {
    ComplexityAnalysis complexity = analyzer.analyze(filter, relations);
    boolean batch = complexity.score() > settings.complexityThreshold();
    log.debug("quire.relation op=smart collection={} score={} factors={} strategy={}",
        collection, complexity.score(), complexity.factors(), batch ? "batch" : "join");
    return batch
        ? executeBatchStrategy(collection, filter, relations, options)
        : findWithRelations(collection, filter, relations, options);
  }

  /** One aggregation round trip: match, one lookup per relation, then sort/window/projection. */
  public LoadResult<Map<String, Object>> findWithRelations(String collection, QueryElement filter,
                                                           List<RelationConfig> relations, QueryOptions options) {
    Objects.requireNonNull(collection, "collection");
    Objects.requireNonNull(relations, "relations");
    long start = System.nanoTime();
    List<Stage> pipeline = relationPipeline(filter, relations, options == null ? QueryOptions.none() : options);

    boolean cached = relations.stream().anyMatch(RelationConfig::cached);
    String cacheKey = cached ? cacheKey(collection, pipeline) : null;
    if (cached) {
      List<Map<String, Object>> hit = cachedDocuments(cacheKey);
      if (hit != null) {
        return new LoadResult<>(hit, true, elapsedMs(start), null);
      }
    }

    List<Map<String, Object>> data;
    try {
      data = store.aggregate(collection, pipeline);
    } catch (RuntimeException e) {
      log.error("quire.relation op=join collection={} relations={} failed", collection, relationNames(relations), e);
      throw e;
    }

    if (cached) {
      long ttl = settings.defaultCacheTtlSeconds();
      for (RelationConfig r : relations) {
        if (r.cacheTtlSeconds() != null) {
          ttl = r.cacheTtlSeconds();
          break;
        }
      }
      List<Map<String, Object>> copies = new ArrayList<>(data.size());
      for (Map<String, Object> d : data) copies.add(Documents.copy(d));
      cache.set(cacheKey, copies, ttl);
    }

    long ms = elapsedMs(start);
    log.debug("quire.relation_done op=join collection={} relations={} returned={} durationMs={}",
        collection, relationNames(relations), data.size(), ms);
    return new LoadResult<>(data, false, ms, null);
  }

  /** Primary records first, then each relation batch-loaded and attached. */
  public LoadResult<Map<String, Object>> executeBatchStrategy(String collection, QueryElement filter,
                                                              List<RelationConfig> relations, QueryOptions options) {
    Objects.requireNonNull(collection, "collection");
    Objects.requireNonNull(relations, "relations");
    long start = System.nanoTime();
    QueryOptions o = (options == null) ? QueryOptions.none() : options;

    Query q = Query.of(filter).withSort(o.sort()).withProjection(o.projection());
    if (o.skip() > 0 || o.limit() > 0) q.withPage(OffsetPage.of(o.skip(), o.limit()));

    List<Map<String, Object>> primaries;
    try {
      primaries = new ArrayList<>(store.find(collection, q));
    } catch (RuntimeException e) {
      log.error("quire.relation op=batch_strategy collection={} failed", collection, e);
      throw e;
    }

    List<RelationMapping> mappings = new ArrayList<>(relations.size());
    for (RelationConfig r : relations) {
      long ttl = (r.cacheTtlSeconds() != null) ? r.cacheTtlSeconds() : settings.defaultCacheTtlSeconds();
      BatchLoadConfig config = settings.defaultBatch().withCacheResults(r.cached()).withCacheTtlSeconds(ttl);
      mappings.add(new RelationMapping(r.localField(), r.from(), r.foreignField(), r.as(), config));
    }
    preloader.preloadRelations(primaries, mappings);

    long ms = elapsedMs(start);
    log.debug("quire.relation_done op=batch_strategy collection={} relations={} returned={} durationMs={}",
        collection, relationNames(relations), primaries.size(), ms);
    return new LoadResult<>(primaries, false, ms, null);
  }

  /** The join pipeline {@link #findWithRelations} runs. */
  public List<Stage> relationPipeline(QueryElement filter, List<RelationConfig> relations, QueryOptions options) {
    List<Stage> out = new ArrayList<>();
    if (!isEmpty(filter)) out.add(Pipelines.match(filter));
    for (RelationConfig r : relations) {
      out.add(new LookupStage(r.from(), r.localField(), r.foreignField(), r.as(), r.joinPipeline()));
      if (!r.preserveEmptyMatches()) out.add(Pipelines.match(QueryFilters.ne(r.as(), List.of())));
    }
    if (!options.sort().isEmpty()) out.add(Pipelines.sort(options.sort()));
    if (options.skip() > 0) out.add(Pipelines.skip(options.skip()));
    if (options.limit() > 0) out.add(Pipelines.limit(options.limit()));
    if (!options.projection().isEmpty()) out.add(new ProjectStage(options.projection()));
    return out;
  }

  /** {@code relation:<collection>:<first 16 hex chars of sha-256 over the canonical pipeline JSON>}. */
  public static String cacheKey(String collection, List<Stage> pipeline) {
    byte[] json = QueryJson.writePipeline(pipeline).getBytes(StandardCharsets.UTF_8);
    try {
      byte[] digest = MessageDigest.getInstance("SHA-256").digest(json);
      return "relation:" + collection + ":" + HexFormat.of().formatHex(digest).substring(0, 16);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  private List<Map<String, Object>> cachedDocuments(String key) {
    Object v = cache.get(key);
    if (!(v instanceof List<?> list)) return null;
    List<Map<String, Object>> out = new ArrayList<>(list.size());
    for (Object o : list) {
      if (!(o instanceof Map<?, ?>)) return null;
      @SuppressWarnings("unchecked")
      Map<String, Object> doc = (Map<String, Object>) o;
      out.add(Documents.copy(doc));
    }
    return out;
  }

  private static boolean isEmpty(QueryElement filter) {
    return filter == null || (filter instanceof LogicalGroup g && g.elements().isEmpty());
  }

  private static List<String> relationNames(List<RelationConfig> relations) {
    List<String> out = new ArrayList<>(relations.size());
    for (RelationConfig r : relations) out.add(r.from() + "->" + r.as());
    return out;
  }

  private static long elapsedMs(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000;
  }
}
