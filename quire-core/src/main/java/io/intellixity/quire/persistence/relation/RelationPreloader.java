package io.intellixity.quire.persistence.relation;

import io.intellixity.quire.persistence.memory.Documents;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Attaches related records to a list of primary records, one relation at a time.\n
 *
 * Relations are independent: when one fails it is logged and skipped, and the records are left
 * without that target field.
 */
public final class RelationPreloader {
  private static final Logger log = LoggerFactory.getLogger(RelationPreloader.class);

  private final BatchLoader loader;
  private final BatchLoadConfig defaultConfig;

  public RelationPreloader(BatchLoader loader, BatchLoadConfig defaultConfig) {
    this.loader = Objects.requireNonNull(loader, "loader");
    this.defaultConfig = Objects.requireNonNull(defaultConfig, "defaultConfig");
  }

  /** Enriches {@code records} in place and returns the same list. */
  public List<Map<String, Object>> preloadRelations(List<Map<String, Object>> records, List<RelationMapping> mappings) {
    Objects.requireNonNull(records, "records");
    Objects.requireNonNull(mappings, "mappings");
    for (RelationMapping m : mappings) {
      try {
        preload(records, m);
      } catch (RuntimeException e) {
        RelationLoadException failure = new RelationLoadException(
            "Failed to preload " + m.collection() + " into " + m.targetField(), e);
        log.warn("quire.relation op=preload collection={} itemField={} targetField={} skipped",
            m.collection(), m.itemField(), m.targetField(), failure);
      }
    }
    return records;
  }

  private void preload(List<Map<String, Object>> records, RelationMapping m) {
    List<Object> keys = new ArrayList<>();
    for (Map<String, Object> rec : records) {
      keys.addAll(BatchLoader.keyValues(Documents.get(rec, m.itemField())));
    }
    if (keys.isEmpty()) {
      for (Map<String, Object> rec : records) Documents.put(rec, m.targetField(), new ArrayList<>());
      return;
    }

    BatchLoadConfig config = (m.config() == null) ? defaultConfig : m.config();
    LoadResult<Map<String, Object>> loaded = loader.batchLoad(m.collection(), keys, m.foreignField(), config);
    Map<Object, List<Map<String, Object>>> byKey = BatchLoader.group(loaded.data(), m.foreignField());

    for (Map<String, Object> rec : records) {
      List<Map<String, Object>> related = new ArrayList<>();
      Set<Map<String, Object>> added = Collections.newSetFromMap(new IdentityHashMap<>());
      for (Object k : BatchLoader.keyValues(Documents.get(rec, m.itemField()))) {
        for (Map<String, Object> r : byKey.getOrDefault(Documents.normalizeKey(k), List.of())) {
          if (added.add(r)) related.add(r);
        }
      }
      Documents.put(rec, m.targetField(), related);
    }
  }
}
