package io.intellixity.quire.persistence.relation;

import io.intellixity.quire.persistence.query.InvalidParametersException;
import io.intellixity.quire.persistence.query.pipeline.Stage;

import java.util.ArrayList;
import java.util.List;

/**
 * One relation to join or preload: records of {@code from} whose {@code foreignField} equals the
 * primary record's {@code localField} end up under {@code as}.
 *
 * @param joinPipeline         stages applied to the joined records (join strategy only); may be empty
 * @param preserveEmptyMatches keep primary records that matched nothing (join strategy only)
 * @param cacheKey             when set, results touching this relation are cached
 * @param cacheTtlSeconds      cache lifetime; null means the configured default
 */
public record RelationConfig(String from,
                             String localField,
                             String foreignField,
                             String as,
                             List<Stage> joinPipeline,
                             boolean preserveEmptyMatches,
                             String cacheKey,
                             Long cacheTtlSeconds) {
  public RelationConfig {
    List<String> errors = new ArrayList<>();
    if (blank(from)) errors.add("from must not be blank");
    if (blank(localField)) errors.add("localField must not be blank");
    if (blank(foreignField)) errors.add("foreignField must not be blank");
    if (blank(as)) errors.add("as must not be blank");
    if (cacheTtlSeconds != null && cacheTtlSeconds <= 0) errors.add("cacheTtlSeconds must be > 0");
    if (!errors.isEmpty()) {
      throw new InvalidParametersException("Invalid relation config: " + String.join("; ", errors));
    }
    joinPipeline = (joinPipeline == null) ? List.of() : List.copyOf(joinPipeline);
    cacheKey = blank(cacheKey) ? null : cacheKey;
  }

  public RelationConfig withJoinPipeline(List<Stage> v) {
    return new RelationConfig(from, localField, foreignField, as, v, preserveEmptyMatches, cacheKey, cacheTtlSeconds);
  }

  public RelationConfig withPreserveEmptyMatches(boolean v) {
    return new RelationConfig(from, localField, foreignField, as, joinPipeline, v, cacheKey, cacheTtlSeconds);
  }

  public RelationConfig withCache(String key, Long ttlSeconds) {
    return new RelationConfig(from, localField, foreignField, as, joinPipeline, preserveEmptyMatches, key, ttlSeconds);
  }

  public boolean cached() { return cacheKey != null; }

  private static boolean blank(String s) {
    return s == null || s.isBlank();
  }
}
