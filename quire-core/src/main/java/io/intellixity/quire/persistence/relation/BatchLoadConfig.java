package io.intellixity.quire.persistence.relation;

import io.intellixity.quire.persistence.query.InvalidParametersException;

/**
 * Batch loader tuning: keys per {@code IN} query, chunk queries in flight at once, and whether
 * (and how long) loaded records are cached per key.
 */
public record BatchLoadConfig(int batchSize, int maxConcurrency, boolean cacheResults, long cacheTtlSeconds) {
  public BatchLoadConfig {
    if (batchSize <= 0) throw new InvalidParametersException("batchSize must be > 0");
    if (maxConcurrency <= 0) throw new InvalidParametersException("maxConcurrency must be > 0");
    if (cacheTtlSeconds <= 0) throw new InvalidParametersException("cacheTtlSeconds must be > 0");
  }

  public static BatchLoadConfig defaults() {
    return new BatchLoadConfig(100, 5, true, 300);
  }

  public BatchLoadConfig withBatchSize(int v) { return new BatchLoadConfig(v, maxConcurrency, cacheResults, cacheTtlSeconds); }
  public BatchLoadConfig withMaxConcurrency(int v) { return new BatchLoadConfig(batchSize, v, cacheResults, cacheTtlSeconds); }
  public BatchLoadConfig withCacheResults(boolean v) { return new BatchLoadConfig(batchSize, maxConcurrency, v, cacheTtlSeconds); }
  public BatchLoadConfig withCacheTtlSeconds(long v) { return new BatchLoadConfig(batchSize, maxConcurrency, cacheResults, v); }
}
