package io.intellixity.quire.persistence.relation;

import java.util.List;

/** {@code batchInfo} is null for results that did not go through the batch loader. */
public record LoadResult<T>(List<T> data, boolean fromCache, long executionTimeMs, BatchInfo batchInfo) {
  public LoadResult {
    data = List.copyOf(data);
  }

  public record BatchInfo(int batchSize, int batchCount, int totalItems) {
    public static final BatchInfo EMPTY = new BatchInfo(0, 0, 0);
  }
}
