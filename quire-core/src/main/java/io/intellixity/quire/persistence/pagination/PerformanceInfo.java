package io.intellixity.quire.persistence.pagination;

/** {@code indexUsed} is reported optimistically; the store interface carries no explain output. */
public record PerformanceInfo(long executionTimeMs, long documentsExamined, boolean indexUsed) {
  static PerformanceInfo since(long startNanos, long documentsExamined) {
    return new PerformanceInfo((System.nanoTime() - startNanos) / 1_000_000, documentsExamined, true);
  }
}
