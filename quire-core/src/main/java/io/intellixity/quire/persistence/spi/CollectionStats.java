package io.intellixity.quire.persistence.spi;

/** Collection metadata as reported by the store, without scanning. */
public record CollectionStats(String collection, long approxCount) {
  public CollectionStats {
    if (approxCount < 0) throw new IllegalArgumentException("approxCount must be >= 0");
  }
}
