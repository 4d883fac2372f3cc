package io.intellixity.quire.persistence.query;

/** Skip/limit window of a find. A limit of 0 means unbounded. */
public record OffsetPage(int offset, int limit) {
  public OffsetPage {
    if (limit < 0) throw new IllegalArgumentException("limit must be >= 0");
    if (offset < 0) throw new IllegalArgumentException("offset must be >= 0");
  }

  public static OffsetPage of(int offset, int limit) {
    return new OffsetPage(offset, limit);
  }

  public boolean unbounded() { return limit == 0; }
}
