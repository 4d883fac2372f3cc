package io.intellixity.quire.persistence.pagination;

public record OffsetPageInfo(int page, int limit, long total, long totalPages, boolean hasNext, boolean hasPrev) {
  public static OffsetPageInfo of(int page, int limit, long total) {
    long totalPages = (total + limit - 1) / limit;
    return new OffsetPageInfo(page, limit, total, totalPages, page < totalPages, page > 1);
  }
}
