package io.intellixity.quire.persistence.pagination;

import io.intellixity.quire.persistence.query.SortField;

import java.util.List;

/**
 * Offset paging request. {@code page} below 1 means the first page; {@code limit} is clamped
 * by the paginator, so out-of-range values are accepted here.
 */
public record PaginationParams(int page, int limit, List<SortField> sort, String cursor) {
  public PaginationParams {
    page = Math.max(1, page);
    sort = SortField.checked(sort);
    cursor = (cursor == null || cursor.isBlank()) ? null : cursor.trim();
  }

  public static PaginationParams of(int page, int limit) {
    return new PaginationParams(page, limit, List.of(), null);
  }

  public static PaginationParams of(int page, int limit, List<SortField> sort) {
    return new PaginationParams(page, limit, sort, null);
  }

  public PaginationParams withCursor(String cursor) {
    return new PaginationParams(page, limit, sort, cursor);
  }

  public PaginationParams withPage(int page) {
    return new PaginationParams(page, limit, sort, cursor);
  }
}
