package io.intellixity.quire.persistence.pagination;

import io.intellixity.quire.persistence.query.InvalidParametersException;
import io.intellixity.quire.persistence.query.SortField;

import java.util.List;

/** Keyset paging request. The sort must be non-empty; a null cursor starts from the first (or, backward, the last) record. */
public record CursorPaginationParams(int limit, String cursor, List<SortField> sort, Direction direction) {
  public enum Direction { FORWARD, BACKWARD }

  public CursorPaginationParams {
    sort = SortField.checked(sort);
    if (sort.isEmpty()) throw new InvalidParametersException("Cursor pagination requires a non-empty sort");
    cursor = (cursor == null || cursor.isBlank()) ? null : cursor.trim();
    direction = (direction == null) ? Direction.FORWARD : direction;
  }

  public static CursorPaginationParams first(int limit, List<SortField> sort) {
    return new CursorPaginationParams(limit, null, sort, Direction.FORWARD);
  }

  public CursorPaginationParams after(String cursor) {
    return new CursorPaginationParams(limit, cursor, sort, Direction.FORWARD);
  }

  public CursorPaginationParams before(String cursor) {
    return new CursorPaginationParams(limit, cursor, sort, Direction.BACKWARD);
  }
}
