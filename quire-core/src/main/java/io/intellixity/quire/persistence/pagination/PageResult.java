package io.intellixity.quire.persistence.pagination;

import java.util.List;

/** Common view of {@link PaginationResult} and {@link CursorPaginationResult}. */
public interface PageResult<T> {
  List<T> data();

  PerformanceInfo performance();
}
