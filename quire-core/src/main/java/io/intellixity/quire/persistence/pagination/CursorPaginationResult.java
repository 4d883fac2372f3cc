package io.intellixity.quire.persistence.pagination;

import java.util.List;
import java.util.Objects;

public record CursorPaginationResult<T>(List<T> data, CursorPageInfo pagination, PerformanceInfo performance)
    implements PageResult<T> {
  public CursorPaginationResult {
    data = List.copyOf(data);
    Objects.requireNonNull(pagination, "pagination");
    Objects.requireNonNull(performance, "performance");
  }
}
