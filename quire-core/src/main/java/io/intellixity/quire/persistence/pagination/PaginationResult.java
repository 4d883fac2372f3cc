package io.intellixity.quire.persistence.pagination;

import java.util.List;
import java.util.Objects;

public record PaginationResult<T>(List<T> data, OffsetPageInfo pagination, PerformanceInfo performance)
    implements PageResult<T> {
  public PaginationResult {
    data = List.copyOf(data);
    Objects.requireNonNull(pagination, "pagination");
    Objects.requireNonNull(performance, "performance");
  }
}
