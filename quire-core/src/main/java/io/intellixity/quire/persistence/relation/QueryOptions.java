package io.intellixity.quire.persistence.relation;

import io.intellixity.quire.persistence.query.InvalidParametersException;
import io.intellixity.quire.persistence.query.SortField;

import java.util.List;

/** Sort, window and projection for relation queries. {@code skip}/{@code limit} of 0 mean unset. */
public record QueryOptions(List<SortField> sort, int skip, int limit, List<String> projection) {
  public QueryOptions {
    sort = SortField.checked(sort);
    if (skip < 0) throw new InvalidParametersException("skip must be >= 0");
    if (limit < 0) throw new InvalidParametersException("limit must be >= 0");
    projection = (projection == null) ? List.of() : List.copyOf(projection);
  }

  public static QueryOptions none() {
    return new QueryOptions(List.of(), 0, 0, List.of());
  }

  public QueryOptions withSort(List<SortField> v) { return new QueryOptions(v, skip, limit, projection); }
  public QueryOptions withSkip(int v) { return new QueryOptions(sort, v, limit, projection); }
  public QueryOptions withLimit(int v) { return new QueryOptions(sort, skip, v, projection); }
  public QueryOptions withProjection(List<String> v) { return new QueryOptions(sort, skip, limit, v); }
}
