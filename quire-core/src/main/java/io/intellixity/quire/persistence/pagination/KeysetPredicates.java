package io.intellixity.quire.persistence.pagination;

import io.intellixity.quire.persistence.query.QueryElement;
import io.intellixity.quire.persistence.query.SortField;

import java.util.ArrayList;
import java.util.List;

import static io.intellixity.quire.persistence.query.QueryFilters.*;

/**
 * Builds the "strictly after this position" filter for a multi-field sort:\n
 * {@code f1 > v1 OR (f1 = v1 AND f2 > v2) OR ...}, with the comparison flipped for descending fields.\n
 *
 * Nulls sort lowest, as document stores order them: nothing is below null, and everything
 * non-null is above it.
 */
final class KeysetPredicates {
  private KeysetPredicates() {}

  static QueryElement after(List<SortField> sort, CursorValues cursor) {
    List<QueryElement> branches = new ArrayList<>();
    for (int i = 0; i < sort.size(); i++) {
      SortField sf = sort.get(i);
      QueryElement strict = strictlyAfter(sf, cursor.value(sf.field()));
      if (strict == null) continue;

      List<QueryElement> parts = new ArrayList<>();
      for (int j = 0; j < i; j++) {
        String f = sort.get(j).field();
        parts.add(eq(f, cursor.value(f)));
      }
      parts.add(strict);
      branches.add(parts.size() == 1 ? parts.get(0) : and(parts.toArray(QueryElement[]::new)));
    }
    if (branches.isEmpty()) {
      // cursor sits on the very last position
      String f = sort.get(0).field();
      return and(exists(f, false), exists(f, true));
    }
    return branches.size() == 1 ? branches.get(0) : or(branches.toArray(QueryElement[]::new));
  }

  /** Null when no value can follow {@code v} in this field's direction. */
  private static QueryElement strictlyAfter(SortField sf, Object v) {
    String f = sf.field();
    if (sf.direction() == SortField.Direction.ASC) {
      return (v == null) ? ne(f, null) : gt(f, v);
    }
    return (v == null) ? null : or(lt(f, v), eq(f, null));
  }
}
