package io.intellixity.quire.persistence.pagination;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Decoded cursor: the last-seen value of each sort field, the record identifier, the sort
 * signature the cursor was issued for, and whether it points backwards (a previous-page cursor).
 */
public record CursorValues(Map<String, Object> values, Object id, String sortSignature, boolean reverse) {
  public CursorValues {
    // may hold nulls
    values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }

  public Object value(String field) {
    return values.get(field);
  }
}
