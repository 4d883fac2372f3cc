package io.intellixity.quire.persistence.pagination;

/**
 * Carries a non-JSON sort value (dates, store-specific identifiers) through a cursor as a tagged string.
 * <p>
 * Adapters are discovered through {@code META-INF/quire.factories}; the built-in ones cover
 * {@link java.time.Instant} and {@link java.util.Date}.
 */
public interface CursorValueAdapter {
  /** Short, stable tag written into the cursor. */
  String tag();

  boolean supports(Object value);

  String encode(Object value);

  Object decode(String encoded);
}
