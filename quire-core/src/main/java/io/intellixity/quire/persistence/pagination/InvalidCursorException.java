package io.intellixity.quire.persistence.pagination;

/**
 * The cursor token cannot be decoded, or was issued for a different sort.
 * <p>
 * A client error: callers should answer it as a bad request and not retry.
 */
public final class InvalidCursorException extends RuntimeException {
  public InvalidCursorException(String message) {
    super(message);
  }

  public InvalidCursorException(String message, Throwable cause) {
    super(message, cause);
  }
}
