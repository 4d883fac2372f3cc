package io.intellixity.quire.persistence.query;

/**
 * Raised when paging parameters, sort specs, filters or relation configs fail validation.
 * <p>
 * Always thrown before any store or cache call is issued.
 */
public final class InvalidParametersException extends RuntimeException {
  public InvalidParametersException(String message) {
    super(message);
  }

  public InvalidParametersException(String message, Throwable cause) {
    super(message, cause);
  }
}
