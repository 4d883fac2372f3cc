package io.intellixity.quire.persistence.spi;

/**
 * A document-store or cache operation failed.
 * <p>
 * Store implementations wrap driver errors in this type; the paginators and loaders let it
 * through unchanged.
 */
public final class UpstreamQueryException extends RuntimeException {
  public UpstreamQueryException(String message) {
    super(message);
  }

  public UpstreamQueryException(String message, Throwable cause) {
    super(message, cause);
  }
}
