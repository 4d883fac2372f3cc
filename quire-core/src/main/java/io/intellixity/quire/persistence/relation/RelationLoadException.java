package io.intellixity.quire.persistence.relation;

/** One relation of a preload failed; the preloader logs it and moves on. */
public final class RelationLoadException extends RuntimeException {
  public RelationLoadException(String message) {
    super(message);
  }

  public RelationLoadException(String message, Throwable cause) {
    super(message, cause);
  }
}
