package io.intellixity.quire.persistence.query.pipeline;

import io.intellixity.quire.persistence.query.InvalidParametersException;

/** Emits {@code {field: n}}; emits nothing when the input is empty. */
public record CountStage(String field) implements Stage {
  public CountStage {
    if (field == null || field.isBlank()) throw new InvalidParametersException("$count requires a field name");
  }

  @Override public String name() { return "$count"; }
}
