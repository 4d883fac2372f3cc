package io.intellixity.quire.persistence.query.pipeline;

import io.intellixity.quire.persistence.query.InvalidParametersException;

import java.util.List;

/** Inclusion projection. The identifier field is always kept. */
public record ProjectStage(List<String> include) implements Stage {
  public ProjectStage {
    include = List.copyOf(include == null ? List.of() : include);
    if (include.isEmpty()) throw new InvalidParametersException("$project requires at least one field");
  }

  @Override public String name() { return "$project"; }
}
