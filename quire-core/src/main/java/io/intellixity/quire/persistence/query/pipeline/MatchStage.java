package io.intellixity.quire.persistence.query.pipeline;

import io.intellixity.quire.persistence.query.QueryElement;

import java.util.Objects;

public record MatchStage(QueryElement filter) implements Stage {
  public MatchStage {
    Objects.requireNonNull(filter, "filter");
  }

  @Override public String name() { return "$match"; }
}
