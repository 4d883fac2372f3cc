package io.intellixity.quire.persistence.query.pipeline;

public record LimitStage(int count) implements Stage {
  public LimitStage {
    if (count <= 0) throw new IllegalArgumentException("limit must be > 0");
  }

  @Override public String name() { return "$limit"; }
}
