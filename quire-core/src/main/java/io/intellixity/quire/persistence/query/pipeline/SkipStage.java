package io.intellixity.quire.persistence.query.pipeline;

public record SkipStage(int count) implements Stage {
  public SkipStage {
    if (count < 0) throw new IllegalArgumentException("skip must be >= 0");
  }

  @Override public String name() { return "$skip"; }
}
