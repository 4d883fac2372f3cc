package io.intellixity.quire.persistence.query.pipeline;

import io.intellixity.quire.persistence.query.InvalidParametersException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Runs several named sub-pipelines over the same input and emits one document holding each branch's output. */
public record FacetStage(Map<String, List<Stage>> branches) implements Stage {
  public FacetStage {
    if (branches == null || branches.isEmpty()) throw new InvalidParametersException("$facet requires at least one branch");
    Map<String, List<Stage>> copy = new LinkedHashMap<>();
    for (var e : branches.entrySet()) copy.put(e.getKey(), List.copyOf(e.getValue()));
    branches = Collections.unmodifiableMap(copy);
  }

  @Override public String name() { return "$facet"; }
}
