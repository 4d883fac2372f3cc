package io.intellixity.quire.persistence.relation;

import java.util.List;

/** Heuristic score in [0, 1] plus the factors that raised it. */
public record ComplexityAnalysis(double score, List<String> factors) {
  public ComplexityAnalysis {
    if (score < 0 || score > 1) throw new IllegalArgumentException("score must be within [0, 1]");
    factors = List.copyOf(factors);
  }
}
