package io.intellixity.quire.persistence.relation;

import io.intellixity.quire.persistence.config.RelationSettings;
import io.intellixity.quire.persistence.query.QueryElement;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Scores a relation query so the optimizer can choose between one join pipeline and batch loading. */
public final class ComplexityAnalyzer {
  private final RelationSettings settings;

  public ComplexityAnalyzer(RelationSettings settings) {
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  public ComplexityAnalysis analyze(QueryElement filter, List<RelationConfig> relations) {
    Objects.requireNonNull(relations, "relations");
    double score = 0;
    List<String> factors = new ArrayList<>();

    if (relations.size() > settings.relationCountLimit()) {
      score += settings.relationCountWeight();
      factors.add("many relations (" + relations.size() + ")");
    }

    for (RelationConfig r : relations) {
      if (r.joinPipeline().size() > settings.pipelineStageLimit()) {
        score += settings.pipelineWeight();
        factors.add("complex join pipeline on " + r.from());
        break;
      }
    }

    double filterComplexity = filterComplexity(filter);
    score += filterComplexity * settings.filterWeight();
    if (filterComplexity > 0.5) factors.add("complex filter (" + filterComplexity + ")");

    for (RelationConfig r : relations) {
      if (r.localField().contains(".") || r.foreignField().contains(".")) {
        score += settings.pathFieldWeight();
        factors.add("path-valued join field on " + r.from());
        break;
      }
    }

    return new ComplexityAnalysis(Math.min(score, 1.0), factors);
  }

  /** Operator density and nesting of the filter, in [0, 1]. */
  public double filterComplexity(QueryElement filter) {
    return FilterComplexity.of(filter);
  }
}
