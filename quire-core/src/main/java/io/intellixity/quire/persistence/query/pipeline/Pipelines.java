package io.intellixity.quire.persistence.query.pipeline;

import io.intellixity.quire.persistence.query.QueryElement;
import io.intellixity.quire.persistence.query.SortField;

import java.util.*;

public final class Pipelines {
  private Pipelines() {}

  public static MatchStage match(QueryElement filter) { return new MatchStage(filter); }
  public static SortStage sort(List<SortField> fields) { return new SortStage(fields); }
  public static SkipStage skip(int n) { return new SkipStage(n); }
  public static LimitStage limit(int n) { return new LimitStage(n); }
  public static ProjectStage project(String... fields) { return new ProjectStage(List.of(fields)); }
  public static CountStage count(String field) { return new CountStage(field); }

  /** Two-branch facet, branches in the given order. */
  public static FacetStage facet(String first, List<Stage> firstStages, String second, List<Stage> secondStages) {
    Map<String, List<Stage>> m = new LinkedHashMap<>();
    m.put(first, firstStages);
    m.put(second, secondStages);
    return new FacetStage(m);
  }
}
