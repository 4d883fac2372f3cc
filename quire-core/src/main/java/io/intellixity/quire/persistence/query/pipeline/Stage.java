package io.intellixity.quire.persistence.query.pipeline;

/**
 * One step of an aggregation pipeline.
 * <p>
 * Closed set: {@link MatchStage}, {@link SortStage}, {@link SkipStage}, {@link LimitStage},
 * {@link ProjectStage}, {@link LookupStage}, {@link FacetStage}, {@link CountStage}.
 */
public interface Stage {
  /** Stage operator name as the document store knows it, e.g. {@code $match}. */
  String name();
}
