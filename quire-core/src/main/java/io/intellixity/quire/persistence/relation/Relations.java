package io.intellixity.quire.persistence.relation;

import io.intellixity.quire.persistence.query.pipeline.Pipelines;

import java.util.List;

/** Shorthands for common relation configs. */
public final class Relations {
  public static final String DEFAULT_FOREIGN_FIELD = "_id";

  private Relations() {}

  public static RelationConfig of(String from, String localField) {
    return of(from, localField, DEFAULT_FOREIGN_FIELD);
  }

  public static RelationConfig of(String from, String localField, String foreignField) {
    return of(from, localField, foreignField, from + "Data");
  }

  public static RelationConfig of(String from, String localField, String foreignField, String as) {
    return new RelationConfig(from, localField, foreignField, as, List.of(), false, null, null);
  }

  /** Joined records carry only {@code fields} (plus the identifier). */
  public static RelationConfig projected(String from, String localField, String as, String... fields) {
    return of(from, localField, DEFAULT_FOREIGN_FIELD, as).withJoinPipeline(List.of(Pipelines.project(fields)));
  }
}
