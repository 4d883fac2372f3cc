package io.intellixity.quire.persistence.query.pipeline;

import io.intellixity.quire.persistence.query.InvalidParametersException;

import java.util.List;

/**
 * Server-side join: for each input document, collects documents of {@code from} whose
 * {@code foreignField} equals the input's {@code localField} into the array {@code as}.
 * The optional sub-pipeline runs over the matched documents.
 */
public record LookupStage(String from, String localField, String foreignField, String as, List<Stage> pipeline)
    implements Stage {
  public LookupStage {
    requireName("from", from);
    requireName("localField", localField);
    requireName("foreignField", foreignField);
    requireName("as", as);
    pipeline = List.copyOf(pipeline == null ? List.of() : pipeline);
  }

  public LookupStage(String from, String localField, String foreignField, String as) {
    this(from, localField, foreignField, as, List.of());
  }

  private static void requireName(String label, String v) {
    if (v == null || v.isBlank()) throw new InvalidParametersException("$lookup." + label + " must not be blank");
  }

  @Override public String name() { return "$lookup"; }
}
