package io.intellixity.quire.persistence.query.pipeline;

import io.intellixity.quire.persistence.query.InvalidParametersException;
import io.intellixity.quire.persistence.query.SortField;

import java.util.List;

public record SortStage(List<SortField> fields) implements Stage {
  public SortStage {
    fields = SortField.checked(fields);
    if (fields.isEmpty()) throw new InvalidParametersException("$sort requires at least one field");
  }

  @Override public String name() { return "$sort"; }
}
