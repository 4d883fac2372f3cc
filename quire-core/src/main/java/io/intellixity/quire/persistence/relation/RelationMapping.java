package io.intellixity.quire.persistence.relation;

import io.intellixity.quire.persistence.query.InvalidParametersException;

/**
 * Preload instruction: for each record, look up {@code collection} records whose
 * {@code foreignField} equals the record's {@code itemField}, and store them as a list under
 * {@code targetField}. A null {@code config} uses the preloader's default.
 */
public record RelationMapping(String itemField, String collection, String foreignField, String targetField,
                              BatchLoadConfig config) {
  public RelationMapping {
    if (itemField == null || itemField.isBlank()) throw new InvalidParametersException("itemField must not be blank");
    if (collection == null || collection.isBlank()) throw new InvalidParametersException("collection must not be blank");
    if (foreignField == null || foreignField.isBlank()) throw new InvalidParametersException("foreignField must not be blank");
    if (targetField == null || targetField.isBlank()) throw new InvalidParametersException("targetField must not be blank");
  }

  public static RelationMapping of(String itemField, String collection, String foreignField, String targetField) {
    return new RelationMapping(itemField, collection, foreignField, targetField, null);
  }
}
