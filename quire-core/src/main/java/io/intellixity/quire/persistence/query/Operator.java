package io.intellixity.quire.persistence.query;

public enum Operator {
  EQ,
  NE,
  GT,
  GE,
  LT,
  LE,

  IN,
  NIN,

  RANGE,
  LIKE,
  /** Unanchored regular expression search, as Mongo's {@code $regex}. */
  REGEX,
  /** Value is a Boolean: whether the path must be present. */
  EXISTS;

  /** True for operators that carry a list of values rather than a single one. */
  public boolean multiValued() {
    return this == IN || this == NIN;
  }
}
