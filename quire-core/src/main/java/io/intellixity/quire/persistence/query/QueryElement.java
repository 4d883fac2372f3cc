package io.intellixity.quire.persistence.query;

/** A node of a filter tree: {@link Condition}, {@link LogicalGroup} or {@link NotElement}. */
public interface QueryElement {
  <Q> Q accept(QueryVisitor<Q> visitor);
}
