package io.intellixity.quire.persistence.relation;

import io.intellixity.quire.persistence.query.*;

/**
 * Operator density and nesting of a filter tree.\n
 *
 * Each group, negation or non-equality operator adds 0.1; value lists (IN, NIN, RANGE, group
 * children) add 0.05; anything nested deeper than 3 levels adds 0.2 and is not descended into.
 * A top-level AND is the implicit conjunction of a plain filter and costs nothing.
 */
final class FilterComplexity implements QueryVisitor<Double> {
  static final int MAX_DEPTH = 3;

  private final int depth;

  private FilterComplexity(int depth) {
    this.depth = depth;
  }

  static double of(QueryElement filter) {
    if (filter == null) return 0;
    double raw;
    if (filter instanceof LogicalGroup g && g.clause() == Clause.AND) {
      raw = 0;
      for (QueryElement child : g.elements()) raw += child.accept(new FilterComplexity(0));
    } else {
      raw = filter.accept(new FilterComplexity(0));
    }
    return Math.min(raw, 1.0);
  }

  @Override
  public Double visit(Condition c) {
    if (depth > MAX_DEPTH) return 0.2;
    double s = 0;
    if (c.operator() != Operator.EQ) s += 0.1;
    if (c.not()) s += 0.1;
    if (c.operator().multiValued() || c.operator() == Operator.RANGE) s += 0.05;
    return s;
  }

  @Override
  public Double visit(LogicalGroup g) {
    if (depth > MAX_DEPTH) return 0.2;
    double s = 0.1 + 0.05;
    FilterComplexity deeper = new FilterComplexity(depth + 1);
    for (QueryElement child : g.elements()) s += child.accept(deeper);
    return s;
  }

  @Override
  public Double visit(NotElement n) {
    if (depth > MAX_DEPTH) return 0.2;
    return 0.1 + n.element().accept(new FilterComplexity(depth + 1));
  }
}
