package io.intellixity.quire.persistence.query;

import java.util.*;

public final class QueryFilters {
  private QueryFilters() {}

  public static Condition eq(String property, Object value) { return Condition.of(property, Operator.EQ, value); }
  public static Condition ne(String property, Object value) { return Condition.of(property, Operator.NE, value); }
  public static Condition gt(String property, Object value) { return Condition.of(property, Operator.GT, value); }
  public static Condition ge(String property, Object value) { return Condition.of(property, Operator.GE, value); }
  public static Condition lt(String property, Object value) { return Condition.of(property, Operator.LT, value); }
  public static Condition le(String property, Object value) { return Condition.of(property, Operator.LE, value); }

  public static Condition in(String property, Collection<?> values) { return Condition.of(property, Operator.IN, List.copyOf(values)); }
  public static Condition nin(String property, Collection<?> values) { return Condition.of(property, Operator.NIN, List.copyOf(values)); }

  public static Condition range(String property, Object lower, Object upper) { return Condition.range(property, lower, upper); }

  /** SQL-style pattern: '%' any run, '_' any single character. */
  public static Condition like(String property, String pattern) { return Condition.of(property, Operator.LIKE, pattern); }

  public static Condition regex(String property, String regex) { return Condition.of(property, Operator.REGEX, regex); }

  public static Condition exists(String property, boolean exists) { return Condition.of(property, Operator.EXISTS, exists); }

  public static LogicalGroup and(QueryElement... elements) {
    return new LogicalGroup(Clause.AND, List.of(elements));
  }

  public static LogicalGroup or(QueryElement... elements) {
    return new LogicalGroup(Clause.OR, List.of(elements));
  }

  public static NotElement not(QueryElement element) {
    return new NotElement(element);
  }

  /** ANDs the non-null parts; returns null when nothing is left. */
  public static QueryElement allOf(QueryElement... parts) {
    List<QueryElement> out = new ArrayList<>();
    for (QueryElement p : parts) {
      if (p == null) continue;
      if (p instanceof LogicalGroup g && g.clause() == Clause.AND) {
        out.addAll(g.elements());
      } else {
        out.add(p);
      }
    }
    if (out.isEmpty()) return null;
    if (out.size() == 1) return out.get(0);
    return new LogicalGroup(Clause.AND, out);
  }
}
