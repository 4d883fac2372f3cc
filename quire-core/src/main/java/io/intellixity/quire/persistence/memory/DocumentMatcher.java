package io.intellixity.quire.persistence.memory;

import io.intellixity.quire.persistence.query.*;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Evaluates a {@link QueryElement} against one document with document-store semantics:
 * an array field matches when any element matches, comparisons never cross value kinds,
 * EQ null matches missing fields.
 */
final class DocumentMatcher {
  private DocumentMatcher() {}

  static boolean matches(Map<String, Object> doc, QueryElement filter) {
    if (filter == null) return true;
    return eval(doc, filter, false);
  }

  private static boolean eval(Map<String, Object> doc, QueryElement el, boolean negate) {
    if (el instanceof NotElement n) {
      return eval(doc, n.element(), !negate);
    }

    if (el instanceof LogicalGroup g) {
      if (g.elements().isEmpty()) return !negate;
      boolean any = false;
      boolean all = true;
      for (QueryElement child : g.elements()) {
        boolean r = eval(doc, child, false);
        any |= r;
        all &= r;
      }
      boolean positive = (g.clause() == Clause.OR) ? any : all;
      return positive != negate;
    }

    if (!(el instanceof Condition c)) {
      throw new IllegalArgumentException("Unsupported QueryElement in filter: " + el.getClass().getName());
    }

    boolean positive = condition(doc, c);
    return positive != (c.not() ^ negate);
  }

  private static boolean condition(Map<String, Object> doc, Condition c) {
    String path = c.property();
    Object actual = Documents.get(doc, path);
    return switch (c.operator()) {
      case EQ -> equalsAny(actual, c.value());
      case NE -> !equalsAny(actual, c.value());
      case GT -> compareAny(actual, c.value(), cmp -> cmp > 0);
      case GE -> compareAny(actual, c.value(), cmp -> cmp >= 0);
      case LT -> compareAny(actual, c.value(), cmp -> cmp < 0);
      case LE -> compareAny(actual, c.value(), cmp -> cmp <= 0);
      case IN -> inAny(actual, c.value());
      case NIN -> !inAny(actual, c.value());
      case RANGE -> compareAny(actual, c.lower(), cmp -> cmp >= 0) && compareAny(actual, c.upper(), cmp -> cmp <= 0);
      case LIKE -> regexAny(actual, Pattern.compile(LikePatterns.toRegex(String.valueOf(c.value()))));
      case REGEX -> regexAny(actual, Pattern.compile(String.valueOf(c.value())));
      case EXISTS -> Documents.has(doc, path) == Boolean.TRUE.equals(c.value());
    };
  }

  private static boolean equalsAny(Object actual, Object expected) {
    if (Documents.valueEquals(actual, expected)) return true;
    if (actual instanceof List<?> l && !(expected instanceof List<?>)) {
      for (Object x : l) if (Documents.valueEquals(x, expected)) return true;
    }
    return false;
  }

  private static boolean inAny(Object actual, Object values) {
    if (!(values instanceof Collection<?> candidates)) {
      throw new IllegalArgumentException("IN/NIN expects a collection of values");
    }
    for (Object v : candidates) if (equalsAny(actual, v)) return true;
    return false;
  }

  private interface CmpTest { boolean test(int cmp); }

  private static boolean compareAny(Object actual, Object bound, CmpTest test) {
    if (bound == null) throw new IllegalArgumentException("comparison requires a non-null value");
    if (actual instanceof List<?> l) {
      for (Object x : l) if (compareOne(x, bound, test)) return true;
      return false;
    }
    return compareOne(actual, bound, test);
  }

  private static boolean compareOne(Object actual, Object bound, CmpTest test) {
    if (actual == null || !Documents.sameKind(actual, bound)) return false;
    return test.test(Documents.compare(actual, bound));
  }

  private static boolean regexAny(Object actual, Pattern p) {
    if (actual instanceof CharSequence cs) return p.matcher(cs).find();
    if (actual instanceof List<?> l) {
      for (Object x : l) if (x instanceof CharSequence cs && p.matcher(cs).find()) return true;
    }
    return false;
  }
}
