package io.intellixity.quire.persistence.memory;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.*;

/**
 * Value helpers over documents represented as {@code Map<String, Object>}.\n
 *
 * Ordering follows the document-store convention: values of different kinds order by kind
 * (null, numbers, strings, documents, arrays, booleans, dates, anything else), values of the same
 * kind by their natural order. Numbers compare numerically across Java types.
 */
public final class Documents {
  private Documents() {}

  /** Value at a dotted path; null when any segment is missing. */
  public static Object get(Map<String, Object> doc, String path) {
    if (doc == null || path == null) return null;
    if (!path.contains(".")) return doc.get(path);
    Object cur = doc;
    for (String p : path.split("\\.")) {
      if (!(cur instanceof Map<?, ?> m)) return null;
      cur = m.get(p);
    }
    return cur;
  }

  public static boolean has(Map<String, Object> doc, String path) {
    if (doc == null || path == null) return false;
    Object cur = doc;
    String[] parts = path.split("\\.");
    for (int i = 0; i < parts.length; i++) {
      if (!(cur instanceof Map<?, ?> m) || !m.containsKey(parts[i])) return false;
      cur = m.get(parts[i]);
    }
    return true;
  }

  /** Sets a dotted path, creating intermediate documents. */
  @SuppressWarnings("unchecked")
  public static void put(Map<String, Object> doc, String path, Object value) {
    String[] parts = path.split("\\.");
    Map<String, Object> cur = doc;
    for (int i = 0; i < parts.length - 1; i++) {
      Object next = cur.get(parts[i]);
      if (!(next instanceof Map<?, ?>)) {
        next = new LinkedHashMap<String, Object>();
        cur.put(parts[i], next);
      }
      cur = (Map<String, Object>) next;
    }
    cur.put(parts[parts.length - 1], value);
  }

  /** Copy deep enough that callers can mutate nested documents and lists without touching the source. */
  @SuppressWarnings("unchecked")
  public static Map<String, Object> copy(Map<String, Object> doc) {
    Map<String, Object> out = new LinkedHashMap<>();
    for (var e : doc.entrySet()) out.put(e.getKey(), copyValue(e.getValue()));
    return out;
  }

  @SuppressWarnings("unchecked")
  private static Object copyValue(Object v) {
    if (v instanceof Map<?, ?> m) return copy((Map<String, Object>) m);
    if (v instanceof List<?> l) {
      List<Object> out = new ArrayList<>(l.size());
      for (Object x : l) out.add(copyValue(x));
      return out;
    }
    return v;
  }

  /** Equality under the same rules as {@link #compare}; 1 equals 1L equals 1.0. */
  public static boolean valueEquals(Object a, Object b) {
    if (a == null || b == null) return a == b;
    if (sameKind(a, b) && (a instanceof Number || a instanceof Date || a instanceof Instant)) return compare(a, b) == 0;
    if (a instanceof List<?> la && b instanceof List<?> lb) {
      if (la.size() != lb.size()) return false;
      for (int i = 0; i < la.size(); i++) if (!valueEquals(la.get(i), lb.get(i))) return false;
      return true;
    }
    return a.equals(b);
  }

  /** Hash-map key with the same equality as {@link #valueEquals} for scalars. */
  public static Object normalizeKey(Object v) {
    if (v instanceof Number n) return decimal(n).stripTrailingZeros();
    return v;
  }

  /** True when both values are of a kind that compares without type bracketing. */
  public static boolean sameKind(Object a, Object b) {
    return rank(a) == rank(b);
  }

  @SuppressWarnings({"unchecked", "rawtypes"})
  public static int compare(Object a, Object b) {
    int ra = rank(a);
    int rb = rank(b);
    if (ra != rb) return Integer.compare(ra, rb);
    if (a == null) return 0;
    if (a instanceof Number na) return decimal(na).compareTo(decimal((Number) b));
    if (ra == 6) return instant(a).compareTo(instant(b));
    if (a instanceof List<?> la) {
      List<?> lb = (List<?>) b;
      for (int i = 0; i < Math.min(la.size(), lb.size()); i++) {
        int c = compare(la.get(i), lb.get(i));
        if (c != 0) return c;
      }
      return Integer.compare(la.size(), lb.size());
    }
    if (a instanceof Map<?, ?>) return String.valueOf(a).compareTo(String.valueOf(b));
    if (a instanceof Comparable ca && a.getClass().isInstance(b)) return ca.compareTo(b);
    return String.valueOf(a).compareTo(String.valueOf(b));
  }

  private static int rank(Object v) {
    if (v == null) return 0;
    if (v instanceof Number) return 1;
    if (v instanceof CharSequence) return 2;
    if (v instanceof Map<?, ?>) return 3;
    if (v instanceof List<?>) return 4;
    if (v instanceof Boolean) return 5;
    if (v instanceof Date || v instanceof Instant) return 6;
    return 7;
  }

  private static Instant instant(Object v) {
    return (v instanceof Date d) ? d.toInstant() : (Instant) v;
  }

  private static BigDecimal decimal(Number n) {
    if (n instanceof BigDecimal bd) return bd;
    if (n instanceof Double || n instanceof Float) return BigDecimal.valueOf(n.doubleValue());
    return new BigDecimal(n.toString());
  }
}
