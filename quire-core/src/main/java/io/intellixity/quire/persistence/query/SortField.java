package io.intellixity.quire.persistence.query;

import java.util.*;

public record SortField(String field, Direction direction) {
  public SortField {
    Objects.requireNonNull(field, "field");
    if (field.isBlank()) throw new InvalidParametersException("Sort field must not be blank");
    direction = (direction == null) ? Direction.ASC : direction;
  }

  public enum Direction {
    ASC, DESC;

    /** Mongo-style sign: 1 for ascending, -1 for descending. */
    public int sign() { return this == DESC ? -1 : 1; }

    public Direction reverse() { return this == DESC ? ASC : DESC; }

    public static Direction fromSign(Object raw) {
      if (raw instanceof Number n) {
        if (n.intValue() == 1) return ASC;
        if (n.intValue() == -1) return DESC;
      } else if (raw != null) {
        String s = String.valueOf(raw).trim();
        if (s.equals("1") || s.equalsIgnoreCase("asc")) return ASC;
        if (s.equals("-1") || s.equalsIgnoreCase("desc")) return DESC;
      }
      throw new InvalidParametersException("Sort direction must be 1 or -1 but was: " + raw);
    }
  }

  public static SortField asc(String field) { return new SortField(field, Direction.ASC); }
  public static SortField desc(String field) { return new SortField(field, Direction.DESC); }

  public SortField reverse() { return new SortField(field, direction.reverse()); }

  /** Appends {@code idField} ascending unless the sort already orders by it, so that the order is total. */
  public static List<SortField> withTieBreaker(List<SortField> sort, String idField) {
    List<SortField> out = new ArrayList<>(sort == null ? List.of() : sort);
    for (SortField sf : out) {
      if (sf.field().equals(idField)) return List.copyOf(out);
    }
    out.add(asc(idField));
    return List.copyOf(out);
  }

  public static List<SortField> reverse(List<SortField> sort) {
    List<SortField> out = new ArrayList<>(sort.size());
    for (SortField sf : sort) out.add(sf.reverse());
    return List.copyOf(out);
  }

  /** Rejects duplicate fields; returns an immutable copy. */
  public static List<SortField> checked(List<SortField> sort) {
    if (sort == null) return List.of();
    Set<String> seen = new HashSet<>();
    for (SortField sf : sort) {
      if (sf == null) throw new InvalidParametersException("Sort contains a null entry");
      if (!seen.add(sf.field())) throw new InvalidParametersException("Duplicate sort field: " + sf.field());
    }
    return List.copyOf(sort);
  }

  /** Compact signature such as {@code createdAt:-1,_id:1}. */
  public static String signature(List<SortField> sort) {
    StringJoiner j = new StringJoiner(",");
    for (SortField sf : sort) j.add(sf.field() + ":" + sf.direction().sign());
    return j.toString();
  }
}
