package io.intellixity.quire.persistence.mongo;

import io.intellixity.quire.persistence.query.*;
import org.bson.Document;

import java.util.*;

/**
 * Renders filters ({@link QueryElement}) to MongoDB BSON ({@link Document}),
 * applying De Morgan for NOT groups and rewriting EQ/NE null to IS NULL/IS NOT NULL semantics.
 */
final class MongoQueryRenderer {
  private MongoQueryRenderer() {}

  static Document toBson(QueryElement filter) {
    if (filter == null) return new Document();
    return render(filter, false);
  }

  static Document sort(List<SortField> sort) {
    Document d = new Document();
    if (sort == null) return d;
    for (SortField sf : sort) d.append(sf.field(), sf.direction().sign());
    return d;
  }

  /** Inclusion projection; the server keeps _id unless excluded. */
  static Document projection(List<String> fields) {
    Document d = new Document();
    for (String f : fields) d.append(f, 1);
    return d;
  }

  private static Document render(QueryElement el, boolean negate) {
    if (el == null) return new Document();

    if (el instanceof NotElement n) {
      return render(n.element(), !negate);
    }

    if (el instanceof LogicalGroup g) {
      Clause clause = g.clause();
      if (negate) clause = (clause == Clause.OR) ? Clause.AND : Clause.OR;

      List<Document> parts = new ArrayList<>();
      for (QueryElement child : g.elements()) {
        Document d = render(child, negate);
        if (d != null && !d.isEmpty()) parts.add(d);
      }
      if (parts.isEmpty()) return new Document();
      if (parts.size() == 1) return parts.get(0);
      return new Document((clause == Clause.OR) ? "$or" : "$and", parts);
    }

    if (!(el instanceof Condition c)) {
      throw new IllegalArgumentException("Unsupported QueryElement in filter: " + el.getClass().getName());
    }

    String path = c.property();
    boolean not = c.not() ^ negate;
    Operator op = c.operator();

    Document positive = switch (op) {
      case EQ -> new Document(path, c.value());
      case NE -> new Document(path, new Document("$ne", c.value()));
      case GT -> new Document(path, new Document("$gt", requireNonNull(op, c.value())));
      case GE -> new Document(path, new Document("$gte", requireNonNull(op, c.value())));
      case LT -> new Document(path, new Document("$lt", requireNonNull(op, c.value())));
      case LE -> new Document(path, new Document("$lte", requireNonNull(op, c.value())));
      case IN -> new Document(path, new Document("$in", toList(c.value())));
      case NIN -> new Document(path, new Document("$nin", toList(c.value())));
      case RANGE -> new Document(path,
          new Document("$gte", requireNonNull("RANGE.lower", c.lower()))
              .append("$lte", requireNonNull("RANGE.upper", c.upper())));
      case LIKE -> new Document(path, new Document("$regex", LikePatterns.toRegex(String.valueOf(requireNonNull(op, c.value())))));
      case REGEX -> new Document(path, new Document("$regex", String.valueOf(requireNonNull(op, c.value()))));
      case EXISTS -> new Document(path, new Document("$exists", Boolean.TRUE.equals(c.value())));
    };

    return not ? new Document("$nor", List.of(positive)) : positive;
  }

  private static Object requireNonNull(Object op, Object v) {
    if (v == null) throw new IllegalArgumentException(op + " requires non-null value");
    return v;
  }

  private static List<Object> toList(Object v) {
    if (v == null) return List.of();
    if (v instanceof Collection<?> c) return new ArrayList<>(c);
    return List.of(v);
  }
}
