package io.intellixity.quire.persistence.query;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.*;

/** Reads the canonical form written by {@link QueryJsonSerializer}. Unknown top-level keys are ignored. */
public final class QueryJsonDeserializer extends JsonDeserializer<Query> {
  @Override
  public Query deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    if (root == null || root.isNull()) return null;
    if (!root.isObject()) throw new InvalidParametersException("Query JSON must be an object");

    Query q = Query.of(parseElement(root.get("filter"), codec));

    JsonNode page = root.path("page");
    if (page.isObject()) {
      q.withPage(OffsetPage.of(intOr(page.get("offset"), 0), intOr(page.get("limit"), 0)));
    }

    List<SortField> sort = new ArrayList<>();
    for (JsonNode s : root.path("sort")) {
      String field = textOrNull(s.get("field"));
      if (field == null) continue;
      String dir = textOrNull(s.get("dir"));
      sort.add(new SortField(field, dir == null ? SortField.Direction.ASC : direction(dir)));
    }
    q.withSort(sort);

    List<String> projection = new ArrayList<>();
    for (JsonNode f : root.path("projection")) {
      if (f.isTextual()) projection.add(f.asText());
    }
    return q.withProjection(projection);
  }

  /** Parses one filter node; null for absent or JSON null. */
  public static QueryElement parseElement(JsonNode n, ObjectCodec codec) throws IOException {
    if (n == null || n.isNull()) return null;
    if (!n.isObject()) throw new InvalidParametersException("Filter element must be an object: " + n);

    if (n.has("and")) return new LogicalGroup(Clause.AND, children(n.get("and"), codec));
    if (n.has("or")) return new LogicalGroup(Clause.OR, children(n.get("or"), codec));
    if (n.has("not")) {
      QueryElement inner = parseElement(n.get("not"), codec);
      return (inner == null) ? null : new NotElement(inner);
    }

    Iterator<Map.Entry<String, JsonNode>> fields = n.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> e = fields.next();
      Operator op = operator(e.getKey());
      if (op != null) return condition(op, e.getValue(), codec);
    }
    throw new InvalidParametersException("Unsupported filter element: " + n);
  }

  private static List<QueryElement> children(JsonNode arr, ObjectCodec codec) throws IOException {
    if (arr == null || !arr.isArray()) throw new InvalidParametersException("and/or expects an array");
    List<QueryElement> out = new ArrayList<>(arr.size());
    for (JsonNode x : arr) {
      QueryElement e = parseElement(x, codec);
      if (e != null) out.add(e);
    }
    return out;
  }

  private static Condition condition(Operator op, JsonNode body, ObjectCodec codec) throws IOException {
    if (body == null || !body.isObject()) {
      throw new InvalidParametersException(op.name().toLowerCase() + " must be an object");
    }
    String field = textOrNull(body.get("field"));
    if (field == null) throw new InvalidParametersException(op.name().toLowerCase() + " requires field");
    boolean not = body.path("not").asBoolean(false);

    if (op == Operator.RANGE) {
      return new Condition(field, op, null, value(body.get("lower"), codec), value(body.get("upper"), codec), not);
    }
    if (op.multiValued()) {
      if (!(value(body.get("values"), codec) instanceof List<?> values)) {
        throw new InvalidParametersException(op.name().toLowerCase() + " requires a values array");
      }
      return new Condition(field, op, values, null, null, not);
    }
    return new Condition(field, op, value(body.get("value"), codec), null, null, not);
  }

  /** JSON scalars map to their natural Java types; {@code {"$date":..}} to {@link Instant}. */
  static Object value(JsonNode v, ObjectCodec codec) throws IOException {
    if (v == null || v.isNull()) return null;
    if (v.isObject() && v.size() == 1 && v.has(QueryJsonSerializer.DATE)) {
      String text = v.get(QueryJsonSerializer.DATE).asText();
      try {
        return Instant.parse(text);
      } catch (DateTimeParseException e) {
        throw new InvalidParametersException("Malformed $date value: " + text, e);
      }
    }
    if (v.isArray()) {
      List<Object> out = new ArrayList<>(v.size());
      for (JsonNode x : v) out.add(value(x, codec));
      return out;
    }
    return codec.treeToValue(v, Object.class);
  }

  private static Operator operator(String key) {
    for (Operator op : Operator.values()) {
      if (op.name().equalsIgnoreCase(key)) return op;
    }
    return null;
  }

  private static SortField.Direction direction(String dir) {
    try {
      return SortField.Direction.valueOf(dir.trim().toUpperCase());
    } catch (IllegalArgumentException e) {
      throw new InvalidParametersException("Unknown sort direction: " + dir);
    }
  }

  private static String textOrNull(JsonNode n) {
    return (n == null || n.isNull()) ? null : n.asText();
  }

  private static int intOr(JsonNode n, int def) {
    if (n == null || n.isNull()) return def;
    if (n.isNumber()) return n.intValue();
    try {
      return Integer.parseInt(n.asText().trim());
    } catch (NumberFormatException e) {
      throw new InvalidParametersException("Expected an integer but got " + n);
    }
  }
}
