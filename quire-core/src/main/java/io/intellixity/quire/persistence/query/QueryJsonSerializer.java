package io.intellixity.quire.persistence.query;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;
import java.time.Instant;
import java.util.Collection;
import java.util.Date;

/**
 * Canonical JSON for {@link Query}: {@code {"filter":..,"page":{"offset":..,"limit":..},"sort":[..],"projection":[..]}}.\n
 *
 * Filter nodes are {@code {"and":[..]}}, {@code {"or":[..]}}, {@code {"not":..}} or
 * {@code {"<op>":{"field":..,"value":..}}}. Timestamps in values are written as
 * {@code {"$date":"<ISO-8601>"}} and read back as {@link Instant}.
 */
public final class QueryJsonSerializer extends JsonSerializer<Query> {
  static final String DATE = "$date";

  @Override
  public void serialize(Query q, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (q == null) {
      g.writeNull();
      return;
    }
    g.writeStartObject();
    if (q.filter() != null) {
      g.writeFieldName("filter");
      writeElement(q.filter(), g, serializers);
    }
    if (q.page() != null) {
      g.writeObjectFieldStart("page");
      g.writeNumberField("offset", q.page().offset());
      g.writeNumberField("limit", q.page().limit());
      g.writeEndObject();
    }
    if (!q.sort().isEmpty()) {
      g.writeArrayFieldStart("sort");
      for (SortField sf : q.sort()) {
        g.writeStartObject();
        g.writeStringField("field", sf.field());
        g.writeStringField("dir", sf.direction().name());
        g.writeEndObject();
      }
      g.writeEndArray();
    }
    if (!q.projection().isEmpty()) {
      g.writeArrayFieldStart("projection");
      for (String p : q.projection()) g.writeString(p);
      g.writeEndArray();
    }
    g.writeEndObject();
  }

  public static void writeElement(QueryElement el, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (el == null) {
      g.writeNull();
    } else if (el instanceof LogicalGroup lg) {
      g.writeStartObject();
      g.writeArrayFieldStart(lg.clause() == Clause.OR ? "or" : "and");
      for (QueryElement child : lg.elements()) writeElement(child, g, serializers);
      g.writeEndArray();
      g.writeEndObject();
    } else if (el instanceof NotElement n) {
      g.writeStartObject();
      g.writeFieldName("not");
      writeElement(n.element(), g, serializers);
      g.writeEndObject();
    } else if (el instanceof Condition c) {
      g.writeStartObject();
      g.writeObjectFieldStart(c.operator().name().toLowerCase());
      writeConditionBody(c, g, serializers);
      g.writeEndObject();
      g.writeEndObject();
    } else {
      throw new IllegalArgumentException("Unsupported QueryElement: " + el.getClass().getName());
    }
  }

  private static void writeConditionBody(Condition c, JsonGenerator g, SerializerProvider serializers) throws IOException {
    g.writeStringField("field", c.property());
    if (c.not()) g.writeBooleanField("not", true);
    if (c.operator() == Operator.RANGE) {
      g.writeFieldName("lower");
      writeValue(c.lower(), g, serializers);
      g.writeFieldName("upper");
      writeValue(c.upper(), g, serializers);
    } else {
      g.writeFieldName(c.operator().multiValued() ? "values" : "value");
      writeValue(c.value(), g, serializers);
    }
  }

  static void writeValue(Object v, JsonGenerator g, SerializerProvider serializers) throws IOException {
    Instant ts = (v instanceof Instant i) ? i : (v instanceof Date d) ? d.toInstant() : null;
    if (ts != null) {
      g.writeStartObject();
      g.writeStringField(DATE, ts.toString());
      g.writeEndObject();
    } else if (v instanceof Collection<?> values) {
      g.writeStartArray();
      for (Object x : values) writeValue(x, g, serializers);
      g.writeEndArray();
    } else {
      serializers.defaultSerializeValue(v, g);
    }
  }
}
