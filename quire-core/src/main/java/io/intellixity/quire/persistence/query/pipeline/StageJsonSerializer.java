package io.intellixity.quire.persistence.query.pipeline;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import io.intellixity.quire.persistence.query.QueryJsonSerializer;
import io.intellixity.quire.persistence.query.SortField;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/** Canonical JSON for pipeline stages: {@code {"$match": <filter>}}, {@code {"$sort": {"f": -1}}}, ... */
public final class StageJsonSerializer extends JsonSerializer<Stage> {
  @Override
  public void serialize(Stage stage, JsonGenerator g, SerializerProvider serializers) throws IOException {
    g.writeStartObject();
    g.writeFieldName(stage.name());

    if (stage instanceof MatchStage m) {
      QueryJsonSerializer.writeElement(m.filter(), g, serializers);
    } else if (stage instanceof SortStage s) {
      g.writeStartObject();
      for (SortField sf : s.fields()) g.writeNumberField(sf.field(), sf.direction().sign());
      g.writeEndObject();
    } else if (stage instanceof SkipStage s) {
      g.writeNumber(s.count());
    } else if (stage instanceof LimitStage l) {
      g.writeNumber(l.count());
    } else if (stage instanceof ProjectStage p) {
      g.writeStartObject();
      for (String f : p.include()) g.writeNumberField(f, 1);
      g.writeEndObject();
    } else if (stage instanceof LookupStage l) {
      g.writeStartObject();
      g.writeStringField("from", l.from());
      g.writeStringField("localField", l.localField());
      g.writeStringField("foreignField", l.foreignField());
      g.writeStringField("as", l.as());
      if (!l.pipeline().isEmpty()) {
        g.writeFieldName("pipeline");
        writeStages(l.pipeline(), g, serializers);
      }
      g.writeEndObject();
    } else if (stage instanceof FacetStage f) {
      g.writeStartObject();
      for (Map.Entry<String, List<Stage>> e : f.branches().entrySet()) {
        g.writeFieldName(e.getKey());
        writeStages(e.getValue(), g, serializers);
      }
      g.writeEndObject();
    } else if (stage instanceof CountStage c) {
      g.writeString(c.field());
    } else {
      throw new IllegalArgumentException("Unsupported stage: " + stage.getClass().getName());
    }

    g.writeEndObject();
  }

  private void writeStages(List<Stage> stages, JsonGenerator g, SerializerProvider serializers) throws IOException {
    g.writeStartArray();
    for (Stage s : stages) serialize(s, g, serializers);
    g.writeEndArray();
  }
}
