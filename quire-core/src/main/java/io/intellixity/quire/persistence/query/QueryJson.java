package io.intellixity.quire.persistence.query;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.module.SimpleModule;
import io.intellixity.quire.persistence.query.pipeline.Stage;
import io.intellixity.quire.persistence.query.pipeline.StageJsonSerializer;

import java.io.IOException;
import java.util.List;

/** Shared mapper and entry points for the canonical query and pipeline JSON forms. */
public final class QueryJson {
  private static final ObjectMapper JSON = new ObjectMapper()
      .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
      .registerModule(new SimpleModule("quire-pipeline").addSerializer(Stage.class, new StageJsonSerializer()));

  private QueryJson() {}

  public static ObjectMapper mapper() { return JSON; }

  public static String write(Query q) {
    try {
      return JSON.writeValueAsString(q);
    } catch (JsonProcessingException e) {
      throw new InvalidParametersException("Query is not serializable: " + e.getOriginalMessage(), e);
    }
  }

  public static Query read(String json) {
    try {
      return JSON.readValue(json, Query.class);
    } catch (IOException e) {
      throw new InvalidParametersException("Malformed query JSON: " + e.getMessage(), e);
    }
  }

  /** Parses a bare filter node, e.g. {@code {"eq":{"field":"status","value":"published"}}}. */
  public static QueryElement readFilter(String json) {
    try {
      JsonNode node = JSON.readTree(json);
      return QueryJsonDeserializer.parseElement(node, JSON);
    } catch (IOException e) {
      throw new InvalidParametersException("Malformed filter JSON: " + e.getMessage(), e);
    }
  }

  /** Inverse of {@link #readFilter(String)}. */
  public static String writeFilter(QueryElement filter) {
    JsonNode node = JSON.valueToTree(Query.of(filter));
    return node.path("filter").toString();
  }

  /** Canonical pipeline JSON: map keys sorted, stages in order. */
  public static String writePipeline(List<Stage> pipeline) {
    try {
      return JSON.writerFor(JSON.getTypeFactory().constructCollectionType(List.class, Stage.class))
          .writeValueAsString(pipeline);
    } catch (JsonProcessingException e) {
      throw new InvalidParametersException("Pipeline is not serializable: " + e.getOriginalMessage(), e);
    }
  }
}
