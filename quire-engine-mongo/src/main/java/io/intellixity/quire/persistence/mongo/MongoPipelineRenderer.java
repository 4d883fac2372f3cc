package io.intellixity.quire.persistence.mongo;

import io.intellixity.quire.persistence.query.pipeline.*;
import org.bson.Document;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Renders pipeline stages to their {@code $stage} BSON documents. */
final class MongoPipelineRenderer {
  private MongoPipelineRenderer() {}

  static List<Document> toBson(List<Stage> pipeline) {
    List<Document> out = new ArrayList<>(pipeline == null ? 0 : pipeline.size());
    if (pipeline == null) return out;
    for (Stage s : pipeline) out.add(stage(s));
    return out;
  }

  static Document stage(Stage stage) {
    if (stage instanceof MatchStage m) return new Document("$match", MongoQueryRenderer.toBson(m.filter()));
    if (stage instanceof SortStage s) return new Document("$sort", MongoQueryRenderer.sort(s.fields()));
    if (stage instanceof SkipStage s) return new Document("$skip", s.count());
    if (stage instanceof LimitStage l) return new Document("$limit", l.count());
    if (stage instanceof ProjectStage p) return new Document("$project", MongoQueryRenderer.projection(p.include()));
    if (stage instanceof CountStage c) return new Document("$count", c.field());
    if (stage instanceof LookupStage l) {
      Document body = new Document("from", l.from())
          .append("localField", l.localField())
          .append("foreignField", l.foreignField())
          .append("as", l.as());
      if (!l.pipeline().isEmpty()) body.append("pipeline", toBson(l.pipeline()));
      return new Document("$lookup", body);
    }
    if (stage instanceof FacetStage f) {
      Document body = new Document();
      for (Map.Entry<String, List<Stage>> e : f.branches().entrySet()) body.append(e.getKey(), toBson(e.getValue()));
      return new Document("$facet", body);
    }
    throw new IllegalArgumentException("Unsupported stage: " + stage.getClass().getName());
  }
}
