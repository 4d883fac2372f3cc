package io.intellixity.quire.persistence.query;

import io.intellixity.quire.persistence.query.pipeline.Pipelines;
import io.intellixity.quire.persistence.query.pipeline.Stage;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Date;
import java.util.List;

import static io.intellixity.quire.persistence.query.QueryFilters.*;
import static org.junit.jupiter.api.Assertions.*;

final class QueryJsonTest {
  @Test
  void parsesNotNode() {
    String s = """
        {
          "filter": {
            "not": { "eq": { "field": "status", "value": "draft" } }
          }
        }
        """;
    Query q = QueryJson.read(s);
    assertTrue(q.filter() instanceof NotElement);
    Condition c = (Condition) ((NotElement) q.filter()).element();
    assertEquals("status", c.property());
    assertEquals(Operator.EQ, c.operator());
    assertEquals("draft", c.value());
  }

  @Test
  void query_roundTrips_filterSortAndPage() {
    Query q = Query.of(and(eq("status", "published"), in("tag", List.of("a", "b")), range("score", 1, 5)))
        .withSort(List.of(SortField.desc("createdAt")))
        .withPage(OffsetPage.of(20, 10))
        .withProjection(List.of("title"));

    Query back = QueryJson.read(QueryJson.write(q));

    assertEquals(q.filter(), back.filter());
    assertEquals(q.sort(), back.sort());
    assertEquals(q.page(), back.page());
    assertEquals(q.projection(), back.projection());
  }

  @Test
  void filter_roundTrips_throughBareFilterJson() {
    QueryElement f = or(like("title", "Intro%"), not(exists("deletedAt", true)));
    assertEquals(f, QueryJson.readFilter(QueryJson.writeFilter(f)));
  }

  @Test
  void timestamps_roundTripAsInstants() {
    Instant t = Instant.parse("2024-03-01T10:15:30Z");
    QueryElement f = and(lt("createdAt", t), in("day", List.of(t)));

    String json = QueryJson.writeFilter(f);
    assertTrue(json.contains("{\"$date\":\"2024-03-01T10:15:30Z\"}"), json);
    assertEquals(f, QueryJson.readFilter(json));
    assertEquals(lt("createdAt", t), QueryJson.readFilter(QueryJson.writeFilter(lt("createdAt", Date.from(t)))));
  }

  @Test
  void malformedFilter_isInvalidParameters() {
    assertThrows(InvalidParametersException.class, () -> QueryJson.readFilter("{\"bogus\":{}}"));
    assertThrows(InvalidParametersException.class, () -> QueryJson.readFilter("{not json"));
    assertThrows(InvalidParametersException.class,
        () -> QueryJson.readFilter("{\"lt\":{\"field\":\"t\",\"value\":{\"$date\":\"yesterday\"}}}"));
  }

  @Test
  void pipelineJson_isCanonical() {
    List<Stage> a = List.of(Pipelines.match(eq("status", "published")), Pipelines.limit(5));
    List<Stage> b = List.of(Pipelines.match(eq("status", "published")), Pipelines.limit(5));

    String json = QueryJson.writePipeline(a);
    assertEquals(json, QueryJson.writePipeline(b));
    assertEquals("[{\"$match\":{\"eq\":{\"field\":\"status\",\"value\":\"published\"}}},{\"$limit\":5}]", json);
  }

  @Test
  void allOf_flattensAndSkipsNulls() {
    QueryElement base = and(eq("a", 1), eq("b", 2));
    QueryElement merged = allOf(base, null, eq("c", 3));

    LogicalGroup g = assertInstanceOf(LogicalGroup.class, merged);
    assertEquals(Clause.AND, g.clause());
    assertEquals(3, g.elements().size());
    assertNull(allOf(null, null));
    assertEquals(eq("a", 1), allOf(null, eq("a", 1)));
  }

  @Test
  void range_requiresBothBounds() {
    assertThrows(InvalidParametersException.class, () -> range("score", null, 5));
  }
}
