package io.intellixity.quire.persistence.pagination;

import io.intellixity.quire.persistence.config.PaginationSettings;
import io.intellixity.quire.persistence.memory.InMemoryDocumentStore;
import io.intellixity.quire.persistence.query.SortField;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static io.intellixity.quire.persistence.pagination.Posts.*;
import static io.intellixity.quire.persistence.query.QueryFilters.eq;
import static org.junit.jupiter.api.Assertions.*;

final class PaginationOptimizerTest {
  private static final List<SortField> NEWEST = List.of(SortField.desc("createdAt"));

  @Test
  void shallowPage_usesOffsetPaging() {
    InMemoryDocumentStore s = store();
    PaginationOptimizer optimizer = new PaginationOptimizer(s, DIRECT, PaginationSettings.defaults());

    PageResult<Map<String, Object>> r = optimizer.smartPaginate("posts", eq("status", "published"),
        PaginationParams.of(1, 2, NEWEST));

    PaginationResult<Map<String, Object>> offset = assertInstanceOf(PaginationResult.class, r);
    assertEquals(5, offset.pagination().total());
    assertEquals(1, s.countCalls());
  }

  @Test
  void deepPage_switchesToCursorPaging() {
    InMemoryDocumentStore s = store();
    PaginationOptimizer optimizer = new PaginationOptimizer(s, DIRECT, PaginationSettings.defaults());

    PageResult<Map<String, Object>> r = optimizer.smartPaginate("posts", null, PaginationParams.of(51, 3));

    CursorPaginationResult<Map<String, Object>> cursor = assertInstanceOf(CursorPaginationResult.class, r);
    assertEquals(List.of("d1", "d2", "p1"), ids(cursor.data()));
    assertTrue(cursor.pagination().hasNext());
    assertEquals(0, s.countCalls());
  }

  @Test
  void thresholdIsConfigurable() {
    PaginationOptimizer optimizer = new PaginationOptimizer(store(), DIRECT,
        PaginationSettings.defaults().withCursorPreferenceThreshold(2));

    assertInstanceOf(PaginationResult.class, optimizer.smartPaginate("posts", null, PaginationParams.of(2, 3)));
    assertInstanceOf(CursorPaginationResult.class, optimizer.smartPaginate("posts", null, PaginationParams.of(3, 3)));
  }

  @Test
  void cursorParam_continuesInItsDirection() {
    PaginationOptimizer optimizer = new PaginationOptimizer(store(), DIRECT, PaginationSettings.defaults());
    PaginationParams params = PaginationParams.of(1, 2, NEWEST);

    CursorPaginationResult<Map<String, Object>> first =
        optimizer.paginateWithCursor("posts", eq("status", "published"), CursorPaginationParams.first(2, NEWEST));
    PageResult<Map<String, Object>> second = optimizer.smartPaginate("posts", eq("status", "published"),
        params.withCursor(first.pagination().nextCursor()));
    assertEquals(List.of("p3", "p2"), ids(second.data()));

    String prev = ((CursorPaginationResult<Map<String, Object>>) second).pagination().prevCursor();
    PageResult<Map<String, Object>> back = optimizer.smartPaginate("posts", eq("status", "published"),
        params.withCursor(prev));
    assertEquals(List.of("p5", "p4"), ids(back.data()));
  }

  @Test
  void facade_exposesAllStrategies() {
    PaginationOptimizer optimizer = new PaginationOptimizer(store(), DIRECT, PaginationSettings.defaults());

    assertEquals(2, optimizer.paginateWithOffset("posts", eq("status", "draft"), PaginationParams.of(1, 5)).data().size());
    assertEquals(7, optimizer.paginateAggregation("posts", List.of(), PaginationParams.of(1, 5)).pagination().total());
  }
}
