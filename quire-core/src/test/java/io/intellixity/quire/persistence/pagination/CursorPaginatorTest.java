package io.intellixity.quire.persistence.pagination;

import io.intellixity.quire.persistence.config.PaginationSettings;
import io.intellixity.quire.persistence.memory.InMemoryDocumentStore;
import io.intellixity.quire.persistence.query.InvalidParametersException;
import io.intellixity.quire.persistence.query.QueryElement;
import io.intellixity.quire.persistence.query.SortField;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static io.intellixity.quire.persistence.memory.TestDocs.doc;
import static io.intellixity.quire.persistence.pagination.Posts.*;
import static io.intellixity.quire.persistence.query.QueryFilters.eq;
import static org.junit.jupiter.api.Assertions.*;

final class CursorPaginatorTest {
  private static final PaginationSettings SETTINGS = PaginationSettings.defaults();
  private static final CursorCodec CODEC = CursorCodec.withDiscoveredAdapters("_id");
  private static final QueryElement PUBLISHED = eq("status", "published");
  private static final List<SortField> NEWEST = List.of(SortField.desc("createdAt"));

  @Test
  void publishedPosts_walkForwardInPagesOfTwo() {
    InMemoryDocumentStore s = store();
    CursorPaginator paginator = new CursorPaginator(s, SETTINGS, CODEC);

    CursorPaginationResult<Map<String, Object>> first =
        paginator.paginate("posts", PUBLISHED, CursorPaginationParams.first(2, NEWEST));
    assertEquals(List.of("p5", "p4"), ids(first.data()));
    assertTrue(first.pagination().hasNext());
    assertFalse(first.pagination().hasPrev());
    assertNotNull(first.pagination().nextCursor());
    assertNull(first.pagination().prevCursor());

    CursorPaginationResult<Map<String, Object>> second = paginator.paginate("posts", PUBLISHED,
        CursorPaginationParams.first(2, NEWEST).after(first.pagination().nextCursor()));
    assertEquals(List.of("p3", "p2"), ids(second.data()));
    assertTrue(second.pagination().hasNext());
    assertTrue(second.pagination().hasPrev());
    assertNotNull(second.pagination().prevCursor());

    CursorPaginationResult<Map<String, Object>> third = paginator.paginate("posts", PUBLISHED,
        CursorPaginationParams.first(2, NEWEST).after(second.pagination().nextCursor()));
    assertEquals(List.of("p1"), ids(third.data()));
    assertFalse(third.pagination().hasNext());
    assertNull(third.pagination().nextCursor());
    assertEquals(3, s.findCalls());
  }

  @Test
  void prevCursor_walksBackward_inRequestedOrder() {
    CursorPaginator paginator = new CursorPaginator(store(), SETTINGS, CODEC);
    CursorPaginationParams params = CursorPaginationParams.first(2, NEWEST);

    String c1 = paginator.paginate("posts", PUBLISHED, params).pagination().nextCursor();
    CursorPaginationResult<Map<String, Object>> second = paginator.paginate("posts", PUBLISHED, params.after(c1));
    String c2 = second.pagination().nextCursor();
    CursorPaginationResult<Map<String, Object>> third = paginator.paginate("posts", PUBLISHED, params.after(c2));

    CursorPaginationResult<Map<String, Object>> back =
        paginator.paginate("posts", PUBLISHED, params.before(third.pagination().prevCursor()));
    assertEquals(List.of("p3", "p2"), ids(back.data()));
    assertTrue(back.pagination().hasPrev());
    assertTrue(back.pagination().hasNext());

    CursorPaginationResult<Map<String, Object>> start =
        paginator.paginate("posts", PUBLISHED, params.before(back.pagination().prevCursor()));
    assertEquals(List.of("p5", "p4"), ids(start.data()));
    assertFalse(start.pagination().hasPrev());
    assertNull(start.pagination().prevCursor());
    assertTrue(start.pagination().hasNext());
    assertEquals(List.of("p3", "p2"),
        ids(paginator.paginate("posts", PUBLISHED, params.after(start.pagination().nextCursor())).data()));
  }

  @Test
  void backward_withoutCursor_returnsLastPage() {
    CursorPaginator paginator = new CursorPaginator(store(), SETTINGS, CODEC);

    CursorPaginationResult<Map<String, Object>> r = paginator.paginate("posts", PUBLISHED,
        new CursorPaginationParams(2, null, NEWEST, CursorPaginationParams.Direction.BACKWARD));

    assertEquals(List.of("p2", "p1"), ids(r.data()));
    assertTrue(r.pagination().hasPrev());
    assertFalse(r.pagination().hasNext());
  }

  @Test
  void multiFieldSort_withTies_visitsEveryRecordOnce() {
    InMemoryDocumentStore s = new InMemoryDocumentStore();
    int[] scores = {3, 1, 3, 2, 3, 1, 2, 2, 3, 1};
    for (int i = 0; i < scores.length; i++) {
      s.insert("games", doc("_id", i, "score", scores[i], "level", i % 3));
    }
    List<SortField> sort = List.of(SortField.desc("score"), SortField.asc("level"));
    OffsetPaginator offset = new OffsetPaginator(s, DIRECT, SETTINGS);
    CursorPaginator cursor = new CursorPaginator(s, SETTINGS, CODEC);

    List<Object> byOffset = new ArrayList<>();
    for (int page = 1; ; page++) {
      PaginationResult<Map<String, Object>> r = offset.paginate("games", null, PaginationParams.of(page, 3, sort));
      byOffset.addAll(ids(r.data()));
      if (!r.pagination().hasNext()) break;
    }

    List<Object> byCursor = new ArrayList<>();
    CursorPaginationParams params = CursorPaginationParams.first(3, sort);
    while (true) {
      CursorPaginationResult<Map<String, Object>> r = cursor.paginate("games", null, params);
      byCursor.addAll(ids(r.data()));
      if (!r.pagination().hasNext()) break;
      params = params.after(r.pagination().nextCursor());
    }

    assertEquals(10, byOffset.size());
    assertEquals(byOffset, byCursor);
  }

  @Test
  void decimalSortValues_closerThanDoublePrecision_eachAppearOnce() {
    InMemoryDocumentStore s = new InMemoryDocumentStore()
        .insert("items", doc("_id", 1, "price", new BigDecimal("0.10000000000000000000000001")))
        .insert("items", doc("_id", 2, "price", new BigDecimal("0.10000000000000000000000002")))
        .insert("items", doc("_id", 3, "price", new BigDecimal("0.10000000000000000000000003")));
    CursorPaginator paginator = new CursorPaginator(s, SETTINGS, CODEC);

    List<Object> seen = new ArrayList<>();
    CursorPaginationParams params = CursorPaginationParams.first(1, List.of(SortField.asc("price")));
    for (int i = 0; i < 5; i++) {
      CursorPaginationResult<Map<String, Object>> r = paginator.paginate("items", null, params);
      seen.addAll(ids(r.data()));
      if (!r.pagination().hasNext()) break;
      params = params.after(r.pagination().nextCursor());
    }
    assertEquals(List.of(1, 2, 3), seen);
  }

  @Test
  void nullSortValues_orderLowest_andAreNotSkipped() {
    InMemoryDocumentStore s = new InMemoryDocumentStore()
        .insert("tasks", doc("_id", 1, "due", 5))
        .insert("tasks", doc("_id", 2))
        .insert("tasks", doc("_id", 3, "due", 1))
        .insert("tasks", doc("_id", 4));
    CursorPaginator paginator = new CursorPaginator(s, SETTINGS, CODEC);

    for (List<SortField> sort : List.of(List.of(SortField.asc("due")), List.of(SortField.desc("due")))) {
      List<Object> seen = new ArrayList<>();
      CursorPaginationParams params = CursorPaginationParams.first(1, sort);
      while (true) {
        CursorPaginationResult<Map<String, Object>> r = paginator.paginate("tasks", null, params);
        seen.addAll(ids(r.data()));
        if (!r.pagination().hasNext()) break;
        params = params.after(r.pagination().nextCursor());
      }
      List<Object> expected = sort.get(0).direction() == SortField.Direction.ASC
          ? List.of(2, 4, 3, 1)
          : List.of(1, 3, 2, 4);
      assertEquals(expected, seen, sort.toString());
    }
  }

  @Test
  void cursorFromAnotherSort_isRejected() {
    CursorPaginator paginator = new CursorPaginator(store(), SETTINGS, CODEC);
    String c = paginator.paginate("posts", PUBLISHED, CursorPaginationParams.first(2, NEWEST)).pagination().nextCursor();

    assertThrows(InvalidCursorException.class, () -> paginator.paginate("posts", PUBLISHED,
        CursorPaginationParams.first(2, List.of(SortField.asc("createdAt"))).after(c)));
    assertThrows(InvalidCursorException.class, () -> paginator.paginate("posts", PUBLISHED,
        CursorPaginationParams.first(2, NEWEST).after("garbage")));
  }

  @Test
  void emptySort_isRejected() {
    assertThrows(InvalidParametersException.class, () -> CursorPaginationParams.first(2, List.of()));
  }

  @Test
  void limit_isClamped_andExtraRecordIsNotReturned() {
    CursorPaginator paginator = new CursorPaginator(store(), SETTINGS, CODEC);

    CursorPaginationResult<Map<String, Object>> r =
        paginator.paginate("posts", null, CursorPaginationParams.first(0, NEWEST));
    assertEquals(1, r.pagination().limit());
    assertEquals(1, r.data().size());
    assertEquals(2, r.performance().documentsExamined());
  }
}
