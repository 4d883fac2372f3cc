package io.intellixity.quire.persistence.pagination;

import io.intellixity.quire.persistence.query.InvalidParametersException;
import io.intellixity.quire.persistence.query.SortField;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.intellixity.quire.persistence.query.QueryFilters.*;
import static org.junit.jupiter.api.Assertions.*;

final class PaginationRequestsTest {
  @Test
  void validate_collectsEveryError() {
    Map<String, Object> sort = new LinkedHashMap<>();
    sort.put("createdAt", -1);
    sort.put("title", 2);

    PaginationRequests.ValidationResult r = PaginationRequests.validate(0, 101, sort, null);

    assertFalse(r.valid());
    assertEquals(3, r.errors().size());
    assertNull(r.normalized());
  }

  @Test
  void validate_normalizesDefaults() {
    PaginationRequests.ValidationResult r = PaginationRequests.validate(null, null, Map.of("createdAt", "desc"), "abc");

    assertTrue(r.valid());
    assertEquals(1, r.normalized().page());
    assertEquals(20, r.normalized().limit());
    assertEquals(List.of(SortField.desc("createdAt")), r.normalized().sort());
    assertEquals("abc", r.normalized().cursor());
  }

  @Test
  void fromQueryParams_isLenient() {
    Map<String, String> q = new LinkedHashMap<>();
    q.put("page", "x");
    q.put("limit", "500");
    q.put("sort", "{\"createdAt\":-1,\"_id\":1}");
    q.put("cursor", "tok");

    PaginationRequests.PageRequest r = PaginationRequests.fromQueryParams(q);

    assertEquals(1, r.params().page());
    assertEquals(100, r.params().limit());
    assertEquals(List.of(SortField.desc("createdAt"), SortField.asc("_id")), r.params().sort());
    assertEquals("tok", r.params().cursor());
    assertNull(r.filter());

    PaginationRequests.PageRequest broken = PaginationRequests.fromQueryParams(Map.of("sort", "{oops", "limit", "-3"));
    assertTrue(broken.params().sort().isEmpty());
    assertEquals(20, broken.params().limit());
  }

  @Test
  void queryParams_roundTrip_withFilter() {
    PaginationParams params = new PaginationParams(3, 15, List.of(SortField.desc("createdAt")), "tok");
    var filter = and(eq("status", "published"), gt("likes", 10));

    Map<String, String> q = PaginationRequests.toQueryParams(params, filter);
    PaginationRequests.PageRequest back = PaginationRequests.fromQueryParams(q);

    assertEquals(params, back.params());
    assertEquals(filter, back.filter());
  }

  @Test
  void malformedFilter_isRejected() {
    assertThrows(InvalidParametersException.class,
        () -> PaginationRequests.fromQueryParams(Map.of("filter", "{\"nope\":1}")));
  }

  @Test
  void pageInfo_reportsWindowIndexes() {
    PaginationRequests.PageInfo info = PaginationRequests.pageInfo(3, 10, 25);

    assertEquals(3, info.totalPages());
    assertFalse(info.hasNext());
    assertTrue(info.hasPrev());
    assertEquals(21, info.startIndex());
    assertEquals(25, info.endIndex());
  }

  @Test
  void links_centreOnCurrentPage_andClampAtEdges() {
    PaginationRequests.PageLinks mid = PaginationRequests.links(6, 10);
    assertEquals(List.of(4, 5, 6, 7, 8), mid.pages());
    assertEquals(5, mid.prev());
    assertEquals(7, mid.next());
    assertEquals(1, mid.first());
    assertEquals(10, mid.last());

    PaginationRequests.PageLinks end = PaginationRequests.links(10, 10);
    assertEquals(List.of(6, 7, 8, 9, 10), end.pages());
    assertNull(end.next());

    PaginationRequests.PageLinks start = PaginationRequests.links(1, 3);
    assertEquals(List.of(1, 2, 3), start.pages());
    assertNull(start.prev());
  }
}
