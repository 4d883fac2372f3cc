package io.intellixity.quire.persistence.pagination;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.quire.persistence.config.PaginationSettings;
import io.intellixity.quire.persistence.query.InvalidParametersException;
import io.intellixity.quire.persistence.query.QueryElement;
import io.intellixity.quire.persistence.query.QueryJson;
import io.intellixity.quire.persistence.query.SortField;

import java.util.*;

/**
 * Helpers for turning HTTP-style query parameters into paging requests and back, and for
 * building page navigation.
 */
public final class PaginationRequests {
  public static final String PAGE = "page";
  public static final String LIMIT = "limit";
  public static final String SORT = "sort";
  public static final String CURSOR = "cursor";
  public static final String FILTER = "filter";

  private PaginationRequests() {}

  public record ValidationResult(boolean valid, List<String> errors, PaginationParams normalized) {
    public ValidationResult {
      errors = List.copyOf(errors);
    }
  }

  /** A parsed request: paging parameters plus an optional filter (null when absent). */
  public record PageRequest(PaginationParams params, QueryElement filter) {}

  public record PageInfo(long totalPages, boolean hasNext, boolean hasPrev, long startIndex, long endIndex) {}

  /** {@code prev}/{@code next} are null at the ends. */
  public record PageLinks(int first, int last, Integer prev, Integer next, List<Integer> pages) {}

  public static ValidationResult validate(Integer page, Integer limit, Map<String, ?> sort, String cursor) {
    return validate(page, limit, sort, cursor, PaginationSettings.defaults());
  }

  /**
   * Collects every problem instead of failing on the first. Null arguments mean "not given";
   * {@code normalized} is set only when the request is valid.
   */
  public static ValidationResult validate(Integer page, Integer limit, Map<String, ?> sort, String cursor,
                                          PaginationSettings settings) {
    List<String> errors = new ArrayList<>();
    if (page != null && page < 1) errors.add("page must be an integer greater than 0");
    if (limit != null) {
      if (limit < 1) errors.add("limit must be an integer greater than 0");
      if (limit > settings.maxLimit()) errors.add("limit must not exceed " + settings.maxLimit());
    }
    List<SortField> sortFields = new ArrayList<>();
    if (sort != null) {
      for (Map.Entry<String, ?> e : sort.entrySet()) {
        try {
          sortFields.add(new SortField(e.getKey(), SortField.Direction.fromSign(e.getValue())));
        } catch (InvalidParametersException ex) {
          errors.add("sort direction of field " + e.getKey() + " must be 1 or -1");
        }
      }
    }
    if (!errors.isEmpty()) return new ValidationResult(false, errors, null);

    PaginationParams normalized = new PaginationParams(
        page == null ? 1 : page,
        limit == null ? settings.defaultLimit() : limit,
        sortFields,
        cursor);
    return new ValidationResult(true, List.of(), normalized);
  }

  public static PageRequest fromQueryParams(Map<String, String> query) {
    return fromQueryParams(query, PaginationSettings.defaults());
  }

  /**
   * Lenient parse: unparsable page/limit keep their defaults and an unparsable sort is dropped.
   * A malformed filter is rejected with {@link InvalidParametersException}.
   */
  public static PageRequest fromQueryParams(Map<String, String> query, PaginationSettings settings) {
    Objects.requireNonNull(query, "query");
    int page = 1;
    int limit = settings.defaultLimit();

    Integer p = positiveInt(query.get(PAGE));
    if (p != null) page = p;
    Integer l = positiveInt(query.get(LIMIT));
    if (l != null) limit = Math.min(settings.maxLimit(), l);

    List<SortField> sort = List.of();
    String rawSort = query.get(SORT);
    if (rawSort != null && !rawSort.isBlank()) sort = parseSort(rawSort);

    QueryElement filter = null;
    String rawFilter = query.get(FILTER);
    if (rawFilter != null && !rawFilter.isBlank()) filter = QueryJson.readFilter(rawFilter);

    return new PageRequest(new PaginationParams(page, limit, sort, query.get(CURSOR)), filter);
  }

  public static Map<String, String> toQueryParams(PaginationParams params) {
    return toQueryParams(params, null);
  }

  public static Map<String, String> toQueryParams(PaginationParams params, QueryElement filter) {
    Map<String, String> out = new LinkedHashMap<>();
    out.put(PAGE, Integer.toString(params.page()));
    if (params.limit() > 0) out.put(LIMIT, Integer.toString(params.limit()));
    if (!params.sort().isEmpty()) {
      Map<String, Integer> sort = new LinkedHashMap<>();
      for (SortField sf : params.sort()) sort.put(sf.field(), sf.direction().sign());
      try {
        out.put(SORT, QueryJson.mapper().writeValueAsString(sort));
      } catch (JsonProcessingException e) {
        throw new IllegalStateException("Failed to write sort", e);
      }
    }
    if (params.cursor() != null) out.put(CURSOR, params.cursor());
    if (filter != null) out.put(FILTER, QueryJson.writeFilter(filter));
    return out;
  }

  public static PageInfo pageInfo(int page, int limit, long total) {
    if (limit < 1) throw new InvalidParametersException("limit must be >= 1");
    long totalPages = (total + limit - 1) / limit;
    long startIndex = (long) (page - 1) * limit + 1;
    long endIndex = Math.min((long) page * limit, total);
    return new PageInfo(totalPages, page < totalPages, page > 1, startIndex, endIndex);
  }

  public static PageLinks links(int currentPage, int totalPages) {
    return links(currentPage, totalPages, 5);
  }

  /** A window of at most {@code maxLinks} page numbers around {@code currentPage}. */
  public static PageLinks links(int currentPage, int totalPages, int maxLinks) {
    if (maxLinks < 1) throw new InvalidParametersException("maxLinks must be >= 1");
    int half = maxLinks / 2;
    int start = Math.max(1, currentPage - half);
    int end = Math.min(totalPages, start + maxLinks - 1);
    if (end - start + 1 < maxLinks) start = Math.max(1, end - maxLinks + 1);

    List<Integer> pages = new ArrayList<>();
    for (int i = start; i <= end; i++) pages.add(i);
    return new PageLinks(1, totalPages,
        currentPage > 1 ? currentPage - 1 : null,
        currentPage < totalPages ? currentPage + 1 : null,
        List.copyOf(pages));
  }

  private static Integer positiveInt(String raw) {
    if (raw == null) return null;
    try {
      int v = Integer.parseInt(raw.trim());
      return v > 0 ? v : null;
    } catch (NumberFormatException e) {
      return null;
    }
  }

  private static List<SortField> parseSort(String raw) {
    try {
      JsonNode node = QueryJson.mapper().readTree(raw);
      if (node == null || !node.isObject()) return List.of();
      List<SortField> out = new ArrayList<>();
      Iterator<Map.Entry<String, JsonNode>> it = node.fields();
      while (it.hasNext()) {
        Map.Entry<String, JsonNode> e = it.next();
        JsonNode v = e.getValue();
        out.add(new SortField(e.getKey(), SortField.Direction.fromSign(v.isNumber() ? v.numberValue() : v.asText())));
      }
      return out;
    } catch (JsonProcessingException | InvalidParametersException e) {
      return List.of();
    }
  }
}
