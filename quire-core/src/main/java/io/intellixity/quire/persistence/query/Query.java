package io.intellixity.quire.persistence.query;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.util.*;

/** The shape of a find: filter, sort, skip/limit window and projection. */
@JsonSerialize(using = QueryJsonSerializer.class)
@JsonDeserialize(using = QueryJsonDeserializer.class)
public final class Query {
  private QueryElement filter;
  private OffsetPage page;
  private List<String> projection = new ArrayList<>();
  private List<SortField> sort = new ArrayList<>();

  public Query() {}

  public QueryElement filter() { return filter; }
  public OffsetPage page() { return page; }
  public List<String> projection() { return projection; }
  public List<SortField> sort() { return sort; }

  public Query withFilter(QueryElement filter) { this.filter = filter; return this; }
  public Query withPage(OffsetPage page) { this.page = page; return this; }
  public Query withProjection(List<String> projection) { this.projection = new ArrayList<>(projection == null ? List.of() : projection); return this; }
  public Query withSort(List<SortField> sort) { this.sort = new ArrayList<>(sort == null ? List.of() : sort); return this; }

  public static Query of(QueryElement filter) {
    return new Query().withFilter(filter);
  }

  @Override
  public String toString() {
    return "Query{filter=" + filter + ", sort=" + sort + ", page=" + page + ", projection=" + projection + "}";
  }
}
