package io.intellixity.quire.persistence.memory;

import io.intellixity.quire.persistence.query.OffsetPage;
import io.intellixity.quire.persistence.query.Query;
import io.intellixity.quire.persistence.query.QueryElement;
import io.intellixity.quire.persistence.query.SortField;
import io.intellixity.quire.persistence.query.pipeline.*;
import io.intellixity.quire.persistence.spi.CollectionStats;
import io.intellixity.quire.persistence.spi.DocumentStore;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Heap-backed {@link DocumentStore} for tests and embedded use.\n
 *
 * Documents are copied on the way in and on the way out, so callers may mutate results freely.
 * Call counters let tests assert how many round trips a component issued.
 */
public final class InMemoryDocumentStore implements DocumentStore {
  public static final String ID_FIELD = "_id";

  private final Map<String, List<Map<String, Object>>> collections = new ConcurrentHashMap<>();
  private final AtomicLong findCalls = new AtomicLong();
  private final AtomicLong countCalls = new AtomicLong();
  private final AtomicLong aggregateCalls = new AtomicLong();

  public InMemoryDocumentStore insert(String collection, Map<String, Object> doc) {
    Objects.requireNonNull(doc, "doc");
    collection(collection).add(Documents.copy(doc));
    return this;
  }

  public InMemoryDocumentStore insertAll(String collection, Collection<? extends Map<String, Object>> docs) {
    for (Map<String, Object> d : docs) insert(collection, d);
    return this;
  }

  public long findCalls() { return findCalls.get(); }
  public long countCalls() { return countCalls.get(); }
  public long aggregateCalls() { return aggregateCalls.get(); }

  @Override
  public List<Map<String, Object>> find(String collection, Query query) {
    findCalls.incrementAndGet();
    Query q = (query == null) ? new Query() : query;
    List<Map<String, Object>> out = filter(snapshot(collection), q.filter());
    if (!q.sort().isEmpty()) out.sort(comparator(q.sort()));
    out = window(out, q.page());
    if (!q.projection().isEmpty()) out = project(out, q.projection());
    return out;
  }

  @Override
  public long count(String collection, QueryElement filter) {
    countCalls.incrementAndGet();
    return filter(snapshot(collection), filter).size();
  }

  @Override
  public List<Map<String, Object>> aggregate(String collection, List<Stage> pipeline) {
    aggregateCalls.incrementAndGet();
    return run(snapshot(collection), pipeline);
  }

  @Override
  public CollectionStats stats(String collection) {
    return new CollectionStats(collection, collection(collection).size());
  }

  private List<Map<String, Object>> run(List<Map<String, Object>> docs, List<Stage> pipeline) {
    List<Map<String, Object>> cur = docs;
    for (Stage s : pipeline) {
      cur = apply(cur, s);
    }
    return cur;
  }

  private List<Map<String, Object>> apply(List<Map<String, Object>> docs, Stage stage) {
    if (stage instanceof MatchStage m) return filter(docs, m.filter());
    if (stage instanceof SortStage s) {
      List<Map<String, Object>> out = new ArrayList<>(docs);
      out.sort(comparator(s.fields()));
      return out;
    }
    if (stage instanceof SkipStage s) return docs.subList(Math.min(s.count(), docs.size()), docs.size());
    if (stage instanceof LimitStage l) return docs.subList(0, Math.min(l.count(), docs.size()));
    if (stage instanceof ProjectStage p) return project(docs, p.include());
    if (stage instanceof LookupStage l) return lookup(docs, l);
    if (stage instanceof FacetStage f) {
      Map<String, Object> out = new LinkedHashMap<>();
      for (var e : f.branches().entrySet()) out.put(e.getKey(), run(docs, e.getValue()));
      return List.of(out);
    }
    if (stage instanceof CountStage c) {
      if (docs.isEmpty()) return List.of();
      Map<String, Object> out = new LinkedHashMap<>();
      out.put(c.field(), docs.size());
      return List.of(out);
    }
    throw new IllegalArgumentException("Unsupported stage: " + stage.getClass().getName());
  }

  private List<Map<String, Object>> lookup(List<Map<String, Object>> docs, LookupStage l) {
    List<Map<String, Object>> foreign = snapshot(l.from());
    List<Map<String, Object>> out = new ArrayList<>(docs.size());
    for (Map<String, Object> d : docs) {
      List<Object> locals = asValues(Documents.get(d, l.localField()));
      List<Map<String, Object>> matched = new ArrayList<>();
      for (Map<String, Object> f : foreign) {
        List<Object> remotes = asValues(Documents.get(f, l.foreignField()));
        if (intersects(locals, remotes)) matched.add(Documents.copy(f));
      }
      Map<String, Object> copy = new LinkedHashMap<>(d);
      Documents.put(copy, l.as(), run(matched, l.pipeline()));
      out.add(copy);
    }
    return out;
  }

  private static List<Object> asValues(Object v) {
    if (v instanceof List<?> l) return l.isEmpty() ? Collections.singletonList(null) : new ArrayList<>(l);
    return Collections.singletonList(v);
  }

  private static boolean intersects(List<Object> a, List<Object> b) {
    for (Object x : a) {
      for (Object y : b) if (Documents.valueEquals(x, y)) return true;
    }
    return false;
  }

  private static List<Map<String, Object>> filter(List<Map<String, Object>> docs, QueryElement filter) {
    List<Map<String, Object>> out = new ArrayList<>();
    for (Map<String, Object> d : docs) if (DocumentMatcher.matches(d, filter)) out.add(d);
    return out;
  }

  private static List<Map<String, Object>> window(List<Map<String, Object>> docs, OffsetPage page) {
    if (page == null) return docs;
    int from = Math.min(page.offset(), docs.size());
    int to = page.unbounded() ? docs.size() : Math.min(docs.size(), from + page.limit());
    return new ArrayList<>(docs.subList(from, to));
  }

  private static List<Map<String, Object>> project(List<Map<String, Object>> docs, List<String> include) {
    List<Map<String, Object>> out = new ArrayList<>(docs.size());
    for (Map<String, Object> d : docs) {
      Map<String, Object> p = new LinkedHashMap<>();
      if (d.containsKey(ID_FIELD)) p.put(ID_FIELD, d.get(ID_FIELD));
      for (String f : include) {
        if (Documents.has(d, f)) Documents.put(p, f, Documents.get(d, f));
      }
      out.add(p);
    }
    return out;
  }

  private static Comparator<Map<String, Object>> comparator(List<SortField> sort) {
    return (a, b) -> {
      for (SortField sf : sort) {
        int c = Documents.compare(Documents.get(a, sf.field()), Documents.get(b, sf.field()));
        if (c != 0) return sf.direction() == SortField.Direction.DESC ? -c : c;
      }
      return 0;
    };
  }

  private List<Map<String, Object>> snapshot(String collection) {
    List<Map<String, Object>> out = new ArrayList<>();
    for (Map<String, Object> d : collection(collection)) out.add(Documents.copy(d));
    return out;
  }

  private List<Map<String, Object>> collection(String name) {
    Objects.requireNonNull(name, "collection");
    return collections.computeIfAbsent(name, k -> new CopyOnWriteArrayList<>());
  }
}
