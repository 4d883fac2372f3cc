package io.intellixity.quire.persistence.memory;

import io.intellixity.quire.persistence.query.Query;
import io.intellixity.quire.persistence.query.QueryElement;
import io.intellixity.quire.persistence.query.pipeline.Stage;
import io.intellixity.quire.persistence.spi.CollectionStats;
import io.intellixity.quire.persistence.spi.DocumentStore;
import io.intellixity.quire.persistence.spi.UpstreamQueryException;

import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/** Test store: delegates to an in-memory store, records finds, and fails where told to. */
public final class ScriptedDocumentStore implements DocumentStore {
  private final DocumentStore delegate;
  private final Set<String> failingFinds = new HashSet<>();
  private boolean failStats;
  private long findDelayMillis;

  private final List<Query> finds = new CopyOnWriteArrayList<>();
  private final AtomicInteger inFlight = new AtomicInteger();
  private final AtomicInteger maxInFlight = new AtomicInteger();

  public ScriptedDocumentStore(DocumentStore delegate) {
    this.delegate = delegate;
  }

  public ScriptedDocumentStore failFindOn(String collection) {
    failingFinds.add(collection);
    return this;
  }

  public ScriptedDocumentStore failStats() {
    this.failStats = true;
    return this;
  }

  public ScriptedDocumentStore slowFinds(long millis) {
    this.findDelayMillis = millis;
    return this;
  }

  public List<Query> finds() { return finds; }
  public int maxConcurrentFinds() { return maxInFlight.get(); }

  @Override
  public List<Map<String, Object>> find(String collection, Query query) {
    finds.add(query);
    int now = inFlight.incrementAndGet();
    maxInFlight.accumulateAndGet(now, Math::max);
    try {
      if (findDelayMillis > 0) sleep(findDelayMillis);
      if (failingFinds.contains(collection)) throw new UpstreamQueryException("find on " + collection + " failed");
      return delegate.find(collection, query);
    } finally {
      inFlight.decrementAndGet();
    }
  }

  @Override
  public long count(String collection, QueryElement filter) {
    return delegate.count(collection, filter);
  }

  @Override
  public List<Map<String, Object>> aggregate(String collection, List<Stage> pipeline) {
    return delegate.aggregate(collection, pipeline);
  }

  @Override
  public CollectionStats stats(String collection) {
    if (failStats) throw new UpstreamQueryException("stats unavailable");
    return delegate.stats(collection);
  }

  private static void sleep(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException(e);
    }
  }
}
