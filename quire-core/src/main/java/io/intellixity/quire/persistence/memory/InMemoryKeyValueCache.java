package io.intellixity.quire.persistence.memory;

import io.intellixity.quire.persistence.spi.KeyValueCache;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Simple synchronized LRU cache with per-entry TTL.\n
 *
 * - LRU eviction: access-order LinkedHashMap\n
 * - TTL: expire-after-write, given per {@link #set} call\n
 */
public final class InMemoryKeyValueCache implements KeyValueCache {
  private final int maxEntries;
  private final LongSupplier nowMillis;

  private final LinkedHashMap<String, Entry> map = new LinkedHashMap<>(16, 0.75f, true);

  private record Entry(Object value, long expiresAt) {}

  public InMemoryKeyValueCache(int maxEntries) {
    this(maxEntries, System::currentTimeMillis);
  }

  public InMemoryKeyValueCache(int maxEntries, LongSupplier nowMillis) {
    if (maxEntries <= 0) throw new IllegalArgumentException("maxEntries must be > 0");
    this.maxEntries = maxEntries;
    this.nowMillis = Objects.requireNonNull(nowMillis, "nowMillis");
  }

  @Override
  public synchronized Object get(String key) {
    Objects.requireNonNull(key, "key");
    Entry e = map.get(key);
    if (e == null) return null;
    if (isExpired(e, nowMillis.getAsLong())) {
      map.remove(key);
      return null;
    }
    return e.value;
  }

  @Override
  public synchronized void set(String key, Object value, long ttlSeconds) {
    Objects.requireNonNull(key, "key");
    if (ttlSeconds <= 0) throw new IllegalArgumentException("ttlSeconds must be > 0");
    long now = nowMillis.getAsLong();
    pruneExpired(now);
    map.put(key, new Entry(value, now + ttlSeconds * 1000L));
    evictIfNeeded();
  }

  public synchronized int size() {
    pruneExpired(nowMillis.getAsLong());
    return map.size();
  }

  private static boolean isExpired(Entry e, long now) {
    return now >= e.expiresAt;
  }

  private void pruneExpired(long now) {
    if (map.isEmpty()) return;
    Iterator<Map.Entry<String, Entry>> it = map.entrySet().iterator();
    while (it.hasNext()) {
      if (isExpired(it.next().getValue(), now)) it.remove();
    }
  }

  private void evictIfNeeded() {
    while (map.size() > maxEntries) {
      Iterator<Map.Entry<String, Entry>> it = map.entrySet().iterator();
      if (!it.hasNext()) return;
      it.next();
      it.remove();
    }
  }
}
