package io.intellixity.quire.persistence.spi;

/** Key-value cache with per-entry TTL. Entries expire on their own; writes are last-write-wins. */
public interface KeyValueCache {
  /** Returns the live value or null when absent/expired. */
  Object get(String key);

  void set(String key, Object value, long ttlSeconds);

  /** A cache that stores nothing. */
  static KeyValueCache none() {
    return NoopCache.INSTANCE;
  }

  final class NoopCache implements KeyValueCache {
    static final NoopCache INSTANCE = new NoopCache();

    private NoopCache() {}

    @Override public Object get(String key) { return null; }
    @Override public void set(String key, Object value, long ttlSeconds) {}
  }
}
