package io.intellixity.quire.persistence.pagination;

import java.util.Map;

/** Maps a raw store document to the caller's type. */
@FunctionalInterface
public interface DocumentReader<T> {
  T read(Map<String, Object> document);

  static DocumentReader<Map<String, Object>> identity() {
    return d -> d;
  }
}
