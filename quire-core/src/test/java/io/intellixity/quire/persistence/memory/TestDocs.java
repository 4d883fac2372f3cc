package io.intellixity.quire.persistence.memory;

import java.util.LinkedHashMap;
import java.util.Map;

/** {@code doc("_id", 1, "name", "a")} */
public final class TestDocs {
  private TestDocs() {}

  public static Map<String, Object> doc(Object... kv) {
    if (kv.length % 2 != 0) throw new IllegalArgumentException("key/value pairs expected");
    Map<String, Object> m = new LinkedHashMap<>();
    for (int i = 0; i < kv.length; i += 2) m.put((String) kv[i], kv[i + 1]);
    return m;
  }
}
