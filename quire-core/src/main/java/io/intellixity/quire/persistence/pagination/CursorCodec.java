package io.intellixity.quire.persistence.pagination;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.intellixity.quire.persistence.memory.Documents;
import io.intellixity.quire.persistence.query.InvalidParametersException;
import io.intellixity.quire.persistence.query.SortField;
import io.intellixity.quire.persistence.util.QuireFactoriesLoader;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.*;

/**
 * Opaque, URL-safe cursor tokens.\n
 *
 * A token is base64url (unpadded) of a small JSON object:
 * <pre>
 * {"s":"createdAt:-1,_id:1","k":{"createdAt":...,"_id":...},"id":...,"r":false}
 * </pre>
 * JSON-native values are written as-is; anything else goes through a {@link CursorValueAdapter}
 * as {@code {"$t":tag,"v":string}}. Tokens carry no integrity protection.
 */
public final class CursorCodec {
  private static final String TAG = "$t";
  private static final ObjectMapper JSON = new ObjectMapper();

  private final String idField;
  private final List<CursorValueAdapter> adapters;

  public CursorCodec(String idField, List<CursorValueAdapter> adapters) {
    this.idField = Objects.requireNonNull(idField, "idField");
    this.adapters = List.copyOf(adapters);
  }

  /** Built-in adapters first, then everything registered under {@code META-INF/quire.factories}. */
  public static CursorCodec withDiscoveredAdapters(String idField) {
    List<CursorValueAdapter> all = new ArrayList<>();
    all.add(new BuiltinCursorValueAdapters.InstantAdapter());
    all.add(new BuiltinCursorValueAdapters.DateAdapter());
    all.add(new BuiltinCursorValueAdapters.DecimalAdapter());
    all.addAll(QuireFactoriesLoader.load(CursorValueAdapter.class));
    return new CursorCodec(idField, all);
  }

  public String idField() { return idField; }

  /** Encodes the position of {@code record} under {@code sort}; missing fields encode as null. */
  public String encode(Map<String, Object> record, List<SortField> sort, boolean reverse) {
    Objects.requireNonNull(record, "record");
    ObjectNode root = JSON.createObjectNode();
    root.put("s", SortField.signature(sort));
    ObjectNode keys = root.putObject("k");
    for (SortField sf : sort) {
      keys.set(sf.field(), encodeValue(Documents.get(record, sf.field())));
    }
    root.set("id", encodeValue(Documents.get(record, idField)));
    root.put("r", reverse);
    try {
      byte[] json = JSON.writeValueAsBytes(root);
      return Base64.getUrlEncoder().withoutPadding().encodeToString(json);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to encode cursor", e);
    }
  }

  /** Decodes without checking which sort the cursor was issued for. */
  public CursorValues decode(String token) {
    if (token == null || token.isBlank()) throw new InvalidCursorException("Cursor must not be blank");
    JsonNode root;
    try {
      root = JSON.readTree(new String(base64(token.trim()), StandardCharsets.UTF_8));
    } catch (JsonProcessingException | IllegalArgumentException e) {
      throw new InvalidCursorException("Malformed cursor", e);
    }
    if (root == null || !root.isObject() || !root.path("s").isTextual() || !root.path("k").isObject()) {
      throw new InvalidCursorException("Malformed cursor");
    }

    Map<String, Object> values = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> it = root.get("k").fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> e = it.next();
      values.put(e.getKey(), decodeValue(e.getValue()));
    }
    Object id = decodeValue(root.path("id"));
    return new CursorValues(values, id, root.get("s").asText(), root.path("r").asBoolean(false));
  }

  /** Decodes and checks that the cursor was issued for exactly {@code sort}. */
  public CursorValues decode(String token, List<SortField> sort) {
    CursorValues cv = decode(token);
    String expected = SortField.signature(sort);
    if (!expected.equals(cv.sortSignature())) {
      throw new InvalidCursorException("Cursor was issued for sort [" + cv.sortSignature()
          + "] but the request sorts by [" + expected + "]");
    }
    for (SortField sf : sort) {
      if (!cv.values().containsKey(sf.field())) {
        throw new InvalidCursorException("Cursor has no value for sort field " + sf.field());
      }
    }
    return cv;
  }

  private static byte[] base64(String token) {
    try {
      return Base64.getUrlDecoder().decode(token);
    } catch (IllegalArgumentException e) {
      // accept the standard alphabet too
      return Base64.getDecoder().decode(token);
    }
  }

  private JsonNode encodeValue(Object v) {
    if (v == null || v instanceof String || v instanceof Boolean || v instanceof Integer || v instanceof Long
        || v instanceof Short || v instanceof Byte || v instanceof Double || v instanceof Float
        || v instanceof BigInteger) {
      return JSON.valueToTree(v);
    }
    for (CursorValueAdapter a : adapters) {
      if (a.supports(v)) {
        ObjectNode n = JsonNodeFactory.instance.objectNode();
        n.put(TAG, a.tag());
        n.put("v", a.encode(v));
        return n;
      }
    }
    throw new InvalidParametersException("No cursor value adapter for sort or id value of type "
        + v.getClass().getName());
  }

  private Object decodeValue(JsonNode n) {
    if (n == null || n.isNull() || n.isMissingNode()) return null;
    if (n.isObject() && n.has(TAG)) {
      String tag = n.get(TAG).asText();
      for (CursorValueAdapter a : adapters) {
        if (a.tag().equals(tag)) {
          try {
            return a.decode(n.path("v").asText());
          } catch (RuntimeException e) {
            throw new InvalidCursorException("Malformed cursor value tagged " + tag, e);
          }
        }
      }
      throw new InvalidCursorException("Unknown cursor value tag: " + tag);
    }
    if (n.isContainerNode()) throw new InvalidCursorException("Unsupported cursor value: " + n);
    try {
      return JSON.treeToValue(n, Object.class);
    } catch (JsonProcessingException e) {
      throw new InvalidCursorException("Malformed cursor value", e);
    }
  }
}
