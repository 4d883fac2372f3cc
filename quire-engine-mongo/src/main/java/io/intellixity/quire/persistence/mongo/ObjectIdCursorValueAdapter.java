package io.intellixity.quire.persistence.mongo;

import io.intellixity.quire.persistence.pagination.CursorValueAdapter;
import org.bson.types.ObjectId;

/** Carries {@link ObjectId} sort values and identifiers through cursors as hex strings. */
public final class ObjectIdCursorValueAdapter implements CursorValueAdapter {
  @Override public String tag() { return "oid"; }
  @Override public boolean supports(Object value) { return value instanceof ObjectId; }
  @Override public String encode(Object value) { return ((ObjectId) value).toHexString(); }
  @Override public Object decode(String encoded) { return new ObjectId(encoded); }
}
