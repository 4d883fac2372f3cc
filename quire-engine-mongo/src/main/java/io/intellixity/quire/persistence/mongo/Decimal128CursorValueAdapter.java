package io.intellixity.quire.persistence.mongo;

import io.intellixity.quire.persistence.pagination.CursorValueAdapter;
import org.bson.types.Decimal128;

/** Carries BSON decimal sort values through cursors in their exact string form. */
public final class Decimal128CursorValueAdapter implements CursorValueAdapter {
  @Override public String tag() { return "d128"; }
  @Override public boolean supports(Object value) { return value instanceof Decimal128; }
  @Override public String encode(Object value) { return value.toString(); }
  @Override public Object decode(String encoded) { return Decimal128.parse(encoded); }
}
