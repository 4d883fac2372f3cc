package io.intellixity.quire.persistence.pagination;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Date;

final class BuiltinCursorValueAdapters {
  private BuiltinCursorValueAdapters() {}

  static final class InstantAdapter implements CursorValueAdapter {
    @Override public String tag() { return "instant"; }
    @Override public boolean supports(Object value) { return value instanceof Instant; }
    @Override public String encode(Object value) { return value.toString(); }
    @Override public Object decode(String encoded) { return Instant.parse(encoded); }
  }

  static final class DateAdapter implements CursorValueAdapter {
    @Override public String tag() { return "date"; }
    @Override public boolean supports(Object value) { return value instanceof Date; }
    @Override public String encode(Object value) { return ((Date) value).toInstant().toString(); }
    @Override public Object decode(String encoded) { return Date.from(Instant.parse(encoded)); }
  }

  /** Plain-string form keeps every digit; a JSON number would read back as a double. */
  static final class DecimalAdapter implements CursorValueAdapter {
    @Override public String tag() { return "dec"; }
    @Override public boolean supports(Object value) { return value instanceof BigDecimal; }
    @Override public String encode(Object value) { return ((BigDecimal) value).toPlainString(); }
    @Override public Object decode(String encoded) { return new BigDecimal(encoded); }
  }
}
