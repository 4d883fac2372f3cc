package io.intellixity.quire.persistence.config;

import io.intellixity.quire.persistence.query.InvalidParametersException;

import java.util.Properties;

final class Props {
  private Props() {}

  static int intOr(Properties p, String key, int def) {
    String v = p.getProperty(key);
    if (v == null || v.isBlank()) return def;
    try {
      return Integer.parseInt(v.trim());
    } catch (NumberFormatException e) {
      throw new InvalidParametersException("Property " + key + " must be an integer but was: " + v, e);
    }
  }

  static long longOr(Properties p, String key, long def) {
    String v = p.getProperty(key);
    if (v == null || v.isBlank()) return def;
    try {
      return Long.parseLong(v.trim());
    } catch (NumberFormatException e) {
      throw new InvalidParametersException("Property " + key + " must be an integer but was: " + v, e);
    }
  }

  static double doubleOr(Properties p, String key, double def) {
    String v = p.getProperty(key);
    if (v == null || v.isBlank()) return def;
    try {
      return Double.parseDouble(v.trim());
    } catch (NumberFormatException e) {
      throw new InvalidParametersException("Property " + key + " must be a number but was: " + v, e);
    }
  }

  static boolean boolOr(Properties p, String key, boolean def) {
    String v = p.getProperty(key);
    if (v == null || v.isBlank()) return def;
    return Boolean.parseBoolean(v.trim());
  }
}
