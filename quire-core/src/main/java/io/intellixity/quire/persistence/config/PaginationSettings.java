package io.intellixity.quire.persistence.config;

import io.intellixity.quire.persistence.query.InvalidParametersException;

import java.util.Properties;

/**
 * Paging limits and strategy thresholds.
 *
 * @param defaultLimit              page size used when a request names none
 * @param maxLimit                  upper clamp for any requested page size
 * @param deepPageWarnThreshold     offset paging logs a warning above this page number
 * @param cursorPreferenceThreshold the strategy selector switches to cursor paging above this page number
 * @param approxCountSkipThreshold  above this skip, totals come from collection stats instead of an exact count
 * @param idField                   unique identifier field used as the final tie-breaker
 */
public record PaginationSettings(int defaultLimit,
                                 int maxLimit,
                                 int deepPageWarnThreshold,
                                 int cursorPreferenceThreshold,
                                 int approxCountSkipThreshold,
                                 String idField) {
  public static final String PREFIX = "quire.pagination.";

  public PaginationSettings {
    if (maxLimit < 1) throw new InvalidParametersException("maxLimit must be >= 1");
    if (defaultLimit < 1 || defaultLimit > maxLimit) {
      throw new InvalidParametersException("defaultLimit must be within [1, " + maxLimit + "]");
    }
    if (deepPageWarnThreshold < 1) throw new InvalidParametersException("deepPageWarnThreshold must be >= 1");
    if (cursorPreferenceThreshold < 1) throw new InvalidParametersException("cursorPreferenceThreshold must be >= 1");
    if (approxCountSkipThreshold < 0) throw new InvalidParametersException("approxCountSkipThreshold must be >= 0");
    if (idField == null || idField.isBlank()) throw new InvalidParametersException("idField must not be blank");
  }

  public static PaginationSettings defaults() {
    return new PaginationSettings(20, 100, 100, 50, 10_000, "_id");
  }

  public int clampLimit(int requested) {
    return Math.min(maxLimit, Math.max(1, requested));
  }

  public PaginationSettings withMaxLimit(int v) {
    return new PaginationSettings(Math.min(defaultLimit, v), v, deepPageWarnThreshold, cursorPreferenceThreshold,
        approxCountSkipThreshold, idField);
  }

  public PaginationSettings withApproxCountSkipThreshold(int v) {
    return new PaginationSettings(defaultLimit, maxLimit, deepPageWarnThreshold, cursorPreferenceThreshold, v, idField);
  }

  public PaginationSettings withCursorPreferenceThreshold(int v) {
    return new PaginationSettings(defaultLimit, maxLimit, deepPageWarnThreshold, v, approxCountSkipThreshold, idField);
  }

  /** Missing keys keep their defaults. */
  public static PaginationSettings fromProperties(Properties p) {
    PaginationSettings d = defaults();
    return new PaginationSettings(
        Props.intOr(p, PREFIX + "default-limit", d.defaultLimit()),
        Props.intOr(p, PREFIX + "max-limit", d.maxLimit()),
        Props.intOr(p, PREFIX + "deep-page-warn-threshold", d.deepPageWarnThreshold()),
        Props.intOr(p, PREFIX + "cursor-preference-threshold", d.cursorPreferenceThreshold()),
        Props.intOr(p, PREFIX + "approx-count-skip-threshold", d.approxCountSkipThreshold()),
        p.getProperty(PREFIX + "id-field", d.idField()).trim());
  }
}
