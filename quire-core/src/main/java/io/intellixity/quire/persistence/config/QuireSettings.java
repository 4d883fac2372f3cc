package io.intellixity.quire.persistence.config;

import io.intellixity.quire.persistence.query.InvalidParametersException;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.Properties;

/** All tunables, read from an optional {@code quire.properties} on the classpath. */
public record QuireSettings(PaginationSettings pagination, RelationSettings relation) {
  public static final String RESOURCE = "quire.properties";

  public QuireSettings {
    Objects.requireNonNull(pagination, "pagination");
    Objects.requireNonNull(relation, "relation");
  }

  public static QuireSettings defaults() {
    return new QuireSettings(PaginationSettings.defaults(), RelationSettings.defaults());
  }

  public static QuireSettings load() {
    return load(Thread.currentThread().getContextClassLoader());
  }

  public static QuireSettings load(ClassLoader cl) {
    if (cl == null) cl = QuireSettings.class.getClassLoader();
    Properties p = new Properties();
    try (InputStream in = cl.getResourceAsStream(RESOURCE)) {
      if (in == null) return defaults();
      p.load(in);
    } catch (IOException e) {
      throw new InvalidParametersException("Failed to read " + RESOURCE, e);
    }
    return fromProperties(p);
  }

  public static QuireSettings fromProperties(Properties p) {
    return new QuireSettings(PaginationSettings.fromProperties(p), RelationSettings.fromProperties(p));
  }
}
