package io.intellixity.quire.persistence.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.*;

/**
 * Discovers extension implementations listed in {@code META-INF/quire.factories}.\n
 *
 * Every such resource on the classpath is read as a properties file keyed by the extension
 * interface's binary name, with comma-separated implementation class names:\n
 *
 * <pre>
 * io.intellixity.quire.persistence.pagination.CursorValueAdapter=com.acme.MoneyAdapter, com.acme.UuidAdapter
 * </pre>
 *
 * Implementations need a public no-arg constructor. A name listed twice yields one instance, at
 * its first position.
 */
public final class QuireFactoriesLoader {
  private static final Logger log = LoggerFactory.getLogger(QuireFactoriesLoader.class);

  public static final String RESOURCE = "META-INF/quire.factories";

  private QuireFactoriesLoader() {}

  public static <T> List<T> load(Class<T> extension) {
    return load(extension, Thread.currentThread().getContextClassLoader());
  }

  public static <T> List<T> load(Class<T> extension, ClassLoader classLoader) {
    Objects.requireNonNull(extension, "extension");
    ClassLoader cl = (classLoader == null) ? QuireFactoriesLoader.class.getClassLoader() : classLoader;

    List<T> out = new ArrayList<>();
    for (String name : implementationNames(extension.getName(), cl)) {
      out.add(instantiate(name, extension, cl));
    }
    if (!out.isEmpty()) {
      log.debug("quire.factories extension={} implementations={}", extension.getSimpleName(), out.size());
    }
    return out;
  }

  static Set<String> implementationNames(String key, ClassLoader cl) {
    Set<String> names = new LinkedHashSet<>();
    for (URL url : resources(cl)) {
      String listed = read(url).getProperty(key);
      if (listed == null) continue;
      for (String part : listed.split(",")) {
        if (!part.isBlank()) names.add(part.trim());
      }
    }
    return names;
  }

  private static List<URL> resources(ClassLoader cl) {
    try {
      return Collections.list(cl.getResources(RESOURCE));
    } catch (IOException e) {
      throw new IllegalStateException("Cannot list " + RESOURCE + " resources", e);
    }
  }

  private static Properties read(URL url) {
    Properties p = new Properties();
    try (InputStream in = url.openStream()) {
      p.load(in);
      return p;
    } catch (IOException e) {
      throw new IllegalStateException("Cannot read " + url, e);
    }
  }

  private static <T> T instantiate(String name, Class<T> extension, ClassLoader cl) {
    Class<?> type;
    try {
      type = Class.forName(name, true, cl);
    } catch (ClassNotFoundException e) {
      throw new IllegalStateException(RESOURCE + " lists " + name + " for " + extension.getName()
          + " but the class is not on the classpath", e);
    }
    if (!extension.isAssignableFrom(type)) {
      throw new IllegalStateException(name + " is listed for " + extension.getName() + " but does not implement it");
    }
    try {
      return extension.cast(type.getDeclaredConstructor().newInstance());
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Cannot instantiate " + name + "; a public no-arg constructor is required", e);
    }
  }
}
