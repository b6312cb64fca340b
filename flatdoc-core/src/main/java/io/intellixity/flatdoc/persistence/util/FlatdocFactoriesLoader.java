package io.intellixity.flatdoc.persistence.util;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.*;
import java.util.function.Predicate;

/**
 * Minimal spring.factories-style loader for flatdoc.\n
 *
 * Looks up all {@code META-INF/flatdoc.factories} resources on the classpath.\n
 * Each resource is a Java Properties file of the form:\n
 *\n
 * <pre>\n
 * io.intellixity.flatdoc.persistence.jdbc.dialect.JdbcDialect=com.acme.MyDialect,com.acme.OtherDialect\n
 * </pre>\n
 *
 * Values may be comma-separated. Whitespace is ignored.\n
 */
public final class FlatdocFactoriesLoader {
  public static final String RESOURCE = "META-INF/flatdoc.factories";

  private FlatdocFactoriesLoader() {}

  public static <T> List<T> load(Class<T> spiType) {
    return load(spiType, Thread.currentThread().getContextClassLoader());
  }

  public static <T> List<T> load(Class<T> spiType, ClassLoader cl) {
    Objects.requireNonNull(spiType, "spiType");
    if (cl == null) cl = FlatdocFactoriesLoader.class.getClassLoader();

    String key = spiType.getName();
    List<String> implNames = new ArrayList<>();

    Enumeration<URL> resources;
    try {
      resources = cl.getResources(RESOURCE);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to enumerate " + RESOURCE, e);
    }

    while (resources.hasMoreElements()) {
      URL url = resources.nextElement();
      Properties p = new Properties();
      try (InputStream in = url.openStream()) {
        p.load(in);
      } catch (IOException e) {
        throw new IllegalStateException("Failed to load " + RESOURCE + " from " + url, e);
      }

      String v = p.getProperty(key);
      if (v == null || v.isBlank()) continue;
      for (String part : v.split(",")) {
        String name = part.trim();
        if (!name.isEmpty()) implNames.add(name);
      }
    }

    LinkedHashSet<String> uniq = new LinkedHashSet<>(implNames);
    List<T> out = new ArrayList<>(uniq.size());
    for (String implName : uniq) {
      out.add(newInstance(implName, spiType, cl));
    }
    return out;
  }

  /** First registered implementation accepted by {@code filter}, in classpath order. */
  public static <T> Optional<T> first(Class<T> spiType, Predicate<? super T> filter) {
    Objects.requireNonNull(filter, "filter");
    for (T candidate : load(spiType)) {
      if (filter.test(candidate)) return Optional.of(candidate);
    }
    return Optional.empty();
  }

  private static <T> T newInstance(String implName, Class<T> spiType, ClassLoader cl) {
    try {
      Class<?> raw = Class.forName(implName, true, cl);
      if (!spiType.isAssignableFrom(raw)) {
        throw new IllegalArgumentException("Class " + implName + " does not implement " + spiType.getName());
      }
      @SuppressWarnings("unchecked")
      Class<? extends T> impl = (Class<? extends T>) raw;
      return impl.getDeclaredConstructor().newInstance();
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Failed to instantiate " + implName + " for SPI " + spiType.getName(), e);
    }
  }
}
