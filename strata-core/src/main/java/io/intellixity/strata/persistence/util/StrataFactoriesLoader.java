package io.intellixity.strata.persistence.util;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.*;

/**
 * Loads service implementations listed in {@code META-INF/strata.factories}.
 * <p>
 * Each resource is a Java Properties file keyed by the service interface name:
 *
 * <pre>
 * io.intellixity.strata.persistence.sql.Dialect=com.acme.OracleDialect,com.acme.H2Dialect
 * </pre>
 *
 * Values may be comma-separated. Names listed by several resources are instantiated once, in
 * classpath order.
 */
public final class StrataFactoriesLoader {
  public static final String RESOURCE = "META-INF/strata.factories";

  private StrataFactoriesLoader() {}

  public static <T> List<T> load(Class<T> serviceType) {
    return load(serviceType, Thread.currentThread().getContextClassLoader());
  }

  public static <T> List<T> load(Class<T> serviceType, ClassLoader cl) {
    Objects.requireNonNull(serviceType, "serviceType");
    ClassLoader loader = (cl == null) ? StrataFactoriesLoader.class.getClassLoader() : cl;

    LinkedHashSet<String> names = new LinkedHashSet<>();
    for (URL url : resources(loader)) {
      String listed = read(url).getProperty(serviceType.getName());
      if (listed == null || listed.isBlank()) continue;
      Arrays.stream(listed.split(","))
          .map(String::trim)
          .filter(s -> !s.isEmpty())
          .forEach(names::add);
    }

    List<T> out = new ArrayList<>(names.size());
    for (String name : names) out.add(instantiate(name, serviceType, loader));
    return out;
  }

  private static List<URL> resources(ClassLoader loader) {
    try {
      return Collections.list(loader.getResources(RESOURCE));
    } catch (IOException e) {
      throw new IllegalStateException("Failed to enumerate " + RESOURCE, e);
    }
  }

  private static Properties read(URL url) {
    Properties p = new Properties();
    try (InputStream in = url.openStream()) {
      p.load(in);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to load " + RESOURCE + " from " + url, e);
    }
    return p;
  }

  private static <T> T instantiate(String name, Class<T> serviceType, ClassLoader loader) {
    Class<?> raw;
    try {
      raw = Class.forName(name, true, loader);
    } catch (ClassNotFoundException e) {
      throw new IllegalStateException("Listed " + serviceType.getSimpleName() + " not found: " + name, e);
    }
    if (!serviceType.isAssignableFrom(raw)) {
      throw new IllegalStateException("Class " + name + " does not implement " + serviceType.getName());
    }
    try {
      return serviceType.cast(raw.getDeclaredConstructor().newInstance());
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Failed to instantiate " + name + " for " + serviceType.getName(), e);
    }
  }
}
