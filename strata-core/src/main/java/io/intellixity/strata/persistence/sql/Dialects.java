package io.intellixity.strata.persistence.sql;

import io.intellixity.strata.persistence.util.StrataFactoriesLoader;

import java.util.*;

/**
 * Registry of dialects keyed by driver name and alias (case-insensitive).
 * <p>
 * {@link #discovered()} holds every dialect listed in {@code META-INF/strata.factories} on the
 * classpath: {@code mysql} ships with the core; {@code postgres} and {@code sqlite3} arrive with
 * their modules.
 */
public final class Dialects {
  private static volatile Dialects discovered;

  private final Map<String, Dialect> byName;
  private final SortedSet<String> ids;

  public Dialects(Collection<? extends Dialect> dialects) {
    Map<String, Dialect> m = new HashMap<>();
    SortedSet<String> canonical = new TreeSet<>();
    for (Dialect d : dialects) {
      String id = normalize(d.id());
      register(m, id, d);
      canonical.add(id);
      for (String alias : d.aliases()) register(m, normalize(alias), d);
    }
    this.byName = Map.copyOf(m);
    this.ids = Collections.unmodifiableSortedSet(canonical);
  }

  public static Dialects discovered() {
    Dialects d = discovered;
    if (d == null) {
      synchronized (Dialects.class) {
        d = discovered;
        if (d == null) {
          d = new Dialects(StrataFactoriesLoader.load(Dialect.class));
          discovered = d;
        }
      }
    }
    return d;
  }

  private static void register(Map<String, Dialect> m, String name, Dialect d) {
    Dialect prev = m.putIfAbsent(name, d);
    if (prev != null && prev.getClass() != d.getClass()) {
      throw new IllegalArgumentException("Driver name '" + name + "' claimed by both "
          + prev.getClass().getName() + " and " + d.getClass().getName());
    }
  }

  public Optional<Dialect> find(String driver) {
    if (driver == null) return Optional.empty();
    return Optional.ofNullable(byName.get(normalize(driver)));
  }

  public Dialect forDriver(String driver) {
    return find(driver).orElseThrow(() ->
        new IllegalArgumentException("Unsupported database driver: " + driver + " (supported: " + ids + ")"));
  }

  /** Canonical ids, sorted. */
  public Set<String> supportedDrivers() { return ids; }

  public static String normalize(String driver) {
    return driver == null ? "" : driver.trim().toLowerCase(Locale.ROOT);
  }
}
