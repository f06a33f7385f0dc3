package io.intellixity.strata.persistence.migrations;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.Objects;

/**
 * A versioned schema change. Versions sort lexically, so timestamps from {@link #generateVersion()}
 * order by creation time.
 * <p>
 * A callback takes precedence over SQL text for the same direction. Instances are immutable; the
 * {@code with*} methods return copies.
 */
public final class Migration {
  public static final Comparator<Migration> BY_VERSION = Comparator.comparing(Migration::version);

  private static final DateTimeFormatter VERSION_FORMAT =
      DateTimeFormatter.ofPattern("yyyyMMddHHmmss").withZone(ZoneOffset.UTC);

  private final String version;
  private final String name;
  private final String upSql;
  private final String downSql;
  private final MigrationCallback up;
  private final MigrationCallback down;

  private Migration(String version, String name, String upSql, String downSql, MigrationCallback up, MigrationCallback down) {
    this.version = version;
    this.name = name;
    this.upSql = upSql;
    this.downSql = downSql;
    this.up = up;
    this.down = down;
  }

  public static Migration of(String version, String name) {
    Objects.requireNonNull(version, "version");
    if (version.isBlank()) throw new IllegalArgumentException("migration version must not be blank");
    return new Migration(version, name == null ? "" : name, "", "", null, null);
  }

  public Migration withUpSql(String sql) {
    return new Migration(version, name, sql == null ? "" : sql, downSql, up, down);
  }

  public Migration withDownSql(String sql) {
    return new Migration(version, name, upSql, sql == null ? "" : sql, up, down);
  }

  public Migration withUp(MigrationCallback callback) {
    return new Migration(version, name, upSql, downSql, callback, down);
  }

  public Migration withDown(MigrationCallback callback) {
    return new Migration(version, name, upSql, downSql, up, callback);
  }

  public String version() { return version; }
  public String name() { return name; }
  public String upSql() { return upSql; }
  public String downSql() { return downSql; }
  public MigrationCallback up() { return up; }
  public MigrationCallback down() { return down; }

  public boolean hasUp() { return up != null || !upSql.isEmpty(); }

  public boolean hasDown() { return down != null || !downSql.isEmpty(); }

  /** {@code version_name}, or just the version when unnamed. */
  public String fullName() {
    return name.isEmpty() ? version : version + "_" + name;
  }

  public static String generateVersion() {
    return generateVersion(Clock.systemUTC());
  }

  public static String generateVersion(Clock clock) {
    return VERSION_FORMAT.format(clock.instant());
  }

  @Override
  public String toString() {
    return "Migration{" + fullName() + "}";
  }
}
