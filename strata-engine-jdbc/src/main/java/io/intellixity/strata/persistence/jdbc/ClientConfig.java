package io.intellixity.strata.persistence.jdbc;

import io.intellixity.strata.persistence.sql.Dialects;

import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * Connection settings for {@link JdbcClient}.
 * <p>
 * Properties form (prefix {@code db}):
 *
 * <pre>
 * db.driver=postgres
 * db.url=jdbc:postgresql://localhost:5432/app
 * db.username=app
 * db.password=secret
 * db.maxOpenConns=25
 * db.maxIdleConns=5
 * db.connMaxLifetime=PT5M
 * db.connMaxIdleTime=PT5M
 * </pre>
 *
 * Durations use ISO-8601 ({@code PT5M}) or plain seconds.
 */
public final class ClientConfig {
  public static final int DEFAULT_MAX_OPEN_CONNS = 25;
  public static final int DEFAULT_MAX_IDLE_CONNS = 5;
  public static final Duration DEFAULT_CONN_MAX_LIFETIME = Duration.ofMinutes(5);
  public static final Duration DEFAULT_CONN_MAX_IDLE_TIME = Duration.ofMinutes(5);

  private String driver;
  private String url;
  private String username;
  private String password;
  private int maxOpenConns = DEFAULT_MAX_OPEN_CONNS;
  private int maxIdleConns = DEFAULT_MAX_IDLE_CONNS;
  private Duration connMaxLifetime = DEFAULT_CONN_MAX_LIFETIME;
  private Duration connMaxIdleTime = DEFAULT_CONN_MAX_IDLE_TIME;

  public static ClientConfig of(String driver, String url) {
    return new ClientConfig().driver(driver).url(url);
  }

  public static ClientConfig fromProperties(Properties props, String prefix) {
    Objects.requireNonNull(props, "props");
    String p = (prefix == null || prefix.isBlank()) ? "" : (prefix.endsWith(".") ? prefix : prefix + ".");
    ClientConfig c = new ClientConfig()
        .driver(props.getProperty(p + "driver"))
        .url(props.getProperty(p + "url"))
        .username(props.getProperty(p + "username"))
        .password(props.getProperty(p + "password"));
    String v;
    if ((v = props.getProperty(p + "maxOpenConns")) != null) c.maxOpenConns(parseInt(p + "maxOpenConns", v));
    if ((v = props.getProperty(p + "maxIdleConns")) != null) c.maxIdleConns(parseInt(p + "maxIdleConns", v));
    if ((v = props.getProperty(p + "connMaxLifetime")) != null) c.connMaxLifetime(parseDuration(p + "connMaxLifetime", v));
    if ((v = props.getProperty(p + "connMaxIdleTime")) != null) c.connMaxIdleTime(parseDuration(p + "connMaxIdleTime", v));
    return c;
  }

  /** Checks the settings against the dialects on the classpath. */
  public ClientConfig validate() {
    return validate(Dialects.discovered());
  }

  public ClientConfig validate(Dialects dialects) {
    if (driver == null || driver.isBlank()) throw new IllegalArgumentException("database driver is required");
    dialects.forDriver(driver);
    if (url == null || url.isBlank()) throw new IllegalArgumentException("database url is required");
    if (maxOpenConns < 1) throw new IllegalArgumentException("maxOpenConns must be at least 1: " + maxOpenConns);
    if (maxIdleConns < 0) throw new IllegalArgumentException("maxIdleConns must not be negative: " + maxIdleConns);
    requireNonNegative("connMaxLifetime", connMaxLifetime);
    requireNonNegative("connMaxIdleTime", connMaxIdleTime);
    return this;
  }

  public String driver() { return driver; }
  public ClientConfig driver(String driver) { this.driver = driver; return this; }

  public String url() { return url; }
  public ClientConfig url(String url) { this.url = url; return this; }

  public String username() { return username; }
  public ClientConfig username(String username) { this.username = username; return this; }

  public String password() { return password; }
  public ClientConfig password(String password) { this.password = password; return this; }

  public int maxOpenConns() { return maxOpenConns; }
  public ClientConfig maxOpenConns(int n) { this.maxOpenConns = n; return this; }

  public int maxIdleConns() { return maxIdleConns; }
  public ClientConfig maxIdleConns(int n) { this.maxIdleConns = n; return this; }

  public Duration connMaxLifetime() { return connMaxLifetime; }
  public ClientConfig connMaxLifetime(Duration d) { this.connMaxLifetime = d; return this; }

  public Duration connMaxIdleTime() { return connMaxIdleTime; }
  public ClientConfig connMaxIdleTime(Duration d) { this.connMaxIdleTime = d; return this; }

  private static void requireNonNegative(String name, Duration d) {
    if (d == null || d.isNegative()) throw new IllegalArgumentException(name + " must not be negative: " + d);
  }

  private static int parseInt(String key, String value) {
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("invalid integer for " + key + ": " + value, e);
    }
  }

  static Duration parseDuration(String key, String value) {
    String v = value.trim();
    try {
      if (!v.isEmpty() && v.chars().allMatch(Character::isDigit)) return Duration.ofSeconds(Long.parseLong(v));
      return Duration.parse(v);
    } catch (RuntimeException e) {
      throw new IllegalArgumentException("invalid duration for " + key + ": " + value, e);
    }
  }

  @Override
  public String toString() {
    // no password
    return "ClientConfig{driver=" + driver + ", url=" + url + ", username=" + username
        + ", maxOpenConns=" + maxOpenConns + ", maxIdleConns=" + maxIdleConns
        + ", connMaxLifetime=" + connMaxLifetime + ", connMaxIdleTime=" + connMaxIdleTime + "}";
  }
}
