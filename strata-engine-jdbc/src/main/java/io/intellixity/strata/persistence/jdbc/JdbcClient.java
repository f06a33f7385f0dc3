package io.intellixity.strata.persistence.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.strata.persistence.error.DataAccessException;
import io.intellixity.strata.persistence.error.NotInitializedException;
import io.intellixity.strata.persistence.exec.ConnectionClient;
import io.intellixity.strata.persistence.exec.OperationContext;
import io.intellixity.strata.persistence.exec.TxHandle;
import io.intellixity.strata.persistence.mapping.RowReader;
import io.intellixity.strata.persistence.sql.Dialect;
import io.intellixity.strata.persistence.sql.Dialects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link ConnectionClient} over JDBC.
 * <p>
 * Built from a {@link ClientConfig}, the client owns a HikariCP pool created by
 * {@link #initialize()} and closed by {@link #close()}. Built from an existing
 * {@link DataSource}, it is ready immediately and leaves the data source open on close.
 */
public final class JdbcClient implements ConnectionClient {
  private static final Logger log = LoggerFactory.getLogger(JdbcClient.class);
  private static final Duration DEFAULT_PING_TIMEOUT = Duration.ofSeconds(5);

  private final ClientConfig config;
  private final Dialect dialect;
  private final JdbcStatementRunner runner;
  private volatile DataSource dataSource;
  private volatile HikariDataSource pool;

  public JdbcClient(ClientConfig config) {
    this(config, Dialects.discovered());
  }

  public JdbcClient(ClientConfig config, Dialects dialects) {
    this.config = Objects.requireNonNull(config, "config").validate(dialects);
    this.dialect = dialects.forDriver(config.driver());
    this.runner = new JdbcStatementRunner(dialect);
  }

  public JdbcClient(DataSource dataSource, Dialect dialect) {
    this.config = null;
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.runner = new JdbcStatementRunner(dialect);
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
  }

  /** Validates the config, opens the pool and verifies a connection can be made. */
  public static JdbcClient connect(ClientConfig config) {
    return new JdbcClient(config).initialize();
  }

  public synchronized JdbcClient initialize() {
    if (dataSource != null) return this;
    HikariDataSource hds;
    try {
      hds = new HikariDataSource(hikariConfig());
    } catch (RuntimeException e) {
      throw new DataAccessException("failed to connect to database: " + e.getMessage(), e);
    }
    pool = hds;
    dataSource = hds;
    log.info("strata.jdbc connected driver={} pool={} maxOpenConns={}", dialect.id(), hds.getPoolName(), config.maxOpenConns());
    return this;
  }

  HikariConfig hikariConfig() {
    HikariConfig hc = new HikariConfig();
    hc.setPoolName("strata-" + dialect.id());
    hc.setJdbcUrl(config.url());
    if (config.username() != null) hc.setUsername(config.username());
    if (config.password() != null) hc.setPassword(config.password());
    hc.setMaximumPoolSize(config.maxOpenConns());
    hc.setMinimumIdle(Math.min(config.maxIdleConns(), config.maxOpenConns()));
    hc.setMaxLifetime(config.connMaxLifetime().toMillis());
    hc.setIdleTimeout(config.connMaxIdleTime().toMillis());
    return hc;
  }

  @Override public Dialect dialect() { return dialect; }

  @Override public boolean isInitialized() { return dataSource != null; }

  public Optional<ClientConfig> config() { return Optional.ofNullable(config); }

  @Override
  public long execute(OperationContext ctx, String sql, List<?> args) {
    DataSource ds = requireInitialized();
    ctx.throwIfDone();
    try (Connection c = ds.getConnection()) {
      return runner.execute(c, ctx, sql, args);
    } catch (SQLException e) {
      throw runner.translate(ctx, e);
    }
  }

  @Override
  public <R> List<R> query(OperationContext ctx, String sql, List<?> args, RowReader<R> reader) {
    return query(ctx, sql, args, reader, 0);
  }

  @Override
  public <R> Optional<R> queryOne(OperationContext ctx, String sql, List<?> args, RowReader<R> reader) {
    List<R> rows = query(ctx, sql, args, reader, 1);
    return rows.isEmpty() ? Optional.empty() : Optional.ofNullable(rows.get(0));
  }

  private <R> List<R> query(OperationContext ctx, String sql, List<?> args, RowReader<R> reader, int maxRows) {
    DataSource ds = requireInitialized();
    ctx.throwIfDone();
    try (Connection c = ds.getConnection()) {
      return runner.query(c, ctx, sql, args, reader, maxRows);
    } catch (SQLException e) {
      throw runner.translate(ctx, e);
    }
  }

  @Override
  public TxHandle beginTransaction(OperationContext ctx) {
    DataSource ds = requireInitialized();
    ctx.throwIfDone();
    Connection c = null;
    try {
      c = ds.getConnection();
      c.setAutoCommit(false);
      log.debug("strata.tx begin dialect={}", dialect.id());
      return new JdbcTransaction(c, runner, ctx);
    } catch (SQLException e) {
      RuntimeException failure = runner.translate(ctx, e);
      if (c != null) closeAfterFailure(c, failure);
      throw failure;
    }
  }

  @Override
  public void ping(OperationContext ctx) {
    DataSource ds = requireInitialized();
    ctx.throwIfDone();
    Duration timeout = ctx.remaining().orElse(DEFAULT_PING_TIMEOUT);
    int seconds = (int) Math.max(1, timeout.toSeconds());
    try (Connection c = ds.getConnection()) {
      if (!c.isValid(seconds)) throw new DataAccessException("database ping failed: connection is not valid");
    } catch (SQLException e) {
      throw runner.translate(ctx, e);
    }
  }

  @Override
  public synchronized void close() {
    HikariDataSource p = pool;
    if (p != null) {
      p.close();
      log.info("strata.jdbc closed pool={}", p.getPoolName());
      pool = null;
      dataSource = null;
    }
  }

  private DataSource requireInitialized() {
    DataSource ds = dataSource;
    if (ds == null) throw new NotInitializedException("database client is not initialized");
    return ds;
  }

  private static void closeAfterFailure(Connection c, RuntimeException failure) {
    try {
      c.close();
    } catch (SQLException closeFailure) {
      failure.addSuppressed(closeFailure);
    }
  }
}
