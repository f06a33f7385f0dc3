package io.intellixity.strata.persistence.migrations;

import io.intellixity.strata.persistence.error.DataAccessErrors;
import io.intellixity.strata.persistence.error.OperationCancelledException;
import io.intellixity.strata.persistence.exec.ConnectionClient;
import io.intellixity.strata.persistence.exec.OperationContext;
import io.intellixity.strata.persistence.exec.TxHandle;
import io.intellixity.strata.persistence.mapping.ColumnTypes;
import io.intellixity.strata.persistence.mapping.RowReader;
import io.intellixity.strata.persistence.sql.Identifiers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.*;
import java.util.function.Supplier;

/**
 * Applies and reverts {@link Migration}s, recording each applied version in a tracking table.
 * <p>
 * Every migration runs in its own transaction together with its tracking-table change, so a
 * failing migration leaves the ones before it applied. Batch operations report that progress
 * through {@link MigrationException#completed()}. Forward steps go in ascending version order,
 * backward steps in descending order.
 * <p>
 * Not thread-safe; meant to run once at startup.
 */
public final class MigrationRunner {
  private static final Logger log = LoggerFactory.getLogger(MigrationRunner.class);

  public static final String DEFAULT_TABLE = "schema_migrations";

  private final ConnectionClient client;
  private final Clock clock;
  private final List<Migration> migrations = new ArrayList<>();
  private String tableName = DEFAULT_TABLE;
  private boolean tableReady;

  public MigrationRunner(ConnectionClient client) {
    this(client, Clock.systemUTC());
  }

  public MigrationRunner(ConnectionClient client, Clock clock) {
    this.client = Objects.requireNonNull(client, "client");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public MigrationRunner withTableName(String name) {
    if (!Identifiers.isTableName(name)) throw new IllegalArgumentException("invalid migrations table name: " + name);
    this.tableName = name;
    this.tableReady = false;
    return this;
  }

  public String tableName() { return tableName; }

  /** Registers migrations. A version may be registered once. */
  public MigrationRunner add(Migration... toAdd) {
    Set<String> seen = new HashSet<>();
    for (Migration m : migrations) seen.add(m.version());
    for (Migration m : toAdd) {
      Objects.requireNonNull(m, "migration");
      if (!seen.add(m.version())) throw new IllegalArgumentException("duplicate migration version: " + m.version());
    }
    migrations.addAll(Arrays.asList(toAdd));
    return this;
  }

  /** Registered migrations in registration order. */
  public List<Migration> migrations() {
    return List.copyOf(migrations);
  }

  public void initialize(OperationContext ctx) {
    String ddl = "CREATE TABLE IF NOT EXISTS " + tableName + " ("
        + "version VARCHAR(255) PRIMARY KEY, "
        + "name VARCHAR(255) NOT NULL, "
        + "applied_at TIMESTAMP NOT NULL DEFAULT CURRENT_TIMESTAMP)";
    try {
      client.execute(ctx, ddl, Collections.emptyList());
    } catch (RuntimeException e) {
      throw DataAccessErrors.translate("create migrations table", e);
    }
    tableReady = true;
  }

  /** Tracking-table rows in ascending version order. */
  public List<MigrationRecord> applied(OperationContext ctx) {
    ensureTable(ctx);
    RowReader<MigrationRecord> reader = row -> new MigrationRecord(
        row.decode("version", ColumnTypes.string()),
        row.decode("name", ColumnTypes.string()),
        row.decode("applied_at", ColumnTypes.instant()));
    return read("load applied migrations", () -> client.query(ctx,
        "SELECT version, name, applied_at FROM " + tableName + " ORDER BY version ASC", Collections.emptyList(), reader));
  }

  /** Registered migrations without a tracking row, ascending by version. */
  public List<Migration> pending(OperationContext ctx) {
    Set<String> done = new HashSet<>();
    for (MigrationRecord r : applied(ctx)) done.add(r.version());
    List<Migration> out = new ArrayList<>();
    for (Migration m : migrations) {
      if (!done.contains(m.version())) out.add(m);
    }
    out.sort(Migration.BY_VERSION);
    return out;
  }

  /** Applies every pending migration; returns how many ran. */
  public int up(OperationContext ctx) {
    return upThrough(ctx, null);
  }

  /** Applies pending migrations with versions up to and including {@code version}. */
  public int upTo(OperationContext ctx, String version) {
    Objects.requireNonNull(version, "version");
    return upThrough(ctx, version);
  }

  /** Applies the next pending migration; false when there was none. */
  public boolean upOne(OperationContext ctx) {
    List<Migration> pending = pending(ctx);
    if (pending.isEmpty()) return false;
    apply(ctx, pending.get(0), Direction.UP, 0);
    return true;
  }

  /** Reverts the most recently applied migration; false when nothing is applied. */
  public boolean down(OperationContext ctx) {
    List<MigrationRecord> applied = applied(ctx);
    if (applied.isEmpty()) return false;
    String last = applied.get(applied.size() - 1).version();
    apply(ctx, registered(last, 0), Direction.DOWN, 0);
    return true;
  }

  /** Reverts applied migrations newer than {@code version}; the version itself stays applied. */
  public int downTo(OperationContext ctx, String version) {
    Objects.requireNonNull(version, "version");
    return downThrough(ctx, version);
  }

  /** Reverts every applied migration. */
  public int reset(OperationContext ctx) {
    return downThrough(ctx, null);
  }

  /** {@link #reset} then {@link #up}; returns how many migrations were applied again. */
  public int refresh(OperationContext ctx) {
    try {
      reset(ctx);
    } catch (MigrationException e) {
      throw new MigrationException("reset failed: " + e.getMessage(), e, 0);
    }
    try {
      return up(ctx);
    } catch (MigrationException e) {
      throw new MigrationException("up failed: " + e.getMessage(), e, e.completed());
    }
  }

  /** Every version that is registered or tracked, ascending. */
  public List<MigrationStatus> status(OperationContext ctx) {
    Map<String, MigrationRecord> applied = new HashMap<>();
    for (MigrationRecord r : applied(ctx)) applied.put(r.version(), r);

    Map<String, Migration> registered = new HashMap<>();
    for (Migration m : migrations) registered.put(m.version(), m);

    SortedSet<String> versions = new TreeSet<>(registered.keySet());
    versions.addAll(applied.keySet());

    List<MigrationStatus> out = new ArrayList<>(versions.size());
    for (String v : versions) {
      Migration m = registered.get(v);
      MigrationRecord r = applied.get(v);
      out.add(new MigrationStatus(v, m == null ? "" : m.name(), r != null, r == null ? null : r.appliedAt(), m != null));
    }
    return out;
  }

  /** Highest applied version, empty when nothing is applied. */
  public Optional<String> version(OperationContext ctx) {
    ensureTable(ctx);
    return read("load schema version", () -> client.queryOne(ctx,
        "SELECT version FROM " + tableName + " ORDER BY version DESC LIMIT 1", Collections.emptyList(),
        RowReader.firstColumn(ColumnTypes.string())));
  }

  private int upThrough(OperationContext ctx, String maxVersion) {
    int count = 0;
    for (Migration m : pending(ctx)) {
      if (maxVersion != null && m.version().compareTo(maxVersion) > 0) break;
      apply(ctx, m, Direction.UP, count);
      count++;
    }
    log.info("strata.migrate up applied={} table={}", count, tableName);
    return count;
  }

  private int downThrough(OperationContext ctx, String floorVersion) {
    List<MigrationRecord> applied = new ArrayList<>(applied(ctx));
    Collections.reverse(applied);

    int count = 0;
    for (MigrationRecord r : applied) {
      if (floorVersion != null && r.version().compareTo(floorVersion) <= 0) break;
      apply(ctx, registered(r.version(), count), Direction.DOWN, count);
      count++;
    }
    log.info("strata.migrate down reverted={} table={}", count, tableName);
    return count;
  }

  private Migration registered(String version, int completed) {
    for (Migration m : migrations) {
      if (m.version().equals(version)) return m;
    }
    throw new MigrationException("migration " + version + " not found", completed);
  }

  private void apply(OperationContext ctx, Migration m, Direction direction, int completed) {
    long started = System.nanoTime();
    try {
      ctx.throwIfDone();
      runInTransaction(ctx, m, direction);
    } catch (OperationCancelledException e) {
      throw new MigrationException("migration " + m.fullName() + " interrupted: " + e.getMessage(), e, completed);
    } catch (Exception e) {
      throw new MigrationException("migration " + m.fullName() + " failed: " + e.getMessage(), e, completed);
    }
    log.info("strata.migrate {} version={} name={} durationMs={}",
        direction.label(), m.version(), m.name(), (System.nanoTime() - started) / 1_000_000);
  }

  private void runInTransaction(OperationContext ctx, Migration m, Direction direction) throws Exception {
    TxHandle tx = client.beginTransaction(ctx);
    try {
      if (direction == Direction.UP) runUp(ctx, tx, m);
      else runDown(ctx, tx, m);
    } catch (Exception | Error failure) {
      try {
        tx.rollback();
      } catch (RuntimeException rollbackFailure) {
        log.warn("strata.migrate rollback failed version={} error={}", m.version(), rollbackFailure.toString());
        failure.addSuppressed(rollbackFailure);
      }
      throw failure;
    }
    tx.commit();
  }

  private void runUp(OperationContext ctx, TxHandle tx, Migration m) throws Exception {
    run(ctx, tx, m.up(), m.upSql());
    tx.execute(ctx, "INSERT INTO " + tableName + " (version, name, applied_at) VALUES (?, ?, ?)",
        Arrays.asList(m.version(), m.name(), now()));
  }

  private void runDown(OperationContext ctx, TxHandle tx, Migration m) throws Exception {
    run(ctx, tx, m.down(), m.downSql());
    tx.execute(ctx, "DELETE FROM " + tableName + " WHERE version = ?", Collections.singletonList(m.version()));
  }

  private static void run(OperationContext ctx, TxHandle tx, MigrationCallback callback, String sql) throws Exception {
    if (callback != null) {
      callback.run(MigrationExecutor.bind(tx, ctx));
      return;
    }
    for (String statement : SqlScripts.split(sql)) {
      tx.execute(ctx, statement, Collections.emptyList());
    }
  }

  private Instant now() {
    return clock.instant().truncatedTo(ChronoUnit.MILLIS);
  }

  private void ensureTable(OperationContext ctx) {
    if (!tableReady) initialize(ctx);
  }

  private static <R> R read(String op, Supplier<R> query) {
    try {
      return query.get();
    } catch (RuntimeException e) {
      throw DataAccessErrors.translate(op, e);
    }
  }
}
