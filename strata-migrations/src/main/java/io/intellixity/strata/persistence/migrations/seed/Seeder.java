package io.intellixity.strata.persistence.migrations.seed;

import io.intellixity.strata.persistence.error.DataAccessErrors;
import io.intellixity.strata.persistence.error.DataAccessException;
import io.intellixity.strata.persistence.error.NotFoundException;
import io.intellixity.strata.persistence.exec.ConnectionClient;
import io.intellixity.strata.persistence.exec.OperationContext;
import io.intellixity.strata.persistence.migrations.MigrationExecutor;
import io.intellixity.strata.persistence.sql.Identifiers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Runs named seeds against a client in registration order. Seeds run outside any transaction;
 * a seed that needs atomicity opens one itself.
 */
public final class Seeder {
  private static final Logger log = LoggerFactory.getLogger(Seeder.class);

  private final ConnectionClient client;
  private final List<Seed> seeds = new ArrayList<>();

  public Seeder(ConnectionClient client) {
    this.client = Objects.requireNonNull(client, "client");
  }

  public Seeder add(Seed... toAdd) {
    for (Seed s : toAdd) seeds.add(Objects.requireNonNull(s, "seed"));
    return this;
  }

  public Seeder add(String name, SeedCallback callback) {
    return add(Seed.of(name, callback));
  }

  public List<Seed> seeds() { return List.copyOf(seeds); }

  public int count() { return seeds.size(); }

  public boolean hasSeed(String name) {
    return find(name).isPresent();
  }

  /** Runs every seed; the first failure stops the run and names the seed. */
  public void run(OperationContext ctx) {
    for (Seed s : seeds) runSeed(ctx, s);
  }

  public void runOne(OperationContext ctx, String name) {
    Seed s = find(name).orElseThrow(() -> new NotFoundException("seed " + name + " not found"));
    runSeed(ctx, s);
  }

  /** Runs the named seeds in registration order. Unknown names are ignored. */
  public void runByNames(OperationContext ctx, String... names) {
    Set<String> wanted = new HashSet<>(Arrays.asList(names));
    for (Seed s : seeds) {
      if (wanted.contains(s.name())) runSeed(ctx, s);
    }
  }

  /** Deletes every row of each table, in the order given. */
  public void clear(OperationContext ctx, String... tables) {
    for (String table : tables) {
      if (!Identifiers.isTableName(table)) throw new IllegalArgumentException("invalid table name: " + table);
      try {
        long rows = client.execute(ctx, "DELETE FROM " + table, Collections.emptyList());
        log.info("strata.seed cleared table={} rows={}", table, rows);
      } catch (RuntimeException e) {
        throw DataAccessErrors.translate("clear " + table, e);
      }
    }
  }

  public void refresh(OperationContext ctx, String... tables) {
    clear(ctx, tables);
    run(ctx);
  }

  private Optional<Seed> find(String name) {
    for (Seed s : seeds) {
      if (s.name().equals(name)) return Optional.of(s);
    }
    return Optional.empty();
  }

  private void runSeed(OperationContext ctx, Seed s) {
    long started = System.nanoTime();
    try {
      ctx.throwIfDone();
      s.callback().run(ctx, MigrationExecutor.bind(client, ctx));
    } catch (Exception e) {
      throw new DataAccessException("seed " + s.name() + " failed: " + e.getMessage(), e);
    }
    log.info("strata.seed ran name={} durationMs={}", s.name(), (System.nanoTime() - started) / 1_000_000);
  }
}
