package io.intellixity.strata.persistence.migrations.seed;

import io.intellixity.strata.persistence.error.DataAccessException;
import io.intellixity.strata.persistence.error.NotFoundException;
import io.intellixity.strata.persistence.error.OperationCancelledException;
import io.intellixity.strata.persistence.exec.OperationContext;
import io.intellixity.strata.persistence.jdbc.JdbcClient;
import io.intellixity.strata.persistence.mapping.ColumnTypes;
import io.intellixity.strata.persistence.mapping.RowReader;
import io.intellixity.strata.persistence.migrations.TestDatabase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static io.intellixity.strata.persistence.migrations.TestDatabase.count;
import static org.junit.jupiter.api.Assertions.*;

final class SeederTest {
  private static final OperationContext CTX = OperationContext.background();

  @TempDir Path dir;
  private JdbcClient client;
  private Seeder seeder;
  private final List<String> ran = new ArrayList<>();

  @BeforeEach
  void open() {
    client = TestDatabase.open(dir);
    client.execute(CTX, "CREATE TABLE contact_groups (id TEXT PRIMARY KEY, name TEXT NOT NULL)", List.of());
    seeder = new Seeder(client)
        .add("default_groups", (ctx, db) -> {
          ran.add("default_groups");
          db.exec("INSERT INTO contact_groups (id, name) VALUES (?, ?), (?, ?)", "family", "Family", "work", "Work");
        })
        .add(Seed.of("extra_group", (ctx, db) -> {
          ran.add("extra_group");
          db.exec("INSERT INTO contact_groups (id, name) VALUES (?, ?)", "club", "Club");
        }));
  }

  @AfterEach
  void close() {
    client.close();
  }

  @Test
  void registry() {
    assertEquals(2, seeder.count());
    assertTrue(seeder.hasSeed("default_groups"));
    assertFalse(seeder.hasSeed("nope"));
    assertEquals("extra_group", seeder.seeds().get(1).name());
  }

  @Test
  void runExecutesInRegistrationOrder() {
    seeder.run(CTX);
    assertEquals(List.of("default_groups", "extra_group"), ran);
    assertEquals(3, count(client, "contact_groups"));
  }

  @Test
  void runOneAndRunByNames() {
    seeder.runOne(CTX, "extra_group");
    assertEquals(List.of("extra_group"), ran);
    assertThrows(NotFoundException.class, () -> seeder.runOne(CTX, "missing"));

    seeder.runByNames(CTX, "default_groups", "missing");
    assertEquals(List.of("extra_group", "default_groups"), ran);
    assertEquals(3, count(client, "contact_groups"));
  }

  @Test
  void failureNamesTheSeedAndStopsTheRun() {
    Seeder failing = new Seeder(client)
        .add("broken", (ctx, db) -> db.exec("INSERT INTO nowhere VALUES (1)"))
        .add("after", (ctx, db) -> ran.add("after"));

    DataAccessException ex = assertThrows(DataAccessException.class, () -> failing.run(CTX));
    assertTrue(ex.getMessage().startsWith("seed broken failed: "), ex.getMessage());
    assertTrue(ran.isEmpty());
  }

  @Test
  void refreshClearsThenReseeds() {
    seeder.run(CTX);
    seeder.refresh(CTX, "contact_groups");

    assertEquals(3, count(client, "contact_groups"));
    List<String> names = client.query(CTX, "SELECT name FROM contact_groups ORDER BY name", List.of(),
        RowReader.firstColumn(ColumnTypes.string()));
    assertEquals(List.of("Club", "Family", "Work"), names);
  }

  @Test
  void clearRejectsBadTableNames() {
    assertThrows(IllegalArgumentException.class, () -> seeder.clear(CTX, "contact_groups; DROP TABLE x"));
    DataAccessException ex = assertThrows(DataAccessException.class, () -> seeder.clear(CTX, "missing_table"));
    assertTrue(ex.getMessage().startsWith("clear missing_table failed: "));
  }

  @Test
  void clearKeepsCancellationUnwrapped() {
    OperationContext cancelled = OperationContext.background().withCancel();
    cancelled.cancel();
    OperationCancelledException ex = assertThrows(OperationCancelledException.class,
        () -> seeder.clear(cancelled, "contact_groups"));
    assertEquals("operation cancelled", ex.getMessage());
    assertNull(ex.getCause());
  }
}
