package io.intellixity.strata.persistence.jdbc;

import io.intellixity.strata.persistence.error.*;
import io.intellixity.strata.persistence.exec.OperationContext;
import io.intellixity.strata.persistence.exec.TxHandle;
import io.intellixity.strata.persistence.jdbc.sqlite.SqliteDialect;
import io.intellixity.strata.persistence.mapping.ColumnTypes;
import io.intellixity.strata.persistence.mapping.RowReader;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class JdbcClientTest {
  private static final OperationContext CTX = OperationContext.background();

  @TempDir Path dir;
  private JdbcClient client;

  @AfterEach
  void close() {
    if (client != null) client.close();
  }

  @Test
  void everyStatementFailsBeforeInitialize() {
    client = new JdbcClient(SqliteDatabase.config(dir));

    assertFalse(client.isInitialized());
    assertThrows(NotInitializedException.class, () -> client.execute(CTX, "SELECT 1", List.of()));
    assertThrows(NotInitializedException.class, () -> client.query(CTX, "SELECT 1", List.of(), r -> r.raw(1)));
    assertThrows(NotInitializedException.class, () -> client.beginTransaction(CTX));
    assertThrows(NotInitializedException.class, () -> client.ping(CTX));
    assertEquals("SELECT ?", client.rebind("SELECT ?"));
  }

  @Test
  void resolvesTheDialectFromTheDriverName() {
    client = new JdbcClient(SqliteDatabase.config(dir));
    assertInstanceOf(SqliteDialect.class, client.dialect());
    assertEquals("sqlite", client.config().orElseThrow().driver());
  }

  @Test
  void executesAndQueries() {
    client = SqliteDatabase.openWithCats(dir);
    client.ping(CTX);

    Instant now = Instant.parse("2024-02-02T08:00:00.250Z");
    long n = client.execute(CTX,
        "INSERT INTO cats (id, name, age, tag, indoor, created_at, updated_at, deleted_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?)",
        Arrays.asList("c-1", "Whiskers", 3, null, true, now, now, null));
    assertEquals(1, n);

    List<String> names = client.query(CTX, "SELECT name FROM cats WHERE age > ?", List.of(1),
        row -> row.decode("NAME", ColumnTypes.string()));
    assertEquals(List.of("Whiskers"), names);

    Optional<Instant> created = client.queryOne(CTX, "SELECT created_at FROM cats WHERE id = ?", List.of("c-1"),
        RowReader.firstColumn(ColumnTypes.instant()));
    assertEquals(Optional.of(now), created);

    Optional<Boolean> indoor = client.queryOne(CTX, "SELECT indoor FROM cats WHERE id = ?", List.of("c-1"),
        RowReader.firstColumn(ColumnTypes.bool()));
    assertEquals(Optional.of(true), indoor);

    assertTrue(client.queryOne(CTX, "SELECT id FROM cats WHERE id = ?", List.of("nope"), r -> r.raw(1)).isEmpty());
  }

  @Test
  void uniqueViolationBecomesDuplicateKey() {
    client = SqliteDatabase.openWithCats(dir);
    String insert = "INSERT INTO cats (id, name, tag, created_at, updated_at) VALUES (?, ?, ?, ?, ?)";
    Instant now = Instant.now();
    client.execute(CTX, insert, List.of("a", "A", "same", now, now));

    DuplicateKeyException ex = assertThrows(DuplicateKeyException.class,
        () -> client.execute(CTX, insert, List.of("b", "B", "same", now, now)));
    assertTrue(DataAccessErrors.isDuplicateKey(ex));
  }

  @Test
  void otherDriverFailuresKeepTheCause() {
    client = SqliteDatabase.open(dir);
    DataAccessException ex = assertThrows(DataAccessException.class,
        () -> client.query(CTX, "SELECT * FROM missing_table", List.of(), r -> r.raw(1)));
    assertNotNull(ex.getCause());
    assertFalse(ex instanceof DuplicateKeyException);
  }

  @Test
  void doneContextStopsBeforeTheStatement() {
    client = SqliteDatabase.openWithCats(dir);
    OperationContext cancelled = CTX.withCancel();
    cancelled.cancel();

    assertThrows(OperationCancelledException.class, () -> client.execute(cancelled, "DELETE FROM cats", List.of()));
    assertThrows(OperationCancelledException.class,
        () -> client.query(CTX.withDeadline(Instant.now().minusSeconds(1)), "SELECT 1", List.of(), r -> r.raw(1)));
    assertThrows(OperationCancelledException.class, () -> client.beginTransaction(cancelled));
  }

  @Test
  void transactionCommitAndRollback() {
    client = SqliteDatabase.openWithCats(dir);
    String insert = "INSERT INTO cats (id, name, created_at, updated_at) VALUES (?, ?, ?, ?)";
    Instant now = Instant.now();

    TxHandle tx = client.beginTransaction(CTX);
    tx.execute(CTX, insert, List.of("kept", "Kept", now, now));
    tx.commit();
    assertFalse(tx.isActive());
    assertThrows(TransactionException.class, tx::commit);

    TxHandle rolled = client.beginTransaction(CTX);
    rolled.execute(CTX, insert, List.of("dropped", "Dropped", now, now));
    assertEquals(Optional.of(1L), rolled.queryOne(CTX, "SELECT COUNT(*) FROM cats WHERE id = ?", List.of("dropped"),
        RowReader.firstColumn(ColumnTypes.longType())));
    rolled.rollback();

    List<String> ids = client.query(CTX, "SELECT id FROM cats ORDER BY id", List.of(), r -> r.decode("id", ColumnTypes.string()));
    assertEquals(List.of("kept"), ids);
  }

  @Test
  void closeReleasesThePool() {
    client = SqliteDatabase.open(dir);
    assertTrue(client.isInitialized());
    client.close();
    assertFalse(client.isInitialized());
    assertThrows(NotInitializedException.class, () -> client.ping(CTX));
  }
}
