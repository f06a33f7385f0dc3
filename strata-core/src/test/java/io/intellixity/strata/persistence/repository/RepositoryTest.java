package io.intellixity.strata.persistence.repository;

import io.intellixity.strata.persistence.error.*;
import io.intellixity.strata.persistence.exec.OperationContext;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.*;

import static io.intellixity.strata.persistence.query.QueryOptions.*;
import static org.junit.jupiter.api.Assertions.*;

final class RepositoryTest {
  private static final OperationContext CTX = OperationContext.background();
  private static final Instant NOW = Instant.parse("2024-06-01T12:00:00.123456Z");
  private static final Instant NOW_MS = Instant.parse("2024-06-01T12:00:00.123Z");

  private final List<String> events = new ArrayList<>();
  private final FakeClient client = new FakeClient(events);
  private final Repository<Cat> repo =
      new Repository<>(client, Cat.MAPPING, Clock.fixed(NOW, ZoneOffset.UTC), () -> "cat-1");

  private Cat persisted(String id) {
    Cat c = new Cat("Whiskers", 3);
    c.setId(id);
    c.setCreatedAt(NOW_MS.minusSeconds(60));
    c.setUpdatedAt(NOW_MS.minusSeconds(60));
    c.events = events;
    return c;
  }

  @Test
  void createStampsIdentityAndInsertsEveryColumn() {
    Cat cat = new Cat("Whiskers", 3);
    repo.create(CTX, cat);

    assertEquals("cat-1", cat.getId());
    assertEquals(NOW_MS, cat.getCreatedAt());
    assertEquals(NOW_MS, cat.getUpdatedAt());
    assertEquals("INSERT INTO cats (id, created_at, updated_at, deleted_at, name, age) VALUES (?, ?, ?, ?, ?, ?)",
        client.last().sql());
    assertEquals(Arrays.asList("cat-1", NOW_MS, NOW_MS, null, "Whiskers", 3), client.last().args());
  }

  @Test
  void createRunsHooksAroundTheInsert() {
    Cat cat = new Cat("Whiskers", 3);
    cat.events = events;
    repo.create(CTX, cat);

    assertEquals(List.of("validate", "beforeSave", "beforeCreate", "sql", "afterCreate", "afterSave"), events);
  }

  @Test
  void rejectingHookAbortsBeforeAnySql() {
    Cat cat = new Cat("Grumpy", 9);
    cat.events = events;
    cat.rejectIn = "validate";

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> repo.create(CTX, cat));
    assertEquals("validate rejected Grumpy", ex.getMessage());
    assertTrue(client.calls.isEmpty());
    assertTrue(cat.isNew());
  }

  @Test
  void failedInsertForgetsTheStampedIdentity() {
    client.then(new DataAccessException("disk full"));
    Cat cat = new Cat("Whiskers", 3);

    DataAccessException ex = assertThrows(DataAccessException.class, () -> repo.create(CTX, cat));
    assertEquals("create failed: disk full", ex.getMessage());
    assertTrue(cat.isNew());
    assertNull(cat.getCreatedAt());
  }

  @Test
  void duplicateKeyPassesThroughUnwrapped() {
    DuplicateKeyException dup = new DuplicateKeyException("duplicate key", new SQLException("x", "23505"), "23505");
    client.then(dup);
    assertSame(dup, assertThrows(DuplicateKeyException.class, () -> repo.create(CTX, new Cat("A", 1))));
  }

  @Test
  void updateOfNewEntityFailsBeforeHooks() {
    Cat cat = new Cat("Whiskers", 3);
    cat.events = events;
    assertThrows(NotPersistedException.class, () -> repo.update(CTX, cat));
    assertTrue(events.isEmpty());
  }

  @Test
  void updateSkipsIdentityColumnsAndScopesToLiveRows() {
    Cat cat = persisted("c-9");
    cat.setName("Tom");
    repo.update(CTX, cat);

    assertEquals("UPDATE cats SET updated_at = ?, name = ?, age = ? WHERE id = ? AND deleted_at IS NULL", client.last().sql());
    assertEquals(Arrays.asList(NOW_MS, "Tom", 3, "c-9"), client.last().args());
    assertEquals(List.of("validate", "beforeSave", "beforeUpdate", "sql", "afterUpdate", "afterSave"), events);
  }

  @Test
  void updateMatchingNothingIsNotFound() {
    client.then(0L);
    Cat cat = persisted("gone");
    Instant before = cat.getUpdatedAt();

    assertThrows(NotFoundException.class, () -> repo.update(CTX, cat));
    assertEquals(before, cat.getUpdatedAt());
    assertFalse(events.contains("afterUpdate"));
  }

  @Test
  void saveDispatchesOnIdentity() {
    Cat fresh = new Cat("A", 1);
    repo.save(CTX, fresh);
    assertTrue(client.last().sql().startsWith("INSERT"));

    repo.save(CTX, fresh);
    assertTrue(client.last().sql().startsWith("UPDATE"));
  }

  @Test
  void softDeleteStampsTheSameInstantItWrote() {
    Cat cat = persisted("c-1");
    repo.delete(CTX, cat);

    assertEquals("UPDATE cats SET deleted_at = ? WHERE id = ? AND deleted_at IS NULL", client.last().sql());
    assertEquals(List.of(NOW_MS, "c-1"), client.last().args());
    assertEquals(NOW_MS, cat.getDeletedAt());
    assertEquals(List.of("beforeDelete", "sql", "afterDelete"), events);
  }

  @Test
  void hardDeleteAndRestore() {
    Cat cat = persisted("c-2");
    repo.hardDelete(CTX, cat);
    assertEquals("DELETE FROM cats WHERE id = ?", client.last().sql());

    cat.markDeleted(NOW_MS);
    events.clear();
    repo.restore(CTX, cat);
    assertEquals("UPDATE cats SET deleted_at = NULL, updated_at = ? WHERE id = ? AND deleted_at IS NOT NULL",
        client.last().sql());
    assertFalse(cat.isDeleted());
    assertEquals(NOW_MS, cat.getUpdatedAt());
    assertEquals(List.of("sql"), events);

    client.then(0L);
    assertThrows(NotFoundException.class, () -> repo.restore(CTX, persisted("live")));
    assertThrows(NotPersistedException.class, () -> repo.hardDelete(CTX, new Cat()));
  }

  @Test
  void findByIdRunsAfterFind() {
    client.thenRows(Map.of("id", "c-1", "name", "Whiskers", "age", 3, "created_at", NOW_MS.toEpochMilli()));
    Record<Cat> r = repo.findById(CTX, "c-1");

    assertEquals("SELECT * FROM cats WHERE id = ? AND deleted_at IS NULL", client.last().sql());
    assertEquals("Whiskers", r.entity().getName());
    assertEquals(List.of("afterFind"), r.entity().events);
    assertSame(repo, r.repository());

    client.then(List.of());
    assertThrows(NotFoundException.class, () -> repo.findById(CTX, "nope"));
  }

  @Test
  void firstAndLastOrderAfterTheCallersOptions() {
    client.thenRows(Map.of("id", "a")).thenRows(Map.of("id", "b"));
    repo.first(CTX, whereEq("name", "Tom"));
    assertEquals("SELECT * FROM cats WHERE deleted_at IS NULL AND name = ? ORDER BY created_at ASC LIMIT 1",
        client.last().sql());

    repo.last(CTX, orderByAsc("name"));
    assertEquals("SELECT * FROM cats WHERE deleted_at IS NULL ORDER BY name ASC, created_at DESC LIMIT 1",
        client.last().sql());
  }

  @Test
  void findOneWithoutMatchIsNotFound() {
    client.then(List.of());
    assertThrows(NotFoundException.class, () -> repo.findOne(CTX, whereEq("name", "nobody")));
  }

  @Test
  void countAndExists() {
    client.thenRows(Map.of("COUNT(*)", 4L)).thenRows(Map.of("e", 1)).then(List.of());

    assertEquals(4L, repo.count(CTX, whereLike("name", "W%")));
    assertEquals("SELECT COUNT(*) FROM cats WHERE deleted_at IS NULL AND name LIKE ?", client.last().sql());
    assertTrue(repo.exists(CTX, "c-1"));
    assertEquals("SELECT EXISTS(SELECT 1 FROM cats WHERE id = ? AND deleted_at IS NULL)", client.last().sql());
    assertFalse(repo.existsWhere(CTX, whereEq("age", 99)));
  }

  @Test
  void updateWhereIgnoresCallerTimestampAndPrependsTheFilter() {
    Map<String, Object> updates = new LinkedHashMap<>();
    updates.put("name", "Renamed");
    updates.put("updated_at", Instant.EPOCH);
    client.then(2L);

    long n = repo.updateWhere(CTX, updates, where("age > ?", 5), withDeleted());

    assertEquals(2, n);
    assertEquals("UPDATE cats SET name = ?, updated_at = ? WHERE deleted_at IS NULL AND age > ?", client.last().sql());
    assertEquals(List.of("Renamed", NOW_MS, 5), client.last().args());
  }

  @Test
  void emptyUpdateWhereTouchesNothing() {
    assertEquals(0, repo.updateWhere(CTX, Map.of(), whereEq("age", 1)));
    assertTrue(client.calls.isEmpty());
  }

  @Test
  void deleteWhereScopesToLiveRows() {
    client.then(3L);
    assertEquals(3, repo.deleteWhere(CTX, whereIn("age", 1, 2)));
    assertEquals("UPDATE cats SET deleted_at = ? WHERE deleted_at IS NULL AND age IN (?, ?)", client.last().sql());
    assertEquals(List.of(NOW_MS, 1, 2), client.last().args());
  }

  @Test
  void transactionCommitsWhenTheCallbackReturns() {
    repo.transaction(CTX, tx -> {
      tx.create(CTX, new Cat("A", 1));
      tx.create(CTX, new Cat("B", 2));
    });
    assertEquals(List.of("begin", "sql", "sql", "commit"), events);
  }

  @Test
  void transactionRollsBackAndRethrowsTheOriginal() {
    IllegalStateException boom = new IllegalStateException("boom");
    IllegalStateException ex = assertThrows(IllegalStateException.class, () -> repo.transaction(CTX, tx -> {
      tx.create(CTX, new Cat("A", 1));
      throw boom;
    }));
    assertSame(boom, ex);
    assertEquals(List.of("begin", "sql", "rollback"), events);
  }

  @Test
  void failedRollbackReportsBothErrors() {
    client.rollbackFailure = new DataAccessException("connection reset");
    IllegalStateException boom = new IllegalStateException("boom");

    TransactionException ex = assertThrows(TransactionException.class, () -> repo.transaction(CTX, tx -> {
      throw boom;
    }));
    assertEquals("rollback failed: connection reset (original error: boom)", ex.getMessage());
    assertSame(boom, ex.getCause());
    assertSame(client.rollbackFailure, ex.getSuppressed()[0]);
  }

  @Test
  void checkedCallbackFailuresAreWrapped() {
    DataAccessException ex = assertThrows(DataAccessException.class,
        () -> repo.transaction(CTX, tx -> { throw new IOException("disk"); }));
    assertInstanceOf(IOException.class, ex.getCause());
    assertEquals(List.of("begin", "rollback"), events);
  }

  @Test
  void commitFailureIsATransactionException() {
    client.commitFailure = new DataAccessException("serialization failure");
    TransactionException ex = assertThrows(TransactionException.class, () -> repo.transaction(CTX, tx -> {}));
    assertEquals("commit failed: serialization failure", ex.getMessage());
  }

  @Test
  void inTransactionReturnsTheResultAndBindsRecords() {
    String id = repo.inTransaction(CTX, tx -> {
      Record<Cat> r = tx.newRecord();
      r.entity().setName("Kit");
      r.entity().setAge(1);
      r.save(CTX);
      assertSame(tx, r.repository());
      return r.id();
    });
    assertEquals("cat-1", id);
    assertEquals(List.of("begin", "sql", "commit"), events);
  }
}
