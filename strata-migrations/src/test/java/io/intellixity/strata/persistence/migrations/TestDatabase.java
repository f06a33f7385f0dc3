package io.intellixity.strata.persistence.migrations;

import io.intellixity.strata.persistence.exec.OperationContext;
import io.intellixity.strata.persistence.jdbc.ClientConfig;
import io.intellixity.strata.persistence.jdbc.JdbcClient;
import io.intellixity.strata.persistence.mapping.ColumnTypes;
import io.intellixity.strata.persistence.mapping.RowReader;

import java.nio.file.Path;
import java.util.List;

/** SQLite file databases for migration and seed tests. */
public final class TestDatabase {
  private TestDatabase() {}

  public static JdbcClient open(Path dir) {
    return JdbcClient.connect(ClientConfig.of("sqlite", "jdbc:sqlite:" + dir.resolve("migrations.db"))
        .maxOpenConns(2).maxIdleConns(1));
  }

  public static boolean tableExists(JdbcClient client, String table) {
    long n = client.queryOne(OperationContext.background(),
        "SELECT count(*) FROM sqlite_master WHERE type = 'table' AND name = ?", List.of(table),
        RowReader.firstColumn(ColumnTypes.longType())).orElse(0L);
    return n > 0;
  }

  public static long count(JdbcClient client, String table) {
    return client.queryOne(OperationContext.background(), "SELECT count(*) FROM " + table, List.of(),
        RowReader.firstColumn(ColumnTypes.longType())).orElse(0L);
  }
}
