package dev.workflowcron.scheduler.migrations;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.workflowcron.scheduler.Constants;
import dev.workflowcron.scheduler.DbSetupTestBase;
import dev.workflowcron.scheduler.config.SchedulerConfig;
import dev.workflowcron.scheduler.database.SchedulerDatabase;
import dev.workflowcron.scheduler.utils.DBUtils;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.DriverManager;
import java.util.ArrayList;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

@Timeout(value = 2, unit = TimeUnit.MINUTES)
class MigrationManagerTest extends DbSetupTestBase {

  private static final String[] TABLES = {
    "scheduled_workflows",
    "execution_credentials",
    "crontab_schedule",
    "periodic_task",
    "periodic_tasks_changed"
  };

  private SchedulerConfig config;

  @BeforeEach
  void setup() throws Exception {
    var url =
        postgres.getJdbcUrl().replace("/" + postgres.getDatabaseName(), "/scheduler_mm_test");
    config = schedulerConfig.withDatabaseUrl(url);

    var pair = MigrationManager.extractDbAndPostgresUrl(url);
    try (var conn = DriverManager.getConnection(pair.url(), config.dbUser(), config.dbPassword());
        var stmt = conn.createStatement()) {
      stmt.execute("DROP DATABASE IF EXISTS %s WITH (FORCE)".formatted(pair.database()));
    }
  }

  static void assertTablesExist(DatabaseMetaData metaData, String schema) throws Exception {
    for (var table : TABLES) {
      assertTrue(
          DBUtils.tableExists(metaData, schema, table),
          "Table %s should exist in schema %s".formatted(table, schema));
    }
  }

  static int getVersion(Connection conn, String schema) throws Exception {
    return MigrationManager.currentVersion(conn, SchedulerDatabase.sanitizeSchema(schema));
  }

  @Test
  void createsDatabaseAndTables() throws Exception {
    MigrationManager.runMigrations(config);

    try (var ds = SchedulerDatabase.createDataSource(config);
        var conn = ds.getConnection()) {
      assertTablesExist(conn.getMetaData(), Constants.DB_SCHEMA);
      var migrations = MigrationManager.getMigrations(Constants.DB_SCHEMA);
      assertEquals(migrations.size(), getVersion(conn, Constants.DB_SCHEMA));
      assertEquals(1, DBUtils.countRows(ds, Constants.DB_SCHEMA, "periodic_tasks_changed"));
    }
  }

  @Test
  void customSchema() throws Exception {
    var schema = "Tenant \"A\" schedules";
    config = config.withDatabaseSchema(schema);
    MigrationManager.runMigrations(config);

    try (var ds = SchedulerDatabase.createDataSource(config);
        var conn = ds.getConnection()) {
      assertTablesExist(conn.getMetaData(), schema);
      assertEquals(MigrationManager.getMigrations(schema).size(), getVersion(conn, schema));
    }
  }

  @Test
  void isIdempotent() throws Exception {
    createsDatabaseAndTables();

    assertDoesNotThrow(
        () -> MigrationManager.runMigrations(config),
        "Migrations should run successfully multiple times");
  }

  @Test
  void toleratesLostVersionRows() throws Exception {
    createsDatabaseAndTables();

    try (var ds = SchedulerDatabase.createDataSource(config)) {
      DBUtils.execute(ds, "DELETE FROM scheduler.scheduler_migrations");

      assertDoesNotThrow(() -> MigrationManager.runMigrations(ds, Constants.DB_SCHEMA));

      try (var conn = ds.getConnection()) {
        assertEquals(
            MigrationManager.getMigrations(Constants.DB_SCHEMA).size(),
            getVersion(conn, Constants.DB_SCHEMA));
      }
    }
  }

  @Test
  void futureVersionIsLeftAlone() throws Exception {
    createsDatabaseAndTables();

    try (var ds = SchedulerDatabase.createDataSource(config)) {
      DBUtils.execute(ds, "INSERT INTO scheduler.scheduler_migrations (version) VALUES (10000)");

      assertDoesNotThrow(() -> MigrationManager.runMigrations(ds, Constants.DB_SCHEMA));

      try (var conn = ds.getConnection()) {
        assertEquals(10000, getVersion(conn, Constants.DB_SCHEMA));
      }
    }
  }

  @Test
  void appliesNewMigration() throws Exception {
    createsDatabaseAndTables();

    var schema = SchedulerDatabase.sanitizeSchema(Constants.DB_SCHEMA);
    var migrations = new ArrayList<>(MigrationManager.getMigrations(schema));
    migrations.add("CREATE TABLE %s.dummy_table (id SERIAL PRIMARY KEY)".formatted(schema));

    try (var ds = SchedulerDatabase.createDataSource(config);
        var conn = ds.getConnection()) {
      MigrationManager.applyMigrations(conn, schema, migrations);

      assertTrue(DBUtils.tableExists(conn.getMetaData(), Constants.DB_SCHEMA, "dummy_table"));
      assertEquals(migrations.size(), getVersion(conn, Constants.DB_SCHEMA));
    }
  }

  @Test
  void brokenMigrationFails() throws Exception {
    createsDatabaseAndTables();

    var schema = SchedulerDatabase.sanitizeSchema(Constants.DB_SCHEMA);
    var migrations = new ArrayList<>(MigrationManager.getMigrations(schema));
    migrations.add("ALTER TABLE %s.no_such_table ADD COLUMN x INT".formatted(schema));

    try (var ds = SchedulerDatabase.createDataSource(config);
        var conn = ds.getConnection()) {
      var ex =
          assertThrows(
              RuntimeException.class,
              () -> MigrationManager.applyMigrations(conn, schema, migrations));
      assertTrue(ex.getMessage().contains("migration 3"));
      assertEquals(2, getVersion(conn, Constants.DB_SCHEMA));
    }
  }

  @Test
  void extractDbAndPostgresUrl() {
    var originalUrl = "jdbc:postgresql://localhost:5432/scheduler?user=alice&ssl=true";
    var pair = MigrationManager.extractDbAndPostgresUrl(originalUrl);

    assertEquals("scheduler", pair.database());
    assertEquals("jdbc:postgresql://localhost:5432/postgres?user=alice&ssl=true", pair.url());

    assertThrows(
        IllegalArgumentException.class,
        () -> MigrationManager.extractDbAndPostgresUrl("jdbc:postgresql://localhost"));
  }
}
