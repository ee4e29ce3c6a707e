package dev.workflowcron.scheduler.migrations;

import dev.workflowcron.scheduler.Constants;
import dev.workflowcron.scheduler.config.SchedulerConfig;
import dev.workflowcron.scheduler.database.SchedulerDatabase;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates and upgrades the scheduler tables. Migrations are applied in order and the highest
 * applied version is kept in the {@code scheduler_migrations} table of the target schema.
 */
public class MigrationManager {

  private static final Logger logger = LoggerFactory.getLogger(MigrationManager.class);

  // "already exists" failures mean a migration ran before its version was recorded
  private static final List<String> IGNORABLE_SQL_STATES =
      List.of("42P07", "42710", "42701", "42P06", "23505");

  public static void runMigrations(SchedulerConfig config) {
    Objects.requireNonNull(config, "SchedulerConfig must not be null");

    if (config.dataSource() != null) {
      runMigrations(config.dataSource(), config.databaseSchema());
    } else {
      createDatabaseIfNotExists(config.databaseUrl(), config.dbUser(), config.dbPassword());
      try (var ds = SchedulerDatabase.createDataSource(config)) {
        runMigrations(ds, config.databaseSchema());
      }
    }
  }

  public static void runMigrations(String url, String user, String password, String schema) {
    Objects.requireNonNull(url, "database url must not be null");
    Objects.requireNonNull(user, "database user must not be null");

    createDatabaseIfNotExists(url, user, password);
    try (var ds = SchedulerDatabase.createDataSource(url, user, password)) {
      runMigrations(ds, schema);
    }
  }

  public static void runMigrations(DataSource ds, String schema) {
    Objects.requireNonNull(ds, "Data Source must not be null");
    var quoted = SchedulerDatabase.sanitizeSchema(schema);

    try (var conn = ds.getConnection()) {
      try (var stmt = conn.createStatement()) {
        stmt.execute("CREATE SCHEMA IF NOT EXISTS %s".formatted(quoted));
        stmt.execute(
            """
            CREATE TABLE IF NOT EXISTS %s.scheduler_migrations (
              version BIGINT NOT NULL PRIMARY KEY
            )
            """
                .formatted(quoted));
      }
      applyMigrations(conn, quoted, getMigrations(quoted));
    } catch (SQLException e) {
      throw new RuntimeException("Failed to run scheduler migrations", e);
    }
  }

  public static void createDatabaseIfNotExists(String url, String user, String password) {
    var pair = extractDbAndPostgresUrl(url);

    try (var adminDS = SchedulerDatabase.createDataSource(pair.url(), user, password);
        var conn = adminDS.getConnection()) {
      try (var stmt = conn.prepareStatement("SELECT 1 FROM pg_database WHERE datname = ?")) {
        stmt.setString(1, pair.database());
        try (var rs = stmt.executeQuery()) {
          if (rs.next()) {
            logger.debug("Database '{}' already exists", pair.database());
            return;
          }
        }
      }

      logger.info("Creating '{}' database", pair.database());
      try (var stmt = conn.createStatement()) {
        var quoted = pair.database().replace("\"", "\"\"");
        stmt.executeUpdate("CREATE DATABASE \"%s\"".formatted(quoted));
      }
    } catch (SQLException e) {
      // the database may exist and only the postgres maintenance database be off limits
      logger.warn("Unable to verify or create database '{}': {}", pair.database(), e.getMessage());
    }
  }

  public record UrlPair(String url, String database) {}

  public static UrlPair extractDbAndPostgresUrl(String url) {
    int qm = Objects.requireNonNull(url, "database url must not be null").indexOf('?');
    var base = qm >= 0 ? url.substring(0, qm) : url;
    var params = qm >= 0 ? url.substring(qm) : "";
    int slash = base.lastIndexOf('/');
    if (slash < "jdbc:postgresql://".length()) {
      throw new IllegalArgumentException(String.format("JDBC URL %s is not valid", url));
    }

    return new UrlPair(
        base.substring(0, slash + 1) + Constants.POSTGRES_DEFAULT_DB + params,
        base.substring(slash + 1));
  }

  static int currentVersion(Connection conn, String schema) throws SQLException {
    var sql = "SELECT max(version) FROM %s.scheduler_migrations".formatted(schema);
    try (var stmt = conn.createStatement();
        var rs = stmt.executeQuery(sql)) {
      return rs.next() ? rs.getInt(1) : 0;
    }
  }

  static void applyMigrations(Connection conn, String schema, List<String> migrations)
      throws SQLException {
    var lastApplied = currentVersion(conn, schema);

    for (var i = lastApplied; i < migrations.size(); i++) {
      var version = i + 1;
      logger.info("Applying scheduler schema migration {}", version);
      try (var stmt = conn.createStatement()) {
        stmt.execute(migrations.get(i));
      } catch (SQLException e) {
        if (!IGNORABLE_SQL_STATES.contains(e.getSQLState())) {
          throw new RuntimeException("Failed to run migration %d".formatted(version), e);
        }
        logger.warn(
            "Ignoring migration {} error ({}); it was likely applied already",
            version,
            e.getSQLState());
      }

      var recordSql =
          "INSERT INTO %s.scheduler_migrations (version) VALUES (?) ON CONFLICT DO NOTHING"
              .formatted(schema);
      try (var stmt = conn.prepareStatement(recordSql)) {
        stmt.setLong(1, version);
        stmt.executeUpdate();
      }
    }
  }

  public static List<String> getMigrations(String schema) {
    Objects.requireNonNull(schema);
    return List.of(migration1, migration2).stream().map(m -> m.formatted(schema)).toList();
  }

  static final String migration1 =
      """
      CREATE TABLE %1$s.scheduled_workflows (
          id BIGSERIAL PRIMARY KEY,
          uuid UUID NOT NULL UNIQUE DEFAULT gen_random_uuid(),
          organization_id UUID NOT NULL,
          project_id UUID,
          type TEXT NOT NULL,
          cron_expression TEXT NOT NULL,
          timezone TEXT NOT NULL DEFAULT 'UTC',
          enabled BOOLEAN NOT NULL DEFAULT TRUE,
          args TEXT NOT NULL DEFAULT '{}',
          created_at TIMESTAMPTZ NOT NULL DEFAULT now(),
          updated_at TIMESTAMPTZ NOT NULL DEFAULT now(),
          CONSTRAINT scheduled_workflows_project_scope
              CHECK ((type = 'PROJECT') = (project_id IS NOT NULL))
      );

      CREATE INDEX idx_scheduled_workflows_scope
          ON %1$s.scheduled_workflows (organization_id, project_id);
      CREATE INDEX idx_scheduled_workflows_project ON %1$s.scheduled_workflows (project_id);

      CREATE TABLE %1$s.execution_credentials (
          id UUID PRIMARY KEY,
          project_id UUID NOT NULL,
          name TEXT NOT NULL,
          public_key TEXT NOT NULL UNIQUE,
          hashed_secret TEXT NOT NULL UNIQUE,
          encrypted_secret TEXT,
          is_active BOOLEAN NOT NULL DEFAULT TRUE,
          is_automation BOOLEAN NOT NULL DEFAULT FALSE,
          creator_user_id UUID NOT NULL,
          revoker_user_id UUID,
          revocation_reason TEXT,
          created_at TIMESTAMPTZ NOT NULL DEFAULT now(),
          revoked_at TIMESTAMPTZ
      );

      CREATE INDEX idx_execution_credentials_project ON %1$s.execution_credentials (project_id);
      CREATE UNIQUE INDEX uq_execution_credentials_active_automation
          ON %1$s.execution_credentials (project_id) WHERE is_active AND is_automation;
      """;

  static final String migration2 =
      """
      CREATE TABLE %1$s.crontab_schedule (
          id BIGSERIAL PRIMARY KEY,
          minute TEXT NOT NULL,
          hour TEXT NOT NULL,
          day_of_month TEXT NOT NULL,
          month_of_year TEXT NOT NULL,
          day_of_week TEXT NOT NULL,
          timezone TEXT NOT NULL,
          CONSTRAINT crontab_schedule_fields_uq
              UNIQUE (minute, hour, day_of_month, month_of_year, day_of_week, timezone)
      );

      CREATE TABLE %1$s.periodic_task (
          id BIGSERIAL PRIMARY KEY,
          name TEXT NOT NULL UNIQUE,
          task TEXT NOT NULL,
          crontab_id BIGINT REFERENCES %1$s.crontab_schedule (id) ON DELETE SET NULL,
          args TEXT NOT NULL DEFAULT '[]',
          kwargs TEXT NOT NULL DEFAULT '{}',
          queue TEXT,
          enabled BOOLEAN NOT NULL DEFAULT TRUE,
          last_run_at TIMESTAMPTZ,
          total_run_count INTEGER NOT NULL DEFAULT 0,
          date_changed TIMESTAMPTZ NOT NULL DEFAULT now(),
          description TEXT NOT NULL DEFAULT '',
          scheduled_workflow_uuid UUID UNIQUE
              REFERENCES %1$s.scheduled_workflows (uuid) ON DELETE CASCADE
      );

      CREATE TABLE %1$s.periodic_tasks_changed (
          ident INTEGER PRIMARY KEY,
          last_update TIMESTAMPTZ NOT NULL
      );

      INSERT INTO %1$s.periodic_tasks_changed (ident, last_update) VALUES (1, clock_timestamp());

      CREATE OR REPLACE FUNCTION %1$s.periodic_task_removed() RETURNS TRIGGER AS $$
      BEGIN
          UPDATE %1$s.periodic_tasks_changed SET last_update = clock_timestamp() WHERE ident = 1;
          RETURN NULL;
      END;
      $$ LANGUAGE plpgsql;

      CREATE TRIGGER periodic_task_removed
          AFTER DELETE ON %1$s.periodic_task
          FOR EACH STATEMENT EXECUTE FUNCTION %1$s.periodic_task_removed();
      """;
}
