package dev.workflowcron.scheduler.database;

import dev.workflowcron.scheduler.Constants;
import dev.workflowcron.scheduler.config.SchedulerConfig;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Objects;
import java.util.UUID;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/** Owns the connection pool and the JDBC stores that share it. */
public class SchedulerDatabase implements AutoCloseable {

  public static String sanitizeSchema(String schema) {
    schema =
        Objects.requireNonNullElse(schema, Constants.DB_SCHEMA)
            .replace("\0", "")
            .replace("\"", "\"\"");
    return "\"%s\"".formatted(schema);
  }

  private final HikariDataSource dataSource;
  private final String schema;

  private final JdbcScheduleStore scheduleStore;
  private final JdbcCredentialStore credentialStore;
  private final JdbcPeriodicTaskStore periodicTaskStore;

  public SchedulerDatabase(SchedulerConfig config) {
    this(createDataSource(config), Objects.requireNonNull(config).databaseSchema());
  }

  public SchedulerDatabase(HikariDataSource dataSource, String schema) {
    this.dataSource = Objects.requireNonNull(dataSource);
    this.schema = sanitizeSchema(schema);
    scheduleStore = new JdbcScheduleStore(dataSource, this.schema);
    credentialStore = new JdbcCredentialStore(dataSource, this.schema);
    periodicTaskStore = new JdbcPeriodicTaskStore(dataSource, this.schema);
  }

  public HikariDataSource dataSource() {
    return dataSource;
  }

  public String schema() {
    return schema;
  }

  public JdbcScheduleStore scheduleStore() {
    return scheduleStore;
  }

  public JdbcCredentialStore credentialStore() {
    return credentialStore;
  }

  public JdbcPeriodicTaskStore periodicTaskStore() {
    return periodicTaskStore;
  }

  @Override
  public void close() {
    dataSource.close();
  }

  public static HikariDataSource createDataSource(String url, String user, String password) {
    return createDataSource(url, user, password, 0, 0);
  }

  public static HikariDataSource createDataSource(
      String url, String user, String password, int poolSize, int timeout) {
    HikariConfig hikariConfig = new HikariConfig();
    hikariConfig.setJdbcUrl(url);
    hikariConfig.setUsername(user);
    hikariConfig.setPassword(password);
    hikariConfig.setMaximumPoolSize(poolSize > 0 ? poolSize : 2);
    hikariConfig.setPoolName("workflow-scheduler");
    if (timeout > 0) {
      hikariConfig.setConnectionTimeout(timeout);
    }

    return new HikariDataSource(hikariConfig);
  }

  public static HikariDataSource createDataSource(SchedulerConfig config) {
    if (config.dataSource() != null) {
      return config.dataSource();
    }

    return createDataSource(
        config.databaseUrl(),
        config.dbUser(),
        config.dbPassword(),
        config.maximumPoolSize(),
        config.connectionTimeout());
  }

  static OffsetDateTime toTimestamp(Instant instant) {
    return instant == null ? null : OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
  }

  static Instant toInstant(OffsetDateTime timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }

  /** Two part advisory lock key: a namespace plus a hash of the id. */
  static int lockKey(UUID id) {
    return Long.hashCode(id.getMostSignificantBits() ^ id.getLeastSignificantBits());
  }

  static void rollback(Connection conn, Exception cause) {
    try {
      conn.rollback();
    } catch (SQLException rollbackEx) {
      cause.addSuppressed(rollbackEx);
    }
  }
}
