package dev.workflowcron.scheduler.database;

import static dev.workflowcron.scheduler.database.SchedulerDatabase.toInstant;
import static dev.workflowcron.scheduler.database.SchedulerDatabase.toTimestamp;

import dev.workflowcron.scheduler.sync.CrontabHandle;
import dev.workflowcron.scheduler.sync.CrontabSpec;
import dev.workflowcron.scheduler.sync.PeriodicTask;
import dev.workflowcron.scheduler.sync.PeriodicTaskDefinition;
import dev.workflowcron.scheduler.sync.PeriodicTaskStore;
import dev.workflowcron.scheduler.sync.SyncAction;
import dev.workflowcron.scheduler.sync.SyncResult;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

import javax.sql.DataSource;

import org.jspecify.annotations.Nullable;

public class JdbcPeriodicTaskStore implements PeriodicTaskStore {

  private static final String TASK_COLUMNS =
      """
      t.id, t.name, t.task, t.crontab_id, t.args, t.kwargs, t.queue, t.enabled, t.last_run_at,
      t.total_run_count, t.scheduled_workflow_uuid, c.minute, c.hour, c.day_of_month,
      c.month_of_year, c.day_of_week, c.timezone
      """;

  private final DataSource dataSource;
  private final String schema;

  JdbcPeriodicTaskStore(DataSource dataSource, String schema) {
    this.dataSource = Objects.requireNonNull(dataSource);
    this.schema = Objects.requireNonNull(schema);
  }

  @Override
  public CrontabHandle ensureCrontab(CrontabSpec spec) {
    Objects.requireNonNull(spec);
    return DbRetry.call(
        () -> {
          try (Connection conn = dataSource.getConnection()) {
            return new CrontabHandle(ensureCrontab(conn, spec), spec);
          }
        });
  }

  @Override
  public SyncResult upsert(PeriodicTaskDefinition definition, CrontabSpec crontab) {
    Objects.requireNonNull(definition);
    Objects.requireNonNull(crontab);
    var sql =
        """
        INSERT INTO %s.periodic_task
            (name, task, crontab_id, args, kwargs, queue, enabled, description,
             scheduled_workflow_uuid, date_changed)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, now())
        ON CONFLICT (scheduled_workflow_uuid) DO UPDATE
        SET name = EXCLUDED.name,
            task = EXCLUDED.task,
            crontab_id = EXCLUDED.crontab_id,
            args = EXCLUDED.args,
            kwargs = EXCLUDED.kwargs,
            queue = EXCLUDED.queue,
            enabled = EXCLUDED.enabled,
            description = EXCLUDED.description,
            date_changed = now()
        RETURNING id, (xmax = 0) AS inserted
        """
            .formatted(schema);

    return DbRetry.call(
        () -> {
          try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
              var crontabId = ensureCrontab(conn, crontab);
              SyncResult result;
              try (var stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, definition.name());
                stmt.setString(2, definition.task());
                stmt.setLong(3, crontabId);
                stmt.setString(4, definition.argsJson());
                stmt.setString(5, definition.kwargsJson());
                stmt.setString(6, definition.queue());
                stmt.setBoolean(7, definition.enabled());
                stmt.setString(8, definition.description());
                stmt.setObject(9, definition.scheduleUuid());
                try (ResultSet rs = stmt.executeQuery()) {
                  rs.next();
                  var action = rs.getBoolean("inserted") ? SyncAction.CREATED : SyncAction.UPDATED;
                  result = new SyncResult(definition.scheduleUuid(), action, rs.getLong("id"));
                }
              }
              bumpChangedMarker(conn);
              conn.commit();
              return result;
            } catch (SQLException | RuntimeException e) {
              SchedulerDatabase.rollback(conn, e);
              throw e;
            }
          }
        });
  }

  @Override
  public Optional<PeriodicTask> findByScheduleUuid(UUID scheduleUuid) {
    var tasks = queryTasks("t.scheduled_workflow_uuid = ?", scheduleUuid);
    return tasks.isEmpty() ? Optional.empty() : Optional.of(tasks.get(0));
  }

  @Override
  public boolean deleteByScheduleUuid(UUID scheduleUuid) {
    // the periodic_task_removed trigger bumps the changed marker
    var sql = "DELETE FROM %s.periodic_task WHERE scheduled_workflow_uuid = ?".formatted(schema);
    return DbRetry.call(
        () -> {
          try (Connection conn = dataSource.getConnection();
              PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setObject(1, scheduleUuid);
            return stmt.executeUpdate() > 0;
          }
        });
  }

  @Override
  public List<PeriodicTask> listEnabled() {
    return queryTasks("t.enabled AND t.crontab_id IS NOT NULL", null);
  }

  @Override
  public @Nullable Instant lastChanged() {
    var sql = "SELECT last_update FROM %s.periodic_tasks_changed WHERE ident = 1".formatted(schema);
    return DbRetry.call(
        () -> {
          try (Connection conn = dataSource.getConnection();
              PreparedStatement stmt = conn.prepareStatement(sql);
              ResultSet rs = stmt.executeQuery()) {
            return rs.next() ? toInstant(rs.getObject(1, OffsetDateTime.class)) : null;
          }
        });
  }

  @Override
  public void recordRun(long taskId, Instant ranAt) {
    var sql =
        """
        UPDATE %s.periodic_task
        SET last_run_at = ?, total_run_count = total_run_count + 1
        WHERE id = ?
        """
            .formatted(schema);
    DbRetry.run(
        () -> {
          try (Connection conn = dataSource.getConnection();
              PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setObject(1, toTimestamp(ranAt));
            stmt.setLong(2, taskId);
            stmt.executeUpdate();
          }
        });
  }

  @Override
  public int pruneUnusedCrontabs() {
    var sql =
        """
        DELETE FROM %1$s.crontab_schedule c
        WHERE NOT EXISTS (SELECT 1 FROM %1$s.periodic_task t WHERE t.crontab_id = c.id)
        """
            .formatted(schema);
    return DbRetry.call(
        () -> {
          try (Connection conn = dataSource.getConnection();
              PreparedStatement stmt = conn.prepareStatement(sql)) {
            return stmt.executeUpdate();
          }
        });
  }

  private long ensureCrontab(Connection conn, CrontabSpec spec) throws SQLException {
    var insertSql =
        """
        INSERT INTO %s.crontab_schedule
            (minute, hour, day_of_month, month_of_year, day_of_week, timezone)
        VALUES (?, ?, ?, ?, ?, ?)
        ON CONFLICT ON CONSTRAINT crontab_schedule_fields_uq DO NOTHING
        RETURNING id
        """
            .formatted(schema);
    try (var stmt = conn.prepareStatement(insertSql)) {
      bindCrontab(stmt, spec);
      try (var rs = stmt.executeQuery()) {
        if (rs.next()) {
          return rs.getLong(1);
        }
      }
    }

    var selectSql =
        """
        SELECT id FROM %s.crontab_schedule
        WHERE minute = ? AND hour = ? AND day_of_month = ? AND month_of_year = ?
          AND day_of_week = ? AND timezone = ?
        """
            .formatted(schema);
    try (var stmt = conn.prepareStatement(selectSql)) {
      bindCrontab(stmt, spec);
      try (var rs = stmt.executeQuery()) {
        if (!rs.next()) {
          throw new SQLException("crontab row vanished while being reused", "40001");
        }
        return rs.getLong(1);
      }
    }
  }

  private static void bindCrontab(PreparedStatement stmt, CrontabSpec spec) throws SQLException {
    stmt.setString(1, spec.minute());
    stmt.setString(2, spec.hour());
    stmt.setString(3, spec.dayOfMonth());
    stmt.setString(4, spec.monthOfYear());
    stmt.setString(5, spec.dayOfWeek());
    stmt.setString(6, spec.timezone());
  }

  private void bumpChangedMarker(Connection conn) throws SQLException {
    var sql =
        """
        INSERT INTO %s.periodic_tasks_changed (ident, last_update) VALUES (1, clock_timestamp())
        ON CONFLICT (ident) DO UPDATE SET last_update = EXCLUDED.last_update
        """
            .formatted(schema);
    try (var stmt = conn.prepareStatement(sql)) {
      stmt.executeUpdate();
    }
  }

  private List<PeriodicTask> queryTasks(String where, @Nullable Object param) {
    var sql =
        """
        SELECT %s FROM %s.periodic_task t
        LEFT JOIN %s.crontab_schedule c ON c.id = t.crontab_id
        WHERE %s
        ORDER BY t.id
        """
            .formatted(TASK_COLUMNS, schema, schema, where);
    return DbRetry.call(
        () -> {
          try (Connection conn = dataSource.getConnection();
              PreparedStatement stmt = conn.prepareStatement(sql)) {
            if (param != null) {
              stmt.setObject(1, param);
            }
            List<PeriodicTask> tasks = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
              while (rs.next()) {
                tasks.add(readTask(rs));
              }
            }
            return tasks;
          }
        });
  }

  private static PeriodicTask readTask(ResultSet rs) throws SQLException {
    CrontabHandle crontab = null;
    var crontabId = rs.getLong("crontab_id");
    if (!rs.wasNull()) {
      crontab =
          new CrontabHandle(
              crontabId,
              new CrontabSpec(
                  rs.getString("minute"),
                  rs.getString("hour"),
                  rs.getString("day_of_month"),
                  rs.getString("month_of_year"),
                  rs.getString("day_of_week"),
                  rs.getString("timezone")));
    }
    return new PeriodicTask(
        rs.getLong("id"),
        rs.getString("name"),
        rs.getString("task"),
        crontab,
        rs.getString("args"),
        rs.getString("kwargs"),
        rs.getString("queue"),
        rs.getBoolean("enabled"),
        toInstant(rs.getObject("last_run_at", OffsetDateTime.class)),
        rs.getInt("total_run_count"),
        rs.getObject("scheduled_workflow_uuid", UUID.class));
  }
}
