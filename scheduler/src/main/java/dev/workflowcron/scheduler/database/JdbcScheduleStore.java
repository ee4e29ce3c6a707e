package dev.workflowcron.scheduler.database;

import static dev.workflowcron.scheduler.database.SchedulerDatabase.toInstant;

import dev.workflowcron.scheduler.exceptions.ScheduleNotFoundException;
import dev.workflowcron.scheduler.schedule.NewSchedule;
import dev.workflowcron.scheduler.schedule.ScheduleArgs;
import dev.workflowcron.scheduler.schedule.ScheduleRecord;
import dev.workflowcron.scheduler.schedule.ScheduleStore;
import dev.workflowcron.scheduler.schedule.ScheduledWorkflowType;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

import javax.sql.DataSource;

import org.jspecify.annotations.Nullable;

public class JdbcScheduleStore implements ScheduleStore {

  private static final String COLUMNS =
      "id, uuid, organization_id, project_id, type, cron_expression, timezone, enabled, args,"
          + " created_at, updated_at";

  private final DataSource dataSource;
  private final String schema;

  JdbcScheduleStore(DataSource dataSource, String schema) {
    this.dataSource = Objects.requireNonNull(dataSource);
    this.schema = Objects.requireNonNull(schema);
  }

  @Override
  public ScheduleRecord create(NewSchedule schedule) {
    Objects.requireNonNull(schedule);
    // generated outside the retry loop so a retried insert keeps the same identity
    var uuid = UUID.randomUUID();
    var sql =
        """
        INSERT INTO %s.scheduled_workflows
            (uuid, organization_id, project_id, type, cron_expression, timezone, enabled, args)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?)
        RETURNING %s
        """
            .formatted(schema, COLUMNS);

    return DbRetry.call(
        () -> {
          try (Connection conn = dataSource.getConnection();
              PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setObject(1, uuid);
            stmt.setObject(2, schedule.organizationId());
            stmt.setObject(3, schedule.projectId());
            stmt.setString(4, schedule.type().name());
            stmt.setString(5, schedule.cronExpression());
            stmt.setString(6, schedule.timezone());
            stmt.setBoolean(7, schedule.enabled());
            stmt.setString(8, schedule.args().toJson());
            try (ResultSet rs = stmt.executeQuery()) {
              rs.next();
              return readRecord(rs);
            }
          }
        });
  }

  @Override
  public ScheduleRecord getById(long id) {
    var sql = "SELECT %s FROM %s.scheduled_workflows WHERE id = ?".formatted(COLUMNS, schema);
    return DbRetry.call(
        () -> {
          try (Connection conn = dataSource.getConnection();
              PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setLong(1, id);
            try (ResultSet rs = stmt.executeQuery()) {
              if (!rs.next()) {
                throw new ScheduleNotFoundException(id);
              }
              return readRecord(rs);
            }
          }
        });
  }

  @Override
  public ScheduleRecord getByUuid(UUID uuid) {
    var sql = "SELECT %s FROM %s.scheduled_workflows WHERE uuid = ?".formatted(COLUMNS, schema);
    return DbRetry.call(
        () -> {
          try (Connection conn = dataSource.getConnection();
              PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setObject(1, uuid);
            try (ResultSet rs = stmt.executeQuery()) {
              if (!rs.next()) {
                throw new ScheduleNotFoundException(uuid);
              }
              return readRecord(rs);
            }
          }
        });
  }

  @Override
  public ScheduleRecord update(ScheduleRecord record) {
    Objects.requireNonNull(record);
    var sql =
        """
        UPDATE %s.scheduled_workflows
        SET cron_expression = ?, timezone = ?, enabled = ?, args = ?, updated_at = now()
        WHERE id = ?
        RETURNING %s
        """
            .formatted(schema, COLUMNS);

    return DbRetry.call(
        () -> {
          try (Connection conn = dataSource.getConnection();
              PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, record.cronExpression());
            stmt.setString(2, record.timezone());
            stmt.setBoolean(3, record.enabled());
            stmt.setString(4, record.args().toJson());
            stmt.setLong(5, record.id());
            try (ResultSet rs = stmt.executeQuery()) {
              if (!rs.next()) {
                throw new ScheduleNotFoundException(record.id());
              }
              return readRecord(rs);
            }
          }
        });
  }

  @Override
  public void delete(long id) {
    var sql = "DELETE FROM %s.scheduled_workflows WHERE id = ?".formatted(schema);
    DbRetry.run(
        () -> {
          try (Connection conn = dataSource.getConnection();
              PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setLong(1, id);
            if (stmt.executeUpdate() == 0) {
              throw new ScheduleNotFoundException(id);
            }
          }
        });
  }

  @Override
  public List<ScheduleRecord> listByScope(
      UUID organizationId,
      @Nullable UUID projectId,
      @Nullable ScheduledWorkflowType type,
      @Nullable Boolean enabled) {
    Objects.requireNonNull(organizationId, "organizationId must not be null");

    var where = new StringBuilder("organization_id = ?");
    List<Object> params = new ArrayList<>();
    params.add(organizationId);
    if (projectId != null) {
      where.append(" AND project_id = ?");
      params.add(projectId);
    }
    if (type != null) {
      where.append(" AND type = ?");
      params.add(type.name());
    }
    if (enabled != null) {
      where.append(" AND enabled = ?");
      params.add(enabled);
    }
    return query(where.toString(), params);
  }

  @Override
  public List<ScheduleRecord> listByProject(UUID projectId, @Nullable Boolean enabled) {
    Objects.requireNonNull(projectId, "projectId must not be null");
    if (enabled == null) {
      return query("project_id = ?", List.of(projectId));
    }
    return query("project_id = ? AND enabled = ?", List.of(projectId, enabled));
  }

  @Override
  public List<ScheduleRecord> listEnabled() {
    return query("enabled", List.of());
  }

  @Override
  public int deleteByProject(UUID projectId) {
    var sql = "DELETE FROM %s.scheduled_workflows WHERE project_id = ?".formatted(schema);
    return DbRetry.call(
        () -> {
          try (Connection conn = dataSource.getConnection();
              PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setObject(1, projectId);
            return stmt.executeUpdate();
          }
        });
  }

  private List<ScheduleRecord> query(String where, List<Object> params) {
    var sql =
        "SELECT %s FROM %s.scheduled_workflows WHERE %s ORDER BY created_at, id"
            .formatted(COLUMNS, schema, where);
    return DbRetry.call(
        () -> {
          try (Connection conn = dataSource.getConnection();
              PreparedStatement stmt = conn.prepareStatement(sql)) {
            for (int i = 0; i < params.size(); i++) {
              stmt.setObject(i + 1, params.get(i));
            }
            List<ScheduleRecord> records = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
              while (rs.next()) {
                records.add(readRecord(rs));
              }
            }
            return records;
          }
        });
  }

  static ScheduleRecord readRecord(ResultSet rs) throws SQLException {
    var type = ScheduledWorkflowType.valueOf(rs.getString("type"));
    return new ScheduleRecord(
        rs.getLong("id"),
        rs.getObject("uuid", UUID.class),
        rs.getObject("organization_id", UUID.class),
        rs.getObject("project_id", UUID.class),
        type,
        rs.getString("cron_expression"),
        rs.getString("timezone"),
        rs.getBoolean("enabled"),
        ScheduleArgs.fromJson(type, rs.getString("args")),
        toInstant(rs.getObject("created_at", OffsetDateTime.class)),
        toInstant(rs.getObject("updated_at", OffsetDateTime.class)));
  }
}
