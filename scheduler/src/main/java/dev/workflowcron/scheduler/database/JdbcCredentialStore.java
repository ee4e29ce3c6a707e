package dev.workflowcron.scheduler.database;

import static dev.workflowcron.scheduler.database.SchedulerDatabase.toInstant;
import static dev.workflowcron.scheduler.database.SchedulerDatabase.toTimestamp;

import dev.workflowcron.scheduler.credential.CredentialStore;
import dev.workflowcron.scheduler.credential.ExecutionCredential;
import dev.workflowcron.scheduler.credential.RevocationReason;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

import javax.sql.DataSource;

public class JdbcCredentialStore implements CredentialStore {

  // advisory lock namespace for credential rotation
  static final int ROTATION_LOCK_NAMESPACE = 0x5C4ED001;

  private static final String COLUMNS =
      "id, project_id, name, public_key, hashed_secret, encrypted_secret, is_active, is_automation,"
          + " creator_user_id, revoker_user_id, revocation_reason, created_at, revoked_at";

  private final DataSource dataSource;
  private final String schema;

  JdbcCredentialStore(DataSource dataSource, String schema) {
    this.dataSource = Objects.requireNonNull(dataSource);
    this.schema = Objects.requireNonNull(schema);
  }

  @Override
  public List<ExecutionCredential> listByProject(UUID projectId) {
    var sql =
        "SELECT %s FROM %s.execution_credentials WHERE project_id = ? ORDER BY created_at"
            .formatted(COLUMNS, schema);
    return DbRetry.call(
        () -> {
          try (Connection conn = dataSource.getConnection();
              PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setObject(1, projectId);
            List<ExecutionCredential> credentials = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
              while (rs.next()) {
                credentials.add(readCredential(rs));
              }
            }
            return credentials;
          }
        });
  }

  @Override
  public Optional<ExecutionCredential> findByHashedSecret(String hashedSecret) {
    var sql =
        "SELECT %s FROM %s.execution_credentials WHERE hashed_secret = ?"
            .formatted(COLUMNS, schema);
    return DbRetry.call(
        () -> {
          try (Connection conn = dataSource.getConnection();
              PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, hashedSecret);
            try (ResultSet rs = stmt.executeQuery()) {
              return rs.next() ? Optional.of(readCredential(rs)) : Optional.empty();
            }
          }
        });
  }

  @Override
  public ExecutionCredential rotate(ExecutionCredential replacement, UUID actorId) {
    Objects.requireNonNull(replacement);
    var lockSql = "SELECT pg_advisory_xact_lock(?, ?)";
    var deactivateSql =
        """
        UPDATE %s.execution_credentials
        SET is_active = FALSE, revoked_at = now(), revoker_user_id = ?, revocation_reason = ?
        WHERE project_id = ? AND is_automation AND is_active
        """
            .formatted(schema);
    var insertSql =
        """
        INSERT INTO %s.execution_credentials
            (id, project_id, name, public_key, hashed_secret, encrypted_secret, is_active,
             is_automation, creator_user_id, created_at)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        RETURNING %s
        """
            .formatted(schema, COLUMNS);

    return DbRetry.call(
        () -> {
          try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
              try (var stmt = conn.prepareStatement(lockSql)) {
                stmt.setInt(1, ROTATION_LOCK_NAMESPACE);
                stmt.setInt(2, SchedulerDatabase.lockKey(replacement.projectId()));
                stmt.execute();
              }
              try (var stmt = conn.prepareStatement(deactivateSql)) {
                stmt.setObject(1, actorId);
                stmt.setString(2, RevocationReason.ROTATION.name());
                stmt.setObject(3, replacement.projectId());
                stmt.executeUpdate();
              }
              ExecutionCredential inserted;
              try (var stmt = conn.prepareStatement(insertSql)) {
                stmt.setObject(1, replacement.id());
                stmt.setObject(2, replacement.projectId());
                stmt.setString(3, replacement.name());
                stmt.setString(4, replacement.publicKey());
                stmt.setString(5, replacement.hashedSecret());
                stmt.setString(6, replacement.encryptedSecret());
                stmt.setBoolean(7, replacement.active());
                stmt.setBoolean(8, replacement.automation());
                stmt.setObject(9, replacement.creatorUserId());
                stmt.setObject(10, toTimestamp(replacement.createdAt()));
                try (ResultSet rs = stmt.executeQuery()) {
                  rs.next();
                  inserted = readCredential(rs);
                }
              }
              conn.commit();
              return inserted;
            } catch (SQLException | RuntimeException e) {
              SchedulerDatabase.rollback(conn, e);
              throw e;
            }
          }
        });
  }

  @Override
  public int deactivateAutomation(UUID projectId, UUID actorId, RevocationReason reason) {
    var sql =
        """
        UPDATE %s.execution_credentials
        SET is_active = FALSE, revoked_at = now(), revoker_user_id = ?, revocation_reason = ?
        WHERE project_id = ? AND is_automation AND is_active
        """
            .formatted(schema);
    return DbRetry.call(
        () -> {
          try (Connection conn = dataSource.getConnection();
              PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setObject(1, actorId);
            stmt.setString(2, reason.name());
            stmt.setObject(3, projectId);
            return stmt.executeUpdate();
          }
        });
  }

  static ExecutionCredential readCredential(ResultSet rs) throws SQLException {
    var reason = rs.getString("revocation_reason");
    return new ExecutionCredential(
        rs.getObject("id", UUID.class),
        rs.getObject("project_id", UUID.class),
        rs.getString("name"),
        rs.getString("public_key"),
        rs.getString("hashed_secret"),
        rs.getString("encrypted_secret"),
        rs.getBoolean("is_active"),
        rs.getBoolean("is_automation"),
        rs.getObject("creator_user_id", UUID.class),
        rs.getObject("revoker_user_id", UUID.class),
        reason == null ? null : RevocationReason.valueOf(reason),
        toInstant(rs.getObject("created_at", OffsetDateTime.class)),
        toInstant(rs.getObject("revoked_at", OffsetDateTime.class)));
  }
}
