package dev.workflowcron.scheduler.database;

import dev.workflowcron.scheduler.exceptions.ProjectLockTimeoutException;
import dev.workflowcron.scheduler.exceptions.SchedulerDatabaseException;
import dev.workflowcron.scheduler.reconcile.ProjectLock;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.time.Duration;
import java.util.Objects;
import java.util.UUID;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Project locks backed by Postgres session advisory locks, so that scheduler instances sharing a
 * database never reconcile the same project at once.
 *
 * <p>A held lock pins a connection for the whole pass. Those connections come from a separate
 * small pool, never from the pool the stores query through, and waiters poll with {@code
 * pg_try_advisory_lock} without keeping a connection between attempts.
 */
public class AdvisoryProjectLock implements ProjectLock, AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(AdvisoryProjectLock.class);

  // distinct from the credential rotation namespace so a pass can rotate while holding this lock
  static final int RECONCILE_LOCK_NAMESPACE = 0x5C4ED002;

  static final int LOCK_POOL_SIZE = 4;
  static final Duration DEFAULT_ACQUIRE_TIMEOUT = Duration.ofMinutes(5);
  private static final long INITIAL_BACKOFF_MS = 50;
  private static final long MAX_BACKOFF_MS = 1000;

  private final HikariDataSource lockPool;
  private final Duration acquireTimeout;

  public AdvisoryProjectLock(HikariDataSource lockPool, Duration acquireTimeout) {
    this.lockPool = Objects.requireNonNull(lockPool);
    this.acquireTimeout = Objects.requireNonNull(acquireTimeout);
  }

  /** Locks on the database behind {@code dataSource}, through a lock pool of their own. */
  public static AdvisoryProjectLock onDatabaseOf(HikariDataSource dataSource) {
    return new AdvisoryProjectLock(createLockPool(dataSource), DEFAULT_ACQUIRE_TIMEOUT);
  }

  static HikariDataSource createLockPool(HikariDataSource dataSource) {
    HikariConfig hikariConfig = new HikariConfig();
    hikariConfig.setJdbcUrl(dataSource.getJdbcUrl());
    hikariConfig.setUsername(dataSource.getUsername());
    hikariConfig.setPassword(dataSource.getPassword());
    hikariConfig.setMaximumPoolSize(LOCK_POOL_SIZE);
    hikariConfig.setMinimumIdle(0);
    hikariConfig.setConnectionTimeout(5000);
    hikariConfig.setPoolName("workflow-scheduler-locks");
    return new HikariDataSource(hikariConfig);
  }

  @Override
  public Held acquire(UUID projectId) {
    long deadline = System.nanoTime() + acquireTimeout.toNanos();
    long backoffMs = INITIAL_BACKOFF_MS;
    while (true) {
      var conn = tryAcquire(projectId);
      if (conn != null) {
        logger.debug("Acquired reconciliation lock for project {}", projectId);
        return () -> release(conn, projectId);
      }
      if (System.nanoTime() - deadline >= 0) {
        throw new ProjectLockTimeoutException(projectId, acquireTimeout);
      }
      pause(backoffMs);
      backoffMs = Math.min(backoffMs * 2, MAX_BACKOFF_MS);
    }
  }

  private @Nullable Connection tryAcquire(UUID projectId) {
    Connection conn;
    try {
      conn = lockPool.getConnection();
    } catch (SQLTransientConnectionException e) {
      logger.debug("All lock connections busy, waiting to lock project {}", projectId);
      return null;
    } catch (SQLException e) {
      throw new SchedulerDatabaseException(e);
    }

    try {
      boolean locked;
      try (var stmt = conn.prepareStatement("SELECT pg_try_advisory_lock(?, ?)")) {
        stmt.setInt(1, RECONCILE_LOCK_NAMESPACE);
        stmt.setInt(2, SchedulerDatabase.lockKey(projectId));
        try (var rs = stmt.executeQuery()) {
          locked = rs.next() && rs.getBoolean(1);
        }
      }
      if (!locked) {
        conn.close();
        return null;
      }
      return conn;
    } catch (SQLException e) {
      lockPool.evictConnection(conn);
      throw new SchedulerDatabaseException(e);
    }
  }

  private void release(Connection conn, UUID projectId) {
    try {
      try (var stmt = conn.prepareStatement("SELECT pg_advisory_unlock(?, ?)")) {
        stmt.setInt(1, RECONCILE_LOCK_NAMESPACE);
        stmt.setInt(2, SchedulerDatabase.lockKey(projectId));
        stmt.execute();
      }
      conn.close();
      logger.debug("Released reconciliation lock for project {}", projectId);
    } catch (SQLException e) {
      // a session lock dies with its connection, so never hand this one back to the pool
      logger.warn(
          "Failed to release reconciliation lock for project {}, evicting connection",
          projectId,
          e);
      lockPool.evictConnection(conn);
    }
  }

  private static void pause(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SchedulerDatabaseException(e);
    }
  }

  @Override
  public void close() {
    lockPool.close();
  }
}
