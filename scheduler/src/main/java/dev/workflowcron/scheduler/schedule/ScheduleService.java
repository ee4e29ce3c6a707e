package dev.workflowcron.scheduler.schedule;

import dev.workflowcron.scheduler.Constants;
import dev.workflowcron.scheduler.credential.CredentialLifecycle;
import dev.workflowcron.scheduler.credential.RevocationReason;
import dev.workflowcron.scheduler.cron.CronMath;
import dev.workflowcron.scheduler.exceptions.ScheduleNotFoundException;
import dev.workflowcron.scheduler.exceptions.ScheduleSyncException;
import dev.workflowcron.scheduler.reconcile.ReconciliationReport;
import dev.workflowcron.scheduler.reconcile.Reconciler;
import dev.workflowcron.scheduler.sync.BulkSyncReport;
import dev.workflowcron.scheduler.sync.ExecutionBackendSync;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Schedule management for callers outside the deployment path. Every write validates the schedule
 * and pushes it to the periodic task store; a failed push undoes the write and propagates.
 */
public class ScheduleService {

  private static final Logger logger = LoggerFactory.getLogger(ScheduleService.class);

  private final ScheduleStore store;
  private final ExecutionBackendSync backendSync;
  private final CredentialLifecycle credentials;
  private final CronMath cronMath;
  private final @Nullable Reconciler reconciler;

  public ScheduleService(
      ScheduleStore store,
      ExecutionBackendSync backendSync,
      CredentialLifecycle credentials,
      CronMath cronMath,
      @Nullable Reconciler reconciler) {
    this.store = Objects.requireNonNull(store);
    this.backendSync = Objects.requireNonNull(backendSync);
    this.credentials = Objects.requireNonNull(credentials);
    this.cronMath = Objects.requireNonNull(cronMath);
    this.reconciler = reconciler;
  }

  /**
   * Creates a schedule and its periodic task.
   *
   * @throws dev.workflowcron.scheduler.exceptions.ScheduleValidationException on a type / project
   *     mismatch
   * @throws dev.workflowcron.scheduler.exceptions.CronConversionException on a bad cron expression
   *     or timezone
   * @throws ScheduleSyncException if the periodic task could not be written; the schedule is not
   *     kept
   */
  public ScheduleRecord createSchedule(ScheduleCreateRequest request) {
    Objects.requireNonNull(request);
    request.type().checkProjectScope(request.projectId());
    cronMath.convertToUTC(request.cronExpression(), request.timezone());

    var created =
        store.create(
            new NewSchedule(
                request.organizationId(),
                request.projectId(),
                request.type(),
                request.cronExpression(),
                request.timezone(),
                request.enabled(),
                ScheduleArgs.of(request.type(), request.args())));
    try {
      backendSync.upsertPeriodicTask(created);
    } catch (ScheduleSyncException e) {
      try {
        store.delete(created.id());
      } catch (RuntimeException deleteEx) {
        e.addSuppressed(deleteEx);
      }
      throw e;
    }
    logger.info("Created {} schedule {}", created.type(), created.uuid());
    return created;
  }

  /**
   * Applies the non-null fields of {@code request}.
   *
   * @throws ScheduleNotFoundException if no schedule has this uuid
   * @throws ScheduleSyncException if the periodic task could not be written; the previous values
   *     are restored
   */
  public ScheduleRecord updateSchedule(UUID scheduleUuid, ScheduleUpdateRequest request) {
    Objects.requireNonNull(request);
    var current = store.getByUuid(scheduleUuid);
    if (request.isEmpty()) {
      return current;
    }

    var next = current;
    if (request.cronExpression() != null) {
      next = next.withCronExpression(request.cronExpression());
    }
    if (request.timezone() != null) {
      next = next.withTimezone(request.timezone());
    }
    if (request.enabled() != null) {
      next = next.withEnabled(request.enabled());
    }
    if (request.args() != null) {
      next = next.withArgs(ScheduleArgs.of(next.type(), request.args()));
    }
    cronMath.convertToUTC(next.cronExpression(), next.timezone());

    var updated = store.update(next);
    try {
      backendSync.upsertPeriodicTask(updated);
    } catch (ScheduleSyncException e) {
      try {
        store.update(current);
      } catch (RuntimeException restoreEx) {
        e.addSuppressed(restoreEx);
      }
      throw e;
    }
    logger.info("Updated schedule {}", scheduleUuid);
    return updated;
  }

  /** Deletes a schedule; its periodic task goes with it. */
  public void deleteSchedule(UUID scheduleUuid) {
    var record = store.getByUuid(scheduleUuid);
    store.delete(record.id());
    logger.info("Deleted schedule {}", scheduleUuid);
    pruneCrontabs();
  }

  public ScheduleRecord getSchedule(UUID scheduleUuid) {
    return store.getByUuid(scheduleUuid);
  }

  public List<ScheduleRecord> listSchedulesForProject(UUID projectId, @Nullable Boolean enabled) {
    return store.listByProject(projectId, enabled);
  }

  public List<ScheduleRecord> listSchedules(
      UUID organizationId,
      @Nullable UUID projectId,
      @Nullable ScheduledWorkflowType type,
      @Nullable Boolean enabled) {
    return store.listByScope(organizationId, projectId, type, enabled);
  }

  public ScheduleStats getStats(UUID organizationId) {
    return ScheduleStats.of(store.listByScope(organizationId, null, null, null));
  }

  /** Pushes every enabled schedule again, e.g. after the periodic task store was rebuilt. */
  public BulkSyncReport resyncAllEnabled() {
    return backendSync.resyncAll(store.listEnabled());
  }

  /**
   * Removes every schedule of a project that is being deleted and revokes its automation
   * credential. Returns the number of schedules removed.
   */
  public int deleteSchedulesForProject(UUID projectId) {
    var removed = store.deleteByProject(projectId);
    var revoked =
        credentials.revokeAll(
            projectId, Constants.SYSTEM_USER_ID, RevocationReason.PROJECT_DELETED);
    logger.info(
        "Removed {} schedule(s) and revoked {} credential(s) of deleted project {}",
        removed,
        revoked,
        projectId);
    if (removed > 0) {
      pruneCrontabs();
    }
    return removed;
  }

  public ReconciliationReport handleDeploymentReconciliation(
      UUID projectId, UUID graphId, @Nullable UUID previousGraphId) {
    if (reconciler == null) {
      throw new IllegalStateException("No workflow graph source is configured");
    }
    return reconciler.reconcile(projectId, graphId, previousGraphId);
  }

  private void pruneCrontabs() {
    try {
      backendSync.pruneUnusedCrontabs();
    } catch (RuntimeException e) {
      logger.warn("Failed to prune unused crontabs", e);
    }
  }
}
