package dev.workflowcron.scheduler.sync;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.jspecify.annotations.Nullable;

/**
 * Storage of the periodic task tables read by the beat. Every mutating call commits atomically and
 * bumps the shared "last changed" marker in the same transaction.
 */
public interface PeriodicTaskStore {

  /** Finds the crontab row with exactly these fields and timezone, creating it if needed. */
  CrontabHandle ensureCrontab(CrontabSpec spec);

  /**
   * Creates or updates the task whose back reference is {@code definition.scheduleUuid()}, pointing
   * it at the crontab for {@code crontab}.
   */
  SyncResult upsert(PeriodicTaskDefinition definition, CrontabSpec crontab);

  Optional<PeriodicTask> findByScheduleUuid(UUID scheduleUuid);

  /** Returns true if a task was removed */
  boolean deleteByScheduleUuid(UUID scheduleUuid);

  List<PeriodicTask> listEnabled();

  /** Time of the last change to the task definitions, or null if nothing was ever written */
  @Nullable
  Instant lastChanged();

  /** Records a fire; does not count as a definition change */
  void recordRun(long taskId, Instant ranAt);

  /** Deletes crontab rows no task refers to and returns how many were deleted */
  int pruneUnusedCrontabs();
}
