package dev.workflowcron.scheduler.sync;

import dev.workflowcron.scheduler.Constants;
import dev.workflowcron.scheduler.exceptions.ScheduleSyncException;
import dev.workflowcron.scheduler.json.JSONUtil;
import dev.workflowcron.scheduler.schedule.ScheduleRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps the periodic task store in line with schedule records. The beat only ever sees durable
 * rows: it notices changes through the "last changed" marker on its next poll.
 */
public class ExecutionBackendSync {

  private static final Logger logger = LoggerFactory.getLogger(ExecutionBackendSync.class);

  private final PeriodicTaskStore store;

  public ExecutionBackendSync(PeriodicTaskStore store) {
    this.store = Objects.requireNonNull(store);
  }

  public static String taskName(UUID scheduleUuid) {
    return Constants.PERIODIC_TASK_NAME_PREFIX + scheduleUuid;
  }

  /**
   * Builds the task row for a schedule. Positional args are {@code [projectId or "", scheduleUuid,
   * type, args]}; keyword args are always empty.
   */
  public static PeriodicTaskDefinition definitionFor(ScheduleRecord schedule) {
    List<Object> args =
        List.of(
            schedule.projectId() == null ? "" : schedule.projectId().toString(),
            schedule.uuid().toString(),
            schedule.type().name(),
            schedule.args().asMap());
    return new PeriodicTaskDefinition(
        schedule.uuid(),
        taskName(schedule.uuid()),
        Constants.PERIODIC_TASK_IDENTIFIER,
        JSONUtil.toJson(args),
        JSONUtil.toJson(Map.of()),
        Constants.PERIODIC_TASK_QUEUE,
        schedule.enabled(),
        "Scheduled workflow %s for %s".formatted(schedule.type(), schedule.uuid()));
  }

  public CrontabHandle ensureCrontab(String cronExpression, String timezone) {
    return store.ensureCrontab(CrontabSpec.of(cronExpression, timezone));
  }

  /**
   * Pushes a schedule into the periodic task store.
   *
   * @throws ScheduleSyncException if any part of the upsert failed; nothing was committed
   */
  public SyncResult upsertPeriodicTask(ScheduleRecord schedule) {
    Objects.requireNonNull(schedule);
    try {
      var crontab = CrontabSpec.of(schedule.cronExpression(), schedule.timezone());
      var result = store.upsert(definitionFor(schedule), crontab);
      logger.info(
          "{} periodic task {} for schedule {} ({} {})",
          result.action() == SyncAction.CREATED ? "Created" : "Updated",
          result.externalTaskId(),
          schedule.uuid(),
          schedule.cronExpression(),
          schedule.timezone());
      return result;
    } catch (RuntimeException e) {
      logger.error("Failed to sync schedule {} to the periodic task store", schedule.uuid(), e);
      throw new ScheduleSyncException(schedule.uuid(), e);
    }
  }

  /**
   * Removes the task of a schedule. Deleting the schedule row removes it as well, through the
   * foreign key cascade; this is for callers that keep the schedule.
   */
  public boolean removePeriodicTask(UUID scheduleUuid) {
    try {
      var removed = store.deleteByScheduleUuid(scheduleUuid);
      if (removed) {
        logger.info("Removed periodic task for schedule {}", scheduleUuid);
      }
      return removed;
    } catch (RuntimeException e) {
      throw new ScheduleSyncException(scheduleUuid, e);
    }
  }

  public int pruneUnusedCrontabs() {
    var pruned = store.pruneUnusedCrontabs();
    if (pruned > 0) {
      logger.debug("Pruned {} unused crontab(s)", pruned);
    }
    return pruned;
  }

  /** Re-pushes every given schedule, collecting failures instead of stopping at the first one. */
  public BulkSyncReport resyncAll(List<ScheduleRecord> schedules) {
    int successful = 0;
    List<String> errors = new ArrayList<>();
    for (var schedule : schedules) {
      try {
        upsertPeriodicTask(schedule);
        successful++;
      } catch (ScheduleSyncException e) {
        errors.add("Schedule %s: %s".formatted(schedule.id(), e.getMessage()));
      }
    }
    logger.info("Resynced {} of {} schedule(s)", successful, schedules.size());
    return new BulkSyncReport(schedules.size(), successful, errors.size(), List.copyOf(errors));
  }
}
