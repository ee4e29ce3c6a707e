package dev.workflowcron.scheduler.schedule;

import dev.workflowcron.scheduler.exceptions.ScheduleNotFoundException;

import java.util.List;
import java.util.UUID;

import org.jspecify.annotations.Nullable;

/**
 * Persistence for {@link ScheduleRecord}s. Implementations hold no scheduling logic; every write
 * is transactional and returns the row as persisted, with generated identity and timestamps.
 */
public interface ScheduleStore {

  ScheduleRecord create(NewSchedule schedule);

  /** @throws ScheduleNotFoundException if no schedule has this id */
  ScheduleRecord getById(long id);

  /** @throws ScheduleNotFoundException if no schedule has this uuid */
  ScheduleRecord getByUuid(UUID uuid);

  /**
   * Writes the mutable fields (cron expression, timezone, enabled, args) of {@code record}.
   *
   * @throws ScheduleNotFoundException if the schedule no longer exists
   */
  ScheduleRecord update(ScheduleRecord record);

  /** @throws ScheduleNotFoundException if no schedule has this id */
  void delete(long id);

  /**
   * Lists schedules of an organization. Null filters match everything.
   */
  List<ScheduleRecord> listByScope(
      UUID organizationId,
      @Nullable UUID projectId,
      @Nullable ScheduledWorkflowType type,
      @Nullable Boolean enabled);

  List<ScheduleRecord> listByProject(UUID projectId, @Nullable Boolean enabled);

  List<ScheduleRecord> listEnabled();

  /** Deletes every schedule of a project and returns how many were removed */
  int deleteByProject(UUID projectId);
}
