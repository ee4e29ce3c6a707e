package dev.workflowcron.scheduler.exceptions;

import java.util.UUID;

/**
 * {@code ScheduleNotFoundException} is thrown by schedule lookups, updates and deletes that target
 * a schedule which does not exist (or no longer exists).
 */
public class ScheduleNotFoundException extends RuntimeException {
  private final Long scheduleId;
  private final UUID scheduleUuid;

  public ScheduleNotFoundException(long scheduleId) {
    super(String.format("Schedule does not exist: id %d", scheduleId));
    this.scheduleId = scheduleId;
    this.scheduleUuid = null;
  }

  public ScheduleNotFoundException(UUID scheduleUuid) {
    super(String.format("Schedule does not exist: uuid %s", scheduleUuid));
    this.scheduleId = null;
    this.scheduleUuid = scheduleUuid;
  }

  /** Numeric id of the missing schedule, or null if it was looked up by UUID */
  public Long scheduleId() {
    return scheduleId;
  }

  /** UUID of the missing schedule, or null if it was looked up by numeric id */
  public UUID scheduleUuid() {
    return scheduleUuid;
  }
}
