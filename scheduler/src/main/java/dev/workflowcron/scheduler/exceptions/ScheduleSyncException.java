package dev.workflowcron.scheduler.exceptions;

import java.util.UUID;

/**
 * Thrown when a schedule could not be pushed into the periodic task store. Nothing is committed to
 * the periodic task store when this is thrown.
 */
public class ScheduleSyncException extends RuntimeException {
  private final UUID scheduleUuid;

  public ScheduleSyncException(UUID scheduleUuid, Throwable cause) {
    super(
        String.format(
            "Failed to sync schedule %s to the periodic task store: %s",
            scheduleUuid, cause.getMessage()),
        cause);
    this.scheduleUuid = scheduleUuid;
  }

  public UUID scheduleUuid() {
    return scheduleUuid;
  }
}
