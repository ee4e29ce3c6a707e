package dev.workflowcron.scheduler.schedule;

import dev.workflowcron.scheduler.exceptions.ScheduleValidationException;

import java.util.UUID;

/** Kind of workflow a schedule fires. Only PROJECT schedules are scoped to a project. */
public enum ScheduledWorkflowType {
  PROJECT,
  INGESTION;

  public boolean requiresProject() {
    return this == PROJECT;
  }

  /**
   * Checks that {@code projectId} is present exactly when this type requires a project.
   *
   * @throws ScheduleValidationException if the project scoping does not match the type
   */
  public void checkProjectScope(UUID projectId) {
    if (requiresProject() && projectId == null) {
      throw new ScheduleValidationException(
          "project_id is required for %s schedules".formatted(this));
    }
    if (!requiresProject() && projectId != null) {
      throw new ScheduleValidationException(
          "project_id must not be set for %s schedules".formatted(this));
    }
  }
}
