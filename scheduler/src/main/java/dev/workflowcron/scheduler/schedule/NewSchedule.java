package dev.workflowcron.scheduler.schedule;

import java.util.Objects;
import java.util.UUID;

import org.jspecify.annotations.Nullable;

/** The caller-supplied part of a schedule; identity and timestamps are assigned by the store. */
public record NewSchedule(
    UUID organizationId,
    @Nullable UUID projectId,
    ScheduledWorkflowType type,
    String cronExpression,
    String timezone,
    boolean enabled,
    ScheduleArgs args) {

  public NewSchedule {
    Objects.requireNonNull(organizationId, "organizationId must not be null");
    Objects.requireNonNull(type, "type must not be null");
    Objects.requireNonNull(cronExpression, "cronExpression must not be null");
    Objects.requireNonNull(timezone, "timezone must not be null");
    args = Objects.requireNonNullElseGet(args, ScheduleArgs::empty);
  }
}
