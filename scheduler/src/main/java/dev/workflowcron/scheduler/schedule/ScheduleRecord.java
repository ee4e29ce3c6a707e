package dev.workflowcron.scheduler.schedule;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import org.jspecify.annotations.Nullable;

public record ScheduleRecord(
    long id,
    UUID uuid,
    UUID organizationId,
    @Nullable UUID projectId,
    ScheduledWorkflowType type,
    String cronExpression,
    String timezone,
    boolean enabled,
    ScheduleArgs args,
    Instant createdAt,
    Instant updatedAt) {

  /** Id of the trigger node this schedule was derived from, if it is bound to one */
  public Optional<String> triggerNodeId() {
    return args instanceof TriggerBinding binding
        ? Optional.of(binding.nodeInstanceId())
        : Optional.empty();
  }

  public ScheduleRecord withCronExpression(String v) {
    return new ScheduleRecord(
        id,
        uuid,
        organizationId,
        projectId,
        type,
        v,
        timezone,
        enabled,
        args,
        createdAt,
        updatedAt);
  }

  public ScheduleRecord withTimezone(String v) {
    return new ScheduleRecord(
        id,
        uuid,
        organizationId,
        projectId,
        type,
        cronExpression,
        v,
        enabled,
        args,
        createdAt,
        updatedAt);
  }

  public ScheduleRecord withEnabled(boolean v) {
    return new ScheduleRecord(
        id,
        uuid,
        organizationId,
        projectId,
        type,
        cronExpression,
        timezone,
        v,
        args,
        createdAt,
        updatedAt);
  }

  public ScheduleRecord withArgs(ScheduleArgs v) {
    return new ScheduleRecord(
        id,
        uuid,
        organizationId,
        projectId,
        type,
        cronExpression,
        timezone,
        enabled,
        v,
        createdAt,
        updatedAt);
  }
}
