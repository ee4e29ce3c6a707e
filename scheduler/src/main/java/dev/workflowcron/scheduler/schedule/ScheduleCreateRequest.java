package dev.workflowcron.scheduler.schedule;

import dev.workflowcron.scheduler.Constants;

import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import org.jspecify.annotations.Nullable;

public record ScheduleCreateRequest(
    UUID organizationId,
    @Nullable UUID projectId,
    ScheduledWorkflowType type,
    String cronExpression,
    String timezone,
    boolean enabled,
    Map<String, Object> args) {

  public ScheduleCreateRequest {
    Objects.requireNonNull(organizationId, "organizationId must not be null");
    Objects.requireNonNull(type, "type must not be null");
    Objects.requireNonNull(cronExpression, "cronExpression must not be null");
    timezone = timezone == null || timezone.isBlank() ? Constants.DEFAULT_TIMEZONE : timezone;
    args = args == null ? Map.of() : Map.copyOf(args);
  }

  public static ScheduleCreateRequest forProject(
      UUID organizationId, UUID projectId, String cronExpression, String timezone) {
    return new ScheduleCreateRequest(
        organizationId,
        projectId,
        ScheduledWorkflowType.PROJECT,
        cronExpression,
        timezone,
        true,
        Map.of());
  }

  public ScheduleCreateRequest withEnabled(boolean v) {
    return new ScheduleCreateRequest(
        organizationId, projectId, type, cronExpression, timezone, v, args);
  }

  public ScheduleCreateRequest withArgs(Map<String, Object> v) {
    return new ScheduleCreateRequest(
        organizationId, projectId, type, cronExpression, timezone, enabled, v);
  }
}
