package dev.workflowcron.scheduler.schedule;

import java.util.Map;

import org.jspecify.annotations.Nullable;

/** A partial update; null fields keep their current value. */
public record ScheduleUpdateRequest(
    @Nullable String cronExpression,
    @Nullable String timezone,
    @Nullable Boolean enabled,
    @Nullable Map<String, Object> args) {

  public static ScheduleUpdateRequest empty() {
    return new ScheduleUpdateRequest(null, null, null, null);
  }

  public ScheduleUpdateRequest withCronExpression(String v) {
    return new ScheduleUpdateRequest(v, timezone, enabled, args);
  }

  public ScheduleUpdateRequest withTimezone(String v) {
    return new ScheduleUpdateRequest(cronExpression, v, enabled, args);
  }

  public ScheduleUpdateRequest withEnabled(Boolean v) {
    return new ScheduleUpdateRequest(cronExpression, timezone, v, args);
  }

  public ScheduleUpdateRequest withArgs(Map<String, Object> v) {
    return new ScheduleUpdateRequest(cronExpression, timezone, enabled, v);
  }

  public boolean isEmpty() {
    return cronExpression == null && timezone == null && enabled == null && args == null;
  }
}
