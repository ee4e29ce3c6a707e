package dev.workflowcron.scheduler.schedule;

import dev.workflowcron.scheduler.json.JSONUtil;

import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.core.type.TypeReference;

/**
 * Arguments carried by a schedule. PROJECT args naming a trigger node hold a {@link
 * TriggerBinding}, everything else holds {@link FreeformArgs}. Both keep every entry they were
 * given.
 */
public interface ScheduleArgs {

  String COMPONENT_INSTANCE_ID = "component_instance_id";

  Map<String, Object> asMap();

  default String toJson() {
    return JSONUtil.toJson(asMap());
  }

  static ScheduleArgs empty() {
    return new FreeformArgs(Map.of());
  }

  static ScheduleArgs of(ScheduledWorkflowType type, Map<String, Object> values) {
    Objects.requireNonNull(type);
    if (values == null || values.isEmpty()) {
      return empty();
    }
    if (type == ScheduledWorkflowType.PROJECT
        && values.get(COMPONENT_INSTANCE_ID) instanceof String nodeId
        && !nodeId.isEmpty()) {
      return new TriggerBinding(nodeId, values);
    }
    return new FreeformArgs(values);
  }

  static ScheduleArgs fromJson(ScheduledWorkflowType type, String json) {
    if (json == null || json.isBlank()) {
      return empty();
    }
    Map<String, Object> values =
        JSONUtil.fromJson(json, new TypeReference<Map<String, Object>>() {});
    return of(type, values);
  }
}
