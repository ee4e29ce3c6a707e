package dev.workflowcron.scheduler.schedule;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Binds a PROJECT schedule to the trigger node of the deployed graph that declared it. Any other
 * entries the args carried are kept in {@code extra}.
 */
public record TriggerBinding(String nodeInstanceId, Map<String, Object> extra)
    implements ScheduleArgs {

  public TriggerBinding {
    Objects.requireNonNull(nodeInstanceId, "nodeInstanceId must not be null");
    if (nodeInstanceId.isEmpty()) {
      throw new IllegalArgumentException("nodeInstanceId must not be empty");
    }
    Map<String, Object> copy = new LinkedHashMap<>(extra == null ? Map.of() : extra);
    copy.remove(COMPONENT_INSTANCE_ID);
    extra = Collections.unmodifiableMap(copy);
  }

  public TriggerBinding(String nodeInstanceId) {
    this(nodeInstanceId, Map.of());
  }

  @Override
  public Map<String, Object> asMap() {
    Map<String, Object> values = new LinkedHashMap<>();
    values.put(COMPONENT_INSTANCE_ID, nodeInstanceId);
    values.putAll(extra);
    return Collections.unmodifiableMap(values);
  }
}
