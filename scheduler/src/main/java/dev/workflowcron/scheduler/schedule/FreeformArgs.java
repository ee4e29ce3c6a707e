package dev.workflowcron.scheduler.schedule;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record FreeformArgs(Map<String, Object> values) implements ScheduleArgs {

  public FreeformArgs {
    values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }

  @Override
  public Map<String, Object> asMap() {
    return values;
  }
}
