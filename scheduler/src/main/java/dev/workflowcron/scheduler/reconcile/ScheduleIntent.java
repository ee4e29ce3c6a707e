package dev.workflowcron.scheduler.reconcile;

import dev.workflowcron.scheduler.Constants;

import java.util.Map;

/** What a trigger node asks for, with defaults applied to unset parameters. */
public record ScheduleIntent(
    String nodeInstanceId, String cronExpression, String timezone, boolean enabled) {

  public static final String CRON_EXPRESSION_PARAM = "cron_expression";
  public static final String TIMEZONE_PARAM = "timezone";
  public static final String ENABLED_PARAM = "enabled";

  /**
   * Reads the intent of {@code node}.
   *
   * @throws IllegalArgumentException if {@code enabled} is neither a boolean nor "true" or "false"
   */
  public static ScheduleIntent from(TriggerNode node) {
    var params = node.params();
    return new ScheduleIntent(
        node.nodeInstanceId(),
        text(params, CRON_EXPRESSION_PARAM, Constants.DEFAULT_CRON_EXPRESSION),
        text(params, TIMEZONE_PARAM, Constants.DEFAULT_TIMEZONE),
        flag(node.nodeInstanceId(), params.get(ENABLED_PARAM)));
  }

  private static String text(Map<String, Object> params, String name, String defaultValue) {
    var value = params.get(name);
    if (value == null || value.toString().isBlank()) {
      return defaultValue;
    }
    return value.toString().trim();
  }

  private static boolean flag(String nodeId, Object value) {
    if (value == null) {
      return true;
    }
    if (value instanceof Boolean b) {
      return b;
    }
    var text = value.toString().trim();
    if (text.isEmpty() || text.equalsIgnoreCase("true")) {
      return true;
    }
    if (text.equalsIgnoreCase("false")) {
      return false;
    }
    throw new IllegalArgumentException(
        "Invalid %s value '%s' on trigger node %s".formatted(ENABLED_PARAM, value, nodeId));
  }
}
