package dev.workflowcron.scheduler.reconcile;

import java.util.Map;
import java.util.Objects;

/**
 * A trigger node found in a deployed graph. {@code params} holds the node's configured values,
 * keyed by parameter name ({@code cron_expression}, {@code timezone}, {@code enabled}).
 */
public record TriggerNode(String nodeInstanceId, Map<String, Object> params) {
  public TriggerNode {
    Objects.requireNonNull(nodeInstanceId, "nodeInstanceId must not be null");
    params = params == null ? Map.of() : params;
  }
}
