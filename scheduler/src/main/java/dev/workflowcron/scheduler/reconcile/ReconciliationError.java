package dev.workflowcron.scheduler.reconcile;

import java.util.UUID;

import org.jspecify.annotations.Nullable;

/**
 * A failure recorded during a reconciliation pass. Errors about a trigger node carry its id, errors
 * about an existing schedule carry its uuid, and credential errors carry neither.
 */
public record ReconciliationError(
    @Nullable String triggerNodeId, @Nullable UUID scheduleUuid, String message) {

  static ReconciliationError forNode(
      String triggerNodeId, @Nullable UUID scheduleUuid, String message) {
    return new ReconciliationError(triggerNodeId, scheduleUuid, message);
  }

  static ReconciliationError forSchedule(UUID scheduleUuid, String message) {
    return new ReconciliationError(null, scheduleUuid, message);
  }

  static ReconciliationError forCredential(String message) {
    return new ReconciliationError(null, null, message);
  }
}
