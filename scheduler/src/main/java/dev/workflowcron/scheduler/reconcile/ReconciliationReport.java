package dev.workflowcron.scheduler.reconcile;

import java.util.List;
import java.util.UUID;

import org.jspecify.annotations.Nullable;

public record ReconciliationReport(
    UUID projectId,
    UUID graphId,
    @Nullable UUID previousGraphId,
    int updated,
    int removed,
    CredentialAction credentialAction,
    List<ReconciliationError> errors) {

  public enum Status {
    SUCCESS,
    PARTIAL
  }

  public enum CredentialAction {
    NONE,
    ISSUED,
    ROTATED,
    REVOKED
  }

  public ReconciliationReport {
    errors = List.copyOf(errors);
  }

  public Status status() {
    return errors.isEmpty() ? Status.SUCCESS : Status.PARTIAL;
  }
}
