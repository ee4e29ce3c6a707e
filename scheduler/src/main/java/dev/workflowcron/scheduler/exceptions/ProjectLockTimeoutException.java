package dev.workflowcron.scheduler.exceptions;

import java.time.Duration;
import java.util.UUID;

/** Thrown when another pass keeps a project's reconciliation lock past the acquire timeout. */
public class ProjectLockTimeoutException extends RuntimeException {
  private final UUID projectId;

  public ProjectLockTimeoutException(UUID projectId, Duration timeout) {
    super(
        String.format(
            "Timed out after %d ms waiting for the reconciliation lock of project %s",
            timeout.toMillis(), projectId));
    this.projectId = projectId;
  }

  public UUID projectId() {
    return projectId;
  }
}
