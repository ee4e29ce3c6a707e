package dev.workflowcron.scheduler.exceptions;

import java.util.UUID;

/**
 * Thrown when a project has no usable automation credential, or when a stored credential secret
 * can not be recovered.
 */
public class CredentialException extends RuntimeException {
  private final UUID projectId;

  public CredentialException(UUID projectId, String message) {
    super(message);
    this.projectId = projectId;
  }

  public CredentialException(UUID projectId, String message, Throwable cause) {
    super(message, cause);
    this.projectId = projectId;
  }

  public UUID projectId() {
    return projectId;
  }
}
