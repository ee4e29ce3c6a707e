package dev.workflowcron.scheduler.credential;

public enum RevocationReason {
  /** Replaced by a newer automation credential */
  ROTATION,
  /** The project no longer has any enabled schedule */
  SCHEDULES_REMOVED,
  /** The project itself was deleted */
  PROJECT_DELETED
}
