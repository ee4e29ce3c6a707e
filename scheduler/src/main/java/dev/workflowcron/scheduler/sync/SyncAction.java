package dev.workflowcron.scheduler.sync;

public enum SyncAction {
  CREATED,
  UPDATED
}
