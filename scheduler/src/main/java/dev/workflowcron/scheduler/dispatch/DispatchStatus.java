package dev.workflowcron.scheduler.dispatch;

public enum DispatchStatus {
  SUCCESS,
  FAILED
}
