package dev.workflowcron.scheduler.dispatch;

/** Classification of a single dispatch attempt. */
public enum DispatchOutcome {
  SUCCESS,
  /** The endpoint answered with a non-2xx status. */
  HTTP_ERROR,
  TIMEOUT_ERROR,
  /** Connecting to or talking with the endpoint failed. */
  REQUEST_ERROR,
  UNEXPECTED_ERROR,
  /** No usable automation credential; no request was sent. */
  CREDENTIAL_ERROR,
  SCHEDULE_NOT_FOUND;

  public DispatchStatus status() {
    return this == SUCCESS ? DispatchStatus.SUCCESS : DispatchStatus.FAILED;
  }
}
