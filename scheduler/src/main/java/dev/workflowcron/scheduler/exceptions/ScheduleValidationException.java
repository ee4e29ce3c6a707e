package dev.workflowcron.scheduler.exceptions;

/** Thrown when a schedule write would violate the type / project scoping rules. */
public class ScheduleValidationException extends RuntimeException {
  public ScheduleValidationException(String message) {
    super(message);
  }
}
