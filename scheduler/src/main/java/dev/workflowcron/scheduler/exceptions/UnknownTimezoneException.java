package dev.workflowcron.scheduler.exceptions;

/** Thrown when a timezone is not part of the supported timezone catalog. */
public class UnknownTimezoneException extends RuntimeException {
  private final String timezone;

  public UnknownTimezoneException(String timezone) {
    super(String.format("Unsupported timezone: %s", timezone));
    this.timezone = timezone;
  }

  public String timezone() {
    return timezone;
  }
}
