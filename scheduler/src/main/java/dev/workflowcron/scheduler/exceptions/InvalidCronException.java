package dev.workflowcron.scheduler.exceptions;

/**
 * Thrown when a cron expression does not have exactly five fields, or when one of its fields is
 * outside the standard cron grammar.
 */
public class InvalidCronException extends RuntimeException {
  private final String expression;

  public InvalidCronException(String expression, String reason) {
    super(String.format("Invalid cron expression '%s': %s", expression, reason));
    this.expression = expression;
  }

  public InvalidCronException(String expression, Throwable cause) {
    super(String.format("Invalid cron expression '%s': %s", expression, cause.getMessage()), cause);
    this.expression = expression;
  }

  /** The rejected expression, exactly as supplied */
  public String expression() {
    return expression;
  }
}
