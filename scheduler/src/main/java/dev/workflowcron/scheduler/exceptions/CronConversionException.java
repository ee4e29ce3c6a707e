package dev.workflowcron.scheduler.exceptions;

public class CronConversionException extends RuntimeException {
  private final String expression;
  private final String timezone;

  public CronConversionException(String expression, String timezone, Throwable cause) {
    super(
        String.format(
            "Unable to convert cron expression '%s' from timezone %s: %s",
            expression, timezone, cause.getMessage()),
        cause);
    this.expression = expression;
    this.timezone = timezone;
  }

  public String expression() {
    return expression;
  }

  public String timezone() {
    return timezone;
  }
}
