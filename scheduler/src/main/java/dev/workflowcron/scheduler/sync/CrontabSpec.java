package dev.workflowcron.scheduler.sync;

import dev.workflowcron.scheduler.exceptions.InvalidCronException;

import java.util.Objects;

/** The field by field form of a cron expression plus the timezone it fires in. */
public record CrontabSpec(
    String minute,
    String hour,
    String dayOfMonth,
    String monthOfYear,
    String dayOfWeek,
    String timezone) {

  public CrontabSpec {
    Objects.requireNonNull(minute);
    Objects.requireNonNull(hour);
    Objects.requireNonNull(dayOfMonth);
    Objects.requireNonNull(monthOfYear);
    Objects.requireNonNull(dayOfWeek);
    Objects.requireNonNull(timezone);
  }

  public static CrontabSpec of(String cronExpression, String timezone) {
    var fields = cronExpression == null ? new String[0] : cronExpression.trim().split("\\s+");
    if (fields.length != 5) {
      throw new InvalidCronException(cronExpression, "expected 5 fields");
    }
    return new CrontabSpec(fields[0], fields[1], fields[2], fields[3], fields[4], timezone);
  }

  public String cronExpression() {
    return String.join(" ", minute, hour, dayOfMonth, monthOfYear, dayOfWeek);
  }
}
