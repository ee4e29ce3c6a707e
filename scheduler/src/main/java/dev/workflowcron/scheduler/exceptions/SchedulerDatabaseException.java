package dev.workflowcron.scheduler.exceptions;

import java.sql.SQLException;

/**
 * This exception is thrown when the scheduler database reports a non-transient error, or cannot be
 * reached despite numerous retries.
 */
public class SchedulerDatabaseException extends RuntimeException {
  private final Throwable underlyingException;

  public SchedulerDatabaseException(Throwable e) {
    super(
        String.format(
            "Scheduler database access error:%s %s",
            e instanceof SQLException ? " " + ((SQLException) e).getSQLState() : "",
            e.getMessage()),
        e);
    this.underlyingException = e;
  }

  /** The exception most recently received from the database connection */
  public Throwable databaseException() {
    return underlyingException;
  }
}
