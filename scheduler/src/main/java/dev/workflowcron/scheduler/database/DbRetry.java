package dev.workflowcron.scheduler.database;

import dev.workflowcron.scheduler.exceptions.SchedulerDatabaseException;

import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a database operation, retrying it with jittered exponential backoff while it keeps failing
 * with transient errors. Non-transient failures are rethrown unchecked on the first attempt.
 */
public final class DbRetry {
  private static final Logger logger = LoggerFactory.getLogger(DbRetry.class);

  // Postgres states worth retrying outside of the 08 (connection) and 40 (rollback) classes
  private static final Set<String> RETRIABLE_STATES = Set.of("55P03", "53300", "57014");

  private DbRetry() {}

  public record Options(
      Duration initialBackoff,
      Duration maxBackoff,
      int maxAttempts,
      Predicate<Throwable> retriablePredicate) {

    public static Options defaults() {
      return new Options(
          Duration.ofMillis(500), Duration.ofSeconds(30), 8, DbRetry::isTransient);
    }

    public Options withInitialBackoff(Duration d) {
      return new Options(Objects.requireNonNull(d), maxBackoff, maxAttempts, retriablePredicate);
    }

    public Options withMaxBackoff(Duration d) {
      return new Options(
          initialBackoff, Objects.requireNonNull(d), maxAttempts, retriablePredicate);
    }

    public Options withMaxAttempts(int n) {
      return new Options(initialBackoff, maxBackoff, n, retriablePredicate);
    }
  }

  public static <T> T call(ThrowingSupplier<T, Exception> body) {
    return call(body, Options.defaults());
  }

  public static <T, E extends Exception> T call(ThrowingSupplier<T, E> body, Options opts) {
    Objects.requireNonNull(body);
    Objects.requireNonNull(opts);

    int attempts = Math.max(1, opts.maxAttempts());
    long backoffMs = opts.initialBackoff().toMillis();
    Throwable last = null;

    for (int attempt = 1; attempt <= attempts; attempt++) {
      try {
        return body.execute();
      } catch (Throwable t) {
        if (!opts.retriablePredicate().test(t)) {
          throw unchecked(t);
        }
        last = t;
        if (attempt == attempts) {
          break;
        }

        double jitter = 0.5 + ThreadLocalRandom.current().nextDouble();
        long sleepMs = Math.max(1L, (long) (backoffMs * jitter));
        logger.warn(
            "Scheduler database operation failed (attempt {} of {}): {}. Retrying in {} ms",
            attempt,
            attempts,
            t.getMessage(),
            sleepMs);
        pause(sleepMs);
        backoffMs = Math.min(backoffMs * 2, opts.maxBackoff().toMillis());
      }
    }

    logger.error("Scheduler database operation failed after {} attempts", attempts);
    throw new SchedulerDatabaseException(last);
  }

  public static <E extends Exception> void run(ThrowingRunnable<E> body) {
    run(body, Options.defaults());
  }

  public static <E extends Exception> void run(ThrowingRunnable<E> body, Options opts) {
    call(
        () -> {
          body.execute();
          return null;
        },
        opts);
  }

  private static RuntimeException unchecked(Throwable t) {
    if (t instanceof RuntimeException re) {
      return re;
    }
    if (t instanceof Error err) {
      throw err;
    }
    return new SchedulerDatabaseException(t);
  }

  private static void pause(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SchedulerDatabaseException(e);
    }
  }

  static boolean isTransient(Throwable t) {
    for (Throwable cur = t; cur != null; cur = cur.getCause()) {
      if (cur instanceof SQLTransientException || cur instanceof SQLRecoverableException) {
        return true;
      }
      if (cur instanceof SQLException sqlEx && sqlEx.getSQLState() != null) {
        String state = sqlEx.getSQLState();
        if (state.startsWith("08") || state.startsWith("40") || RETRIABLE_STATES.contains(state)) {
          return true;
        }
      }
    }
    return false;
  }
}
