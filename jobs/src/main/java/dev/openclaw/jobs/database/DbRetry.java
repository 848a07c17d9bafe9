package dev.openclaw.jobs.database;

import dev.openclaw.jobs.exceptions.JobsSystemDatabaseException;

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
 * Retries a database call while it fails with a transient error (lost connection, serialization
 * failure, deadlock, lock timeout, too many connections). Anything else propagates immediately;
 * checked exceptions are wrapped in {@link JobsSystemDatabaseException}.
 */
public final class DbRetry {
  private static final Logger logger = LoggerFactory.getLogger(DbRetry.class);

  private static final Set<String> RETRIABLE_SQL_STATES = Set.of("55P03", "53300", "57014");

  private DbRetry() {}

  public record Options(
      Duration initialBackoff,
      Duration maxBackoff,
      int maxAttempts,
      Predicate<Throwable> retriablePredicate) {

    public static Options defaults() {
      return new Options(
          Duration.ofMillis(500), Duration.ofSeconds(30), 8, DbRetry::isRetriableSql);
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

    int attempt = 0;
    long backoffMillis = opts.initialBackoff().toMillis();
    Throwable last = null;

    while (attempt < Math.max(1, opts.maxAttempts())) {
      try {
        return body.execute();
      } catch (Throwable t) {
        last = t;
        if (!opts.retriablePredicate().test(t)) {
          throw wrapUnchecked(t);
        }

        attempt++;
        if (attempt >= opts.maxAttempts()) {
          break;
        }

        // backoff * (0.5 .. 1.5)
        double jitterFactor = 0.5 + ThreadLocalRandom.current().nextDouble();
        long sleepMillis = Math.max(1L, (long) (backoffMillis * jitterFactor));
        logger.warn(
            "Job store operation failed (attempt {} of {}): {}. Retrying in {} ms",
            attempt,
            opts.maxAttempts(),
            t.getMessage(),
            sleepMillis);
        sleepUninterruptibly(sleepMillis);
        backoffMillis = Math.min(backoffMillis * 2, opts.maxBackoff().toMillis());
      }
    }

    throw new JobsSystemDatabaseException(last);
  }

  private static RuntimeException wrapUnchecked(Throwable t) {
    return (t instanceof RuntimeException re) ? re : new JobsSystemDatabaseException(t);
  }

  private static void sleepUninterruptibly(long millis) {
    boolean interrupted = false;
    long end = System.currentTimeMillis() + millis;
    while (true) {
      long remaining = end - System.currentTimeMillis();
      if (remaining <= 0) {
        break;
      }
      try {
        Thread.sleep(remaining);
      } catch (InterruptedException ie) {
        interrupted = true;
      }
    }
    if (interrupted) {
      Thread.currentThread().interrupt();
    }
  }

  static boolean isRetriableSql(Throwable t) {
    for (Throwable cur = t; cur != null; cur = cur.getCause()) {
      if (cur instanceof SQLTransientException || cur instanceof SQLRecoverableException) {
        return true;
      }
      if (cur instanceof SQLException sqlEx) {
        String state = sqlEx.getSQLState();
        if (state == null) {
          continue;
        }
        // 08: connection exception, 40: transaction rollback
        if (state.startsWith("08") || state.startsWith("40")) {
          return true;
        }
        if (RETRIABLE_SQL_STATES.contains(state)) {
          return true;
        }
      }
    }
    return false;
  }
}
