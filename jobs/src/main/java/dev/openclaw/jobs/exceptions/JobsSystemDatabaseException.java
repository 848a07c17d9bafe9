package dev.openclaw.jobs.exceptions;

import java.sql.SQLException;

/**
 * Thrown when the jobs database cannot be reached, or rejects an operation for a reason that
 * retrying will not fix. Transient failures are retried before this is raised.
 */
public class JobsSystemDatabaseException extends RuntimeException {
  Throwable underlyingException;

  public JobsSystemDatabaseException(Throwable e) {
    super(
        String.format(
            "Jobs database access error:%s %s",
            e instanceof SQLException ? " " + ((SQLException) e).getSQLState() : "",
            e.getMessage()),
        e);
    this.underlyingException = e;
  }

  /** The most recent exception received from the database connection */
  public Throwable databaseException() {
    return underlyingException;
  }
}
