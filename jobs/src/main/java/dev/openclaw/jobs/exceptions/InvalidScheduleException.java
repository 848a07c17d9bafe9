package dev.openclaw.jobs.exceptions;

/**
 * {@code InvalidScheduleException} is thrown when a schedule is created or updated with a value
 * that cannot be accepted: a malformed or too-frequent cron expression, an unknown timezone, an
 * unusable webhook URL, an out-of-range retry budget, or a missing required field.
 */
public class InvalidScheduleException extends RuntimeException {
  private final String field;

  public InvalidScheduleException(String field, String message) {
    super(message);
    this.field = field;
  }

  /** Name of the schedule field that failed validation, e.g. {@code cron_expression} */
  public String field() {
    return field;
  }
}
