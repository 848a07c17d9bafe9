package dev.openclaw.jobs.exceptions;

/**
 * Thrown by a job handler to signal that the job can never succeed, no matter how often it is
 * retried. The dispatcher moves such a job straight to the dead-letter state, keeping the message
 * as its last error.
 */
public class NonRetryableJobException extends RuntimeException {

  public NonRetryableJobException(String message) {
    super(message);
  }

  public NonRetryableJobException(String message, Throwable cause) {
    super(message, cause);
  }
}
