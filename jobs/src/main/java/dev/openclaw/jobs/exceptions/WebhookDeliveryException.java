package dev.openclaw.jobs.exceptions;

/**
 * {@code WebhookDeliveryException} is thrown when a scheduled webhook could not be delivered.
 * Transport failures carry no status code. Whether a retry may help is decided from the status:
 * timeouts, conflicts, rate limits and server errors are retryable, other client errors are not.
 */
public class WebhookDeliveryException extends RuntimeException {
  private final Integer statusCode;

  public WebhookDeliveryException(String message, Integer statusCode) {
    super(message);
    this.statusCode = statusCode;
  }

  public WebhookDeliveryException(String message, Throwable cause) {
    super(message, cause);
    this.statusCode = null;
  }

  /** HTTP status returned by the receiver, or {@code null} when no response was received */
  public Integer statusCode() {
    return statusCode;
  }

  public boolean isRetryable() {
    return isRetryable(statusCode);
  }

  public static boolean isRetryable(Integer statusCode) {
    if (statusCode == null) {
      return true;
    }
    if (statusCode >= 500) {
      return true;
    }
    return statusCode == 408 || statusCode == 409 || statusCode == 425 || statusCode == 429;
  }
}
