package dev.openclaw.jobs.exceptions;

/**
 * {@code UnknownJobKindException} is recorded as the failure of a claimed job whose kind has no
 * registered handler. The job is retried with backoff, so a worker deployed later with the handler
 * can still pick it up.
 */
public class UnknownJobKindException extends RuntimeException {
  private final String kind;

  public UnknownJobKindException(String kind) {
    super(String.format("Unknown job kind: %s", kind));
    this.kind = kind;
  }

  public String kind() {
    return kind;
  }
}
