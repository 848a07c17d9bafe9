package dev.openclaw.jobs.exceptions;

import java.time.Duration;
import java.util.UUID;

/** Recorded as the failure of a job whose handler did not finish within the handler timeout. */
public class JobTimeoutException extends RuntimeException {
  private final UUID jobId;
  private final Duration timeout;

  public JobTimeoutException(UUID jobId, Duration timeout) {
    super(String.format("Job %s handler timed out after %d ms", jobId, timeout.toMillis()));
    this.jobId = jobId;
    this.timeout = timeout;
  }

  public UUID jobId() {
    return jobId;
  }

  public Duration timeout() {
    return timeout;
  }
}
