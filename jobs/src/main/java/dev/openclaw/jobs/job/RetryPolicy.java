package dev.openclaw.jobs.job;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.LongSupplier;

/**
 * Backoff applied when a job fails: {@code 2^min(attempts, 5)} seconds plus up to one second of
 * jitter, so the delay grows with each failure and stops growing at 32 seconds.
 */
public class RetryPolicy {

  static final int MAX_EXPONENT = 5;
  static final long JITTER_BOUND_MS = 1000;

  private final int maxAttempts;
  private final LongSupplier jitter;

  public RetryPolicy(int maxAttempts) {
    this(maxAttempts, () -> ThreadLocalRandom.current().nextLong(JITTER_BOUND_MS));
  }

  public RetryPolicy(int maxAttempts, LongSupplier jitter) {
    if (maxAttempts <= 0) {
      throw new IllegalArgumentException("maxAttempts must be greater than zero");
    }
    this.maxAttempts = maxAttempts;
    this.jitter = jitter;
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  /** Delay before the next try, given the attempt count after the failure was counted. */
  public Duration backoff(int attempts) {
    int exponent = Math.min(Math.max(attempts, 0), MAX_EXPONENT);
    long jitterMs = Math.max(0, Math.min(jitter.getAsLong(), JITTER_BOUND_MS - 1));
    return Duration.ofSeconds(1L << exponent).plusMillis(jitterMs);
  }

  public Instant nextRunAt(Instant now, int attempts) {
    return now.plus(backoff(attempts));
  }

  /** True once a job with this many recorded attempts must not be claimed again. */
  public boolean isExhausted(int attempts) {
    return attempts >= maxAttempts;
  }
}
