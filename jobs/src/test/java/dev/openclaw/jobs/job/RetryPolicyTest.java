package dev.openclaw.jobs.job;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.Test;

public class RetryPolicyTest {

  @Test
  public void backoffDoublesUpToCap() {
    var policy = new RetryPolicy(10, () -> 0);
    assertEquals(Duration.ofSeconds(1), policy.backoff(0));
    assertEquals(Duration.ofSeconds(2), policy.backoff(1));
    assertEquals(Duration.ofSeconds(4), policy.backoff(2));
    assertEquals(Duration.ofSeconds(32), policy.backoff(5));
    assertEquals(Duration.ofSeconds(32), policy.backoff(9));
  }

  @Test
  public void jitterIsBoundedToOneSecond() {
    var policy = new RetryPolicy(10, () -> 5000);
    assertEquals(Duration.ofSeconds(2).plusMillis(999), policy.backoff(1));

    var negative = new RetryPolicy(10, () -> -10);
    assertEquals(Duration.ofSeconds(2), negative.backoff(1));
  }

  @Test
  public void nextRunAt() {
    var policy = new RetryPolicy(5, () -> 250);
    var now = Instant.parse("2025-01-15T12:00:00Z");
    assertEquals(Instant.parse("2025-01-15T12:00:08.250Z"), policy.nextRunAt(now, 3));
  }

  @Test
  public void exhaustion() {
    var policy = new RetryPolicy(3);
    assertFalse(policy.isExhausted(2));
    assertTrue(policy.isExhausted(3));
    assertTrue(policy.isExhausted(4));
    assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(0));
  }

  @Test
  public void jobStates() {
    var now = Instant.parse("2025-01-15T12:00:00Z");
    var stale = Duration.ofMinutes(5);
    var job = Job.create(java.util.UUID.randomUUID(), "k", null, now, null, now);

    assertEquals(JobState.READY, job.state(now, stale, 3));
    assertEquals(JobState.PENDING, job.state(now.minusSeconds(1), stale, 3));

    var locked = job.withLock(now, "w1");
    assertEquals(JobState.LOCKED, locked.state(now.plusSeconds(60), stale, 3));
    assertEquals(JobState.LOCKED_STALE, locked.state(now.plusSeconds(301), stale, 3));
    assertTrue(locked.isClaimable(now.plusSeconds(301), stale, 3));
    assertFalse(locked.isClaimable(now.plusSeconds(60), stale, 3));

    assertEquals(JobState.COMPLETED, locked.withCompleted(now).state(now, stale, 3));
    assertEquals(
        JobState.DEAD_LETTER, locked.withFailure(3, "boom", now, now).state(now, stale, 3));
    assertTrue(job.payload().isEmpty());
  }
}
