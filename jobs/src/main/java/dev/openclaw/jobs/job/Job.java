package dev.openclaw.jobs.job;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import org.jspecify.annotations.Nullable;

/**
 * A durable unit of asynchronous work. The {@code kind} selects the handler and the {@code
 * payload} is handed to it unchanged. Jobs are never deleted by the queue itself; a job either
 * completes, is retried with a later {@code runAt}, or stays un-completed once it has used up its
 * attempts.
 */
public record Job(
    UUID id,
    String kind,
    Map<String, Object> payload,
    Instant runAt,
    int attempts,
    @Nullable String idempotencyKey,
    @Nullable Instant lockedAt,
    @Nullable String lockedBy,
    @Nullable Instant completedAt,
    @Nullable String lastError,
    Instant createdAt,
    Instant updatedAt) {

  public Job {
    Objects.requireNonNull(id, "Job id must not be null");
    Objects.requireNonNull(kind, "Job kind must not be null");
    Objects.requireNonNull(runAt, "Job runAt must not be null");
    payload = payload == null ? Map.of() : payload;
  }

  public static Job create(
      UUID id,
      String kind,
      Map<String, Object> payload,
      Instant runAt,
      String idempotencyKey,
      Instant now) {
    return new Job(id, kind, payload, runAt, 0, idempotencyKey, null, null, null, null, now, now);
  }

  public boolean isCompleted() {
    return completedAt != null;
  }

  public boolean isLocked() {
    return lockedAt != null;
  }

  /** Where this job sits in its lifecycle as seen at {@code now}. */
  public JobState state(Instant now, Duration staleAfter, int maxAttempts) {
    if (completedAt != null) {
      return JobState.COMPLETED;
    }
    if (attempts >= maxAttempts) {
      return JobState.DEAD_LETTER;
    }
    if (lockedAt != null) {
      return lockedAt.isBefore(now.minus(staleAfter)) ? JobState.LOCKED_STALE : JobState.LOCKED;
    }
    return runAt.isAfter(now) ? JobState.PENDING : JobState.READY;
  }

  /** True when {@link #state} would allow a worker to claim this job at {@code now}. */
  public boolean isClaimable(Instant now, Duration staleAfter, int maxAttempts) {
    var state = state(now, staleAfter, maxAttempts);
    if (state == JobState.READY) {
      return true;
    }
    return state == JobState.LOCKED_STALE && !runAt.isAfter(now);
  }

  public Job withLock(Instant lockedAt, String lockedBy) {
    return new Job(
        id,
        kind,
        payload,
        runAt,
        attempts,
        idempotencyKey,
        lockedAt,
        lockedBy,
        completedAt,
        lastError,
        createdAt,
        lockedAt);
  }

  public Job withCompleted(Instant completedAt) {
    return new Job(
        id,
        kind,
        payload,
        runAt,
        attempts,
        idempotencyKey,
        null,
        null,
        completedAt,
        lastError,
        createdAt,
        completedAt);
  }

  public Job withFailure(int attempts, String lastError, Instant runAt, Instant now) {
    return new Job(
        id,
        kind,
        payload,
        runAt,
        attempts,
        idempotencyKey,
        null,
        null,
        null,
        lastError,
        createdAt,
        now);
  }

  public Job withRequeued(Instant now) {
    return new Job(
        id,
        kind,
        payload,
        now,
        0,
        idempotencyKey,
        null,
        null,
        null,
        null,
        createdAt,
        now);
  }
}
