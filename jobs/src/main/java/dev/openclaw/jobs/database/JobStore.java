package dev.openclaw.jobs.database;

import dev.openclaw.jobs.job.EnqueueResult;
import dev.openclaw.jobs.job.Job;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import org.jspecify.annotations.Nullable;

/**
 * Durable job queue primitives. Every method takes the caller's notion of "now" so that the
 * Postgres and in-memory implementations agree on timing.
 */
public interface JobStore {

  /**
   * Inserts a job, unless {@code idempotencyKey} is present and a job with the same {@code kind}
   * and key already exists; in that case the existing job is returned unchanged with {@code
   * created == false}.
   */
  EnqueueResult enqueue(
      String kind,
      Map<String, Object> payload,
      Instant runAt,
      @Nullable String idempotencyKey,
      Instant now);

  /**
   * Atomically locks one claimable job for {@code workerId}: not completed, due, below {@code
   * maxAttempts}, and unlocked or locked longer than {@code staleAfter}. Concurrent callers never
   * receive the same job.
   */
  Optional<Job> claimNext(String workerId, Instant now, Duration staleAfter, int maxAttempts);

  /**
   * Marks a job completed and clears its lock.
   *
   * @return false when {@code workerId} no longer holds the lock
   */
  boolean complete(UUID jobId, String workerId, Instant now);

  /**
   * Records a failed attempt: increments {@code attempts}, stores the error, clears the lock and
   * moves {@code run_at} to {@code retryAt}.
   *
   * @return false when {@code workerId} no longer holds the lock
   */
  boolean fail(UUID jobId, String workerId, String error, Instant now, Instant retryAt);

  /** Records a failure that must not be retried; the job is left dead-lettered. */
  boolean failPermanently(UUID jobId, String workerId, String error, Instant now, int maxAttempts);

  Optional<Job> getJob(UUID jobId);

  /** Uncompleted jobs that still have attempts left, counted per kind. */
  Map<String, Long> countPendingByKind(int maxAttempts);

  /** Uncompleted jobs that have used up their attempts, most recently failed first. */
  List<Job> listDeadLetter(int maxAttempts, int limit);

  /**
   * Gives a dead-lettered job a fresh set of attempts, due immediately.
   *
   * @return false when the job does not exist, is completed, or still has attempts left
   */
  boolean requeue(UUID jobId, int maxAttempts, Instant now);
}
