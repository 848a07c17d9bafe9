package dev.openclaw.jobs.execution;

import dev.openclaw.jobs.Constants;
import dev.openclaw.jobs.database.JobStore;
import dev.openclaw.jobs.database.ScheduleStore;
import dev.openclaw.jobs.schedule.Schedule;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.HexFormat;
import java.util.Objects;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns due schedules into {@code skill_store.scheduled_process} jobs. Safe to run concurrently
 * and to re-run after a crash: each schedule gets at most one job per minute, enforced by the
 * job store's idempotency key rather than by locking.
 */
public class ScheduleEnqueuer {

  private static final Logger logger = LoggerFactory.getLogger(ScheduleEnqueuer.class);

  /** A run without an outcome blocks the next one for this long, then counts as stuck. */
  public static final Duration OVERLAP_WINDOW = Duration.ofHours(1);

  private final ScheduleStore schedules;
  private final JobStore jobs;
  private final Clock clock;

  public ScheduleEnqueuer(ScheduleStore schedules, JobStore jobs, Clock clock) {
    this.schedules = Objects.requireNonNull(schedules);
    this.jobs = Objects.requireNonNull(jobs);
    this.clock = Objects.requireNonNull(clock);
  }

  /**
   * Evaluates every enabled schedule whose next run is due.
   *
   * @return the number of jobs created by this call
   */
  public int enqueueDue() {
    var now = clock.instant();
    var due = schedules.listDueSchedules(now);
    int created = 0;
    for (var schedule : due) {
      try {
        if (enqueue(schedule, now)) {
          created++;
        }
      } catch (RuntimeException e) {
        logger.error("Failed to enqueue schedule {}", schedule.id(), e);
      }
    }
    if (!due.isEmpty()) {
      logger.debug("{} schedules due, {} jobs created", due.size(), created);
    }
    return created;
  }

  private boolean enqueue(Schedule schedule, Instant now) {
    if (schedule.isCircuitOpen()) {
      logger.warn(
          "Skipping schedule {}: {} consecutive failures reached max_retries {}",
          schedule.id(),
          schedule.consecutiveFailures(),
          schedule.maxRetries());
      return false;
    }
    if (schedule.isRunInFlight(now, OVERLAP_WINDOW)) {
      logger.warn(
          "Skipping schedule {}: run started at {} has not finished",
          schedule.id(),
          schedule.lastRunAt());
      return false;
    }

    var next = schedule.nextRunAfter(now);
    var result =
        jobs.enqueue(
            Constants.SCHEDULED_PROCESS_KIND,
            schedule.jobPayload(),
            now,
            idempotencyKey(schedule.id(), now),
            now);

    if (result.created()) {
      schedules.recordEnqueued(schedule.id(), schedule.nextRunAt(), next, now);
      logger.info(
          "Enqueued job {} for schedule {}, next run {}", result.job().id(), schedule.id(), next);
      return true;
    }

    // an earlier pass in this minute already produced the job
    schedules.advanceNextRun(schedule.id(), schedule.nextRunAt(), next, now);
    logger.debug(
        "Schedule {} already enqueued this minute as job {}", schedule.id(), result.job().id());
    return false;
  }

  /** Hex SHA-256 of the schedule id and the minute {@code at} falls in. */
  public static String idempotencyKey(UUID scheduleId, Instant at) {
    var minute = at.truncatedTo(ChronoUnit.MINUTES);
    try {
      var digest = MessageDigest.getInstance("SHA-256");
      var hash = digest.digest((scheduleId + ":" + minute).getBytes(StandardCharsets.UTF_8));
      return HexFormat.of().formatHex(hash);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 is not available", e);
    }
  }
}
