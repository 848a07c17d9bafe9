package dev.openclaw.jobs.execution;

import dev.openclaw.jobs.Constants;
import dev.openclaw.jobs.database.ScheduleStore;
import dev.openclaw.jobs.job.Job;
import dev.openclaw.jobs.schedule.RunStatus;
import dev.openclaw.jobs.schedule.Schedule;

import java.time.Clock;
import java.util.Objects;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the outcome of a {@code skill_store.scheduled_process} job back to the schedule that
 * produced it. {@code last_run_at} is the time the job was claimed.
 */
public class ScheduleFeedback {

  private static final Logger logger = LoggerFactory.getLogger(ScheduleFeedback.class);

  private final ScheduleStore schedules;
  private final Clock clock;

  public ScheduleFeedback(ScheduleStore schedules, Clock clock) {
    this.schedules = Objects.requireNonNull(schedules);
    this.clock = Objects.requireNonNull(clock);
  }

  public void record(Job job, RunStatus status) {
    if (!Constants.SCHEDULED_PROCESS_KIND.equals(job.kind())) {
      return;
    }
    var scheduleId = scheduleId(job);
    if (scheduleId == null) {
      logger.debug("Job {} carries no schedule id, nothing to record", job.id());
      return;
    }
    var runAt = job.lockedAt() != null ? job.lockedAt() : clock.instant();
    if (!schedules.recordRunResult(scheduleId, status, runAt, clock.instant())) {
      logger.debug("Schedule {} for job {} no longer exists", scheduleId, job.id());
    }
  }

  public static UUID scheduleId(Job job) {
    var value = job.payload().get(Schedule.SCHEDULE_ID_KEY);
    if (value == null) {
      return null;
    }
    try {
      return UUID.fromString(value.toString());
    } catch (IllegalArgumentException e) {
      logger.warn("Job {} has malformed schedule id {}", job.id(), value);
      return null;
    }
  }
}
