package dev.openclaw.jobs.database;

import dev.openclaw.jobs.schedule.PurgeResult;
import dev.openclaw.jobs.schedule.RunStatus;
import dev.openclaw.jobs.schedule.Schedule;
import dev.openclaw.jobs.schedule.ScheduleFilter;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/** Durable registry of schedules. */
public interface ScheduleStore {

  /**
   * @throws dev.openclaw.jobs.exceptions.ScheduleConflictException when a schedule with the same
   *     skill, collection and cron expression exists
   */
  Schedule insertSchedule(Schedule schedule);

  Optional<Schedule> getSchedule(UUID scheduleId);

  List<Schedule> listSchedules(ScheduleFilter filter);

  /**
   * Replaces the administrative fields of a schedule (cron, timezone, webhook, template, enabled,
   * max retries, next run). Run history is left alone.
   *
   * @throws dev.openclaw.jobs.exceptions.NonExistentScheduleException when the schedule is gone
   * @throws dev.openclaw.jobs.exceptions.ScheduleConflictException on a uniqueness violation
   */
  Schedule updateSchedule(Schedule schedule);

  boolean deleteSchedule(UUID scheduleId);

  /** Enabled schedules with {@code next_run_at <= now}, earliest first. */
  List<Schedule> listDueSchedules(Instant now);

  /**
   * Marks a run as started and advances {@code next_run_at}, provided {@code next_run_at} still
   * equals {@code expectedNextRunAt}.
   */
  boolean recordEnqueued(
      UUID scheduleId, Instant expectedNextRunAt, Instant nextRunAt, Instant enqueuedAt);

  /** Advances {@code next_run_at} if it still equals {@code expectedNextRunAt}. */
  boolean advanceNextRun(
      UUID scheduleId, Instant expectedNextRunAt, Instant nextRunAt, Instant now);

  /**
   * Applies a job outcome: success resets {@code consecutive_failures}, failure increments it,
   * skipped leaves it unchanged.
   */
  boolean recordRunResult(UUID scheduleId, RunStatus status, Instant runAt, Instant now);

  /** Deletes every schedule of the skill and the skill's uncompleted jobs. */
  PurgeResult purgeSkill(String skillId);
}
