package dev.openclaw.jobs.schedule;

import dev.openclaw.jobs.Constants;
import dev.openclaw.jobs.database.JobStore;
import dev.openclaw.jobs.database.ScheduleStore;
import dev.openclaw.jobs.exceptions.NonExistentScheduleException;
import dev.openclaw.jobs.job.EnqueueResult;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Administrative operations on schedules. */
public class ScheduleService {

  private static final Logger logger = LoggerFactory.getLogger(ScheduleService.class);

  private final ScheduleStore schedules;
  private final JobStore jobs;
  private final ScheduleValidator validator;
  private final Clock clock;

  public ScheduleService(
      ScheduleStore schedules, JobStore jobs, ScheduleValidator validator, Clock clock) {
    this.schedules = Objects.requireNonNull(schedules);
    this.jobs = Objects.requireNonNull(jobs);
    this.validator = Objects.requireNonNull(validator);
    this.clock = Objects.requireNonNull(clock);
  }

  public Schedule create(ScheduleRequest request) {
    validator.validate(request);
    var now = clock.instant();
    var timezone = Objects.requireNonNullElse(request.timezone(), Constants.DEFAULT_TIMEZONE);
    var enabled = Objects.requireNonNullElse(request.enabled(), Boolean.TRUE);
    var cron = CronSpec.parse(request.cronExpression());

    var schedule =
        new Schedule(
            UUID.randomUUID(),
            request.skillId(),
            request.collection(),
            cron.expression(),
            timezone,
            request.webhookUrl(),
            Objects.requireNonNullElse(request.webhookHeaders(), Map.of()),
            Objects.requireNonNullElse(request.payloadTemplate(), Map.of()),
            enabled,
            Objects.requireNonNullElse(
                request.maxRetries(), Constants.DEFAULT_SCHEDULE_MAX_RETRIES),
            0,
            null,
            null,
            cron.nextExecution(now, validator.validateTimezone(timezone)),
            now,
            now);
    var created = schedules.insertSchedule(schedule);
    logger.info(
        "Created schedule {} for skill {} ({} {}), next run {}",
        created.id(),
        created.skillId(),
        created.cronExpression(),
        created.timezone(),
        created.nextRunAt());
    return created;
  }

  /** Applies a partial update; the next run is recomputed when the cron or timezone changes. */
  public Schedule update(UUID scheduleId, ScheduleUpdate update) {
    validator.validate(update);
    var current = get(scheduleId);
    if (update.isEmpty()) {
      return current;
    }
    var now = clock.instant();
    var cronExpression =
        update.cronExpression() == null
            ? current.cronExpression()
            : CronSpec.parse(update.cronExpression()).expression();
    var timezone = Objects.requireNonNullElse(update.timezone(), current.timezone());
    var enabled = Objects.requireNonNullElse(update.enabled(), current.enabled());

    var nextRunAt = current.nextRunAt();
    boolean timingChanged =
        !cronExpression.equals(current.cronExpression()) || !timezone.equals(current.timezone());
    if (timingChanged || (enabled && !current.enabled()) || nextRunAt == null) {
      nextRunAt = nextRun(cronExpression, timezone, now);
    }

    var updated =
        new Schedule(
            current.id(),
            current.skillId(),
            current.collection(),
            cronExpression,
            timezone,
            Objects.requireNonNullElse(update.webhookUrl(), current.webhookUrl()),
            Objects.requireNonNullElse(update.webhookHeaders(), current.webhookHeaders()),
            Objects.requireNonNullElse(update.payloadTemplate(), current.payloadTemplate()),
            enabled,
            Objects.requireNonNullElse(update.maxRetries(), current.maxRetries()),
            current.consecutiveFailures(),
            current.lastRunAt(),
            current.lastRunStatus(),
            nextRunAt,
            current.createdAt(),
            now);
    var saved = schedules.updateSchedule(updated);
    logger.info("Updated schedule {}", scheduleId);
    return saved;
  }

  public Schedule get(UUID scheduleId) {
    return find(scheduleId).orElseThrow(() -> new NonExistentScheduleException(scheduleId));
  }

  public Optional<Schedule> find(UUID scheduleId) {
    return schedules.getSchedule(Objects.requireNonNull(scheduleId));
  }

  public List<Schedule> list(ScheduleFilter filter) {
    return schedules.listSchedules(filter == null ? ScheduleFilter.all() : filter);
  }

  public boolean delete(UUID scheduleId) {
    var deleted = schedules.deleteSchedule(scheduleId);
    if (deleted) {
      logger.info("Deleted schedule {}", scheduleId);
    }
    return deleted;
  }

  public Schedule pause(UUID scheduleId) {
    var current = get(scheduleId);
    if (!current.enabled()) {
      return current;
    }
    var paused = schedules.updateSchedule(current.withEnabled(false, current.nextRunAt(), now()));
    logger.info("Paused schedule {}", scheduleId);
    return paused;
  }

  /** Re-enables a schedule. Runs missed while paused are not replayed. */
  public Schedule resume(UUID scheduleId) {
    var current = get(scheduleId);
    if (current.enabled()) {
      return current;
    }
    var now = now();
    var next = nextRun(current.cronExpression(), current.timezone(), now);
    var resumed = schedules.updateSchedule(current.withEnabled(true, next, now));
    logger.info("Resumed schedule {}, next run {}", scheduleId, next);
    return resumed;
  }

  /**
   * Enqueues a run right away, independent of the cron cadence. The circuit breaker and overlap
   * guard do not apply to manual runs.
   */
  public EnqueueResult trigger(UUID scheduleId) {
    var schedule = get(scheduleId);
    var payload = schedule.jobPayload();
    payload.put(Schedule.MANUAL_TRIGGER_KEY, true);
    var now = now();
    var result = jobs.enqueue(Constants.SCHEDULED_PROCESS_KIND, payload, now, null, now);
    logger.info("Triggered schedule {} as job {}", scheduleId, result.job().id());
    return result;
  }

  /**
   * Hard-deletes every schedule of a skill together with the skill's uncompleted jobs.
   *
   * @throws IllegalArgumentException unless {@code confirm} is set
   */
  public PurgeResult purgeSkill(String skillId, boolean confirm) {
    validator.requireSkillId(skillId);
    if (!confirm) {
      throw new IllegalArgumentException(
          "Purging skill %s is permanent and must be confirmed".formatted(skillId));
    }
    return schedules.purgeSkill(skillId);
  }

  private Instant nextRun(String cronExpression, String timezone, Instant now) {
    return CronSpec.parse(cronExpression).nextExecution(now, validator.validateTimezone(timezone));
  }

  private Instant now() {
    return clock.instant();
  }
}
