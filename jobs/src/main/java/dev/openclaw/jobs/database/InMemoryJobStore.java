package dev.openclaw.jobs.database;

import dev.openclaw.jobs.exceptions.NonExistentScheduleException;
import dev.openclaw.jobs.exceptions.ScheduleConflictException;
import dev.openclaw.jobs.job.EnqueueResult;
import dev.openclaw.jobs.job.Job;
import dev.openclaw.jobs.schedule.PurgeResult;
import dev.openclaw.jobs.schedule.RunStatus;
import dev.openclaw.jobs.schedule.Schedule;
import dev.openclaw.jobs.schedule.ScheduleFilter;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

import org.jspecify.annotations.Nullable;

/**
 * Process-local implementation of both stores. Claiming is a compare-and-set on the job map: a
 * worker only owns a job if its locked copy replaced exactly the unlocked version it read, so two
 * workers racing for the same job cannot both win.
 */
public class InMemoryJobStore implements JobStore, ScheduleStore {

  private final ConcurrentHashMap<UUID, Job> jobs = new ConcurrentHashMap<>();
  private final Map<UUID, Schedule> schedules = new LinkedHashMap<>();
  private final Object enqueueLock = new Object();

  @Override
  public EnqueueResult enqueue(
      String kind,
      Map<String, Object> payload,
      Instant runAt,
      @Nullable String idempotencyKey,
      Instant now) {
    var job =
        Job.create(
            UUID.randomUUID(),
            kind,
            payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload)),
            runAt,
            idempotencyKey,
            now);
    if (idempotencyKey == null) {
      jobs.put(job.id(), job);
      return new EnqueueResult(job, true);
    }
    synchronized (enqueueLock) {
      for (var existing : jobs.values()) {
        if (existing.kind().equals(kind) && idempotencyKey.equals(existing.idempotencyKey())) {
          return new EnqueueResult(existing, false);
        }
      }
      jobs.put(job.id(), job);
      return new EnqueueResult(job, true);
    }
  }

  @Override
  public Optional<Job> claimNext(
      String workerId, Instant now, Duration staleAfter, int maxAttempts) {
    var candidates =
        jobs.values().stream()
            .filter(j -> j.isClaimable(now, staleAfter, maxAttempts))
            .sorted(Comparator.comparing(Job::runAt).thenComparing(Job::createdAt))
            .toList();
    for (var candidate : candidates) {
      var locked = candidate.withLock(now, workerId);
      if (jobs.replace(candidate.id(), candidate, locked)) {
        return Optional.of(locked);
      }
    }
    return Optional.empty();
  }

  @Override
  public boolean complete(UUID jobId, String workerId, Instant now) {
    return updateIfOwned(jobId, workerId, job -> job.withCompleted(now));
  }

  @Override
  public boolean fail(UUID jobId, String workerId, String error, Instant now, Instant retryAt) {
    return updateIfOwned(
        jobId, workerId, job -> job.withFailure(job.attempts() + 1, error, retryAt, now));
  }

  @Override
  public boolean failPermanently(
      UUID jobId, String workerId, String error, Instant now, int maxAttempts) {
    return updateIfOwned(
        jobId,
        workerId,
        job -> job.withFailure(Math.max(job.attempts() + 1, maxAttempts), error, job.runAt(), now));
  }

  private boolean updateIfOwned(UUID jobId, String workerId, UnaryOperator<Job> update) {
    while (true) {
      var current = jobs.get(jobId);
      if (current == null || current.isCompleted() || !workerId.equals(current.lockedBy())) {
        return false;
      }
      if (jobs.replace(jobId, current, update.apply(current))) {
        return true;
      }
    }
  }

  @Override
  public Optional<Job> getJob(UUID jobId) {
    return Optional.ofNullable(jobs.get(jobId));
  }

  @Override
  public Map<String, Long> countPendingByKind(int maxAttempts) {
    var counts = new TreeMap<String, Long>();
    for (var job : jobs.values()) {
      if (!job.isCompleted() && job.attempts() < maxAttempts) {
        counts.merge(job.kind(), 1L, Long::sum);
      }
    }
    return new LinkedHashMap<>(counts);
  }

  @Override
  public List<Job> listDeadLetter(int maxAttempts, int limit) {
    return jobs.values().stream()
        .filter(j -> !j.isCompleted() && j.attempts() >= maxAttempts)
        .sorted(Comparator.comparing(Job::updatedAt).reversed())
        .limit(limit)
        .toList();
  }

  @Override
  public boolean requeue(UUID jobId, int maxAttempts, Instant now) {
    while (true) {
      var current = jobs.get(jobId);
      if (current == null || current.isCompleted() || current.attempts() < maxAttempts) {
        return false;
      }
      if (jobs.replace(jobId, current, current.withRequeued(now))) {
        return true;
      }
    }
  }

  @Override
  public synchronized Schedule insertSchedule(Schedule schedule) {
    checkUnique(schedule);
    schedules.put(schedule.id(), schedule);
    return schedule;
  }

  @Override
  public synchronized Optional<Schedule> getSchedule(UUID scheduleId) {
    return Optional.ofNullable(schedules.get(scheduleId));
  }

  @Override
  public synchronized List<Schedule> listSchedules(ScheduleFilter filter) {
    return schedules.values().stream()
        .filter(s -> filter.skillId() == null || filter.skillId().equals(s.skillId()))
        .filter(s -> filter.enabled() == null || filter.enabled() == s.enabled())
        .sorted(Comparator.comparing(Schedule::createdAt).thenComparing(Schedule::id))
        .skip(filter.offset())
        .limit(filter.limit())
        .toList();
  }

  @Override
  public synchronized Schedule updateSchedule(Schedule schedule) {
    var current = schedules.get(schedule.id());
    if (current == null) {
      throw new NonExistentScheduleException(schedule.id());
    }
    checkUnique(schedule);
    var updated =
        new Schedule(
            current.id(),
            current.skillId(),
            current.collection(),
            schedule.cronExpression(),
            schedule.timezone(),
            schedule.webhookUrl(),
            schedule.webhookHeaders(),
            schedule.payloadTemplate(),
            schedule.enabled(),
            schedule.maxRetries(),
            current.consecutiveFailures(),
            current.lastRunAt(),
            current.lastRunStatus(),
            schedule.nextRunAt(),
            current.createdAt(),
            schedule.updatedAt());
    schedules.put(updated.id(), updated);
    return updated;
  }

  @Override
  public synchronized boolean deleteSchedule(UUID scheduleId) {
    return schedules.remove(scheduleId) != null;
  }

  @Override
  public synchronized List<Schedule> listDueSchedules(Instant now) {
    return schedules.values().stream()
        .filter(s -> s.enabled() && s.nextRunAt() != null && !s.nextRunAt().isAfter(now))
        .sorted(Comparator.comparing(Schedule::nextRunAt).thenComparing(Schedule::id))
        .toList();
  }

  @Override
  public synchronized boolean recordEnqueued(
      UUID scheduleId, Instant expectedNextRunAt, Instant nextRunAt, Instant enqueuedAt) {
    var current = schedules.get(scheduleId);
    if (current == null || !Objects.equals(current.nextRunAt(), expectedNextRunAt)) {
      return false;
    }
    schedules.put(scheduleId, current.withRunStarted(enqueuedAt, nextRunAt));
    return true;
  }

  @Override
  public synchronized boolean advanceNextRun(
      UUID scheduleId, Instant expectedNextRunAt, Instant nextRunAt, Instant now) {
    var current = schedules.get(scheduleId);
    if (current == null || !Objects.equals(current.nextRunAt(), expectedNextRunAt)) {
      return false;
    }
    schedules.put(scheduleId, current.withNextRunAt(nextRunAt, now));
    return true;
  }

  @Override
  public synchronized boolean recordRunResult(
      UUID scheduleId, RunStatus status, Instant runAt, Instant now) {
    var current = schedules.get(scheduleId);
    if (current == null) {
      return false;
    }
    schedules.put(scheduleId, current.withRunResult(status, runAt, now));
    return true;
  }

  @Override
  public synchronized PurgeResult purgeSkill(String skillId) {
    int schedulesDeleted = 0;
    for (var it = schedules.values().iterator(); it.hasNext(); ) {
      if (it.next().skillId().equals(skillId)) {
        it.remove();
        schedulesDeleted++;
      }
    }
    int jobsDeleted = 0;
    for (var job : new ArrayList<>(jobs.values())) {
      if (!job.isCompleted()
          && skillId.equals(job.payload().get(Schedule.SKILL_ID_KEY))
          && jobs.remove(job.id(), job)) {
        jobsDeleted++;
      }
    }
    return new PurgeResult(skillId, schedulesDeleted, jobsDeleted);
  }

  /** Same partitioning as the database: a null collection only collides with another null. */
  private void checkUnique(Schedule candidate) {
    for (var existing : schedules.values()) {
      if (!existing.id().equals(candidate.id())
          && existing.skillId().equals(candidate.skillId())
          && Objects.equals(existing.collection(), candidate.collection())
          && existing.cronExpression().equals(candidate.cronExpression())) {
        throw new ScheduleConflictException(
            candidate.skillId(), candidate.collection(), candidate.cronExpression());
      }
    }
  }
}
