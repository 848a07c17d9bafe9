package dev.openclaw.jobs;

import dev.openclaw.jobs.config.JobsConfig;
import dev.openclaw.jobs.database.JobStore;
import dev.openclaw.jobs.database.ScheduleStore;
import dev.openclaw.jobs.database.SystemDatabase;
import dev.openclaw.jobs.execution.ScheduleEnqueuer;
import dev.openclaw.jobs.job.EnqueueResult;
import dev.openclaw.jobs.job.Job;
import dev.openclaw.jobs.schedule.ScheduleService;
import dev.openclaw.jobs.schedule.ScheduleValidator;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

import com.zaxxer.hikari.HikariDataSource;

/**
 * JobsClient lets producers and operators work with the job queue without running a worker:
 * enqueue jobs, inspect and requeue dead letters, and administer schedules.
 */
public class JobsClient implements AutoCloseable {

  private final JobStore jobs;
  private final AutoCloseable closeable;
  private final ScheduleService schedules;
  private final ScheduleEnqueuer enqueuer;
  private final Clock clock;
  private final int maxAttempts;

  /**
   * Construct a JobsClient, by providing database access credentials
   *
   * @param url JDBC URL of the database holding the job tables
   * @param user database user
   * @param password database password
   */
  public JobsClient(String url, String user, String password) {
    this(url, user, password, null);
  }

  /**
   * Construct a JobsClient, by providing database access credentials
   *
   * @param url JDBC URL of the database holding the job tables
   * @param user database user
   * @param password database password
   * @param schema schema of the job tables
   */
  public JobsClient(String url, String user, String password, String schema) {
    this(
        new SystemDatabase(url, user, password, schema),
        JobsConfig.defaults(),
        Clock.systemUTC());
  }

  /**
   * Construct a JobsClient, by providing a configured data source
   *
   * @param dataSource pool connected to the database holding the job tables
   */
  public JobsClient(HikariDataSource dataSource) {
    this(dataSource, null);
  }

  public JobsClient(HikariDataSource dataSource, String schema) {
    this(new SystemDatabase(dataSource, schema), JobsConfig.defaults(), Clock.systemUTC());
  }

  /** Uses the pool or credentials, schema, attempt ceiling and webhook policy of {@code config}. */
  public JobsClient(JobsConfig config) {
    this(new SystemDatabase(config), config, Clock.systemUTC());
  }

  private JobsClient(SystemDatabase database, JobsConfig config, Clock clock) {
    this(database, database, database, config, clock);
  }

  /** Client over caller-provided stores, e.g. an {@code InMemoryJobStore}. */
  public <S extends JobStore & ScheduleStore> JobsClient(S store, JobsConfig config, Clock clock) {
    this(store, store, null, config, clock);
  }

  private JobsClient(
      JobStore jobs,
      ScheduleStore scheduleStore,
      AutoCloseable closeable,
      JobsConfig config,
      Clock clock) {
    this.jobs = Objects.requireNonNull(jobs);
    Objects.requireNonNull(scheduleStore);
    this.closeable = closeable;
    this.clock = Objects.requireNonNull(clock);
    this.maxAttempts = config.maxAttempts();
    this.schedules =
        new ScheduleService(
            scheduleStore, jobs, new ScheduleValidator(config.allowInsecureWebhooks()), clock);
    this.enqueuer = new ScheduleEnqueuer(scheduleStore, jobs, clock);
  }

  @Override
  public void close() throws Exception {
    if (closeable != null) {
      closeable.close();
    }
  }

  /** Enqueues a job that is due immediately. */
  public EnqueueResult enqueue(String kind, Map<String, Object> payload) {
    return enqueue(kind, payload, null, null);
  }

  /**
   * Enqueues a job unless one with the same kind and idempotency key exists, in which case the
   * existing job is returned.
   */
  public EnqueueResult enqueue(String kind, Map<String, Object> payload, String idempotencyKey) {
    return enqueue(kind, payload, idempotencyKey, null);
  }

  /**
   * Enqueues a job.
   *
   * @param kind handler selector
   * @param payload handed to the handler unchanged
   * @param idempotencyKey optional; repeated enqueues with the same kind and key return the first
   *     job
   * @param runAt earliest time the job may run; {@code null} for now
   */
  public EnqueueResult enqueue(
      String kind, Map<String, Object> payload, String idempotencyKey, Instant runAt) {
    if (Objects.requireNonNull(kind, "kind must not be null").isBlank()) {
      throw new IllegalArgumentException("kind must not be blank");
    }
    var now = clock.instant();
    return jobs.enqueue(
        kind,
        payload == null ? Map.of() : payload,
        runAt == null ? now : runAt,
        idempotencyKey,
        now);
  }

  public Optional<Job> getJob(UUID jobId) {
    return jobs.getJob(jobId);
  }

  public Map<String, Long> pendingCounts() {
    return jobs.countPendingByKind(maxAttempts);
  }

  public List<Job> deadLetters(int limit) {
    return jobs.listDeadLetter(maxAttempts, limit);
  }

  public boolean requeue(UUID jobId) {
    return jobs.requeue(jobId, maxAttempts, clock.instant());
  }

  public ScheduleService schedules() {
    return schedules;
  }

  /** Runs one enqueuer pass over the due schedules and returns the number of jobs created. */
  public int enqueueDueSchedules() {
    return enqueuer.enqueueDue();
  }
}
