package dev.openclaw.jobs.database;

import dev.openclaw.jobs.Constants;
import dev.openclaw.jobs.config.JobsConfig;
import dev.openclaw.jobs.job.EnqueueResult;
import dev.openclaw.jobs.job.Job;
import dev.openclaw.jobs.schedule.PurgeResult;
import dev.openclaw.jobs.schedule.RunStatus;
import dev.openclaw.jobs.schedule.Schedule;
import dev.openclaw.jobs.schedule.ScheduleFilter;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Postgres-backed job queue and schedule registry. */
public class SystemDatabase implements JobStore, ScheduleStore, AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(SystemDatabase.class);

  public static String sanitizeSchema(String schema) {
    schema =
        Objects.requireNonNullElse(schema, Constants.DB_SCHEMA)
            .replace("\0", "")
            .replace("\"", "\"\"");
    return "\"%s\"".formatted(schema);
  }

  private final HikariDataSource dataSource;
  private final boolean ownsDataSource;
  private final String schema;

  private final JobsDAO jobsDAO;
  private final SchedulesDAO schedulesDAO;

  public SystemDatabase(JobsConfig config) {
    this(
        Objects.requireNonNull(config).dataSource() != null
            ? config.dataSource()
            : createDataSource(config),
        config.databaseSchema(),
        config.dataSource() == null);
  }

  /** Opens a pool of its own, closed together with this instance. */
  public SystemDatabase(String url, String user, String password, String schema) {
    this(createDataSource(url, user, password), schema, true);
  }

  /** Uses a caller-owned pool, left open by {@link #close()}. */
  public SystemDatabase(HikariDataSource dataSource, String schema) {
    this(dataSource, schema, false);
  }

  private SystemDatabase(HikariDataSource dataSource, String schema, boolean ownsDataSource) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource must not be null");
    this.ownsDataSource = ownsDataSource;
    this.schema = sanitizeSchema(schema);
    jobsDAO = new JobsDAO(dataSource, this.schema);
    schedulesDAO = new SchedulesDAO(dataSource, this.schema);
  }

  /** A listener on this database's pool that runs {@code onWake} when jobs are inserted. */
  public JobNotificationListener newNotificationListener(Runnable onWake) {
    return new JobNotificationListener(dataSource, onWake);
  }

  String schema() {
    return schema;
  }

  @Override
  public void close() {
    if (ownsDataSource) {
      logger.debug("Closing job store data source");
      dataSource.close();
    }
  }

  @Override
  public EnqueueResult enqueue(
      String kind,
      Map<String, Object> payload,
      Instant runAt,
      String idempotencyKey,
      Instant now) {
    return DbRetry.call(
        () -> {
          return jobsDAO.enqueue(kind, payload, runAt, idempotencyKey, now);
        });
  }

  @Override
  public Optional<Job> claimNext(
      String workerId, Instant now, Duration staleAfter, int maxAttempts) {
    return DbRetry.call(
        () -> {
          return jobsDAO.claimNext(workerId, now, staleAfter, maxAttempts);
        });
  }

  @Override
  public boolean complete(UUID jobId, String workerId, Instant now) {
    return DbRetry.call(
        () -> {
          return jobsDAO.complete(jobId, workerId, now);
        });
  }

  @Override
  public boolean fail(UUID jobId, String workerId, String error, Instant now, Instant retryAt) {
    return DbRetry.call(
        () -> {
          return jobsDAO.fail(jobId, workerId, error, now, retryAt);
        });
  }

  @Override
  public boolean failPermanently(
      UUID jobId, String workerId, String error, Instant now, int maxAttempts) {
    return DbRetry.call(
        () -> {
          return jobsDAO.failPermanently(jobId, workerId, error, now, maxAttempts);
        });
  }

  @Override
  public Optional<Job> getJob(UUID jobId) {
    return DbRetry.call(
        () -> {
          return jobsDAO.getJob(jobId);
        });
  }

  @Override
  public Map<String, Long> countPendingByKind(int maxAttempts) {
    return DbRetry.call(
        () -> {
          return jobsDAO.countPendingByKind(maxAttempts);
        });
  }

  @Override
  public List<Job> listDeadLetter(int maxAttempts, int limit) {
    return DbRetry.call(
        () -> {
          return jobsDAO.listDeadLetter(maxAttempts, limit);
        });
  }

  @Override
  public boolean requeue(UUID jobId, int maxAttempts, Instant now) {
    return DbRetry.call(
        () -> {
          return jobsDAO.requeue(jobId, maxAttempts, now);
        });
  }

  @Override
  public Schedule insertSchedule(Schedule schedule) {
    return DbRetry.call(
        () -> {
          return schedulesDAO.insertSchedule(schedule);
        });
  }

  @Override
  public Optional<Schedule> getSchedule(UUID scheduleId) {
    return DbRetry.call(
        () -> {
          return schedulesDAO.getSchedule(scheduleId);
        });
  }

  @Override
  public List<Schedule> listSchedules(ScheduleFilter filter) {
    return DbRetry.call(
        () -> {
          return schedulesDAO.listSchedules(filter);
        });
  }

  @Override
  public Schedule updateSchedule(Schedule schedule) {
    return DbRetry.call(
        () -> {
          return schedulesDAO.updateSchedule(schedule);
        });
  }

  @Override
  public boolean deleteSchedule(UUID scheduleId) {
    return DbRetry.call(
        () -> {
          return schedulesDAO.deleteSchedule(scheduleId);
        });
  }

  @Override
  public List<Schedule> listDueSchedules(Instant now) {
    return DbRetry.call(
        () -> {
          return schedulesDAO.listDueSchedules(now);
        });
  }

  @Override
  public boolean recordEnqueued(
      UUID scheduleId, Instant expectedNextRunAt, Instant nextRunAt, Instant enqueuedAt) {
    return DbRetry.call(
        () -> {
          return schedulesDAO.recordEnqueued(
              scheduleId, expectedNextRunAt, nextRunAt, enqueuedAt);
        });
  }

  @Override
  public boolean advanceNextRun(
      UUID scheduleId, Instant expectedNextRunAt, Instant nextRunAt, Instant now) {
    return DbRetry.call(
        () -> {
          return schedulesDAO.advanceNextRun(scheduleId, expectedNextRunAt, nextRunAt, now);
        });
  }

  @Override
  public boolean recordRunResult(UUID scheduleId, RunStatus status, Instant runAt, Instant now) {
    return DbRetry.call(
        () -> {
          return schedulesDAO.recordRunResult(scheduleId, status, runAt, now);
        });
  }

  @Override
  public PurgeResult purgeSkill(String skillId) {
    return DbRetry.call(
        () -> {
          return schedulesDAO.purgeSkill(skillId);
        });
  }

  public static HikariDataSource createDataSource(JobsConfig config) {
    Objects.requireNonNull(config, "JobsConfig must not be null");
    return createDataSource(
        config.databaseUrl(),
        config.dbUser(),
        config.dbPassword(),
        config.maximumPoolSize(),
        config.connectionTimeout());
  }

  public static HikariDataSource createDataSource(String url, String user, String password) {
    return createDataSource(url, user, password, 0, 0);
  }

  public static HikariDataSource createDataSource(
      String url, String user, String password, int poolSize, int timeout) {
    HikariConfig hikariConfig = new HikariConfig();
    hikariConfig.setJdbcUrl(url);
    hikariConfig.setUsername(user);
    hikariConfig.setPassword(password);
    hikariConfig.setMaximumPoolSize(poolSize > 0 ? poolSize : 2);
    if (timeout > 0) {
      hikariConfig.setConnectionTimeout(timeout);
    }
    hikariConfig.setPoolName("openclaw-jobs");
    return new HikariDataSource(hikariConfig);
  }
}
