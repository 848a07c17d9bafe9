package dev.openclaw.jobs.config;

import dev.openclaw.jobs.Constants;

import java.time.Duration;
import java.util.Objects;

import com.zaxxer.hikari.HikariDataSource;

public record JobsConfig(
    String databaseUrl,
    String dbUser,
    String dbPassword,
    int maximumPoolSize,
    int connectionTimeout,
    HikariDataSource dataSource,
    String databaseSchema,
    boolean migrate,
    String workerId,
    int workerThreads,
    Duration pollInterval,
    int batchSize,
    Duration staleLockTimeout,
    Duration handlerTimeout,
    int maxAttempts,
    boolean schedulerEnabled,
    boolean allowInsecureWebhooks) {

  public JobsConfig {
    Objects.requireNonNull(pollInterval, "JobsConfig.pollInterval must not be null");
    Objects.requireNonNull(staleLockTimeout, "JobsConfig.staleLockTimeout must not be null");
    Objects.requireNonNull(handlerTimeout, "JobsConfig.handlerTimeout must not be null");
    if (workerId != null && workerId.isEmpty()) {
      throw new IllegalArgumentException("JobsConfig.workerId must not be empty if specified");
    }
    if (workerThreads <= 0) {
      throw new IllegalArgumentException("JobsConfig.workerThreads must be greater than zero");
    }
    if (batchSize <= 0) {
      throw new IllegalArgumentException("JobsConfig.batchSize must be greater than zero");
    }
    if (maxAttempts <= 0) {
      throw new IllegalArgumentException("JobsConfig.maxAttempts must be greater than zero");
    }
    if (pollInterval.isNegative() || pollInterval.isZero()) {
      throw new IllegalArgumentException("JobsConfig.pollInterval must be positive");
    }
    if (handlerTimeout.isNegative() || handlerTimeout.isZero()) {
      throw new IllegalArgumentException("JobsConfig.handlerTimeout must be positive");
    }
    // a claim must outlive the handler that holds it
    if (staleLockTimeout.compareTo(handlerTimeout) <= 0) {
      throw new IllegalArgumentException(
          "JobsConfig.staleLockTimeout must be longer than JobsConfig.handlerTimeout");
    }
  }

  public static JobsConfig defaults() {
    return new JobsConfig(
        null,
        null,
        null,
        5, // maximumPoolSize default
        30000, // connectionTimeout default
        null,
        Constants.DB_SCHEMA,
        true, // migrate
        null,
        1, // workerThreads
        Duration.ofSeconds(30),
        10, // batchSize
        Duration.ofMinutes(5),
        Duration.ofSeconds(120),
        Constants.DEFAULT_MAX_ATTEMPTS,
        true, // schedulerEnabled
        false);
  }

  public static JobsConfig defaultsFromEnv() {
    String databaseUrl = System.getenv(Constants.JDBC_URL_ENV_VAR);
    String dbUser = System.getenv(Constants.POSTGRES_USER_ENV_VAR);
    if (dbUser == null || dbUser.isEmpty()) dbUser = "postgres";
    String dbPassword = System.getenv(Constants.POSTGRES_PASSWORD_ENV_VAR);
    var config =
        defaults().withDatabaseUrl(databaseUrl).withDbUser(dbUser).withDbPassword(dbPassword);

    String pollMs = System.getenv(Constants.POLL_INTERVAL_ENV_VAR);
    if (pollMs != null && !pollMs.isEmpty()) {
      config = config.withPollInterval(Duration.ofMillis(Long.parseLong(pollMs)));
    }
    String threads = System.getenv(Constants.WORKER_THREADS_ENV_VAR);
    if (threads != null && !threads.isEmpty()) {
      config = config.withWorkerThreads(Integer.parseInt(threads));
    }
    return config;
  }

  public JobsConfig withDatabaseUrl(String v) {
    return new JobsConfig(
        v,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        databaseSchema,
        migrate,
        workerId,
        workerThreads,
        pollInterval,
        batchSize,
        staleLockTimeout,
        handlerTimeout,
        maxAttempts,
        schedulerEnabled,
        allowInsecureWebhooks);
  }

  public JobsConfig withDbUser(String v) {
    return new JobsConfig(
        databaseUrl,
        v,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        databaseSchema,
        migrate,
        workerId,
        workerThreads,
        pollInterval,
        batchSize,
        staleLockTimeout,
        handlerTimeout,
        maxAttempts,
        schedulerEnabled,
        allowInsecureWebhooks);
  }

  public JobsConfig withDbPassword(String v) {
    return new JobsConfig(
        databaseUrl,
        dbUser,
        v,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        databaseSchema,
        migrate,
        workerId,
        workerThreads,
        pollInterval,
        batchSize,
        staleLockTimeout,
        handlerTimeout,
        maxAttempts,
        schedulerEnabled,
        allowInsecureWebhooks);
  }

  public JobsConfig withMaximumPoolSize(int v) {
    return new JobsConfig(
        databaseUrl,
        dbUser,
        dbPassword,
        v,
        connectionTimeout,
        dataSource,
        databaseSchema,
        migrate,
        workerId,
        workerThreads,
        pollInterval,
        batchSize,
        staleLockTimeout,
        handlerTimeout,
        maxAttempts,
        schedulerEnabled,
        allowInsecureWebhooks);
  }

  public JobsConfig withConnectionTimeout(int v) {
    return new JobsConfig(
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        v,
        dataSource,
        databaseSchema,
        migrate,
        workerId,
        workerThreads,
        pollInterval,
        batchSize,
        staleLockTimeout,
        handlerTimeout,
        maxAttempts,
        schedulerEnabled,
        allowInsecureWebhooks);
  }

  public JobsConfig withDataSource(HikariDataSource v) {
    return new JobsConfig(
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        v,
        databaseSchema,
        migrate,
        workerId,
        workerThreads,
        pollInterval,
        batchSize,
        staleLockTimeout,
        handlerTimeout,
        maxAttempts,
        schedulerEnabled,
        allowInsecureWebhooks);
  }

  public JobsConfig withDatabaseSchema(String v) {
    return new JobsConfig(
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        v,
        migrate,
        workerId,
        workerThreads,
        pollInterval,
        batchSize,
        staleLockTimeout,
        handlerTimeout,
        maxAttempts,
        schedulerEnabled,
        allowInsecureWebhooks);
  }

  public JobsConfig withMigrate(boolean v) {
    return new JobsConfig(
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        databaseSchema,
        v,
        workerId,
        workerThreads,
        pollInterval,
        batchSize,
        staleLockTimeout,
        handlerTimeout,
        maxAttempts,
        schedulerEnabled,
        allowInsecureWebhooks);
  }

  public JobsConfig withWorkerId(String v) {
    return new JobsConfig(
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        databaseSchema,
        migrate,
        v,
        workerThreads,
        pollInterval,
        batchSize,
        staleLockTimeout,
        handlerTimeout,
        maxAttempts,
        schedulerEnabled,
        allowInsecureWebhooks);
  }

  public JobsConfig withWorkerThreads(int v) {
    return new JobsConfig(
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        databaseSchema,
        migrate,
        workerId,
        v,
        pollInterval,
        batchSize,
        staleLockTimeout,
        handlerTimeout,
        maxAttempts,
        schedulerEnabled,
        allowInsecureWebhooks);
  }

  public JobsConfig withPollInterval(Duration v) {
    return new JobsConfig(
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        databaseSchema,
        migrate,
        workerId,
        workerThreads,
        v,
        batchSize,
        staleLockTimeout,
        handlerTimeout,
        maxAttempts,
        schedulerEnabled,
        allowInsecureWebhooks);
  }

  public JobsConfig withBatchSize(int v) {
    return new JobsConfig(
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        databaseSchema,
        migrate,
        workerId,
        workerThreads,
        pollInterval,
        v,
        staleLockTimeout,
        handlerTimeout,
        maxAttempts,
        schedulerEnabled,
        allowInsecureWebhooks);
  }

  public JobsConfig withStaleLockTimeout(Duration v) {
    return new JobsConfig(
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        databaseSchema,
        migrate,
        workerId,
        workerThreads,
        pollInterval,
        batchSize,
        v,
        handlerTimeout,
        maxAttempts,
        schedulerEnabled,
        allowInsecureWebhooks);
  }

  public JobsConfig withHandlerTimeout(Duration v) {
    return new JobsConfig(
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        databaseSchema,
        migrate,
        workerId,
        workerThreads,
        pollInterval,
        batchSize,
        staleLockTimeout,
        v,
        maxAttempts,
        schedulerEnabled,
        allowInsecureWebhooks);
  }

  public JobsConfig withMaxAttempts(int v) {
    return new JobsConfig(
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        databaseSchema,
        migrate,
        workerId,
        workerThreads,
        pollInterval,
        batchSize,
        staleLockTimeout,
        handlerTimeout,
        v,
        schedulerEnabled,
        allowInsecureWebhooks);
  }

  public JobsConfig withSchedulerEnabled(boolean v) {
    return new JobsConfig(
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        databaseSchema,
        migrate,
        workerId,
        workerThreads,
        pollInterval,
        batchSize,
        staleLockTimeout,
        handlerTimeout,
        maxAttempts,
        v,
        allowInsecureWebhooks);
  }

  public JobsConfig withAllowInsecureWebhooks(boolean v) {
    return new JobsConfig(
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        databaseSchema,
        migrate,
        workerId,
        workerThreads,
        pollInterval,
        batchSize,
        staleLockTimeout,
        handlerTimeout,
        maxAttempts,
        schedulerEnabled,
        v);
  }

  // Override toString to mask the DB password
  @Override
  public String toString() {
    return "JobsConfig[databaseUrl=%s, dbUser=%s, dbPassword=***, maximumPoolSize=%d, connectionTimeout=%d, dataSource=%s, databaseSchema=%s, migrate=%s, workerId=%s, workerThreads=%d, pollInterval=%s, batchSize=%d, staleLockTimeout=%s, handlerTimeout=%s, maxAttempts=%d, schedulerEnabled=%s, allowInsecureWebhooks=%s]"
        .formatted(
            databaseUrl,
            dbUser,
            maximumPoolSize,
            connectionTimeout,
            dataSource,
            databaseSchema,
            migrate,
            workerId,
            workerThreads,
            pollInterval,
            batchSize,
            staleLockTimeout,
            handlerTimeout,
            maxAttempts,
            schedulerEnabled,
            allowInsecureWebhooks);
  }
}
