package dev.openclaw.jobs;

public class Constants {

  public static final String DB_SCHEMA = "openclaw_jobs";
  public static final String POSTGRES_DEFAULT_DB = "postgres";

  public static final String POSTGRES_PASSWORD_ENV_VAR = "PGPASSWORD";
  public static final String POSTGRES_USER_ENV_VAR = "PGUSER";
  public static final String JDBC_URL_ENV_VAR = "JOBS_JDBC_URL";
  public static final String POLL_INTERVAL_ENV_VAR = "JOBS_WORKER_POLL_INTERVAL_MS";
  public static final String WORKER_THREADS_ENV_VAR = "JOBS_WORKER_THREADS";

  public static final String SCHEDULED_PROCESS_KIND = "skill_store.scheduled_process";

  /** Channel the {@code internal_job} insert trigger notifies. */
  public static final String JOB_NOTIFY_CHANNEL = "openclaw_internal_job";

  public static final int DEFAULT_MAX_ATTEMPTS = 5;
  public static final int DEFAULT_SCHEDULE_MAX_RETRIES = 5;
  public static final int MAX_SCHEDULE_MAX_RETRIES = 20;
  public static final int MIN_SCHEDULE_INTERVAL_MINUTES = 5;
  public static final String DEFAULT_TIMEZONE = "UTC";
}
