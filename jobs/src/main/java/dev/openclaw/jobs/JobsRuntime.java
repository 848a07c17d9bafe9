package dev.openclaw.jobs;

import dev.openclaw.jobs.config.JobsConfig;
import dev.openclaw.jobs.database.JobStore;
import dev.openclaw.jobs.database.ScheduleStore;
import dev.openclaw.jobs.database.SystemDatabase;
import dev.openclaw.jobs.execution.HandlerRegistry;
import dev.openclaw.jobs.execution.JobDispatcher;
import dev.openclaw.jobs.execution.JobHandler;
import dev.openclaw.jobs.execution.JobsLifecycleListener;
import dev.openclaw.jobs.execution.ScheduleEnqueuer;
import dev.openclaw.jobs.execution.ScheduleFeedback;
import dev.openclaw.jobs.execution.SchedulerService;
import dev.openclaw.jobs.migrations.MigrationManager;
import dev.openclaw.jobs.schedule.ScheduleService;
import dev.openclaw.jobs.schedule.ScheduleValidator;
import dev.openclaw.jobs.webhook.ScheduledProcessHandler;
import dev.openclaw.jobs.webhook.WebhookClient;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A worker process: the job dispatcher plus, when enabled, the minute scheduler that turns due
 * schedules into jobs. Against Postgres the dispatcher is also woken by job insert notifications.
 * Handlers are registered before {@link #launch()}; the {@code skill_store.scheduled_process}
 * handler is registered by default.
 */
public class JobsRuntime implements AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(JobsRuntime.class);

  private final JobsConfig config;
  private final JobStore jobs;
  private final ScheduleStore scheduleStore;
  private final AutoCloseable closeable;
  private final Clock clock;
  private final HandlerRegistry handlers = new HandlerRegistry();
  private final List<JobsLifecycleListener> listeners = new ArrayList<>();
  private final List<JobsLifecycleListener> active = new ArrayList<>();

  private final JobDispatcher dispatcher;
  private final ScheduleEnqueuer enqueuer;
  private final ScheduleService scheduleService;
  private boolean launched = false;
  private volatile boolean migrated;

  /**
   * Runtime over Postgres. When {@link JobsConfig#migrate()} is set the database is created if
   * missing and migrated before the connection pool opens.
   */
  public JobsRuntime(JobsConfig config) {
    this(config, openSystemDatabase(config), Clock.systemUTC(), true);
    this.migrated = config.migrate();
  }

  /** Runtime over caller-provided stores, e.g. an {@code InMemoryJobStore}. */
  public <S extends JobStore & ScheduleStore> JobsRuntime(JobsConfig config, S store, Clock clock) {
    this(config, store, clock, false);
  }

  private <S extends JobStore & ScheduleStore> JobsRuntime(
      JobsConfig config, S store, Clock clock, boolean ownsStore) {
    this.config = Objects.requireNonNull(config, "JobsConfig must not be null");
    this.jobs = Objects.requireNonNull(store);
    this.scheduleStore = store;
    this.closeable = ownsStore && store instanceof AutoCloseable ac ? ac : null;
    this.clock = Objects.requireNonNull(clock);

    var timeout =
        config.handlerTimeout().compareTo(WebhookClient.DEFAULT_TIMEOUT) < 0
            ? config.handlerTimeout()
            : WebhookClient.DEFAULT_TIMEOUT;
    handlers.register(
        Constants.SCHEDULED_PROCESS_KIND,
        new ScheduledProcessHandler(scheduleStore, new WebhookClient(timeout), clock));

    var feedback = new ScheduleFeedback(scheduleStore, clock);
    dispatcher = new JobDispatcher(jobs, handlers, feedback, config, clock);
    enqueuer = new ScheduleEnqueuer(scheduleStore, jobs, clock);
    scheduleService =
        new ScheduleService(
            scheduleStore, jobs, new ScheduleValidator(config.allowInsecureWebhooks()), clock);
  }

  public synchronized JobsRuntime registerHandler(String kind, JobHandler handler) {
    if (launched) {
      throw new IllegalStateException("Cannot register a handler after launch");
    }
    handlers.register(kind, handler);
    return this;
  }

  public synchronized JobsRuntime registerLifecycleListener(JobsLifecycleListener listener) {
    if (launched) {
      throw new IllegalStateException("Cannot register a lifecycle listener after launch");
    }
    listeners.add(Objects.requireNonNull(listener));
    return this;
  }

  /** Runs migrations if configured, then starts the dispatcher, scheduler and listeners. */
  public synchronized void launch() {
    if (launched) {
      logger.warn("Jobs runtime already launched");
      return;
    }
    logger.info("Launching jobs runtime with {}", config);

    migrate();

    active.add(dispatcher);
    if (jobs instanceof SystemDatabase db) {
      active.add(db.newNotificationListener(dispatcher::wakeUp));
    }
    if (config.schedulerEnabled()) {
      active.add(new SchedulerService(enqueuer, clock));
    }
    active.addAll(listeners);

    for (var listener : active) {
      listener.jobsLaunched();
    }
    launched = true;
    logger.info("Jobs runtime launched, worker {}", dispatcher.workerId());
  }

  public synchronized void shutdown() {
    if (!launched) {
      return;
    }
    for (int i = active.size() - 1; i >= 0; i--) {
      var listener = active.get(i);
      try {
        listener.jobsShutDown();
      } catch (RuntimeException e) {
        logger.warn("Lifecycle listener {} failed to shut down", listener, e);
      }
    }
    active.clear();
    launched = false;
    logger.info("Jobs runtime shut down");
  }

  @Override
  public void close() throws Exception {
    shutdown();
    dispatcher.close();
    if (closeable != null) {
      closeable.close();
    }
  }

  public synchronized boolean isLaunched() {
    return launched;
  }

  /** Usable before launch for one-off passes, e.g. {@code processAvailable}. */
  public JobDispatcher dispatcher() {
    return dispatcher;
  }

  public ScheduleEnqueuer enqueuer() {
    return enqueuer;
  }

  public ScheduleService schedules() {
    return scheduleService;
  }

  /**
   * Runs migrations when configured against Postgres and not already run by the constructor.
   * {@link #launch()} calls this.
   */
  public void migrate() {
    if (config.migrate() && jobs instanceof SystemDatabase && !migrated) {
      MigrationManager.runMigrations(config);
      migrated = true;
    }
  }

  private static SystemDatabase openSystemDatabase(JobsConfig config) {
    Objects.requireNonNull(config, "JobsConfig must not be null");
    if (config.migrate()) {
      MigrationManager.runMigrations(config);
    }
    return new SystemDatabase(config);
  }
}
