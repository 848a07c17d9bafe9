package dev.openclaw.jobs.execution;

import java.time.Clock;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Runs the {@link ScheduleEnqueuer} at the top of every minute while the runtime is up. */
public class SchedulerService implements JobsLifecycleListener {

  private static final Logger logger = LoggerFactory.getLogger(SchedulerService.class);

  private final ScheduleEnqueuer enqueuer;
  private final Clock clock;
  private final AtomicReference<ScheduledExecutorService> scheduler = new AtomicReference<>();

  public SchedulerService(ScheduleEnqueuer enqueuer, Clock clock) {
    this.enqueuer = Objects.requireNonNull(enqueuer);
    this.clock = Objects.requireNonNull(clock);
  }

  @Override
  public void jobsLaunched() {
    if (this.scheduler.get() == null) {
      var scheduler =
          Executors.newSingleThreadScheduledExecutor(
              r -> {
                var t = new Thread(r, "ScheduleEnqueuer");
                t.setDaemon(true);
                return t;
              });
      if (this.scheduler.compareAndSet(null, scheduler)) {
        logger.info("Scheduler service started");
        scheduleNextTick();
      } else {
        scheduler.shutdown();
      }
    }
  }

  @Override
  public void jobsShutDown() {
    var scheduler = this.scheduler.getAndSet(null);
    if (scheduler != null) {
      List<Runnable> notRun = scheduler.shutdownNow();
      logger.debug("Shutting down scheduler service. Tasks not run {}", notRun.size());
    }
  }

  public boolean isRunning() {
    return scheduler.get() != null;
  }

  /** Delay until the start of the next wall-clock minute. */
  Duration delayToNextMinute() {
    var now = clock.instant();
    var nextMinute = now.truncatedTo(ChronoUnit.MINUTES).plus(1, ChronoUnit.MINUTES);
    return Duration.between(now, nextMinute);
  }

  private void scheduleNextTick() {
    var localScheduler = scheduler.get();
    if (localScheduler == null) {
      return;
    }
    var delay = delayToNextMinute();
    logger.debug("Next schedule tick in {} ms", delay.toMillis());
    try {
      localScheduler.schedule(this::tick, delay.toMillis(), TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException e) {
      logger.debug("Scheduler service shut down, tick not scheduled");
    }
  }

  private void tick() {
    // shut down between scheduling and firing
    if (scheduler.get() == null) {
      return;
    }
    try {
      int created = enqueuer.enqueueDue();
      if (created > 0) {
        logger.info("Schedule tick created {} jobs", created);
      }
    } catch (Exception e) {
      logger.error("Schedule tick failed", e);
    } finally {
      scheduleNextTick();
    }
  }
}
