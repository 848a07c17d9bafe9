package dev.openclaw.jobs.execution;

import static java.lang.Math.max;
import static java.lang.Math.min;

import dev.openclaw.jobs.config.JobsConfig;
import dev.openclaw.jobs.database.JobStore;
import dev.openclaw.jobs.exceptions.JobTimeoutException;
import dev.openclaw.jobs.exceptions.NonRetryableJobException;
import dev.openclaw.jobs.exceptions.UnknownJobKindException;
import dev.openclaw.jobs.job.Job;
import dev.openclaw.jobs.job.RetryPolicy;
import dev.openclaw.jobs.schedule.RunStatus;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Claims ready jobs and runs the handler registered for their kind. Each poll thread claims under
 * its own worker id, so a stale-lock takeover by one thread is visible to the others through
 * failed {@code complete}/{@code fail} calls.
 */
public class JobDispatcher implements JobsLifecycleListener, AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(JobDispatcher.class);

  private static final double MAX_POLLING_INTERVAL_SEC = 120.0;

  private final JobStore jobs;
  private final HandlerRegistry handlers;
  private final ScheduleFeedback feedback;
  private final RetryPolicy retryPolicy;
  private final Clock clock;
  private final String workerId;
  private final int workerThreads;
  private final int batchSize;
  private final Duration pollInterval;
  private final Duration staleLockTimeout;
  private final Duration handlerTimeout;
  private final ExecutorService handlerExecutor;

  private final List<Thread> pollThreads = new ArrayList<>();
  private final ReentrantLock wakeLock = new ReentrantLock();
  private final Condition wakeCondition = wakeLock.newCondition();
  private long wakeGeneration = 0; // guarded by wakeLock
  private volatile boolean running = false;
  private CountDownLatch shutdownLatch;

  public JobDispatcher(
      JobStore jobs,
      HandlerRegistry handlers,
      ScheduleFeedback feedback,
      JobsConfig config,
      Clock clock) {
    this(jobs, handlers, feedback, config, new RetryPolicy(config.maxAttempts()), clock);
  }

  public JobDispatcher(
      JobStore jobs,
      HandlerRegistry handlers,
      ScheduleFeedback feedback,
      JobsConfig config,
      RetryPolicy retryPolicy,
      Clock clock) {
    this.jobs = Objects.requireNonNull(jobs);
    this.handlers = Objects.requireNonNull(handlers);
    this.feedback = Objects.requireNonNull(feedback);
    this.retryPolicy = Objects.requireNonNull(retryPolicy);
    this.clock = Objects.requireNonNull(clock);
    Objects.requireNonNull(config, "JobsConfig must not be null");
    this.workerId =
        config.workerId() != null
            ? config.workerId()
            : "worker-" + UUID.randomUUID().toString().substring(0, 8);
    this.workerThreads = config.workerThreads();
    this.batchSize = config.batchSize();
    this.pollInterval = config.pollInterval();
    this.staleLockTimeout = config.staleLockTimeout();
    this.handlerTimeout = config.handlerTimeout();

    var counter = new AtomicInteger();
    this.handlerExecutor =
        Executors.newCachedThreadPool(
            r -> {
              var t = new Thread(r, "JobHandler-" + counter.incrementAndGet());
              t.setDaemon(true);
              return t;
            });
  }

  public String workerId() {
    return workerId;
  }

  /**
   * Claims and runs up to {@code limit} jobs on the calling thread, stopping early when nothing is
   * claimable.
   */
  public DispatchStats processAvailable(int limit) {
    return processAvailable(workerId, limit);
  }

  DispatchStats processAvailable(String worker, int limit) {
    var stats = DispatchStats.empty();
    for (int i = 0; i < limit; i++) {
      var result = processNext(worker);
      if (result.isEmpty()) {
        break;
      }
      stats = stats.plus(result.get());
    }
    return stats;
  }

  /** Claims and runs a single job. Empty when no job was claimable. */
  public Optional<DispatchStats> processNext(String worker) {
    var claimed =
        jobs.claimNext(worker, clock.instant(), staleLockTimeout, retryPolicy.maxAttempts());
    if (claimed.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(dispatch(claimed.get(), worker));
  }

  DispatchStats dispatch(Job job, String worker) {
    logger.debug(
        "Worker {} running job {} ({}), attempt {}",
        worker,
        job.id(),
        job.kind(),
        job.attempts() + 1);
    JobOutcome outcome;
    try {
      outcome = runHandler(job);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.warn(
          "Worker {} interrupted while running job {}; lock left to expire", worker, job.id());
      return DispatchStats.failure();
    } catch (Exception e) {
      recordFailure(job, worker, e);
      return DispatchStats.failure();
    }

    if (jobs.complete(job.id(), worker, clock.instant())) {
      feedback.record(job, outcome == JobOutcome.SKIPPED ? RunStatus.SKIPPED : RunStatus.SUCCESS);
      logger.debug("Job {} finished: {}", job.id(), outcome);
    } else {
      logger.warn("Worker {} lost the lock on job {} before completing it", worker, job.id());
    }
    return DispatchStats.of(outcome);
  }

  private JobOutcome runHandler(Job job) throws Exception {
    var handler =
        handlers.find(job.kind()).orElseThrow(() -> new UnknownJobKindException(job.kind()));
    var future = handlerExecutor.submit(() -> handler.handle(job));
    try {
      var outcome = future.get(handlerTimeout.toMillis(), TimeUnit.MILLISECONDS);
      return outcome == null ? JobOutcome.SUCCEEDED : outcome;
    } catch (TimeoutException e) {
      future.cancel(true);
      throw new JobTimeoutException(job.id(), handlerTimeout);
    } catch (ExecutionException e) {
      var cause = e.getCause();
      if (cause instanceof Exception ex) {
        throw ex;
      }
      throw e;
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw e;
    }
  }

  private void recordFailure(Job job, String worker, Exception e) {
    var now = clock.instant();
    var error = describe(e);
    boolean recorded;
    if (e instanceof NonRetryableJobException) {
      logger.error("Job {} ({}) failed permanently: {}", job.id(), job.kind(), error);
      recorded = jobs.failPermanently(job.id(), worker, error, now, retryPolicy.maxAttempts());
    } else {
      int attempts = job.attempts() + 1;
      if (retryPolicy.isExhausted(attempts)) {
        logger.error(
            "Job {} ({}) failed on final attempt {}: {}", job.id(), job.kind(), attempts, error, e);
      } else {
        logger.warn("Job {} ({}) failed on attempt {}: {}", job.id(), job.kind(), attempts, error);
      }
      recorded = jobs.fail(job.id(), worker, error, now, retryPolicy.nextRunAt(now, attempts));
    }

    if (recorded) {
      feedback.record(job, RunStatus.FAILED);
    } else {
      logger.warn(
          "Worker {} lost the lock on job {} before recording its failure", worker, job.id());
    }
  }

  static String describe(Throwable e) {
    var message = e.getMessage();
    return message == null || message.isBlank() ? e.getClass().getName() : message;
  }

  /** Ends the current poll sleep of every poll thread so ready jobs are claimed right away. */
  public void wakeUp() {
    wakeLock.lock();
    try {
      wakeGeneration++;
      wakeCondition.signalAll();
    } finally {
      wakeLock.unlock();
    }
  }

  private long currentWakeGeneration() {
    wakeLock.lock();
    try {
      return wakeGeneration;
    } finally {
      wakeLock.unlock();
    }
  }

  /**
   * Sleeps up to {@code millis}, returning early once {@link #wakeUp()} has been called since
   * {@code seen} was read. A wake-up that arrived during the preceding pass is not lost.
   */
  private void awaitWakeUp(long seen, long millis) throws InterruptedException {
    wakeLock.lock();
    try {
      long remaining = TimeUnit.MILLISECONDS.toNanos(millis);
      while (wakeGeneration == seen && remaining > 0) {
        remaining = wakeCondition.awaitNanos(remaining);
      }
    } finally {
      wakeLock.unlock();
    }
  }

  private void pollForJobs(String worker) {
    logger.debug("JobPollThread {} started {}", worker, Thread.currentThread().getId());

    double pollingIntervalSec = pollInterval.toMillis() / 1000.0;
    double basePollingIntervalSec = pollingIntervalSec;

    try {
      while (running) {
        long seen = currentWakeGeneration();
        try {
          var stats = processAvailable(worker, batchSize);
          if (stats.processed() > 0) {
            logger.debug("Worker {} processed {}", worker, stats);
          }
          pollingIntervalSec = max(basePollingIntervalSec, pollingIntervalSec * 0.9);
          if (stats.processed() == batchSize) {
            // more work is likely waiting
            continue;
          }
        } catch (Exception e) {
          pollingIntervalSec = min(MAX_POLLING_INTERVAL_SEC, pollingIntervalSec * 2);
          logger.error("Error polling for jobs", e);
        }

        double randomSleepFactor = 0.95 + ThreadLocalRandom.current().nextDouble(0.1);
        try {
          awaitWakeUp(seen, (long) (randomSleepFactor * pollingIntervalSec * 1000));
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          running = false;
        }
      }
    } finally {
      shutdownLatch.countDown();
      logger.debug("JobPollThread {} has ended", worker);
    }
  }

  public synchronized void start() {
    if (running) {
      logger.warn("Job dispatcher is already running");
      return;
    }
    running = true;
    shutdownLatch = new CountDownLatch(workerThreads);
    for (int i = 0; i < workerThreads; i++) {
      var worker = workerThreads == 1 ? workerId : workerId + "-" + i;
      var thread = new Thread(() -> pollForJobs(worker), "JobPollThread-" + i);
      thread.setDaemon(true);
      pollThreads.add(thread);
      thread.start();
    }
    logger.info(
        "Job dispatcher {} started with {} poll threads, handlers for {}",
        workerId,
        workerThreads,
        handlers.kinds());
  }

  public synchronized void stop() {
    if (!running) {
      return;
    }
    running = false;
    for (var thread : pollThreads) {
      thread.interrupt();
    }
    try {
      if (!shutdownLatch.await(handlerTimeout.toMillis() + 1000, TimeUnit.MILLISECONDS)) {
        logger.warn("Job poll threads did not stop within the handler timeout");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.warn("Interrupted while stopping job poll threads", e);
    } finally {
      pollThreads.clear();
    }
    logger.info("Job dispatcher {} stopped", workerId);
  }

  public synchronized boolean isRunning() {
    return running;
  }

  @Override
  public void jobsLaunched() {
    start();
  }

  @Override
  public void jobsShutDown() {
    stop();
  }

  @Override
  public void close() {
    stop();
    handlerExecutor.shutdownNow();
  }
}
