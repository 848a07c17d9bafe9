package dev.openclaw.jobs.cli;

import dev.openclaw.jobs.JobsRuntime;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

@Command(
    name = "worker",
    description = "Run the job dispatcher and schedule enqueuer until interrupted",
    mixinStandardHelpOptions = true)
public class WorkerCommand implements Callable<Integer> {

  private static final Logger logger = LoggerFactory.getLogger(WorkerCommand.class);

  @Mixin DatabaseOptions dbOptions;

  @Option(
      names = {"-w", "--worker-id"},
      description = "Worker id recorded on claimed jobs (default: generated)")
  String workerId;

  @Option(
      names = {"-t", "--threads"},
      description = "Number of poll threads (defaults to JOBS_WORKER_THREADS env var or 1)")
  Integer threads;

  @Option(
      names = {"--poll-interval-ms"},
      description =
          "Poll interval in milliseconds (defaults to JOBS_WORKER_POLL_INTERVAL_MS or 30000)")
  Long pollIntervalMs;

  @Option(
      names = {"--batch-size"},
      description = "Jobs claimed per poll (default: 10)")
  Integer batchSize;

  @Option(
      names = {"--no-scheduler"},
      description = "Only dispatch jobs; do not enqueue due schedules")
  boolean noScheduler;

  @Option(
      names = {"--no-migrate"},
      description = "Do not create or upgrade the job tables at startup")
  boolean noMigrate;

  @Option(
      names = {"--allow-insecure-webhooks"},
      description = "Accept plain http webhook URLs (development only)")
  boolean allowInsecureWebhooks;

  @Spec CommandSpec spec;

  @Override
  public Integer call() throws Exception {
    var out = spec.commandLine().getOut();
    var config =
        dbOptions
            .config()
            .withSchedulerEnabled(!noScheduler)
            .withMigrate(!noMigrate)
            .withAllowInsecureWebhooks(allowInsecureWebhooks);
    if (workerId != null) {
      config = config.withWorkerId(workerId);
    }
    if (threads != null) {
      config = config.withWorkerThreads(threads);
    }
    if (pollIntervalMs != null) {
      config = config.withPollInterval(Duration.ofMillis(pollIntervalMs));
    }
    if (batchSize != null) {
      config = config.withBatchSize(batchSize);
    }

    var stopped = new CountDownLatch(1);
    try (var runtime = new JobsRuntime(config)) {
      Runtime.getRuntime()
          .addShutdownHook(
              new Thread(
                  () -> {
                    logger.info("Shutdown requested");
                    runtime.shutdown();
                    stopped.countDown();
                  },
                  "JobsWorkerShutdown"));
      runtime.launch();
      out.format("Worker %s running; press Ctrl+C to stop%n", runtime.dispatcher().workerId());
      out.flush();
      stopped.await();
    }
    return 0;
  }
}
