package dev.openclaw.jobs.cli;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.UUID;
import java.util.concurrent.Callable;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

@Command(
    name = "job",
    description = "Inspect and manage queued jobs",
    subcommands = {
      JobGetCommand.class,
      JobEnqueueCommand.class,
      JobPendingCommand.class,
      JobDeadCommand.class,
      JobRequeueCommand.class,
    })
public class JobCommand implements Runnable {

  @Option(
      names = {"-h", "--help"},
      usageHelp = true,
      description = "Display this help message")
  boolean help;

  @Override
  public void run() {
    CommandLine cmd = new CommandLine(this);
    cmd.usage(System.out);
  }
}

@Command(name = "get", description = "Show a job")
class JobGetCommand implements Callable<Integer> {

  @Parameters(index = "0", description = "Job ID")
  UUID jobId;

  @Mixin DatabaseOptions dbOptions;

  @Option(
      names = {"-h", "--help"},
      usageHelp = true,
      description = "Display this help message")
  boolean help;

  @Spec CommandSpec spec;

  @Override
  public Integer call() throws Exception {
    try (var client = dbOptions.createClient()) {
      var job = client.getJob(jobId);
      if (job.isEmpty()) {
        spec.commandLine().getErr().format("Job %s not found%n", jobId);
        return JobsCommand.EXIT_INVALID;
      }
      spec.commandLine().getOut().println(JobsCommand.prettyPrint(job.get()));
    }
    return 0;
  }
}

@Command(name = "enqueue", description = "Add a job to the queue")
class JobEnqueueCommand implements Callable<Integer> {

  @Parameters(index = "0", description = "Job kind")
  String kind;

  @Option(
      names = {"-p", "--payload"},
      description = "Job payload as a JSON object")
  String payload;

  @Option(
      names = {"-k", "--key"},
      description = "Idempotency key; a second enqueue with the same kind and key is a no-op")
  String idempotencyKey;

  @Option(
      names = {"--run-at"},
      description = "Earliest run time as an ISO-8601 instant, e.g. 2025-01-01T09:00:00Z")
  String runAt;

  @Mixin DatabaseOptions dbOptions;

  @Option(
      names = {"-h", "--help"},
      usageHelp = true,
      description = "Display this help message")
  boolean help;

  @Spec CommandSpec spec;

  @Override
  public Integer call() throws Exception {
    var body = ScheduleCommand.parseTemplate(payload);
    Instant at = null;
    if (runAt != null) {
      try {
        at = Instant.parse(runAt);
      } catch (DateTimeParseException e) {
        throw new IllegalArgumentException("--run-at must be an ISO-8601 instant: " + runAt);
      }
    }
    try (var client = dbOptions.createClient()) {
      var result = client.enqueue(kind, body, idempotencyKey, at);
      spec.commandLine().getOut().println(JobsCommand.prettyPrint(result));
    }
    return 0;
  }
}

@Command(name = "pending", description = "Count runnable jobs per kind")
class JobPendingCommand implements Callable<Integer> {

  @Mixin DatabaseOptions dbOptions;

  @Option(
      names = {"-h", "--help"},
      usageHelp = true,
      description = "Display this help message")
  boolean help;

  @Spec CommandSpec spec;

  @Override
  public Integer call() throws Exception {
    try (var client = dbOptions.createClient()) {
      spec.commandLine().getOut().println(JobsCommand.prettyPrint(client.pendingCounts()));
    }
    return 0;
  }
}

@Command(name = "dead", description = "List jobs that exhausted their attempts")
class JobDeadCommand implements Callable<Integer> {

  @Option(
      names = {"-l", "--limit"},
      description = "Limit the results returned",
      defaultValue = "50")
  int limit;

  @Mixin DatabaseOptions dbOptions;

  @Option(
      names = {"-h", "--help"},
      usageHelp = true,
      description = "Display this help message")
  boolean help;

  @Spec CommandSpec spec;

  @Override
  public Integer call() throws Exception {
    try (var client = dbOptions.createClient()) {
      spec.commandLine().getOut().println(JobsCommand.prettyPrint(client.deadLetters(limit)));
    }
    return 0;
  }
}

@Command(name = "requeue", description = "Give a dead-lettered job a fresh set of attempts")
class JobRequeueCommand implements Callable<Integer> {

  @Parameters(index = "0", description = "Job ID")
  UUID jobId;

  @Mixin DatabaseOptions dbOptions;

  @Option(
      names = {"-h", "--help"},
      usageHelp = true,
      description = "Display this help message")
  boolean help;

  @Spec CommandSpec spec;

  @Override
  public Integer call() throws Exception {
    try (var client = dbOptions.createClient()) {
      if (!client.requeue(jobId)) {
        spec.commandLine().getErr().format("Job %s is not dead-lettered%n", jobId);
        return JobsCommand.EXIT_INVALID;
      }
    }
    spec.commandLine().getOut().format("Requeued job %s%n", jobId);
    return 0;
  }
}
