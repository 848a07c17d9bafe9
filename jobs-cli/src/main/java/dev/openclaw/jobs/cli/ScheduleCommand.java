package dev.openclaw.jobs.cli;

import dev.openclaw.jobs.json.JSONUtil;
import dev.openclaw.jobs.schedule.ScheduleFilter;
import dev.openclaw.jobs.schedule.ScheduleRequest;
import dev.openclaw.jobs.schedule.ScheduleUpdate;

import java.util.Map;
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
    name = "schedule",
    aliases = {"sched"},
    description = "Manage skill schedules",
    subcommands = {
      ScheduleListCommand.class,
      ScheduleGetCommand.class,
      ScheduleCreateCommand.class,
      ScheduleUpdateCommand.class,
      ScheduleDeleteCommand.class,
      SchedulePauseCommand.class,
      ScheduleResumeCommand.class,
      ScheduleTriggerCommand.class,
    })
public class ScheduleCommand implements Runnable {

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

  static Map<String, Object> parseTemplate(String json) {
    if (json == null) {
      return null;
    }
    try {
      return JSONUtil.toObjectMap(json);
    } catch (JSONUtil.JsonRuntimeException e) {
      throw new IllegalArgumentException("--template must be a JSON object: " + e.getMessage());
    }
  }
}

@Command(name = "list", description = "List schedules")
class ScheduleListCommand implements Callable<Integer> {

  @Option(
      names = {"-s", "--skill-id"},
      description = "Only schedules of this skill")
  String skillId;

  @Option(
      names = {"-e", "--enabled"},
      description = "Only enabled (true) or paused (false) schedules",
      arity = "1")
  Boolean enabled;

  @Option(
      names = {"-l", "--limit"},
      description = "Limit the results returned (max 100)",
      defaultValue = "50")
  int limit;

  @Option(
      names = {"-o", "--offset"},
      description = "Offset for pagination",
      defaultValue = "0")
  int offset;

  @Mixin DatabaseOptions dbOptions;

  @Option(
      names = {"-h", "--help"},
      usageHelp = true,
      description = "Display this help message")
  boolean help;

  @Spec CommandSpec spec;

  @Override
  public Integer call() throws Exception {
    var out = spec.commandLine().getOut();
    var filter = new ScheduleFilter(skillId, enabled, limit, offset);
    try (var client = dbOptions.createClient()) {
      out.println(JobsCommand.prettyPrint(client.schedules().list(filter)));
    }
    return 0;
  }
}

@Command(name = "get", description = "Show a schedule")
class ScheduleGetCommand implements Callable<Integer> {

  @Parameters(index = "0", description = "Schedule ID")
  UUID scheduleId;

  @Mixin DatabaseOptions dbOptions;

  @Option(
      names = {"-h", "--help"},
      usageHelp = true,
      description = "Display this help message")
  boolean help;

  @Spec CommandSpec spec;

  @Override
  public Integer call() throws Exception {
    var out = spec.commandLine().getOut();
    try (var client = dbOptions.createClient()) {
      out.println(JobsCommand.prettyPrint(client.schedules().get(scheduleId)));
    }
    return 0;
  }
}

@Command(name = "create", description = "Create a schedule")
class ScheduleCreateCommand implements Callable<Integer> {

  @Option(
      names = {"-s", "--skill-id"},
      required = true,
      description = "Skill the schedule belongs to")
  String skillId;

  @Option(
      names = {"-c", "--collection"},
      description = "Collection within the skill")
  String collection;

  @Option(
      names = {"--cron"},
      required = true,
      description = "Five-field cron expression, at most every 5 minutes")
  String cron;

  @Option(
      names = {"-z", "--timezone"},
      description = "IANA timezone the cron expression is evaluated in (default: UTC)")
  String timezone;

  @Option(
      names = {"-u", "--webhook-url"},
      required = true,
      description = "URL the scheduled run is posted to")
  String webhookUrl;

  @Option(
      names = {"-H", "--header"},
      description = "Webhook header as NAME=VALUE; may be repeated")
  Map<String, String> headers;

  @Option(
      names = {"-t", "--template"},
      description = "Payload template as a JSON object")
  String template;

  @Option(
      names = {"--disabled"},
      description = "Create the schedule paused")
  boolean disabled;

  @Option(
      names = {"-r", "--max-retries"},
      description = "Consecutive failures before enqueueing is suspended (0-20, default 5)")
  Integer maxRetries;

  @Option(
      names = {"--allow-insecure-webhooks"},
      description = "Accept plain http webhook URLs (development only)")
  boolean allowInsecureWebhooks;

  @Mixin DatabaseOptions dbOptions;

  @Option(
      names = {"-h", "--help"},
      usageHelp = true,
      description = "Display this help message")
  boolean help;

  @Spec CommandSpec spec;

  @Override
  public Integer call() throws Exception {
    var out = spec.commandLine().getOut();
    var request =
        ScheduleRequest.of(skillId, cron, webhookUrl)
            .withCollection(collection)
            .withTimezone(timezone)
            .withWebhookHeaders(headers)
            .withPayloadTemplate(ScheduleCommand.parseTemplate(template))
            .withEnabled(!disabled)
            .withMaxRetries(maxRetries);
    try (var client = dbOptions.createClient(allowInsecureWebhooks)) {
      out.println(JobsCommand.prettyPrint(client.schedules().create(request)));
    }
    return 0;
  }
}

@Command(name = "update", description = "Change a schedule; omitted options are left unchanged")
class ScheduleUpdateCommand implements Callable<Integer> {

  @Parameters(index = "0", description = "Schedule ID")
  UUID scheduleId;

  @Option(
      names = {"--cron"},
      description = "Five-field cron expression, at most every 5 minutes")
  String cron;

  @Option(
      names = {"-z", "--timezone"},
      description = "IANA timezone the cron expression is evaluated in")
  String timezone;

  @Option(
      names = {"-u", "--webhook-url"},
      description = "URL the scheduled run is posted to")
  String webhookUrl;

  @Option(
      names = {"-H", "--header"},
      description = "Webhook header as NAME=VALUE; replaces all headers; may be repeated")
  Map<String, String> headers;

  @Option(
      names = {"-t", "--template"},
      description = "Payload template as a JSON object")
  String template;

  @Option(
      names = {"-e", "--enabled"},
      description = "Enable (true) or pause (false) the schedule",
      arity = "1")
  Boolean enabled;

  @Option(
      names = {"-r", "--max-retries"},
      description = "Consecutive failures before enqueueing is suspended (0-20)")
  Integer maxRetries;

  @Option(
      names = {"--allow-insecure-webhooks"},
      description = "Accept plain http webhook URLs (development only)")
  boolean allowInsecureWebhooks;

  @Mixin DatabaseOptions dbOptions;

  @Option(
      names = {"-h", "--help"},
      usageHelp = true,
      description = "Display this help message")
  boolean help;

  @Spec CommandSpec spec;

  @Override
  public Integer call() throws Exception {
    var out = spec.commandLine().getOut();
    var update =
        ScheduleUpdate.none()
            .withCronExpression(cron)
            .withTimezone(timezone)
            .withWebhookUrl(webhookUrl)
            .withWebhookHeaders(headers)
            .withPayloadTemplate(ScheduleCommand.parseTemplate(template))
            .withEnabled(enabled)
            .withMaxRetries(maxRetries);
    try (var client = dbOptions.createClient(allowInsecureWebhooks)) {
      out.println(JobsCommand.prettyPrint(client.schedules().update(scheduleId, update)));
    }
    return 0;
  }
}

@Command(name = "delete", description = "Delete a schedule")
class ScheduleDeleteCommand implements Callable<Integer> {

  @Parameters(index = "0", description = "Schedule ID")
  UUID scheduleId;

  @Mixin DatabaseOptions dbOptions;

  @Option(
      names = {"-h", "--help"},
      usageHelp = true,
      description = "Display this help message")
  boolean help;

  @Spec CommandSpec spec;

  @Override
  public Integer call() throws Exception {
    var out = spec.commandLine().getOut();
    try (var client = dbOptions.createClient()) {
      if (!client.schedules().delete(scheduleId)) {
        spec.commandLine().getErr().format("Schedule %s not found%n", scheduleId);
        return JobsCommand.EXIT_INVALID;
      }
    }
    out.format("Deleted schedule %s%n", scheduleId);
    return 0;
  }
}

@Command(name = "pause", description = "Stop enqueueing runs of a schedule")
class SchedulePauseCommand implements Callable<Integer> {

  @Parameters(index = "0", description = "Schedule ID")
  UUID scheduleId;

  @Mixin DatabaseOptions dbOptions;

  @Option(
      names = {"-h", "--help"},
      usageHelp = true,
      description = "Display this help message")
  boolean help;

  @Spec CommandSpec spec;

  @Override
  public Integer call() throws Exception {
    var out = spec.commandLine().getOut();
    try (var client = dbOptions.createClient()) {
      out.println(JobsCommand.prettyPrint(client.schedules().pause(scheduleId)));
    }
    return 0;
  }
}

@Command(name = "resume", description = "Resume a paused schedule from its next cron time")
class ScheduleResumeCommand implements Callable<Integer> {

  @Parameters(index = "0", description = "Schedule ID")
  UUID scheduleId;

  @Mixin DatabaseOptions dbOptions;

  @Option(
      names = {"-h", "--help"},
      usageHelp = true,
      description = "Display this help message")
  boolean help;

  @Spec CommandSpec spec;

  @Override
  public Integer call() throws Exception {
    var out = spec.commandLine().getOut();
    try (var client = dbOptions.createClient()) {
      out.println(JobsCommand.prettyPrint(client.schedules().resume(scheduleId)));
    }
    return 0;
  }
}

@Command(name = "trigger", description = "Enqueue a run of a schedule right away")
class ScheduleTriggerCommand implements Callable<Integer> {

  @Parameters(index = "0", description = "Schedule ID")
  UUID scheduleId;

  @Mixin DatabaseOptions dbOptions;

  @Option(
      names = {"-h", "--help"},
      usageHelp = true,
      description = "Display this help message")
  boolean help;

  @Spec CommandSpec spec;

  @Override
  public Integer call() throws Exception {
    var out = spec.commandLine().getOut();
    try (var client = dbOptions.createClient()) {
      var result = client.schedules().trigger(scheduleId);
      out.println(JobsCommand.prettyPrint(result.job()));
    }
    return 0;
  }
}
