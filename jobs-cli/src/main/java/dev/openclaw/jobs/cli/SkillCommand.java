package dev.openclaw.jobs.cli;

import java.util.concurrent.Callable;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

@Command(
    name = "skill",
    description = "Operations spanning all data of a skill",
    subcommands = {SkillPurgeCommand.class})
public class SkillCommand implements Runnable {

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

@Command(
    name = "purge",
    description = "Delete every schedule of a skill and its jobs that have not completed")
class SkillPurgeCommand implements Callable<Integer> {

  @Parameters(index = "0", description = "Skill ID")
  String skillId;

  @Option(
      names = {"-y", "--yes"},
      description = "Confirm the purge")
  boolean yes;

  @Mixin DatabaseOptions dbOptions;

  @Option(
      names = {"-h", "--help"},
      usageHelp = true,
      description = "Display this help message")
  boolean help;

  @Spec CommandSpec spec;

  @Override
  public Integer call() throws Exception {
    if (!yes) {
      spec.commandLine()
          .getErr()
          .format("Refusing to purge skill %s without --yes%n", skillId);
      return JobsCommand.EXIT_INVALID;
    }
    try (var client = dbOptions.createClient()) {
      var result = client.schedules().purgeSkill(skillId, true);
      spec.commandLine().getOut().println(JobsCommand.prettyPrint(result));
    }
    return 0;
  }
}
