package dev.openclaw.jobs.cli;

import dev.openclaw.jobs.JobsRuntime;

import java.util.concurrent.Callable;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

@Command(
    name = "process",
    description = "Claim and run ready jobs once, then print the dispatch statistics",
    mixinStandardHelpOptions = true)
public class ProcessCommand implements Callable<Integer> {

  @Mixin DatabaseOptions dbOptions;

  @Option(
      names = {"-l", "--limit"},
      description = "Maximum number of jobs to run (default: ${DEFAULT-VALUE})",
      defaultValue = "10")
  int limit;

  @Spec CommandSpec spec;

  @Override
  public Integer call() throws Exception {
    var out = spec.commandLine().getOut();
    try (var runtime = new JobsRuntime(dbOptions.config().withMigrate(false))) {
      var stats = runtime.dispatcher().processAvailable(limit);
      out.println(JobsCommand.prettyPrint(stats));
    }
    return 0;
  }
}
