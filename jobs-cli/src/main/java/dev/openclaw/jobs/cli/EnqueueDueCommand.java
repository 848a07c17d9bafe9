package dev.openclaw.jobs.cli;

import java.util.concurrent.Callable;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

@Command(
    name = "enqueue-due",
    description = "Run one schedule enqueuer pass and print the number of jobs created",
    mixinStandardHelpOptions = true)
public class EnqueueDueCommand implements Callable<Integer> {

  @Mixin DatabaseOptions dbOptions;

  @Spec CommandSpec spec;

  @Override
  public Integer call() throws Exception {
    var out = spec.commandLine().getOut();
    try (var client = dbOptions.createClient()) {
      int created = client.enqueueDueSchedules();
      out.format("Enqueued %d jobs%n", created);
    }
    return 0;
  }
}
