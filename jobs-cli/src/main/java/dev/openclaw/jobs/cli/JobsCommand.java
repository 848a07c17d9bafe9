package dev.openclaw.jobs.cli;

import dev.openclaw.jobs.JobsClient;
import dev.openclaw.jobs.exceptions.InvalidScheduleException;
import dev.openclaw.jobs.exceptions.NonExistentScheduleException;
import dev.openclaw.jobs.exceptions.ScheduleConflictException;
import dev.openclaw.jobs.json.JSONUtil;
import dev.openclaw.jobs.json.JSONUtil.JsonRuntimeException;

import java.util.Objects;

import com.fasterxml.jackson.core.JsonProcessingException;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.IVersionProvider;

@Command(
    name = "jobs",
    description = "Command-line interface for the OpenClaw job queue and skill schedules",
    mixinStandardHelpOptions = true,
    subcommands = {
      MigrateCommand.class,
      WorkerCommand.class,
      EnqueueDueCommand.class,
      ProcessCommand.class,
      ScheduleCommand.class,
      JobCommand.class,
      SkillCommand.class
    },
    versionProvider = JobsCommand.class)
public class JobsCommand implements Runnable, IVersionProvider {

  /** Exit code for requests rejected by validation or referring to missing schedules. */
  public static final int EXIT_INVALID = 2;

  /** Command line with the error reporting used by {@link Main}. */
  public static CommandLine newCommandLine() {
    var cmd = new CommandLine(new JobsCommand());
    cmd.setExecutionExceptionHandler(
        (ex, commandLine, parseResult) -> {
          if (ex instanceof InvalidScheduleException
              || ex instanceof ScheduleConflictException
              || ex instanceof NonExistentScheduleException
              || ex instanceof IllegalArgumentException) {
            commandLine.getErr().println("Error: " + ex.getMessage());
            return EXIT_INVALID;
          }
          throw ex;
        });
    return cmd;
  }

  @Override
  public void run() {
    CommandLine cmd = new CommandLine(this);
    cmd.usage(System.out);
  }

  @Override
  public String[] getVersion() throws Exception {
    var pkg = JobsClient.class.getPackage();
    var ver = pkg == null ? null : pkg.getImplementationVersion();
    return new String[] {
      "${COMMAND-FULL-NAME} "
          + Objects.requireNonNullElse(ver == null ? null : "v" + ver, "<unknown version>")
    };
  }

  public static String prettyPrint(Object object) {
    var writer = JSONUtil.mapper().writerWithDefaultPrettyPrinter();
    try {
      return writer.writeValueAsString(Objects.requireNonNull(object));
    } catch (JsonProcessingException e) {
      throw new JsonRuntimeException(e);
    }
  }
}
