package dev.openclaw.jobs.cli;

import dev.openclaw.jobs.migrations.MigrationManager;

import java.util.concurrent.Callable;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

@Command(
    name = "migrate",
    description = "Create or upgrade the job queue tables",
    mixinStandardHelpOptions = true)
public class MigrateCommand implements Callable<Integer> {

  @Mixin DatabaseOptions dbOptions;

  @Spec CommandSpec spec;

  @Override
  public Integer call() throws Exception {
    var out = spec.commandLine().getOut();
    out.format("Starting job queue migrations%n");
    out.format("  Database: %s%n", dbOptions.url());
    out.format("  Database User: %s%n", dbOptions.user());
    out.format("  Schema: %s%n", dbOptions.schema());

    MigrationManager.runMigrations(
        dbOptions.url(), dbOptions.user(), dbOptions.password(), dbOptions.schema());
    out.format("Migrations complete%n");
    return 0;
  }
}
