package dev.openclaw.jobs.cli;

public class Main {
  public static void main(String[] args) {
    var cmd = JobsCommand.newCommandLine();
    var exitCode = cmd.execute(args);
    System.exit(exitCode);
  }
}
