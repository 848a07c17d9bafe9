package dev.openclaw.jobs.execution;

/** Tally of one or more dispatch passes. */
public record DispatchStats(int processed, int succeeded, int failed, int skipped) {

  public static DispatchStats empty() {
    return new DispatchStats(0, 0, 0, 0);
  }

  DispatchStats plus(DispatchStats other) {
    return new DispatchStats(
        processed + other.processed,
        succeeded + other.succeeded,
        failed + other.failed,
        skipped + other.skipped);
  }

  static DispatchStats of(JobOutcome outcome) {
    return outcome == JobOutcome.SKIPPED
        ? new DispatchStats(1, 0, 0, 1)
        : new DispatchStats(1, 1, 0, 0);
  }

  static DispatchStats failure() {
    return new DispatchStats(1, 0, 1, 0);
  }
}
