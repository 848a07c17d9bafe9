package dev.openclaw.jobs.execution;

/** How a handler finished a job without throwing. Both outcomes complete the job. */
public enum JobOutcome {
  SUCCEEDED,
  /** The handler decided there was nothing to do, e.g. the originating schedule is paused. */
  SKIPPED
}
