package dev.openclaw.jobs.job;

/**
 * Lifecycle of a job. The state is derived from the stored fields rather than kept in a column,
 * so there is no way for the two to disagree.
 */
public enum JobState {
  /** Not completed, not locked, {@code run_at} is in the future */
  PENDING,
  /** Not completed, not locked, due */
  READY,
  /** Claimed by a worker within the staleness window */
  LOCKED,
  /** Claimed, but the claim is older than the staleness window and may be taken over */
  LOCKED_STALE,
  /** Finished successfully; terminal */
  COMPLETED,
  /** Used up its attempts without completing; kept for operator inspection */
  DEAD_LETTER
}
