package dev.openclaw.jobs.execution;

import dev.openclaw.jobs.job.Job;

/**
 * Performs the work of one job kind. Returning completes the job; throwing records a failed
 * attempt that is retried with backoff, unless the exception is a {@link
 * dev.openclaw.jobs.exceptions.NonRetryableJobException}.
 */
@FunctionalInterface
public interface JobHandler {
  JobOutcome handle(Job job) throws Exception;
}
