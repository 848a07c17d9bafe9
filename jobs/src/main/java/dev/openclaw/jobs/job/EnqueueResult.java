package dev.openclaw.jobs.job;

/**
 * Result of an enqueue call. {@code created} is false when an idempotency key matched an existing
 * job, in which case {@code job} is that existing job, unchanged.
 */
public record EnqueueResult(Job job, boolean created) {}
