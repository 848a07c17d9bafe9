package dev.openclaw.jobs.schedule;

/** What purging a skill removed. */
public record PurgeResult(String skillId, int schedulesDeleted, int jobsDeleted) {}
