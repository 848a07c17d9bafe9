package dev.openclaw.jobs.exceptions;

/**
 * {@code ScheduleConflictException} is thrown when a schedule with the same skill, collection and
 * cron expression already exists. A missing collection is its own partition: two schedules for
 * the same skill and cron expression, both without a collection, also conflict.
 */
public class ScheduleConflictException extends RuntimeException {
  private final String skillId;
  private final String collection;
  private final String cronExpression;

  public ScheduleConflictException(String skillId, String collection, String cronExpression) {
    super(
        String.format(
            "A schedule for skill %s (collection: %s) with cron expression '%s' already exists",
            skillId, collection == null ? "<none>" : collection, cronExpression));
    this.skillId = skillId;
    this.collection = collection;
    this.cronExpression = cronExpression;
  }

  public String skillId() {
    return skillId;
  }

  public String collection() {
    return collection;
  }

  public String cronExpression() {
    return cronExpression;
  }
}
