package dev.openclaw.jobs.schedule;

/** Filter and page for listing schedules, ordered by creation time. */
public record ScheduleFilter(String skillId, Boolean enabled, int limit, int offset) {

  public static final int DEFAULT_LIMIT = 50;
  public static final int MAX_LIMIT = 100;

  public ScheduleFilter {
    if (limit <= 0) {
      limit = DEFAULT_LIMIT;
    }
    limit = Math.min(limit, MAX_LIMIT);
    offset = Math.max(offset, 0);
  }

  public static ScheduleFilter all() {
    return new ScheduleFilter(null, null, DEFAULT_LIMIT, 0);
  }

  public ScheduleFilter withSkillId(String v) {
    return new ScheduleFilter(v, enabled, limit, offset);
  }

  public ScheduleFilter withEnabled(Boolean v) {
    return new ScheduleFilter(skillId, v, limit, offset);
  }

  public ScheduleFilter withLimit(int v) {
    return new ScheduleFilter(skillId, enabled, v, offset);
  }

  public ScheduleFilter withOffset(int v) {
    return new ScheduleFilter(skillId, enabled, limit, v);
  }
}
