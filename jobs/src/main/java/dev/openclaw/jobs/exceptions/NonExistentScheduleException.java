package dev.openclaw.jobs.exceptions;

import java.util.UUID;

/** Thrown by schedule administration calls that target a schedule id that does not exist. */
public class NonExistentScheduleException extends RuntimeException {
  private final UUID scheduleId;

  public NonExistentScheduleException(UUID scheduleId) {
    super(String.format("Schedule does not exist %s", scheduleId));
    this.scheduleId = scheduleId;
  }

  public UUID scheduleId() {
    return scheduleId;
  }
}
