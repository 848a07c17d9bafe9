package dev.openclaw.jobs.schedule;

/** Terminal outcome of a schedule's most recent run. A null status means a run is in flight. */
public enum RunStatus {
  SUCCESS("success"),
  FAILED("failed"),
  SKIPPED("skipped");

  private final String value;

  RunStatus(String value) {
    this.value = value;
  }

  /** The value stored in {@code last_run_status} */
  public String value() {
    return value;
  }

  public static RunStatus fromValue(String value) {
    if (value == null) {
      return null;
    }
    for (var status : values()) {
      if (status.value.equals(value)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown run status: " + value);
  }

  @Override
  public String toString() {
    return value;
  }
}
