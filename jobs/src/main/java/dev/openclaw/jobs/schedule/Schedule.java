package dev.openclaw.jobs.schedule;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import org.jspecify.annotations.Nullable;

/**
 * A recurring definition that produces {@code skill_store.scheduled_process} jobs on a cron
 * cadence, evaluated in the schedule's timezone.
 */
public record Schedule(
    UUID id,
    String skillId,
    @Nullable String collection,
    String cronExpression,
    String timezone,
    String webhookUrl,
    Map<String, String> webhookHeaders,
    Map<String, Object> payloadTemplate,
    boolean enabled,
    int maxRetries,
    int consecutiveFailures,
    @Nullable Instant lastRunAt,
    @Nullable RunStatus lastRunStatus,
    @Nullable Instant nextRunAt,
    Instant createdAt,
    Instant updatedAt) {

  public static final String SCHEDULE_ID_KEY = "schedule_id";
  public static final String SKILL_ID_KEY = "skill_id";
  public static final String COLLECTION_KEY = "collection";
  public static final String MANUAL_TRIGGER_KEY = "manual_trigger";

  public Schedule {
    Objects.requireNonNull(id, "Schedule id must not be null");
    Objects.requireNonNull(skillId, "Schedule skillId must not be null");
    Objects.requireNonNull(cronExpression, "Schedule cronExpression must not be null");
    Objects.requireNonNull(timezone, "Schedule timezone must not be null");
    Objects.requireNonNull(webhookUrl, "Schedule webhookUrl must not be null");
    webhookHeaders = webhookHeaders == null ? Map.of() : webhookHeaders;
    payloadTemplate = payloadTemplate == null ? Map.of() : payloadTemplate;
  }

  /** The circuit breaker: enqueueing is suspended while this holds. */
  public boolean isCircuitOpen() {
    return consecutiveFailures >= maxRetries;
  }

  /**
   * True when a run started within {@code window} before {@code now} has not reported an outcome
   * yet. A run older than the window is considered stuck and no longer blocks the next one.
   */
  public boolean isRunInFlight(Instant now, Duration window) {
    return lastRunAt != null && lastRunStatus == null && lastRunAt.isAfter(now.minus(window));
  }

  public Instant nextRunAfter(Instant after) {
    return CronSpec.parse(cronExpression).nextExecution(after, ZoneId.of(timezone));
  }

  /** Payload of the job this schedule produces. */
  public Map<String, Object> jobPayload() {
    var payload = new LinkedHashMap<String, Object>();
    payload.put(SCHEDULE_ID_KEY, id.toString());
    payload.put(SKILL_ID_KEY, skillId);
    payload.put(COLLECTION_KEY, collection);
    return payload;
  }

  public Schedule withEnabled(boolean enabled, @Nullable Instant nextRunAt, Instant now) {
    return new Schedule(
        id,
        skillId,
        collection,
        cronExpression,
        timezone,
        webhookUrl,
        webhookHeaders,
        payloadTemplate,
        enabled,
        maxRetries,
        consecutiveFailures,
        lastRunAt,
        lastRunStatus,
        nextRunAt,
        createdAt,
        now);
  }

  public Schedule withNextRunAt(Instant nextRunAt, Instant now) {
    return new Schedule(
        id,
        skillId,
        collection,
        cronExpression,
        timezone,
        webhookUrl,
        webhookHeaders,
        payloadTemplate,
        enabled,
        maxRetries,
        consecutiveFailures,
        lastRunAt,
        lastRunStatus,
        nextRunAt,
        createdAt,
        now);
  }

  /** Marks a run as started: {@code lastRunAt} set, status cleared until the job reports back. */
  public Schedule withRunStarted(Instant startedAt, Instant nextRunAt) {
    return new Schedule(
        id,
        skillId,
        collection,
        cronExpression,
        timezone,
        webhookUrl,
        webhookHeaders,
        payloadTemplate,
        enabled,
        maxRetries,
        consecutiveFailures,
        startedAt,
        null,
        nextRunAt,
        createdAt,
        startedAt);
  }

  public Schedule withRunResult(RunStatus status, Instant runAt, Instant now) {
    int failures =
        switch (status) {
          case SUCCESS -> 0;
          case FAILED -> consecutiveFailures + 1;
          case SKIPPED -> consecutiveFailures;
        };
    return new Schedule(
        id,
        skillId,
        collection,
        cronExpression,
        timezone,
        webhookUrl,
        webhookHeaders,
        payloadTemplate,
        enabled,
        maxRetries,
        failures,
        runAt,
        status,
        nextRunAt,
        createdAt,
        now);
  }
}
