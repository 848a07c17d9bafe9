package dev.openclaw.jobs.webhook;

import dev.openclaw.jobs.database.ScheduleStore;
import dev.openclaw.jobs.exceptions.NonRetryableJobException;
import dev.openclaw.jobs.exceptions.WebhookDeliveryException;
import dev.openclaw.jobs.execution.JobHandler;
import dev.openclaw.jobs.execution.JobOutcome;
import dev.openclaw.jobs.execution.ScheduleFeedback;
import dev.openclaw.jobs.job.Job;
import dev.openclaw.jobs.schedule.Schedule;

import java.net.URI;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handles {@code skill_store.scheduled_process} jobs by posting to the schedule's webhook. The
 * target and headers always come from the stored schedule, never from the job payload.
 */
public class ScheduledProcessHandler implements JobHandler {

  private static final Logger logger = LoggerFactory.getLogger(ScheduledProcessHandler.class);

  public static final String TRIGGERED_AT_KEY = "triggered_at";

  private final ScheduleStore schedules;
  private final WebhookClient webhookClient;
  private final Clock clock;

  public ScheduledProcessHandler(
      ScheduleStore schedules, WebhookClient webhookClient, Clock clock) {
    this.schedules = Objects.requireNonNull(schedules);
    this.webhookClient = Objects.requireNonNull(webhookClient);
    this.clock = Objects.requireNonNull(clock);
  }

  @Override
  public JobOutcome handle(Job job) {
    var scheduleId = ScheduleFeedback.scheduleId(job);
    if (scheduleId == null) {
      throw new NonRetryableJobException("Job %s has no schedule_id".formatted(job.id()));
    }
    var schedule =
        schedules
            .getSchedule(scheduleId)
            .orElseThrow(
                () -> new NonRetryableJobException("Schedule %s not found".formatted(scheduleId)));
    if (!schedule.enabled()) {
      logger.info("Schedule {} is paused, skipping job {}", scheduleId, job.id());
      return JobOutcome.SKIPPED;
    }

    var runtime = new LinkedHashMap<String, Object>();
    runtime.put(Schedule.SCHEDULE_ID_KEY, schedule.id().toString());
    runtime.put(Schedule.SKILL_ID_KEY, schedule.skillId());
    runtime.put(Schedule.COLLECTION_KEY, schedule.collection());
    runtime.put(TRIGGERED_AT_KEY, clock.instant().toString());
    if (Boolean.TRUE.equals(job.payload().get(Schedule.MANUAL_TRIGGER_KEY))) {
      runtime.put(Schedule.MANUAL_TRIGGER_KEY, true);
    }
    var body = PayloadTemplate.merge(schedule.payloadTemplate(), runtime);

    try {
      int status =
          webhookClient.post(URI.create(schedule.webhookUrl()), schedule.webhookHeaders(), body);
      logger.info(
          "Delivered schedule {} run to {} ({})", scheduleId, schedule.webhookUrl(), status);
    } catch (WebhookDeliveryException e) {
      if (!e.isRetryable()) {
        throw new NonRetryableJobException(e.getMessage(), e);
      }
      throw e;
    }
    return JobOutcome.SUCCEEDED;
  }
}
