package dev.openclaw.jobs.schedule;

import dev.openclaw.jobs.Constants;
import dev.openclaw.jobs.exceptions.InvalidScheduleException;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Locale;
import java.util.Map;

/**
 * Write-time checks for schedules. Nothing that fails here ever reaches the enqueuer: a schedule
 * with a too-frequent cron expression, unknown timezone or unusable webhook URL cannot be stored.
 */
public class ScheduleValidator {

  private final boolean allowInsecureWebhooks;

  public ScheduleValidator(boolean allowInsecureWebhooks) {
    this.allowInsecureWebhooks = allowInsecureWebhooks;
  }

  public void validate(ScheduleRequest request) {
    requireSkillId(request.skillId());
    validateCron(request.cronExpression());
    validateTimezone(request.timezone() == null ? Constants.DEFAULT_TIMEZONE : request.timezone());
    validateWebhookUrl(request.webhookUrl());
    validateHeaders(request.webhookHeaders());
    if (request.maxRetries() != null) {
      validateMaxRetries(request.maxRetries());
    }
  }

  public void validate(ScheduleUpdate update) {
    if (update.cronExpression() != null) {
      validateCron(update.cronExpression());
    }
    if (update.timezone() != null) {
      validateTimezone(update.timezone());
    }
    if (update.webhookUrl() != null) {
      validateWebhookUrl(update.webhookUrl());
    }
    if (update.webhookHeaders() != null) {
      validateHeaders(update.webhookHeaders());
    }
    if (update.maxRetries() != null) {
      validateMaxRetries(update.maxRetries());
    }
  }

  public void requireSkillId(String skillId) {
    if (skillId == null || skillId.isBlank()) {
      throw new InvalidScheduleException("skill_id", "skill_id is required");
    }
  }

  public CronSpec validateCron(String cronExpression) {
    var spec = CronSpec.parse(cronExpression);
    if (spec.firesEveryMinute()) {
      throw new InvalidScheduleException(
          "cron_expression",
          "cron_expression '%s' fires every minute; schedules may run at most every %d minutes"
              .formatted(spec.expression(), Constants.MIN_SCHEDULE_INTERVAL_MINUTES));
    }
    int interval = spec.minimumIntervalMinutes();
    if (interval < Constants.MIN_SCHEDULE_INTERVAL_MINUTES) {
      throw new InvalidScheduleException(
          "cron_expression",
          "cron_expression '%s' fires more frequently than every %d minutes (every %d minutes)"
              .formatted(spec.expression(), Constants.MIN_SCHEDULE_INTERVAL_MINUTES, interval));
    }
    if (!spec.canFire()) {
      throw new InvalidScheduleException(
          "cron_expression",
          "cron_expression '%s' never fires: no date matches its day and month fields"
              .formatted(spec.expression()));
    }
    return spec;
  }

  public ZoneId validateTimezone(String timezone) {
    try {
      return ZoneId.of(timezone);
    } catch (DateTimeException e) {
      throw new InvalidScheduleException(
          "timezone", "Invalid timezone '%s': must be an IANA timezone name".formatted(timezone));
    }
  }

  public URI validateWebhookUrl(String webhookUrl) {
    if (webhookUrl == null || webhookUrl.isBlank()) {
      throw new InvalidScheduleException("webhook_url", "webhook_url is required");
    }
    URI uri;
    try {
      uri = new URI(webhookUrl);
    } catch (URISyntaxException e) {
      throw new InvalidScheduleException(
          "webhook_url", "webhook_url '%s' is not a valid URL".formatted(webhookUrl));
    }
    var scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
    if (!uri.isAbsolute() || uri.getHost() == null) {
      throw new InvalidScheduleException(
          "webhook_url", "webhook_url '%s' must be an absolute URL".formatted(webhookUrl));
    }
    if (scheme.equals("https")) {
      return uri;
    }
    if (scheme.equals("http") && allowInsecureWebhooks) {
      return uri;
    }
    throw new InvalidScheduleException(
        "webhook_url",
        allowInsecureWebhooks
            ? "webhook_url '%s' must use http or https".formatted(webhookUrl)
            : "webhook_url '%s' must use https".formatted(webhookUrl));
  }

  public void validateMaxRetries(int maxRetries) {
    if (maxRetries < 0 || maxRetries > Constants.MAX_SCHEDULE_MAX_RETRIES) {
      throw new InvalidScheduleException(
          "max_retries",
          "max_retries must be between 0 and %d".formatted(Constants.MAX_SCHEDULE_MAX_RETRIES));
    }
  }

  void validateHeaders(Map<String, String> headers) {
    if (headers == null) {
      return;
    }
    for (var entry : headers.entrySet()) {
      if (entry.getKey() == null || entry.getKey().isBlank() || entry.getValue() == null) {
        throw new InvalidScheduleException(
            "webhook_headers", "webhook_headers must map non-empty names to values");
      }
    }
  }
}
