package dev.openclaw.jobs.schedule;

import java.util.Map;

/** Partial update of a schedule. Null fields are left unchanged. */
public record ScheduleUpdate(
    String cronExpression,
    String timezone,
    String webhookUrl,
    Map<String, String> webhookHeaders,
    Map<String, Object> payloadTemplate,
    Boolean enabled,
    Integer maxRetries) {

  public static ScheduleUpdate none() {
    return new ScheduleUpdate(null, null, null, null, null, null, null);
  }

  public boolean isEmpty() {
    return cronExpression == null
        && timezone == null
        && webhookUrl == null
        && webhookHeaders == null
        && payloadTemplate == null
        && enabled == null
        && maxRetries == null;
  }

  public ScheduleUpdate withCronExpression(String v) {
    return new ScheduleUpdate(
        v, timezone, webhookUrl, webhookHeaders, payloadTemplate, enabled, maxRetries);
  }

  public ScheduleUpdate withTimezone(String v) {
    return new ScheduleUpdate(
        cronExpression, v, webhookUrl, webhookHeaders, payloadTemplate, enabled, maxRetries);
  }

  public ScheduleUpdate withWebhookUrl(String v) {
    return new ScheduleUpdate(
        cronExpression, timezone, v, webhookHeaders, payloadTemplate, enabled, maxRetries);
  }

  public ScheduleUpdate withWebhookHeaders(Map<String, String> v) {
    return new ScheduleUpdate(
        cronExpression, timezone, webhookUrl, v, payloadTemplate, enabled, maxRetries);
  }

  public ScheduleUpdate withPayloadTemplate(Map<String, Object> v) {
    return new ScheduleUpdate(
        cronExpression, timezone, webhookUrl, webhookHeaders, v, enabled, maxRetries);
  }

  public ScheduleUpdate withEnabled(Boolean v) {
    return new ScheduleUpdate(
        cronExpression, timezone, webhookUrl, webhookHeaders, payloadTemplate, v, maxRetries);
  }

  public ScheduleUpdate withMaxRetries(Integer v) {
    return new ScheduleUpdate(
        cronExpression, timezone, webhookUrl, webhookHeaders, payloadTemplate, enabled, v);
  }
}
