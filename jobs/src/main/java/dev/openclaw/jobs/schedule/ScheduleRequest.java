package dev.openclaw.jobs.schedule;

import java.util.Map;

/**
 * Input for creating a schedule. {@code skillId}, {@code cronExpression} and {@code webhookUrl}
 * are required; everything else falls back to a default when left null (UTC timezone, enabled,
 * five retries, empty headers and template).
 */
public record ScheduleRequest(
    String skillId,
    String collection,
    String cronExpression,
    String timezone,
    String webhookUrl,
    Map<String, String> webhookHeaders,
    Map<String, Object> payloadTemplate,
    Boolean enabled,
    Integer maxRetries) {

  public static ScheduleRequest of(String skillId, String cronExpression, String webhookUrl) {
    return new ScheduleRequest(
        skillId, null, cronExpression, null, webhookUrl, null, null, null, null);
  }

  public ScheduleRequest withCollection(String v) {
    return new ScheduleRequest(
        skillId,
        v,
        cronExpression,
        timezone,
        webhookUrl,
        webhookHeaders,
        payloadTemplate,
        enabled,
        maxRetries);
  }

  public ScheduleRequest withTimezone(String v) {
    return new ScheduleRequest(
        skillId,
        collection,
        cronExpression,
        v,
        webhookUrl,
        webhookHeaders,
        payloadTemplate,
        enabled,
        maxRetries);
  }

  public ScheduleRequest withWebhookHeaders(Map<String, String> v) {
    return new ScheduleRequest(
        skillId,
        collection,
        cronExpression,
        timezone,
        webhookUrl,
        v,
        payloadTemplate,
        enabled,
        maxRetries);
  }

  public ScheduleRequest withPayloadTemplate(Map<String, Object> v) {
    return new ScheduleRequest(
        skillId,
        collection,
        cronExpression,
        timezone,
        webhookUrl,
        webhookHeaders,
        v,
        enabled,
        maxRetries);
  }

  public ScheduleRequest withEnabled(Boolean v) {
    return new ScheduleRequest(
        skillId,
        collection,
        cronExpression,
        timezone,
        webhookUrl,
        webhookHeaders,
        payloadTemplate,
        v,
        maxRetries);
  }

  public ScheduleRequest withMaxRetries(Integer v) {
    return new ScheduleRequest(
        skillId,
        collection,
        cronExpression,
        timezone,
        webhookUrl,
        webhookHeaders,
        payloadTemplate,
        enabled,
        v);
  }
}
