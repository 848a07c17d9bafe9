package dev.openclaw.jobs.webhook;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the webhook body from a schedule's template. The merge is shallow: run-time values
 * replace template entries with the same top-level key, nested objects are not combined.
 */
public final class PayloadTemplate {

  private PayloadTemplate() {}

  public static Map<String, Object> merge(
      Map<String, Object> template, Map<String, Object> runtime) {
    var body = new LinkedHashMap<String, Object>();
    if (template != null) {
      body.putAll(template);
    }
    if (runtime != null) {
      body.putAll(runtime);
    }
    return body;
  }
}
