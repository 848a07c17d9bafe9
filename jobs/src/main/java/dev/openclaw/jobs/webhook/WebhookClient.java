package dev.openclaw.jobs.webhook;

import dev.openclaw.jobs.exceptions.WebhookDeliveryException;
import dev.openclaw.jobs.json.JSONUtil;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Posts JSON bodies to schedule webhooks. Redirects are not followed. */
public class WebhookClient {

  private static final Logger logger = LoggerFactory.getLogger(WebhookClient.class);

  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

  private final HttpClient httpClient;
  private final Duration requestTimeout;

  public WebhookClient() {
    this(DEFAULT_TIMEOUT);
  }

  public WebhookClient(Duration requestTimeout) {
    this(
        HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NEVER)
            .connectTimeout(requestTimeout)
            .build(),
        requestTimeout);
  }

  public WebhookClient(HttpClient httpClient, Duration requestTimeout) {
    this.httpClient = Objects.requireNonNull(httpClient);
    this.requestTimeout = Objects.requireNonNull(requestTimeout);
  }

  /**
   * Delivers {@code body} and returns the 2xx status of the receiver.
   *
   * @throws WebhookDeliveryException on a non-2xx response or when no response was received
   */
  public int post(URI url, Map<String, String> headers, Map<String, Object> body) {
    var builder =
        HttpRequest.newBuilder(url)
            .timeout(requestTimeout)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(JSONUtil.toJson(body)));
    if (headers != null) {
      for (var header : headers.entrySet()) {
        try {
          builder.setHeader(header.getKey(), header.getValue());
        } catch (IllegalArgumentException e) {
          logger.warn("Not sending restricted header {} to {}", header.getKey(), url.getHost());
        }
      }
    }

    HttpResponse<String> response;
    try {
      response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      throw new WebhookDeliveryException(
          "Webhook delivery to %s failed: %s".formatted(url.getHost(), e.getMessage()), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new WebhookDeliveryException(
          "Webhook delivery to %s was interrupted".formatted(url.getHost()), e);
    }

    int status = response.statusCode();
    if (status >= 200 && status < 300) {
      logger.debug("Webhook {} answered {}", url.getHost(), status);
      return status;
    }
    throw new WebhookDeliveryException(
        "Webhook %s answered HTTP %d: %s"
            .formatted(url.getHost(), status, abbreviate(response.body())),
        status);
  }

  private static String abbreviate(String body) {
    if (body == null) {
      return "";
    }
    return body.length() <= 200 ? body : body.substring(0, 200) + "...";
  }
}
