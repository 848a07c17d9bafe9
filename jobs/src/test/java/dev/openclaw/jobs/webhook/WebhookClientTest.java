package dev.openclaw.jobs.webhook;

import static org.junit.jupiter.api.Assertions.*;

import dev.openclaw.jobs.exceptions.WebhookDeliveryException;
import dev.openclaw.jobs.json.JSONUtil;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

@Timeout(value = 1, unit = TimeUnit.MINUTES)
public class WebhookClientTest {

  private HttpServer server;
  private final AtomicReference<String> receivedBody = new AtomicReference<>();
  private final AtomicReference<String> receivedAuth = new AtomicReference<>();
  private final AtomicReference<String> receivedContentType = new AtomicReference<>();
  private final WebhookClient client = new WebhookClient(Duration.ofSeconds(5));

  @BeforeEach
  void setup() throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext("/ok", exchange -> respond(exchange, 200, "{\"ok\":true}"));
    server.createContext("/accepted", exchange -> respond(exchange, 202, ""));
    server.createContext("/missing", exchange -> respond(exchange, 404, "no such hook"));
    server.createContext("/busy", exchange -> respond(exchange, 429, "slow down"));
    server.createContext("/broken", exchange -> respond(exchange, 500, "x".repeat(500)));
    server.createContext(
        "/redirect",
        exchange -> {
          exchange.getResponseHeaders().add("Location", "http://example.com/elsewhere");
          respond(exchange, 302, "");
        });
    server.start();
  }

  @AfterEach
  void teardown() {
    server.stop(0);
  }

  private void respond(HttpExchange exchange, int status, String body) throws IOException {
    receivedBody.set(
        new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
    receivedAuth.set(exchange.getRequestHeaders().getFirst("Authorization"));
    receivedContentType.set(exchange.getRequestHeaders().getFirst("Content-Type"));
    var bytes = body.getBytes(StandardCharsets.UTF_8);
    exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
    if (bytes.length > 0) {
      try (var out = exchange.getResponseBody()) {
        out.write(bytes);
      }
    }
    exchange.close();
  }

  private URI url(String path) {
    return URI.create("http://127.0.0.1:" + server.getAddress().getPort() + path);
  }

  @Test
  public void postsJsonWithHeaders() {
    var body = new LinkedHashMap<String, Object>();
    body.put("skill_id", "skill-a");
    body.put("collection", null);
    body.put("count", 3);

    int status = client.post(url("/ok"), Map.of("Authorization", "Bearer t0k"), body);

    assertEquals(200, status);
    assertEquals("Bearer t0k", receivedAuth.get());
    assertEquals("application/json", receivedContentType.get());
    var parsed = JSONUtil.toObjectMap(receivedBody.get());
    assertEquals("skill-a", parsed.get("skill_id"));
    assertTrue(parsed.containsKey("collection"));
    assertNull(parsed.get("collection"));
    assertEquals(3, parsed.get("count"));
  }

  @Test
  public void anyTwoHundredIsSuccess() {
    assertEquals(202, client.post(url("/accepted"), null, Map.of()));
  }

  @Test
  public void restrictedHeadersAreDropped() {
    var headers = new LinkedHashMap<String, String>();
    headers.put("Host", "spoofed.example");
    headers.put("Authorization", "Bearer t0k");
    assertEquals(200, client.post(url("/ok"), headers, Map.of()));
    assertEquals("Bearer t0k", receivedAuth.get());
  }

  @Test
  public void clientErrorIsNotRetryable() {
    var e =
        assertThrows(
            WebhookDeliveryException.class, () -> client.post(url("/missing"), null, Map.of()));
    assertEquals(404, e.statusCode());
    assertFalse(e.isRetryable());
    assertTrue(e.getMessage().contains("no such hook"), e.getMessage());
  }

  @Test
  public void rateLimitAndServerErrorsAreRetryable() {
    var busy =
        assertThrows(
            WebhookDeliveryException.class, () -> client.post(url("/busy"), null, Map.of()));
    assertEquals(429, busy.statusCode());
    assertTrue(busy.isRetryable());

    var broken =
        assertThrows(
            WebhookDeliveryException.class, () -> client.post(url("/broken"), null, Map.of()));
    assertEquals(500, broken.statusCode());
    assertTrue(broken.isRetryable());
    assertTrue(broken.getMessage().endsWith("..."), broken.getMessage());
  }

  @Test
  public void redirectsAreNotFollowed() {
    var e =
        assertThrows(
            WebhookDeliveryException.class, () -> client.post(url("/redirect"), null, Map.of()));
    assertEquals(302, e.statusCode());
    assertFalse(e.isRetryable());
  }

  @Test
  public void connectionFailureIsRetryable() throws IOException {
    int port;
    try (var socket = new ServerSocket(0)) {
      port = socket.getLocalPort();
    }
    var e =
        assertThrows(
            WebhookDeliveryException.class,
            () -> client.post(URI.create("http://127.0.0.1:" + port + "/hook"), null, Map.of()));
    assertNull(e.statusCode());
    assertTrue(e.isRetryable());
  }

  @Test
  public void statusClassification() {
    assertTrue(WebhookDeliveryException.isRetryable(null));
    assertTrue(WebhookDeliveryException.isRetryable(408));
    assertTrue(WebhookDeliveryException.isRetryable(409));
    assertTrue(WebhookDeliveryException.isRetryable(425));
    assertTrue(WebhookDeliveryException.isRetryable(502));
    assertFalse(WebhookDeliveryException.isRetryable(400));
    assertFalse(WebhookDeliveryException.isRetryable(401));
    assertFalse(WebhookDeliveryException.isRetryable(410));
  }
}
