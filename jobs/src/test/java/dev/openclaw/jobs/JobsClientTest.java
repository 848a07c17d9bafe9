package dev.openclaw.jobs;

import static org.junit.jupiter.api.Assertions.*;

import dev.openclaw.jobs.config.JobsConfig;
import dev.openclaw.jobs.database.InMemoryJobStore;
import dev.openclaw.jobs.schedule.ScheduleRequest;
import dev.openclaw.jobs.utils.TestClock;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class JobsClientTest {

  private TestClock clock;
  private InMemoryJobStore store;
  private JobsClient client;

  @BeforeEach
  void setup() {
    clock = TestClock.at("2025-01-15T12:00:00Z");
    store = new InMemoryJobStore();
    client = new JobsClient(store, JobsConfig.defaults().withMaxAttempts(2), clock);
  }

  @Test
  public void enqueueDefaults() {
    var result = client.enqueue("report.build", null);
    assertTrue(result.created());
    assertEquals(clock.instant(), result.job().runAt());
    assertEquals(Map.of(), result.job().payload());
    assertEquals(Map.of("report.build", 1L), client.pendingCounts());
  }

  @Test
  public void enqueueWithKeyIsIdempotent() {
    var first = client.enqueue("report.build", Map.of("id", 7), "report-7");
    var second = client.enqueue("report.build", Map.of("id", 8), "report-7");
    assertFalse(second.created());
    assertEquals(first.job().id(), second.job().id());
  }

  @Test
  public void enqueueInFuture() {
    var runAt = Instant.parse("2025-01-15T13:00:00Z");
    var job = client.enqueue("report.build", Map.of(), null, runAt).job();
    assertEquals(runAt, job.runAt());
    assertTrue(store.claimNext("w", clock.instant(), Duration.ofMinutes(5), 2).isEmpty());
  }

  @Test
  public void rejectsBlankKind() {
    assertThrows(IllegalArgumentException.class, () -> client.enqueue(" ", Map.of()));
    assertThrows(NullPointerException.class, () -> client.enqueue(null, Map.of()));
  }

  @Test
  public void deadLettersCanBeRequeued() {
    var job = client.enqueue("report.build", Map.of()).job();
    store.claimNext("w", clock.instant(), Duration.ofMinutes(5), 2).orElseThrow();
    store.failPermanently(job.id(), "w", "bad", clock.instant(), 2);

    assertEquals(1, client.deadLetters(10).size());
    assertEquals(Map.of(), client.pendingCounts());
    assertTrue(client.requeue(job.id()));
    assertTrue(client.deadLetters(10).isEmpty());
    assertEquals(0, client.getJob(job.id()).orElseThrow().attempts());
  }

  @Test
  public void schedulesAndEnqueuePass() {
    client
        .schedules()
        .create(ScheduleRequest.of("skill-a", "*/5 * * * *", "https://example.com/hook"));
    assertEquals(0, client.enqueueDueSchedules());
    clock.set("2025-01-15T12:05:01Z");
    assertEquals(1, client.enqueueDueSchedules());
    assertEquals(Map.of(Constants.SCHEDULED_PROCESS_KIND, 1L), client.pendingCounts());
  }
}
