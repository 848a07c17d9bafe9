package dev.openclaw.jobs.schedule;

import static org.junit.jupiter.api.Assertions.*;

import dev.openclaw.jobs.Constants;
import dev.openclaw.jobs.database.InMemoryJobStore;
import dev.openclaw.jobs.exceptions.InvalidScheduleException;
import dev.openclaw.jobs.exceptions.NonExistentScheduleException;
import dev.openclaw.jobs.exceptions.ScheduleConflictException;
import dev.openclaw.jobs.utils.TestClock;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class ScheduleServiceTest {

  private TestClock clock;
  private InMemoryJobStore store;
  private ScheduleService service;

  @BeforeEach
  void setup() {
    clock = TestClock.at("2025-01-15T12:00:00Z");
    store = new InMemoryJobStore();
    service = new ScheduleService(store, store, new ScheduleValidator(false), clock);
  }

  private static ScheduleRequest request(String cron) {
    return ScheduleRequest.of("skill-a", cron, "https://example.com/hook");
  }

  @Test
  public void createAppliesDefaults() {
    var s = service.create(request("0 */12 * * *"));

    assertEquals("skill-a", s.skillId());
    assertNull(s.collection());
    assertEquals("UTC", s.timezone());
    assertTrue(s.enabled());
    assertEquals(Constants.DEFAULT_SCHEDULE_MAX_RETRIES, s.maxRetries());
    assertEquals(0, s.consecutiveFailures());
    assertNull(s.lastRunAt());
    assertNull(s.lastRunStatus());
    assertEquals(Instant.parse("2025-01-16T00:00:00Z"), s.nextRunAt());
    assertEquals(Map.of(), s.payloadTemplate());
    assertEquals(s, service.get(s.id()));
  }

  @Test
  public void createComputesNextRunInTimezone() {
    var s = service.create(request("0 9 * * *").withTimezone("America/New_York"));
    assertEquals(Instant.parse("2025-01-15T14:00:00Z"), s.nextRunAt());
  }

  @Test
  public void createRejectsInvalidRequestsWithoutStoring() {
    assertThrows(InvalidScheduleException.class, () -> service.create(request("* * * * *")));
    assertThrows(
        InvalidScheduleException.class,
        () -> service.create(request("*/5 * * * *").withTimezone("Nowhere/Land")));
    assertThrows(InvalidScheduleException.class, () -> service.create(request("0 0 30 2 *")));
    assertTrue(service.list(ScheduleFilter.all()).isEmpty());
  }

  @Test
  public void updateRejectsCronThatNeverFires() {
    var s = service.create(request("0 */12 * * *"));
    var update = ScheduleUpdate.none().withCronExpression("0 0 31 11 *");
    assertThrows(InvalidScheduleException.class, () -> service.update(s.id(), update));
    assertEquals("0 */12 * * *", service.get(s.id()).cronExpression());
  }

  @Test
  public void createRejectsDuplicates() {
    service.create(request("*/5 * * * *"));
    assertThrows(ScheduleConflictException.class, () -> service.create(request("*/5 * * * *")));
    assertDoesNotThrow(() -> service.create(request("*/5 * * * *").withCollection("notes")));
  }

  @Test
  public void updateRecomputesNextRunOnlyWhenTimingChanges() {
    var s = service.create(request("0 */12 * * *"));
    clock.advance(Duration.ofMinutes(1));

    var urlOnly =
        service.update(s.id(), ScheduleUpdate.none().withWebhookUrl("https://example.com/v2"));
    assertEquals("https://example.com/v2", urlOnly.webhookUrl());
    assertEquals(s.nextRunAt(), urlOnly.nextRunAt());

    var retimed = service.update(s.id(), ScheduleUpdate.none().withCronExpression("30 * * * *"));
    assertEquals("30 * * * *", retimed.cronExpression());
    assertEquals(Instant.parse("2025-01-15T12:30:00Z"), retimed.nextRunAt());

    var rezoned =
        service.update(
            s.id(),
            ScheduleUpdate.none().withCronExpression("0 9 * * *").withTimezone("Europe/Paris"));
    assertEquals(Instant.parse("2025-01-16T08:00:00Z"), rezoned.nextRunAt());
  }

  @Test
  public void updateValidatesAndReportsMissing() {
    var s = service.create(request("*/5 * * * *"));
    assertThrows(
        InvalidScheduleException.class,
        () -> service.update(s.id(), ScheduleUpdate.none().withCronExpression("* * * * *")));
    assertThrows(
        NonExistentScheduleException.class,
        () -> service.update(UUID.randomUUID(), ScheduleUpdate.none().withMaxRetries(2)));
    assertEquals(s, service.update(s.id(), ScheduleUpdate.none()));
  }

  @Test
  public void pauseAndResume() {
    var s = service.create(request("*/5 * * * *"));
    assertEquals(Instant.parse("2025-01-15T12:05:00Z"), s.nextRunAt());

    var paused = service.pause(s.id());
    assertFalse(paused.enabled());
    assertEquals(paused, service.pause(s.id()));

    clock.set("2025-01-15T13:02:00Z");
    assertTrue(store.listDueSchedules(clock.instant()).isEmpty());

    var resumed = service.resume(s.id());
    assertTrue(resumed.enabled());
    // missed runs are not replayed
    assertEquals(Instant.parse("2025-01-15T13:05:00Z"), resumed.nextRunAt());
    assertEquals(resumed, service.resume(s.id()));
  }

  @Test
  public void enablingThroughUpdateRecomputesNextRun() {
    var s = service.create(request("*/5 * * * *").withEnabled(false));
    clock.set("2025-01-15T14:11:00Z");
    var enabled = service.update(s.id(), ScheduleUpdate.none().withEnabled(true));
    assertEquals(Instant.parse("2025-01-15T14:15:00Z"), enabled.nextRunAt());
  }

  @Test
  public void triggerEnqueuesManualRun() {
    var s = service.create(request("*/5 * * * *").withCollection("notes"));

    var first = service.trigger(s.id());
    var second = service.trigger(s.id());
    assertTrue(first.created());
    assertTrue(second.created());
    assertNotEquals(first.job().id(), second.job().id());

    var job = first.job();
    assertEquals(Constants.SCHEDULED_PROCESS_KIND, job.kind());
    assertNull(job.idempotencyKey());
    assertEquals(clock.instant(), job.runAt());
    assertEquals(s.id().toString(), job.payload().get(Schedule.SCHEDULE_ID_KEY));
    assertEquals("skill-a", job.payload().get(Schedule.SKILL_ID_KEY));
    assertEquals("notes", job.payload().get(Schedule.COLLECTION_KEY));
    assertEquals(true, job.payload().get(Schedule.MANUAL_TRIGGER_KEY));

    assertThrows(NonExistentScheduleException.class, () -> service.trigger(UUID.randomUUID()));
  }

  @Test
  public void deleteAndList() {
    var a = service.create(request("*/5 * * * *"));
    service.create(request("*/10 * * * *"));
    service.create(ScheduleRequest.of("skill-b", "*/5 * * * *", "https://example.com/b"));

    assertEquals(3, service.list(null).size());
    assertEquals(2, service.list(ScheduleFilter.all().withSkillId("skill-a")).size());

    assertTrue(service.delete(a.id()));
    assertFalse(service.delete(a.id()));
    assertTrue(service.find(a.id()).isEmpty());
    assertThrows(NonExistentScheduleException.class, () -> service.get(a.id()));
  }

  @Test
  public void purgeRequiresConfirmation() {
    var s = service.create(request("*/5 * * * *"));
    service.trigger(s.id());

    assertThrows(IllegalArgumentException.class, () -> service.purgeSkill("skill-a", false));
    assertEquals(1, service.list(null).size());

    var result = service.purgeSkill("skill-a", true);
    assertEquals(1, result.schedulesDeleted());
    assertEquals(1, result.jobsDeleted());
    assertTrue(service.list(null).isEmpty());
    assertThrows(InvalidScheduleException.class, () -> service.purgeSkill("", true));
  }
}
