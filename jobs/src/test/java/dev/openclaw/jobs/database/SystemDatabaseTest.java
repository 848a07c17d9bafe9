package dev.openclaw.jobs.database;

import static org.junit.jupiter.api.Assertions.*;

import dev.openclaw.jobs.DbSetupTestBase;
import dev.openclaw.jobs.exceptions.NonExistentScheduleException;
import dev.openclaw.jobs.exceptions.ScheduleConflictException;
import dev.openclaw.jobs.migrations.MigrationManager;
import dev.openclaw.jobs.schedule.RunStatus;
import dev.openclaw.jobs.schedule.Schedule;
import dev.openclaw.jobs.schedule.ScheduleFilter;

import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

@Timeout(value = 2, unit = TimeUnit.MINUTES)
public class SystemDatabaseTest extends DbSetupTestBase {

  private static final String SCHEMA = "sysdb_test";
  private static final Instant NOW = Instant.parse("2025-01-15T12:00:00Z");
  private static final Duration STALE = Duration.ofMinutes(5);
  private static final int MAX_ATTEMPTS = 3;

  private SystemDatabase db;

  @BeforeEach
  void setup() throws SQLException {
    MigrationManager.runMigrations(dataSource, SCHEMA);
    try (var conn = dataSource.getConnection();
        var stmt = conn.createStatement()) {
      stmt.execute("TRUNCATE %1$s.internal_job, %1$s.skill_store_schedule".formatted(SCHEMA));
    }
    db = new SystemDatabase(dataSource, SCHEMA);
  }

  @AfterEach
  void teardown() {
    db.close();
    assertFalse(dataSource.isClosed());
  }

  @Test
  public void enqueueClaimComplete() {
    var payload = new LinkedHashMap<String, Object>();
    payload.put("to", "a@example.com");
    payload.put("collection", null);
    payload.put("nested", Map.of("n", 1));
    var job = db.enqueue("email.send", payload, NOW, null, NOW).job();

    var loaded = db.getJob(job.id()).orElseThrow();
    assertEquals("email.send", loaded.kind());
    assertEquals(NOW, loaded.runAt());
    assertEquals(0, loaded.attempts());
    assertEquals("a@example.com", loaded.payload().get("to"));
    assertTrue(loaded.payload().containsKey("collection"));
    assertEquals(Map.of("n", 1), loaded.payload().get("nested"));

    var claimed = db.claimNext("w1", NOW, STALE, MAX_ATTEMPTS).orElseThrow();
    assertEquals(job.id(), claimed.id());
    assertEquals("w1", claimed.lockedBy());
    assertEquals(NOW, claimed.lockedAt());
    assertTrue(db.claimNext("w2", NOW, STALE, MAX_ATTEMPTS).isEmpty());

    assertFalse(db.complete(job.id(), "w2", NOW));
    assertTrue(db.complete(job.id(), "w1", NOW.plusSeconds(1)));
    var done = db.getJob(job.id()).orElseThrow();
    assertEquals(NOW.plusSeconds(1), done.completedAt());
    assertNull(done.lockedBy());
  }

  @Test
  public void idempotentEnqueue() {
    var first = db.enqueue("k", Map.of("n", 1), NOW, "key-1", NOW);
    var second = db.enqueue("k", Map.of("n", 2), NOW, "key-1", NOW);
    var otherKind = db.enqueue("k2", Map.of(), NOW, "key-1", NOW);

    assertTrue(first.created());
    assertFalse(second.created());
    assertEquals(first.job().id(), second.job().id());
    assertEquals(1, second.job().payload().get("n"));
    assertTrue(otherKind.created());
    assertTrue(db.enqueue("k", Map.of(), NOW, null, NOW).created());
    assertTrue(db.enqueue("k", Map.of(), NOW, null, NOW).created());
    assertEquals(Map.of("k", 3L, "k2", 1L), db.countPendingByKind(MAX_ATTEMPTS));
  }

  @Test
  public void failureBackoffAndDeadLetter() {
    var job = db.enqueue("k", Map.of(), NOW, null, NOW).job();
    db.claimNext("w1", NOW, STALE, MAX_ATTEMPTS).orElseThrow();
    assertTrue(db.fail(job.id(), "w1", "boom", NOW, NOW.plusSeconds(2)));

    var failed = db.getJob(job.id()).orElseThrow();
    assertEquals(1, failed.attempts());
    assertEquals("boom", failed.lastError());
    assertEquals(NOW.plusSeconds(2), failed.runAt());
    assertTrue(db.claimNext("w1", NOW.plusSeconds(1), STALE, MAX_ATTEMPTS).isEmpty());

    db.claimNext("w1", NOW.plusSeconds(2), STALE, MAX_ATTEMPTS).orElseThrow();
    assertTrue(db.failPermanently(job.id(), "w1", "fatal", NOW.plusSeconds(2), MAX_ATTEMPTS));
    assertTrue(db.claimNext("w1", NOW.plusSeconds(60), STALE, MAX_ATTEMPTS).isEmpty());

    var dead = db.listDeadLetter(MAX_ATTEMPTS, 10);
    assertEquals(1, dead.size());
    assertEquals("fatal", dead.get(0).lastError());
    assertEquals(Map.of(), db.countPendingByKind(MAX_ATTEMPTS));

    assertTrue(db.requeue(job.id(), MAX_ATTEMPTS, NOW.plusSeconds(60)));
    assertFalse(db.requeue(job.id(), MAX_ATTEMPTS, NOW.plusSeconds(60)));
    var requeued = db.claimNext("w1", NOW.plusSeconds(60), STALE, MAX_ATTEMPTS).orElseThrow();
    assertEquals(0, requeued.attempts());
  }

  @Test
  public void staleLockTakeover() {
    var job = db.enqueue("k", Map.of(), NOW, null, NOW).job();
    db.claimNext("w1", NOW, STALE, MAX_ATTEMPTS).orElseThrow();

    var later = NOW.plus(STALE).plusSeconds(1);
    assertEquals("w2", db.claimNext("w2", later, STALE, MAX_ATTEMPTS).orElseThrow().lockedBy());
    assertFalse(db.fail(job.id(), "w1", "late", later, later));
    assertTrue(db.complete(job.id(), "w2", later));
  }

  @Test
  public void concurrentClaimsAreExclusive() throws Exception {
    int jobCount = 40;
    for (int i = 0; i < jobCount; i++) {
      db.enqueue("k", Map.of("i", i), NOW, null, NOW);
    }

    var claimed = new ConcurrentLinkedQueue<UUID>();
    var executor = Executors.newFixedThreadPool(4);
    try {
      List<Callable<Void>> workers = new ArrayList<>();
      for (int w = 0; w < 4; w++) {
        var workerId = "w" + w;
        workers.add(
            () -> {
              while (true) {
                var job = db.claimNext(workerId, NOW, STALE, MAX_ATTEMPTS);
                if (job.isEmpty()) {
                  return null;
                }
                claimed.add(job.get().id());
              }
            });
      }
      for (Future<Void> f : executor.invokeAll(workers)) {
        f.get();
      }
    } finally {
      executor.shutdownNow();
    }

    assertEquals(jobCount, claimed.size());
    assertEquals(jobCount, new HashSet<>(claimed).size());
  }

  @Test
  public void scheduleRoundTripAndConflicts() {
    var s = schedule("skill-a", null, "*/5 * * * *").withNextRunAt(NOW.plusSeconds(300), NOW);
    var inserted = db.insertSchedule(s);
    assertEquals(s.id(), inserted.id());
    assertNull(inserted.collection());
    assertEquals(Map.of("Authorization", "Bearer t"), inserted.webhookHeaders());
    assertEquals(Map.of("action", "digest"), inserted.payloadTemplate());
    assertEquals(NOW.plusSeconds(300), inserted.nextRunAt());
    assertEquals(inserted, db.getSchedule(s.id()).orElseThrow());

    assertThrows(
        ScheduleConflictException.class,
        () -> db.insertSchedule(schedule("skill-a", null, "*/5 * * * *")));
    assertDoesNotThrow(() -> db.insertSchedule(schedule("skill-a", "notes", "*/5 * * * *")));
    assertThrows(
        ScheduleConflictException.class,
        () -> db.insertSchedule(schedule("skill-a", "notes", "*/5 * * * *")));

    var changed =
        new Schedule(
            s.id(),
            s.skillId(),
            s.collection(),
            "*/15 * * * *",
            "Europe/Paris",
            "https://example.com/v2",
            Map.of(),
            Map.of(),
            false,
            7,
            99,
            NOW,
            RunStatus.FAILED,
            NOW.plusSeconds(900),
            s.createdAt(),
            NOW.plusSeconds(1));
    var updated = db.updateSchedule(changed);
    assertEquals("*/15 * * * *", updated.cronExpression());
    assertEquals("Europe/Paris", updated.timezone());
    assertFalse(updated.enabled());
    assertEquals(7, updated.maxRetries());
    // run bookkeeping is not an administrative field
    assertEquals(0, updated.consecutiveFailures());
    assertNull(updated.lastRunStatus());

    assertThrows(
        NonExistentScheduleException.class,
        () -> db.updateSchedule(schedule("skill-z", null, "*/5 * * * *")));
    assertTrue(db.deleteSchedule(s.id()));
    assertFalse(db.deleteSchedule(s.id()));
  }

  @Test
  public void listFilters() {
    db.insertSchedule(schedule("skill-a", "c1", "*/5 * * * *"));
    db.insertSchedule(schedule("skill-a", "c2", "*/5 * * * *"));
    db.insertSchedule(schedule("skill-b", null, "*/5 * * * *").withEnabled(false, null, NOW));

    assertEquals(3, db.listSchedules(ScheduleFilter.all()).size());
    assertEquals(2, db.listSchedules(ScheduleFilter.all().withSkillId("skill-a")).size());
    assertEquals(1, db.listSchedules(ScheduleFilter.all().withEnabled(false)).size());
    assertEquals(1, db.listSchedules(ScheduleFilter.all().withLimit(1)).size());
    assertEquals(1, db.listSchedules(ScheduleFilter.all().withOffset(2)).size());
  }

  @Test
  public void dueSchedulesAndRunBookkeeping() {
    var due = db.insertSchedule(schedule("skill-a", null, "*/5 * * * *"));
    db.insertSchedule(
        schedule("skill-b", null, "*/5 * * * *").withNextRunAt(NOW.plusSeconds(60), NOW));
    db.insertSchedule(schedule("skill-c", null, "*/5 * * * *").withEnabled(false, NOW, NOW));

    var list = db.listDueSchedules(NOW);
    assertEquals(List.of(due.id()), list.stream().map(Schedule::id).toList());

    var next = NOW.plusSeconds(300);
    assertTrue(db.recordEnqueued(due.id(), NOW, next, NOW.plusSeconds(5)));
    assertFalse(db.recordEnqueued(due.id(), NOW, next, NOW.plusSeconds(5)));
    assertFalse(db.advanceNextRun(due.id(), NOW, next, NOW));

    var started = db.getSchedule(due.id()).orElseThrow();
    assertEquals(next, started.nextRunAt());
    assertEquals(NOW.plusSeconds(5), started.lastRunAt());
    assertNull(started.lastRunStatus());

    assertTrue(db.advanceNextRun(due.id(), next, next.plusSeconds(300), NOW));
    assertEquals(next.plusSeconds(300), db.getSchedule(due.id()).orElseThrow().nextRunAt());

    db.recordRunResult(due.id(), RunStatus.FAILED, NOW.plusSeconds(6), NOW.plusSeconds(7));
    db.recordRunResult(due.id(), RunStatus.FAILED, NOW.plusSeconds(8), NOW.plusSeconds(9));
    db.recordRunResult(due.id(), RunStatus.SKIPPED, NOW.plusSeconds(8), NOW.plusSeconds(9));
    var failing = db.getSchedule(due.id()).orElseThrow();
    assertEquals(2, failing.consecutiveFailures());
    assertEquals(RunStatus.SKIPPED, failing.lastRunStatus());
    assertEquals(NOW.plusSeconds(8), failing.lastRunAt());

    db.recordRunResult(due.id(), RunStatus.SUCCESS, NOW.plusSeconds(10), NOW.plusSeconds(11));
    assertEquals(0, db.getSchedule(due.id()).orElseThrow().consecutiveFailures());
    assertFalse(db.recordRunResult(UUID.randomUUID(), RunStatus.SUCCESS, NOW, NOW));
  }

  @Test
  public void purgeSkill() {
    var a = db.insertSchedule(schedule("skill-a", "c1", "*/5 * * * *"));
    db.insertSchedule(schedule("skill-a", "c2", "*/5 * * * *"));
    var b = db.insertSchedule(schedule("skill-b", null, "*/5 * * * *"));

    var pending = db.enqueue("k", a.jobPayload(), NOW, null, NOW).job();
    var done = db.enqueue("k", a.jobPayload(), NOW.minusSeconds(1), null, NOW).job();
    db.claimNext("w", NOW, STALE, MAX_ATTEMPTS).orElseThrow();
    assertTrue(db.complete(done.id(), "w", NOW));
    var other = db.enqueue("k", b.jobPayload(), NOW, null, NOW).job();

    var result = db.purgeSkill("skill-a");
    assertEquals(2, result.schedulesDeleted());
    assertEquals(1, result.jobsDeleted());
    assertTrue(db.getJob(pending.id()).isEmpty());
    assertTrue(db.getJob(done.id()).isPresent());
    assertTrue(db.getJob(other.id()).isPresent());
    var remaining = db.listSchedules(ScheduleFilter.all());
    assertEquals(List.of(b.id()), remaining.stream().map(Schedule::id).toList());
  }

  static Schedule schedule(String skillId, String collection, String cron) {
    return new Schedule(
        UUID.randomUUID(),
        skillId,
        collection,
        cron,
        "UTC",
        "https://example.com/hook",
        Map.of("Authorization", "Bearer t"),
        Map.of("action", "digest"),
        true,
        5,
        0,
        null,
        null,
        NOW,
        NOW,
        NOW);
  }
}
