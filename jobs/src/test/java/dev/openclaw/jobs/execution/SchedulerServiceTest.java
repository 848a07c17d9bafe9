package dev.openclaw.jobs.execution;

import static org.junit.jupiter.api.Assertions.*;

import dev.openclaw.jobs.database.InMemoryJobStore;
import dev.openclaw.jobs.schedule.ScheduleRequest;
import dev.openclaw.jobs.schedule.ScheduleService;
import dev.openclaw.jobs.schedule.ScheduleValidator;
import dev.openclaw.jobs.utils.TestClock;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

@Timeout(value = 1, unit = TimeUnit.MINUTES)
public class SchedulerServiceTest {

  @Test
  public void delayIsToTheNextMinuteBoundary() {
    var clock = TestClock.at("2025-01-15T12:00:45.250Z");
    var store = new InMemoryJobStore();
    var scheduler = new SchedulerService(new ScheduleEnqueuer(store, store, clock), clock);

    assertEquals(Duration.ofMillis(14_750), scheduler.delayToNextMinute());
    clock.set("2025-01-15T12:00:00Z");
    assertEquals(Duration.ofMinutes(1), scheduler.delayToNextMinute());
  }

  @Test
  public void tickEnqueuesDueSchedules() throws Exception {
    var clock = TestClock.at("2025-01-15T11:59:00Z");
    var store = new InMemoryJobStore();
    var service = new ScheduleService(store, store, new ScheduleValidator(false), clock);
    var schedule =
        service.create(ScheduleRequest.of("skill-a", "*/5 * * * *", "https://example.com/hook"));

    // first tick fires 100 ms after launch
    clock.set("2025-01-15T12:00:59.900Z");
    var scheduler = new SchedulerService(new ScheduleEnqueuer(store, store, clock), clock);
    scheduler.jobsLaunched();
    try {
      assertTrue(scheduler.isRunning());
      long deadline = System.currentTimeMillis() + 10_000;
      while (System.currentTimeMillis() < deadline
          && service.get(schedule.id()).lastRunAt() == null) {
        Thread.sleep(20);
      }
    } finally {
      scheduler.jobsShutDown();
    }

    assertFalse(scheduler.isRunning());
    assertEquals(clock.instant(), service.get(schedule.id()).lastRunAt());
    assertEquals(1L, store.countPendingByKind(5).values().stream().mapToLong(v -> v).sum());
  }

  @Test
  public void shutdownIsIdempotent() {
    var clock = TestClock.at("2025-01-15T12:00:00Z");
    var store = new InMemoryJobStore();
    var scheduler = new SchedulerService(new ScheduleEnqueuer(store, store, clock), clock);
    scheduler.jobsShutDown();
    scheduler.jobsLaunched();
    scheduler.jobsLaunched();
    scheduler.jobsShutDown();
    scheduler.jobsShutDown();
    assertFalse(scheduler.isRunning());
  }
}
