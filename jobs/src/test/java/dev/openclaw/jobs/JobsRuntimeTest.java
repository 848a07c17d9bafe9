package dev.openclaw.jobs;

import static org.junit.jupiter.api.Assertions.*;

import dev.openclaw.jobs.config.JobsConfig;
import dev.openclaw.jobs.database.InMemoryJobStore;
import dev.openclaw.jobs.execution.JobOutcome;
import dev.openclaw.jobs.execution.JobsLifecycleListener;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

@Timeout(value = 1, unit = TimeUnit.MINUTES)
public class JobsRuntimeTest {

  private InMemoryJobStore store;
  private JobsConfig config;
  private JobsRuntime runtime;

  @BeforeEach
  void setup() {
    store = new InMemoryJobStore();
    config =
        JobsConfig.defaults()
            .withPollInterval(Duration.ofMillis(50))
            .withHandlerTimeout(Duration.ofSeconds(5));
    runtime = new JobsRuntime(config, store, Clock.systemUTC());
  }

  @AfterEach
  void teardown() throws Exception {
    runtime.close();
  }

  @Test
  public void launchedRuntimeProcessesEnqueuedJobs() throws Exception {
    var seen = ConcurrentHashMap.<String>newKeySet();
    runtime.registerHandler(
        "email.send",
        job -> {
          seen.add((String) job.payload().get("to"));
          return JobOutcome.SUCCEEDED;
        });
    runtime.launch();
    assertTrue(runtime.isLaunched());
    assertTrue(runtime.dispatcher().isRunning());

    var client = new JobsClient(store, config, Clock.systemUTC());
    var job = client.enqueue("email.send", Map.of("to", "a@example.com")).job();

    long deadline = System.currentTimeMillis() + 10_000;
    while (System.currentTimeMillis() < deadline
        && !client.getJob(job.id()).orElseThrow().isCompleted()) {
      Thread.sleep(20);
    }
    assertTrue(client.getJob(job.id()).orElseThrow().isCompleted());
    assertEquals(Set.of("a@example.com"), seen);

    runtime.shutdown();
    assertFalse(runtime.isLaunched());
    assertFalse(runtime.dispatcher().isRunning());
  }

  @Test
  public void listenersStartInOrderAndStopInReverse() {
    List<String> events = new ArrayList<>();
    runtime.registerLifecycleListener(listener("a", events));
    runtime.registerLifecycleListener(listener("b", events));

    runtime.launch();
    runtime.launch();
    runtime.shutdown();
    runtime.shutdown();

    assertEquals(List.of("a up", "b up", "b down", "a down"), events);
  }

  @Test
  public void relaunchDoesNotDuplicateListeners() {
    List<String> events = new ArrayList<>();
    runtime.registerLifecycleListener(listener("a", events));
    runtime.launch();
    runtime.shutdown();
    runtime.launch();
    runtime.shutdown();
    assertEquals(List.of("a up", "a down", "a up", "a down"), events);
  }

  @Test
  public void registrationClosesAtLaunch() {
    runtime.launch();
    assertThrows(
        IllegalStateException.class,
        () -> runtime.registerHandler("late", job -> JobOutcome.SUCCEEDED));
    assertThrows(
        IllegalStateException.class,
        () -> runtime.registerLifecycleListener(listener("late", new ArrayList<>())));
  }

  @Test
  public void scheduledProcessHandlerIsBuiltIn() {
    assertThrows(
        IllegalStateException.class,
        () ->
            runtime.registerHandler(
                Constants.SCHEDULED_PROCESS_KIND, job -> JobOutcome.SUCCEEDED));
  }

  @Test
  public void oneOffPassWithoutLaunch() {
    runtime.registerHandler("noop", job -> JobOutcome.SKIPPED);
    store.enqueue("noop", Map.of(), Clock.systemUTC().instant(), null, Clock.systemUTC().instant());
    var stats = runtime.dispatcher().processAvailable(10);
    assertEquals(1, stats.skipped());
    assertFalse(runtime.isLaunched());
  }

  private static JobsLifecycleListener listener(String name, List<String> events) {
    return new JobsLifecycleListener() {
      @Override
      public void jobsLaunched() {
        events.add(name + " up");
      }

      @Override
      public void jobsShutDown() {
        events.add(name + " down");
      }
    };
  }
}
