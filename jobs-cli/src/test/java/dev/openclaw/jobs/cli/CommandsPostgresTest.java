package dev.openclaw.jobs.cli;

import static org.junit.jupiter.api.Assertions.*;

import dev.openclaw.jobs.json.JSONUtil;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.testcontainers.DockerClientFactory;
import org.testcontainers.containers.PostgreSQLContainer;

@Timeout(value = 2, unit = TimeUnit.MINUTES)
public class CommandsPostgresTest {

  static PostgreSQLContainer<?> postgres;

  @BeforeAll
  static void onetimeSetup() {
    Assumptions.assumeTrue(
        DockerClientFactory.instance().isDockerAvailable(), "Docker is not available");
    postgres = new PostgreSQLContainer<>("postgres:16-alpine");
    postgres.start();
  }

  @AfterAll
  static void afterAll() {
    if (postgres != null) {
      postgres.stop();
      postgres = null;
    }
  }

  record Result(int exitCode, String out, String err) {}

  static Result run(String schema, String... args) {
    var cmd = JobsCommand.newCommandLine();
    var out = new StringWriter();
    var err = new StringWriter();
    cmd.setOut(new PrintWriter(out));
    cmd.setErr(new PrintWriter(err));
    var all = new ArrayList<>(List.of(args));
    all.add("-D=" + postgres.getJdbcUrl());
    all.add("-U=" + postgres.getUsername());
    all.add("-P=" + postgres.getPassword());
    all.add("--schema=" + schema);
    int exitCode = cmd.execute(all.toArray(new String[0]));
    return new Result(exitCode, out.toString(), err.toString());
  }

  @Test
  public void migrateTwice() throws Exception {
    var schema = "cli_migrate";
    var first = run(schema, "migrate");
    assertEquals(0, first.exitCode(), first.err());
    assertTrue(first.out().contains("Migrations complete"));
    assertEquals(0, run(schema, "migrate").exitCode());

    assertTrue(checkTable(schema, "internal_job"));
    assertTrue(checkTable(schema, "skill_store_schedule"));
  }

  @Test
  public void scheduleLifecycle() {
    var schema = "cli_schedules";
    assertEquals(0, run(schema, "migrate").exitCode());

    var created =
        run(
            schema,
            "schedule",
            "create",
            "-s=skill-a",
            "--cron=*/10 * * * *",
            "-u=https://example.com/hook",
            "-H=Authorization=Bearer t",
            "-t={\"action\":\"digest\"}");
    assertEquals(0, created.exitCode(), created.err());
    var schedule = JSONUtil.toObjectMap(created.out());
    var id = (String) schedule.get("id");
    assertEquals("skill-a", schedule.get("skillId"));
    assertEquals(Map.of("Authorization", "Bearer t"), schedule.get("webhookHeaders"));
    assertNotNull(schedule.get("nextRunAt"));

    var duplicate =
        run(
            schema,
            "schedule",
            "create",
            "-s=skill-a",
            "--cron=*/10 * * * *",
            "-u=https://example.com/hook");
    assertEquals(JobsCommand.EXIT_INVALID, duplicate.exitCode());
    assertTrue(duplicate.err().startsWith("Error: "));

    var tooFrequent =
        run(schema, "schedule", "create", "-s=skill-b", "--cron=* * * * *", "-u=https://x.io/h");
    assertEquals(JobsCommand.EXIT_INVALID, tooFrequent.exitCode());

    var listed = run(schema, "schedule", "list", "-s=skill-a");
    assertEquals(0, listed.exitCode());
    assertTrue(listed.out().contains(id));

    var paused = JSONUtil.toObjectMap(run(schema, "schedule", "pause", id).out());
    assertEquals(false, paused.get("enabled"));

    var triggered = run(schema, "schedule", "trigger", id);
    assertEquals(0, triggered.exitCode(), triggered.err());
    var job = JSONUtil.toObjectMap(triggered.out());
    assertEquals("skill_store.scheduled_process", job.get("kind"));
    @SuppressWarnings("unchecked")
    var payload = (Map<String, Object>) job.get("payload");
    assertEquals(id, payload.get("schedule_id"));
    assertEquals(true, payload.get("manual_trigger"));

    var pending = JSONUtil.toObjectMap(run(schema, "job", "pending").out());
    assertEquals(1, pending.get("skill_store.scheduled_process"));

    var jobGet = run(schema, "job", "get", (String) job.get("id"));
    assertEquals(0, jobGet.exitCode());

    var purged = run(schema, "skill", "purge", "skill-a", "--yes");
    assertEquals(0, purged.exitCode(), purged.err());
    var result = JSONUtil.toObjectMap(purged.out());
    assertEquals(1, result.get("schedulesDeleted"));
    assertEquals(1, result.get("jobsDeleted"));

    assertEquals(JobsCommand.EXIT_INVALID, run(schema, "schedule", "delete", id).exitCode());
  }

  @Test
  public void enqueueAndDeadLetter() {
    var schema = "cli_jobs";
    assertEquals(0, run(schema, "migrate").exitCode());

    var enqueued = run(schema, "job", "enqueue", "email.send", "-p={\"to\":\"a@b.c\"}", "-k=k1");
    assertEquals(0, enqueued.exitCode(), enqueued.err());
    var again = run(schema, "job", "enqueue", "email.send", "-p={\"to\":\"x@y.z\"}", "-k=k1");
    assertEquals(0, again.exitCode());
    var first = JSONUtil.toObjectMap(enqueued.out());
    var second = JSONUtil.toObjectMap(again.out());
    assertEquals(true, first.get("created"));
    assertEquals(false, second.get("created"));

    var pending = JSONUtil.toObjectMap(run(schema, "job", "pending").out());
    assertEquals(Map.of("email.send", 1), pending);

    assertEquals("[ ]", run(schema, "job", "dead").out().trim());
    @SuppressWarnings("unchecked")
    var job = (Map<String, Object>) first.get("job");
    var requeue = run(schema, "job", "requeue", (String) job.get("id"));
    assertEquals(JobsCommand.EXIT_INVALID, requeue.exitCode());
    assertTrue(requeue.err().contains("is not dead-lettered"));
  }

  static boolean checkTable(String schema, String table) throws SQLException {
    var sql =
        "SELECT EXISTS(SELECT 1 FROM information_schema.tables"
            + " WHERE table_schema = ? AND table_name = ?)";
    try (var conn =
            DriverManager.getConnection(
                postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
        var stmt = conn.prepareStatement(sql)) {
      stmt.setString(1, schema);
      stmt.setString(2, table);
      try (var rs = stmt.executeQuery()) {
        return rs.next() && rs.getBoolean(1);
      }
    }
  }
}
