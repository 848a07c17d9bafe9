package dev.openclaw.jobs.database;

import dev.openclaw.jobs.job.EnqueueResult;
import dev.openclaw.jobs.job.Job;
import dev.openclaw.jobs.json.JSONUtil;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class JobsDAO {
  private static final Logger logger = LoggerFactory.getLogger(JobsDAO.class);

  private static final String JOB_COLUMNS =
      "id, kind, payload, run_at, attempts, idempotency_key, locked_at, locked_by, completed_at,"
          + " last_error, created_at, updated_at";

  private final HikariDataSource dataSource;
  private final String schema;

  JobsDAO(HikariDataSource ds, String schema) {
    this.dataSource = ds;
    this.schema = Objects.requireNonNull(schema);
  }

  EnqueueResult enqueue(
      String kind, Map<String, Object> payload, Instant runAt, String idempotencyKey, Instant now)
      throws SQLException {
    var insertSql =
        """
        INSERT INTO %s.internal_job
          (id, kind, payload, run_at, attempts, idempotency_key, created_at, updated_at)
        VALUES (?, ?, ?::jsonb, ?, 0, ?, ?, ?)
        ON CONFLICT (kind, idempotency_key) WHERE idempotency_key IS NOT NULL DO NOTHING
        RETURNING %s
        """
            .formatted(schema, JOB_COLUMNS);

    try (Connection conn = dataSource.getConnection()) {
      try (PreparedStatement ps = conn.prepareStatement(insertSql)) {
        ps.setObject(1, UUID.randomUUID());
        ps.setString(2, kind);
        ps.setString(3, JSONUtil.toJson(payload));
        ps.setObject(4, toTimestamp(runAt));
        if (idempotencyKey == null) {
          ps.setNull(5, Types.VARCHAR);
        } else {
          ps.setString(5, idempotencyKey);
        }
        ps.setObject(6, toTimestamp(now));
        ps.setObject(7, toTimestamp(now));
        try (ResultSet rs = ps.executeQuery()) {
          if (rs.next()) {
            return new EnqueueResult(mapJob(rs), true);
          }
        }
      }

      // ON CONFLICT DO NOTHING returns no row; the existing job is the answer
      var selectSql =
          "SELECT %s FROM %s.internal_job WHERE kind = ? AND idempotency_key = ?"
              .formatted(JOB_COLUMNS, schema);
      try (PreparedStatement ps = conn.prepareStatement(selectSql)) {
        ps.setString(1, kind);
        ps.setString(2, idempotencyKey);
        try (ResultSet rs = ps.executeQuery()) {
          if (rs.next()) {
            logger.debug("Job {} already enqueued with key {}", kind, idempotencyKey);
            return new EnqueueResult(mapJob(rs), false);
          }
        }
      }
    }
    throw new IllegalStateException(
        "Enqueue of %s with key %s neither inserted nor found a job"
            .formatted(kind, idempotencyKey));
  }

  Optional<Job> claimNext(String workerId, Instant now, Duration staleAfter, int maxAttempts)
      throws SQLException {
    if (dataSource.isClosed()) {
      throw new IllegalStateException("Database is closed!");
    }

    var sql =
        """
        UPDATE %1$s.internal_job
        SET locked_at = ?, locked_by = ?, updated_at = ?
        WHERE id = (
          SELECT id FROM %1$s.internal_job
          WHERE completed_at IS NULL
            AND run_at <= ?
            AND attempts < ?
            AND (locked_at IS NULL OR locked_at < ?)
          ORDER BY run_at, created_at
          LIMIT 1
          FOR UPDATE SKIP LOCKED
        )
        RETURNING %2$s
        """
            .formatted(schema, JOB_COLUMNS);

    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setObject(1, toTimestamp(now));
      ps.setString(2, workerId);
      ps.setObject(3, toTimestamp(now));
      ps.setObject(4, toTimestamp(now));
      ps.setInt(5, maxAttempts);
      ps.setObject(6, toTimestamp(now.minus(staleAfter)));
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next() ? Optional.of(mapJob(rs)) : Optional.empty();
      }
    }
  }

  boolean complete(UUID jobId, String workerId, Instant now) throws SQLException {
    var sql =
        """
        UPDATE %s.internal_job
        SET completed_at = ?, locked_at = NULL, locked_by = NULL, updated_at = ?
        WHERE id = ? AND locked_by = ? AND completed_at IS NULL
        """
            .formatted(schema);
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setObject(1, toTimestamp(now));
      ps.setObject(2, toTimestamp(now));
      ps.setObject(3, jobId);
      ps.setString(4, workerId);
      return ps.executeUpdate() > 0;
    }
  }

  boolean fail(UUID jobId, String workerId, String error, Instant now, Instant retryAt)
      throws SQLException {
    var sql =
        """
        UPDATE %s.internal_job
        SET attempts = attempts + 1, last_error = ?, run_at = ?,
            locked_at = NULL, locked_by = NULL, updated_at = ?
        WHERE id = ? AND locked_by = ? AND completed_at IS NULL
        """
            .formatted(schema);
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setString(1, error);
      ps.setObject(2, toTimestamp(retryAt));
      ps.setObject(3, toTimestamp(now));
      ps.setObject(4, jobId);
      ps.setString(5, workerId);
      return ps.executeUpdate() > 0;
    }
  }

  boolean failPermanently(UUID jobId, String workerId, String error, Instant now, int maxAttempts)
      throws SQLException {
    var sql =
        """
        UPDATE %s.internal_job
        SET attempts = GREATEST(attempts + 1, ?), last_error = ?,
            locked_at = NULL, locked_by = NULL, updated_at = ?
        WHERE id = ? AND locked_by = ? AND completed_at IS NULL
        """
            .formatted(schema);
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setInt(1, maxAttempts);
      ps.setString(2, error);
      ps.setObject(3, toTimestamp(now));
      ps.setObject(4, jobId);
      ps.setString(5, workerId);
      return ps.executeUpdate() > 0;
    }
  }

  Optional<Job> getJob(UUID jobId) throws SQLException {
    var sql = "SELECT %s FROM %s.internal_job WHERE id = ?".formatted(JOB_COLUMNS, schema);
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setObject(1, jobId);
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next() ? Optional.of(mapJob(rs)) : Optional.empty();
      }
    }
  }

  Map<String, Long> countPendingByKind(int maxAttempts) throws SQLException {
    var sql =
        """
        SELECT kind, COUNT(*) AS pending FROM %s.internal_job
        WHERE completed_at IS NULL AND attempts < ?
        GROUP BY kind ORDER BY kind
        """
            .formatted(schema);
    var counts = new LinkedHashMap<String, Long>();
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setInt(1, maxAttempts);
      try (ResultSet rs = ps.executeQuery()) {
        while (rs.next()) {
          counts.put(rs.getString("kind"), rs.getLong("pending"));
        }
      }
    }
    return counts;
  }

  List<Job> listDeadLetter(int maxAttempts, int limit) throws SQLException {
    var sql =
        """
        SELECT %s FROM %s.internal_job
        WHERE completed_at IS NULL AND attempts >= ?
        ORDER BY updated_at DESC
        LIMIT ?
        """
            .formatted(JOB_COLUMNS, schema);
    var jobs = new ArrayList<Job>();
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setInt(1, maxAttempts);
      ps.setInt(2, limit);
      try (ResultSet rs = ps.executeQuery()) {
        while (rs.next()) {
          jobs.add(mapJob(rs));
        }
      }
    }
    return jobs;
  }

  boolean requeue(UUID jobId, int maxAttempts, Instant now) throws SQLException {
    var sql =
        """
        UPDATE %s.internal_job
        SET attempts = 0, last_error = NULL, run_at = ?,
            locked_at = NULL, locked_by = NULL, updated_at = ?
        WHERE id = ? AND completed_at IS NULL AND attempts >= ?
        """
            .formatted(schema);
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setObject(1, toTimestamp(now));
      ps.setObject(2, toTimestamp(now));
      ps.setObject(3, jobId);
      ps.setInt(4, maxAttempts);
      return ps.executeUpdate() > 0;
    }
  }

  static int deleteUncompletedJobsForSkill(Connection conn, String schema, String skillId)
      throws SQLException {
    var sql =
        "DELETE FROM %s.internal_job WHERE completed_at IS NULL AND payload->>'skill_id' = ?"
            .formatted(schema);
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setString(1, skillId);
      return ps.executeUpdate();
    }
  }

  static Job mapJob(ResultSet rs) throws SQLException {
    return new Job(
        rs.getObject("id", UUID.class),
        rs.getString("kind"),
        JSONUtil.toObjectMap(rs.getString("payload")),
        toInstant(rs, "run_at"),
        rs.getInt("attempts"),
        rs.getString("idempotency_key"),
        toInstant(rs, "locked_at"),
        rs.getString("locked_by"),
        toInstant(rs, "completed_at"),
        rs.getString("last_error"),
        toInstant(rs, "created_at"),
        toInstant(rs, "updated_at"));
  }

  static OffsetDateTime toTimestamp(Instant instant) {
    return instant == null ? null : OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
  }

  static Instant toInstant(ResultSet rs, String column) throws SQLException {
    var value = rs.getObject(column, OffsetDateTime.class);
    return value == null ? null : value.toInstant();
  }
}
