package dev.openclaw.jobs.database;

import static dev.openclaw.jobs.database.JobsDAO.toInstant;
import static dev.openclaw.jobs.database.JobsDAO.toTimestamp;

import dev.openclaw.jobs.exceptions.NonExistentScheduleException;
import dev.openclaw.jobs.exceptions.ScheduleConflictException;
import dev.openclaw.jobs.json.JSONUtil;
import dev.openclaw.jobs.schedule.PurgeResult;
import dev.openclaw.jobs.schedule.RunStatus;
import dev.openclaw.jobs.schedule.Schedule;
import dev.openclaw.jobs.schedule.ScheduleFilter;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class SchedulesDAO {
  private static final Logger logger = LoggerFactory.getLogger(SchedulesDAO.class);

  private static final String UNIQUE_VIOLATION = "23505";
  private static final String SCHEDULE_COLUMNS =
      "id, skill_id, collection, cron_expression, timezone, webhook_url, webhook_headers,"
          + " payload_template, enabled, max_retries, consecutive_failures, last_run_at,"
          + " last_run_status, next_run_at, created_at, updated_at";

  private final HikariDataSource dataSource;
  private final String schema;

  SchedulesDAO(HikariDataSource ds, String schema) {
    this.dataSource = ds;
    this.schema = Objects.requireNonNull(schema);
  }

  Schedule insertSchedule(Schedule s) throws SQLException {
    var sql =
        """
        INSERT INTO %s.skill_store_schedule
          (id, skill_id, collection, cron_expression, timezone, webhook_url, webhook_headers,
           payload_template, enabled, max_retries, consecutive_failures, next_run_at,
           created_at, updated_at)
        VALUES (?, ?, ?, ?, ?, ?, ?::jsonb, ?::jsonb, ?, ?, ?, ?, ?, ?)
        RETURNING %s
        """
            .formatted(schema, SCHEDULE_COLUMNS);
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setObject(1, s.id());
      ps.setString(2, s.skillId());
      setNullableString(ps, 3, s.collection());
      ps.setString(4, s.cronExpression());
      ps.setString(5, s.timezone());
      ps.setString(6, s.webhookUrl());
      ps.setString(7, JSONUtil.toJson(s.webhookHeaders()));
      ps.setString(8, JSONUtil.toJson(s.payloadTemplate()));
      ps.setBoolean(9, s.enabled());
      ps.setInt(10, s.maxRetries());
      ps.setInt(11, s.consecutiveFailures());
      ps.setObject(12, toTimestamp(s.nextRunAt()));
      ps.setObject(13, toTimestamp(s.createdAt()));
      ps.setObject(14, toTimestamp(s.updatedAt()));
      try (ResultSet rs = ps.executeQuery()) {
        rs.next();
        return mapSchedule(rs);
      }
    } catch (SQLException e) {
      throw conflictOr(e, s);
    }
  }

  Optional<Schedule> getSchedule(UUID scheduleId) throws SQLException {
    var sql =
        "SELECT %s FROM %s.skill_store_schedule WHERE id = ?".formatted(SCHEDULE_COLUMNS, schema);
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setObject(1, scheduleId);
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next() ? Optional.of(mapSchedule(rs)) : Optional.empty();
      }
    }
  }

  List<Schedule> listSchedules(ScheduleFilter filter) throws SQLException {
    var sql = new StringBuilder();
    sql.append(
        "SELECT %s FROM %s.skill_store_schedule WHERE 1 = 1".formatted(SCHEDULE_COLUMNS, schema));
    var params = new ArrayList<Object>();
    if (filter.skillId() != null) {
      sql.append(" AND skill_id = ?");
      params.add(filter.skillId());
    }
    if (filter.enabled() != null) {
      sql.append(" AND enabled = ?");
      params.add(filter.enabled());
    }
    sql.append(" ORDER BY created_at, id LIMIT ? OFFSET ?");
    params.add(filter.limit());
    params.add(filter.offset());

    var schedules = new ArrayList<Schedule>();
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(sql.toString())) {
      for (int i = 0; i < params.size(); i++) {
        ps.setObject(i + 1, params.get(i));
      }
      try (ResultSet rs = ps.executeQuery()) {
        while (rs.next()) {
          schedules.add(mapSchedule(rs));
        }
      }
    }
    return schedules;
  }

  Schedule updateSchedule(Schedule s) throws SQLException {
    var sql =
        """
        UPDATE %s.skill_store_schedule
        SET cron_expression = ?, timezone = ?, webhook_url = ?, webhook_headers = ?::jsonb,
            payload_template = ?::jsonb, enabled = ?, max_retries = ?, next_run_at = ?,
            updated_at = ?
        WHERE id = ?
        RETURNING %s
        """
            .formatted(schema, SCHEDULE_COLUMNS);
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setString(1, s.cronExpression());
      ps.setString(2, s.timezone());
      ps.setString(3, s.webhookUrl());
      ps.setString(4, JSONUtil.toJson(s.webhookHeaders()));
      ps.setString(5, JSONUtil.toJson(s.payloadTemplate()));
      ps.setBoolean(6, s.enabled());
      ps.setInt(7, s.maxRetries());
      ps.setObject(8, toTimestamp(s.nextRunAt()));
      ps.setObject(9, toTimestamp(s.updatedAt()));
      ps.setObject(10, s.id());
      try (ResultSet rs = ps.executeQuery()) {
        if (!rs.next()) {
          throw new NonExistentScheduleException(s.id());
        }
        return mapSchedule(rs);
      }
    } catch (SQLException e) {
      throw conflictOr(e, s);
    }
  }

  boolean deleteSchedule(UUID scheduleId) throws SQLException {
    var sql = "DELETE FROM %s.skill_store_schedule WHERE id = ?".formatted(schema);
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setObject(1, scheduleId);
      return ps.executeUpdate() > 0;
    }
  }

  List<Schedule> listDueSchedules(Instant now) throws SQLException {
    var sql =
        """
        SELECT %s FROM %s.skill_store_schedule
        WHERE enabled = true AND next_run_at IS NOT NULL AND next_run_at <= ?
        ORDER BY next_run_at, id
        """
            .formatted(SCHEDULE_COLUMNS, schema);
    var schedules = new ArrayList<Schedule>();
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setObject(1, toTimestamp(now));
      try (ResultSet rs = ps.executeQuery()) {
        while (rs.next()) {
          schedules.add(mapSchedule(rs));
        }
      }
    }
    return schedules;
  }

  boolean recordEnqueued(
      UUID scheduleId, Instant expectedNextRunAt, Instant nextRunAt, Instant enqueuedAt)
      throws SQLException {
    var sql =
        """
        UPDATE %s.skill_store_schedule
        SET last_run_at = ?, last_run_status = NULL, next_run_at = ?, updated_at = ?
        WHERE id = ? AND next_run_at = ?
        """
            .formatted(schema);
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setObject(1, toTimestamp(enqueuedAt));
      ps.setObject(2, toTimestamp(nextRunAt));
      ps.setObject(3, toTimestamp(enqueuedAt));
      ps.setObject(4, scheduleId);
      ps.setObject(5, toTimestamp(expectedNextRunAt));
      return ps.executeUpdate() > 0;
    }
  }

  boolean advanceNextRun(UUID scheduleId, Instant expectedNextRunAt, Instant nextRunAt, Instant now)
      throws SQLException {
    var sql =
        """
        UPDATE %s.skill_store_schedule
        SET next_run_at = ?, updated_at = ?
        WHERE id = ? AND next_run_at = ?
        """
            .formatted(schema);
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setObject(1, toTimestamp(nextRunAt));
      ps.setObject(2, toTimestamp(now));
      ps.setObject(3, scheduleId);
      ps.setObject(4, toTimestamp(expectedNextRunAt));
      return ps.executeUpdate() > 0;
    }
  }

  boolean recordRunResult(UUID scheduleId, RunStatus status, Instant runAt, Instant now)
      throws SQLException {
    var sql =
        """
        UPDATE %s.skill_store_schedule
        SET last_run_at = ?,
            last_run_status = ?,
            consecutive_failures = CASE
              WHEN ? = 'success' THEN 0
              WHEN ? = 'failed' THEN consecutive_failures + 1
              ELSE consecutive_failures
            END,
            updated_at = ?
        WHERE id = ?
        """
            .formatted(schema);
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setObject(1, toTimestamp(runAt));
      ps.setString(2, status.value());
      ps.setString(3, status.value());
      ps.setString(4, status.value());
      ps.setObject(5, toTimestamp(now));
      ps.setObject(6, scheduleId);
      return ps.executeUpdate() > 0;
    }
  }

  PurgeResult purgeSkill(String skillId) throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      conn.setAutoCommit(false);
      try {
        int jobs = JobsDAO.deleteUncompletedJobsForSkill(conn, schema, skillId);
        int schedules;
        var sql = "DELETE FROM %s.skill_store_schedule WHERE skill_id = ?".formatted(schema);
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
          ps.setString(1, skillId);
          schedules = ps.executeUpdate();
        }
        conn.commit();
        logger.info(
            "Purged skill {}: {} schedules, {} pending jobs deleted", skillId, schedules, jobs);
        return new PurgeResult(skillId, schedules, jobs);
      } catch (SQLException e) {
        conn.rollback();
        throw e;
      }
    }
  }

  private static RuntimeException conflictOr(SQLException e, Schedule s) throws SQLException {
    if (UNIQUE_VIOLATION.equals(e.getSQLState())) {
      return new ScheduleConflictException(s.skillId(), s.collection(), s.cronExpression());
    }
    throw e;
  }

  private static void setNullableString(PreparedStatement ps, int index, String value)
      throws SQLException {
    if (value == null) {
      ps.setNull(index, Types.VARCHAR);
    } else {
      ps.setString(index, value);
    }
  }

  static Schedule mapSchedule(ResultSet rs) throws SQLException {
    return new Schedule(
        rs.getObject("id", UUID.class),
        rs.getString("skill_id"),
        rs.getString("collection"),
        rs.getString("cron_expression"),
        rs.getString("timezone"),
        rs.getString("webhook_url"),
        JSONUtil.toStringMap(rs.getString("webhook_headers")),
        JSONUtil.toObjectMap(rs.getString("payload_template")),
        rs.getBoolean("enabled"),
        rs.getInt("max_retries"),
        rs.getInt("consecutive_failures"),
        toInstant(rs, "last_run_at"),
        RunStatus.fromValue(rs.getString("last_run_status")),
        toInstant(rs, "next_run_at"),
        toInstant(rs, "created_at"),
        toInstant(rs, "updated_at"));
  }
}
