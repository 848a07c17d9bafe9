package dev.openclaw.jobs.migrations;

import dev.openclaw.jobs.Constants;
import dev.openclaw.jobs.config.JobsConfig;
import dev.openclaw.jobs.database.SystemDatabase;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Objects;

import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates and upgrades the job queue tables. Applied versions are recorded in {@code
 * <schema>.jobs_migrations}; running the migrations again is a no-op.
 */
public class MigrationManager {

  private static final Logger logger = LoggerFactory.getLogger(MigrationManager.class);
  private static final List<String> IGNORABLE_SQL_STATES =
      List.of(
          "42P07", // duplicate_table
          "42710", // duplicate_object
          "42701", // duplicate_column
          "42P06", // duplicate_schema
          "23505" // unique_violation
          );

  public static void runMigrations(JobsConfig config) {
    Objects.requireNonNull(config, "JobsConfig must not be null");

    if (config.dataSource() != null) {
      runMigrations(config.dataSource(), config.databaseSchema());
    } else {
      createDatabaseIfNotExists(config.databaseUrl(), config.dbUser(), config.dbPassword());
      try (var ds = SystemDatabase.createDataSource(config)) {
        runMigrations(ds, config.databaseSchema());
      }
    }
  }

  public static void runMigrations(String url, String user, String password, String schema) {
    Objects.requireNonNull(url, "database url must not be null");
    Objects.requireNonNull(user, "database user must not be null");
    Objects.requireNonNull(password, "database password must not be null");

    createDatabaseIfNotExists(url, user, password);
    try (var ds = SystemDatabase.createDataSource(url, user, password)) {
      runMigrations(ds, schema);
    }
  }

  public static void runMigrations(HikariDataSource ds, String schema) {
    Objects.requireNonNull(ds, "Data Source must not be null");
    var schemaName = Objects.requireNonNullElse(schema, Constants.DB_SCHEMA);
    var quoted = SystemDatabase.sanitizeSchema(schemaName);

    try (var conn = ds.getConnection()) {
      ensureSchema(conn, schemaName, quoted);
      ensureMigrationTable(conn, quoted);
      applyMigrations(conn, quoted, getMigrations(quoted));
    } catch (SQLException e) {
      throw new RuntimeException("Failed to run migrations", e);
    }
  }

  public static void createDatabaseIfNotExists(String url, String user, String password) {
    var pair = extractDbAndPostgresUrl(url);

    try (var adminDS = SystemDatabase.createDataSource(pair.url(), user, password);
        var conn = adminDS.getConnection()) {
      try (var stmt = conn.prepareStatement("SELECT 1 FROM pg_database WHERE datname = ?")) {
        stmt.setString(1, pair.database());
        try (ResultSet rs = stmt.executeQuery()) {
          if (rs.next()) {
            logger.debug("Database '{}' already exists", pair.database());
            return;
          }
        }
      }

      logger.info("Creating '{}' database", pair.database());
      try (Statement stmt = conn.createStatement()) {
        stmt.executeUpdate("CREATE DATABASE \"" + pair.database().replace("\"", "\"\"") + "\"");
      }
    } catch (SQLException e) {
      // the target database may still be reachable even when the admin database is not
      logger.warn("Could not verify or create database {}: {}", pair.database(), e.getMessage());
    }
  }

  public record UrlPair(String url, String database) {}

  public static UrlPair extractDbAndPostgresUrl(String url) {
    int qm = Objects.requireNonNull(url, "database url must not be null").indexOf('?');
    var base = qm >= 0 ? url.substring(0, qm) : url;
    var params = qm >= 0 ? url.substring(qm) : "";
    int slash = base.lastIndexOf('/');
    if (slash < "jdbc:postgresql://".length()) {
      throw new IllegalArgumentException(String.format("JDBC URL %s is not valid", url));
    }

    var newUrl = base.substring(0, slash + 1) + Constants.POSTGRES_DEFAULT_DB + params;
    var databaseName = base.substring(slash + 1);
    return new UrlPair(newUrl, databaseName);
  }

  static void ensureSchema(Connection conn, String schemaName, String quoted) throws SQLException {
    var sql = "SELECT schema_name FROM information_schema.schemata WHERE schema_name = ?";
    try (var stmt = conn.prepareStatement(sql)) {
      stmt.setString(1, schemaName);
      try (var rs = stmt.executeQuery()) {
        if (rs.next()) {
          return;
        }
      }
    }

    logger.info("Creating schema {}", quoted);
    try (var stmt = conn.createStatement()) {
      stmt.execute("CREATE SCHEMA IF NOT EXISTS %s".formatted(quoted));
    }
  }

  static void ensureMigrationTable(Connection conn, String schema) throws SQLException {
    try (var stmt = conn.createStatement()) {
      stmt.execute(
          "CREATE TABLE IF NOT EXISTS %s.jobs_migrations (version BIGINT NOT NULL PRIMARY KEY)"
              .formatted(schema));
    }
  }

  public static int getCurrentVersion(Connection conn, String schema) {
    var sql =
        "SELECT version FROM %s.jobs_migrations ORDER BY version DESC LIMIT 1".formatted(schema);
    try (var stmt = conn.createStatement();
        var rs = stmt.executeQuery(sql)) {
      if (rs.next()) {
        return rs.getInt("version");
      }
    } catch (SQLException e) {
      logger.warn("SQLException thrown querying jobs_migrations table", e);
    }
    return 0;
  }

  static void applyMigrations(Connection conn, String schema, List<String> migrations) {
    var lastApplied = getCurrentVersion(conn, schema);

    for (var i = 0; i < migrations.size(); i++) {
      var version = i + 1;
      if (version <= lastApplied) {
        continue;
      }

      logger.info("Applying job queue schema migration {}", version);
      try (var stmt = conn.createStatement()) {
        stmt.execute(migrations.get(i));
      } catch (SQLException e) {
        if (IGNORABLE_SQL_STATES.contains(e.getSQLState())) {
          logger.warn(
              "Ignoring migration {} error {}; migration was likely already applied",
              version,
              e.getSQLState());
        } else {
          throw new RuntimeException("Failed to run migration %d".formatted(version), e);
        }
      }

      try {
        int rowCount;
        var updateSql = "UPDATE %s.jobs_migrations SET version = ?".formatted(schema);
        try (var stmt = conn.prepareStatement(updateSql)) {
          stmt.setLong(1, version);
          rowCount = stmt.executeUpdate();
        }
        if (rowCount == 0) {
          var insertSql = "INSERT INTO %s.jobs_migrations (version) VALUES (?)".formatted(schema);
          try (var stmt = conn.prepareStatement(insertSql)) {
            stmt.setLong(1, version);
            stmt.executeUpdate();
          }
        }
      } catch (SQLException e) {
        throw new RuntimeException("Failed to update job queue migration version", e);
      }

      lastApplied = version;
    }
  }

  public static List<String> getMigrations(String schema) {
    Objects.requireNonNull(schema);
    return List.of(migration1, migration2, migration3).stream()
        .map(m -> m.formatted(schema))
        .toList();
  }

  static final String migration1 =
      """
      CREATE TABLE %1$s.internal_job (
          id UUID PRIMARY KEY,
          kind TEXT NOT NULL,
          payload JSONB NOT NULL DEFAULT '{}'::jsonb,
          run_at TIMESTAMPTZ NOT NULL DEFAULT now(),
          attempts INTEGER NOT NULL DEFAULT 0,
          idempotency_key TEXT,
          locked_at TIMESTAMPTZ,
          locked_by TEXT,
          completed_at TIMESTAMPTZ,
          last_error TEXT,
          created_at TIMESTAMPTZ NOT NULL DEFAULT now(),
          updated_at TIMESTAMPTZ NOT NULL DEFAULT now()
      );

      CREATE UNIQUE INDEX idx_internal_job_kind_idempotency_key
          ON %1$s.internal_job (kind, idempotency_key)
          WHERE idempotency_key IS NOT NULL;

      CREATE INDEX idx_internal_job_ready
          ON %1$s.internal_job (run_at)
          WHERE completed_at IS NULL;
      """;

  static final String migration2 =
      """
      CREATE TABLE %1$s.skill_store_schedule (
          id UUID PRIMARY KEY,
          skill_id TEXT NOT NULL,
          collection TEXT,
          cron_expression TEXT NOT NULL,
          timezone TEXT NOT NULL DEFAULT 'UTC',
          webhook_url TEXT NOT NULL,
          webhook_headers JSONB NOT NULL DEFAULT '{}'::jsonb,
          payload_template JSONB NOT NULL DEFAULT '{}'::jsonb,
          enabled BOOLEAN NOT NULL DEFAULT true,
          max_retries INTEGER NOT NULL DEFAULT 5,
          consecutive_failures INTEGER NOT NULL DEFAULT 0,
          last_run_at TIMESTAMPTZ,
          last_run_status TEXT,
          next_run_at TIMESTAMPTZ,
          created_at TIMESTAMPTZ NOT NULL DEFAULT now(),
          updated_at TIMESTAMPTZ NOT NULL DEFAULT now(),
          CONSTRAINT skill_store_schedule_last_run_status_check
              CHECK (last_run_status IN ('success', 'failed', 'skipped')),
          CONSTRAINT skill_store_schedule_max_retries_check
              CHECK (max_retries BETWEEN 0 AND 20)
      );

      CREATE INDEX idx_skill_store_schedule_skill_id
          ON %1$s.skill_store_schedule (skill_id);

      CREATE INDEX idx_skill_store_schedule_enabled
          ON %1$s.skill_store_schedule (enabled);

      CREATE INDEX idx_skill_store_schedule_next_run
          ON %1$s.skill_store_schedule (next_run_at)
          WHERE enabled = true;

      CREATE UNIQUE INDEX idx_skill_store_schedule_unique
          ON %1$s.skill_store_schedule (skill_id, collection, cron_expression)
          WHERE collection IS NOT NULL;

      CREATE UNIQUE INDEX idx_skill_store_schedule_unique_no_collection
          ON %1$s.skill_store_schedule (skill_id, cron_expression)
          WHERE collection IS NULL;
      """;

  static final String migration3 =
      """
      CREATE OR REPLACE FUNCTION %1$s.internal_job_notify() RETURNS TRIGGER AS $$
      BEGIN
          PERFORM pg_notify('openclaw_internal_job', NEW.kind);
          RETURN NEW;
      END;
      $$ LANGUAGE plpgsql;

      CREATE TRIGGER internal_job_notify_trigger
      AFTER INSERT ON %1$s.internal_job
      FOR EACH ROW EXECUTE FUNCTION %1$s.internal_job_notify();
      """;
}
