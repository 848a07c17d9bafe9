package dev.openclaw.jobs.cli;

import dev.openclaw.jobs.Constants;
import dev.openclaw.jobs.JobsClient;
import dev.openclaw.jobs.config.JobsConfig;

import java.util.Objects;

import picocli.CommandLine.Option;

public class DatabaseOptions {
  @Option(
      names = {"-D", "--db-url"},
      description = "JDBC URL of the job queue database (defaults to JOBS_JDBC_URL env var)")
  String url;

  @Option(
      names = {"-U", "--db-user"},
      description = "user name for the job queue database (defaults to PGUSER env var)")
  String user;

  @Option(
      names = {"-P", "--db-password"},
      description = "password for the job queue database (defaults to PGPASSWORD env var)",
      arity = "0..1",
      interactive = true)
  String password;

  @Option(
      names = {"--schema"},
      description = "schema holding the job tables (default: ${DEFAULT-VALUE})",
      defaultValue = Constants.DB_SCHEMA)
  String schema;

  public String url() {
    var value =
        Objects.requireNonNullElseGet(this.url, () -> System.getenv(Constants.JDBC_URL_ENV_VAR));
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(
          "No database URL given; use --db-url or set " + Constants.JDBC_URL_ENV_VAR);
    }
    return value;
  }

  public String user() {
    return Objects.requireNonNullElseGet(
        this.user,
        () ->
            Objects.requireNonNullElse(
                System.getenv(Constants.POSTGRES_USER_ENV_VAR), "postgres"));
  }

  public String password() {
    return Objects.requireNonNullElseGet(
        this.password,
        () -> Objects.requireNonNullElse(System.getenv(Constants.POSTGRES_PASSWORD_ENV_VAR), ""));
  }

  public String schema() {
    return schema;
  }

  public JobsConfig config() {
    return JobsConfig.defaultsFromEnv()
        .withDatabaseUrl(url())
        .withDbUser(user())
        .withDbPassword(password())
        .withDatabaseSchema(schema());
  }

  public JobsClient createClient() {
    return createClient(false);
  }

  public JobsClient createClient(boolean allowInsecureWebhooks) {
    return new JobsClient(config().withAllowInsecureWebhooks(allowInsecureWebhooks));
  }
}
