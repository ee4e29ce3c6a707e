package dev.workflowcron.scheduler.cli;

import dev.workflowcron.scheduler.Constants;
import dev.workflowcron.scheduler.config.SchedulerConfig;

import java.util.Objects;

import picocli.CommandLine.Option;

public class DatabaseOptions {
  @Option(
      names = {"-D", "--db-url"},
      description = "Your scheduler database URL (defaults to SCHEDULER_JDBC_URL env var)")
  private String url;

  @Option(
      names = {"-U", "--db-user"},
      description = "user name for your scheduler database (defaults to PGUSER env var)")
  private String user;

  @Option(
      names = {"-P", "--db-password"},
      description = "password for your scheduler database (defaults to PGPASSWORD env var)",
      arity = "0..1",
      interactive = true)
  private String password;

  @Option(
      names = {"--schema"},
      description = "Schema holding the scheduler tables (default: ${DEFAULT-VALUE})",
      defaultValue = Constants.DB_SCHEMA)
  private String schema;

  public String url() {
    return Objects.requireNonNullElseGet(
        this.url, () -> System.getenv(Constants.JDBC_URL_ENV_VAR));
  }

  public String user() {
    return Objects.requireNonNullElseGet(
        this.user, () -> System.getenv(Constants.POSTGRES_USER_ENV_VAR));
  }

  public String password() {
    return Objects.requireNonNullElseGet(
        this.password, () -> System.getenv(Constants.POSTGRES_PASSWORD_ENV_VAR));
  }

  public String schema() {
    return schema;
  }

  /** Environment defaults overridden by the options given; never migrates on its own. */
  public SchedulerConfig toConfig() {
    var url = url();
    if (url == null || url.isEmpty()) {
      throw new IllegalArgumentException(
          "No database URL, pass --db-url or set " + Constants.JDBC_URL_ENV_VAR);
    }
    var config =
        SchedulerConfig.defaultsFromEnv()
            .withDatabaseUrl(url)
            .withDatabaseSchema(schema)
            .withMaximumPoolSize(2)
            .withMigrate(false);
    if (user() != null) {
      config = config.withDbUser(user());
    }
    return config.withDbPassword(password());
  }
}
