package dev.workflowcron.scheduler.cli;

import dev.workflowcron.scheduler.database.SchedulerDatabase;
import dev.workflowcron.scheduler.migrations.MigrationManager;

import java.io.PrintWriter;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.concurrent.Callable;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

@Command(
    name = "migrate",
    description = "Create or upgrade the scheduler tables",
    mixinStandardHelpOptions = true)
public class MigrateCommand implements Callable<Integer> {

  @Mixin DatabaseOptions dbOptions;

  @Option(
      names = {"-r", "--app-role"},
      description = "The role the scheduler service connects as")
  String appRole;

  @Spec CommandSpec spec;

  @Override
  public Integer call() throws Exception {
    var out = spec.commandLine().getOut();
    out.println("Starting scheduler migrations");
    out.format("  Database: %s%n", dbOptions.url());
    out.format("  Database User: %s%n", dbOptions.user());
    out.format("  Schema: %s%n", dbOptions.schema());

    MigrationManager.runMigrations(
        dbOptions.url(), dbOptions.user(), dbOptions.password(), dbOptions.schema());
    grantSchemaPermissions(out);
    out.flush();
    return 0;
  }

  void grantSchemaPermissions(PrintWriter out) throws SQLException {
    if (appRole == null || appRole.isEmpty()) {
      return;
    }

    var schema = SchedulerDatabase.sanitizeSchema(dbOptions.schema());
    var role = "\"%s\"".formatted(appRole.replace("\"", "\"\""));
    out.format("Granting permissions for schema %s to %s%n", schema, role);

    String[] queries = {
      "GRANT USAGE ON SCHEMA %s TO %s",
      "GRANT ALL PRIVILEGES ON ALL TABLES IN SCHEMA %s TO %s",
      "GRANT ALL PRIVILEGES ON ALL SEQUENCES IN SCHEMA %s TO %s",
      "GRANT EXECUTE ON ALL FUNCTIONS IN SCHEMA %s TO %s",
      "ALTER DEFAULT PRIVILEGES IN SCHEMA %s GRANT ALL ON TABLES TO %s",
      "ALTER DEFAULT PRIVILEGES IN SCHEMA %s GRANT ALL ON SEQUENCES TO %s",
      "ALTER DEFAULT PRIVILEGES IN SCHEMA %s GRANT EXECUTE ON FUNCTIONS TO %s"
    };
    try (var conn =
            DriverManager.getConnection(dbOptions.url(), dbOptions.user(), dbOptions.password());
        var stmt = conn.createStatement()) {
      for (var query : queries) {
        stmt.execute(query.formatted(schema, role));
      }
    }
  }
}
