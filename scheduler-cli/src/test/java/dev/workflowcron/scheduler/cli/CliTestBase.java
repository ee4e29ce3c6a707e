package dev.workflowcron.scheduler.cli;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.BeforeAll;
import org.testcontainers.DockerClientFactory;
import org.testcontainers.containers.PostgreSQLContainer;
import picocli.CommandLine;

class CliTestBase {

  static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:18");

  @BeforeAll
  static void startDatabase() {
    Assumptions.assumeTrue(
        DockerClientFactory.instance().isDockerAvailable(), "Docker is not available");
    postgres.start();
  }

  @AfterAll
  static void stopDatabase() {
    if (postgres.isRunning()) {
      postgres.stop();
    }
  }

  record Result(int exitCode, String out, String err) {}

  /** Runs the root command with the container's credentials appended. */
  static Result execute(String url, String... args) {
    List<String> argv = new ArrayList<>(List.of(args));
    argv.add("--db-url=" + url);
    argv.add("--db-user=" + postgres.getUsername());
    argv.add("--db-password=" + postgres.getPassword());

    var cmd = new CommandLine(new SchedulerCommand());
    var out = new StringWriter();
    var err = new StringWriter();
    cmd.setOut(new PrintWriter(out, true));
    cmd.setErr(new PrintWriter(err, true));
    var exitCode = cmd.execute(argv.toArray(String[]::new));
    return new Result(exitCode, out.toString(), err.toString());
  }
}
