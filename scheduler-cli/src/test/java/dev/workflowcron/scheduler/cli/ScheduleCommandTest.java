package dev.workflowcron.scheduler.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.workflowcron.scheduler.credential.SecretCipher;
import dev.workflowcron.scheduler.json.JSONUtil;
import dev.workflowcron.scheduler.migrations.MigrationManager;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

@Timeout(value = 2, unit = TimeUnit.MINUTES)
class ScheduleCommandTest extends CliTestBase {

  private static final String ENCRYPTION_KEY = SecretCipher.generateKey();

  private static String url;

  private UUID organizationId;
  private UUID projectId;

  @BeforeAll
  static void migrate() {
    url = postgres.getJdbcUrl();
    MigrationManager.runMigrations(
        url, postgres.getUsername(), postgres.getPassword(), "scheduler");
  }

  @BeforeEach
  void setup() {
    organizationId = UUID.randomUUID();
    projectId = UUID.randomUUID();
  }

  private static JsonNode json(CliTestBase.Result result) throws Exception {
    assertEquals(0, result.exitCode(), result.err());
    return JSONUtil.readTree(result.out());
  }

  private JsonNode create(String cron, String timezone) throws Exception {
    return json(
        execute(
            url,
            "schedule",
            "create",
            "-o=" + organizationId,
            "-p=" + projectId,
            "-c=" + cron,
            "-z=" + timezone,
            "-a=source=cli",
            "--encryption-key=" + ENCRYPTION_KEY));
  }

  @Test
  void createListAndDelete() throws Exception {
    var created = create("0 9 * * 1-5", "Europe/Paris");
    assertEquals("PROJECT", created.path("type").asText());
    assertEquals("0 9 * * 1-5", created.path("cron_expression").asText());
    assertEquals("Europe/Paris", created.path("timezone").asText());
    assertTrue(created.path("enabled").asBoolean());
    assertEquals("cli", created.path("args").path("source").asText());
    var uuid = created.path("uuid").asText();

    var listed = json(execute(url, "schedule", "list", "-o=" + organizationId));
    assertEquals(1, listed.size());
    assertEquals(uuid, listed.get(0).path("uuid").asText());

    var fetched = json(execute(url, "sched", "get", uuid));
    assertEquals(projectId.toString(), fetched.path("project_id").asText());

    var deleted = execute(url, "schedule", "delete", uuid, "--encryption-key=" + ENCRYPTION_KEY);
    assertEquals(0, deleted.exitCode(), deleted.err());

    var missing = execute(url, "schedule", "get", uuid);
    assertEquals(1, missing.exitCode());
    assertTrue(missing.err().contains(uuid), missing.err());
  }

  @Test
  void statsCountEnabledAndDisabled() throws Exception {
    create("0 9 * * *", "UTC");
    var disabled =
        execute(
            url,
            "schedule",
            "create",
            "-o=" + organizationId,
            "-p=" + projectId,
            "-c=30 18 * * *",
            "--disabled",
            "--encryption-key=" + ENCRYPTION_KEY);
    assertEquals(0, disabled.exitCode(), disabled.err());

    var stats = json(execute(url, "schedule", "stats", "-o=" + organizationId));
    assertEquals(2, stats.path("total").asInt());
    assertEquals(1, stats.path("enabled").asInt());
    assertEquals(1, stats.path("disabled").asInt());

    var enabledOnly =
        json(execute(url, "schedule", "list", "-o=" + organizationId, "--enabled=false"));
    assertEquals(1, enabledOnly.size());
    assertEquals("30 18 * * *", enabledOnly.get(0).path("cron_expression").asText());
  }

  @Test
  void createRejectsInvalidCron() throws Exception {
    var result =
        execute(
            url,
            "schedule",
            "create",
            "-o=" + organizationId,
            "-p=" + projectId,
            "-c=61 9 * * *",
            "--encryption-key=" + ENCRYPTION_KEY);
    assertEquals(1, result.exitCode());

    var listed = json(execute(url, "schedule", "list", "-o=" + organizationId));
    assertEquals(0, listed.size());
  }

  @Test
  void mutatingCommandsNeedEncryptionKey() {
    var result =
        execute(
            url,
            "schedule",
            "create",
            "-o=" + organizationId,
            "-p=" + projectId,
            "-c=0 9 * * *");
    assertEquals(1, result.exitCode());
  }

  @Test
  void reconcileFromGraphFile(@TempDir Path dir) throws Exception {
    var graphId = UUID.randomUUID();
    var file = dir.resolve("graph.json");
    Files.writeString(
        file,
        """
        {
          "organization_id": "%s",
          "trigger_nodes": [
            {"id": "weekday", "params": {"cron_expression": "0 8 * * 1-5", "timezone": "UTC"}}
          ]
        }
        """
            .formatted(organizationId));

    var report =
        json(
            execute(
                url,
                "reconcile",
                "-p=" + projectId,
                "-g=" + graphId,
                "-f=" + file,
                "--encryption-key=" + ENCRYPTION_KEY));
    assertEquals(1, report.path("updated").asInt());

    var listed = json(execute(url, "schedule", "list", "-o=" + organizationId));
    assertEquals(1, listed.size());
    assertEquals("0 8 * * 1-5", listed.get(0).path("cron_expression").asText());

    // a second pass over the same graph has nothing to change
    var again =
        json(
            execute(
                url,
                "reconcile",
                "-p=" + projectId,
                "-g=" + graphId,
                "-f=" + file,
                "--encryption-key=" + ENCRYPTION_KEY));
    assertEquals(0, again.path("updated").asInt());
  }
}
