package dev.workflowcron.scheduler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.workflowcron.scheduler.config.SchedulerConfig;
import dev.workflowcron.scheduler.credential.SecretCipher;
import dev.workflowcron.scheduler.dispatch.DispatchOutcome;
import dev.workflowcron.scheduler.reconcile.ReconciliationReport;
import dev.workflowcron.scheduler.reconcile.ReconciliationReport.CredentialAction;
import dev.workflowcron.scheduler.reconcile.ReconciliationReport.Status;
import dev.workflowcron.scheduler.schedule.ScheduleCreateRequest;
import dev.workflowcron.scheduler.utils.DBUtils;
import dev.workflowcron.scheduler.utils.FakeGraphSource;

import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

@Timeout(value = 2, unit = TimeUnit.MINUTES)
public class WorkflowSchedulerTest extends DbSetupTestBase {

  HttpServer server;
  int port;
  List<String> apiKeys = new CopyOnWriteArrayList<>();

  UUID organizationId;
  UUID projectId;
  UUID firstGraph;
  UUID secondGraph;
  FakeGraphSource graphs;

  @BeforeEach
  void beforeEach() throws Exception {
    DBUtils.dropSchema(dataSource, Constants.DB_SCHEMA);

    try (var socket = new ServerSocket(0)) {
      port = socket.getLocalPort();
    }
    server = HttpServer.create(new InetSocketAddress(port), 0);
    server.createContext(
        "/projects/",
        exchange -> {
          apiKeys.add(exchange.getRequestHeaders().getFirst(Constants.API_KEY_HEADER));
          exchange.getRequestBody().readAllBytes();
          var bytes = "{\"status\":\"ok\"}".getBytes(StandardCharsets.UTF_8);
          exchange.sendResponseHeaders(200, bytes.length);
          try (var out = exchange.getResponseBody()) {
            out.write(bytes);
          }
        });
    server.start();

    organizationId = UUID.randomUUID();
    projectId = UUID.randomUUID();
    firstGraph = UUID.randomUUID();
    secondGraph = UUID.randomUUID();
    graphs =
        new FakeGraphSource()
            .withProject(projectId, organizationId)
            .withGraph(
                firstGraph,
                FakeGraphSource.trigger("node-a", "0 9 * * 1-5", "Europe/Paris", true))
            .withGraph(secondGraph);
  }

  @AfterEach
  void afterEach() {
    server.stop(0);
  }

  SchedulerConfig config() {
    return schedulerConfig
        .withDataSource(dataSource)
        .withEncryptionKey(SecretCipher.generateKey())
        .withHashingSecret("pepper")
        .withExecutionBaseUrl("http://localhost:" + port);
  }

  @Test
  void deployDispatchAndUndeploy() {
    try (var scheduler = new WorkflowScheduler(config(), graphs)) {
      var deployed = scheduler.reconcile(projectId, firstGraph, null);
      assertEquals(Status.SUCCESS, deployed.status());
      assertEquals(1, deployed.updated());
      assertEquals(CredentialAction.ISSUED, deployed.credentialAction());

      var schedules = scheduler.schedules().listSchedulesForProject(projectId, null);
      assertEquals(1, schedules.size());
      var schedule = schedules.get(0);
      assertEquals("node-a", schedule.triggerNodeId().orElseThrow());

      var task = scheduler.database().periodicTaskStore().findByScheduleUuid(schedule.uuid());
      assertTrue(task.isPresent());
      assertEquals("Europe/Paris", task.get().crontab().spec().timezone());

      var result = scheduler.dispatch(projectId, schedule.uuid(), "node-a");
      assertEquals(DispatchOutcome.SUCCESS, result.outcome());
      assertEquals(1, apiKeys.size());
      assertTrue(scheduler.credentials().verify(apiKeys.get(0)).isPresent());

      var undeployed = scheduler.reconcile(projectId, secondGraph, firstGraph);
      assertEquals(1, undeployed.removed());
      assertEquals(CredentialAction.REVOKED, undeployed.credentialAction());
      assertTrue(scheduler.schedules().listSchedulesForProject(projectId, null).isEmpty());
      assertTrue(
          scheduler.database().periodicTaskStore().findByScheduleUuid(schedule.uuid()).isEmpty());
      assertFalse(scheduler.credentials().verify(apiKeys.get(0)).isPresent());

      var afterRevoke = scheduler.dispatch(projectId, schedule.uuid(), "node-a");
      assertEquals(DispatchOutcome.CREDENTIAL_ERROR, afterRevoke.outcome());
    }
    // the data source is shared with the test base and stays open
    assertFalse(dataSource.isClosed());
  }

  @Test
  void schedulesWithoutGraphSource() {
    try (var scheduler = new WorkflowScheduler(config().withExecutionBaseUrl(null))) {
      var created =
          scheduler
              .schedules()
              .createSchedule(
                  ScheduleCreateRequest.forProject(
                      organizationId, projectId, "*/5 * * * *", "UTC"));
      assertNotNull(created.uuid());
      assertEquals(1, scheduler.schedules().getStats(organizationId).total());

      assertThrows(
          IllegalStateException.class, () -> scheduler.reconcile(projectId, firstGraph, null));
      assertThrows(IllegalStateException.class, scheduler::dispatcher);
      assertThrows(IllegalStateException.class, scheduler::startBeat);
    }
  }

  @Test
  void concurrentReconcilesOutnumberingThePool() throws Exception {
    var config =
        config()
            .withDataSource(null)
            .withExecutionBaseUrl(null)
            .withMaximumPoolSize(2);
    List<UUID> projects = new ArrayList<>();
    for (int i = 0; i < 6; i++) {
      var project = UUID.randomUUID();
      graphs.withProject(project, organizationId);
      projects.add(project);
    }
    // one project deployed from three callers at once
    projects.add(projectId);
    projects.add(projectId);
    projects.add(projectId);

    var pool = Executors.newFixedThreadPool(projects.size());
    try (var scheduler = new WorkflowScheduler(config, graphs)) {
      List<Future<ReconciliationReport>> reports = new ArrayList<>();
      for (var project : projects) {
        reports.add(pool.submit(() -> scheduler.reconcile(project, firstGraph, null)));
      }
      for (var report : reports) {
        assertEquals(Status.SUCCESS, report.get(60, TimeUnit.SECONDS).status());
      }

      for (var project : projects) {
        assertEquals(1, scheduler.schedules().listSchedulesForProject(project, null).size());
        assertNotNull(scheduler.credentials().findActiveAutomationCredential(project));
      }
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void beatLifecycle() {
    try (var scheduler = new WorkflowScheduler(config(), graphs)) {
      scheduler.startBeat();
      scheduler.stopBeat();
      scheduler.stopBeat();
    }
  }

  @Test
  void encryptionKeyIsRequired() {
    var config = config().withEncryptionKey(null);
    assertThrows(IllegalArgumentException.class, () -> new WorkflowScheduler(config));
  }

  @Test
  void versionIsAvailable() {
    assertNotNull(WorkflowScheduler.version());
    assertFalse(WorkflowScheduler.version().isEmpty());
  }
}
