package dev.workflowcron.scheduler;

import dev.workflowcron.scheduler.beat.BeatService;
import dev.workflowcron.scheduler.config.SchedulerConfig;
import dev.workflowcron.scheduler.credential.CredentialLifecycle;
import dev.workflowcron.scheduler.credential.SecretCipher;
import dev.workflowcron.scheduler.cron.CronMath;
import dev.workflowcron.scheduler.cron.TimezoneCatalog;
import dev.workflowcron.scheduler.database.AdvisoryProjectLock;
import dev.workflowcron.scheduler.database.SchedulerDatabase;
import dev.workflowcron.scheduler.dispatch.DispatchResult;
import dev.workflowcron.scheduler.dispatch.Dispatcher;
import dev.workflowcron.scheduler.migrations.MigrationManager;
import dev.workflowcron.scheduler.reconcile.ReconciliationReport;
import dev.workflowcron.scheduler.reconcile.Reconciler;
import dev.workflowcron.scheduler.reconcile.WorkflowGraphSource;
import dev.workflowcron.scheduler.schedule.ScheduleService;
import dev.workflowcron.scheduler.sync.ExecutionBackendSync;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.Properties;
import java.util.UUID;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point that wires the scheduler from a {@link SchedulerConfig}: the database and its
 * stores, credential handling, reconciliation, dispatch and the beat.
 *
 * <p>Reconciliation needs a {@link WorkflowGraphSource}; without one the remaining operations still
 * work. Dispatch and the beat need {@code executionBaseUrl}.
 */
public class WorkflowScheduler implements AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(WorkflowScheduler.class);
  private static final String version = loadVersionFromResources();

  private static String loadVersionFromResources() {
    final String PROPERTIES_FILE = "/dev/workflowcron/scheduler/app.properties";
    Properties props = new Properties();
    try (InputStream input = WorkflowScheduler.class.getResourceAsStream(PROPERTIES_FILE)) {
      if (input == null) {
        logger.warn("Could not find {} resource file", PROPERTIES_FILE);
        return "<unknown (resource missing)>";
      }
      props.load(input);
      return props.getProperty("app.version", "<unknown>");
    } catch (IOException ex) {
      logger.error("Error loading version properties", ex);
      return "<unknown (IO Error)>";
    }
  }

  public static String version() {
    return version;
  }

  private final SchedulerConfig config;
  private final SchedulerDatabase database;
  private final boolean ownsDataSource;
  private final CronMath cronMath = new CronMath();
  private final TimezoneCatalog timezoneCatalog = new TimezoneCatalog();
  private final CredentialLifecycle credentials;
  private final ExecutionBackendSync backendSync;
  private final @Nullable AdvisoryProjectLock projectLock;
  private final @Nullable Reconciler reconciler;
  private final ScheduleService scheduleService;
  private final @Nullable Dispatcher dispatcher;
  private final @Nullable BeatService beat;

  public WorkflowScheduler(SchedulerConfig config) {
    this(config, null);
  }

  public WorkflowScheduler(SchedulerConfig config, @Nullable WorkflowGraphSource graphSource) {
    this.config = Objects.requireNonNull(config, "SchedulerConfig must not be null");
    if (config.encryptionKey() == null || config.encryptionKey().isEmpty()) {
      throw new IllegalArgumentException(
          "An encryption key is required, set %s".formatted(Constants.ENCRYPTION_KEY_ENV_VAR));
    }
    var hashingSecret = config.hashingSecret();
    if (hashingSecret == null) {
      logger.warn(
          "No credential hashing secret configured ({}), hashing tokens unsalted",
          Constants.HASHING_SECRET_ENV_VAR);
      hashingSecret = "";
    }
    var cipher = new SecretCipher(config.encryptionKey());

    logger.info("Workflow scheduler version: {}", version);
    if (config.migrate()) {
      MigrationManager.runMigrations(config);
    }

    this.ownsDataSource = config.dataSource() == null;
    this.database = new SchedulerDatabase(config);
    this.credentials = new CredentialLifecycle(database.credentialStore(), cipher, hashingSecret);
    this.backendSync = new ExecutionBackendSync(database.periodicTaskStore());
    if (graphSource != null) {
      this.projectLock = AdvisoryProjectLock.onDatabaseOf(database.dataSource());
      this.reconciler =
          new Reconciler(
              graphSource,
              database.scheduleStore(),
              backendSync,
              credentials,
              cronMath,
              projectLock);
    } else {
      this.projectLock = null;
      this.reconciler = null;
    }
    this.scheduleService =
        new ScheduleService(
            database.scheduleStore(), backendSync, credentials, cronMath, reconciler);

    if (config.executionBaseUrl() != null) {
      this.dispatcher =
          new Dispatcher(
              database.scheduleStore(),
              credentials,
              config.executionBaseUrl(),
              config.dispatchTimeout());
      this.beat =
          new BeatService(
              database.periodicTaskStore(),
              dispatcher,
              config.pollInterval(),
              config.workerThreads());
    } else {
      this.dispatcher = null;
      this.beat = null;
    }
  }

  public SchedulerConfig config() {
    return config;
  }

  public SchedulerDatabase database() {
    return database;
  }

  public CronMath cronMath() {
    return cronMath;
  }

  public TimezoneCatalog timezoneCatalog() {
    return timezoneCatalog;
  }

  public CredentialLifecycle credentials() {
    return credentials;
  }

  public ExecutionBackendSync backendSync() {
    return backendSync;
  }

  public ScheduleService schedules() {
    return scheduleService;
  }

  public ReconciliationReport reconcile(
      UUID projectId, UUID graphId, @Nullable UUID previousGraphId) {
    return scheduleService.handleDeploymentReconciliation(projectId, graphId, previousGraphId);
  }

  public Dispatcher dispatcher() {
    if (dispatcher == null) {
      throw new IllegalStateException(
          "Dispatch requires an execution base url, set %s"
              .formatted(Constants.EXECUTION_BASE_URL_ENV_VAR));
    }
    return dispatcher;
  }

  public DispatchResult dispatch(UUID projectId, UUID scheduleUuid, String triggerNodeId) {
    return dispatcher().dispatch(projectId, scheduleUuid, triggerNodeId);
  }

  public void startBeat() {
    if (beat == null) {
      throw new IllegalStateException(
          "The beat requires an execution base url, set %s"
              .formatted(Constants.EXECUTION_BASE_URL_ENV_VAR));
    }
    beat.start();
  }

  public void stopBeat() {
    if (beat != null) {
      beat.stop();
    }
  }

  @Override
  public void close() {
    stopBeat();
    if (projectLock != null) {
      projectLock.close();
    }
    if (ownsDataSource) {
      database.close();
    }
  }
}
