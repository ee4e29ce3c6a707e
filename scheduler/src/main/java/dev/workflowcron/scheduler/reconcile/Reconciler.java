package dev.workflowcron.scheduler.reconcile;

import dev.workflowcron.scheduler.Constants;
import dev.workflowcron.scheduler.credential.CredentialLifecycle;
import dev.workflowcron.scheduler.cron.CronMath;
import dev.workflowcron.scheduler.exceptions.ScheduleNotFoundException;
import dev.workflowcron.scheduler.exceptions.ScheduleSyncException;
import dev.workflowcron.scheduler.reconcile.ReconciliationReport.CredentialAction;
import dev.workflowcron.scheduler.schedule.NewSchedule;
import dev.workflowcron.scheduler.schedule.ScheduleRecord;
import dev.workflowcron.scheduler.schedule.ScheduleStore;
import dev.workflowcron.scheduler.schedule.ScheduledWorkflowType;
import dev.workflowcron.scheduler.schedule.TriggerBinding;
import dev.workflowcron.scheduler.sync.ExecutionBackendSync;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Brings the schedules of a project in line with the trigger nodes of its deployed graph.
 *
 * <p>Each schedule change, together with its push to the periodic task store, is applied on its
 * own: a failure is recorded in the report and the pass moves on to the next trigger node. The
 * automation credential is rotated once per pass, after every schedule change has been applied.
 */
public class Reconciler {

  private static final Logger logger = LoggerFactory.getLogger(Reconciler.class);

  private final WorkflowGraphSource graphSource;
  private final ScheduleStore scheduleStore;
  private final ExecutionBackendSync backendSync;
  private final CredentialLifecycle credentials;
  private final CronMath cronMath;
  private final ProjectLock projectLock;

  public Reconciler(
      WorkflowGraphSource graphSource,
      ScheduleStore scheduleStore,
      ExecutionBackendSync backendSync,
      CredentialLifecycle credentials,
      CronMath cronMath,
      ProjectLock projectLock) {
    this.graphSource = Objects.requireNonNull(graphSource);
    this.scheduleStore = Objects.requireNonNull(scheduleStore);
    this.backendSync = Objects.requireNonNull(backendSync);
    this.credentials = Objects.requireNonNull(credentials);
    this.cronMath = Objects.requireNonNull(cronMath);
    this.projectLock = Objects.requireNonNull(projectLock);
  }

  /**
   * Reconciles the schedules of {@code projectId} against the graph {@code graphId} that was just
   * deployed for it. Failures of individual schedules are reported, not thrown; only a failure to
   * read the graph or the existing schedules aborts the pass.
   */
  public ReconciliationReport reconcile(
      UUID projectId, UUID graphId, @Nullable UUID previousGraphId) {
    Objects.requireNonNull(projectId, "projectId must not be null");
    Objects.requireNonNull(graphId, "graphId must not be null");

    try (var held = projectLock.acquire(projectId)) {
      logger.info(
          "Reconciling schedules of project {} against graph {} (previous graph {})",
          projectId,
          graphId,
          previousGraphId);
      var pass = new Pass(projectId);
      pass.run(graphId);

      var report =
          new ReconciliationReport(
              projectId,
              graphId,
              previousGraphId,
              pass.updated,
              pass.removed,
              pass.credentialAction,
              pass.errors);
      logger.info(
          "Reconciled project {}: updated={} removed={} credential={} errors={}",
          projectId,
          report.updated(),
          report.removed(),
          report.credentialAction(),
          report.errors().size());
      return report;
    }
  }

  private class Pass {
    final UUID projectId;
    int updated;
    int removed;
    boolean changed;
    CredentialAction credentialAction = CredentialAction.NONE;
    final List<ReconciliationError> errors = new ArrayList<>();
    // nodes whose parameters could not be read keep their schedule as is
    final Set<String> unreadable = new HashSet<>();

    Pass(UUID projectId) {
      this.projectId = projectId;
    }

    void run(UUID graphId) {
      var intents = scan(graphId);
      var organizationId = graphSource.getProjectOrganizationId(projectId);

      // only this project's schedules, so a node id reused elsewhere never matches
      var existing =
          scheduleStore.listByScope(
              organizationId, projectId, ScheduledWorkflowType.PROJECT, null);
      Map<String, ScheduleRecord> byNode = new HashMap<>();
      for (var record : existing) {
        record.triggerNodeId().ifPresent(nodeId -> byNode.putIfAbsent(nodeId, record));
      }

      Set<Long> claimed = new HashSet<>();
      for (var nodeId : unreadable) {
        var record = byNode.get(nodeId);
        if (record != null) {
          claimed.add(record.id());
        }
      }
      for (var intent : intents) {
        var record = byNode.get(intent.nodeInstanceId());
        if (record != null) {
          claimed.add(record.id());
        }
        apply(organizationId, intent, record);
      }

      for (var record : existing) {
        if (record.triggerNodeId().isPresent() && !claimed.contains(record.id())) {
          logger.info(
              "Trigger node {} is gone from the graph, removing schedule {}",
              record.triggerNodeId().get(),
              record.uuid());
          removeSchedule(record);
        }
      }

      var enabled = scheduleStore.listByProject(projectId, true);
      if (enabled.isEmpty()) {
        disableProject(!existing.isEmpty());
      } else {
        syncCredential();
      }

      if (changed || removed > 0) {
        try {
          backendSync.pruneUnusedCrontabs();
        } catch (RuntimeException e) {
          logger.warn("Failed to prune unused crontabs after reconciling {}", projectId, e);
        }
      }
    }

    List<ScheduleIntent> scan(UUID graphId) {
      List<ScheduleIntent> intents = new ArrayList<>();
      Set<String> seen = new HashSet<>();
      for (var node : graphSource.scanTriggerNodes(graphId)) {
        if (!seen.add(node.nodeInstanceId())) {
          errors.add(
              ReconciliationError.forNode(
                  node.nodeInstanceId(), null, "Duplicate trigger node in graph " + graphId));
          continue;
        }
        try {
          intents.add(ScheduleIntent.from(node));
        } catch (IllegalArgumentException e) {
          logger.warn("Skipping trigger node {}: {}", node.nodeInstanceId(), e.getMessage());
          unreadable.add(node.nodeInstanceId());
          errors.add(ReconciliationError.forNode(node.nodeInstanceId(), null, e.getMessage()));
        }
      }
      return intents;
    }

    void apply(UUID organizationId, ScheduleIntent intent, @Nullable ScheduleRecord record) {
      var nodeId = intent.nodeInstanceId();
      try {
        if (!intent.enabled()) {
          if (record != null) {
            logger.info("Trigger node {} disabled, removing schedule {}", nodeId, record.uuid());
            removeSchedule(record);
          }
          return;
        }

        // rejects bad cron fields and unknown zones before anything is written
        cronMath.convertToUTC(intent.cronExpression(), intent.timezone());

        if (record == null) {
          createSchedule(organizationId, intent);
          updated++;
          changed = true;
        } else if (differs(record, intent)) {
          updateSchedule(record, intent);
          updated++;
          changed = true;
        }
      } catch (RuntimeException e) {
        logger.warn("Failed to reconcile trigger node {} of project {}", nodeId, projectId, e);
        errors.add(
            ReconciliationError.forNode(
                nodeId, record == null ? null : record.uuid(), e.getMessage()));
      }
    }

    void createSchedule(UUID organizationId, ScheduleIntent intent) {
      var created =
          scheduleStore.create(
              new NewSchedule(
                  organizationId,
                  projectId,
                  ScheduledWorkflowType.PROJECT,
                  intent.cronExpression(),
                  intent.timezone(),
                  true,
                  new TriggerBinding(intent.nodeInstanceId())));
      try {
        backendSync.upsertPeriodicTask(created);
      } catch (ScheduleSyncException e) {
        // drop the record so the next pass sees the node as new and retries
        try {
          scheduleStore.delete(created.id());
        } catch (RuntimeException deleteEx) {
          e.addSuppressed(deleteEx);
        }
        throw e;
      }
      logger.info(
          "Created schedule {} for trigger node {} ({} {})",
          created.uuid(),
          intent.nodeInstanceId(),
          intent.cronExpression(),
          intent.timezone());
    }

    void updateSchedule(ScheduleRecord record, ScheduleIntent intent) {
      var changedRecord =
          scheduleStore.update(
              record
                  .withCronExpression(intent.cronExpression())
                  .withTimezone(intent.timezone())
                  .withEnabled(true));
      try {
        backendSync.upsertPeriodicTask(changedRecord);
      } catch (ScheduleSyncException e) {
        // restore the old values so the next pass sees the difference again
        try {
          scheduleStore.update(record);
        } catch (RuntimeException restoreEx) {
          e.addSuppressed(restoreEx);
        }
        throw e;
      }
      logger.info(
          "Updated schedule {} for trigger node {} to {} {}",
          record.uuid(),
          intent.nodeInstanceId(),
          intent.cronExpression(),
          intent.timezone());
    }

    void removeSchedule(ScheduleRecord record) {
      try {
        scheduleStore.delete(record.id());
        removed++;
      } catch (ScheduleNotFoundException e) {
        logger.debug("Schedule {} was already deleted", record.uuid());
      } catch (RuntimeException e) {
        logger.warn("Failed to remove schedule {} of project {}", record.uuid(), projectId, e);
        errors.add(
            record.triggerNodeId().isPresent()
                ? ReconciliationError.forNode(
                    record.triggerNodeId().get(), record.uuid(), e.getMessage())
                : ReconciliationError.forSchedule(record.uuid(), e.getMessage()));
      }
    }

    void disableProject(boolean hadSchedules) {
      List<ScheduleRecord> leftovers;
      try {
        leftovers = scheduleStore.listByProject(projectId, null);
      } catch (RuntimeException e) {
        logger.error("Failed to list remaining schedules of project {}", projectId, e);
        errors.add(
            ReconciliationError.forCredential("Failed to list schedules: " + e.getMessage()));
        return;
      }
      for (var record : leftovers) {
        logger.info("No enabled schedule left in {}, removing {}", projectId, record.uuid());
        removeSchedule(record);
      }

      if (hadSchedules || !leftovers.isEmpty()) {
        try {
          if (credentials.revokeAll(projectId, Constants.SYSTEM_USER_ID) > 0) {
            credentialAction = CredentialAction.REVOKED;
          }
        } catch (RuntimeException e) {
          logger.error("Failed to revoke automation credential of project {}", projectId, e);
          errors.add(
              ReconciliationError.forCredential(
                  "Failed to revoke automation credential: " + e.getMessage()));
        }
      }
    }

    void syncCredential() {
      try {
        var current = credentials.findActiveAutomationCredential(projectId);
        if (changed || current == null) {
          credentials.issueOrRotate(projectId, Constants.SYSTEM_USER_ID);
          credentialAction = current == null ? CredentialAction.ISSUED : CredentialAction.ROTATED;
        }
      } catch (RuntimeException e) {
        // schedule changes stay applied, the pass is reported as partial
        logger.error("Failed to rotate automation credential of project {}", projectId, e);
        errors.add(
            ReconciliationError.forCredential(
                "Failed to rotate automation credential: " + e.getMessage()));
      }
    }
  }

  static boolean differs(ScheduleRecord record, ScheduleIntent intent) {
    return !record.enabled()
        || !record.cronExpression().equals(intent.cronExpression())
        || !record.timezone().equals(intent.timezone());
  }
}
