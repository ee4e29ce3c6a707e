package dev.workflowcron.scheduler.reconcile;

import java.util.List;
import java.util.UUID;

/** Read access to deployed workflow graphs, provided by the application hosting the scheduler. */
public interface WorkflowGraphSource {

  /** Lists the cron trigger nodes of a graph together with their configured parameters. */
  List<TriggerNode> scanTriggerNodes(UUID graphId);

  /** Returns the organization owning the project. */
  UUID getProjectOrganizationId(UUID projectId);
}
