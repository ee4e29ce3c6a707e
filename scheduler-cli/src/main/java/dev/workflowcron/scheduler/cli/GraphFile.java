package dev.workflowcron.scheduler.cli;

import dev.workflowcron.scheduler.json.JSONUtil;
import dev.workflowcron.scheduler.reconcile.TriggerNode;
import dev.workflowcron.scheduler.reconcile.WorkflowGraphSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * A deployed graph described by a JSON file, for reconciling from the command line:
 *
 * <pre>
 * {
 *   "organization_id": "...",
 *   "trigger_nodes": [
 *     {"id": "node-1", "params": {"cron_expression": "0 9 * * 1-5", "timezone": "Europe/Paris"}}
 *   ]
 * }
 * </pre>
 */
public class GraphFile implements WorkflowGraphSource {

  private final UUID graphId;
  private final UUID organizationId;
  private final List<TriggerNode> triggerNodes;

  public GraphFile(UUID graphId, UUID organizationId, List<TriggerNode> triggerNodes) {
    this.graphId = Objects.requireNonNull(graphId);
    this.organizationId = Objects.requireNonNull(organizationId);
    this.triggerNodes = List.copyOf(triggerNodes);
  }

  public static GraphFile load(UUID graphId, Path path) throws IOException {
    return parse(graphId, Files.readString(path));
  }

  public static GraphFile parse(UUID graphId, String json) throws IOException {
    var root = JSONUtil.readTree(json);
    if (root == null || !root.isObject()) {
      throw new IllegalArgumentException("Graph file must hold a JSON object");
    }
    var org = root.path("organization_id");
    if (!org.isTextual()) {
      throw new IllegalArgumentException("Graph file is missing organization_id");
    }

    List<TriggerNode> nodes = new ArrayList<>();
    for (JsonNode node : root.path("trigger_nodes")) {
      var id = node.path("id");
      if (!id.isTextual() || id.asText().isEmpty()) {
        throw new IllegalArgumentException("Every trigger node needs an id");
      }
      Map<String, Object> params = Map.of();
      if (node.path("params").isObject()) {
        params =
            JSONUtil.mapper()
                .convertValue(node.get("params"), new TypeReference<Map<String, Object>>() {});
      }
      nodes.add(new TriggerNode(id.asText(), params));
    }
    return new GraphFile(graphId, UUID.fromString(org.asText()), nodes);
  }

  @Override
  public List<TriggerNode> scanTriggerNodes(UUID graphId) {
    if (!this.graphId.equals(graphId)) {
      throw new IllegalArgumentException("Graph file does not describe graph " + graphId);
    }
    return triggerNodes;
  }

  @Override
  public UUID getProjectOrganizationId(UUID projectId) {
    return organizationId;
  }
}
