package dev.workflowcron.scheduler.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GraphFileTest {

  private static final UUID GRAPH = UUID.fromString("6c1f1a52-5d1e-4a4e-9a43-0b9a2a1d7c11");
  private static final UUID ORG = UUID.fromString("0f7d4a9e-1b2c-4d3e-8f90-123456789abc");

  @Test
  void loadsTriggerNodes(@TempDir Path dir) throws Exception {
    var file = dir.resolve("graph.json");
    Files.writeString(
        file,
        """
        {
          "organization_id": "%s",
          "trigger_nodes": [
            {
              "id": "morning",
              "params": {"cron_expression": "0 9 * * 1-5", "timezone": "Europe/Paris"}
            },
            {"id": "bare"}
          ]
        }
        """
            .formatted(ORG));

    var graph = GraphFile.load(GRAPH, file);

    assertEquals(ORG, graph.getProjectOrganizationId(UUID.randomUUID()));
    var nodes = graph.scanTriggerNodes(GRAPH);
    assertEquals(2, nodes.size());
    assertEquals("morning", nodes.get(0).nodeInstanceId());
    assertEquals("0 9 * * 1-5", nodes.get(0).params().get("cron_expression"));
    assertEquals("Europe/Paris", nodes.get(0).params().get("timezone"));
    assertEquals("bare", nodes.get(1).nodeInstanceId());
    assertTrue(nodes.get(1).params().isEmpty());
  }

  @Test
  void onlyDescribesItsOwnGraph() throws Exception {
    var json = "{\"organization_id\": \"%s\", \"trigger_nodes\": []}".formatted(ORG);
    var graph = GraphFile.parse(GRAPH, json);

    assertTrue(graph.scanTriggerNodes(GRAPH).isEmpty());
    assertThrows(IllegalArgumentException.class, () -> graph.scanTriggerNodes(UUID.randomUUID()));
  }

  @Test
  void rejectsMalformedFiles() {
    assertThrows(IllegalArgumentException.class, () -> GraphFile.parse(GRAPH, "[]"));
    assertThrows(
        IllegalArgumentException.class,
        () -> GraphFile.parse(GRAPH, "{\"trigger_nodes\": []}"));
    assertThrows(
        IllegalArgumentException.class,
        () ->
            GraphFile.parse(
                GRAPH,
                "{\"organization_id\": \"%s\", \"trigger_nodes\": [{\"params\": {}}]}"
                    .formatted(ORG)));
  }
}
