package dev.workflowcron.scheduler.schedule;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import dev.workflowcron.scheduler.exceptions.ScheduleValidationException;
import dev.workflowcron.scheduler.json.JSONUtil;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import org.junit.jupiter.api.Test;

class ScheduleArgsTest {

  @Test
  void projectArgsWithNodeAreATriggerBinding() {
    var json = "{\"component_instance_id\":\"n1\"}";
    var args = ScheduleArgs.fromJson(ScheduledWorkflowType.PROJECT, json);
    var binding = assertInstanceOf(TriggerBinding.class, args);
    assertEquals("n1", binding.nodeInstanceId());
    assertEquals("{\"component_instance_id\":\"n1\"}", binding.toJson());
  }

  @Test
  void triggerBindingKeepsOtherEntries() {
    Map<String, Object> values = new LinkedHashMap<>();
    values.put("component_instance_id", "n1");
    values.put("graph_runner_id", "g1");
    values.put("retries", 2);

    var args = ScheduleArgs.of(ScheduledWorkflowType.PROJECT, values);
    var binding = assertInstanceOf(TriggerBinding.class, args);
    assertEquals("n1", binding.nodeInstanceId());
    assertEquals(Map.of("graph_runner_id", "g1", "retries", 2), binding.extra());
    assertEquals(values, args.asMap());

    var reread = ScheduleArgs.fromJson(ScheduledWorkflowType.PROJECT, args.toJson());
    assertEquals(values, reread.asMap());
    assertEquals(args, reread);
  }

  @Test
  void otherArgsStayFreeform() {
    var bound = "{\"component_instance_id\":\"n1\"}";
    var ingestion = ScheduleArgs.fromJson(ScheduledWorkflowType.INGESTION, bound);
    assertInstanceOf(FreeformArgs.class, ingestion);

    var blankNode =
        ScheduleArgs.of(ScheduledWorkflowType.PROJECT, Map.of("component_instance_id", ""));
    assertInstanceOf(FreeformArgs.class, blankNode);

    var json = "{\"source\":\"bucket\",\"limit\":5}";
    var freeform = ScheduleArgs.fromJson(ScheduledWorkflowType.INGESTION, json);
    assertEquals(Map.of("source", "bucket", "limit", 5), freeform.asMap());
  }

  @Test
  void emptyJsonIsEmptyArgs() {
    assertEquals(Map.of(), ScheduleArgs.fromJson(ScheduledWorkflowType.PROJECT, null).asMap());
    assertEquals(Map.of(), ScheduleArgs.fromJson(ScheduledWorkflowType.PROJECT, " ").asMap());
    assertEquals("{}", ScheduleArgs.empty().toJson());
  }

  @Test
  void malformedJsonFails() {
    assertThrows(
        JSONUtil.JsonRuntimeException.class,
        () -> ScheduleArgs.fromJson(ScheduledWorkflowType.PROJECT, "{not json"));
  }

  @Test
  void projectScopeFollowsType() {
    ScheduledWorkflowType.PROJECT.checkProjectScope(UUID.randomUUID());
    ScheduledWorkflowType.INGESTION.checkProjectScope(null);
    assertThrows(
        ScheduleValidationException.class,
        () -> ScheduledWorkflowType.PROJECT.checkProjectScope(null));
    assertThrows(
        ScheduleValidationException.class,
        () -> ScheduledWorkflowType.INGESTION.checkProjectScope(UUID.randomUUID()));
  }
}
