package dev.workflowcron.scheduler.cli;

import dev.workflowcron.scheduler.WorkflowScheduler;
import dev.workflowcron.scheduler.exceptions.ScheduleNotFoundException;
import dev.workflowcron.scheduler.json.JSONUtil;

import java.util.UUID;
import java.util.concurrent.Callable;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

@Command(
    name = "dispatch",
    description = "Run a scheduled workflow now, as the beat would",
    mixinStandardHelpOptions = true)
public class DispatchCommand implements Callable<Integer> {

  @Option(
      names = {"-p", "--project"},
      description = "Project owning the schedule",
      required = true)
  UUID projectId;

  @Option(
      names = {"-s", "--schedule"},
      description = "Schedule to run",
      required = true)
  UUID scheduleUuid;

  @Option(
      names = {"-n", "--trigger-node"},
      description = "Trigger node reported to the run (defaults to the schedule's own)")
  String triggerNodeId;

  @Mixin DatabaseOptions dbOptions;
  @Mixin ServiceOptions serviceOptions;

  @Spec CommandSpec spec;

  @Override
  public Integer call() {
    try (var scheduler = new WorkflowScheduler(serviceOptions.applyTo(dbOptions.toConfig()))) {
      var result = scheduler.dispatch(projectId, scheduleUuid, triggerNode(scheduler));
      spec.commandLine().getOut().println(JSONUtil.prettyPrint(result));
      return result.succeeded() ? 0 : 1;
    }
  }

  private String triggerNode(WorkflowScheduler scheduler) {
    if (triggerNodeId != null) {
      return triggerNodeId;
    }
    try {
      return scheduler.schedules().getSchedule(scheduleUuid).triggerNodeId().orElse("");
    } catch (ScheduleNotFoundException e) {
      // the dispatcher reports the missing schedule
      return "";
    }
  }
}
