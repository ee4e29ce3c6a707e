package dev.workflowcron.scheduler.cli;

import dev.workflowcron.scheduler.WorkflowScheduler;
import dev.workflowcron.scheduler.database.SchedulerDatabase;
import dev.workflowcron.scheduler.exceptions.ScheduleNotFoundException;
import dev.workflowcron.scheduler.json.JSONUtil;
import dev.workflowcron.scheduler.schedule.ScheduleCreateRequest;
import dev.workflowcron.scheduler.schedule.ScheduleRecord;
import dev.workflowcron.scheduler.schedule.ScheduleStats;
import dev.workflowcron.scheduler.schedule.ScheduledWorkflowType;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

@Command(
    name = "schedule",
    aliases = {"sched"},
    description = "Manage scheduled workflows",
    subcommands = {
      ListSchedulesCommand.class,
      GetScheduleCommand.class,
      CreateScheduleCommand.class,
      DeleteScheduleCommand.class,
      ScheduleStatsCommand.class,
      ResyncCommand.class,
    })
public class ScheduleCommand implements Runnable {

  @Option(
      names = {"-h", "--help"},
      usageHelp = true,
      description = "Display this help message")
  boolean help;

  @Override
  public void run() {
    CommandLine cmd = new CommandLine(this);
    cmd.usage(System.out);
  }

  /** The printable form of a schedule, with args flattened to their stored map. */
  static Map<String, Object> view(ScheduleRecord record) {
    Map<String, Object> view = new LinkedHashMap<>();
    view.put("id", record.id());
    view.put("uuid", record.uuid());
    view.put("organization_id", record.organizationId());
    view.put("project_id", record.projectId());
    view.put("type", record.type());
    view.put("cron_expression", record.cronExpression());
    view.put("timezone", record.timezone());
    view.put("enabled", record.enabled());
    view.put("args", record.args().asMap());
    view.put("created_at", record.createdAt());
    view.put("updated_at", record.updatedAt());
    return view;
  }
}

@Command(name = "list", description = "List the schedules of an organization")
class ListSchedulesCommand implements Runnable {

  @Option(
      names = {"-o", "--organization"},
      description = "Organization owning the schedules",
      required = true)
  UUID organizationId;

  @Option(
      names = {"-p", "--project"},
      description = "Only schedules of this project")
  UUID projectId;

  @Option(
      names = {"-t", "--type"},
      description = "Only schedules of this type (${COMPLETION-CANDIDATES})")
  ScheduledWorkflowType type;

  @Option(
      names = {"-e", "--enabled"},
      arity = "1",
      description = "Only enabled (true) or disabled (false) schedules")
  Boolean enabled;

  @Mixin DatabaseOptions dbOptions;

  @Option(
      names = {"-h", "--help"},
      usageHelp = true,
      description = "Display this help message")
  boolean help;

  @Spec CommandSpec spec;

  @Override
  public void run() {
    var out = spec.commandLine().getOut();
    try (var db = new SchedulerDatabase(dbOptions.toConfig())) {
      var schedules =
          db.scheduleStore().listByScope(organizationId, projectId, type, enabled).stream()
              .map(ScheduleCommand::view)
              .toList();
      out.println(JSONUtil.prettyPrint(schedules));
    }
  }
}

@Command(name = "get", description = "Retrieve a schedule")
class GetScheduleCommand implements Callable<Integer> {

  @Parameters(index = "0", description = "Schedule UUID to retrieve")
  UUID scheduleUuid;

  @Mixin DatabaseOptions dbOptions;

  @Option(
      names = {"-h", "--help"},
      usageHelp = true,
      description = "Display this help message")
  boolean help;

  @Spec CommandSpec spec;

  @Override
  public Integer call() {
    var out = spec.commandLine().getOut();
    try (var db = new SchedulerDatabase(dbOptions.toConfig())) {
      var schedule = db.scheduleStore().getByUuid(scheduleUuid);
      out.println(JSONUtil.prettyPrint(ScheduleCommand.view(schedule)));
      var task = db.periodicTaskStore().findByScheduleUuid(scheduleUuid);
      if (task.isEmpty()) {
        spec.commandLine().getErr().println("Schedule has no periodic task");
      }
      return 0;
    } catch (ScheduleNotFoundException e) {
      spec.commandLine().getErr().println(e.getMessage());
      return 1;
    }
  }
}

@Command(name = "create", description = "Create a schedule and register it with the beat")
class CreateScheduleCommand implements Runnable {

  @Option(
      names = {"-o", "--organization"},
      description = "Organization owning the schedule",
      required = true)
  UUID organizationId;

  @Option(
      names = {"-p", "--project"},
      description = "Project the schedule runs; required for PROJECT schedules")
  UUID projectId;

  @Option(
      names = {"-t", "--type"},
      description = "Schedule type (${COMPLETION-CANDIDATES}, default: ${DEFAULT-VALUE})",
      defaultValue = "PROJECT")
  ScheduledWorkflowType type;

  @Option(
      names = {"-c", "--cron"},
      description = "Five field cron expression",
      required = true)
  String cronExpression;

  @Option(
      names = {"-z", "--timezone"},
      description = "IANA timezone the expression is read in (default: ${DEFAULT-VALUE})",
      defaultValue = "UTC")
  String timezone;

  @Option(
      names = {"--disabled"},
      description = "Create the schedule disabled")
  boolean disabled;

  @Option(
      names = {"-a", "--arg"},
      description = "Schedule argument as key=value, may be repeated")
  Map<String, String> args = new LinkedHashMap<>();

  @Mixin DatabaseOptions dbOptions;
  @Mixin ServiceOptions serviceOptions;

  @Option(
      names = {"-h", "--help"},
      usageHelp = true,
      description = "Display this help message")
  boolean help;

  @Spec CommandSpec spec;

  @Override
  public void run() {
    var out = spec.commandLine().getOut();
    var request =
        new ScheduleCreateRequest(
            organizationId,
            projectId,
            type,
            cronExpression,
            timezone,
            !disabled,
            new LinkedHashMap<>(args));
    try (var scheduler = new WorkflowScheduler(serviceOptions.applyTo(dbOptions.toConfig()))) {
      var created = scheduler.schedules().createSchedule(request);
      out.println(JSONUtil.prettyPrint(ScheduleCommand.view(created)));
    }
  }
}

@Command(name = "delete", description = "Delete a schedule and its periodic task")
class DeleteScheduleCommand implements Callable<Integer> {

  @Parameters(index = "0", description = "Schedule UUID to delete")
  UUID scheduleUuid;

  @Mixin DatabaseOptions dbOptions;
  @Mixin ServiceOptions serviceOptions;

  @Option(
      names = {"-h", "--help"},
      usageHelp = true,
      description = "Display this help message")
  boolean help;

  @Spec CommandSpec spec;

  @Override
  public Integer call() {
    try (var scheduler = new WorkflowScheduler(serviceOptions.applyTo(dbOptions.toConfig()))) {
      scheduler.schedules().deleteSchedule(scheduleUuid);
      spec.commandLine().getOut().println("Deleted schedule " + scheduleUuid);
      return 0;
    } catch (ScheduleNotFoundException e) {
      spec.commandLine().getErr().println(e.getMessage());
      return 1;
    }
  }
}

@Command(name = "stats", description = "Count the schedules of an organization")
class ScheduleStatsCommand implements Runnable {

  @Option(
      names = {"-o", "--organization"},
      description = "Organization owning the schedules",
      required = true)
  UUID organizationId;

  @Mixin DatabaseOptions dbOptions;

  @Option(
      names = {"-h", "--help"},
      usageHelp = true,
      description = "Display this help message")
  boolean help;

  @Spec CommandSpec spec;

  @Override
  public void run() {
    try (var db = new SchedulerDatabase(dbOptions.toConfig())) {
      var stats =
          ScheduleStats.of(db.scheduleStore().listByScope(organizationId, null, null, null));
      spec.commandLine().getOut().println(JSONUtil.prettyPrint(stats));
    }
  }
}

@Command(
    name = "resync",
    description = "Push every enabled schedule to the periodic task store again")
class ResyncCommand implements Callable<Integer> {

  @Mixin DatabaseOptions dbOptions;
  @Mixin ServiceOptions serviceOptions;

  @Option(
      names = {"-h", "--help"},
      usageHelp = true,
      description = "Display this help message")
  boolean help;

  @Spec CommandSpec spec;

  @Override
  public Integer call() {
    try (var scheduler = new WorkflowScheduler(serviceOptions.applyTo(dbOptions.toConfig()))) {
      var report = scheduler.schedules().resyncAllEnabled();
      spec.commandLine().getOut().println(JSONUtil.prettyPrint(report));
      return report.failed() == 0 ? 0 : 1;
    }
  }
}
