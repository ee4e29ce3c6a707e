package dev.workflowcron.scheduler.cli;

import dev.workflowcron.scheduler.WorkflowScheduler;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.IVersionProvider;

@Command(
    name = "workflow-scheduler",
    description = "Manage cron schedules of deployed workflows",
    mixinStandardHelpOptions = true,
    subcommands = {
      MigrateCommand.class,
      ScheduleCommand.class,
      ReconcileCommand.class,
      DispatchCommand.class,
      CronCommand.class,
      BeatCommand.class
    },
    versionProvider = SchedulerCommand.class)
public class SchedulerCommand implements Runnable, IVersionProvider {

  @Override
  public void run() {
    CommandLine cmd = new CommandLine(this);
    cmd.usage(System.out);
  }

  @Override
  public String[] getVersion() throws Exception {
    return new String[] {"${COMMAND-FULL-NAME} v" + WorkflowScheduler.version()};
  }
}
