package dev.workflowcron.scheduler.cli;

import dev.workflowcron.scheduler.WorkflowScheduler;
import dev.workflowcron.scheduler.json.JSONUtil;
import dev.workflowcron.scheduler.reconcile.ReconciliationReport;

import java.nio.file.Path;
import java.util.UUID;
import java.util.concurrent.Callable;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

@Command(
    name = "reconcile",
    description = "Bring a project's schedules in line with a deployed graph",
    mixinStandardHelpOptions = true)
public class ReconcileCommand implements Callable<Integer> {

  @Option(
      names = {"-p", "--project"},
      description = "Project that was deployed",
      required = true)
  UUID projectId;

  @Option(
      names = {"-g", "--graph"},
      description = "Graph now deployed to production",
      required = true)
  UUID graphId;

  @Option(
      names = {"--previous-graph"},
      description = "Graph that was deployed before, if any")
  UUID previousGraphId;

  @Option(
      names = {"-f", "--graph-file"},
      description = "JSON file listing the organization and trigger nodes of the graph",
      required = true)
  Path graphFile;

  @Mixin DatabaseOptions dbOptions;
  @Mixin ServiceOptions serviceOptions;

  @Spec CommandSpec spec;

  @Override
  public Integer call() throws Exception {
    var graphs = GraphFile.load(graphId, graphFile);
    var config = serviceOptions.applyTo(dbOptions.toConfig());
    try (var scheduler = new WorkflowScheduler(config, graphs)) {
      var report = scheduler.reconcile(projectId, graphId, previousGraphId);
      spec.commandLine().getOut().println(JSONUtil.prettyPrint(report));
      return report.status() == ReconciliationReport.Status.SUCCESS ? 0 : 1;
    }
  }
}
