package dev.workflowcron.scheduler.cli;

import dev.workflowcron.scheduler.WorkflowScheduler;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

@Command(
    name = "beat",
    description = "Fire periodic tasks on their crontabs until stopped",
    mixinStandardHelpOptions = true)
public class BeatCommand implements Callable<Integer> {

  private static final Logger logger = LoggerFactory.getLogger(BeatCommand.class);

  @Option(
      names = {"--poll-interval"},
      description = "Seconds between checks for changed tasks (default: ${DEFAULT-VALUE})",
      defaultValue = "5")
  long pollSeconds;

  @Option(
      names = {"--workers"},
      description = "Runs dispatched in parallel (default: ${DEFAULT-VALUE})",
      defaultValue = "4")
  int workers;

  @Mixin DatabaseOptions dbOptions;
  @Mixin ServiceOptions serviceOptions;

  @Override
  public Integer call() throws InterruptedException {
    var config =
        serviceOptions
            .applyTo(dbOptions.toConfig())
            .withPollInterval(Duration.ofSeconds(pollSeconds))
            .withWorkerThreads(workers);
    var stopped = new CountDownLatch(1);
    try (var scheduler = new WorkflowScheduler(config)) {
      Runtime.getRuntime()
          .addShutdownHook(
              new Thread(
                  () -> {
                    logger.info("Stopping beat");
                    scheduler.stopBeat();
                    stopped.countDown();
                  }));
      scheduler.startBeat();
      stopped.await();
    }
    return 0;
  }
}
