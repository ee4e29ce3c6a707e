package dev.workflowcron.scheduler.beat;

import dev.workflowcron.scheduler.cron.CronMath;
import dev.workflowcron.scheduler.dispatch.DispatchResult;
import dev.workflowcron.scheduler.dispatch.Dispatcher;
import dev.workflowcron.scheduler.json.JSONUtil;
import dev.workflowcron.scheduler.schedule.ScheduleArgs;
import dev.workflowcron.scheduler.schedule.ScheduledWorkflowType;
import dev.workflowcron.scheduler.sync.PeriodicTask;
import dev.workflowcron.scheduler.sync.PeriodicTaskStore;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import com.fasterxml.jackson.core.type.TypeReference;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fires periodic tasks on their crontabs. The task set is reloaded whenever the store's "last
 * changed" marker moves; a reload cancels every pending fire of the previous set.
 */
public class BeatService {

  private static final Logger logger = LoggerFactory.getLogger(BeatService.class);

  private final PeriodicTaskStore taskStore;
  private final Dispatcher dispatcher;
  private final Duration pollInterval;
  private final int workerThreads;

  private final AtomicReference<ScheduledExecutorService> scheduler = new AtomicReference<>();
  private final AtomicReference<ExecutorService> workers = new AtomicReference<>();
  private final AtomicLong generation = new AtomicLong();
  private final Set<Long> running = ConcurrentHashMap.newKeySet();
  private volatile @Nullable Instant lastSeenChange;
  private volatile boolean loaded;

  public BeatService(
      PeriodicTaskStore taskStore,
      Dispatcher dispatcher,
      Duration pollInterval,
      int workerThreads) {
    this.taskStore = Objects.requireNonNull(taskStore);
    this.dispatcher = Objects.requireNonNull(dispatcher);
    this.pollInterval = Objects.requireNonNull(pollInterval);
    if (workerThreads < 1) {
      throw new IllegalArgumentException("workerThreads must be at least 1");
    }
    this.workerThreads = workerThreads;
  }

  public void start() {
    if (this.scheduler.get() == null) {
      var scheduler = Executors.newSingleThreadScheduledExecutor();
      if (this.scheduler.compareAndSet(null, scheduler)) {
        workers.set(Executors.newFixedThreadPool(workerThreads));
        logger.info("Starting beat, polling every {}", pollInterval);
        scheduler.scheduleWithFixedDelay(
            this::pollSafely, 0, pollInterval.toMillis(), TimeUnit.MILLISECONDS);
      } else {
        scheduler.shutdown();
      }
    }
  }

  public void stop() {
    var scheduler = this.scheduler.getAndSet(null);
    if (scheduler != null) {
      generation.incrementAndGet();
      List<Runnable> notRun = scheduler.shutdownNow();
      logger.debug("Shutting down beat. Tasks not run {}", notRun.size());
    }
    var workers = this.workers.getAndSet(null);
    if (workers != null) {
      workers.shutdown();
      try {
        if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
          workers.shutdownNow();
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        workers.shutdownNow();
      }
    }
    loaded = false;
    lastSeenChange = null;
  }

  public boolean isRunning() {
    return scheduler.get() != null;
  }

  private void pollSafely() {
    try {
      pollOnce();
    } catch (Exception e) {
      logger.error("Beat poll failed", e);
    }
  }

  /** Reloads the task set if the store changed since the last poll; returns true if it did. */
  boolean pollOnce() {
    var changed = taskStore.lastChanged();
    if (loaded && Objects.equals(changed, lastSeenChange)) {
      return false;
    }
    var tasks = taskStore.listEnabled();
    lastSeenChange = changed;
    loaded = true;
    reschedule(tasks);
    return true;
  }

  private void reschedule(List<PeriodicTask> tasks) {
    long current = generation.incrementAndGet();
    logger.info("Loaded {} enabled periodic task(s)", tasks.size());
    for (var task : tasks) {
      if (task.crontab() == null) {
        continue;
      }
      try {
        var spec = task.crontab().spec();
        var zone = ZoneId.of(spec.timezone());
        // fail fast on a row the beat cannot parse
        CronMath.parse(spec.cronExpression());
        scheduleNext(task, spec.cronExpression(), zone, current, Instant.now());
      } catch (RuntimeException e) {
        logger.error("Periodic task {} has an invalid crontab, skipping it", task.name(), e);
      }
    }
  }

  private void scheduleNext(
      PeriodicTask task, String expression, ZoneId zone, long taskGeneration, Instant after) {
    CronMath.nextExecution(expression, zone, after)
        .ifPresent(
            next -> {
              var localScheduler = scheduler.get();
              if (localScheduler == null || generation.get() != taskGeneration) {
                return;
              }
              long delayMs = Duration.between(ZonedDateTime.now(zone), next).toMillis();
              logger.debug("Scheduling {} @ {}", task.name(), next);
              try {
                localScheduler.schedule(
                    () -> onTick(task, expression, zone, taskGeneration, next.toInstant()),
                    Math.max(0, delayMs),
                    TimeUnit.MILLISECONDS);
              } catch (RejectedExecutionException e) {
                logger.debug("Beat stopped before {} could be scheduled", task.name());
              }
            });
  }

  private void onTick(
      PeriodicTask task, String expression, ZoneId zone, long taskGeneration, Instant fireTime) {
    // a reload or stop since this fire was planned supersedes it
    if (scheduler.get() == null || generation.get() != taskGeneration) {
      return;
    }
    var pool = workers.get();
    if (pool != null) {
      try {
        pool.execute(() -> fire(task));
      } catch (RejectedExecutionException e) {
        logger.warn("Worker pool rejected periodic task {}", task.name());
      }
    }
    scheduleNext(task, expression, zone, taskGeneration, fireTime);
  }

  /**
   * Runs one fire of {@code task} on the calling thread. Returns empty when the fire was skipped,
   * either because the previous fire is still running or because the task is not dispatchable.
   */
  Optional<DispatchResult> fire(PeriodicTask task) {
    if (!running.add(task.id())) {
      logger.warn("Periodic task {} is still running, skipping this fire", task.name());
      return Optional.empty();
    }
    try {
      var result = execute(task);
      taskStore.recordRun(task.id(), Instant.now());
      return result;
    } catch (RuntimeException e) {
      logger.error("Periodic task {} failed", task.name(), e);
      return Optional.empty();
    } finally {
      running.remove(task.id());
    }
  }

  private Optional<DispatchResult> execute(PeriodicTask task) {
    List<Object> args = JSONUtil.fromJson(task.argsJson(), new TypeReference<List<Object>>() {});
    if (args.size() < 3) {
      logger.error("Periodic task {} has malformed args {}", task.name(), task.argsJson());
      return Optional.empty();
    }

    var type = ScheduledWorkflowType.valueOf(String.valueOf(args.get(2)));
    if (type != ScheduledWorkflowType.PROJECT) {
      logger.info("Periodic task {} is of type {}, nothing to dispatch", task.name(), type);
      return Optional.empty();
    }

    var projectId = UUID.fromString(String.valueOf(args.get(0)));
    var scheduleUuid = UUID.fromString(String.valueOf(args.get(1)));
    String triggerNodeId = "";
    if (args.size() > 3 && args.get(3) instanceof Map<?, ?> values) {
      var nodeId = values.get(ScheduleArgs.COMPONENT_INSTANCE_ID);
      triggerNodeId = nodeId == null ? "" : nodeId.toString();
    }

    var result = dispatcher.dispatch(projectId, scheduleUuid, triggerNodeId);
    logger.info(
        "Periodic task {} finished with {} in {} ms",
        task.name(),
        result.outcome(),
        result.duration().toMillis());
    return Optional.of(result);
  }
}
