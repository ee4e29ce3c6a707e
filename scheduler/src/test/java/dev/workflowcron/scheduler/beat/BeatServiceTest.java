package dev.workflowcron.scheduler.beat;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.workflowcron.scheduler.dispatch.DispatchOutcome;
import dev.workflowcron.scheduler.dispatch.DispatchResult;
import dev.workflowcron.scheduler.dispatch.Dispatcher;
import dev.workflowcron.scheduler.schedule.FreeformArgs;
import dev.workflowcron.scheduler.schedule.NewSchedule;
import dev.workflowcron.scheduler.schedule.ScheduleRecord;
import dev.workflowcron.scheduler.schedule.ScheduledWorkflowType;
import dev.workflowcron.scheduler.schedule.TriggerBinding;
import dev.workflowcron.scheduler.sync.ExecutionBackendSync;
import dev.workflowcron.scheduler.sync.PeriodicTask;
import dev.workflowcron.scheduler.utils.InMemoryPeriodicTaskStore;
import dev.workflowcron.scheduler.utils.InMemoryScheduleStore;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

@Timeout(value = 2, unit = TimeUnit.MINUTES)
class BeatServiceTest {

  InMemoryScheduleStore scheduleStore;
  InMemoryPeriodicTaskStore taskStore;
  ExecutionBackendSync backendSync;
  Dispatcher dispatcher;
  BeatService beat;
  UUID projectId;

  @BeforeEach
  void beforeEach() {
    scheduleStore = new InMemoryScheduleStore();
    taskStore = new InMemoryPeriodicTaskStore();
    backendSync = new ExecutionBackendSync(taskStore);
    dispatcher = mock(Dispatcher.class);
    beat = new BeatService(taskStore, dispatcher, Duration.ofMillis(100), 2);
    projectId = UUID.randomUUID();
  }

  @AfterEach
  void afterEach() {
    beat.stop();
  }

  ScheduleRecord projectSchedule(String nodeId) {
    var record =
        scheduleStore.create(
            new NewSchedule(
                UUID.randomUUID(),
                projectId,
                ScheduledWorkflowType.PROJECT,
                "0 9 * * 1-5",
                "America/New_York",
                true,
                new TriggerBinding(nodeId)));
    backendSync.upsertPeriodicTask(record);
    return record;
  }

  PeriodicTask taskFor(ScheduleRecord record) {
    return taskStore.findByScheduleUuid(record.uuid()).orElseThrow();
  }

  static DispatchResult success(UUID projectId, UUID scheduleUuid) {
    var now = Instant.now();
    return new DispatchResult(
        projectId, scheduleUuid, DispatchOutcome.SUCCESS, now, now, 200, null, null);
  }

  @Test
  void rejectsEmptyWorkerPool() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new BeatService(taskStore, dispatcher, Duration.ofSeconds(1), 0));
  }

  @Test
  void reloadsOnlyWhenTheMarkerMoves() {
    assertTrue(beat.pollOnce());
    assertFalse(beat.pollOnce());

    projectSchedule("node-1");
    assertTrue(beat.pollOnce());
    assertFalse(beat.pollOnce());

    var second = projectSchedule("node-2");
    backendSync.removePeriodicTask(second.uuid());
    assertTrue(beat.pollOnce());
  }

  @Test
  void fireDispatchesProjectTask() {
    var record = projectSchedule("node-7");
    when(dispatcher.dispatch(projectId, record.uuid(), "node-7"))
        .thenReturn(success(projectId, record.uuid()));

    var result = beat.fire(taskFor(record));

    assertTrue(result.isPresent());
    assertTrue(result.get().succeeded());
    verify(dispatcher).dispatch(projectId, record.uuid(), "node-7");

    var task = taskFor(record);
    assertEquals(1, task.totalRunCount());
    assertNotNull(task.lastRunAt());
  }

  @Test
  void failedDispatchStillCountsAsARun() {
    var record = projectSchedule("node-1");
    var now = Instant.now();
    when(dispatcher.dispatch(projectId, record.uuid(), "node-1"))
        .thenReturn(
            new DispatchResult(
                projectId,
                record.uuid(),
                DispatchOutcome.HTTP_ERROR,
                now,
                now,
                500,
                null,
                "HTTP 500"));

    var result = beat.fire(taskFor(record));

    assertEquals(DispatchOutcome.HTTP_ERROR, result.orElseThrow().outcome());
    assertEquals(1, taskFor(record).totalRunCount());
  }

  @Test
  void ingestionTaskIsNotDispatched() {
    var record =
        scheduleStore.create(
            new NewSchedule(
                UUID.randomUUID(),
                null,
                ScheduledWorkflowType.INGESTION,
                "*/15 * * * *",
                "UTC",
                true,
                new FreeformArgs(Map.of("source_id", "s-1"))));
    backendSync.upsertPeriodicTask(record);

    var result = beat.fire(taskFor(record));

    assertTrue(result.isEmpty());
    verify(dispatcher, never()).dispatch(any(), any(), anyString());
    assertEquals(1, taskFor(record).totalRunCount());
  }

  @Test
  void malformedArgsAreSkipped() {
    var task =
        new PeriodicTask(
            99, "broken", "scheduled_workflow", null, "[]", "{}", "default", true, null, 0, null);

    assertTrue(beat.fire(task).isEmpty());
    verify(dispatcher, never()).dispatch(any(), any(), anyString());
  }

  @Test
  void dispatcherExceptionIsContained() {
    var record = projectSchedule("node-1");
    when(dispatcher.dispatch(any(), any(), anyString()))
        .thenThrow(new IllegalStateException("boom"));

    assertTrue(beat.fire(taskFor(record)).isEmpty());
  }

  @Test
  void overlappingFireIsSkipped() throws Exception {
    var record = projectSchedule("node-1");
    var entered = new CountDownLatch(1);
    var release = new CountDownLatch(1);
    when(dispatcher.dispatch(projectId, record.uuid(), "node-1"))
        .thenAnswer(
            invocation -> {
              entered.countDown();
              release.await(30, TimeUnit.SECONDS);
              return success(projectId, record.uuid());
            });

    var task = taskFor(record);
    var first = CompletableFuture.supplyAsync(() -> beat.fire(task));
    assertTrue(entered.await(30, TimeUnit.SECONDS));

    assertTrue(beat.fire(task).isEmpty());

    release.countDown();
    assertTrue(first.get(30, TimeUnit.SECONDS).isPresent());
    verify(dispatcher, times(1)).dispatch(projectId, record.uuid(), "node-1");

    // once the first fire finished the task can run again
    assertTrue(beat.fire(task).isPresent());
  }

  @Test
  void startAndStop() {
    projectSchedule("node-1");
    assertFalse(beat.isRunning());

    beat.start();
    beat.start();
    assertTrue(beat.isRunning());

    beat.stop();
    assertFalse(beat.isRunning());
  }
}
