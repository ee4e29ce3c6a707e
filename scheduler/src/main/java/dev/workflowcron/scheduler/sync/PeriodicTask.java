package dev.workflowcron.scheduler.sync;

import java.time.Instant;
import java.util.UUID;

import org.jspecify.annotations.Nullable;

/** A row of the periodic task store, joined with its crontab. */
public record PeriodicTask(
    long id,
    String name,
    String task,
    @Nullable CrontabHandle crontab,
    String argsJson,
    String kwargsJson,
    String queue,
    boolean enabled,
    @Nullable Instant lastRunAt,
    int totalRunCount,
    @Nullable UUID scheduleUuid) {}
