package dev.workflowcron.scheduler.sync;

import java.util.UUID;

/** What the periodic task store should hold for one schedule. */
public record PeriodicTaskDefinition(
    UUID scheduleUuid,
    String name,
    String task,
    String argsJson,
    String kwargsJson,
    String queue,
    boolean enabled,
    String description) {}
