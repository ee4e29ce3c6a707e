package dev.workflowcron.scheduler.sync;

import java.util.UUID;

public record SyncResult(UUID scheduleUuid, SyncAction action, long externalTaskId) {}
