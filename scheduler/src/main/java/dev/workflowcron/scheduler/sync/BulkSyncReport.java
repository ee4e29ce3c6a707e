package dev.workflowcron.scheduler.sync;

import java.util.List;

public record BulkSyncReport(int total, int successful, int failed, List<String> errors) {}
