package dev.workflowcron.scheduler.sync;

public record CrontabHandle(long id, CrontabSpec spec) {}
