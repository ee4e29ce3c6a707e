package dev.workflowcron.scheduler.cron;

public record TimezoneInfo(
    String timezone, String label, String currentOffset, String currentTime) {}
