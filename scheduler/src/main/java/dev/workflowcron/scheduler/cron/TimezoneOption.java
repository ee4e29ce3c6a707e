package dev.workflowcron.scheduler.cron;

public record TimezoneOption(String value, String label) {}
