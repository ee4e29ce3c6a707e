package dev.workflowcron.scheduler.cron;

import java.util.Map;

/**
 * Outcome of a successful cron validation.
 *
 * @param expression the validated expression
 * @param description short human readable description, e.g. "Daily at 09:00"
 * @param parsedFields the five fields keyed by minute, hour, day_of_month, month, day_of_week
 */
public record CronValidation(
    String expression, String description, Map<String, String> parsedFields) {}
