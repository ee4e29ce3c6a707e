package dev.workflowcron.scheduler.cron;

import java.time.ZonedDateTime;

import org.jspecify.annotations.Nullable;

/**
 * Result of anchoring a cron expression in a timezone. The wall clock fields are never rewritten:
 * {@code utcExpression} equals the input, and the offset is reported for display only. Firing in
 * the right zone is left to the periodic task store, which keeps the timezone next to the fields.
 */
public record CronConversion(
    String utcExpression,
    String originalDescription,
    String utcDescription,
    String offsetLabel,
    @Nullable ZonedDateTime nextLocal,
    @Nullable ZonedDateTime nextUtc) {}
