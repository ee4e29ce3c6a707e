package dev.workflowcron.scheduler.dispatch;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

public record DispatchResult(
    UUID projectId,
    UUID scheduleUuid,
    DispatchOutcome outcome,
    Instant startedAt,
    Instant finishedAt,
    @Nullable Integer httpStatus,
    @Nullable JsonNode body,
    @Nullable String error) {

  public DispatchResult {
    Objects.requireNonNull(outcome, "outcome must not be null");
  }

  public DispatchStatus status() {
    return outcome.status();
  }

  public Duration duration() {
    return Duration.between(startedAt, finishedAt);
  }

  public boolean succeeded() {
    return outcome == DispatchOutcome.SUCCESS;
  }
}
