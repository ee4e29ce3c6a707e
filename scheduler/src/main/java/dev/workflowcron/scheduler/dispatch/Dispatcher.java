package dev.workflowcron.scheduler.dispatch;

import dev.workflowcron.scheduler.Constants;
import dev.workflowcron.scheduler.credential.CredentialLifecycle;
import dev.workflowcron.scheduler.exceptions.CredentialException;
import dev.workflowcron.scheduler.exceptions.ScheduleNotFoundException;
import dev.workflowcron.scheduler.json.JSONUtil;
import dev.workflowcron.scheduler.schedule.ScheduleRecord;
import dev.workflowcron.scheduler.schedule.ScheduleStore;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a scheduled workflow by calling the project's production run endpoint with the project's
 * automation credential. Every failure is returned as a classified {@link DispatchResult}; nothing
 * is retried here.
 */
public class Dispatcher {

  private static final Logger logger = LoggerFactory.getLogger(Dispatcher.class);

  private final ScheduleStore scheduleStore;
  private final CredentialLifecycle credentials;
  private final HttpClient httpClient;
  private final String baseUrl;
  private final Duration timeout;
  private final Clock clock;

  public Dispatcher(
      ScheduleStore scheduleStore,
      CredentialLifecycle credentials,
      String executionBaseUrl,
      Duration timeout) {
    this(
        scheduleStore,
        credentials,
        HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(Duration.ofSeconds(10))
            .build(),
        executionBaseUrl,
        timeout,
        Clock.systemUTC());
  }

  public Dispatcher(
      ScheduleStore scheduleStore,
      CredentialLifecycle credentials,
      HttpClient httpClient,
      String executionBaseUrl,
      Duration timeout,
      Clock clock) {
    this.scheduleStore = Objects.requireNonNull(scheduleStore);
    this.credentials = Objects.requireNonNull(credentials);
    this.httpClient = Objects.requireNonNull(httpClient);
    this.baseUrl = stripTrailingSlash(Objects.requireNonNull(executionBaseUrl));
    this.timeout = Objects.requireNonNull(timeout);
    this.clock = Objects.requireNonNull(clock);
  }

  public String endpointFor(UUID projectId) {
    return "%s/projects/%s/production/run".formatted(baseUrl, projectId);
  }

  public DispatchResult dispatch(UUID projectId, UUID scheduleUuid, String triggerNodeId) {
    var startedAt = clock.instant();
    logger.info(
        "Dispatching schedule {} (trigger node {}) of project {}",
        scheduleUuid,
        triggerNodeId,
        projectId);

    String apiKey;
    try {
      var credential = credentials.findActiveAutomationCredential(projectId);
      if (credential == null) {
        return failed(
            projectId,
            scheduleUuid,
            DispatchOutcome.CREDENTIAL_ERROR,
            startedAt,
            "No active automation credential for project " + projectId);
      }
      apiKey = credentials.revealSecret(credential);
    } catch (CredentialException e) {
      return failed(
          projectId, scheduleUuid, DispatchOutcome.CREDENTIAL_ERROR, startedAt, e.getMessage());
    }

    ScheduleRecord schedule;
    try {
      schedule = scheduleStore.getByUuid(scheduleUuid);
    } catch (ScheduleNotFoundException e) {
      return failed(
          projectId, scheduleUuid, DispatchOutcome.SCHEDULE_NOT_FOUND, startedAt, e.getMessage());
    }

    String payload;
    try {
      payload = JSONUtil.toJson(payload(schedule, triggerNodeId, startedAt));
    } catch (RuntimeException e) {
      logger.error("Failed to build payload for schedule {}", scheduleUuid, e);
      return failed(
          projectId, scheduleUuid, DispatchOutcome.UNEXPECTED_ERROR, startedAt, e.getMessage());
    }

    var request =
        HttpRequest.newBuilder(URI.create(endpointFor(projectId)))
            .timeout(timeout)
            .header(Constants.API_KEY_HEADER, apiKey)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(payload))
            .build();

    try {
      var response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      return classify(projectId, scheduleUuid, startedAt, response);
    } catch (HttpTimeoutException e) {
      return failed(
          projectId,
          scheduleUuid,
          DispatchOutcome.TIMEOUT_ERROR,
          startedAt,
          "Request timed out after %s".formatted(timeout));
    } catch (IOException e) {
      return failed(
          projectId, scheduleUuid, DispatchOutcome.REQUEST_ERROR, startedAt, describe(e));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return failed(
          projectId, scheduleUuid, DispatchOutcome.UNEXPECTED_ERROR, startedAt, "Interrupted");
    } catch (RuntimeException e) {
      logger.error("Unexpected error dispatching schedule {}", scheduleUuid, e);
      return failed(
          projectId, scheduleUuid, DispatchOutcome.UNEXPECTED_ERROR, startedAt, describe(e));
    }
  }

  Map<String, Object> payload(ScheduleRecord schedule, String triggerNodeId, Instant startedAt) {
    var triggeredAt = LocalDateTime.ofInstant(startedAt, ZoneOffset.UTC).toString();

    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("schedule_id", schedule.uuid().toString());
    metadata.put("trigger_node_id", triggerNodeId);
    metadata.put("cron_expression", schedule.cronExpression());
    metadata.put("timezone", schedule.timezone());
    metadata.put("triggered_at", triggeredAt);
    metadata.put("schedule_created_at", schedule.createdAt().toString());

    Map<String, Object> body = new LinkedHashMap<>();
    body.put(
        "messages",
        List.of(
            Map.of(
                "role", "user",
                "content", "Scheduled execution triggered at %s UTC".formatted(triggeredAt))));
    body.put("scheduled", true);
    body.put("scheduled_execution_metadata", metadata);
    return body;
  }

  private DispatchResult classify(
      UUID projectId, UUID scheduleUuid, Instant startedAt, HttpResponse<String> response) {
    int status = response.statusCode();
    var text = response.body() == null ? "" : response.body();

    if (status < 200 || status >= 300) {
      var result =
          new DispatchResult(
              projectId,
              scheduleUuid,
              DispatchOutcome.HTTP_ERROR,
              startedAt,
              clock.instant(),
              status,
              bodyOrText(text),
              "HTTP %d from %s".formatted(status, response.uri()));
      logger.warn("Dispatch of schedule {} failed: {}", scheduleUuid, result.error());
      return result;
    }

    JsonNode body;
    try {
      body = JSONUtil.readTree(text);
    } catch (JsonProcessingException e) {
      return failed(
          projectId,
          scheduleUuid,
          DispatchOutcome.UNEXPECTED_ERROR,
          startedAt,
          status,
          "Response is not valid JSON: " + e.getOriginalMessage());
    }
    if (body == null || body.isMissingNode()) {
      return failed(
          projectId,
          scheduleUuid,
          DispatchOutcome.UNEXPECTED_ERROR,
          startedAt,
          status,
          "Response body is empty");
    }

    var result =
        new DispatchResult(
            projectId,
            scheduleUuid,
            DispatchOutcome.SUCCESS,
            startedAt,
            clock.instant(),
            status,
            body,
            null);
    logger.info(
        "Dispatched schedule {} of project {} in {} ms",
        scheduleUuid,
        projectId,
        result.duration().toMillis());
    return result;
  }

  private DispatchResult failed(
      UUID projectId, UUID scheduleUuid, DispatchOutcome outcome, Instant startedAt, String error) {
    return failed(projectId, scheduleUuid, outcome, startedAt, null, error);
  }

  private DispatchResult failed(
      UUID projectId,
      UUID scheduleUuid,
      DispatchOutcome outcome,
      Instant startedAt,
      @Nullable Integer httpStatus,
      String error) {
    logger.warn("Dispatch of schedule {} failed with {}: {}", scheduleUuid, outcome, error);
    return new DispatchResult(
        projectId, scheduleUuid, outcome, startedAt, clock.instant(), httpStatus, null, error);
  }

  private static JsonNode bodyOrText(String text) {
    try {
      var node = JSONUtil.readTree(text);
      return node == null || node.isMissingNode() ? TextNode.valueOf(text) : node;
    } catch (JsonProcessingException e) {
      return TextNode.valueOf(text);
    }
  }

  private static String describe(Throwable t) {
    return t.getMessage() == null ? t.getClass().getSimpleName() : t.getMessage();
  }

  private static String stripTrailingSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
