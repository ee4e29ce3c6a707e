package dev.workflowcron.scheduler.cli;

import dev.workflowcron.scheduler.config.SchedulerConfig;

import java.time.Duration;

import picocli.CommandLine.Option;

/** Secrets and endpoints needed by commands that touch credentials or dispatch runs. */
public class ServiceOptions {
  @Option(
      names = {"--encryption-key"},
      description = "Key sealing automation credentials (defaults to SCHEDULER_ENCRYPTION_KEY)")
  String encryptionKey;

  @Option(
      names = {"--hashing-secret"},
      description = "Secret mixed into credential hashes (defaults to SCHEDULER_HASHING_SECRET)")
  String hashingSecret;

  @Option(
      names = {"-X", "--execution-url"},
      description = "Base URL of the workflow runner (defaults to SCHEDULER_EXECUTION_BASE_URL)")
  String executionUrl;

  @Option(
      names = {"--dispatch-timeout"},
      description = "Seconds to wait for a scheduled run to answer (default: ${DEFAULT-VALUE})",
      defaultValue = "600")
  long dispatchTimeoutSeconds;

  SchedulerConfig applyTo(SchedulerConfig config) {
    if (encryptionKey != null) {
      config = config.withEncryptionKey(encryptionKey);
    }
    if (hashingSecret != null) {
      config = config.withHashingSecret(hashingSecret);
    }
    if (executionUrl != null) {
      config = config.withExecutionBaseUrl(executionUrl);
    }
    return config.withDispatchTimeout(Duration.ofSeconds(dispatchTimeoutSeconds));
  }
}
