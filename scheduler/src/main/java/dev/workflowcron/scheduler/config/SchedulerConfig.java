package dev.workflowcron.scheduler.config;

import dev.workflowcron.scheduler.Constants;

import java.time.Duration;

import com.zaxxer.hikari.HikariDataSource;

public record SchedulerConfig(
    String databaseUrl,
    String dbUser,
    String dbPassword,
    int maximumPoolSize,
    int connectionTimeout,
    HikariDataSource dataSource,
    String databaseSchema,
    boolean migrate,
    String executionBaseUrl,
    Duration dispatchTimeout,
    String encryptionKey,
    String hashingSecret,
    Duration pollInterval,
    int workerThreads) {

  public SchedulerConfig {
    if (executionBaseUrl != null && executionBaseUrl.isEmpty()) {
      throw new IllegalArgumentException(
          "SchedulerConfig.executionBaseUrl must not be empty if specified");
    }
    if (dispatchTimeout == null || dispatchTimeout.isNegative() || dispatchTimeout.isZero()) {
      throw new IllegalArgumentException("SchedulerConfig.dispatchTimeout must be positive");
    }
    if (pollInterval == null || pollInterval.isNegative() || pollInterval.isZero()) {
      throw new IllegalArgumentException("SchedulerConfig.pollInterval must be positive");
    }
    if (workerThreads < 1) {
      throw new IllegalArgumentException("SchedulerConfig.workerThreads must be at least 1");
    }
  }

  public static SchedulerConfig defaults() {
    return new SchedulerConfig(
        null, null, null, 4, // maximumPoolSize default
        30000, // connectionTimeout default
        null, null, true, // migrate
        null, Duration.ofSeconds(600), // dispatchTimeout default
        null, null, Duration.ofSeconds(5), // pollInterval default
        4);
  }

  public static SchedulerConfig defaultsFromEnv() {
    String databaseUrl = System.getenv(Constants.JDBC_URL_ENV_VAR);
    String dbUser = System.getenv(Constants.POSTGRES_USER_ENV_VAR);
    if (dbUser == null || dbUser.isEmpty()) dbUser = "postgres";
    String dbPassword = System.getenv(Constants.POSTGRES_PASSWORD_ENV_VAR);
    return defaults()
        .withDatabaseUrl(databaseUrl)
        .withDbUser(dbUser)
        .withDbPassword(dbPassword)
        .withExecutionBaseUrl(emptyToNull(System.getenv(Constants.EXECUTION_BASE_URL_ENV_VAR)))
        .withEncryptionKey(System.getenv(Constants.ENCRYPTION_KEY_ENV_VAR))
        .withHashingSecret(System.getenv(Constants.HASHING_SECRET_ENV_VAR));
  }

  private static String emptyToNull(String v) {
    return v == null || v.isEmpty() ? null : v;
  }

  public SchedulerConfig withDatabaseUrl(String v) {
    return new SchedulerConfig(
        v,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        databaseSchema,
        migrate,
        executionBaseUrl,
        dispatchTimeout,
        encryptionKey,
        hashingSecret,
        pollInterval,
        workerThreads);
  }

  public SchedulerConfig withDbUser(String v) {
    return new SchedulerConfig(
        databaseUrl,
        v,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        databaseSchema,
        migrate,
        executionBaseUrl,
        dispatchTimeout,
        encryptionKey,
        hashingSecret,
        pollInterval,
        workerThreads);
  }

  public SchedulerConfig withDbPassword(String v) {
    return new SchedulerConfig(
        databaseUrl,
        dbUser,
        v,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        databaseSchema,
        migrate,
        executionBaseUrl,
        dispatchTimeout,
        encryptionKey,
        hashingSecret,
        pollInterval,
        workerThreads);
  }

  public SchedulerConfig withMaximumPoolSize(int v) {
    return new SchedulerConfig(
        databaseUrl,
        dbUser,
        dbPassword,
        v,
        connectionTimeout,
        dataSource,
        databaseSchema,
        migrate,
        executionBaseUrl,
        dispatchTimeout,
        encryptionKey,
        hashingSecret,
        pollInterval,
        workerThreads);
  }

  public SchedulerConfig withConnectionTimeout(int v) {
    return new SchedulerConfig(
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        v,
        dataSource,
        databaseSchema,
        migrate,
        executionBaseUrl,
        dispatchTimeout,
        encryptionKey,
        hashingSecret,
        pollInterval,
        workerThreads);
  }

  public SchedulerConfig withDataSource(HikariDataSource v) {
    return new SchedulerConfig(
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        v,
        databaseSchema,
        migrate,
        executionBaseUrl,
        dispatchTimeout,
        encryptionKey,
        hashingSecret,
        pollInterval,
        workerThreads);
  }

  public SchedulerConfig withDatabaseSchema(String v) {
    return new SchedulerConfig(
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        v,
        migrate,
        executionBaseUrl,
        dispatchTimeout,
        encryptionKey,
        hashingSecret,
        pollInterval,
        workerThreads);
  }

  public SchedulerConfig withMigrate(boolean v) {
    return new SchedulerConfig(
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        databaseSchema,
        v,
        executionBaseUrl,
        dispatchTimeout,
        encryptionKey,
        hashingSecret,
        pollInterval,
        workerThreads);
  }

  public SchedulerConfig withExecutionBaseUrl(String v) {
    return new SchedulerConfig(
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        databaseSchema,
        migrate,
        v,
        dispatchTimeout,
        encryptionKey,
        hashingSecret,
        pollInterval,
        workerThreads);
  }

  public SchedulerConfig withDispatchTimeout(Duration v) {
    return new SchedulerConfig(
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        databaseSchema,
        migrate,
        executionBaseUrl,
        v,
        encryptionKey,
        hashingSecret,
        pollInterval,
        workerThreads);
  }

  public SchedulerConfig withEncryptionKey(String v) {
    return new SchedulerConfig(
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        databaseSchema,
        migrate,
        executionBaseUrl,
        dispatchTimeout,
        v,
        hashingSecret,
        pollInterval,
        workerThreads);
  }

  public SchedulerConfig withHashingSecret(String v) {
    return new SchedulerConfig(
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        databaseSchema,
        migrate,
        executionBaseUrl,
        dispatchTimeout,
        encryptionKey,
        v,
        pollInterval,
        workerThreads);
  }

  public SchedulerConfig withPollInterval(Duration v) {
    return new SchedulerConfig(
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        databaseSchema,
        migrate,
        executionBaseUrl,
        dispatchTimeout,
        encryptionKey,
        hashingSecret,
        v,
        workerThreads);
  }

  public SchedulerConfig withWorkerThreads(int v) {
    return new SchedulerConfig(
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        databaseSchema,
        migrate,
        executionBaseUrl,
        dispatchTimeout,
        encryptionKey,
        hashingSecret,
        pollInterval,
        v);
  }

  @Override
  public String toString() {
    return "SchedulerConfig["
        + "databaseUrl=%s, dbUser=%s, dbPassword=%s, maximumPoolSize=%d, connectionTimeout=%d, "
            .formatted(databaseUrl, dbUser, mask(dbPassword), maximumPoolSize, connectionTimeout)
        + "dataSource=%s, databaseSchema=%s, migrate=%s, executionBaseUrl=%s, dispatchTimeout=%s, "
            .formatted(dataSource, databaseSchema, migrate, executionBaseUrl, dispatchTimeout)
        + "encryptionKey=%s, hashingSecret=%s, pollInterval=%s, workerThreads=%d]"
            .formatted(mask(encryptionKey), mask(hashingSecret), pollInterval, workerThreads);
  }

  private static String mask(String secret) {
    return secret == null ? null : "***";
  }
}
