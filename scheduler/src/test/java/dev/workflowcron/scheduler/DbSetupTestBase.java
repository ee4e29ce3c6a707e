package dev.workflowcron.scheduler;

import dev.workflowcron.scheduler.config.SchedulerConfig;
import dev.workflowcron.scheduler.database.SchedulerDatabase;

import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.BeforeAll;
import org.testcontainers.DockerClientFactory;
import org.testcontainers.containers.PostgreSQLContainer;

public class DbSetupTestBase {

  protected static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:18");

  protected static SchedulerConfig schedulerConfig;
  protected static HikariDataSource dataSource;

  @BeforeAll
  static void onetimeSetup() {
    Assumptions.assumeTrue(
        DockerClientFactory.instance().isDockerAvailable(), "Docker is not available");
    postgres.start();
    schedulerConfig =
        SchedulerConfig.defaults()
            .withDatabaseUrl(postgres.getJdbcUrl())
            .withDbUser(postgres.getUsername())
            .withDbPassword(postgres.getPassword())
            .withMaximumPoolSize(4);
    dataSource = SchedulerDatabase.createDataSource(schedulerConfig);
  }

  @AfterAll
  static void afterAll() {
    if (dataSource != null) {
      dataSource.close();
      dataSource = null;
    }
    if (postgres.isRunning()) {
      postgres.stop();
    }
  }
}
