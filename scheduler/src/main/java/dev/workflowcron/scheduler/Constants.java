package dev.workflowcron.scheduler;

import java.util.UUID;

public class Constants {

  public static final String DB_SCHEMA = "scheduler";
  public static final String POSTGRES_DEFAULT_DB = "postgres";

  public static final String POSTGRES_PASSWORD_ENV_VAR = "PGPASSWORD";
  public static final String POSTGRES_USER_ENV_VAR = "PGUSER";
  public static final String JDBC_URL_ENV_VAR = "SCHEDULER_JDBC_URL";
  public static final String EXECUTION_BASE_URL_ENV_VAR = "SCHEDULER_EXECUTION_BASE_URL";
  public static final String ENCRYPTION_KEY_ENV_VAR = "SCHEDULER_ENCRYPTION_KEY";
  public static final String HASHING_SECRET_ENV_VAR = "SCHEDULER_HASHING_SECRET";

  public static final String DEFAULT_CRON_EXPRESSION = "0 9 * * *";
  public static final String DEFAULT_TIMEZONE = "UTC";

  public static final String PERIODIC_TASK_NAME_PREFIX = "schedule_";
  public static final String PERIODIC_TASK_IDENTIFIER = "execute_scheduled_workflow";
  public static final String PERIODIC_TASK_QUEUE = "scheduled_workflows";

  public static final String AUTOMATION_CREDENTIAL_PREFIX = "automation_schedule_";
  public static final String CREDENTIAL_TOKEN_PREFIX = "wfc_";
  public static final int CREDENTIAL_TOKEN_BYTES = 24;

  public static final UUID SYSTEM_USER_ID = UUID.fromString("00000000-0000-0000-0000-000000000001");

  public static final String API_KEY_HEADER = "X-API-Key";
}
