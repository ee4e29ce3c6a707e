package dev.workflowcron.scheduler.cron;

import dev.workflowcron.scheduler.exceptions.CronConversionException;
import dev.workflowcron.scheduler.exceptions.InvalidCronException;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;

public class CronMath {

  public static final String NO_CONVERSION_LABEL = "UTC (no conversion needed)";

  static final List<String> FIELD_NAMES =
      List.of("minute", "hour", "day_of_month", "month", "day_of_week");

  private static final CronParser cronParser =
      new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));

  private final Clock clock;

  public CronMath() {
    this(Clock.systemUTC());
  }

  public CronMath(Clock clock) {
    this.clock = Objects.requireNonNull(clock);
  }

  /**
   * Validates a standard five field cron expression and describes it.
   *
   * @throws InvalidCronException if the expression is blank, does not have five fields, or has a
   *     field outside the cron grammar
   */
  public CronValidation validate(String expression) {
    var fields = splitFields(expression);
    parse(expression);

    Map<String, String> parsed = new LinkedHashMap<>();
    for (int i = 0; i < FIELD_NAMES.size(); i++) {
      parsed.put(FIELD_NAMES.get(i), fields[i]);
    }
    return new CronValidation(
        expression, describe(expression), Collections.unmodifiableMap(parsed));
  }

  /**
   * Anchors {@code expression} in {@code timezone} and reports the UTC offset in effect at the next
   * local fire time, so a DST change between now and that fire time is reflected.
   *
   * @throws InvalidCronException if the expression is invalid
   * @throws CronConversionException if the timezone is unknown or the expression never fires
   */
  public CronConversion convertToUTC(String expression, String timezone) {
    var description = validate(expression).description();
    if (timezone == null || timezone.isBlank()) {
      throw new CronConversionException(
          expression, timezone, new IllegalArgumentException("timezone must not be empty"));
    }
    if (isUtc(timezone)) {
      return new CronConversion(
          expression, description, description, NO_CONVERSION_LABEL, null, null);
    }

    ZoneId zone;
    try {
      zone = ZoneId.of(timezone);
    } catch (DateTimeException e) {
      throw new CronConversionException(expression, timezone, e);
    }

    var executionTime = ExecutionTime.forCron(parse(expression));
    var now = clock.instant();
    var nextLocal = nextOrThrow(executionTime, now.atZone(zone), expression, timezone);
    var nextUtc = nextOrThrow(executionTime, now.atZone(ZoneOffset.UTC), expression, timezone);

    var offsetHours = nextLocal.getOffset().getTotalSeconds() / 3600.0;
    return new CronConversion(
        expression, description, description, formatOffset(offsetHours), nextLocal, nextUtc);
  }

  /** Next fire time of {@code expression} strictly after {@code after}, evaluated in a zone. */
  public static Optional<ZonedDateTime> nextExecution(
      String expression, ZoneId zone, Instant after) {
    return ExecutionTime.forCron(parse(expression)).nextExecution(after.atZone(zone));
  }

  /**
   * Parses a five field expression.
   *
   * @throws InvalidCronException if the expression is not valid
   */
  public static Cron parse(String expression) {
    var fields = splitFields(expression);
    try {
      return cronParser.parse(String.join(" ", fields));
    } catch (IllegalArgumentException e) {
      throw new InvalidCronException(expression, e);
    }
  }

  public static String describe(String expression) {
    var parts = expression == null ? new String[0] : expression.trim().split("\\s+");
    if (parts.length != 5) {
      return "Cron: " + expression;
    }
    var minute = parts[0];
    var hour = parts[1];
    boolean everyDay = parts[2].equals("*") && parts[3].equals("*") && parts[4].equals("*");
    if (!everyDay || !isNumber(minute) || !isNumber(hour)) {
      return "Cron: " + expression;
    }
    return "Daily at %02d:%02d".formatted(Integer.parseInt(hour), Integer.parseInt(minute));
  }

  public static boolean isUtc(String timezone) {
    return "UTC".equalsIgnoreCase(timezone) || "GMT".equalsIgnoreCase(timezone);
  }

  static String formatOffset(double hours) {
    return String.format(Locale.ROOT, "%+.1fh", hours);
  }

  private static String[] splitFields(String expression) {
    if (expression == null || expression.isBlank()) {
      throw new InvalidCronException(expression, "expression must not be empty");
    }
    var fields = expression.trim().split("\\s+");
    if (fields.length != 5) {
      throw new InvalidCronException(
          expression, "expected 5 fields but found %d".formatted(fields.length));
    }
    return fields;
  }

  private static boolean isNumber(String field) {
    return !field.isEmpty() && field.length() <= 2 && field.chars().allMatch(Character::isDigit);
  }

  private static ZonedDateTime nextOrThrow(
      ExecutionTime executionTime, ZonedDateTime from, String expression, String timezone) {
    return executionTime
        .nextExecution(from)
        .orElseThrow(
            () ->
                new CronConversionException(
                    expression,
                    timezone,
                    new IllegalStateException("expression has no upcoming fire time")));
  }
}
