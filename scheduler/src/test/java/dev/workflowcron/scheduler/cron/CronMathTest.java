package dev.workflowcron.scheduler.cron;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.workflowcron.scheduler.exceptions.CronConversionException;
import dev.workflowcron.scheduler.exceptions.InvalidCronException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

@Timeout(value = 2, unit = TimeUnit.MINUTES)
public class CronMathTest {

  static final Instant WINTER = Instant.parse("2025-01-15T12:00:00Z");
  static final Instant SUMMER = Instant.parse("2025-07-15T12:00:00Z");

  CronMath at(Instant instant) {
    return new CronMath(Clock.fixed(instant, ZoneOffset.UTC));
  }

  @Test
  public void validExpressionsValidate() {
    var cronMath = new CronMath();
    for (var expr :
        List.of(
            "* * * * *",
            "0 9 * * *",
            "*/15 * * * *",
            "0 0 1 * *",
            "30 8 * * 1-5",
            "0 6,18 * * *",
            "5-10/2 0-23 1-31 1-12 0-6",
            "0 9 * * 7")) {
      var validation = cronMath.validate(expr);
      assertEquals(expr, validation.expression());
      assertEquals(5, validation.parsedFields().size());
    }
  }

  @Test
  public void wrongFieldCountIsRejected() {
    var cronMath = new CronMath();
    for (var expr : List.of("", "   ", "* * * *", "0 9 * * * *", "0 0 9 * * * 2025")) {
      var e = assertThrows(InvalidCronException.class, () -> cronMath.validate(expr));
      assertEquals(expr, e.expression());
    }
    assertThrows(InvalidCronException.class, () -> cronMath.validate(null));
  }

  @Test
  public void outOfRangeFieldsAreRejected() {
    var cronMath = new CronMath();
    for (var expr :
        List.of("60 * * * *", "0 24 * * *", "0 0 32 * *", "0 0 * 13 *", "x * * * *")) {
      assertThrows(InvalidCronException.class, () -> cronMath.validate(expr), expr);
    }
  }

  @Test
  public void parsedFieldsAreNamed() {
    var fields = new CronMath().validate("15 6 1 2 3").parsedFields();
    assertEquals(
        List.of("minute", "hour", "day_of_month", "month", "day_of_week"),
        List.copyOf(fields.keySet()));
    assertEquals("15", fields.get("minute"));
    assertEquals("3", fields.get("day_of_week"));
  }

  @Test
  public void descriptions() {
    assertEquals("Daily at 00:00", CronMath.describe("0 0 * * *"));
    assertEquals("Daily at 00:00", CronMath.describe("00 00 * * *"));
    assertEquals("Daily at 09:00", CronMath.describe("0 9 * * *"));
    assertEquals("Daily at 08:30", CronMath.describe("30 8 * * *"));
    assertEquals("Daily at 14:05", CronMath.describe("5 14 * * *"));
    assertEquals("Cron: */5 * * * *", CronMath.describe("*/5 * * * *"));
    assertEquals("Cron: 0 9 * * 1-5", CronMath.describe("0 9 * * 1-5"));
    assertEquals("Cron: 0 9", CronMath.describe("0 9"));
  }

  @Test
  public void utcIsIdentity() {
    var cronMath = at(WINTER);
    for (var tz : List.of("UTC", "utc", "GMT", "gmt")) {
      var conversion = cronMath.convertToUTC("30 8 * * 1-5", tz);
      assertEquals("30 8 * * 1-5", conversion.utcExpression());
      assertEquals(CronMath.NO_CONVERSION_LABEL, conversion.offsetLabel());
      assertEquals(conversion.originalDescription(), conversion.utcDescription());
      assertNull(conversion.nextLocal());
      assertNull(conversion.nextUtc());
    }
  }

  @Test
  public void offsetFollowsDaylightSaving() {
    assertEquals("-5.0h", at(WINTER).convertToUTC("0 9 * * *", "America/New_York").offsetLabel());
    assertEquals("-4.0h", at(SUMMER).convertToUTC("0 9 * * *", "America/New_York").offsetLabel());
    assertEquals("+1.0h", at(WINTER).convertToUTC("0 9 * * *", "Europe/Paris").offsetLabel());
    assertEquals("+2.0h", at(SUMMER).convertToUTC("0 9 * * *", "Europe/Paris").offsetLabel());
    assertEquals("+5.5h", at(WINTER).convertToUTC("0 9 * * *", "Asia/Kolkata").offsetLabel());
  }

  @Test
  public void offsetIsTakenAtTheNextLocalFire() {
    // 2025-03-09 is the US spring forward; the next 09:00 after Saturday noon is on Sunday
    var saturday = Instant.parse("2025-03-08T18:00:00Z");
    var conversion = at(saturday).convertToUTC("0 9 * * *", "America/New_York");
    assertEquals("-4.0h", conversion.offsetLabel());
    assertEquals(Instant.parse("2025-03-09T13:00:00Z"), conversion.nextLocal().toInstant());
  }

  @Test
  public void conversionKeepsWallClockFields() {
    var conversion = at(WINTER).convertToUTC("0 9 * * *", "America/New_York");
    assertEquals("0 9 * * *", conversion.utcExpression());
    assertEquals("Daily at 09:00", conversion.originalDescription());
    // 12:00Z is 07:00 in New York, so 09:00 local is still ahead today
    assertEquals(Instant.parse("2025-01-15T14:00:00Z"), conversion.nextLocal().toInstant());
    assertEquals(ZoneId.of("America/New_York"), conversion.nextLocal().getZone());
    assertEquals(Instant.parse("2025-01-16T09:00:00Z"), conversion.nextUtc().toInstant());
  }

  @Test
  public void unknownZoneFailsConversion() {
    var e =
        assertThrows(
            CronConversionException.class,
            () -> new CronMath().convertToUTC("0 9 * * *", "Mars/Olympus_Mons"));
    assertTrue(e.getMessage().contains("Mars/Olympus_Mons"));
  }

  @Test
  public void invalidExpressionFailsConversion() {
    assertThrows(
        InvalidCronException.class, () -> new CronMath().convertToUTC("0 9 * *", "Europe/Paris"));
  }

  @Test
  public void nextExecutionIsStrictlyAfter() {
    var after = Instant.parse("2025-01-15T09:00:00Z");
    var next = CronMath.nextExecution("0 9 * * *", ZoneId.of("UTC"), after);
    assertEquals(Instant.parse("2025-01-16T09:00:00Z"), next.orElseThrow().toInstant());
  }
}
