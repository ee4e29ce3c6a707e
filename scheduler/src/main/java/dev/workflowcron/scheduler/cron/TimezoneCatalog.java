package dev.workflowcron.scheduler.cron;

import dev.workflowcron.scheduler.exceptions.UnknownTimezoneException;

import java.time.Clock;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/** The timezones offered for schedules, grouped by region for display. */
public class TimezoneCatalog {

  private static final DateTimeFormatter CURRENT_TIME_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z", Locale.ROOT);

  private static final Map<String, List<TimezoneOption>> OPTIONS = buildOptions();

  private static Map<String, List<TimezoneOption>> buildOptions() {
    Map<String, List<TimezoneOption>> options = new LinkedHashMap<>();
    options.put(
        "UTC & GMT",
        List.of(
            new TimezoneOption("UTC", "UTC (Coordinated Universal Time)"),
            new TimezoneOption("GMT", "GMT (Greenwich Mean Time)")));
    options.put(
        "North America",
        List.of(
            new TimezoneOption("America/New_York", "Eastern Time (ET) - New York, Toronto"),
            new TimezoneOption("America/Chicago", "Central Time (CT) - Chicago, Mexico City"),
            new TimezoneOption("America/Denver", "Mountain Time (MT) - Denver, Phoenix"),
            new TimezoneOption(
                "America/Los_Angeles", "Pacific Time (PT) - Los Angeles, Vancouver"),
            new TimezoneOption("America/Anchorage", "Alaska Time (AKT) - Anchorage"),
            new TimezoneOption("Pacific/Honolulu", "Hawaii Time (HST) - Honolulu")));
    options.put(
        "Europe",
        List.of(
            new TimezoneOption("Europe/London", "GMT/BST - London, Dublin"),
            new TimezoneOption("Europe/Paris", "CET/CEST - Paris, Berlin, Rome"),
            new TimezoneOption("Europe/Moscow", "MSK - Moscow"),
            new TimezoneOption("Europe/Istanbul", "TRT - Istanbul"),
            new TimezoneOption("Europe/Amsterdam", "CET/CEST - Amsterdam, Brussels"),
            new TimezoneOption("Europe/Stockholm", "CET/CEST - Stockholm, Oslo")));
    options.put(
        "Asia",
        List.of(
            new TimezoneOption("Asia/Tokyo", "JST - Tokyo, Seoul"),
            new TimezoneOption("Asia/Shanghai", "CST - Shanghai, Beijing"),
            new TimezoneOption("Asia/Hong_Kong", "HKT - Hong Kong"),
            new TimezoneOption("Asia/Singapore", "SGT - Singapore, Kuala Lumpur"),
            new TimezoneOption("Asia/Kolkata", "IST - Mumbai, New Delhi"),
            new TimezoneOption("Asia/Dubai", "GST - Dubai, Abu Dhabi"),
            new TimezoneOption("Asia/Bangkok", "ICT - Bangkok, Jakarta")));
    options.put(
        "Australia & Pacific",
        List.of(
            new TimezoneOption("Australia/Sydney", "AEST/AEDT - Sydney, Melbourne"),
            new TimezoneOption("Australia/Perth", "AWST - Perth"),
            new TimezoneOption("Pacific/Auckland", "NZST/NZDT - Auckland, Wellington"),
            new TimezoneOption("Pacific/Fiji", "FJT - Fiji")));
    options.put(
        "South America",
        List.of(
            new TimezoneOption("America/Sao_Paulo", "BRT/BRST - São Paulo, Rio de Janeiro"),
            new TimezoneOption("America/Argentina/Buenos_Aires", "ART - Buenos Aires"),
            new TimezoneOption("America/Santiago", "CLT/CLST - Santiago"),
            new TimezoneOption("America/Lima", "PET - Lima")));
    options.put(
        "Africa",
        List.of(
            new TimezoneOption("Africa/Cairo", "EET - Cairo"),
            new TimezoneOption("Africa/Johannesburg", "SAST - Johannesburg, Cape Town"),
            new TimezoneOption("Africa/Lagos", "WAT - Lagos, Kinshasa"),
            new TimezoneOption("Africa/Nairobi", "EAT - Nairobi, Addis Ababa")));
    return Collections.unmodifiableMap(options);
  }

  private final Clock clock;

  public TimezoneCatalog() {
    this(Clock.systemUTC());
  }

  public TimezoneCatalog(Clock clock) {
    this.clock = Objects.requireNonNull(clock);
  }

  public Map<String, List<TimezoneOption>> listTimezones() {
    return OPTIONS;
  }

  public boolean isSupported(String timezone) {
    return findOption(timezone) != null;
  }

  /**
   * Describes a supported timezone together with its current UTC offset.
   *
   * @throws UnknownTimezoneException if the timezone is not in the catalog
   */
  public TimezoneInfo validateTimezone(String timezone) {
    var option = findOption(timezone);
    if (option == null) {
      throw new UnknownTimezoneException(timezone);
    }
    var now = ZonedDateTime.now(clock.withZone(ZoneId.of(option.value())));
    var offsetHours = now.getOffset().getTotalSeconds() / 3600.0;
    return new TimezoneInfo(
        option.value(),
        option.label(),
        CronMath.formatOffset(offsetHours),
        now.format(CURRENT_TIME_FORMAT));
  }

  private static TimezoneOption findOption(String timezone) {
    if (timezone == null) {
      return null;
    }
    for (var region : OPTIONS.values()) {
      for (var option : region) {
        if (option.value().equals(timezone)) {
          return option;
        }
      }
    }
    return null;
  }
}
