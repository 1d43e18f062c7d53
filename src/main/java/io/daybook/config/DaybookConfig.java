package io.daybook.config;

import io.daybook.eval.CalendarMath;
import io.daybook.eval.DayProjector;
import io.daybook.eval.RecurrenceExpander;
import io.daybook.model.Frequency;
import io.daybook.model.Window;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Settings for loading and projecting calendars.
 *
 * <p>Values are read from {@code /daybook-default.properties} on the classpath, then overridden
 * by {@code DAYBOOK_*} environment variables ({@code DAYBOOK_EXPANSION_MAX_OCCURRENCES} sets
 * {@code daybook.expansion.max-occurrences}) and finally by {@code daybook.*} system properties.
 */
public final class DaybookConfig {
  private static final Logger logger = LoggerFactory.getLogger(DaybookConfig.class);

  static final String DEFAULTS_RESOURCE = "/daybook-default.properties";

  public static final String ZONE = "daybook.zone";
  public static final String MAX_OCCURRENCES = "daybook.expansion.max-occurrences";
  public static final String MAX_TOTAL_OCCURRENCES = "daybook.expansion.max-total-occurrences";
  public static final String PAST_YEARS = "daybook.window.default-past-years";
  public static final String FUTURE_YEARS = "daybook.window.default-future-years";
  public static final String CHARSET = "daybook.file.charset";

  private final ZoneId zone;
  private final int maxOccurrences;
  private final int maxTotalOccurrences;
  private final Integer pastYears;
  private final int futureYears;
  private final Charset charset;

  /** Loads the configuration from defaults, environment, and system properties. */
  public DaybookConfig() {
    this(loadProperties(System.getenv(), System.getProperties()));
  }

  /**
   * Creates a configuration from explicit properties, on top of the classpath defaults only.
   *
   * @param overrides the properties to apply
   * @throws IllegalArgumentException if a value is invalid
   */
  public DaybookConfig(Properties overrides) {
    Properties props = new Properties();
    loadPropertiesFromResource(props);
    props.putAll(overrides);

    List<String> errors = new ArrayList<>();
    this.zone = parseZone(props.getProperty(ZONE, ""), errors);
    this.maxOccurrences =
        parsePositive(props, MAX_OCCURRENCES, RecurrenceExpander.MAX_OCCURRENCES, errors);
    if (maxOccurrences > RecurrenceExpander.MAX_OCCURRENCES) {
      errors.add(
          MAX_OCCURRENCES
              + " must not exceed "
              + RecurrenceExpander.MAX_OCCURRENCES
              + ": "
              + maxOccurrences);
    }
    this.maxTotalOccurrences =
        parsePositive(props, MAX_TOTAL_OCCURRENCES, DayProjector.MAX_TOTAL_OCCURRENCES, errors);
    String past = props.getProperty(PAST_YEARS, "").strip();
    this.pastYears = past.isEmpty() ? null : parsePositive(props, PAST_YEARS, 1, errors);
    this.futureYears = parsePositive(props, FUTURE_YEARS, 100, errors);
    this.charset = parseCharset(props.getProperty(CHARSET, "UTF-8"), errors);

    if (!errors.isEmpty()) {
      throw new IllegalArgumentException("Invalid daybook configuration: " + errors);
    }
    logger.debug(
        "Loaded daybook configuration: zone={}, maxOccurrences={}, maxTotalOccurrences={}",
        zone,
        maxOccurrences,
        maxTotalOccurrences);
  }

  /** Returns the zone floating times are resolved in. */
  public ZoneId zone() {
    return zone;
  }

  /** Returns the per-entry occurrence cap, never above 1000. */
  public int maxOccurrences() {
    return maxOccurrences;
  }

  /** Returns the occurrence budget across all entries of one view. */
  public int maxTotalOccurrences() {
    return maxTotalOccurrences;
  }

  /** Returns the charset calendar files are decoded with. */
  public Charset charset() {
    return charset;
  }

  /**
   * Returns the window used when the caller gives none.
   *
   * <p>It starts on Jan 1 of year 0, or the configured number of past years before today, and
   * ends the configured number of future years from now.
   *
   * @param clock the clock defining now
   * @return the default window
   */
  public Window defaultWindow(Clock clock) {
    Instant now = clock.instant();
    Instant start =
        pastYears == null
            ? LocalDate.of(0, 1, 1).atStartOfDay(zone).toInstant()
            : CalendarMath.startOfDay(
                CalendarMath.advance(now, -pastYears, Frequency.YEARLY, zone), zone);
    Instant end = CalendarMath.advance(now, futureYears, Frequency.YEARLY, zone);
    return new Window(start, end);
  }

  static Properties loadProperties(Map<String, String> env, Properties system) {
    Properties props = new Properties();
    env.forEach(
        (key, value) -> {
          if (key.startsWith("DAYBOOK_")) {
            props.setProperty(toPropertyKey(key), value);
          }
        });
    system.forEach(
        (key, value) -> {
          String keyStr = key.toString();
          if (keyStr.startsWith("daybook.")) {
            props.setProperty(keyStr, value.toString());
          }
        });
    return props;
  }

  /** Maps DAYBOOK_EXPANSION_MAX_OCCURRENCES to the matching known key, if any. */
  static String toPropertyKey(String envKey) {
    String dotted = envKey.toLowerCase().replace('_', '.');
    for (String known :
        List.of(ZONE, MAX_OCCURRENCES, MAX_TOTAL_OCCURRENCES, PAST_YEARS, FUTURE_YEARS, CHARSET)) {
      if (known.replace('-', '.').equals(dotted)) {
        return known;
      }
    }
    return dotted;
  }

  private static void loadPropertiesFromResource(Properties props) {
    try (InputStream is = DaybookConfig.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
      if (is != null) {
        props.load(is);
        logger.debug("Loaded properties from: {}", DEFAULTS_RESOURCE);
      } else {
        logger.debug("Properties file not found: {}", DEFAULTS_RESOURCE);
      }
    } catch (IOException e) {
      logger.warn("Failed to load properties from: {}", DEFAULTS_RESOURCE, e);
    }
  }

  private static ZoneId parseZone(String value, List<String> errors) {
    if (value.isBlank()) {
      return ZoneId.systemDefault();
    }
    try {
      return ZoneId.of(value.strip());
    } catch (DateTimeException e) {
      errors.add(ZONE + " is not a valid zone: " + value);
      return ZoneId.systemDefault();
    }
  }

  private static int parsePositive(
      Properties props, String key, int defaultValue, List<String> errors) {
    String value = props.getProperty(key, "").strip();
    if (value.isEmpty()) {
      return defaultValue;
    }
    try {
      int n = Integer.parseInt(value);
      if (n < 1) {
        errors.add(key + " must be positive: " + value);
        return defaultValue;
      }
      return n;
    } catch (NumberFormatException e) {
      errors.add(key + " is not a number: " + value);
      return defaultValue;
    }
  }

  private static Charset parseCharset(String value, List<String> errors) {
    try {
      return Charset.forName(value.strip());
    } catch (IllegalArgumentException e) {
      errors.add(CHARSET + " is not a supported charset: " + value);
      return Charset.defaultCharset();
    }
  }
}
