package com.ospicorp.forecastengine.metrics.service;

import static java.time.temporal.ChronoField.HOUR_OF_DAY;
import static java.time.temporal.ChronoField.MINUTE_OF_HOUR;
import static java.time.temporal.ChronoField.NANO_OF_SECOND;
import static java.time.temporal.ChronoField.SECOND_OF_MINUTE;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.chrono.IsoChronology;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.TemporalAccessor;
import java.util.Date;
import java.util.Locale;
import java.util.Optional;

/**
 * Lenient timestamp parsing shared by the batch path and the request boundary. Offsets are
 * normalised to UTC and dropped; a bare date means midnight.
 */
public final class TimestampParser {

  public static final DateTimeFormatter OUTPUT_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE_TIME;

  private static final DateTimeFormatter INPUT_FORMAT = new DateTimeFormatterBuilder()
      .parseCaseInsensitive()
      .append(DateTimeFormatter.ISO_LOCAL_DATE)
      .optionalStart()
      .optionalStart().appendLiteral('T').optionalEnd()
      .optionalStart().appendLiteral(' ').optionalEnd()
      .appendValue(HOUR_OF_DAY, 2)
      .appendLiteral(':')
      .appendValue(MINUTE_OF_HOUR, 2)
      .optionalStart()
      .appendLiteral(':')
      .appendValue(SECOND_OF_MINUTE, 2)
      .optionalStart().appendFraction(NANO_OF_SECOND, 0, 9, true).optionalEnd()
      .optionalEnd()
      .optionalStart().appendOffsetId().optionalEnd()
      .optionalEnd()
      .toFormatter(Locale.ROOT)
      .withChronology(IsoChronology.INSTANCE)
      .withResolverStyle(ResolverStyle.STRICT);

  private TimestampParser() {
  }

  public static Optional<LocalDateTime> parse(String text) {
    if (text == null || text.isBlank()) {
      return Optional.empty();
    }
    try {
      TemporalAccessor parsed = INPUT_FORMAT.parseBest(text.strip(),
          OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
      if (parsed instanceof OffsetDateTime offset) {
        return Optional.of(offset.withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime());
      }
      if (parsed instanceof LocalDateTime local) {
        return Optional.of(local);
      }
      return Optional.of(((LocalDate) parsed).atStartOfDay());
    } catch (DateTimeParseException ex) {
      return Optional.empty();
    }
  }

  /** Accepts the temporal types JDBC drivers hand back as well as text. */
  public static Optional<LocalDateTime> coerce(Object value) {
    if (value == null) {
      return Optional.empty();
    }
    if (value instanceof LocalDateTime local) {
      return Optional.of(local);
    }
    if (value instanceof java.sql.Timestamp timestamp) {
      return Optional.of(timestamp.toLocalDateTime());
    }
    if (value instanceof OffsetDateTime offset) {
      return Optional.of(offset.withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime());
    }
    if (value instanceof ZonedDateTime zoned) {
      return Optional.of(zoned.withZoneSameInstant(ZoneOffset.UTC).toLocalDateTime());
    }
    if (value instanceof Instant instant) {
      return Optional.of(LocalDateTime.ofInstant(instant, ZoneOffset.UTC));
    }
    if (value instanceof LocalDate date) {
      return Optional.of(date.atStartOfDay());
    }
    if (value instanceof Date date) {
      return Optional.of(LocalDateTime.ofInstant(date.toInstant(), ZoneOffset.UTC));
    }
    return parse(value.toString());
  }

  public static String format(LocalDateTime timestamp) {
    return OUTPUT_FORMAT.format(timestamp);
  }
}
