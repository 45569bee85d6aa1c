package com.ospicorp.forecastengine.metrics.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.time.LocalDateTime;
import org.junit.jupiter.api.Test;

class TimestampParserTest {

  @Test
  void parsesCommonShapes() {
    LocalDateTime expected = LocalDateTime.of(2024, 3, 1, 8, 30);
    assertThat(TimestampParser.parse("2024-03-01T08:30:00")).hasValue(expected);
    assertThat(TimestampParser.parse("2024-03-01 08:30")).hasValue(expected);
    assertThat(TimestampParser.parse(" 2024-03-01 08:30:00.000 ")).hasValue(expected);
    assertThat(TimestampParser.parse("2024-03-01T10:30:00+02:00")).hasValue(expected);
    assertThat(TimestampParser.parse("2024-03-01")).hasValue(LocalDateTime.of(2024, 3, 1, 0, 0));
  }

  @Test
  void rejectsGarbageAndImpossibleDates() {
    assertThat(TimestampParser.parse("not-a-date")).isEmpty();
    assertThat(TimestampParser.parse("2024-02-30T00:00:00")).isEmpty();
    assertThat(TimestampParser.parse("")).isEmpty();
    assertThat(TimestampParser.parse(null)).isEmpty();
  }

  @Test
  void coercesInstantsToUtc() {
    assertThat(TimestampParser.coerce(Instant.parse("2024-03-01T08:30:00Z")))
        .hasValue(LocalDateTime.of(2024, 3, 1, 8, 30));
  }

  @Test
  void formatsIsoLocal() {
    assertThat(TimestampParser.format(LocalDateTime.of(2024, 3, 1, 8, 5)))
        .isEqualTo("2024-03-01T08:05:00");
  }
}
