package com.ospicorp.forecastengine.metrics.service;

import com.ospicorp.forecastengine.metrics.model.MetricDefinition;
import com.ospicorp.forecastengine.metrics.model.NormalizationResult;
import com.ospicorp.forecastengine.metrics.model.Observation;
import com.ospicorp.forecastengine.metrics.model.RawObservation;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Turns raw connector rows into typed observations. Rows with an unparseable timestamp, a
 * blank entity or any missing/non-numeric tracked metric are dropped and counted; row content
 * never raises.
 */
public class SampleNormalizer {

  private static final Logger log = LoggerFactory.getLogger(SampleNormalizer.class);

  private final String timestampColumn;
  private final String entityColumn;
  private final List<MetricDefinition> metrics;

  public SampleNormalizer(String timestampColumn, String entityColumn,
      List<MetricDefinition> metrics) {
    if (!StringUtils.hasText(timestampColumn) || !StringUtils.hasText(entityColumn)) {
      throw new IllegalArgumentException("timestamp and entity columns must be provided");
    }
    if (metrics == null || metrics.isEmpty()) {
      throw new IllegalArgumentException("at least one metric must be tracked");
    }
    this.timestampColumn = timestampColumn.strip();
    this.entityColumn = entityColumn.strip();
    this.metrics = List.copyOf(metrics);
  }

  public NormalizationResult normalize(List<RawObservation> rows) {
    List<Observation> out = new ArrayList<>(rows.size());
    int badTimestamp = 0;
    int badEntity = 0;
    int badMetric = 0;

    for (RawObservation row : rows) {
      Optional<LocalDateTime> timestamp = TimestampParser.coerce(row.get(timestampColumn));
      if (timestamp.isEmpty()) {
        badTimestamp++;
        log.debug("Dropping row with invalid timestamp: {}", row.fields());
        continue;
      }
      Object entityValue = row.get(entityColumn);
      String entity = entityValue == null ? null : entityValue.toString().strip();
      if (!StringUtils.hasText(entity)) {
        badEntity++;
        log.debug("Dropping row without entity: {}", row.fields());
        continue;
      }
      Map<String, Double> values = new LinkedHashMap<>();
      for (MetricDefinition metric : metrics) {
        OptionalDouble value = toNumber(row.get(metric.column()));
        if (value.isEmpty()) {
          break;
        }
        values.put(metric.column(), value.getAsDouble());
      }
      if (values.size() != metrics.size()) {
        badMetric++;
        log.debug("Dropping row with missing or non-numeric metric: {}", row.fields());
        continue;
      }
      out.add(new Observation(timestamp.get(), entity, values));
    }

    NormalizationResult result =
        new NormalizationResult(out, rows.size(), badTimestamp, badEntity, badMetric);
    if (result.droppedRows() > 0) {
      log.info("Normalized {} of {} rows; dropped {} (timestamp={}, entity={}, metric={})",
          out.size(), rows.size(), result.droppedRows(), badTimestamp, badEntity, badMetric);
    } else {
      log.debug("Normalized {} rows", out.size());
    }
    return result;
  }

  static OptionalDouble toNumber(Object value) {
    if (value instanceof Number number) {
      double d = number.doubleValue();
      return Double.isFinite(d) ? OptionalDouble.of(d) : OptionalDouble.empty();
    }
    if (value instanceof CharSequence text) {
      String trimmed = text.toString().strip();
      if (trimmed.isEmpty()) {
        return OptionalDouble.empty();
      }
      try {
        double d = new BigDecimal(trimmed).doubleValue();
        return Double.isFinite(d) ? OptionalDouble.of(d) : OptionalDouble.empty();
      } catch (NumberFormatException ex) {
        return OptionalDouble.empty();
      }
    }
    return OptionalDouble.empty();
  }
}
