package com.ospicorp.forecastengine.forecast.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Model output: one row per (item, horizon step) carrying the point estimate under
 * {@value #MEAN} and one column per quantile level, named like {@code 0.025}.
 */
public record QuantileForecast(Set<String> columns, List<Row> rows) {

  public static final String MEAN = "mean";

  public QuantileForecast {
    columns = Collections.unmodifiableSet(new LinkedHashSet<>(columns));
    rows = List.copyOf(rows);
  }

  public static String quantileColumn(double level) {
    return BigDecimal.valueOf(level).stripTrailingZeros().toPlainString();
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }

  public record Row(String itemId, LocalDateTime timestamp, Map<String, Double> values) {

    public Row {
      values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public Double value(String column) {
      return values.get(column);
    }
  }
}
