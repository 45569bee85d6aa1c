package com.ospicorp.forecastengine.forecast.service;

import com.ospicorp.forecastengine.forecast.model.ForecastResultRow;
import com.ospicorp.forecastengine.forecast.model.QuantileForecast;
import com.ospicorp.forecastengine.metrics.service.TimestampParser;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Projects the forecast frame onto the public contract: {@code mean} becomes
 * {@code prediction}, the 2.5% and 97.5% quantiles become {@code lowerBound} and
 * {@code upperBound}. The levels are fixed.
 */
@Component
public class ResponseShaper {

  public static final double LOWER_LEVEL = 0.025;
  public static final double UPPER_LEVEL = 0.975;
  public static final List<Double> REQUIRED_QUANTILE_LEVELS = List.of(LOWER_LEVEL, UPPER_LEVEL);

  static final String PREDICTION_COLUMN = QuantileForecast.MEAN;
  static final String LOWER_COLUMN = QuantileForecast.quantileColumn(LOWER_LEVEL);
  static final String UPPER_COLUMN = QuantileForecast.quantileColumn(UPPER_LEVEL);

  private static final List<String> REQUIRED_COLUMNS =
      List.of(PREDICTION_COLUMN, LOWER_COLUMN, UPPER_COLUMN);

  public List<ForecastResultRow> shape(QuantileForecast forecast) {
    List<String> missing = REQUIRED_COLUMNS.stream()
        .filter(column -> !forecast.columns().contains(column))
        .toList();
    if (!missing.isEmpty()) {
      throw new QuantileConfigurationException("Forecast is missing columns " + missing
          + "; available columns are " + forecast.columns());
    }

    List<ForecastResultRow> out = new ArrayList<>(forecast.rows().size());
    for (QuantileForecast.Row row : forecast.rows()) {
      out.add(new ForecastResultRow(
          row.itemId(),
          TimestampParser.format(row.timestamp()),
          required(row, PREDICTION_COLUMN),
          required(row, LOWER_COLUMN),
          required(row, UPPER_COLUMN)));
    }
    return out;
  }

  private static double required(QuantileForecast.Row row, String column) {
    Double value = row.value(column);
    if (value == null || Double.isNaN(value)) {
      throw new QuantileConfigurationException("Forecast row for " + row.itemId() + " at "
          + row.timestamp() + " has no value for column " + column);
    }
    return value;
  }
}
