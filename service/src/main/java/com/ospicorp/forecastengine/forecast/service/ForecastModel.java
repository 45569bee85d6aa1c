package com.ospicorp.forecastengine.forecast.service;

import com.ospicorp.forecastengine.forecast.model.QuantileForecast;
import com.ospicorp.forecastengine.metrics.model.SeriesRecord;
import java.util.List;
import java.util.Map;

/**
 * A loaded predictor. Read-only after loading.
 */
public interface ForecastModel {

  /**
   * Forecasts every item in {@code history}.
   *
   * @param history series keyed by item id, each ordered by timestamp
   * @param modelName which of the predictor's models to use
   * @throws PredictionException if any item cannot be forecast
   */
  QuantileForecast predict(Map<String, List<SeriesRecord>> history, String modelName);

  /** False when concurrent {@link #predict} calls must be serialized by the caller. */
  default boolean threadSafe() {
    return true;
  }
}
