package com.ospicorp.forecastengine.forecast.service;

import com.ospicorp.forecastengine.forecast.model.QuantileForecast;
import com.ospicorp.forecastengine.metrics.model.SeriesRecord;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * In-process predictor backed by the built-in estimators. Stateless between calls, so safe for
 * concurrent use.
 */
public class LocalForecastModel implements ForecastModel {

  private static final Map<String, SeriesEstimator> ESTIMATORS = Map.of(
      ExponentialSmoothingEstimator.NAME, new ExponentialSmoothingEstimator(),
      NaiveEstimator.NAME, new NaiveEstimator());

  private final Map<String, SeriesEstimator> estimators;
  private final Duration frequency;
  private final int predictionLength;
  private final List<Double> quantileLevels;

  public LocalForecastModel(List<String> models, Duration frequency, int predictionLength,
      List<Double> quantileLevels) {
    Map<String, SeriesEstimator> selected = new LinkedHashMap<>();
    for (String model : models) {
      SeriesEstimator estimator = ESTIMATORS.get(model);
      if (estimator == null) {
        throw new IllegalArgumentException("Unsupported local model: " + model
            + ". Supported values: " + String.join(",", supportedModels()));
      }
      selected.put(model, estimator);
    }
    this.estimators = selected;
    this.frequency = frequency;
    this.predictionLength = predictionLength;
    this.quantileLevels = List.copyOf(quantileLevels);
  }

  public static Set<String> supportedModels() {
    return new TreeSet<>(ESTIMATORS.keySet());
  }

  @Override
  public QuantileForecast predict(Map<String, List<SeriesRecord>> history, String modelName) {
    SeriesEstimator estimator = estimators.get(modelName);
    if (estimator == null) {
      throw new PredictionException("Model not available in predictor: " + modelName);
    }

    Set<String> columns = new LinkedHashSet<>();
    columns.add(QuantileForecast.MEAN);
    quantileLevels.forEach(level -> columns.add(QuantileForecast.quantileColumn(level)));

    List<QuantileForecast.Row> rows = new ArrayList<>(history.size() * predictionLength);
    history.forEach((itemId, series) -> rows.addAll(forecastItem(itemId, series, estimator)));
    return new QuantileForecast(columns, rows);
  }

  private List<QuantileForecast.Row> forecastItem(String itemId, List<SeriesRecord> series,
      SeriesEstimator estimator) {
    if (series.size() < estimator.minimumHistory()) {
      throw new PredictionException("Series " + itemId + " has " + series.size()
          + " observation(s); " + estimator.name() + " needs at least " + estimator.minimumHistory());
    }
    double[] values = new double[series.size()];
    for (int i = 0; i < values.length; i++) {
      double v = series.get(i).value();
      if (!Double.isFinite(v)) {
        throw new PredictionException("Series " + itemId + " contains a non-finite value");
      }
      values[i] = v;
    }

    SeriesEstimator.Fit fit = estimator.fit(values);
    LocalDateTime last = series.get(series.size() - 1).timestamp();
    List<QuantileForecast.Row> rows = new ArrayList<>(predictionLength);
    for (int step = 1; step <= predictionLength; step++) {
      double mean = fit.mean(step);
      double sd = fit.standardDeviation(step);
      Map<String, Double> columnValues = new LinkedHashMap<>();
      columnValues.put(QuantileForecast.MEAN, mean);
      for (double level : quantileLevels) {
        columnValues.put(QuantileForecast.quantileColumn(level),
            mean + NormalQuantiles.inverseCdf(level) * sd);
      }
      // Finite inputs can still overflow the fit.
      if (!Double.isFinite(sd) || !columnValues.values().stream().allMatch(Double::isFinite)) {
        throw new PredictionException("Series " + itemId + " produced a non-finite forecast with "
            + estimator.name() + " at step " + step);
      }
      LocalDateTime timestamp = last.plus(frequency.multipliedBy(step));
      rows.add(new QuantileForecast.Row(itemId, timestamp, columnValues));
    }
    return rows;
  }
}
