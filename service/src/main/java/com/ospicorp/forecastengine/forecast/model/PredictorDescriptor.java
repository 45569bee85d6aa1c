package com.ospicorp.forecastengine.forecast.model;

import java.time.Duration;
import java.util.List;

/**
 * Contents of {@code predictor.json} in the model directory.
 *
 * @param type {@code local} for the built-in estimators, {@code remote} for an inference endpoint
 * @param frequency spacing of forecast timestamps; matches the resampling interval of the training data
 * @param predictionLength number of horizon steps returned per item
 * @param quantileLevels levels emitted as quantile columns
 * @param models model names the predictor can serve
 * @param endpoint inference URL, remote only
 * @param concurrentPredict whether the predictor tolerates concurrent calls; defaults to true
 */
public record PredictorDescriptor(
    String type,
    Duration frequency,
    Integer predictionLength,
    List<Double> quantileLevels,
    List<String> models,
    String endpoint,
    Boolean concurrentPredict
) {

  public static final String LOCAL = "local";
  public static final String REMOTE = "remote";

  public boolean allowsConcurrentPredict() {
    return concurrentPredict == null || concurrentPredict;
  }
}
