package com.ospicorp.forecastengine.forecast.service;

import com.ospicorp.forecastengine.forecast.model.QuantileForecast;
import java.util.function.Function;

/** Outcome of one predict call. */
public sealed interface PredictionResult permits PredictionResult.Success, PredictionResult.Failure {

  static PredictionResult success(QuantileForecast forecast) {
    return new Success(forecast);
  }

  static PredictionResult failure(PredictionException error) {
    return new Failure(error);
  }

  <T> T fold(Function<QuantileForecast, T> onSuccess, Function<PredictionException, T> onFailure);

  record Success(QuantileForecast forecast) implements PredictionResult {
    @Override
    public <T> T fold(Function<QuantileForecast, T> onSuccess,
        Function<PredictionException, T> onFailure) {
      return onSuccess.apply(forecast);
    }
  }

  record Failure(PredictionException error) implements PredictionResult {
    @Override
    public <T> T fold(Function<QuantileForecast, T> onSuccess,
        Function<PredictionException, T> onFailure) {
      return onFailure.apply(error);
    }
  }
}
