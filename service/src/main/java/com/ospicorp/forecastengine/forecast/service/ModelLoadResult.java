package com.ospicorp.forecastengine.forecast.service;

import java.util.function.Function;

/** Outcome of loading the predictor: a ready context or the reason startup must abort. */
public sealed interface ModelLoadResult permits ModelLoadResult.Ready, ModelLoadResult.Failed {

  static ModelLoadResult ready(ForecastServiceContext context) {
    return new Ready(context);
  }

  static ModelLoadResult failed(ModelLoadException error) {
    return new Failed(error);
  }

  <T> T fold(Function<ForecastServiceContext, T> onReady, Function<ModelLoadException, T> onFailed);

  default ForecastServiceContext orElseThrow() {
    return fold(context -> context, error -> {
      throw error;
    });
  }

  record Ready(ForecastServiceContext context) implements ModelLoadResult {
    @Override
    public <T> T fold(Function<ForecastServiceContext, T> onReady,
        Function<ModelLoadException, T> onFailed) {
      return onReady.apply(context);
    }
  }

  record Failed(ModelLoadException error) implements ModelLoadResult {
    @Override
    public <T> T fold(Function<ForecastServiceContext, T> onReady,
        Function<ModelLoadException, T> onFailed) {
      return onFailed.apply(error);
    }
  }
}
