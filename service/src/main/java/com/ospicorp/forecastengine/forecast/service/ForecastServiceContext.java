package com.ospicorp.forecastengine.forecast.service;

import com.ospicorp.forecastengine.forecast.model.PredictorDescriptor;

/**
 * Everything the request path needs from startup: the loaded predictor, the model name to ask
 * it for, and the descriptor it was built from. Created once, never mutated.
 */
public record ForecastServiceContext(
    ForecastModel model,
    String modelName,
    String location,
    PredictorDescriptor descriptor
) {}
