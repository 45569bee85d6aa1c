package com.ospicorp.forecastengine.forecast.service;

/**
 * A predict call failed: too little history, a malformed series, an unknown model name or a
 * fault inside the predictor. Fails the whole request; never retried.
 */
public class PredictionException extends RuntimeException {

  public PredictionException(String message) {
    super(message);
  }

  public PredictionException(String message, Throwable cause) {
    super(message, cause);
  }
}
