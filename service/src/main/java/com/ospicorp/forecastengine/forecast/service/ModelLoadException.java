package com.ospicorp.forecastengine.forecast.service;

/** The predictor could not be loaded. Fatal: the service must not start without a model. */
public class ModelLoadException extends RuntimeException {

  public ModelLoadException(String message) {
    super(message);
  }

  public ModelLoadException(String message, Throwable cause) {
    super(message, cause);
  }
}
