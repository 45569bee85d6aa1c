package com.ospicorp.forecastengine.forecast.service;

/**
 * The forecast frame lacks a column the response contract needs. The model and the service
 * are mismatched; this is a deployment fault, not a bad request.
 */
public class QuantileConfigurationException extends RuntimeException {

  public QuantileConfigurationException(String message) {
    super(message);
  }
}
