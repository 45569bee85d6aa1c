package com.ospicorp.forecastengine.metrics.source;

/** The metrics store could not be reached or returned output that could not be read. */
public class ExtractionException extends Exception {

  public ExtractionException(String message) {
    super(message);
  }

  public ExtractionException(String message, Throwable cause) {
    super(message, cause);
  }
}
