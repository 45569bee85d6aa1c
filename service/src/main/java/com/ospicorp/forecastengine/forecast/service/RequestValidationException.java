package com.ospicorp.forecastengine.forecast.service;

/** The request payload does not match the record contract. Reported to the client as a 400. */
public class RequestValidationException extends RuntimeException {

  public static final int MALFORMED_BODY = 2001;
  public static final int MISSING_FIELD = 2002;
  public static final int INVALID_TIMESTAMP = 2003;
  public static final int EMPTY_PAYLOAD = 2004;

  private static final String ERROR_DOCS_BASE = "https://docs.forecast-engine.dev/errors/";

  private final int errorCode;
  private final String moreInfo;

  public RequestValidationException(String message, int errorCode) {
    super(message);
    this.errorCode = errorCode;
    this.moreInfo = ERROR_DOCS_BASE + errorCode;
  }

  public int errorCode() {
    return errorCode;
  }

  public String moreInfo() {
    return moreInfo;
  }
}
