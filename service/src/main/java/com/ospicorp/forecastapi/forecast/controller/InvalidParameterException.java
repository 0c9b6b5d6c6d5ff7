package com.ospicorp.forecastapi.forecast.controller;

public class InvalidParameterException extends RuntimeException {
  private static final String ERROR_DOCS_BASE = "https://docs.forecast-api.dev/errors/";

  private final int errorCode;
  private final String moreInfo;

  public InvalidParameterException(String message, int errorCode) {
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
