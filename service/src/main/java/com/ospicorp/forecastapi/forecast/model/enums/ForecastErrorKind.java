package com.ospicorp.forecastapi.forecast.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ForecastErrorKind {
  INSUFFICIENT_DATA("InsufficientData"),
  DEGENERATE_SERIES("DegenerateSeries"),
  INVALID_PARAMETER("InvalidParameter");

  private final String code;

  ForecastErrorKind(String code) {
    this.code = code;
  }

  @JsonValue
  public String code() {
    return code;
  }
}
