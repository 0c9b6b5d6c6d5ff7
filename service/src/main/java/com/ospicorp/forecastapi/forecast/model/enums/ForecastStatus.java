package com.ospicorp.forecastapi.forecast.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ForecastStatus {
  SUCCESS("Success"),
  ERROR("Error");

  private final String code;

  ForecastStatus(String code) {
    this.code = code;
  }

  @JsonValue
  public String code() {
    return code;
  }
}
