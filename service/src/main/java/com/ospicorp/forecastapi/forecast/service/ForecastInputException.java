package com.ospicorp.forecastapi.forecast.service;

import com.ospicorp.forecastapi.forecast.model.enums.ForecastErrorKind;

/** Raised inside the engine when a request cannot be forecast; never escapes the engine. */
class ForecastInputException extends RuntimeException {
  private final ForecastErrorKind kind;

  ForecastInputException(ForecastErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  ForecastErrorKind kind() {
    return kind;
  }
}
