package com.ospicorp.forecastapi.forecast.model;

import jakarta.validation.constraints.NotNull;
import java.time.Instant;

public record SampleDto(
    @NotNull Instant timestamp,
    @NotNull Double value
) {

  public TimeSeriesSample toSample() {
    return new TimeSeriesSample(timestamp, value);
  }
}
