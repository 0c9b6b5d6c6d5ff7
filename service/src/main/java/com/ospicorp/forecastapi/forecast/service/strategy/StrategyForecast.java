package com.ospicorp.forecastapi.forecast.service.strategy;

/**
 * Raw output of a {@link ForecastStrategy}: one estimate and one interval half-width per
 * horizon step, plus the in-sample predictions the model makes for the history it was fitted
 * on, aligned with the observations they predict.
 */
public record StrategyForecast(
    double[] estimates,
    double[] halfWidths,
    double[] observed,
    double[] fitted
) {

  public int horizon() {
    return estimates.length;
  }
}
