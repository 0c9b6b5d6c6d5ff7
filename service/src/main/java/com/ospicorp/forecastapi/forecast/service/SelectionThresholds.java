package com.ospicorp.forecastapi.forecast.service;

/**
 * Cut-offs used by {@link AlgorithmSelector}. The defaults are placeholders that have not been
 * fitted against held-out data.
 */
public record SelectionThresholds(double trendStrength, double volatility) {

  public static final SelectionThresholds DEFAULTS = new SelectionThresholds(0.2d, 0.5d);

  public SelectionThresholds {
    if (trendStrength < 0d || volatility < 0d) {
      throw new IllegalArgumentException("selection thresholds must not be negative");
    }
  }
}
