package com.ospicorp.forecastapi.forecast.service.strategy;

/**
 * Smoothing constants of {@link HoltWintersStrategy}.
 *
 * @param alpha level smoothing, default 0.3
 * @param beta trend smoothing, default 0.1
 * @param gamma seasonal smoothing, default 0.1
 */
public record HoltWintersParameters(double alpha, double beta, double gamma) {

  public static final HoltWintersParameters DEFAULTS = new HoltWintersParameters(0.3d, 0.1d, 0.1d);

  public HoltWintersParameters {
    requireUnitInterval("alpha", alpha);
    requireUnitInterval("beta", beta);
    requireUnitInterval("gamma", gamma);
  }

  private static void requireUnitInterval(String name, double value) {
    if (!(value >= 0d && value <= 1d)) {
      throw new IllegalArgumentException(name + " must be within [0, 1] but was " + value);
    }
  }
}
