package com.ospicorp.forecastapi.forecast.service;

import com.ospicorp.forecastapi.forecast.model.TrendReport;
import com.ospicorp.forecastapi.forecast.service.SeriesStatistics.LinearFit;

public final class TrendAnalyzer {
  static final double TREND_THRESHOLD = 0.1d;

  private TrendAnalyzer() {
  }

  /**
   * Least-squares line over the sample index. Strength is {@code sqrt(R^2)}, 0 for series with
   * no variance.
   */
  public static TrendReport analyze(double[] values) {
    LinearFit fit = SeriesStatistics.fitLine(values);
    double strength = Math.sqrt(fit.rSquared());
    return new TrendReport(fit.slope(), fit.intercept(), strength, strength > TREND_THRESHOLD);
  }
}
