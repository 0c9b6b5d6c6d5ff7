package com.ospicorp.forecastapi.forecast.service;

import com.ospicorp.forecastapi.forecast.model.BaselineReport;
import java.util.Arrays;

/**
 * Percentile baseline of a metric window, used to flag current readings that run well above
 * normal.
 */
public final class BaselineAnalyzer {
  public static final double DEFAULT_THRESHOLD_PERCENT = 30d;

  private BaselineAnalyzer() {
  }

  public static BaselineReport baseline(double[] values) {
    if (values.length == 0) {
      throw new IllegalArgumentException("Insufficient data: a baseline needs at least one sample");
    }
    double[] sorted = values.clone();
    Arrays.sort(sorted);
    return new BaselineReport(
        SeriesStatistics.percentile(sorted, 0.50d),
        SeriesStatistics.percentile(sorted, 0.95d),
        SeriesStatistics.percentile(sorted, 0.99d),
        SeriesStatistics.mean(values),
        SeriesStatistics.standardDeviation(values),
        values.length);
  }

  /** True when {@code currentValue} exceeds P95 raised by {@code thresholdPercent}. */
  public static boolean isAboveBaseline(BaselineReport baseline, double currentValue,
      double thresholdPercent) {
    double threshold = baseline.p95() * (1d + thresholdPercent / 100d);
    return currentValue > threshold;
  }
}
