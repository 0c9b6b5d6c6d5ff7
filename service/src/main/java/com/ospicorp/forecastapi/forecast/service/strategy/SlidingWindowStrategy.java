package com.ospicorp.forecastapi.forecast.service.strategy;

import com.ospicorp.forecastapi.forecast.model.enums.StrategyType;
import com.ospicorp.forecastapi.forecast.service.SeriesStatistics;

/**
 * Short-memory extrapolation: the mean step over the most recent {@code min(10, n / 2)}
 * samples is carried forward. The in-sample fit is a walk-forward replay of the same rule.
 */
public class SlidingWindowStrategy implements ForecastStrategy {

  static final int MAX_MEMORY = 10;

  @Override
  public StrategyType type() {
    return StrategyType.SLIDING_WINDOW;
  }

  @Override
  public StrategyForecast forecast(double[] values, int horizon, int seasonalPeriod) {
    int n = values.length;
    int memory = memoryLength(n);
    double[] recentSteps = SeriesStatistics.differences(values, n - memory, n);
    double drift = SeriesStatistics.mean(recentSteps);
    double sigma = SeriesStatistics.standardDeviation(recentSteps);
    double last = values[n - 1];

    double[] estimates = new double[horizon];
    double[] halfWidths = new double[horizon];
    for (int h = 1; h <= horizon; h++) {
      estimates[h - 1] = last + h * drift;
      halfWidths[h - 1] = Z_95 * sigma * Math.sqrt(h);
    }

    double[] observed = new double[n - memory];
    double[] fitted = new double[n - memory];
    for (int i = memory; i < n; i++) {
      double windowDrift = SeriesStatistics.mean(SeriesStatistics.differences(values, i - memory, i));
      observed[i - memory] = values[i];
      fitted[i - memory] = values[i - 1] + windowDrift;
    }
    return new StrategyForecast(estimates, halfWidths, observed, fitted);
  }

  static int memoryLength(int n) {
    return Math.max(1, Math.min(MAX_MEMORY, n / 2));
  }
}
