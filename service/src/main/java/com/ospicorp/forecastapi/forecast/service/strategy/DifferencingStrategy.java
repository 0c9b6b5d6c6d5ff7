package com.ospicorp.forecastapi.forecast.service.strategy;

import com.ospicorp.forecastapi.forecast.model.enums.StrategyType;
import com.ospicorp.forecastapi.forecast.service.SeriesStatistics;

/**
 * Random walk with drift on the first or seasonal differences, whichever is more stationary
 * (lower standard deviation). The drift is the mean of the last five chosen differences.
 *
 * <p>Both cases project {@code last + h * drift} with an interval growing as {@code sqrt(h)}.
 */
public class DifferencingStrategy implements ForecastStrategy {

  static final int DRIFT_WINDOW = 5;

  @Override
  public StrategyType type() {
    return StrategyType.DIFFERENCING;
  }

  @Override
  public StrategyForecast forecast(double[] values, int horizon, int seasonalPeriod) {
    int n = values.length;
    double[] differences = SeriesStatistics.differences(values, 0, n);
    int lag = 1;
    if (seasonalPeriod > 1 && n > seasonalPeriod) {
      double[] seasonalDifferences = seasonalDifferences(values, seasonalPeriod);
      if (SeriesStatistics.standardDeviation(seasonalDifferences)
          < SeriesStatistics.standardDeviation(differences)) {
        differences = seasonalDifferences;
        lag = seasonalPeriod;
      }
    }

    double drift = SeriesStatistics.trailingMean(differences, differences.length, DRIFT_WINDOW);
    double sigma = SeriesStatistics.standardDeviation(differences);
    double last = values[n - 1];

    double[] estimates = new double[horizon];
    double[] halfWidths = new double[horizon];
    for (int h = 1; h <= horizon; h++) {
      estimates[h - 1] = last + h * drift;
      halfWidths[h - 1] = Z_95 * sigma * Math.sqrt(h);
    }

    // differences[k] = values[k + lag] - values[k]; differences[0, t - lag) precede values[t]
    double[] observed = new double[n - 1];
    double[] fitted = new double[n - 1];
    for (int t = 1; t < n; t++) {
      observed[t - 1] = values[t];
      fitted[t - 1] = values[t - 1]
          + SeriesStatistics.trailingMean(differences, Math.max(0, t - lag), DRIFT_WINDOW);
    }
    return new StrategyForecast(estimates, halfWidths, observed, fitted);
  }

  private static double[] seasonalDifferences(double[] values, int period) {
    double[] out = new double[values.length - period];
    for (int i = period; i < values.length; i++) {
      out[i - period] = values[i] - values[i - period];
    }
    return out;
  }
}
