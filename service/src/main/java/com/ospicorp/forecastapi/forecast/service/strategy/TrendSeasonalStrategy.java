package com.ospicorp.forecastapi.forecast.service.strategy;

import com.ospicorp.forecastapi.forecast.model.enums.StrategyType;
import com.ospicorp.forecastapi.forecast.service.SeriesStatistics;
import com.ospicorp.forecastapi.forecast.service.SeriesStatistics.LinearFit;

/**
 * Additive decomposition into a least-squares linear trend and a per-phase seasonal effect
 * (the mean detrended value of every sample sharing that phase).
 *
 * <p>The model is deterministic given its fit, so the interval is {@code 1.96 * sigma} at every
 * step, sigma being the standard deviation of the in-sample residuals.
 */
public class TrendSeasonalStrategy implements ForecastStrategy {

  @Override
  public StrategyType type() {
    return StrategyType.TREND_SEASONAL;
  }

  @Override
  public StrategyForecast forecast(double[] values, int horizon, int seasonalPeriod) {
    int n = values.length;
    LinearFit trend = SeriesStatistics.fitLine(values);
    double[] effects = seasonalEffects(values, trend, seasonalPeriod);

    double[] fitted = new double[n];
    double[] residuals = new double[n];
    for (int t = 0; t < n; t++) {
      fitted[t] = trend.valueAt(t) + effects[t % effects.length];
      residuals[t] = values[t] - fitted[t];
    }
    double halfWidth = Z_95 * SeriesStatistics.standardDeviation(residuals);

    double[] estimates = new double[horizon];
    double[] halfWidths = new double[horizon];
    for (int h = 1; h <= horizon; h++) {
      int t = n - 1 + h;
      estimates[h - 1] = trend.valueAt(t) + effects[t % effects.length];
      halfWidths[h - 1] = halfWidth;
    }
    return new StrategyForecast(estimates, halfWidths, values.clone(), fitted);
  }

  private static double[] seasonalEffects(double[] values, LinearFit trend, int period) {
    if (period < 2) {
      return new double[1];
    }
    double[] sums = new double[period];
    int[] counts = new int[period];
    for (int t = 0; t < values.length; t++) {
      sums[t % period] += values[t] - trend.valueAt(t);
      counts[t % period]++;
    }
    double[] effects = new double[period];
    for (int phase = 0; phase < period; phase++) {
      effects[phase] = counts[phase] == 0 ? 0d : sums[phase] / counts[phase];
    }
    return effects;
  }
}
