package com.ospicorp.forecastapi.forecast.service;

import com.ospicorp.forecastapi.forecast.model.enums.StrategyType;

/**
 * Picks a forecast strategy for {@code "auto"} requests from two scale-free statistics:
 * volatility (coefficient of variation) and the relative shift between the means of the two
 * halves of the series.
 *
 * <ul>
 *   <li>strong shift under controlled noise: {@link StrategyType#DIFFERENCING}</li>
 *   <li>anything else, noisy or not: {@link StrategyType#HOLT_WINTERS}</li>
 * </ul>
 *
 * <p>This is a fixed heuristic, not a validated model-selection criterion.
 */
public class AlgorithmSelector {

  private final SelectionThresholds thresholds;

  public AlgorithmSelector(SelectionThresholds thresholds) {
    this.thresholds = thresholds;
  }

  public StrategyType select(double[] values) {
    return select(profile(values));
  }

  public StrategyType select(SeriesProfile profile) {
    if (profile.trendStrength() > thresholds.trendStrength()
        && profile.volatility() < thresholds.volatility()) {
      return StrategyType.DIFFERENCING;
    }
    if (profile.volatility() >= thresholds.volatility()) {
      return StrategyType.HOLT_WINTERS;
    }
    return StrategyType.HOLT_WINTERS;
  }

  public static SeriesProfile profile(double[] values) {
    double mean = SeriesStatistics.mean(values);
    double deviation = SeriesStatistics.standardDeviation(values);
    double volatility = mean == 0d ? 0d : deviation / Math.abs(mean);

    int half = values.length / 2;
    double firstHalf = SeriesStatistics.mean(values, 0, half);
    double secondHalf = SeriesStatistics.mean(values, half, values.length);
    double trendStrength = firstHalf == 0d ? 0d : Math.abs(secondHalf - firstHalf) / Math.abs(firstHalf);

    return new SeriesProfile(mean, deviation, SeriesStatistics.finiteOr(volatility, 0d),
        SeriesStatistics.finiteOr(trendStrength, 0d));
  }

  public record SeriesProfile(double mean, double standardDeviation, double volatility,
      double trendStrength) {}
}
