package com.ospicorp.forecastapi.forecast.service.strategy;

import com.ospicorp.forecastapi.forecast.model.enums.StrategyType;
import com.ospicorp.forecastapi.forecast.service.SeriesStatistics;

/**
 * Additive triple exponential smoothing. With a seasonal period below two the seasonal
 * component is switched off and the model reduces to Holt's linear method.
 *
 * <p>Interval half-width at step h is {@code 1.96 * sigma * c(h)}, where sigma is the standard
 * deviation of the one-step in-sample errors and
 * {@code c(h)^2 = 1 + (h - 1) * (alpha^2 + alpha * b * h + b^2 * h * (2h - 1) / 6)} with
 * {@code b = alpha * beta}, the variance growth of the additive-error Holt model.
 */
public class HoltWintersStrategy implements ForecastStrategy {

  private final HoltWintersParameters parameters;

  public HoltWintersStrategy(HoltWintersParameters parameters) {
    this.parameters = parameters;
  }

  public HoltWintersParameters parameters() {
    return parameters;
  }

  @Override
  public StrategyType type() {
    return StrategyType.HOLT_WINTERS;
  }

  @Override
  public StrategyForecast forecast(double[] values, int horizon, int seasonalPeriod) {
    int n = values.length;
    double alpha = parameters.alpha();
    double beta = parameters.beta();
    double gamma = parameters.gamma();
    boolean seasonalModel = seasonalPeriod >= 2;
    int period = seasonalModel ? seasonalPeriod : 1;

    double[] seasonal = new double[period];
    if (seasonalModel) {
      for (int i = 0; i < Math.min(period, n); i++) {
        seasonal[i] = values[i] - values[0];
      }
    }

    double level = values[0];
    double trend = 0d;
    double[] observed = new double[n - 1];
    double[] fitted = new double[n - 1];
    for (int t = 1; t < n; t++) {
      double s = seasonalModel && t >= period ? seasonal[t % period] : 0d;
      observed[t - 1] = values[t];
      fitted[t - 1] = level + trend + s;

      double previousLevel = level;
      level = alpha * (values[t] - s) + (1d - alpha) * (level + trend);
      trend = beta * (level - previousLevel) + (1d - beta) * trend;
      if (seasonalModel) {
        seasonal[t % period] = gamma * (values[t] - level) + (1d - gamma) * s;
      }
    }

    double sigma = residualDeviation(observed, fitted);
    double trendGain = alpha * beta;
    double[] estimates = new double[horizon];
    double[] halfWidths = new double[horizon];
    for (int h = 1; h <= horizon; h++) {
      double s = seasonalModel ? seasonal[(n + h - 1) % period] : 0d;
      estimates[h - 1] = level + h * trend + s;
      double growth = 1d + (h - 1) * (alpha * alpha + alpha * trendGain * h
          + trendGain * trendGain * h * (2d * h - 1d) / 6d);
      halfWidths[h - 1] = Z_95 * sigma * Math.sqrt(growth);
    }
    return new StrategyForecast(estimates, halfWidths, observed, fitted);
  }

  private static double residualDeviation(double[] observed, double[] fitted) {
    double[] residuals = new double[observed.length];
    for (int i = 0; i < observed.length; i++) {
      residuals[i] = observed[i] - fitted[i];
    }
    return SeriesStatistics.standardDeviation(residuals);
  }
}
