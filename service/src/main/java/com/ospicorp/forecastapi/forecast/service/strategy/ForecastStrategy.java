package com.ospicorp.forecastapi.forecast.service.strategy;

import com.ospicorp.forecastapi.forecast.model.enums.StrategyType;

/**
 * A forecasting model. Implementations are stateless: every call fits the model to
 * {@code values} from scratch and projects it {@code horizon} steps past the last sample.
 */
public interface ForecastStrategy {

  /** Two-sided 95% normal quantile used for every confidence interval. */
  double Z_95 = 1.96d;

  StrategyType type();

  /**
   * @param values observations in time order; at least two
   * @param horizon number of steps to project, at least one
   * @param seasonalPeriod samples per cycle; 1 disables the seasonal component
   */
  StrategyForecast forecast(double[] values, int horizon, int seasonalPeriod);
}
