package com.ospicorp.forecastapi.forecast.model;

/**
 * In-sample fit quality of a forecast model. {@code mape} is a percentage computed over the
 * non-zero observations only.
 */
public record FitMetrics(double mse, double mae, double rmse, double mape) {

  public static final FitMetrics EMPTY = new FitMetrics(0d, 0d, 0d, 0d);
}
