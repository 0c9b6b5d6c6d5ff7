package com.ospicorp.forecastapi.forecast.model;

import com.ospicorp.forecastapi.forecast.model.enums.ForecastErrorKind;
import com.ospicorp.forecastapi.forecast.model.enums.ForecastStatus;
import com.ospicorp.forecastapi.forecast.model.enums.StrategyType;
import java.util.List;

/**
 * Outcome of one forecast call. Failed calls carry {@link ForecastStatus#ERROR}, no points,
 * a zero confidence score and the {@link ForecastErrorKind} that caused them.
 */
public record ForecastResult(
    StrategyType strategyUsed,
    List<ForecastPoint> forecasts,
    FitMetrics inSampleMetrics,
    ForecastStatus status,
    String message,
    double confidenceScore,
    ForecastErrorKind errorKind
) {

  public ForecastResult {
    forecasts = List.copyOf(forecasts);
  }

  public static ForecastResult error(StrategyType strategy, ForecastErrorKind kind, String message) {
    return new ForecastResult(strategy, List.of(), FitMetrics.EMPTY, ForecastStatus.ERROR,
        message, 0d, kind);
  }

  public boolean isSuccess() {
    return status == ForecastStatus.SUCCESS;
  }
}
