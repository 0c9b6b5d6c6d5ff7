package com.ospicorp.forecastapi.forecast.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.ospicorp.forecastapi.forecast.model.enums.ForecastErrorKind;
import com.ospicorp.forecastapi.forecast.model.enums.ForecastStatus;
import com.ospicorp.forecastapi.forecast.model.enums.StrategyType;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/** Flat document rendering of a {@link ForecastResult}. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ForecastResponse(
    StrategyType strategyUsed,
    List<Point> forecasts,
    FitMetrics metrics,
    ForecastStatus status,
    String message,
    double confidenceScore,
    ForecastErrorKind errorKind
) {

  public static ForecastResponse from(ForecastResult result) {
    List<Point> points = new ArrayList<>(result.forecasts().size());
    for (ForecastPoint p : result.forecasts()) {
      points.add(new Point(p.timestamp(), p.pointEstimate(), p.lowerBound95(), p.upperBound95(),
          p.horizonStep()));
    }
    return new ForecastResponse(result.strategyUsed(), points, result.inSampleMetrics(),
        result.status(), result.message(), result.confidenceScore(), result.errorKind());
  }

  public static ForecastResponse failure(String message) {
    return new ForecastResponse(null, List.of(), FitMetrics.EMPTY, ForecastStatus.ERROR, message,
        0d, null);
  }

  @JsonPropertyOrder({"timestamp", "value", "lowerBound", "upperBound", "horizonStep"})
  public record Point(
      Instant timestamp,
      double value,
      double lowerBound,
      double upperBound,
      int horizonStep
  ) {}
}
