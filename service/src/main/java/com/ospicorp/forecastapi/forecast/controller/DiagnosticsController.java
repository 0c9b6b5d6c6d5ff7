package com.ospicorp.forecastapi.forecast.controller;

import com.ospicorp.forecastapi.forecast.model.BaselineResponse;
import com.ospicorp.forecastapi.forecast.model.DiagnosticsRequest;
import com.ospicorp.forecastapi.forecast.model.SeasonalityReport;
import com.ospicorp.forecastapi.forecast.model.TrendReport;
import com.ospicorp.forecastapi.forecast.service.BaselineAnalyzer;
import com.ospicorp.forecastapi.forecast.service.ForecastService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/diagnostics")
@Validated
@Tag(name = "Diagnostics")
public class DiagnosticsController {

  private final ForecastService service;
  private final int defaultMaxPeriod;

  public DiagnosticsController(ForecastService service,
      @Value("${forecast.seasonality.max-period:168}") int defaultMaxPeriod) {
    this.service = service;
    this.defaultMaxPeriod = defaultMaxPeriod;
  }

  @PostMapping("/trend")
  @Operation(summary = "Trend strength", description = "Least-squares trend over the sample index.")
  public TrendReport trend(@Valid @RequestBody DiagnosticsRequest request) {
    return service.trend(request.series());
  }

  @PostMapping("/seasonality")
  @Operation(summary = "Seasonality scan",
      description = "Autocorrelation scan for repeating cycles, strongest candidates first.")
  public SeasonalityReport seasonality(@Valid @RequestBody DiagnosticsRequest request,
      @RequestParam(name = "max_period", required = false)
          @Parameter(description = "Longest lag to test, in samples", example = "48")
          Integer maxPeriod) {
    int effective = maxPeriod == null ? defaultMaxPeriod : maxPeriod;
    if (effective < 2) {
      throw new InvalidParameterException(
          "Invalid max_period parameter. Must be greater than or equal to 2.", 2003);
    }
    return service.seasonality(request.series(), effective);
  }

  @PostMapping("/baseline")
  @Operation(summary = "Percentile baseline",
      description = "P50/P95/P99 baseline; flags the current value when it exceeds P95 by "
          + "more than the threshold.")
  public BaselineResponse baseline(@Valid @RequestBody DiagnosticsRequest request,
      @RequestParam(name = "current", required = false)
          @Parameter(description = "Reading to compare against the baseline") Double current,
      @RequestParam(name = "threshold_pct", required = false)
          @Parameter(description = "Allowed excess over P95 in percent", example = "30")
          Double thresholdPercent) {
    double threshold = thresholdPercent == null
        ? BaselineAnalyzer.DEFAULT_THRESHOLD_PERCENT
        : thresholdPercent;
    if (threshold < 0d || !Double.isFinite(threshold)) {
      throw new InvalidParameterException(
          "Invalid threshold_pct parameter. Must be a non-negative number.", 2004);
    }
    return service.baseline(request.series(), current, threshold);
  }
}
