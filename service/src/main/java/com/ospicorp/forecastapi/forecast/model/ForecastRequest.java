package com.ospicorp.forecastapi.forecast.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.forecastapi.forecast.service.ForecastEngine;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotNull;
import java.util.List;

/**
 * Body of a forecast call. Horizon and period are checked by the engine, which answers with an
 * {@code Error} document rather than a 400 when they are out of range. Horizons above the
 * hard ceiling are rejected before the engine runs.
 */
public record ForecastRequest(
    @NotNull List<@Valid @NotNull SampleDto> series,
    @NotNull @Max(ForecastEngine.DEFAULT_MAX_HORIZON) @Schema(example = "24") Integer horizon,
    @JsonProperty("seasonal_period")
    @Schema(description = "Samples per cycle; omit or 1 for none", example = "24")
    Integer seasonalPeriod,
    @Schema(description = "auto, HoltWinters, Differencing, TrendSeasonal or SlidingWindow",
        example = "auto")
    String strategy
) {}
