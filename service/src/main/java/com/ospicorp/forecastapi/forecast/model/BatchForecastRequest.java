package com.ospicorp.forecastapi.forecast.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.Map;

// One independent forecast per metric name
public record BatchForecastRequest(
    @NotEmpty Map<String, @Valid @NotNull ForecastRequest> metrics
) {}
