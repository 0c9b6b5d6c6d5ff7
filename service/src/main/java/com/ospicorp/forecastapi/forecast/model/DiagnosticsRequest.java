package com.ospicorp.forecastapi.forecast.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.List;

public record DiagnosticsRequest(
    @NotEmpty List<@Valid @NotNull SampleDto> series
) {}
