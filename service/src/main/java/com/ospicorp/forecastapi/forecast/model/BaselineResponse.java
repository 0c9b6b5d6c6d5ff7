package com.ospicorp.forecastapi.forecast.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record BaselineResponse(
    BaselineReport baseline,
    @JsonProperty("threshold_pct") double thresholdPercent,
    @JsonProperty("current_value") Double currentValue,
    @JsonProperty("above_baseline") Boolean aboveBaseline
) {}
