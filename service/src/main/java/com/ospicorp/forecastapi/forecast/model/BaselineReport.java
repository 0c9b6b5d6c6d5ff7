package com.ospicorp.forecastapi.forecast.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record BaselineReport(
    double p50,
    double p95,
    double p99,
    double mean,
    @JsonProperty("standard_deviation") double standardDeviation,
    @JsonProperty("sample_count") int sampleCount
) {}
