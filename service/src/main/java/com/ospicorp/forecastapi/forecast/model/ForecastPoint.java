package com.ospicorp.forecastapi.forecast.model;

import java.time.Instant;

public record ForecastPoint(
    Instant timestamp,
    double pointEstimate,
    double lowerBound95,
    double upperBound95,
    int horizonStep
) {}
