package com.ospicorp.forecastapi.forecast.model;

import java.time.Instant;

// Caller supplies samples sorted by timestamp, nulls already filtered out
public record TimeSeriesSample(Instant timestamp, double value) {}
