package com.ospicorp.forecastapi.forecast.model;

// Lag in samples and the Pearson correlation of the series with itself shifted by that lag
public record SeasonalityCandidate(int period, double correlation) {}
