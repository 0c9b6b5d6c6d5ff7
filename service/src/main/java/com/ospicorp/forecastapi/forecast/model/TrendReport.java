package com.ospicorp.forecastapi.forecast.model;

public record TrendReport(double slope, double intercept, double strength, boolean hasTrend) {}
