package com.ospicorp.forecastapi.forecast.model;

import java.util.List;

public record SeasonalityReport(
    List<SeasonalityCandidate> candidatePeriods,
    int dominantPeriod,
    double dominantStrength,
    boolean hasSeasonality
) {

  public static final SeasonalityReport NONE = new SeasonalityReport(List.of(), 0, 0d, false);

  public SeasonalityReport {
    candidatePeriods = List.copyOf(candidatePeriods);
  }
}
