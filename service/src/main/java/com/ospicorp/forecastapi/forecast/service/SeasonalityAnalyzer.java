package com.ospicorp.forecastapi.forecast.service;

import com.ospicorp.forecastapi.forecast.model.SeasonalityCandidate;
import com.ospicorp.forecastapi.forecast.model.SeasonalityReport;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Detects repeating cycles by scanning the autocorrelation of the series for lags between 2
 * and {@code min(maxPeriod, n / 2)}.
 */
public final class SeasonalityAnalyzer {
  public static final int DEFAULT_MAX_PERIOD = 168;
  static final int MIN_OVERLAP = 5;
  static final double CORRELATION_THRESHOLD = 0.3d;
  static final int MAX_CANDIDATES = 5;

  // |r| at 1e-6 resolution, then in-phase before anti-phase, then the shorter lag
  private static final Comparator<SeasonalityCandidate> BY_STRENGTH =
      Comparator.<SeasonalityCandidate>comparingDouble(
              c -> SeriesStatistics.normalize(Math.abs(c.correlation())))
          .reversed()
          .thenComparing(c -> c.correlation() < 0d)
          .thenComparingInt(SeasonalityCandidate::period);

  private SeasonalityAnalyzer() {
  }

  public static SeasonalityReport analyze(double[] values) {
    return analyze(values, DEFAULT_MAX_PERIOD);
  }

  /**
   * Candidates are lags whose |correlation| exceeds 0.3, strongest first, at most five. The
   * dominant period is the first candidate.
   */
  public static SeasonalityReport analyze(double[] values, int maxPeriod) {
    int n = values.length;
    int maxLag = Math.min(maxPeriod, n / 2);
    List<SeasonalityCandidate> candidates = new ArrayList<>();
    for (int lag = 2; lag <= maxLag; lag++) {
      if (n - lag < MIN_OVERLAP) {
        break;
      }
      double correlation = SeriesStatistics.autocorrelation(values, lag);
      if (Math.abs(correlation) > CORRELATION_THRESHOLD) {
        candidates.add(new SeasonalityCandidate(lag, correlation));
      }
    }
    if (candidates.isEmpty()) {
      return SeasonalityReport.NONE;
    }

    candidates.sort(BY_STRENGTH);
    List<SeasonalityCandidate> top = candidates.subList(0, Math.min(MAX_CANDIDATES, candidates.size()));
    SeasonalityCandidate dominant = top.get(0);
    return new SeasonalityReport(top, dominant.period(), Math.abs(dominant.correlation()), true);
  }
}
