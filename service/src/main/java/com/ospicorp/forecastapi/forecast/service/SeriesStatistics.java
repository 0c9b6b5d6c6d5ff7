package com.ospicorp.forecastapi.forecast.service;

import com.ospicorp.forecastapi.forecast.model.FitMetrics;

/**
 * Numeric helpers shared by the forecast strategies and the diagnostics. All methods guard
 * their own degenerate cases (empty ranges, zero variance) and return a neutral value instead
 * of {@code NaN}.
 */
public final class SeriesStatistics {
  private SeriesStatistics() {
  }

  public static double mean(double[] values) {
    return mean(values, 0, values.length);
  }

  /** Mean of {@code values[from, to)}; 0 for an empty range. */
  public static double mean(double[] values, int from, int to) {
    if (to <= from) return 0d;
    double sum = 0d;
    for (int i = from; i < to; i++) {
      sum += values[i];
    }
    return sum / (to - from);
  }

  public static double standardDeviation(double[] values) {
    return standardDeviation(values, 0, values.length);
  }

  /** Population standard deviation of {@code values[from, to)}. */
  public static double standardDeviation(double[] values, int from, int to) {
    if (to <= from) return 0d;
    double mean = mean(values, from, to);
    double sumSquares = 0d;
    for (int i = from; i < to; i++) {
      double delta = values[i] - mean;
      sumSquares += delta * delta;
    }
    return Math.sqrt(sumSquares / (to - from));
  }

  /** Mean of the last {@code window} entries of {@code values[0, to)}. */
  public static double trailingMean(double[] values, int to, int window) {
    int from = Math.max(0, to - window);
    return mean(values, from, to);
  }

  /** Consecutive differences {@code values[i + 1] - values[i]} over {@code values[from, to)}. */
  public static double[] differences(double[] values, int from, int to) {
    int count = Math.max(0, to - from - 1);
    double[] out = new double[count];
    for (int i = 0; i < count; i++) {
      out[i] = values[from + i + 1] - values[from + i];
    }
    return out;
  }

  /** Ordinary least squares fit of {@code value = intercept + slope * index}. */
  public static LinearFit fitLine(double[] values) {
    int n = values.length;
    if (n == 0) return new LinearFit(0d, 0d, 0d);
    double meanX = (n - 1) / 2d;
    double meanY = mean(values);
    double sxx = 0d;
    double sxy = 0d;
    for (int i = 0; i < n; i++) {
      double dx = i - meanX;
      sxx += dx * dx;
      sxy += dx * (values[i] - meanY);
    }
    double slope = sxx == 0d ? 0d : sxy / sxx;
    double intercept = meanY - slope * meanX;

    double ssTotal = 0d;
    double ssResidual = 0d;
    for (int i = 0; i < n; i++) {
      double fitted = intercept + slope * i;
      ssResidual += (values[i] - fitted) * (values[i] - fitted);
      ssTotal += (values[i] - meanY) * (values[i] - meanY);
    }
    double rSquared = ssTotal == 0d ? 0d : 1d - ssResidual / ssTotal;
    return new LinearFit(slope, intercept, clamp(rSquared, 0d, 1d));
  }

  /**
   * Pearson correlation between {@code values[0, n - lag)} and {@code values[lag, n)}; 0 when
   * either side has no variance.
   */
  public static double autocorrelation(double[] values, int lag) {
    int length = values.length - lag;
    if (lag < 0 || length < 2) return 0d;
    double meanA = mean(values, 0, length);
    double meanB = mean(values, lag, values.length);
    double covariance = 0d;
    double varianceA = 0d;
    double varianceB = 0d;
    for (int i = 0; i < length; i++) {
      double a = values[i] - meanA;
      double b = values[i + lag] - meanB;
      covariance += a * b;
      varianceA += a * a;
      varianceB += b * b;
    }
    double denominator = Math.sqrt(varianceA * varianceB);
    if (denominator == 0d) return 0d;
    return clamp(covariance / denominator, -1d, 1d);
  }

  /** Percentile of an ascending array by linear interpolation between closest ranks. */
  public static double percentile(double[] sorted, double fraction) {
    if (sorted.length == 0) return 0d;
    if (sorted.length == 1) return sorted[0];
    double index = fraction * (sorted.length - 1);
    int lower = (int) Math.floor(index);
    int upper = (int) Math.ceil(index);
    if (lower == upper) return sorted[lower];
    double weight = index - lower;
    return sorted[lower] * (1d - weight) + sorted[upper] * weight;
  }

  /**
   * Fit metrics of {@code predicted} against {@code actual} over their common length. MAPE skips
   * zero observations.
   */
  public static FitMetrics fitMetrics(double[] actual, double[] predicted) {
    int n = Math.min(actual.length, predicted.length);
    if (n == 0) return FitMetrics.EMPTY;
    double squared = 0d;
    double absolute = 0d;
    double percentage = 0d;
    int percentageCount = 0;
    for (int i = 0; i < n; i++) {
      double error = actual[i] - predicted[i];
      squared += error * error;
      absolute += Math.abs(error);
      if (actual[i] != 0d) {
        percentage += Math.abs(error / actual[i]);
        percentageCount++;
      }
    }
    double mse = squared / n;
    double mape = percentageCount == 0 ? 0d : percentage / percentageCount * 100d;
    return new FitMetrics(finiteOr(mse, 0d), finiteOr(absolute / n, 0d),
        finiteOr(Math.sqrt(mse), 0d), finiteOr(mape, 0d));
  }

  public static double finiteOr(double value, double fallback) {
    return Double.isFinite(value) ? value : fallback;
  }

  public static double clamp(double value, double min, double max) {
    return Math.max(min, Math.min(max, value));
  }

  /** Rounds to six decimals so that values differing only by floating-point noise compare equal. */
  public static double normalize(double value) {
    double scaled = Math.round(value * 1_000_000d);
    return scaled / 1_000_000d;
  }

  public record LinearFit(double slope, double intercept, double rSquared) {

    public double valueAt(double index) {
      return intercept + slope * index;
    }
  }
}
