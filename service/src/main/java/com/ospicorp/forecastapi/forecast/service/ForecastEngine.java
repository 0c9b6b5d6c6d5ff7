package com.ospicorp.forecastapi.forecast.service;

import com.ospicorp.forecastapi.forecast.model.FitMetrics;
import com.ospicorp.forecastapi.forecast.model.ForecastPoint;
import com.ospicorp.forecastapi.forecast.model.ForecastResult;
import com.ospicorp.forecastapi.forecast.model.TimeSeriesSample;
import com.ospicorp.forecastapi.forecast.model.enums.ForecastErrorKind;
import com.ospicorp.forecastapi.forecast.model.enums.ForecastStatus;
import com.ospicorp.forecastapi.forecast.model.enums.StrategyType;
import com.ospicorp.forecastapi.forecast.service.strategy.ForecastStrategy;
import com.ospicorp.forecastapi.forecast.service.strategy.StrategyForecast;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Validates a forecast request, resolves the strategy (through {@link AlgorithmSelector} for
 * {@code "auto"}), runs it and assembles the {@link ForecastResult}.
 *
 * <p>The engine is stateless and thread-safe. It never throws: invalid or insufficient input is
 * reported as an {@link ForecastStatus#ERROR} result, and numerically degenerate series still
 * produce a forecast with a halved confidence score.
 */
public class ForecastEngine {
  private static final Logger log = LoggerFactory.getLogger(ForecastEngine.class);

  public static final int MIN_SAMPLES = 10;
  public static final int NO_SEASONALITY = 1;
  public static final int DEFAULT_MAX_HORIZON = 10_000;
  static final Duration DEFAULT_INTERVAL = Duration.ofHours(1);
  static final double DEGRADED_CONFIDENCE_FACTOR = 0.5d;

  private final Map<StrategyType, ForecastStrategy> strategies = new EnumMap<>(StrategyType.class);
  private final AlgorithmSelector selector;
  private final int maxHorizon;

  public ForecastEngine(Collection<? extends ForecastStrategy> strategies,
      AlgorithmSelector selector) {
    this(strategies, selector, DEFAULT_MAX_HORIZON);
  }

  public ForecastEngine(Collection<? extends ForecastStrategy> strategies,
      AlgorithmSelector selector, int maxHorizon) {
    if (maxHorizon < 1) {
      throw new IllegalArgumentException("maxHorizon must be at least 1, got " + maxHorizon);
    }
    for (ForecastStrategy strategy : strategies) {
      this.strategies.put(strategy.type(), strategy);
    }
    for (StrategyType type : StrategyType.values()) {
      if (!this.strategies.containsKey(type)) {
        throw new IllegalArgumentException("No forecast strategy registered for " + type.code());
      }
    }
    this.selector = selector;
    this.maxHorizon = maxHorizon;
  }

  public ForecastResult forecast(List<TimeSeriesSample> series, int horizon, int seasonalPeriod) {
    return forecast(series, horizon, seasonalPeriod, StrategyType.AUTO);
  }

  public ForecastResult forecast(List<TimeSeriesSample> series, int horizon, int seasonalPeriod,
      String strategy) {
    StrategyType resolved = null;
    try {
      double[] values = validateSeries(series);
      validateParameters(horizon, seasonalPeriod);
      resolved = resolveStrategy(strategy, values);
      validateSeasonalPeriod(seasonalPeriod, values.length);
      return run(resolved, series, values, horizon, seasonalPeriod);
    } catch (ForecastInputException ex) {
      log.debug("Forecast rejected ({}): {}", ex.kind().code(), ex.getMessage());
      return ForecastResult.error(resolved, ex.kind(), ex.getMessage());
    } catch (RuntimeException ex) {
      log.error("Forecast with strategy {} failed: {}", strategy, ex.getMessage(), ex);
      return ForecastResult.error(resolved, ForecastErrorKind.DEGENERATE_SERIES,
          "Forecast computation failed: " + ex.getMessage());
    }
  }

  private ForecastResult run(StrategyType type, List<TimeSeriesSample> series, double[] values,
      int horizon, int seasonalPeriod) {
    int period = type.usesSeasonalPeriod() ? seasonalPeriod : NO_SEASONALITY;
    StrategyForecast raw = strategies.get(type).forecast(values, horizon, period);

    boolean degenerate = SeriesStatistics.standardDeviation(values) == 0d;
    double last = values[values.length - 1];
    Instant lastTimestamp = series.get(series.size() - 1).timestamp();
    Duration interval = samplingInterval(series);

    List<ForecastPoint> points = new ArrayList<>(horizon);
    for (int h = 1; h <= horizon; h++) {
      double estimate = raw.estimates()[h - 1];
      double halfWidth = raw.halfWidths()[h - 1];
      if (!Double.isFinite(estimate)) {
        estimate = last;
        degenerate = true;
      }
      if (!Double.isFinite(halfWidth) || halfWidth < 0d) {
        halfWidth = 0d;
        degenerate = true;
      }
      points.add(new ForecastPoint(lastTimestamp.plus(interval.multipliedBy(h)), estimate,
          estimate - halfWidth, estimate + halfWidth, h));
    }

    FitMetrics metrics = SeriesStatistics.fitMetrics(raw.observed(), raw.fitted());
    double confidence = SeriesStatistics.clamp(1d - metrics.mape() / 100d, 0d, 1d);
    String message = "Forecast generated with " + type.code();
    if (degenerate) {
      confidence *= DEGRADED_CONFIDENCE_FACTOR;
      message += "; series is degenerate (zero variance or non-finite model output), "
          + "intervals may be collapsed";
      log.warn("Degenerate series forecast with {} (n={}, horizon={})", type.code(),
          values.length, horizon);
    }

    log.debug("Forecast {} n={} horizon={} period={} mape={} confidence={}", type.code(),
        values.length, horizon, period, metrics.mape(), confidence);
    return new ForecastResult(type, points, metrics, ForecastStatus.SUCCESS, message, confidence,
        null);
  }

  private static double[] validateSeries(List<TimeSeriesSample> series) {
    int n = series == null ? 0 : series.size();
    if (n < MIN_SAMPLES) {
      throw new ForecastInputException(ForecastErrorKind.INSUFFICIENT_DATA,
          "Insufficient data: at least " + MIN_SAMPLES + " samples are required, got " + n);
    }
    double[] values = new double[n];
    Instant previous = null;
    for (int i = 0; i < n; i++) {
      TimeSeriesSample sample = series.get(i);
      if (sample == null || sample.timestamp() == null) {
        throw new ForecastInputException(ForecastErrorKind.INVALID_PARAMETER,
            "Sample " + i + " has no timestamp");
      }
      if (!Double.isFinite(sample.value())) {
        throw new ForecastInputException(ForecastErrorKind.INVALID_PARAMETER,
            "Sample " + i + " has a non-finite value");
      }
      if (previous != null && sample.timestamp().isBefore(previous)) {
        throw new ForecastInputException(ForecastErrorKind.INVALID_PARAMETER,
            "Samples must be sorted by timestamp; sample " + i + " is out of order");
      }
      previous = sample.timestamp();
      values[i] = sample.value();
    }
    return values;
  }

  private void validateParameters(int horizon, int seasonalPeriod) {
    if (horizon < 1 || horizon > maxHorizon) {
      throw new ForecastInputException(ForecastErrorKind.INVALID_PARAMETER,
          "Invalid horizon " + horizon + ": must be between 1 and " + maxHorizon);
    }
    if (seasonalPeriod < NO_SEASONALITY) {
      throw new ForecastInputException(ForecastErrorKind.INVALID_PARAMETER,
          "Invalid seasonal period " + seasonalPeriod + ": must be at least 1 (1 = none)");
    }
  }

  // Checked for every strategy, including those that ignore the period
  private static void validateSeasonalPeriod(int seasonalPeriod, int n) {
    if (seasonalPeriod > NO_SEASONALITY && seasonalPeriod > n / 2) {
      throw new ForecastInputException(ForecastErrorKind.INVALID_PARAMETER,
          "Invalid seasonal period " + seasonalPeriod + ": two full cycles ("
              + (2 * seasonalPeriod) + " samples) are required, got " + n);
    }
  }

  private StrategyType resolveStrategy(String strategy, double[] values) {
    if (!StringUtils.hasText(strategy) || StrategyType.AUTO.equalsIgnoreCase(strategy.trim())) {
      StrategyType selected = selector.select(values);
      log.debug("Auto-selected strategy {}", selected.code());
      return selected;
    }
    return StrategyType.fromCode(strategy)
        .orElseThrow(() -> new ForecastInputException(ForecastErrorKind.INVALID_PARAMETER,
            "Unknown strategy '" + strategy
                + "'. Supported values: auto,HoltWinters,Differencing,TrendSeasonal,SlidingWindow."));
  }

  static Duration samplingInterval(List<TimeSeriesSample> series) {
    if (series.size() < 2) {
      return DEFAULT_INTERVAL;
    }
    Duration delta = Duration.between(series.get(series.size() - 2).timestamp(),
        series.get(series.size() - 1).timestamp());
    return delta.isNegative() || delta.isZero() ? DEFAULT_INTERVAL : delta;
  }
}
