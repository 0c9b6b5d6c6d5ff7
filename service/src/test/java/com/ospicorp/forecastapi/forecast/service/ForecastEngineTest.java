package com.ospicorp.forecastapi.forecast.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.ospicorp.forecastapi.forecast.model.ForecastPoint;
import com.ospicorp.forecastapi.forecast.model.ForecastResult;
import com.ospicorp.forecastapi.forecast.model.TimeSeriesSample;
import com.ospicorp.forecastapi.forecast.model.enums.ForecastErrorKind;
import com.ospicorp.forecastapi.forecast.model.enums.ForecastStatus;
import com.ospicorp.forecastapi.forecast.model.enums.StrategyType;
import com.ospicorp.forecastapi.forecast.service.strategy.DifferencingStrategy;
import com.ospicorp.forecastapi.forecast.service.strategy.HoltWintersParameters;
import com.ospicorp.forecastapi.forecast.service.strategy.HoltWintersStrategy;
import com.ospicorp.forecastapi.forecast.service.strategy.SlidingWindowStrategy;
import com.ospicorp.forecastapi.forecast.service.strategy.TrendSeasonalStrategy;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ForecastEngineTest {

  private static final double[] STEADY_DRIFT = {10, 12, 11, 13, 12, 14, 13, 15, 14, 16};

  private final ForecastEngine engine = new ForecastEngine(List.of(
      new HoltWintersStrategy(HoltWintersParameters.DEFAULTS),
      new DifferencingStrategy(),
      new TrendSeasonalStrategy(),
      new SlidingWindowStrategy()),
      new AlgorithmSelector(SelectionThresholds.DEFAULTS));

  @Test
  void tenSamplesAreEnoughAndDriftContinues() {
    ForecastResult result = engine.forecast(SeriesFixtures.hourly(STEADY_DRIFT), 3,
        ForecastEngine.NO_SEASONALITY);

    assertThat(result.status()).isEqualTo(ForecastStatus.SUCCESS);
    assertThat(result.strategyUsed()).isEqualTo(StrategyType.DIFFERENCING);
    assertThat(result.forecasts()).extracting(ForecastPoint::pointEstimate)
        .containsExactly(16.8d, 17.6d, 18.4d);
    assertThat(result.inSampleMetrics().mape()).isCloseTo(14.756900506900509d, within(1e-9));
    assertThat(result.confidenceScore()).isCloseTo(1d - 0.14756900506900509d, within(1e-9));
    assertThat(result.errorKind()).isNull();
  }

  @Test
  void fewerThanTenSamplesIsAnError() {
    ForecastResult result = engine.forecast(SeriesFixtures.hourly(1, 2, 3, 4, 5, 6, 7, 8, 9), 3,
        ForecastEngine.NO_SEASONALITY);

    assertThat(result.status()).isEqualTo(ForecastStatus.ERROR);
    assertThat(result.errorKind()).isEqualTo(ForecastErrorKind.INSUFFICIENT_DATA);
    assertThat(result.message()).containsIgnoringCase("insufficient data");
    assertThat(result.forecasts()).isEmpty();
    assertThat(result.confidenceScore()).isZero();
  }

  @Test
  void missingSeriesIsInsufficientData() {
    ForecastResult result = engine.forecast(null, 3, ForecastEngine.NO_SEASONALITY, "auto");

    assertThat(result.errorKind()).isEqualTo(ForecastErrorKind.INSUFFICIENT_DATA);
  }

  @ParameterizedTest
  @ValueSource(strings = {"HoltWinters", "Differencing", "TrendSeasonal", "SlidingWindow"})
  void constantSeriesForecastsTheConstant(String strategy) {
    List<TimeSeriesSample> series = SeriesFixtures.hourly(SeriesFixtures.constant(20, 50d));

    ForecastResult result = engine.forecast(series, 5, 5, strategy);

    assertThat(result.status()).isEqualTo(ForecastStatus.SUCCESS);
    assertThat(result.forecasts()).allSatisfy(p -> {
      assertThat(p.pointEstimate()).isCloseTo(50d, within(1e-9));
      assertThat(p.upperBound95() - p.lowerBound95()).isCloseTo(0d, within(1e-9));
    });
  }

  @Test
  void constantSeriesLowersConfidence() {
    List<TimeSeriesSample> series = SeriesFixtures.hourly(SeriesFixtures.constant(20, 50d));

    ForecastResult result = engine.forecast(series, 2, ForecastEngine.NO_SEASONALITY);

    assertThat(result.status()).isEqualTo(ForecastStatus.SUCCESS);
    assertThat(result.confidenceScore()).isEqualTo(ForecastEngine.DEGRADED_CONFIDENCE_FACTOR);
    assertThat(result.message()).contains("degenerate");
  }

  @Test
  void seasonalPeriodAboveHalfTheSeriesIsInvalid() {
    List<TimeSeriesSample> series = SeriesFixtures.hourly(SeriesFixtures.noisyRamp(20));

    for (String strategy : List.of("auto", "HoltWinters", "TrendSeasonal", "Differencing")) {
      ForecastResult result = engine.forecast(series, 4, 11, strategy);
      assertThat(result.status()).as(strategy).isEqualTo(ForecastStatus.ERROR);
      assertThat(result.errorKind()).as(strategy).isEqualTo(ForecastErrorKind.INVALID_PARAMETER);
      assertThat(result.forecasts()).isEmpty();
    }
  }

  @Test
  void seasonalPeriodOfExactlyHalfIsAccepted() {
    List<TimeSeriesSample> series = SeriesFixtures.hourly(SeriesFixtures.noisyRamp(20));

    ForecastResult result = engine.forecast(series, 4, 10, "HoltWinters");

    assertThat(result.status()).isEqualTo(ForecastStatus.SUCCESS);
  }

  @Test
  void seasonalPeriodIsCheckedEvenWhenTheStrategyIgnoresIt() {
    List<TimeSeriesSample> series = SeriesFixtures.hourly(SeriesFixtures.noisyRamp(20));

    ForecastResult result = engine.forecast(series, 4, 100, "SlidingWindow");

    assertThat(result.status()).isEqualTo(ForecastStatus.ERROR);
    assertThat(result.errorKind()).isEqualTo(ForecastErrorKind.INVALID_PARAMETER);
    assertThat(result.strategyUsed()).isEqualTo(StrategyType.SLIDING_WINDOW);
  }

  @Test
  void slidingWindowRunsWithAValidSeasonalPeriod() {
    List<TimeSeriesSample> series = SeriesFixtures.hourly(SeriesFixtures.noisyRamp(20));

    ForecastResult result = engine.forecast(series, 4, 10, "SlidingWindow");

    assertThat(result.status()).isEqualTo(ForecastStatus.SUCCESS);
    assertThat(result.forecasts()).hasSize(4);
  }

  @ParameterizedTest
  @ValueSource(strings = {"auto", "HoltWinters", "Differencing", "TrendSeasonal", "SlidingWindow"})
  void oversizedHorizonIsRejectedWithoutAllocating(String strategy) {
    List<TimeSeriesSample> series = SeriesFixtures.hourly(SeriesFixtures.noisyRamp(20));

    ForecastResult result = engine.forecast(series, Integer.MAX_VALUE, 1, strategy);

    assertThat(result.status()).isEqualTo(ForecastStatus.ERROR);
    assertThat(result.errorKind()).isEqualTo(ForecastErrorKind.INVALID_PARAMETER);
    assertThat(result.message()).contains(String.valueOf(ForecastEngine.DEFAULT_MAX_HORIZON));
    assertThat(result.forecasts()).isEmpty();
  }

  @Test
  void horizonCapIsConfigurable() {
    ForecastEngine capped = new ForecastEngine(List.of(
        new HoltWintersStrategy(HoltWintersParameters.DEFAULTS),
        new DifferencingStrategy(),
        new TrendSeasonalStrategy(),
        new SlidingWindowStrategy()),
        new AlgorithmSelector(SelectionThresholds.DEFAULTS), 48);
    List<TimeSeriesSample> series = SeriesFixtures.hourly(SeriesFixtures.noisyRamp(20));

    assertThat(capped.forecast(series, 48, 1).forecasts()).hasSize(48);
    assertThat(capped.forecast(series, 49, 1).errorKind())
        .isEqualTo(ForecastErrorKind.INVALID_PARAMETER);
  }

  @Test
  void seasonalDifferencingIntervalsWiden() {
    double[] pattern = {10, 20, 30, 20};
    List<TimeSeriesSample> series = SeriesFixtures.hourly(SeriesFixtures.generate(24,
        t -> pattern[t % 4] + 0.5d * t + 0.3d * Math.sin(1.3d * t)));

    ForecastResult result = engine.forecast(series, 8, 4, "Differencing");

    assertThat(result.status()).isEqualTo(ForecastStatus.SUCCESS);
    List<Double> widths = widths(result);
    assertThat(widths).isSorted();
    assertThat(widths.get(0)).isPositive();
    for (int h = 1; h <= 8; h++) {
      assertThat(widths.get(h - 1)).isCloseTo(widths.get(0) * Math.sqrt(h), within(1e-9));
    }
  }

  @Test
  void invalidHorizonPeriodAndStrategyAreRejected() {
    List<TimeSeriesSample> series = SeriesFixtures.hourly(SeriesFixtures.noisyRamp(30));

    assertThat(engine.forecast(series, 0, 1).errorKind())
        .isEqualTo(ForecastErrorKind.INVALID_PARAMETER);
    assertThat(engine.forecast(series, 3, 0).errorKind())
        .isEqualTo(ForecastErrorKind.INVALID_PARAMETER);
    ForecastResult unknown = engine.forecast(series, 3, 1, "NeuralProphet");
    assertThat(unknown.errorKind()).isEqualTo(ForecastErrorKind.INVALID_PARAMETER);
    assertThat(unknown.message()).contains("NeuralProphet");
  }

  @Test
  void unsortedOrNonFiniteSamplesAreRejected() {
    List<TimeSeriesSample> unsorted = new ArrayList<>(SeriesFixtures.hourly(SeriesFixtures.noisyRamp(12)));
    unsorted.set(3, new TimeSeriesSample(SeriesFixtures.START.minusSeconds(60), 1d));
    List<TimeSeriesSample> nonFinite = new ArrayList<>(SeriesFixtures.hourly(SeriesFixtures.noisyRamp(12)));
    nonFinite.set(5, new TimeSeriesSample(nonFinite.get(5).timestamp(), Double.NaN));

    assertThat(engine.forecast(unsorted, 2, 1).message()).contains("sorted");
    assertThat(engine.forecast(nonFinite, 2, 1).errorKind())
        .isEqualTo(ForecastErrorKind.INVALID_PARAMETER);
  }

  @ParameterizedTest
  @ValueSource(strings = {"auto", "HoltWinters", "Differencing", "TrendSeasonal", "SlidingWindow"})
  void returnsExactlyHorizonOrderedPointsInsideTheirBounds(String strategy) {
    List<TimeSeriesSample> series = SeriesFixtures.hourly(SeriesFixtures.noisyRamp(48));
    Instant last = series.get(series.size() - 1).timestamp();

    ForecastResult result = engine.forecast(series, 10, 12, strategy);

    assertThat(result.status()).isEqualTo(ForecastStatus.SUCCESS);
    assertThat(result.forecasts()).hasSize(10);
    for (int i = 0; i < 10; i++) {
      ForecastPoint point = result.forecasts().get(i);
      assertThat(point.horizonStep()).isEqualTo(i + 1);
      assertThat(point.timestamp()).isEqualTo(last.plus(Duration.ofHours(i + 1)));
      assertThat(point.lowerBound95()).isLessThanOrEqualTo(point.pointEstimate());
      assertThat(point.pointEstimate()).isLessThanOrEqualTo(point.upperBound95());
    }
    assertThat(result.confidenceScore()).isBetween(0d, 1d);
  }

  @ParameterizedTest
  @ValueSource(strings = {"auto", "HoltWinters", "Differencing", "TrendSeasonal", "SlidingWindow"})
  void identicalInputGivesIdenticalOutput(String strategy) {
    List<TimeSeriesSample> series = SeriesFixtures.hourly(SeriesFixtures.noisyRamp(36));

    assertThat(engine.forecast(series, 6, 6, strategy))
        .isEqualTo(engine.forecast(series, 6, 6, strategy));
  }

  @Test
  void intervalGrowthDependsOnTheModel() {
    List<TimeSeriesSample> series = SeriesFixtures.hourly(SeriesFixtures.noisyRamp(48));

    assertThat(widths(engine.forecast(series, 8, 1, "Differencing"))).isSorted();
    assertThat(widths(engine.forecast(series, 8, 1, "SlidingWindow"))).isSorted();
    assertThat(widths(engine.forecast(series, 8, 1, "HoltWinters"))).isSorted();
    List<Double> constant = widths(engine.forecast(series, 8, 12, "TrendSeasonal"));
    assertThat(constant).allSatisfy(w -> assertThat(w).isCloseTo(constant.get(0), within(1e-9)));
  }

  @Test
  void timestampsFollowTheLastSamplingInterval() {
    List<TimeSeriesSample> series = new ArrayList<>();
    double[] values = SeriesFixtures.noisyRamp(12);
    for (int i = 0; i < values.length; i++) {
      series.add(new TimeSeriesSample(SeriesFixtures.START.plus(Duration.ofMinutes(15L * i)), values[i]));
    }

    ForecastResult result = engine.forecast(series, 2, 1, "SlidingWindow");

    Instant last = series.get(11).timestamp();
    assertThat(result.forecasts()).extracting(ForecastPoint::timestamp)
        .containsExactly(last.plus(Duration.ofMinutes(15)), last.plus(Duration.ofMinutes(30)));
  }

  @Test
  void singleSampleUsesDefaultInterval() {
    List<TimeSeriesSample> one = List.of(new TimeSeriesSample(SeriesFixtures.START, 1d));

    assertThat(ForecastEngine.samplingInterval(one)).isEqualTo(Duration.ofHours(1));
  }

  @Test
  void requiresEveryStrategy() {
    AlgorithmSelector selector = new AlgorithmSelector(SelectionThresholds.DEFAULTS);

    assertThatThrownBy(() -> new ForecastEngine(List.of(new DifferencingStrategy()), selector))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("HoltWinters");
  }

  private static List<Double> widths(ForecastResult result) {
    List<Double> out = new ArrayList<>();
    for (ForecastPoint point : result.forecasts()) {
      out.add(point.upperBound95() - point.lowerBound95());
    }
    return out;
  }
}
