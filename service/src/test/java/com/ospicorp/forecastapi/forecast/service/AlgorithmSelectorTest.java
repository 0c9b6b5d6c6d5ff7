package com.ospicorp.forecastapi.forecast.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.ospicorp.forecastapi.forecast.model.enums.StrategyType;
import com.ospicorp.forecastapi.forecast.service.AlgorithmSelector.SeriesProfile;
import org.junit.jupiter.api.Test;

class AlgorithmSelectorTest {

  private final AlgorithmSelector selector = new AlgorithmSelector(SelectionThresholds.DEFAULTS);

  @Test
  void steadyDriftUnderLowNoisePicksDifferencing() {
    double[] values = {10, 12, 11, 13, 12, 14, 13, 15, 14, 16};

    SeriesProfile profile = AlgorithmSelector.profile(values);

    assertThat(profile.mean()).isCloseTo(13d, within(1e-12));
    assertThat(profile.trendStrength()).isCloseTo(2.8d / 11.6d, within(1e-12));
    assertThat(profile.volatility()).isLessThan(0.5d);
    assertThat(selector.select(values)).isEqualTo(StrategyType.DIFFERENCING);
  }

  @Test
  void volatileSeriesPicksHoltWinters() {
    double[] values = SeriesFixtures.generate(20, t -> t % 2 == 0 ? 1d : 10d);

    assertThat(AlgorithmSelector.profile(values).volatility()).isCloseTo(4.5d / 5.5d, within(1e-12));
    assertThat(selector.select(values)).isEqualTo(StrategyType.HOLT_WINTERS);
  }

  @Test
  void flatSeriesFallsBackToHoltWinters() {
    double[] values = SeriesFixtures.generate(24, t -> 100d + (t % 3) - 1d);

    assertThat(selector.select(values)).isEqualTo(StrategyType.HOLT_WINTERS);
  }

  @Test
  void zeroMeanYieldsZeroVolatility() {
    double[] values = {-2, 2, -2, 2, -2, 2, -2, 2, -2, 2};

    assertThat(AlgorithmSelector.profile(values).volatility()).isZero();
  }

  @Test
  void zeroFirstHalfMeanYieldsZeroTrendStrength() {
    double[] values = {0, 0, 0, 0, 0, 5, 6, 7, 8, 9};

    assertThat(AlgorithmSelector.profile(values).trendStrength()).isZero();
  }

  @Test
  void thresholdsAreConfigurable() {
    double[] values = {10, 12, 11, 13, 12, 14, 13, 15, 14, 16};
    AlgorithmSelector strict = new AlgorithmSelector(new SelectionThresholds(0.5d, 0.5d));

    assertThat(strict.select(values)).isEqualTo(StrategyType.HOLT_WINTERS);
  }

  @Test
  void identicalProfilesSelectIdenticalStrategies() {
    SeriesProfile profile = new SeriesProfile(50d, 5d, 0.1d, 0.3d);

    assertThat(selector.select(profile)).isEqualTo(selector.select(profile))
        .isEqualTo(StrategyType.DIFFERENCING);
  }
}
