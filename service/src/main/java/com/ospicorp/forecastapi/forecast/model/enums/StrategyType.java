package com.ospicorp.forecastapi.forecast.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.Optional;

public enum StrategyType {
  HOLT_WINTERS("HoltWinters", true),
  DIFFERENCING("Differencing", true),
  TREND_SEASONAL("TrendSeasonal", true),
  SLIDING_WINDOW("SlidingWindow", false);

  public static final String AUTO = "auto";

  private final String code;
  private final boolean usesSeasonalPeriod;

  StrategyType(String code, boolean usesSeasonalPeriod) {
    this.code = code;
    this.usesSeasonalPeriod = usesSeasonalPeriod;
  }

  @JsonValue
  public String code() {
    return code;
  }

  /** Whether the model reads the seasonal period; the others are given {@code 1}. */
  public boolean usesSeasonalPeriod() {
    return usesSeasonalPeriod;
  }

  public static Optional<StrategyType> fromCode(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (StrategyType type : values()) {
      if (type.code.toLowerCase(Locale.ROOT).equals(normalized)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }
}
