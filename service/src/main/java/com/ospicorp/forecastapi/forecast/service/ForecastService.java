package com.ospicorp.forecastapi.forecast.service;

import com.ospicorp.forecastapi.forecast.model.BaselineReport;
import com.ospicorp.forecastapi.forecast.model.BaselineResponse;
import com.ospicorp.forecastapi.forecast.model.ForecastRequest;
import com.ospicorp.forecastapi.forecast.model.ForecastResponse;
import com.ospicorp.forecastapi.forecast.model.ForecastResult;
import com.ospicorp.forecastapi.forecast.model.SampleDto;
import com.ospicorp.forecastapi.forecast.model.SeasonalityReport;
import com.ospicorp.forecastapi.forecast.model.TimeSeriesSample;
import com.ospicorp.forecastapi.forecast.model.TrendReport;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

@Service
public class ForecastService {
  private static final Logger log = LoggerFactory.getLogger(ForecastService.class);

  private final ForecastEngine engine;
  private final TaskExecutor executor;

  public ForecastService(ForecastEngine engine,
      @Qualifier("forecastExecutor") TaskExecutor executor) {
    this.engine = engine;
    this.executor = executor;
  }

  public ForecastResult forecast(ForecastRequest request) {
    int period = request.seasonalPeriod() == null
        ? ForecastEngine.NO_SEASONALITY
        : request.seasonalPeriod();
    ForecastResult result = engine.forecast(toSamples(request.series()), request.horizon(), period,
        request.strategy());
    if (!result.isSuccess()) {
      log.warn("Forecast of {} samples failed: {}", request.series().size(), result.message());
    }
    return result;
  }

  /**
   * Forecasts every metric concurrently. Metrics still running when {@code timeout} elapses get
   * an error document and their late results are dropped.
   */
  public Map<String, ForecastResponse> forecastBatch(Map<String, ForecastRequest> requests,
      Duration timeout) {
    Map<String, CompletableFuture<ForecastResponse>> pending = new LinkedHashMap<>();
    requests.forEach((metric, request) -> pending.put(metric,
        CompletableFuture.supplyAsync(() -> ForecastResponse.from(forecast(request)), executor)));

    long deadline = System.nanoTime() + timeout.toNanos();
    Map<String, ForecastResponse> out = new LinkedHashMap<>();
    for (var entry : pending.entrySet()) {
      String metric = entry.getKey();
      CompletableFuture<ForecastResponse> future = entry.getValue();
      try {
        long remaining = Math.max(0L, deadline - System.nanoTime());
        out.put(metric, future.get(remaining, TimeUnit.NANOSECONDS));
      } catch (TimeoutException ex) {
        future.cancel(true);
        log.warn("Forecast of metric {} did not finish within {} ms", metric, timeout.toMillis());
        out.put(metric, ForecastResponse.failure(
            "Forecast timed out after " + timeout.toMillis() + " ms"));
      } catch (ExecutionException ex) {
        log.error("Forecast of metric {} failed: {}", metric, ex.getCause().getMessage(),
            ex.getCause());
        out.put(metric, ForecastResponse.failure("Forecast failed: " + ex.getCause().getMessage()));
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        pending.values().forEach(f -> f.cancel(true));
        throw new IllegalStateException("Interrupted while waiting for batch forecasts", ex);
      }
    }
    return out;
  }

  public TrendReport trend(List<SampleDto> series) {
    return TrendAnalyzer.analyze(toValues(series));
  }

  public SeasonalityReport seasonality(List<SampleDto> series, int maxPeriod) {
    return SeasonalityAnalyzer.analyze(toValues(series), maxPeriod);
  }

  public BaselineResponse baseline(List<SampleDto> series, Double currentValue,
      double thresholdPercent) {
    BaselineReport report = BaselineAnalyzer.baseline(toValues(series));
    Boolean above = currentValue == null
        ? null
        : BaselineAnalyzer.isAboveBaseline(report, currentValue, thresholdPercent);
    if (Boolean.TRUE.equals(above)) {
      log.info("Value {} exceeds baseline threshold (P95={} + {}%)", currentValue, report.p95(),
          thresholdPercent);
    }
    return new BaselineResponse(report, thresholdPercent, currentValue, above);
  }

  private static List<TimeSeriesSample> toSamples(List<SampleDto> series) {
    List<TimeSeriesSample> out = new ArrayList<>(series.size());
    for (SampleDto dto : series) {
      out.add(dto.toSample());
    }
    return out;
  }

  private static double[] toValues(List<SampleDto> series) {
    double[] out = new double[series.size()];
    for (int i = 0; i < out.length; i++) {
      out[i] = series.get(i).value();
    }
    return out;
  }
}
