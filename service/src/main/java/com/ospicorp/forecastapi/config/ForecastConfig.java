package com.ospicorp.forecastapi.config;

import com.ospicorp.forecastapi.forecast.service.AlgorithmSelector;
import com.ospicorp.forecastapi.forecast.service.ForecastEngine;
import com.ospicorp.forecastapi.forecast.service.SelectionThresholds;
import com.ospicorp.forecastapi.forecast.service.strategy.DifferencingStrategy;
import com.ospicorp.forecastapi.forecast.service.strategy.ForecastStrategy;
import com.ospicorp.forecastapi.forecast.service.strategy.HoltWintersParameters;
import com.ospicorp.forecastapi.forecast.service.strategy.HoltWintersStrategy;
import com.ospicorp.forecastapi.forecast.service.strategy.SlidingWindowStrategy;
import com.ospicorp.forecastapi.forecast.service.strategy.TrendSeasonalStrategy;
import java.util.List;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class ForecastConfig {

  @Bean
  HoltWintersParameters holtWintersParameters(
      @Value("${forecast.holt-winters.alpha:0.3}") double alpha,
      @Value("${forecast.holt-winters.beta:0.1}") double beta,
      @Value("${forecast.holt-winters.gamma:0.1}") double gamma) {
    return new HoltWintersParameters(alpha, beta, gamma);
  }

  @Bean
  SelectionThresholds selectionThresholds(
      @Value("${forecast.selector.trend-threshold:0.2}") double trendThreshold,
      @Value("${forecast.selector.volatility-threshold:0.5}") double volatilityThreshold) {
    return new SelectionThresholds(trendThreshold, volatilityThreshold);
  }

  @Bean
  HoltWintersStrategy holtWintersStrategy(HoltWintersParameters parameters) {
    return new HoltWintersStrategy(parameters);
  }

  @Bean
  DifferencingStrategy differencingStrategy() {
    return new DifferencingStrategy();
  }

  @Bean
  TrendSeasonalStrategy trendSeasonalStrategy() {
    return new TrendSeasonalStrategy();
  }

  @Bean
  SlidingWindowStrategy slidingWindowStrategy() {
    return new SlidingWindowStrategy();
  }

  @Bean
  AlgorithmSelector algorithmSelector(SelectionThresholds thresholds) {
    return new AlgorithmSelector(thresholds);
  }

  @Bean
  ForecastEngine forecastEngine(List<ForecastStrategy> strategies, AlgorithmSelector selector,
      @Value("${forecast.max-horizon:10000}") int maxHorizon) {
    return new ForecastEngine(strategies, selector, maxHorizon);
  }

  // Batch forecasts run here; a full queue makes the request thread compute the forecast itself
  @Bean
  ThreadPoolTaskExecutor forecastExecutor(
      @Value("${forecast.batch.pool-size:4}") int poolSize,
      @Value("${forecast.batch.queue-capacity:100}") int queueCapacity) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(poolSize);
    executor.setMaxPoolSize(poolSize);
    executor.setQueueCapacity(queueCapacity);
    executor.setThreadNamePrefix("forecast-");
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    return executor;
  }
}
