package com.ospicorp.forecastapi.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.tags.Tag;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * API document for springdoc. The bearer scheme is only required on operations when
 * {@code security.auth.enabled} is on, matching {@link SecurityConfig}.
 */
@Configuration
public class OpenApiConfig {
  static final String BEARER_SCHEME = "bearer-jwt";

  @Bean
  OpenAPI forecastApi(@Value("${spring.application.name:forecast-service}") String serviceName,
      @Value("${security.auth.enabled:false}") boolean authEnabled) {
    OpenAPI api = new OpenAPI()
        .info(new Info()
            .title("Metric Forecast API")
            .version("v1")
            .description(serviceName + ": forecasts with 95% bounds, trend, seasonality and "
                + "percentile baselines for performance metrics"))
        .tags(List.of(
            new Tag().name("Forecasts").description("Single and batch metric forecasts"),
            new Tag().name("Diagnostics").description("Trend, seasonality and baseline")))
        .components(new Components().addSecuritySchemes(BEARER_SCHEME, new SecurityScheme()
            .type(SecurityScheme.Type.HTTP)
            .scheme("bearer")
            .bearerFormat("JWT")));
    if (authEnabled) {
      api.addSecurityItem(new SecurityRequirement().addList(BEARER_SCHEME));
    }
    return api;
  }
}
