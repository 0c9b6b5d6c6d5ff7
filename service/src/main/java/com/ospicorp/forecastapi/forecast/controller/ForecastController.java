package com.ospicorp.forecastapi.forecast.controller;

import com.ospicorp.forecastapi.forecast.model.BatchForecastRequest;
import com.ospicorp.forecastapi.forecast.model.ForecastRequest;
import com.ospicorp.forecastapi.forecast.model.ForecastResponse;
import com.ospicorp.forecastapi.forecast.service.ForecastService;
import com.ospicorp.forecastapi.web.CsvHttpMessageConverter;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MimeTypeUtils;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/forecasts")
@Validated
@Tag(name = "Forecasts")
public class ForecastController {
  private final ForecastService service;
  private final long defaultTimeoutMs;
  private final long maxTimeoutMs;

  public ForecastController(ForecastService service,
      @Value("${forecast.batch.default-timeout-ms:10000}") long defaultTimeoutMs,
      @Value("${forecast.batch.max-timeout-ms:60000}") long maxTimeoutMs) {
    this.service = service;
    this.defaultTimeoutMs = defaultTimeoutMs;
    this.maxTimeoutMs = maxTimeoutMs;
  }

  @PostMapping
  @Operation(summary = "Forecast a metric",
      description = "Project a metric series with 95% bounds. Insufficient data or invalid "
          + "horizon/period come back as a document with status Error.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Forecast document or CSV forecast points",
          content = {
              @Content(mediaType = "application/json",
                  schema = @Schema(implementation = ForecastResponse.class)),
              @Content(mediaType = "text/csv")
          }),
      @ApiResponse(responseCode = "400", description = "Malformed request",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = org.springframework.http.ProblemDetail.class)))
  })
  public ResponseEntity<?> forecast(@Valid @RequestBody ForecastRequest request,
      @RequestParam(name = "format", required = false)
          @Parameter(description = "json or csv; overrides the Accept header") String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
    MediaType contentType = selectMediaType(format, accept);
    ForecastResponse response = ForecastResponse.from(service.forecast(request));
    Object body = contentType.isCompatibleWith(CsvHttpMessageConverter.TEXT_CSV)
        ? response.forecasts()
        : response;
    return ResponseEntity.ok().contentType(contentType).body(body);
  }

  @PostMapping("/batch")
  @Operation(summary = "Forecast many metrics",
      description = "Forecast each metric independently and in parallel.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Forecast document per metric"),
      @ApiResponse(responseCode = "400", description = "Malformed request",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = org.springframework.http.ProblemDetail.class)))
  })
  public Map<String, ForecastResponse> batch(@Valid @RequestBody BatchForecastRequest request,
      @RequestParam(name = "timeout_ms", required = false)
          @Parameter(description = "Overall time budget in milliseconds", example = "5000")
          Long timeoutMs) {
    long timeout = timeoutMs == null ? defaultTimeoutMs : timeoutMs;
    if (timeout < 1 || timeout > maxTimeoutMs) {
      throw new InvalidParameterException(
          "Invalid timeout_ms parameter. Supported range: 1-" + maxTimeoutMs + ".", 2002);
    }
    return service.forecastBatch(request.metrics(), Duration.ofMillis(timeout));
  }

  private static MediaType selectMediaType(String format, String accept) {
    if (StringUtils.hasText(format)) {
      if ("csv".equalsIgnoreCase(format)) {
        return CsvHttpMessageConverter.TEXT_CSV;
      }
      if ("json".equalsIgnoreCase(format)) {
        return MediaType.APPLICATION_JSON;
      }
      throw new InvalidParameterException("Invalid format value. Supported values: json,csv.",
          2001);
    }
    if (!StringUtils.hasText(accept)) {
      return MediaType.APPLICATION_JSON;
    }
    List<MediaType> mediaTypes = MediaType.parseMediaTypes(accept);
    mediaTypes.sort(Comparator.comparingDouble(MediaType::getQualityValue).reversed());
    MimeTypeUtils.sortBySpecificity(mediaTypes);
    for (MediaType mediaType : mediaTypes) {
      if (mediaType.isCompatibleWith(MediaType.APPLICATION_JSON)) {
        return MediaType.APPLICATION_JSON;
      }
      if (mediaType.isCompatibleWith(CsvHttpMessageConverter.TEXT_CSV)) {
        return CsvHttpMessageConverter.TEXT_CSV;
      }
    }
    return MediaType.APPLICATION_JSON;
  }
}
