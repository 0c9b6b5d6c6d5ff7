package com.ospicorp.forecastapi.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Access log: one line per request with status and duration. Each request gets an id in the
 * {@code requestId} MDC key (taken from {@code X-Request-Id} when the caller sends one) so
 * forecast log lines can be correlated with their request.
 */
@Component
public class RequestLoggingFilter extends OncePerRequestFilter {

  static final String REQUEST_ID_HEADER = "X-Request-Id";
  static final String REQUEST_ID_KEY = "requestId";

  private static final Logger log = LoggerFactory.getLogger(RequestLoggingFilter.class);

  @Override
  protected void doFilterInternal(@NonNull HttpServletRequest request,
      @NonNull HttpServletResponse response, @NonNull FilterChain filterChain)
      throws ServletException, IOException {
    long startTime = System.currentTimeMillis();
    String requestId = request.getHeader(REQUEST_ID_HEADER);
    if (requestId == null || requestId.isBlank()) {
      requestId = UUID.randomUUID().toString();
    }
    MDC.put(REQUEST_ID_KEY, requestId);
    response.setHeader(REQUEST_ID_HEADER, requestId);
    try {
      filterChain.doFilter(request, response);
    } catch (ServletException | IOException | RuntimeException ex) {
      log.error("Request {} {} from {} failed: {}",
          request.getMethod(),
          HttpRequests.uriWithQuery(request),
          HttpRequests.clientIp(request),
          ex.getMessage(),
          ex);
      throw ex;
    } finally {
      long duration = System.currentTimeMillis() - startTime;
      log.info("HTTP {} {} from {} -> {} ({} ms)",
          request.getMethod(),
          HttpRequests.uriWithQuery(request),
          HttpRequests.clientIp(request),
          response.getStatus(),
          duration);
      MDC.remove(REQUEST_ID_KEY);
    }
  }
}
