package com.ospicorp.forecastapi.config;

import com.ospicorp.forecastapi.forecast.controller.InvalidParameterException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import java.net.URI;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/** Maps every failure of the HTTP layer to an RFC 7807 problem document. */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  private static final Map<HttpStatus, String> TYPE_SLUGS = Map.of(
      HttpStatus.BAD_REQUEST, "invalid-parameter",
      HttpStatus.UNAUTHORIZED, "unauthorized",
      HttpStatus.FORBIDDEN, "forbidden",
      HttpStatus.NOT_FOUND, "not-found",
      HttpStatus.METHOD_NOT_ALLOWED, "method-not-allowed",
      HttpStatus.UNSUPPORTED_MEDIA_TYPE, "unsupported-media-type",
      HttpStatus.INTERNAL_SERVER_ERROR, "internal-error"
  );

  @ExceptionHandler({ConstraintViolationException.class, MethodArgumentNotValidException.class,
      MethodArgumentTypeMismatchException.class, MissingServletRequestParameterException.class,
      HttpMessageNotReadableException.class, IllegalArgumentException.class})
  public ResponseEntity<ProblemDetail> handleBadRequest(Exception ex, HttpServletRequest request) {
    return buildProblem(HttpStatus.BAD_REQUEST, ex, request);
  }

  @ExceptionHandler(InvalidParameterException.class)
  public ResponseEntity<ProblemDetail> handleInvalidParameter(InvalidParameterException ex,
      HttpServletRequest request) {
    ResponseEntity<ProblemDetail> response = buildProblem(HttpStatus.BAD_REQUEST, ex, request);
    ProblemDetail detail = response.getBody();
    if (detail != null) {
      detail.setProperty("errorCode", ex.errorCode());
      detail.setProperty("moreInfo", ex.moreInfo());
    }
    return response;
  }

  @ExceptionHandler(NoResourceFoundException.class)
  public ResponseEntity<ProblemDetail> handleNotFound(NoResourceFoundException ex,
      HttpServletRequest request) {
    return buildProblem(HttpStatus.NOT_FOUND, ex, request);
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ResponseEntity<ProblemDetail> handleMethodNotAllowed(
      HttpRequestMethodNotSupportedException ex, HttpServletRequest request) {
    return buildProblem(HttpStatus.METHOD_NOT_ALLOWED, ex, request);
  }

  @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
  public ResponseEntity<ProblemDetail> handleUnsupportedMediaType(
      HttpMediaTypeNotSupportedException ex, HttpServletRequest request) {
    return buildProblem(HttpStatus.UNSUPPORTED_MEDIA_TYPE, ex, request);
  }

  @ExceptionHandler(AuthenticationException.class)
  public ResponseEntity<ProblemDetail> handleUnauthorized(AuthenticationException ex,
      HttpServletRequest request) {
    return buildProblem(HttpStatus.UNAUTHORIZED, ex, request);
  }

  @ExceptionHandler(AccessDeniedException.class)
  public ResponseEntity<ProblemDetail> handleForbidden(AccessDeniedException ex,
      HttpServletRequest request) {
    return buildProblem(HttpStatus.FORBIDDEN, ex, request);
  }

  @ExceptionHandler(ResponseStatusException.class)
  public ResponseEntity<ProblemDetail> handleResponseStatus(ResponseStatusException ex,
      HttpServletRequest request) {
    HttpStatus status = HttpStatus.resolve(ex.getStatusCode().value());
    if (status == null) {
      status = HttpStatus.INTERNAL_SERVER_ERROR;
    }
    return buildProblem(status, ex, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ProblemDetail> handleServerError(Exception ex, HttpServletRequest request) {
    return buildProblem(HttpStatus.INTERNAL_SERVER_ERROR, ex, request);
  }

  private ResponseEntity<ProblemDetail> buildProblem(HttpStatus status, Exception ex,
      HttpServletRequest request) {
    logException(status, ex, request);
    ProblemDetail detail = ProblemDetail.forStatusAndDetail(status, describe(ex));
    detail.setTitle(status.getReasonPhrase());
    detail.setInstance(URI.create(request.getRequestURI()));
    detail.setType(URI.create("https://docs.forecast-api.dev/problems/"
        + TYPE_SLUGS.getOrDefault(status, "internal-error")));
    detail.setProperty("path", request.getRequestURI());
    return ResponseEntity.status(status).body(detail);
  }

  private static String describe(Exception ex) {
    if (ex instanceof MethodArgumentNotValidException invalid) {
      StringBuilder builder = new StringBuilder("Invalid request body:");
      invalid.getBindingResult().getFieldErrors().forEach(error -> builder.append(' ')
          .append(error.getField()).append(' ').append(error.getDefaultMessage()).append(';'));
      return builder.toString();
    }
    if (ex instanceof HttpMessageNotReadableException) {
      return "Malformed request body";
    }
    return ex.getMessage();
  }

  private void logException(HttpStatus status, Exception ex, HttpServletRequest request) {
    String method = request.getMethod();
    String uriWithQuery = HttpRequests.uriWithQuery(request);
    String clientIp = HttpRequests.clientIp(request);
    String errorMessage = ex.getMessage();
    if (errorMessage == null || errorMessage.isBlank()) {
      errorMessage = ex.getClass().getName();
    }

    if (status.is5xxServerError()) {
      log.error("Request {} {} from {} failed with status {}: {}",
          method, uriWithQuery, clientIp, status.value(), errorMessage, ex);
    } else {
      log.warn("Request {} {} from {} returned status {}: {}",
          method, uriWithQuery, clientIp, status.value(), errorMessage);
    }
  }
}
