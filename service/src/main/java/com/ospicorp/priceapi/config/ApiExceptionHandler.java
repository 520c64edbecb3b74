package com.ospicorp.priceapi.config;

import com.ospicorp.priceapi.prices.service.PriceDataNotFoundException;
import com.ospicorp.priceapi.temperatures.TemperatureProviderException;
import com.ospicorp.priceapi.web.InvalidParameterException;
import jakarta.servlet.http.HttpServletRequest;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  private static final Map<HttpStatus, String> TYPE_SLUGS = Map.of(
      HttpStatus.BAD_REQUEST, "invalid-parameter",
      HttpStatus.NOT_FOUND, "not-found",
      HttpStatus.METHOD_NOT_ALLOWED, "method-not-allowed",
      HttpStatus.NOT_ACCEPTABLE, "not-acceptable",
      HttpStatus.SERVICE_UNAVAILABLE, "upstream-unavailable",
      HttpStatus.INTERNAL_SERVER_ERROR, "internal-error"
  );

  @ExceptionHandler(InvalidParameterException.class)
  public ResponseEntity<Map<String, Object>> handleInvalidParameter(InvalidParameterException ex,
      HttpServletRequest request) {
    return buildError(HttpStatus.BAD_REQUEST, ex, request);
  }

  @ExceptionHandler(PriceDataNotFoundException.class)
  public ResponseEntity<Map<String, Object>> handleNotFound(PriceDataNotFoundException ex,
      HttpServletRequest request) {
    return buildError(HttpStatus.NOT_FOUND, ex, request);
  }

  @ExceptionHandler(TemperatureProviderException.class)
  public ResponseEntity<Map<String, Object>> handleTemperatureProvider(
      TemperatureProviderException ex, HttpServletRequest request) {
    return buildError(ex.status(), ex, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ProblemDetail> handleOther(Exception ex, HttpServletRequest request) {
    HttpStatus status = HttpStatus.INTERNAL_SERVER_ERROR;
    if (ex instanceof ErrorResponse errorResponse) {
      HttpStatus resolved = HttpStatus.resolve(errorResponse.getStatusCode().value());
      if (resolved != null) {
        status = resolved;
      }
    }
    return buildProblem(status, ex, request);
  }

  // Devices parse a bare {"error": "..."} object; keep it free of extra fields.
  private ResponseEntity<Map<String, Object>> buildError(HttpStatus status, Exception ex,
      HttpServletRequest request) {
    logException(status, ex, request);
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", ex.getMessage());
    return ResponseEntity.status(status)
        .contentType(MediaType.APPLICATION_JSON)
        .body(body);
  }

  private ResponseEntity<ProblemDetail> buildProblem(HttpStatus status, Exception ex,
      HttpServletRequest request) {
    logException(status, ex, request);
    String detail = status.is5xxServerError() ? "Unexpected server error" : ex.getMessage();
    ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
    problem.setTitle(status.getReasonPhrase());
    problem.setInstance(URI.create(request.getRequestURI()));
    problem.setType(URI.create("https://docs.day-ahead-price-api.dev/problems/"
        + TYPE_SLUGS.getOrDefault(status, "internal-error")));
    problem.setProperty("path", request.getRequestURI());
    return ResponseEntity.status(status)
        .contentType(MediaType.APPLICATION_PROBLEM_JSON)
        .body(problem);
  }

  private void logException(HttpStatus status, Exception ex, HttpServletRequest request) {
    String errorMessage = ex.getMessage();
    if (errorMessage == null || errorMessage.isBlank()) {
      errorMessage = ex.getClass().getName();
    }
    String uri = RequestLoggingFilter.uriWithQuery(request);
    String clientIp = RequestLoggingFilter.clientIp(request);

    if (status.is5xxServerError()) {
      log.error("Request {} {} from {} failed with status {}: {}",
          request.getMethod(), uri, clientIp, status.value(), errorMessage, ex);
    } else {
      log.warn("Request {} {} from {} returned status {}: {}",
          request.getMethod(), uri, clientIp, status.value(), errorMessage);
    }
  }
}
