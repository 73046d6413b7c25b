package com.tasks.api.infra;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.ResponseEntity;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Keeps HTTP failures outside the task routes in the same JSON shape as the envelopes.
 */
@Order(Ordered.LOWEST_PRECEDENCE)
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler({NoResourceFoundException.class, HttpRequestMethodNotSupportedException.class})
  public ResponseEntity<ErrorResponse> routeNotFound(Exception ex) {
    return withCors(ResponseEntity.status(404))
        .body(ErrorResponse.of(ErrorResponse.ROUTE_NOT_FOUND, "Route not found."));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> unknown(Exception ex) {
    log.error("Unhandled HTTP failure: {}", ex.getMessage());
    return withCors(ResponseEntity.status(500))
        .body(ErrorResponse.of(ErrorResponse.INTERNAL_ERROR, "Internal error: " + ex.getMessage()));
  }

  private static ResponseEntity.BodyBuilder withCors(ResponseEntity.BodyBuilder builder) {
    return builder.header(ResponseBuilder.ALLOW_ORIGIN, "*");
  }
}
