package com.tasks.api.infra;

public record ErrorResponse(String code, String message) {

  public static final String VALIDATION_ERROR = "VALIDATION_ERROR";
  public static final String NOT_FOUND = "NOT_FOUND";
  public static final String ROUTE_NOT_FOUND = "ROUTE_NOT_FOUND";
  public static final String STORAGE_ERROR = "STORAGE_ERROR";
  public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

  public static ErrorResponse of(String code, String message) {
    return new ErrorResponse(code, message);
  }
}
