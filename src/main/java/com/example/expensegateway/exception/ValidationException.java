package com.example.expensegateway.exception;

import lombok.Getter;

/**
 * Request validation failure, surfaced to the caller verbatim.
 */
@Getter
public class ValidationException extends RuntimeException {

  private final String field;

  public ValidationException(String message) {
    this(message, null);
  }

  public ValidationException(String message, String field) {
    super(message);
    this.field = field;
  }
}
