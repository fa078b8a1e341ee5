package com.example.expensegateway.exception;

/**
 * Raised when a backend client is requested while no credential is in effect for the
 * current request.
 */
public class UnauthenticatedException extends RuntimeException {
  public UnauthenticatedException(String message) {
    super(message);
  }
}
