package com.example.expensegateway.exception;

/**
 * Splitwise did not issue an access token for an authorization code. Reported as an
 * upstream failure, unlike a malformed callback.
 */
public class TokenExchangeException extends OAuth2Exception {
  public TokenExchangeException(String message) {
    super(message);
  }

  public TokenExchangeException(String message, Throwable cause) {
    super(message, cause);
  }
}
