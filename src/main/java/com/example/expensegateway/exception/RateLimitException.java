package com.example.expensegateway.exception;

/**
 * Splitwise answered 429 Too Many Requests.
 */
public class RateLimitException extends BackendApiException {
  public RateLimitException(String responseBody) {
    super("Splitwise rate limit exceeded", 429, responseBody);
  }
}
