package com.example.expensegateway.exception;

import lombok.Getter;

/**
 * Error reported by the Splitwise API, or a transport failure talking to it.
 * A status code of {@code 0} means no HTTP response was received.
 */
@Getter
public class BackendApiException extends RuntimeException {

  private final int statusCode;
  private final String responseBody;

  public BackendApiException(String message, int statusCode, String responseBody) {
    super(message);
    this.statusCode = statusCode;
    this.responseBody = responseBody;
  }

  public BackendApiException(String message, Throwable cause) {
    super(message, cause);
    this.statusCode = 0;
    this.responseBody = null;
  }

  /**
   * Message and response body combined, for callers that classify errors by their text.
   */
  public String getErrorText() {
    return responseBody == null ? String.valueOf(getMessage()) : getMessage() + " " + responseBody;
  }
}
