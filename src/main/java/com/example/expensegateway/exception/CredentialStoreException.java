package com.example.expensegateway.exception;

/**
 * Credential store failure. Raised when the persistence layer cannot be reached, never for an unknown handle.
 */
public class CredentialStoreException extends RuntimeException {
  public CredentialStoreException(String message) {
    super(message);
  }

  public CredentialStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
