package com.example.expensegateway.web.rest.errors;

import com.example.expensegateway.exception.*;
import com.example.expensegateway.properties.ApplicationProperties;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.validation.FieldError;
import org.springframework.validation.ObjectError;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Global Error Handler
 *
 * The one place where typed failures get their HTTP status and human-readable wording.
 * Bodies never include credentials or handles.
 */
@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class GlobalErrorHandler {

  private static final int MAX_BACKEND_DETAIL_LENGTH = 500;

  private final ApplicationProperties properties;

  @ExceptionHandler(UnauthenticatedException.class)
  public ResponseEntity<Map<String, Object>> handleUnauthenticated(
      UnauthenticatedException ex, WebRequest request) {
    log.debug("Unauthenticated request: {}", ex.getMessage());

    String message = ex.getMessage() + ". Connect your Splitwise account at "
        + properties.gateway().publicUrl() + "/authorize and pass the returned token as ?token=...";
    return respond(HttpStatus.UNAUTHORIZED, "unauthenticated", message, request);
  }

  @ExceptionHandler(CredentialStoreException.class)
  public ResponseEntity<Map<String, Object>> handleCredentialStore(
      CredentialStoreException ex, WebRequest request) {
    log.error("Credential store error", ex);
    return respond(HttpStatus.SERVICE_UNAVAILABLE, "credential_store_unavailable",
                   "Credential store temporarily unavailable, please retry", request);
  }

  @ExceptionHandler(FriendListSyncException.class)
  public ResponseEntity<Map<String, Object>> handleFriendListSync(
      FriendListSyncException ex, WebRequest request) {
    log.warn("Friend list sync failure: {}", ex.getMessage());

    String message = ex.getMessage() + ". Please re-connect your Splitwise account to fix it: "
        + properties.gateway().publicUrl() + "/authorize";
    return respond(HttpStatus.BAD_GATEWAY, "friend_list_sync", message, request);
  }

  @ExceptionHandler(RateLimitException.class)
  public ResponseEntity<Map<String, Object>> handleRateLimit(
      RateLimitException ex, WebRequest request) {
    log.warn("Splitwise rate limit reached");
    return respond(HttpStatus.TOO_MANY_REQUESTS, "rate_limited",
                   "Splitwise rate limit exceeded, please retry later", request);
  }

  @ExceptionHandler(BackendApiException.class)
  public ResponseEntity<Map<String, Object>> handleBackendApi(
      BackendApiException ex, WebRequest request) {
    log.warn("Splitwise API error (status {}): {}", ex.getStatusCode(), ex.getMessage());

    String message;
    if (ex.getStatusCode() == 0) {
      message = "Splitwise could not be reached: " + ex.getMessage();
    } else {
      String detail = ex.getResponseBody() == null ? "" : truncate(ex.getResponseBody());
      message = "Splitwise returned status " + ex.getStatusCode() + (detail.isEmpty() ? "" : ": " + detail);
    }
    return respond(HttpStatus.BAD_GATEWAY, "backend_error", message, request);
  }

  @ExceptionHandler(TokenExchangeException.class)
  public ResponseEntity<Map<String, Object>> handleTokenExchange(
      TokenExchangeException ex, WebRequest request) {
    log.error("Splitwise token exchange failed", ex);
    return respond(HttpStatus.BAD_GATEWAY, "token_exchange_failed", ex.getMessage(), request);
  }

  @ExceptionHandler(OAuth2Exception.class)
  public ResponseEntity<Map<String, Object>> handleOAuth2Exception(
      OAuth2Exception ex, WebRequest request) {
    log.warn("OAuth2 error: {}", ex.getMessage());
    return respond(HttpStatus.BAD_REQUEST, "invalid_request", ex.getMessage(), request);
  }

  @ExceptionHandler(ValidationException.class)
  public ResponseEntity<Map<String, Object>> handleValidation(
      ValidationException ex, WebRequest request) {
    return respond(HttpStatus.BAD_REQUEST, "validation_error", ex.getMessage(), request);
  }

  @ExceptionHandler(BindException.class)
  public ResponseEntity<Map<String, Object>> handleBindException(
      BindException ex, WebRequest request) {

    String errors = ex.getBindingResult().getAllErrors().stream()
        .map(this::describe)
        .collect(Collectors.joining(", "));

    return respond(HttpStatus.BAD_REQUEST, "validation_error", errors, request);
  }

  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<Map<String, Object>> handleConstraintViolation(
      ConstraintViolationException ex, WebRequest request) {

    String errors = ex.getConstraintViolations().stream()
        .map(ConstraintViolation::getMessage)
        .collect(Collectors.joining(", "));

    return respond(HttpStatus.BAD_REQUEST, "validation_error", errors, request);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<Map<String, Object>> handleUnreadableBody(
      HttpMessageNotReadableException ex, WebRequest request) {
    return respond(HttpStatus.BAD_REQUEST, "malformed_request", "Request body is missing or malformed", request);
  }

  @ExceptionHandler(MissingServletRequestParameterException.class)
  public ResponseEntity<Map<String, Object>> handleMissingParams(
      MissingServletRequestParameterException ex, WebRequest request) {
    return respond(HttpStatus.BAD_REQUEST, "missing_parameter",
                   String.format("Missing required parameter: %s", ex.getParameterName()), request);
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<Map<String, Object>> handleTypeMismatch(
      MethodArgumentTypeMismatchException ex, WebRequest request) {
    return respond(HttpStatus.BAD_REQUEST, "invalid_parameter",
                   String.format("Invalid value for parameter: %s", ex.getName()), request);
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ResponseEntity<Map<String, Object>> handleMethodNotSupported(
      HttpRequestMethodNotSupportedException ex, WebRequest request) {
    return respond(HttpStatus.METHOD_NOT_ALLOWED, "method_not_allowed",
                   String.format("Method %s not supported", ex.getMethod()), request);
  }

  @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
  public ResponseEntity<Map<String, Object>> handleMediaTypeNotSupported(
      HttpMediaTypeNotSupportedException ex, WebRequest request) {
    return respond(HttpStatus.UNSUPPORTED_MEDIA_TYPE, "unsupported_media_type",
                   "Content type not supported, use application/json", request);
  }

  @ExceptionHandler(NoResourceFoundException.class)
  public ResponseEntity<Map<String, Object>> handleNotFound(
      NoResourceFoundException ex, WebRequest request) {
    return respond(HttpStatus.NOT_FOUND, "not_found", "No such endpoint", request);
  }

  @ExceptionHandler(EncryptionException.class)
  public ResponseEntity<Map<String, Object>> handleEncryptionException(
      EncryptionException ex, WebRequest request) {
    log.error("Encryption error", ex);
    return respond(HttpStatus.INTERNAL_SERVER_ERROR, "encryption_error",
                   "An error occurred processing your request", request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, Object>> handleGenericException(
      Exception ex, WebRequest request) {
    log.error("Unexpected error", ex);
    return respond(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error",
                   "An error occurred processing your request", request);
  }

  private ResponseEntity<Map<String, Object>> respond(
      HttpStatus status, String error, String message, WebRequest request) {
    return new ResponseEntity<>(createErrorBody(status, error, message, request), status);
  }

  private Map<String, Object> createErrorBody(
      HttpStatus status, String error, String message, WebRequest request) {

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("timestamp", Instant.now());
    body.put("status", status.value());
    body.put("error", error);
    body.put("message", message);
    body.put("path", extractPath(request));

    return body;
  }

  private String describe(ObjectError error) {
    if (error instanceof FieldError) {
      FieldError fieldError = (FieldError) error;
      return fieldError.getField() + ": " + fieldError.getDefaultMessage();
    }
    return error.getDefaultMessage();
  }

  // Query string is dropped so the handle never echoes back
  private String extractPath(WebRequest request) {
    String description = request.getDescription(false);
    return description.replace("uri=", "");
  }

  private String truncate(String text) {
    return text.length() <= MAX_BACKEND_DETAIL_LENGTH ? text : text.substring(0, MAX_BACKEND_DETAIL_LENGTH) + "...";
  }
}
