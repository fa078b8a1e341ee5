package com.example.expensegateway.config;

import com.example.expensegateway.properties.ApplicationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Enforces cross-field rules beyond JSR-303 validation and fails startup with every
 * violation listed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConfigurationValidator implements InitializingBean {

  private static final String ERROR_INVALID_URL = "%s is invalid: %s";
  private static final String ERROR_HTTPS_REQUIRED = "%s must use HTTPS in non-local environments: %s";
  private static final String PROTOCOL_HTTP = "http";
  private static final String PROTOCOL_HTTPS = "https";
  private static final String HOST_LOCALHOST = "localhost";
  private static final String HOST_LOOPBACK = "127.0.0.1";
  private static final String PATH_PREFIX_SLASH = "/";
  private static final String PATH_TRAVERSAL_SEQUENCE = "..";
  private static final String STORE_TYPE_REDIS = "redis";
  private static final int ENCRYPTION_KEY_BYTES = 32;

  private final ApplicationProperties properties;

  @Override
  public void afterPropertiesSet() {
    log.info("Validating application configuration business rules...");
    List<String> errors = validate();

    if (!errors.isEmpty()) {
      String errorMessage = String.format("Configuration validation failed with %d error(s):\n- %s",
                                          errors.size(), String.join("\n- ", errors));
      log.error(errorMessage);
      throw new IllegalStateException(errorMessage);
    }
    log.info("Configuration validated successfully.");
  }

  List<String> validate() {
    List<String> errors = new ArrayList<>();
    validateGatewayConfig(errors);
    validateSplitwiseConfig(errors);
    validateIdentityConfig(errors);
    validateStoreConfig(errors);
    validateHttpConfig(errors);
    return errors;
  }

  private void validateGatewayConfig(List<String> errors) {
    String publicUrl = properties.gateway().publicUrl();
    validateUrl(publicUrl, "Gateway public URL", errors);
    if (publicUrl.endsWith(PATH_PREFIX_SLASH)) {
      errors.add("Gateway public URL must not end with '/': " + publicUrl);
    }
  }

  private void validateSplitwiseConfig(List<String> errors) {
    ApplicationProperties.SplitwiseProperties splitwise = properties.splitwise();
    validateUrl(splitwise.authorizationUri(), "Splitwise authorization URI", errors);
    validateUrl(splitwise.tokenUri(), "Splitwise token URI", errors);
    validateUrl(splitwise.apiBaseUrl(), "Splitwise API base URL", errors);
  }

  private void validateIdentityConfig(List<String> errors) {
    for (String path : properties.identity().publicPaths()) {
      if (!path.startsWith(PATH_PREFIX_SLASH)) {
        errors.add("Public path must start with a '/': " + path);
      }
      if (path.contains(PATH_TRAVERSAL_SEQUENCE)) {
        errors.add("Public path cannot contain path traversal sequence '..': " + path);
      }
      if (PATH_PREFIX_SLASH.equals(path)) {
        errors.add("Public path '/' would exempt every request; the root is already public");
      }
    }
  }

  private void validateStoreConfig(List<String> errors) {
    ApplicationProperties.StoreProperties store = properties.store();
    if (!STORE_TYPE_REDIS.equals(store.type())) {
      return;
    }
    if (properties.redis() == null) {
      errors.add("Redis settings under 'app.redis' are required for the redis credential store.");
    }
    String key = store.encryptionKey();
    if (key == null || key.isBlank()) {
      errors.add("'app.store.encryption-key' is required for the redis credential store.");
      return;
    }
    try {
      if (Base64.getDecoder().decode(key.trim()).length != ENCRYPTION_KEY_BYTES) {
        errors.add("'app.store.encryption-key' must decode to 32 bytes (AES-256).");
      }
    } catch (IllegalArgumentException e) {
      errors.add("'app.store.encryption-key' must be base64 encoded.");
    }
  }

  private void validateHttpConfig(List<String> errors) {
    ApplicationProperties.OkHttpProperties.ClientProperties client = properties.http().client();
    if (client.maxRequests() < client.maxRequestsPerHost()) {
      errors.add("Total max requests must be greater than or equal to max requests per host.");
    }
  }

  private void validateUrl(String url, String fieldName, List<String> errors) {
    URI uri;
    try {
      uri = new URI(url);
    } catch (URISyntaxException e) {
      errors.add(ERROR_INVALID_URL.formatted(fieldName, url));
      return;
    }
    String scheme = uri.getScheme();
    if (uri.getHost() == null || (!PROTOCOL_HTTP.equals(scheme) && !PROTOCOL_HTTPS.equals(scheme))) {
      errors.add(ERROR_INVALID_URL.formatted(fieldName, url));
      return;
    }
    if (PROTOCOL_HTTP.equals(scheme) && !isLocal(uri.getHost())) {
      errors.add(ERROR_HTTPS_REQUIRED.formatted(fieldName, url));
    }
  }

  private boolean isLocal(String host) {
    return HOST_LOCALHOST.equals(host) || HOST_LOOPBACK.equals(host);
  }
}
