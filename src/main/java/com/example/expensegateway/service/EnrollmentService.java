package com.example.expensegateway.service;

import com.example.expensegateway.adapter.splitwise.SplitwiseOAuthClient;
import com.example.expensegateway.adapter.splitwise.dto.OAuthTokenResponse;
import com.example.expensegateway.domain.entity.EnrollmentResult;
import com.example.expensegateway.domain.entity.UserHandle;
import com.example.expensegateway.domain.entity.UserProfile;
import com.example.expensegateway.exception.OAuth2Exception;
import com.example.expensegateway.properties.ApplicationProperties;
import com.example.expensegateway.store.CredentialStore;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.nimbusds.oauth2.sdk.id.State;
import java.util.Map;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Connects a Splitwise account: authorization redirect, code exchange, profile lookup
 * and enrollment in the credential store.
 *
 * <p>Each authorization request carries a one-time {@code state} that must come back on
 * the callback within the configured TTL.
 */
@Slf4j
@Service
public class EnrollmentService {

  private final SplitwiseOAuthClient oauthClient;
  private final SplitwiseClientCache clientCache;
  private final CredentialStore credentialStore;
  private final ApplicationProperties properties;
  private final Cache<String, Boolean> pendingStates;

  public EnrollmentService(
      SplitwiseOAuthClient oauthClient,
      SplitwiseClientCache clientCache,
      CredentialStore credentialStore,
      ApplicationProperties properties) {
    this.oauthClient = oauthClient;
    this.clientCache = clientCache;
    this.credentialStore = credentialStore;
    this.properties = properties;
    this.pendingStates = Caffeine.newBuilder()
        .expireAfterWrite(properties.splitwise().stateTtl())
        .maximumSize(10_000)
        .build();
  }

  public String generateAuthorizationUrl() {
    State state = new State();
    pendingStates.put(state.getValue(), Boolean.TRUE);
    return oauthClient.authorizationUrl(state.getValue(), redirectUri());
  }

  public EnrollmentResult completeAuthorization(String code, String state) {
    if (code == null || code.isBlank()) {
      throw new OAuth2Exception("Missing authorization code");
    }
    if (state == null || pendingStates.asMap().remove(state) == null) {
      throw new OAuth2Exception("Unknown or expired authorization state");
    }

    OAuthTokenResponse token = oauthClient.exchangeCodeForToken(code, redirectUri());
    UserProfile profile = fetchProfile(token.accessToken());
    UserHandle handle = credentialStore.enroll(token.accessToken(), profile);

    log.info("Connected Splitwise user {} as handle {}", profile.backendUserId(), UserHandle.mask(handle.value()));
    return new EnrollmentResult(
        handle.value(),
        profile.displayName(),
        profile.email(),
        properties.gateway().publicUrl() + "/api?token=" + handle.value());
  }

  private UserProfile fetchProfile(String accessToken) {
    Map<String, Object> response = clientCache.getOrCreate(accessToken).getCurrentUser();
    Object user = response.get("user");
    if (!(user instanceof Map)) {
      return UserProfile.empty();
    }
    Map<?, ?> fields = (Map<?, ?>) user;
    Object id = fields.get("id");
    String name = (Objects.toString(fields.get("first_name"), "") + " "
        + Objects.toString(fields.get("last_name"), "")).trim();
    return new UserProfile(
        id instanceof Number ? ((Number) id).longValue() : null,
        name.isEmpty() ? null : name,
        (String) fields.get("email"));
  }

  private String redirectUri() {
    return properties.gateway().publicUrl() + "/callback";
  }
}
