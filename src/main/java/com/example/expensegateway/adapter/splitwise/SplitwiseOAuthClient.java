package com.example.expensegateway.adapter.splitwise;

import com.example.expensegateway.adapter.splitwise.dto.OAuthTokenResponse;
import com.example.expensegateway.exception.OAuth2Exception;
import com.example.expensegateway.exception.TokenExchangeException;
import com.example.expensegateway.properties.ApplicationProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import java.io.IOException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.FormBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Splitwise OAuth 2.0 authorization-code endpoints.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SplitwiseOAuthClient {

  private final ApplicationProperties properties;
  private final OkHttpClient defaultOkHttpClient;
  private final ObjectMapper objectMapper;

  public String authorizationUrl(String state, String redirectUri) {
    return UriComponentsBuilder.fromHttpUrl(properties.splitwise().authorizationUri())
        .queryParam("client_id", properties.splitwise().clientId())
        .queryParam("response_type", "code")
        .queryParam("redirect_uri", redirectUri)
        .queryParam("state", state)
        .encode()
        .build()
        .toUriString();
  }

  @CircuitBreaker(name = "splitwiseOAuth", fallbackMethod = "exchangeCodeFallback")
  public OAuthTokenResponse exchangeCodeForToken(String code, String redirectUri) {
    log.debug("Exchanging authorization code for a Splitwise access token");

    FormBody formBody = new FormBody.Builder()
        .add("grant_type", "authorization_code")
        .add("code", code)
        .add("client_id", properties.splitwise().clientId())
        .add("client_secret", properties.splitwise().clientSecret())
        .add("redirect_uri", redirectUri)
        .build();

    Request request = new Request.Builder()
        .url(properties.splitwise().tokenUri())
        .header("Accept", "application/json")
        .post(formBody)
        .build();

    try (Response response = defaultOkHttpClient.newCall(request).execute()) {
      ResponseBody body = response.body();
      if (!response.isSuccessful() || body == null) {
        throw new TokenExchangeException("Token exchange failed with Splitwise, status: " + response.code());
      }
      OAuthTokenResponse token = objectMapper.readValue(body.string(), OAuthTokenResponse.class);
      if (token.accessToken() == null || token.accessToken().isBlank()) {
        throw new TokenExchangeException("Splitwise token response did not contain an access token");
      }
      return token;

    } catch (IOException e) {
      throw new TokenExchangeException("Token exchange failed due to network error", e);
    }
  }

  public OAuthTokenResponse exchangeCodeFallback(String code, String redirectUri, Throwable ex) {
    if (ex instanceof OAuth2Exception) {
      throw (OAuth2Exception) ex;
    }
    log.error("Splitwise OAuth circuit breaker is open during token exchange.", ex);
    throw new TokenExchangeException("Splitwise is temporarily unavailable.", ex);
  }
}
