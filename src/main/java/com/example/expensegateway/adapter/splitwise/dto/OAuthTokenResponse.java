package com.example.expensegateway.adapter.splitwise.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Splitwise token endpoint response. Access tokens do not expire and no refresh token
 * is issued.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OAuthTokenResponse(
    @JsonProperty("access_token") String accessToken,
    @JsonProperty("token_type") String tokenType
) {
  @Override
  public String toString() {
    return "OAuthTokenResponse[accessToken=<redacted>, tokenType=" + tokenType + "]";
  }
}
