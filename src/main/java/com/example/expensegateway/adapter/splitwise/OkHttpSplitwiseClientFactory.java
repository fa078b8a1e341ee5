package com.example.expensegateway.adapter.splitwise;

import com.example.expensegateway.properties.ApplicationProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.stereotype.Component;

/**
 * Derives per-credential clients from the shared OkHttp client, so every handle shares
 * one connection pool and dispatcher.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OkHttpSplitwiseClientFactory implements SplitwiseClientFactory {

  private final OkHttpClient defaultOkHttpClient;
  private final ObjectMapper objectMapper;
  private final ApplicationProperties properties;

  @Override
  public SplitwiseClient create(String bearerCredential) {
    if (bearerCredential == null || bearerCredential.isBlank()) {
      throw new IllegalArgumentException("bearerCredential must not be blank");
    }
    OkHttpClient authenticated = defaultOkHttpClient.newBuilder()
        .addInterceptor(chain -> chain.proceed(chain.request().newBuilder()
                                                   .header("Authorization", "Bearer " + bearerCredential)
                                                   .build()))
        .build();
    log.debug("Creating Splitwise client");
    return new OkHttpSplitwiseClient(authenticated, objectMapper, properties.splitwise().apiBaseUrl());
  }
}
