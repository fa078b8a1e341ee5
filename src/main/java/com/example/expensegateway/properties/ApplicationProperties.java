package com.example.expensegateway.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.*;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Centralized configuration properties for the Expense Gateway.
 * Uses records for immutability and type safety.
 */
@Validated
@ConfigurationProperties(prefix = "app")
public record ApplicationProperties(
    @NotNull @Valid GatewayProperties gateway,
    @NotNull @Valid SplitwiseProperties splitwise,
    @NotNull @Valid @DefaultValue IdentityProperties identity,
    @NotNull @Valid @DefaultValue StoreProperties store,
    @NotNull @Valid @DefaultValue ClientCacheProperties clientCache,
    @NotNull @Valid @DefaultValue OkHttpProperties http,
    @Valid @DefaultValue RedisProperties redis,
    @NotNull @Valid @DefaultValue AsyncProperties async
) {

  /**
   * Externally reachable base URL of this gateway, used for the OAuth redirect and
   * the connection links handed to users.
   */
  public record GatewayProperties(@NotBlank String publicUrl) {}

  /**
   * Splitwise OAuth2 application and API endpoints
   */
  public record SplitwiseProperties(
      @NotBlank String clientId,
      @NotBlank String clientSecret,
      @DefaultValue("https://secure.splitwise.com/oauth/authorize") @NotBlank String authorizationUri,
      @DefaultValue("https://secure.splitwise.com/oauth/token") @NotBlank String tokenUri,
      @DefaultValue("https://secure.splitwise.com/api/v3.0") @NotBlank String apiBaseUrl,
      @DefaultValue("10m") @DurationUnit(ChronoUnit.MINUTES) Duration stateTtl
  ) {}

  /**
   * Path prefixes that never carry an identity
   */
  public record IdentityProperties(
      @DefaultValue({"/authorize", "/callback"}) List<String> publicPaths
  ) {}

  /**
   * Credential store backend
   */
  public record StoreProperties(
      @DefaultValue("redis") @Pattern(regexp = "redis|memory") String type,
      String encryptionKey,
      @DefaultValue("60s") @DurationUnit(ChronoUnit.SECONDS) Duration localCacheTtl,
      @DefaultValue("10000") @Positive long localCacheMaxSize
  ) {}

  /**
   * Per-credential backend client cache
   */
  public record ClientCacheProperties(
      @DefaultValue("24h") @DurationUnit(ChronoUnit.HOURS) Duration idleTimeout,
      @DefaultValue("10000") @Positive long maxSize
  ) {}

  /**
   * OkHttp client configuration
   */
  public record OkHttpProperties(
      @NotNull @Valid @DefaultValue ClientProperties client
  ) {
    public record ClientProperties(
        @DefaultValue("20") @Positive int maxIdleConnections,
        @DefaultValue("5") @Positive int keepAliveDurationMinutes,
        @DefaultValue("100") @Positive int maxRequests,
        @DefaultValue("20") @Positive int maxRequestsPerHost,
        @DefaultValue("5s") @DurationUnit(ChronoUnit.SECONDS) Duration connectTimeout,
        @DefaultValue("30s") @DurationUnit(ChronoUnit.SECONDS) Duration readTimeout
    ) {}
  }

  /**
   * Redis configuration, only read when the store type is redis
   */
  public record RedisProperties(
      @DefaultValue("localhost") @NotBlank String host,
      @DefaultValue("6379") @Min(1) @Max(65535) int port,
      String password,
      @DefaultValue("false") boolean ssl,
      @DefaultValue("2s") @DurationUnit(ChronoUnit.SECONDS) Duration timeout,
      @NotNull @Valid @DefaultValue PoolProperties pool
  ) {
    public record PoolProperties(
        @DefaultValue("16") @Positive int maxActive,
        @DefaultValue("8") @Positive int maxIdle,
        @DefaultValue("2") @PositiveOrZero int minIdle,
        @DefaultValue("2s") @DurationUnit(ChronoUnit.SECONDS) Duration maxWait,
        @DefaultValue("30s") @DurationUnit(ChronoUnit.SECONDS) Duration timeBetweenEvictionRuns
    ) {}
  }

  /**
   * Executor for fan-out work started from a request
   */
  public record AsyncProperties(
      @DefaultValue("8") @Positive int corePoolSize,
      @DefaultValue("32") @Positive int maxPoolSize,
      @DefaultValue("200") @PositiveOrZero int queueCapacity
  ) {}
}
