package com.example.expensegateway.config;

import com.example.expensegateway.properties.ApplicationProperties;
import lombok.RequiredArgsConstructor;
import okhttp3.ConnectionPool;
import okhttp3.Dispatcher;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Arrays;
import java.util.concurrent.TimeUnit;

/**
 * Shared connection pool and dispatcher for every Splitwise client, so per-user clients
 * cost an interceptor and not a pool of their own.
 *
 * <p>Connection-level retry is left to OkHttp ({@code retryOnConnectionFailure}); it is
 * unrelated to the expense retry done by the coordinator.
 */
@Configuration(proxyBeanMethods = false)
@RequiredArgsConstructor
public class HttpClientConfig {

  private final ApplicationProperties properties;

  @Bean
  public ConnectionPool sharedConnectionPool() {
    ApplicationProperties.OkHttpProperties.ClientProperties client = properties.http().client();
    return new ConnectionPool(client.maxIdleConnections(), client.keepAliveDurationMinutes(), TimeUnit.MINUTES);
  }

  @Bean
  public Dispatcher sharedDispatcher() {
    ApplicationProperties.OkHttpProperties.ClientProperties client = properties.http().client();
    Dispatcher dispatcher = new Dispatcher();
    dispatcher.setMaxRequests(client.maxRequests());
    dispatcher.setMaxRequestsPerHost(client.maxRequestsPerHost());
    return dispatcher;
  }

  /**
   * Base client for the OAuth exchange and for deriving per-credential clients
   */
  @Bean
  public OkHttpClient defaultOkHttpClient(ConnectionPool connectionPool, Dispatcher dispatcher) {
    ApplicationProperties.OkHttpProperties.ClientProperties client = properties.http().client();
    return new OkHttpClient.Builder()
        .connectionPool(connectionPool)
        .dispatcher(dispatcher)
        .protocols(Arrays.asList(Protocol.HTTP_2, Protocol.HTTP_1_1))
        .connectTimeout(client.connectTimeout())
        .readTimeout(client.readTimeout())
        .writeTimeout(client.readTimeout())
        .retryOnConnectionFailure(true)
        .followRedirects(false)
        .followSslRedirects(false)
        .build();
  }
}
