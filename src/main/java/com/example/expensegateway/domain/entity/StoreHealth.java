package com.example.expensegateway.domain.entity;

/**
 * Credential store readiness as reported to the health endpoints.
 */
public record StoreHealth(
    String backend,
    boolean healthy,
    long responseTimeMs,
    String version,
    String error
) {
  public static StoreHealth healthy(String backend, long responseTimeMs, String version) {
    return new StoreHealth(backend, true, responseTimeMs, version, null);
  }

  public static StoreHealth unhealthy(String backend, String error) {
    return new StoreHealth(backend, false, 0, null, error);
  }
}
