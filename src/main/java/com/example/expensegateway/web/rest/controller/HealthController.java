package com.example.expensegateway.web.rest.controller;

import com.example.expensegateway.domain.entity.StoreHealth;
import com.example.expensegateway.service.SplitwiseClientCache;
import com.example.expensegateway.store.CredentialStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

/**
 * Health endpoints return their own status codes and never go through the global error
 * handler.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class HealthController implements HealthAPI {

  private static final double MEMORY_USAGE_CRITICAL_PERCENT = 90.0;
  private static final long STORE_RESPONSE_TIME_WARNING_MS = 250L;
  private static final String STATUS_UP = "UP";
  private static final String STATUS_DOWN = "DOWN";
  private static final String STATUS_LIVE = "LIVE";
  private static final String STATUS_DEAD = "DEAD";

  private final CredentialStore credentialStore;
  private final SplitwiseClientCache clientCache;

  @Override
  public ResponseEntity<Map<String, Object>> health() {
    return ResponseEntity.ok(Map.of(
        "status", STATUS_UP,
        "timestamp", System.currentTimeMillis()
                                   ));
  }

  @Override
  public ResponseEntity<Map<String, Object>> liveness() {
    Runtime runtime = Runtime.getRuntime();
    long usedMemory = runtime.totalMemory() - runtime.freeMemory();
    double memoryUsagePercent = (double) usedMemory / runtime.maxMemory() * 100;

    Map<String, Object> response = new HashMap<>();
    response.put("memoryUsagePercent", String.format("%.2f", memoryUsagePercent));

    if (memoryUsagePercent < MEMORY_USAGE_CRITICAL_PERCENT) {
      response.put("status", STATUS_LIVE);
      return ResponseEntity.ok(response);
    }

    log.warn("Liveness check failed: memory usage {}%", memoryUsagePercent);
    response.put("status", STATUS_DEAD);
    return ResponseEntity.status(503).body(response);
  }

  @Override
  public ResponseEntity<Map<String, Object>> readiness() {
    StoreHealth storeHealth;
    try {
      storeHealth = credentialStore.checkHealth();
    } catch (Exception e) {
      log.error("Credential store health check failed", e);
      storeHealth = StoreHealth.unhealthy("unknown", e.getMessage());
    }

    Map<String, Object> storeStatus = new HashMap<>();
    storeStatus.put("backend", storeHealth.backend());
    storeStatus.put("status", storeHealth.healthy() ? STATUS_UP : STATUS_DOWN);
    storeStatus.put("responseTimeMs", storeHealth.responseTimeMs());
    if (storeHealth.error() != null) {
      storeStatus.put("error", storeHealth.error());
    }

    boolean isReady = storeHealth.healthy() && !clientCache.isClosed();
    if (storeHealth.responseTimeMs() > STORE_RESPONSE_TIME_WARNING_MS) {
      log.warn("Credential store is slow: {}ms", storeHealth.responseTimeMs());
    }
    if (!isReady) {
      log.warn("Readiness check failed: store healthy={}, client cache closed={}",
               storeHealth.healthy(), clientCache.isClosed());
    }

    Map<String, Object> status = new HashMap<>();
    status.put("credentialStore", storeStatus);
    status.put("cachedClients", clientCache.size());
    status.put("ready", isReady);
    status.put("timestamp", System.currentTimeMillis());

    return ResponseEntity.status(isReady ? 200 : 503).body(status);
  }
}
