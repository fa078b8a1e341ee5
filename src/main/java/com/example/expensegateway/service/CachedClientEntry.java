package com.example.expensegateway.service;

import com.example.expensegateway.adapter.splitwise.SplitwiseClient;
import java.time.Instant;

/**
 * A cached client and the last time it was handed out.
 */
public final class CachedClientEntry {

  private final SplitwiseClient client;
  private final Instant createdAt;
  private volatile Instant lastActivity;

  CachedClientEntry(SplitwiseClient client, Instant now) {
    this.client = client;
    this.createdAt = now;
    this.lastActivity = now;
  }

  public SplitwiseClient client() {
    return client;
  }

  public Instant createdAt() {
    return createdAt;
  }

  public Instant lastActivity() {
    return lastActivity;
  }

  void touch(Instant now) {
    lastActivity = now;
  }
}
