package com.example.expensegateway.service;

import com.example.expensegateway.adapter.splitwise.SplitwiseClient;
import com.example.expensegateway.adapter.splitwise.SplitwiseClientFactory;
import com.example.expensegateway.exception.UnauthenticatedException;
import com.example.expensegateway.properties.ApplicationProperties;
import com.example.expensegateway.security.context.CredentialContext;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Keeps one backend client per bearer credential.
 *
 * <p>Construction is single-flighted per credential: concurrent first requests for the
 * same credential build exactly one client and all receive it. Distinct credentials do
 * not block each other.
 *
 * <p>Only explicit teardown ({@link #evict} and {@link #closeAll}) closes a client. Entries
 * dropped for idleness or size are forgotten without closing, because a request that
 * already holds the client may still be using it.
 */
@Slf4j
@Service
public class SplitwiseClientCache {

  private final SplitwiseClientFactory clientFactory;
  private final Cache<String, CachedClientEntry> clients;
  private final Clock clock;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  @Autowired
  public SplitwiseClientCache(SplitwiseClientFactory clientFactory, ApplicationProperties properties) {
    this(clientFactory,
         properties.clientCache().idleTimeout(),
         properties.clientCache().maxSize(),
         Clock.systemUTC());
  }

  SplitwiseClientCache(SplitwiseClientFactory clientFactory, Duration idleTimeout, long maxSize, Clock clock) {
    this.clientFactory = clientFactory;
    this.clock = clock;
    this.clients = Caffeine.newBuilder()
        .expireAfterAccess(idleTimeout)
        .maximumSize(maxSize)
        // Close on the removing thread so closeAll() has finished when it returns
        .executor(Runnable::run)
        .removalListener((String key, CachedClientEntry entry, RemovalCause cause) -> onRemoval(entry, cause))
        .build();
  }

  /**
   * Returns the client for this credential, building it on first use.
   *
   * @throws IllegalStateException after {@link #closeAll()}
   */
  public SplitwiseClient getOrCreate(String bearerCredential) {
    if (closed.get()) {
      throw new IllegalStateException("Client cache is closed");
    }
    if (bearerCredential == null || bearerCredential.isBlank()) {
      throw new IllegalArgumentException("bearerCredential must not be blank");
    }
    CachedClientEntry entry = clients.get(bearerCredential, key -> {
      log.debug("Building Splitwise client for a new credential");
      return new CachedClientEntry(clientFactory.create(key), clock.instant());
    });
    entry.touch(clock.instant());
    return entry.client();
  }

  /**
   * Client for the credential of the request being served.
   *
   * @throws UnauthenticatedException when no credential is in effect
   */
  public SplitwiseClient currentClient() {
    String credential = CredentialContext.get()
        .filter(value -> !value.isBlank())
        .orElseThrow(() -> new UnauthenticatedException("No Splitwise account is connected for this request"));
    return getOrCreate(credential);
  }

  /**
   * Drops and closes the client for one credential, if cached.
   */
  public void evict(String bearerCredential) {
    if (bearerCredential != null) {
      clients.invalidate(bearerCredential);
    }
  }

  public Optional<CachedClientEntry> peek(String bearerCredential) {
    return Optional.ofNullable(clients.getIfPresent(bearerCredential));
  }

  public long size() {
    clients.cleanUp();
    return clients.estimatedSize();
  }

  public boolean isClosed() {
    return closed.get();
  }

  /**
   * Closes every cached client once. Failures closing one client are logged and do not
   * stop the others. Calling again does nothing.
   */
  @PreDestroy
  public void closeAll() {
    if (!closed.compareAndSet(false, true)) {
      log.debug("Client cache already closed");
      return;
    }
    long count = clients.estimatedSize();
    clients.invalidateAll();
    clients.cleanUp();
    log.info("Closed {} cached Splitwise client(s)", count);
  }

  private void onRemoval(CachedClientEntry entry, RemovalCause cause) {
    if (entry == null) {
      return;
    }
    if (cause.wasEvicted()) {
      log.debug("Dropped idle Splitwise client ({})", cause);
      return;
    }
    try {
      entry.client().close();
      log.debug("Closed Splitwise client ({})", cause);
    } catch (RuntimeException e) {
      log.warn("Failed to close Splitwise client ({})", cause, e);
    }
  }
}
