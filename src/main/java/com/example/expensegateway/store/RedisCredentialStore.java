package com.example.expensegateway.store;

import com.example.expensegateway.domain.entity.CredentialRecord;
import com.example.expensegateway.domain.entity.StoreHealth;
import com.example.expensegateway.domain.entity.UserHandle;
import com.example.expensegateway.domain.entity.UserProfile;
import com.example.expensegateway.exception.CredentialStoreException;
import com.example.expensegateway.exception.EncryptionException;
import com.example.expensegateway.properties.ApplicationProperties;
import com.example.expensegateway.service.EncryptionService;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Credential store backed by one Redis hash per handle. Durability comes from the
 * Redis server's AOF/RDB persistence.
 *
 * <p>The bearer credential is encrypted before it is written. A short-lived local cache
 * sits in front of {@link #resolve(String)} and is invalidated on revoke.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "app.store", name = "type", havingValue = "redis", matchIfMissing = true)
public class RedisCredentialStore implements CredentialStore {

  public static final String KEY_PREFIX = "credential:";
  public static final String FIELD_CREDENTIAL = "bearerCredential";
  public static final String FIELD_BACKEND_USER_ID = "backendUserId";
  public static final String FIELD_DISPLAY_NAME = "displayName";
  public static final String FIELD_EMAIL = "email";
  public static final String FIELD_CREATED_AT = "createdAt";
  private static final String BACKEND = "redis";

  private final StringRedisTemplate redisTemplate;
  private final EncryptionService encryptionService;
  private final Cache<String, String> credentialCache;
  private final Clock clock;
  private final AtomicLong revocations = new AtomicLong();

  @Autowired
  public RedisCredentialStore(
      StringRedisTemplate redisTemplate,
      EncryptionService encryptionService,
      ApplicationProperties properties) {
    this(redisTemplate, encryptionService, properties, Clock.systemUTC());
  }

  RedisCredentialStore(
      StringRedisTemplate redisTemplate,
      EncryptionService encryptionService,
      ApplicationProperties properties,
      Clock clock) {
    this.redisTemplate = redisTemplate;
    this.encryptionService = encryptionService;
    this.clock = clock;
    this.credentialCache = Caffeine.newBuilder()
        .maximumSize(properties.store().localCacheMaxSize())
        .expireAfterWrite(properties.store().localCacheTtl())
        .build();
  }

  @Override
  public UserHandle enroll(String bearerCredential, UserProfile profile) {
    if (bearerCredential == null || bearerCredential.isBlank()) {
      throw new IllegalArgumentException("bearerCredential must not be blank");
    }
    Instant createdAt = clock.instant();
    UserProfile p = profile == null ? UserProfile.empty() : profile;

    Map<String, String> fields = new HashMap<>();
    try {
      fields.put(FIELD_CREDENTIAL, encryptionService.encrypt(bearerCredential));
    } catch (EncryptionException e) {
      throw new CredentialStoreException("Failed to encrypt credential", e);
    }
    if (p.backendUserId() != null) {
      fields.put(FIELD_BACKEND_USER_ID, String.valueOf(p.backendUserId()));
    }
    if (p.displayName() != null) {
      fields.put(FIELD_DISPLAY_NAME, p.displayName());
    }
    if (p.email() != null) {
      fields.put(FIELD_EMAIL, p.email());
    }

    HashOperations<String, String, String> hashOps = redisTemplate.opsForHash();
    UserHandle handle = UserHandle.generate();
    try {
      // HSETNX on createdAt claims the key atomically
      while (!Boolean.TRUE.equals(hashOps.putIfAbsent(key(handle.value()), FIELD_CREATED_AT,
                                                       String.valueOf(createdAt.toEpochMilli())))) {
        log.warn("Handle collision on {}, regenerating", UserHandle.mask(handle.value()));
        handle = UserHandle.generate();
      }
    } catch (DataAccessException e) {
      throw new CredentialStoreException("Failed to enroll credential", e);
    }

    try {
      hashOps.putAll(key(handle.value()), fields);
    } catch (DataAccessException e) {
      CredentialStoreException failure = new CredentialStoreException("Failed to enroll credential", e);
      releaseClaim(handle.value(), failure);
      throw failure;
    }

    log.info("Enrolled user handle {}", UserHandle.mask(handle.value()));
    return handle;
  }

  /**
   * Removes a key whose credential write failed, so no half-written record is left behind.
   */
  private void releaseClaim(String handle, CredentialStoreException failure) {
    try {
      redisTemplate.delete(key(handle));
    } catch (DataAccessException cleanup) {
      log.warn("Could not release claimed handle {}", UserHandle.mask(handle), cleanup);
      failure.addSuppressed(cleanup);
    }
  }

  @Override
  public Optional<String> resolve(String handle) {
    if (!UserHandle.isWellFormed(handle)) {
      return Optional.empty();
    }
    String cached = credentialCache.getIfPresent(handle);
    if (cached != null) {
      return Optional.of(cached);
    }
    long generation = revocations.get();
    Optional<String> credential = find(handle).map(CredentialRecord::bearerCredential);
    credential.ifPresent(value -> {
      credentialCache.put(handle, value);
      // A revoke that ran since the read must not be undone by this put
      if (revocations.get() != generation) {
        credentialCache.invalidate(handle);
      }
    });
    return credential;
  }

  @Override
  public Optional<CredentialRecord> find(String handle) {
    if (!UserHandle.isWellFormed(handle)) {
      return Optional.empty();
    }
    Map<String, String> fields;
    try {
      HashOperations<String, String, String> hashOps = redisTemplate.opsForHash();
      fields = hashOps.entries(key(handle));
    } catch (DataAccessException e) {
      throw new CredentialStoreException("Failed to read credential record", e);
    }
    // A claimed key without its credential is an enrollment still in flight
    if (fields == null || fields.get(FIELD_CREDENTIAL) == null) {
      return Optional.empty();
    }

    String credential;
    try {
      credential = encryptionService.decrypt(fields.get(FIELD_CREDENTIAL));
    } catch (EncryptionException e) {
      throw new CredentialStoreException("Stored credential could not be decrypted", e);
    }
    String userId = fields.get(FIELD_BACKEND_USER_ID);
    return Optional.of(new CredentialRecord(
        new UserHandle(handle),
        credential,
        userId == null ? null : Long.valueOf(userId),
        fields.get(FIELD_DISPLAY_NAME),
        fields.get(FIELD_EMAIL),
        Instant.ofEpochMilli(Long.parseLong(fields.get(FIELD_CREATED_AT)))));
  }

  @Override
  public boolean revoke(String handle) {
    if (!UserHandle.isWellFormed(handle)) {
      return false;
    }
    try {
      boolean removed = Boolean.TRUE.equals(redisTemplate.delete(key(handle)));
      if (removed) {
        log.info("Revoked user handle {}", UserHandle.mask(handle));
      }
      return removed;
    } catch (DataAccessException e) {
      throw new CredentialStoreException("Failed to revoke credential", e);
    } finally {
      revocations.incrementAndGet();
      credentialCache.invalidate(handle);
    }
  }

  @Override
  public StoreHealth checkHealth() {
    long startTime = System.currentTimeMillis();
    try {
      String pingResponse = redisTemplate.execute((RedisCallback<String>) connection -> connection.ping());
      if (!"PONG".equals(pingResponse)) {
        return StoreHealth.unhealthy(BACKEND, "Invalid PING response: " + pingResponse);
      }
      Properties info = redisTemplate.execute((RedisCallback<Properties>) connection -> connection.serverCommands().info("server"));
      String version = info == null ? "unknown" : info.getProperty("redis_version", "unknown");
      return StoreHealth.healthy(BACKEND, System.currentTimeMillis() - startTime, version);
    } catch (Exception e) {
      log.error("Redis health check failed", e);
      return StoreHealth.unhealthy(BACKEND, e.getMessage());
    }
  }

  private static String key(String handle) {
    return KEY_PREFIX + handle;
  }
}
