package com.example.expensegateway.store;

import com.example.expensegateway.domain.entity.CredentialRecord;
import com.example.expensegateway.domain.entity.StoreHealth;
import com.example.expensegateway.domain.entity.UserHandle;
import com.example.expensegateway.domain.entity.UserProfile;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Process-local credential store for development and tests. Records do not survive a
 * restart.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "app.store", name = "type", havingValue = "memory")
public class InMemoryCredentialStore implements CredentialStore {

  private static final String BACKEND = "memory";

  private final Map<String, CredentialRecord> records = new ConcurrentHashMap<>();
  private final Clock clock;

  @Autowired
  public InMemoryCredentialStore() {
    this(Clock.systemUTC());
  }

  InMemoryCredentialStore(Clock clock) {
    this.clock = clock;
    log.warn("Using in-memory credential store; enrolled users must reconnect after a restart");
  }

  @Override
  public UserHandle enroll(String bearerCredential, UserProfile profile) {
    while (true) {
      UserHandle handle = UserHandle.generate();
      CredentialRecord record = CredentialRecord.of(handle, bearerCredential, profile, clock.instant());
      if (records.putIfAbsent(handle.value(), record) == null) {
        log.info("Enrolled user handle {}", UserHandle.mask(handle.value()));
        return handle;
      }
      log.warn("Handle collision on {}, regenerating", UserHandle.mask(handle.value()));
    }
  }

  @Override
  public Optional<String> resolve(String handle) {
    return find(handle).map(CredentialRecord::bearerCredential);
  }

  @Override
  public Optional<CredentialRecord> find(String handle) {
    if (handle == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(records.get(handle));
  }

  @Override
  public boolean revoke(String handle) {
    if (handle == null) {
      return false;
    }
    boolean removed = records.remove(handle) != null;
    if (removed) {
      log.info("Revoked user handle {}", UserHandle.mask(handle));
    }
    return removed;
  }

  @Override
  public StoreHealth checkHealth() {
    return StoreHealth.healthy(BACKEND, 0, "records=" + records.size());
  }
}
