package com.example.expensegateway.store;

import com.example.expensegateway.domain.entity.CredentialRecord;
import com.example.expensegateway.domain.entity.StoreHealth;
import com.example.expensegateway.domain.entity.UserHandle;
import com.example.expensegateway.domain.entity.UserProfile;
import java.util.Optional;

/**
 * Durable mapping from opaque user handles to Splitwise bearer credentials.
 *
 * <p>Unknown and malformed handles resolve to empty; they never raise. Failures of the
 * underlying storage raise {@link com.example.expensegateway.exception.CredentialStoreException}
 * and are never reported as absence. All operations are safe to call concurrently.
 */
public interface CredentialStore {

  /**
   * Stores the credential under a freshly generated handle. The handle never collides
   * with one already stored.
   */
  UserHandle enroll(String bearerCredential, UserProfile profile);

  Optional<String> resolve(String handle);

  Optional<CredentialRecord> find(String handle);

  /**
   * @return true only if a record was removed
   */
  boolean revoke(String handle);

  StoreHealth checkHealth();
}
