package com.example.expensegateway.domain.entity;

import java.time.Instant;
import java.util.Objects;

/**
 * A stored mapping from a user handle to the Splitwise bearer credential and the
 * profile captured when the user connected.
 */
public record CredentialRecord(
    UserHandle handle,
    String bearerCredential,
    Long backendUserId,
    String displayName,
    String email,
    Instant createdAt
) {

  public CredentialRecord {
    Objects.requireNonNull(handle, "handle");
    if (bearerCredential == null || bearerCredential.isBlank()) {
      throw new IllegalArgumentException("bearerCredential must not be blank");
    }
    Objects.requireNonNull(createdAt, "createdAt");
  }

  public static CredentialRecord of(UserHandle handle, String bearerCredential, UserProfile profile, Instant createdAt) {
    UserProfile p = profile == null ? UserProfile.empty() : profile;
    return new CredentialRecord(handle, bearerCredential, p.backendUserId(), p.displayName(), p.email(), createdAt);
  }

  public UserProfile profile() {
    return new UserProfile(backendUserId, displayName, email);
  }

  @Override
  public String toString() {
    return "CredentialRecord[handle=" + UserHandle.mask(handle.value())
        + ", bearerCredential=<redacted>, backendUserId=" + backendUserId
        + ", displayName=" + displayName + ", createdAt=" + createdAt + "]";
  }
}
