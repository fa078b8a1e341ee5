package com.example.expensegateway.domain.entity;

/**
 * Splitwise account details captured at enrollment.
 */
public record UserProfile(Long backendUserId, String displayName, String email) {

  public static UserProfile empty() {
    return new UserProfile(null, null, null);
  }
}
