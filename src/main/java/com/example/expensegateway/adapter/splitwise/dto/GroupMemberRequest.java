package com.example.expensegateway.adapter.splitwise.dto;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Positive;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A user to add to a group, by Splitwise id or by email.
 */
public record GroupMemberRequest(
    @Positive(message = "userId must be positive") Long userId,
    @Email(message = "email must be a valid address") String email,
    String firstName,
    String lastName
) {

  public Map<String, Object> toPayload() {
    Map<String, Object> payload = new LinkedHashMap<>();
    if (userId != null) {
      payload.put("user_id", userId);
    }
    if (email != null && !email.isBlank()) {
      payload.put("email", email);
    }
    if (firstName != null && !firstName.isBlank()) {
      payload.put("first_name", firstName);
    }
    if (lastName != null && !lastName.isBlank()) {
      payload.put("last_name", lastName);
    }
    return payload;
  }

  @AssertTrue(message = "Either userId or email must be provided")
  public boolean isIdentified() {
    return userId != null || (email != null && !email.isBlank());
  }
}
