package com.example.expensegateway.domain.entity;

import java.util.Objects;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Opaque per-user handle issued at enrollment. Carries no information about the
 * credential it maps to; it is only a lookup key.
 */
public record UserHandle(String value) {

  private static final Pattern UUID_FORMAT =
      Pattern.compile("^[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}$");

  public UserHandle {
    Objects.requireNonNull(value, "value");
  }

  /**
   * Random version 4 UUID. {@link UUID#randomUUID()} draws from {@code SecureRandom}.
   */
  public static UserHandle generate() {
    return new UserHandle(UUID.randomUUID().toString());
  }

  public static boolean isWellFormed(String candidate) {
    return candidate != null && UUID_FORMAT.matcher(candidate).matches();
  }

  /**
   * First 8 characters only, for log lines.
   */
  public static String mask(String candidate) {
    if (candidate == null || candidate.isEmpty()) {
      return "<none>";
    }
    return candidate.length() <= 8 ? "***" : candidate.substring(0, 8) + "...";
  }

  @Override
  public String toString() {
    return value;
  }
}
