package com.example.expensegateway.domain.entity;

/**
 * Outcome of a completed OAuth handshake: the user's handle and the URL to use it with.
 */
public record EnrollmentResult(
    String token,
    String displayName,
    String email,
    String connectionUrl
) {}
