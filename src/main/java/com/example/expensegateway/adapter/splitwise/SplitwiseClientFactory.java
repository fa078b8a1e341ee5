package com.example.expensegateway.adapter.splitwise;

/**
 * Builds a client bound to one bearer credential.
 */
@FunctionalInterface
public interface SplitwiseClientFactory {

  SplitwiseClient create(String bearerCredential);
}
