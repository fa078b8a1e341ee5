package com.example.expensegateway.web.rest.controller;

import com.example.expensegateway.domain.entity.CredentialRecord;
import com.example.expensegateway.security.context.CredentialContext;
import com.example.expensegateway.service.AccountService;
import com.example.expensegateway.service.SplitwiseClientCache;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class AccountController implements AccountAPI {

  private static final List<String> RESOURCES = List.of(
      "/api/me", "/api/connection", "/api/overview", "/api/expenses", "/api/groups",
      "/api/friends", "/api/categories", "/api/currencies");

  private final AccountService accountService;
  private final SplitwiseClientCache clientCache;

  @Override
  public ResponseEntity<Map<String, Object>> index() {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("connected", CredentialContext.get().isPresent());
    body.put("resources", RESOURCES);
    return ResponseEntity.ok(body);
  }

  @Override
  public ResponseEntity<Map<String, Object>> getCurrentUser() {
    return ResponseEntity.ok(clientCache.currentClient().getCurrentUser());
  }

  @Override
  public ResponseEntity<Map<String, Object>> getUser(long userId) {
    return ResponseEntity.ok(clientCache.currentClient().getUser(userId));
  }

  @Override
  public ResponseEntity<Map<String, Object>> getConnection(String token) {
    CredentialRecord record = accountService.connection(token);
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("splitwiseUserId", record.backendUserId());
    body.put("displayName", record.displayName());
    body.put("email", record.email());
    body.put("connectedAt", record.createdAt());
    return ResponseEntity.ok(body);
  }

  @Override
  public ResponseEntity<Map<String, Object>> disconnect(String token) {
    boolean revoked = accountService.disconnect(token);
    return ResponseEntity.ok(Map.of("revoked", revoked));
  }

  @Override
  public ResponseEntity<Map<String, Object>> overview() {
    return ResponseEntity.ok(accountService.overview());
  }

  @Override
  public ResponseEntity<Map<String, Object>> getCategories() {
    return ResponseEntity.ok(clientCache.currentClient().getCategories());
  }

  @Override
  public ResponseEntity<Map<String, Object>> getCurrencies() {
    return ResponseEntity.ok(clientCache.currentClient().getCurrencies());
  }
}
