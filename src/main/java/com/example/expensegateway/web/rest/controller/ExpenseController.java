package com.example.expensegateway.web.rest.controller;

import com.example.expensegateway.adapter.splitwise.dto.CommentRequest;
import com.example.expensegateway.adapter.splitwise.dto.ExpenseQuery;
import com.example.expensegateway.adapter.splitwise.dto.ExpenseRequest;
import com.example.expensegateway.adapter.splitwise.dto.ExpenseUpdateRequest;
import com.example.expensegateway.service.ExpenseCreationCoordinator;
import com.example.expensegateway.service.SplitwiseClientCache;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class ExpenseController implements ExpenseAPI {

  private final ExpenseCreationCoordinator expenseCreationCoordinator;
  private final SplitwiseClientCache clientCache;

  @Override
  public ResponseEntity<Map<String, Object>> createExpense(ExpenseRequest request) {
    return ResponseEntity.ok(expenseCreationCoordinator.create(request));
  }

  @Override
  public ResponseEntity<Map<String, Object>> getExpenses(ExpenseQuery query) {
    return ResponseEntity.ok(clientCache.currentClient().getExpenses(query == null ? ExpenseQuery.defaults() : query));
  }

  @Override
  public ResponseEntity<Map<String, Object>> getExpense(long expenseId) {
    return ResponseEntity.ok(clientCache.currentClient().getExpense(expenseId));
  }

  @Override
  public ResponseEntity<Map<String, Object>> updateExpense(long expenseId, ExpenseUpdateRequest request) {
    return ResponseEntity.ok(clientCache.currentClient().updateExpense(expenseId, request.toPayload()));
  }

  @Override
  public ResponseEntity<Map<String, Object>> deleteExpense(long expenseId) {
    return ResponseEntity.ok(clientCache.currentClient().deleteExpense(expenseId));
  }

  @Override
  public ResponseEntity<Map<String, Object>> createComment(long expenseId, CommentRequest request) {
    return ResponseEntity.ok(clientCache.currentClient().createComment(expenseId, request.content()));
  }

  @Override
  public ResponseEntity<Map<String, Object>> getComments(long expenseId) {
    return ResponseEntity.ok(clientCache.currentClient().getComments(expenseId));
  }

  @Override
  public ResponseEntity<Map<String, Object>> deleteComment(long commentId) {
    return ResponseEntity.ok(clientCache.currentClient().deleteComment(commentId));
  }
}
