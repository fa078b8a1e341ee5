package com.example.expensegateway.web.rest.controller;

import static com.example.expensegateway.web.rest.ApiConstants.ApiPath.*;

import com.example.expensegateway.adapter.splitwise.dto.CommentRequest;
import com.example.expensegateway.adapter.splitwise.dto.ExpenseQuery;
import com.example.expensegateway.adapter.splitwise.dto.ExpenseRequest;
import com.example.expensegateway.adapter.splitwise.dto.ExpenseUpdateRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;

import java.util.Map;

@Tag(
    name = "Expenses",
    description = "Expenses and their comments"
)
@RequestMapping(
    value = API_BASE,
    produces = MediaType.APPLICATION_JSON_VALUE
)
public interface ExpenseAPI {

  @Operation(
      summary = "Create expense",
      description = "Creates an expense. The caller is added as a participant when missing. "
          + "A stale Splitwise friend list is refreshed and the request retried once."
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Expense created"),
      @ApiResponse(responseCode = "400", description = "Invalid request"),
      @ApiResponse(responseCode = "401", description = "No connected account for this token"),
      @ApiResponse(responseCode = "502", description = "Splitwise rejected the expense")
  })
  @PostMapping(value = EXPENSES, consumes = MediaType.APPLICATION_JSON_VALUE)
  ResponseEntity<Map<String, Object>> createExpense(@Valid @RequestBody ExpenseRequest request);

  @Operation(summary = "List expenses")
  @GetMapping(value = EXPENSES)
  ResponseEntity<Map<String, Object>> getExpenses(@Valid @ModelAttribute ExpenseQuery query);

  @Operation(summary = "Get expense")
  @GetMapping(value = EXPENSES + "/{expenseId}")
  ResponseEntity<Map<String, Object>> getExpense(@PathVariable("expenseId") long expenseId);

  @Operation(summary = "Update expense", description = "Only the provided fields are changed")
  @PutMapping(value = EXPENSES + "/{expenseId}", consumes = MediaType.APPLICATION_JSON_VALUE)
  ResponseEntity<Map<String, Object>> updateExpense(
      @PathVariable("expenseId") long expenseId,
      @Valid @RequestBody ExpenseUpdateRequest request);

  @Operation(summary = "Delete expense")
  @DeleteMapping(value = EXPENSES + "/{expenseId}")
  ResponseEntity<Map<String, Object>> deleteExpense(@PathVariable("expenseId") long expenseId);

  @Operation(summary = "Comment on expense")
  @PostMapping(value = EXPENSES + "/{expenseId}" + COMMENTS, consumes = MediaType.APPLICATION_JSON_VALUE)
  ResponseEntity<Map<String, Object>> createComment(
      @PathVariable("expenseId") long expenseId,
      @Valid @RequestBody CommentRequest request);

  @Operation(summary = "List comments of an expense")
  @GetMapping(value = EXPENSES + "/{expenseId}" + COMMENTS)
  ResponseEntity<Map<String, Object>> getComments(@PathVariable("expenseId") long expenseId);

  @Operation(summary = "Delete comment")
  @DeleteMapping(value = COMMENTS + "/{commentId}")
  ResponseEntity<Map<String, Object>> deleteComment(@PathVariable("commentId") long commentId);
}
