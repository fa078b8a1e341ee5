package com.example.expensegateway.adapter.splitwise.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

/**
 * Filters for listing expenses.
 */
public record ExpenseQuery(
    Long groupId,
    Long friendId,
    String datedAfter,
    String datedBefore,
    String updatedAfter,
    String updatedBefore,
    @Min(1) @Max(100) Integer limit,
    @Min(0) Integer offset
) {

  public ExpenseQuery {
    limit = limit == null ? 20 : limit;
    offset = offset == null ? 0 : offset;
  }

  public static ExpenseQuery defaults() {
    return new ExpenseQuery(null, null, null, null, null, null, null, null);
  }
}
