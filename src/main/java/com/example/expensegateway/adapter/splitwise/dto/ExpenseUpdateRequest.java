package com.example.expensegateway.adapter.splitwise.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Partial update of an expense. Only non-null fields are sent.
 */
public record ExpenseUpdateRequest(
    @DecimalMin(value = "0.01", message = "cost must be positive")
    @Digits(integer = 12, fraction = 2, message = "cost must have at most 2 decimal places") BigDecimal cost,
    String description,
    @Pattern(regexp = "^\\d{4}-\\d{2}-\\d{2}(T.*)?$", message = "date must be ISO 8601") String date,
    @Positive(message = "categoryId must be positive") Long categoryId,
    List<@Valid @NotNull(message = "users must not contain null entries") ExpenseShare> users
) {

  public Map<String, Object> toPayload() {
    Map<String, Object> payload = new LinkedHashMap<>();
    if (cost != null) {
      payload.put("cost", cost.setScale(2, RoundingMode.HALF_UP).toPlainString());
    }
    if (description != null) {
      payload.put("description", description);
    }
    if (date != null) {
      payload.put("date", date);
    }
    if (categoryId != null) {
      payload.put("category_id", categoryId);
    }
    if (users != null) {
      payload.put("users", users.stream().map(ExpenseShare::toPayload).collect(Collectors.toList()));
    }
    return payload;
  }

  @AssertTrue(message = "At least one field must be provided to update")
  public boolean isNotEmpty() {
    return cost != null || description != null || date != null || categoryId != null || users != null;
  }
}
