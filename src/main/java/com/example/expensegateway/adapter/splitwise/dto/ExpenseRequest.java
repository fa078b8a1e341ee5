package com.example.expensegateway.adapter.splitwise.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable description of an expense to create. The participant list is copied on
 * construction so a request can be replayed unchanged.
 */
public record ExpenseRequest(
    @NotNull @DecimalMin(value = "0.01", message = "cost must be positive")
    @Digits(integer = 12, fraction = 2, message = "cost must have at most 2 decimal places") BigDecimal cost,
    @NotBlank(message = "description is required") String description,
    @PositiveOrZero(message = "groupId must be non-negative") Long groupId,
    @Pattern(regexp = "^[A-Z]{3}$", message = "currencyCode must be a three-letter ISO code") String currencyCode,
    @Pattern(regexp = "^\\d{4}-\\d{2}-\\d{2}(T.*)?$", message = "date must be ISO 8601") String date,
    @Positive(message = "categoryId must be positive") Long categoryId,
    List<@Valid @NotNull(message = "users must not contain null entries") ExpenseShare> users,
    Boolean splitEqually
) {

  public static final String DEFAULT_CURRENCY = "INR";

  public ExpenseRequest {
    // Null entries are kept so validation can report them
    users = users == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(users));
    groupId = groupId == null ? 0L : groupId;
    currencyCode = currencyCode == null ? DEFAULT_CURRENCY : currencyCode;
    splitEqually = splitEqually == null ? Boolean.TRUE : splitEqually;
  }
}
