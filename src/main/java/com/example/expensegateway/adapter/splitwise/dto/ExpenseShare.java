package com.example.expensegateway.adapter.splitwise.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One participant of an expense, identified by Splitwise user id or by email. Shares
 * left empty are filled in when the expense is split equally.
 */
public record ExpenseShare(
    @Positive Long userId,
    @Email String email,
    String firstName,
    String lastName,
    @PositiveOrZero BigDecimal paidShare,
    @PositiveOrZero BigDecimal owedShare
) {

  public static ExpenseShare ofUser(long userId) {
    return new ExpenseShare(userId, null, null, null, null, null);
  }

  public ExpenseShare withShares(BigDecimal paid, BigDecimal owed) {
    return new ExpenseShare(userId, email, firstName, lastName, paid, owed);
  }

  /**
   * Splitwise field names; amounts as two-decimal strings, absent values as null.
   */
  public Map<String, Object> toPayload() {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("user_id", userId);
    payload.put("email", email);
    payload.put("first_name", firstName);
    payload.put("last_name", lastName);
    payload.put("paid_share", paidShare == null ? null : paidShare.setScale(2, RoundingMode.HALF_UP).toPlainString());
    payload.put("owed_share", owedShare == null ? null : owedShare.setScale(2, RoundingMode.HALF_UP).toPlainString());
    return payload;
  }
}
