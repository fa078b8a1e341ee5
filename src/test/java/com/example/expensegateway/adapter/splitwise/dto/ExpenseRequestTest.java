package com.example.expensegateway.adapter.splitwise.dto;

import static org.assertj.core.api.Assertions.assertThat;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class ExpenseRequestTest {

  private static ValidatorFactory validatorFactory;
  private static Validator validator;

  @BeforeAll
  static void setUpValidator() {
    validatorFactory = Validation.buildDefaultValidatorFactory();
    validator = validatorFactory.getValidator();
  }

  @AfterAll
  static void closeValidator() {
    validatorFactory.close();
  }

  private static ExpenseRequest withUsers(List<ExpenseShare> users) {
    return new ExpenseRequest(new BigDecimal("12.50"), "Lunch", null, null, null, null, users, null);
  }

  @Test
  void defaultsAreApplied() {
    ExpenseRequest request = withUsers(null);

    assertThat(request.users()).isEmpty();
    assertThat(request.groupId()).isZero();
    assertThat(request.currencyCode()).isEqualTo(ExpenseRequest.DEFAULT_CURRENCY);
    assertThat(request.splitEqually()).isTrue();
    assertThat(validator.validate(request)).isEmpty();
  }

  @Test
  void nullParticipant_isAValidationError() {
    ExpenseRequest request = withUsers(Arrays.asList(ExpenseShare.ofUser(2), null));

    Set<ConstraintViolation<ExpenseRequest>> violations = validator.validate(request);

    assertThat(violations).extracting(ConstraintViolation::getMessage)
        .containsExactly("users must not contain null entries");
  }

  @Test
  void participantsAreCopied() {
    List<ExpenseShare> users = new ArrayList<>(List.of(ExpenseShare.ofUser(2)));
    ExpenseRequest request = withUsers(users);

    users.add(ExpenseShare.ofUser(3));

    assertThat(request.users()).containsExactly(ExpenseShare.ofUser(2));
  }

  @Test
  void invalidCurrencyAndCost_areReported() {
    ExpenseRequest request = new ExpenseRequest(new BigDecimal("0.001"), "Lunch", null, "inr", null, null, null, null);

    assertThat(validator.validate(request)).hasSize(3);
  }
}
