package com.example.expensegateway.security.context;

import org.springframework.core.task.TaskDecorator;

/**
 * Carries the submitting thread's credential into tasks run by a Spring executor.
 */
public class CredentialContextTaskDecorator implements TaskDecorator {

  @Override
  public Runnable decorate(Runnable runnable) {
    return CredentialContext.wrap(runnable);
  }
}
