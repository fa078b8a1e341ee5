package com.example.expensegateway;

import com.example.expensegateway.properties.ApplicationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Expense Gateway Application
 *
 * Lets many users drive the Splitwise API through one process:
 * - OAuth 2.0 enrollment issuing opaque per-user handles
 * - Redis-backed credential store with encryption at rest
 * - Per-credential client cache over a shared OkHttp pool
 */
@SpringBootApplication
@EnableConfigurationProperties(ApplicationProperties.class)
public class ExpenseGatewayApplication {
  public static void main(String[] args) {
    SpringApplication app = new SpringApplication(ExpenseGatewayApplication.class);
    app.setRegisterShutdownHook(true);
    app.run(args);
  }
}
