package com.example.expensegateway.config;

import com.example.expensegateway.properties.ApplicationProperties;
import com.example.expensegateway.security.context.CredentialContextTaskDecorator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executor for fan-out work started inside a request. Tasks inherit the submitting
 * request's credential.
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
@RequiredArgsConstructor
public class AsyncConfig {

  private final ApplicationProperties properties;

  @Bean(name = "applicationTaskExecutor")
  public ThreadPoolTaskExecutor applicationTaskExecutor() {
    ApplicationProperties.AsyncProperties async = properties.async();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(async.corePoolSize());
    executor.setMaxPoolSize(async.maxPoolSize());
    executor.setQueueCapacity(async.queueCapacity());
    executor.setThreadNamePrefix("gateway-async-");
    executor.setTaskDecorator(new CredentialContextTaskDecorator());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(10);
    executor.initialize();
    log.info("Application task executor configured: core={}, max={}, queue={}",
             async.corePoolSize(), async.maxPoolSize(), async.queueCapacity());
    return executor;
  }
}
