package com.example.expensegateway.config;

import com.example.expensegateway.security.filter.TokenAuthenticationFilter;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.annotation.web.configurers.HeadersConfigurer.FrameOptionsConfig;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.AnonymousAuthenticationFilter;
import org.springframework.security.web.header.writers.ReferrerPolicyHeaderWriter.ReferrerPolicy;

/**
 * Three ordered filter chains.
 * <p>
 * PUBLIC CHAIN (@Order(1)): index, OAuth handshake, health and API docs. No identity.
 * API CHAIN (@Order(2)): {@code /api/**}. {@link TokenAuthenticationFilter} installs the
 * user's credential; endpoints that need one fail with 401 on their own.
 * DEFAULT CHAIN (@Order(3)): everything else is denied.
 */
@Configuration(proxyBeanMethods = false)
@EnableWebSecurity
@RequiredArgsConstructor
public class SecurityConfig {

  private final TokenAuthenticationFilter tokenAuthenticationFilter;

  @Bean
  @Order(1)
  public SecurityFilterChain publicEndpointsFilterChain(HttpSecurity http) throws Exception {
    http
        .securityMatcher("/",
                         "/authorize",
                         "/callback",
                         "/error",
                         "/actuator/**",
                         "/health/**",
                         "/health",
                         "/v3/api-docs/**",
                         "/swagger-ui/**",
                         "/swagger-ui.html")
        .authorizeHttpRequests(authorize -> authorize.anyRequest().permitAll());

    applyCommonSettings(http);
    return http.build();
  }

  @Bean
  @Order(2)
  public SecurityFilterChain apiFilterChain(HttpSecurity http) throws Exception {
    http
        .securityMatcher("/api/**")
        .addFilterBefore(tokenAuthenticationFilter, AnonymousAuthenticationFilter.class)
        // Identity is the user's Splitwise credential, checked where it is used
        .authorizeHttpRequests(authorize -> authorize.anyRequest().permitAll());

    applyCommonSettings(http);
    return http.build();
  }

  @Bean
  @Order(3)
  public SecurityFilterChain defaultDenyFilterChain(HttpSecurity http) throws Exception {
    http.authorizeHttpRequests(authorize -> authorize.anyRequest().denyAll());
    applyCommonSettings(http);
    return http.build();
  }

  /**
   * The filter runs inside the API chain only; keep the servlet container from
   * registering it a second time for every path.
   */
  @Bean
  public FilterRegistrationBean<TokenAuthenticationFilter> tokenAuthenticationFilterRegistration(
      TokenAuthenticationFilter filter) {
    FilterRegistrationBean<TokenAuthenticationFilter> registration = new FilterRegistrationBean<>(filter);
    registration.setEnabled(false);
    return registration;
  }

  private void applyCommonSettings(HttpSecurity http) throws Exception {
    http
        // Handles travel in the query string, there is no cookie to forge
        .csrf(AbstractHttpConfigurer::disable)
        .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .httpBasic(AbstractHttpConfigurer::disable)
        .formLogin(AbstractHttpConfigurer::disable)
        .headers(headers -> headers
                     .frameOptions(FrameOptionsConfig::deny)
                     .contentTypeOptions(contentType -> {
                     })
                     // Keeps the handle in the query string out of Referer headers
                     .referrerPolicy(referrer -> referrer.policy(ReferrerPolicy.NO_REFERRER))
                     .httpStrictTransportSecurity(hsts -> hsts
                                                      .maxAgeInSeconds(Duration.ofDays(365).toSeconds())
                                                      .includeSubDomains(true))
                     .addHeaderWriter((request, response) -> {
                       response.setHeader("Cache-Control", "no-cache, no-store, must-revalidate");
                       response.setHeader("Pragma", "no-cache");
                       response.setHeader("Expires", "0");
                     })
                );
  }
}
