package com.example.expensegateway.web.rest.controller;

import com.example.expensegateway.domain.entity.EnrollmentResult;
import com.example.expensegateway.properties.ApplicationProperties;
import com.example.expensegateway.service.EnrollmentService;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequiredArgsConstructor
public class EnrollmentController implements EnrollmentAPI {

  private final EnrollmentService enrollmentService;
  private final ApplicationProperties properties;

  @Override
  public ResponseEntity<Map<String, Object>> index() {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("service", "expense-gateway");
    body.put("description", "Connect your Splitwise account to get a personal token for the gateway API.");
    body.put("authorizeUrl", properties.gateway().publicUrl() + "/authorize");
    return ResponseEntity.ok(body);
  }

  @Override
  public ResponseEntity<Void> authorize() {
    String url = enrollmentService.generateAuthorizationUrl();
    return ResponseEntity.status(HttpStatus.FOUND).location(URI.create(url)).build();
  }

  @Override
  public ResponseEntity<EnrollmentResult> callback(String code, String state) {
    return ResponseEntity.ok(enrollmentService.completeAuthorization(code, state));
  }
}
