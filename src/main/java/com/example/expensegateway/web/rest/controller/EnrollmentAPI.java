package com.example.expensegateway.web.rest.controller;

import static com.example.expensegateway.web.rest.ApiConstants.ApiPath.*;

import com.example.expensegateway.domain.entity.EnrollmentResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;

import java.util.Map;

@Tag(
    name = "Enrollment",
    description = "Connect a Splitwise account and obtain a personal gateway token"
)
public interface EnrollmentAPI {

  @Operation(
      summary = "Gateway index",
      description = "Describes the gateway and links to the authorization flow"
  )
  @GetMapping(value = ROOT, produces = MediaType.APPLICATION_JSON_VALUE)
  ResponseEntity<Map<String, Object>> index();

  @Operation(
      summary = "Start authorization",
      description = "Redirects to Splitwise to approve access for this gateway"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "302", description = "Redirect to Splitwise")
  })
  @GetMapping(value = AUTHORIZE)
  ResponseEntity<Void> authorize();

  @Operation(
      summary = "OAuth callback",
      description = "Exchanges the authorization code, stores the credential and returns the user's token"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Account connected"),
      @ApiResponse(responseCode = "400", description = "Missing code or invalid state"),
      @ApiResponse(responseCode = "502", description = "Splitwise rejected the code exchange")
  })
  @GetMapping(value = CALLBACK, produces = MediaType.APPLICATION_JSON_VALUE)
  ResponseEntity<EnrollmentResult> callback(
      @RequestParam(name = "code", required = false) String code,
      @RequestParam(name = "state", required = false) String state);
}
