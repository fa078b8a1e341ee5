package com.example.expensegateway.web.rest.controller;

import static com.example.expensegateway.web.rest.ApiConstants.ApiPath.*;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;

import java.util.Map;

/**
 * The caller's connection and account-level Splitwise data. Every operation needs the
 * {@code token} query parameter.
 */
@Tag(
    name = "Account",
    description = "Connection management and account-level Splitwise data"
)
@RequestMapping(
    value = API_BASE,
    produces = MediaType.APPLICATION_JSON_VALUE
)
public interface AccountAPI {

  @Operation(summary = "API index", description = "Connection status and available resources")
  @GetMapping
  ResponseEntity<Map<String, Object>> index();

  @Operation(summary = "Current Splitwise user")
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "User returned"),
      @ApiResponse(responseCode = "401", description = "No connected account for this token")
  })
  @GetMapping(value = ME)
  ResponseEntity<Map<String, Object>> getCurrentUser();

  @Operation(summary = "Splitwise user by id")
  @GetMapping(value = USERS + "/{userId}")
  ResponseEntity<Map<String, Object>> getUser(@PathVariable("userId") long userId);

  @Operation(summary = "Stored connection", description = "Profile captured when the account was connected")
  @GetMapping(value = CONNECTION)
  ResponseEntity<Map<String, Object>> getConnection(
      @Parameter(hidden = true) @RequestParam(name = "token", required = false) String token);

  @Operation(summary = "Disconnect", description = "Revokes this token; it stops working immediately")
  @DeleteMapping(value = CONNECTION)
  ResponseEntity<Map<String, Object>> disconnect(
      @Parameter(hidden = true) @RequestParam(name = "token", required = false) String token);

  @Operation(summary = "Account overview", description = "Current user, groups and friends in one call")
  @GetMapping(value = OVERVIEW)
  ResponseEntity<Map<String, Object>> overview();

  @Operation(summary = "Expense categories")
  @GetMapping(value = CATEGORIES)
  ResponseEntity<Map<String, Object>> getCategories();

  @Operation(summary = "Supported currencies")
  @GetMapping(value = CURRENCIES)
  ResponseEntity<Map<String, Object>> getCurrencies();
}
