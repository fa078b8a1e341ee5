package com.example.expensegateway.web.rest.controller;

import static com.example.expensegateway.web.rest.ApiConstants.ApiPath.*;

import com.example.expensegateway.adapter.splitwise.dto.GroupMemberRequest;
import com.example.expensegateway.adapter.splitwise.dto.GroupRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;

import java.util.Map;

@Tag(
    name = "Groups and friends",
    description = "Splitwise groups, their members and the caller's friends"
)
@RequestMapping(
    value = API_BASE,
    produces = MediaType.APPLICATION_JSON_VALUE
)
public interface GroupAPI {

  @Operation(summary = "List groups")
  @GetMapping(value = GROUPS)
  ResponseEntity<Map<String, Object>> getGroups();

  @Operation(summary = "Get group")
  @GetMapping(value = GROUPS + "/{groupId}")
  ResponseEntity<Map<String, Object>> getGroup(@PathVariable("groupId") long groupId);

  @Operation(summary = "Create group")
  @PostMapping(value = GROUPS, consumes = MediaType.APPLICATION_JSON_VALUE)
  ResponseEntity<Map<String, Object>> createGroup(@Valid @RequestBody GroupRequest request);

  @Operation(summary = "Delete group", description = "All expenses in the group must be settled first")
  @DeleteMapping(value = GROUPS + "/{groupId}")
  ResponseEntity<Map<String, Object>> deleteGroup(@PathVariable("groupId") long groupId);

  @Operation(summary = "Add member", description = "Adds a user by Splitwise id or by email")
  @PostMapping(value = GROUPS + "/{groupId}" + MEMBERS, consumes = MediaType.APPLICATION_JSON_VALUE)
  ResponseEntity<Map<String, Object>> addMember(
      @PathVariable("groupId") long groupId,
      @Valid @RequestBody GroupMemberRequest request);

  @Operation(summary = "Remove member", description = "The member must have a zero balance")
  @DeleteMapping(value = GROUPS + "/{groupId}" + MEMBERS + "/{userId}")
  ResponseEntity<Map<String, Object>> removeMember(
      @PathVariable("groupId") long groupId,
      @PathVariable("userId") long userId);

  @Operation(summary = "List friends")
  @GetMapping(value = FRIENDS)
  ResponseEntity<Map<String, Object>> getFriends();

  @Operation(summary = "Get friend")
  @GetMapping(value = FRIENDS + "/{userId}")
  ResponseEntity<Map<String, Object>> getFriend(@PathVariable("userId") long userId);
}
