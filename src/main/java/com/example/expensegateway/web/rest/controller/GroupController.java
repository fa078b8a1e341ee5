package com.example.expensegateway.web.rest.controller;

import com.example.expensegateway.adapter.splitwise.dto.GroupMemberRequest;
import com.example.expensegateway.adapter.splitwise.dto.GroupRequest;
import com.example.expensegateway.service.SplitwiseClientCache;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class GroupController implements GroupAPI {

  private final SplitwiseClientCache clientCache;

  @Override
  public ResponseEntity<Map<String, Object>> getGroups() {
    return ResponseEntity.ok(clientCache.currentClient().getGroups());
  }

  @Override
  public ResponseEntity<Map<String, Object>> getGroup(long groupId) {
    return ResponseEntity.ok(clientCache.currentClient().getGroup(groupId));
  }

  @Override
  public ResponseEntity<Map<String, Object>> createGroup(GroupRequest request) {
    return ResponseEntity.ok(clientCache.currentClient().createGroup(request.toPayload()));
  }

  @Override
  public ResponseEntity<Map<String, Object>> deleteGroup(long groupId) {
    return ResponseEntity.ok(clientCache.currentClient().deleteGroup(groupId));
  }

  @Override
  public ResponseEntity<Map<String, Object>> addMember(long groupId, GroupMemberRequest request) {
    return ResponseEntity.ok(clientCache.currentClient().addUserToGroup(groupId, request.toPayload()));
  }

  @Override
  public ResponseEntity<Map<String, Object>> removeMember(long groupId, long userId) {
    return ResponseEntity.ok(clientCache.currentClient().removeUserFromGroup(groupId, userId));
  }

  @Override
  public ResponseEntity<Map<String, Object>> getFriends() {
    return ResponseEntity.ok(clientCache.currentClient().getFriends());
  }

  @Override
  public ResponseEntity<Map<String, Object>> getFriend(long userId) {
    return ResponseEntity.ok(clientCache.currentClient().getFriend(userId));
  }
}
