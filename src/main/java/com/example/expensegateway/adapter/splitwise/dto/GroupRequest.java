package com.example.expensegateway.adapter.splitwise.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public record GroupRequest(
    @NotBlank(message = "name is required") String name,
    @Pattern(regexp = "home|trip|couple|other", message = "groupType must be one of home, trip, couple, other")
    String groupType,
    Boolean simplifyByDefault,
    List<@Valid @NotNull(message = "users must not contain null entries") GroupMemberRequest> users
) {

  public GroupRequest {
    groupType = groupType == null ? "other" : groupType;
    simplifyByDefault = simplifyByDefault == null ? Boolean.TRUE : simplifyByDefault;
    // Null entries are kept so validation can report them
    users = users == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(users));
  }

  public Map<String, Object> toPayload() {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("name", name);
    payload.put("group_type", groupType);
    payload.put("simplify_by_default", simplifyByDefault);
    if (!users.isEmpty()) {
      payload.put("users", users.stream().map(GroupMemberRequest::toPayload).collect(Collectors.toList()));
    }
    return payload;
  }
}
