package com.example.expensegateway.adapter.splitwise.dto;

import jakarta.validation.constraints.NotBlank;

public record CommentRequest(@NotBlank(message = "content is required") String content) {}
