package com.example.expensegateway.exception;

/**
 * The backend kept rejecting an expense because of its stale friend list, even after a
 * refresh and one retry. The user has to reconnect their account to recover.
 */
public class FriendListSyncException extends RuntimeException {
  public FriendListSyncException(String message, Throwable cause) {
    super(message, cause);
  }
}
