package com.example.expensegateway.adapter.splitwise;

import com.example.expensegateway.adapter.splitwise.dto.ExpenseQuery;
import java.util.Map;

/**
 * One authenticated session against the Splitwise REST API v3.0, bound to a single
 * bearer credential. Responses are returned as the decoded JSON object.
 *
 * <p>Non-2xx responses raise {@link com.example.expensegateway.exception.BackendApiException};
 * 429 raises {@link com.example.expensegateway.exception.RateLimitException}.
 */
public interface SplitwiseClient extends AutoCloseable {

  Map<String, Object> getCurrentUser();

  Map<String, Object> getUser(long userId);

  /**
   * @param expense payload in Splitwise field names; a {@code users} list of maps is
   *     flattened to {@code users__<i>__<field>}
   */
  Map<String, Object> createExpense(Map<String, Object> expense);

  Map<String, Object> getExpenses(ExpenseQuery query);

  Map<String, Object> getExpense(long expenseId);

  Map<String, Object> updateExpense(long expenseId, Map<String, Object> changes);

  Map<String, Object> deleteExpense(long expenseId);

  Map<String, Object> getGroups();

  Map<String, Object> getGroup(long groupId);

  Map<String, Object> createGroup(Map<String, Object> group);

  Map<String, Object> deleteGroup(long groupId);

  Map<String, Object> addUserToGroup(long groupId, Map<String, Object> user);

  Map<String, Object> removeUserFromGroup(long groupId, long userId);

  Map<String, Object> getFriends();

  Map<String, Object> getFriend(long userId);

  Map<String, Object> createComment(long expenseId, String content);

  Map<String, Object> getComments(long expenseId);

  Map<String, Object> deleteComment(long commentId);

  Map<String, Object> getCategories();

  Map<String, Object> getCurrencies();

  /**
   * Cancels in-flight calls and rejects further use. Idempotent.
   */
  @Override
  void close();
}
