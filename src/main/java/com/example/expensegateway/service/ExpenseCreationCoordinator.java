package com.example.expensegateway.service;

import com.example.expensegateway.adapter.splitwise.SplitwiseClient;
import com.example.expensegateway.adapter.splitwise.dto.ExpenseRequest;
import com.example.expensegateway.adapter.splitwise.dto.ExpenseShare;
import com.example.expensegateway.exception.BackendApiException;
import com.example.expensegateway.exception.FriendListSyncException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Creates expenses on behalf of the current user, recovering once from Splitwise's stale
 * friend-list rejection.
 *
 * <p>When the first attempt fails with {@value #STALE_FRIEND_LIST_MARKER}, the friend list
 * is fetched (which refreshes it server side) and the expense is submitted once more,
 * rebuilt from the original request. Any failure of that second attempt ends in
 * {@link FriendListSyncException}. Any other first failure is propagated without a retry.
 */
@Slf4j
@Service
public class ExpenseCreationCoordinator {

  static final String STALE_FRIEND_LIST_MARKER = "not in your friends list";

  private final SplitwiseClientCache clientCache;
  private final Clock clock;

  @Autowired
  public ExpenseCreationCoordinator(SplitwiseClientCache clientCache) {
    this(clientCache, Clock.systemUTC());
  }

  ExpenseCreationCoordinator(SplitwiseClientCache clientCache, Clock clock) {
    this.clientCache = clientCache;
    this.clock = clock;
  }

  public Map<String, Object> create(ExpenseRequest request) {
    SplitwiseClient client = clientCache.currentClient();

    try {
      return submit(client, request);
    } catch (BackendApiException first) {
      if (!isStaleFriendList(first)) {
        throw first;
      }
      log.warn("Splitwise rejected the expense with a stale friend list; refreshing and retrying once");
      refreshFriendList(client);

      try {
        Map<String, Object> result = submit(client, request);
        log.info("Expense created after friend list refresh");
        return result;
      } catch (RuntimeException second) {
        log.warn("Expense still rejected after friend list refresh: {}", second.getMessage());
        throw new FriendListSyncException(
            "Splitwise still reports a friends-list sync issue after refreshing and retrying once", second);
      }
    }
  }

  static boolean isStaleFriendList(BackendApiException e) {
    return e.getErrorText().toLowerCase(Locale.ROOT).contains(STALE_FRIEND_LIST_MARKER);
  }

  private void refreshFriendList(SplitwiseClient client) {
    try {
      client.getFriends();
    } catch (RuntimeException e) {
      log.warn("Friend list refresh failed, retrying the expense anyway", e);
    }
  }

  private Map<String, Object> submit(SplitwiseClient client, ExpenseRequest request) {
    Map<String, Object> payload = buildPayload(request);
    List<Map<String, Object>> participants = prepareParticipants(client, request);
    if (participants.isEmpty()) {
      if (Boolean.TRUE.equals(request.splitEqually())) {
        payload.put("split_equally", true);
      }
    } else {
      payload.put("users", participants);
    }
    Map<String, Object> result = client.createExpense(payload);
    log.debug("Expense created: {}", result.keySet());
    return result;
  }

  private Map<String, Object> buildPayload(ExpenseRequest request) {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("cost", toMoney(request.cost()));
    payload.put("description", request.description());
    payload.put("currency_code", request.currencyCode());
    payload.put("group_id", request.groupId());
    payload.put("date", request.date() != null
        ? request.date()
        : DateTimeFormatter.ISO_INSTANT.format(clock.instant().truncatedTo(ChronoUnit.SECONDS)));
    if (request.categoryId() != null) {
      payload.put("category_id", request.categoryId());
    }
    return payload;
  }

  /**
   * Builds a fresh participant list on every call. The current user is added at the
   * front when missing. With an equal split the first participant pays the total and
   * takes any rounding remainder of the owed shares.
   */
  List<Map<String, Object>> prepareParticipants(SplitwiseClient client, ExpenseRequest request) {
    if (request.users().isEmpty()) {
      return List.of();
    }
    List<ExpenseShare> shares = new ArrayList<>(request.users());

    Long currentUserId = currentUserId(client);
    if (currentUserId != null
        && shares.stream().noneMatch(share -> Objects.equals(share.userId(), currentUserId))) {
      shares.add(0, ExpenseShare.ofUser(currentUserId));
    }

    if (Boolean.TRUE.equals(request.splitEqually())) {
      shares = splitEqually(request.cost(), shares);
    }

    List<Map<String, Object>> participants = new ArrayList<>(shares.size());
    for (ExpenseShare share : shares) {
      participants.add(share.toPayload());
    }
    return participants;
  }

  static List<ExpenseShare> splitEqually(BigDecimal cost, List<ExpenseShare> shares) {
    BigDecimal total = cost.setScale(2, RoundingMode.HALF_UP);
    int count = shares.size();
    BigDecimal perPerson = total.divide(BigDecimal.valueOf(count), 2, RoundingMode.HALF_UP);
    BigDecimal firstOwed = total.subtract(perPerson.multiply(BigDecimal.valueOf(count - 1L)));

    List<ExpenseShare> split = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      ExpenseShare share = shares.get(i);
      BigDecimal paid = share.paidShare() != null ? share.paidShare() : (i == 0 ? total : BigDecimal.ZERO);
      BigDecimal owed = share.owedShare() != null ? share.owedShare() : (i == 0 ? firstOwed : perPerson);
      split.add(share.withShares(paid, owed));
    }
    return split;
  }

  private Long currentUserId(SplitwiseClient client) {
    Object user = client.getCurrentUser().get("user");
    if (!(user instanceof Map)) {
      return null;
    }
    Object id = ((Map<?, ?>) user).get("id");
    return id instanceof Number ? ((Number) id).longValue() : null;
  }

  private static String toMoney(BigDecimal amount) {
    return amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
  }
}
