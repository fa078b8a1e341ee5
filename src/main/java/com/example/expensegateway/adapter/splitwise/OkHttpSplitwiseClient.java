package com.example.expensegateway.adapter.splitwise;

import com.example.expensegateway.adapter.splitwise.dto.ExpenseQuery;
import com.example.expensegateway.exception.BackendApiException;
import com.example.expensegateway.exception.RateLimitException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Splitwise API v3.0 over OkHttp. Every request is tagged with this instance so
 * {@link #close()} can cancel only its own calls on the shared dispatcher.
 */
@Slf4j
public class OkHttpSplitwiseClient implements SplitwiseClient {

  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
  private static final int TOO_MANY_REQUESTS = 429;

  private final OkHttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final HttpUrl baseUrl;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  public OkHttpSplitwiseClient(OkHttpClient httpClient, ObjectMapper objectMapper, String apiBaseUrl) {
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.baseUrl = HttpUrl.get(apiBaseUrl.endsWith("/") ? apiBaseUrl : apiBaseUrl + "/");
  }

  @Override
  public Map<String, Object> getCurrentUser() {
    return get("get_current_user", Map.of());
  }

  @Override
  public Map<String, Object> getUser(long userId) {
    return get("get_user/" + userId, Map.of());
  }

  @Override
  public Map<String, Object> createExpense(Map<String, Object> expense) {
    return failOnReportedErrors("create_expense", post("create_expense", flatten(expense)));
  }

  @Override
  public Map<String, Object> getExpenses(ExpenseQuery query) {
    Map<String, Object> params = new LinkedHashMap<>();
    params.put("group_id", query.groupId());
    params.put("friend_id", query.friendId());
    params.put("dated_after", query.datedAfter());
    params.put("dated_before", query.datedBefore());
    params.put("updated_after", query.updatedAfter());
    params.put("updated_before", query.updatedBefore());
    params.put("limit", query.limit());
    params.put("offset", query.offset());
    return get("get_expenses", params);
  }

  @Override
  public Map<String, Object> getExpense(long expenseId) {
    return get("get_expense/" + expenseId, Map.of());
  }

  @Override
  public Map<String, Object> updateExpense(long expenseId, Map<String, Object> changes) {
    return failOnReportedErrors("update_expense", post("update_expense/" + expenseId, flatten(changes)));
  }

  @Override
  public Map<String, Object> deleteExpense(long expenseId) {
    return post("delete_expense/" + expenseId, Map.of());
  }

  @Override
  public Map<String, Object> getGroups() {
    return get("get_groups", Map.of());
  }

  @Override
  public Map<String, Object> getGroup(long groupId) {
    return get("get_group/" + groupId, Map.of());
  }

  @Override
  public Map<String, Object> createGroup(Map<String, Object> group) {
    return failOnReportedErrors("create_group", post("create_group", flatten(group)));
  }

  @Override
  public Map<String, Object> deleteGroup(long groupId) {
    return post("delete_group/" + groupId, Map.of());
  }

  @Override
  public Map<String, Object> addUserToGroup(long groupId, Map<String, Object> user) {
    Map<String, Object> body = new LinkedHashMap<>(user);
    body.put("group_id", groupId);
    return post("add_user_to_group", body);
  }

  @Override
  public Map<String, Object> removeUserFromGroup(long groupId, long userId) {
    return post("remove_user_from_group", Map.of("group_id", groupId, "user_id", userId));
  }

  @Override
  public Map<String, Object> getFriends() {
    return get("get_friends", Map.of());
  }

  @Override
  public Map<String, Object> getFriend(long userId) {
    return get("get_friend/" + userId, Map.of());
  }

  @Override
  public Map<String, Object> createComment(long expenseId, String content) {
    return post("create_comment", Map.of("expense_id", expenseId, "content", content));
  }

  @Override
  public Map<String, Object> getComments(long expenseId) {
    return get("get_comments", Map.of("expense_id", expenseId));
  }

  @Override
  public Map<String, Object> deleteComment(long commentId) {
    return post("delete_comment/" + commentId, Map.of());
  }

  @Override
  public Map<String, Object> getCategories() {
    return get("get_categories", Map.of());
  }

  @Override
  public Map<String, Object> getCurrencies() {
    return get("get_currencies", Map.of());
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    int cancelled = cancelOwnCalls(httpClient.dispatcher().queuedCalls())
        + cancelOwnCalls(httpClient.dispatcher().runningCalls());
    log.debug("Splitwise client closed, {} in-flight call(s) cancelled", cancelled);
  }

  public boolean isClosed() {
    return closed.get();
  }

  /**
   * Splitwise list fields are sent as {@code users__0__user_id}, {@code users__0__owed_share}
   * and so on. Null values are dropped.
   */
  static Map<String, Object> flatten(Map<String, Object> payload) {
    Map<String, Object> flat = new LinkedHashMap<>();
    payload.forEach((key, value) -> {
      if (isListOfMaps(value)) {
        List<?> list = (List<?>) value;
        for (int i = 0; i < list.size(); i++) {
          Map<?, ?> item = (Map<?, ?>) list.get(i);
          for (Map.Entry<?, ?> field : item.entrySet()) {
            if (field.getValue() != null) {
              flat.put(key + "__" + i + "__" + field.getKey(), field.getValue());
            }
          }
        }
      } else if (value != null) {
        flat.put(key, value);
      }
    });
    return flat;
  }

  private static boolean isListOfMaps(Object value) {
    return value instanceof List && !((List<?>) value).isEmpty() && ((List<?>) value).get(0) instanceof Map;
  }

  private Map<String, Object> get(String path, Map<String, Object> params) {
    HttpUrl.Builder url = baseUrl.newBuilder().addPathSegments(path);
    params.forEach((name, value) -> {
      if (value != null) {
        url.addQueryParameter(name, String.valueOf(value));
      }
    });
    return execute(newRequest(url.build()).get().build());
  }

  private Map<String, Object> post(String path, Map<String, Object> body) {
    String json;
    try {
      json = objectMapper.writeValueAsString(body);
    } catch (JsonProcessingException e) {
      throw new BackendApiException("Failed to serialize request for " + path, e);
    }
    HttpUrl url = baseUrl.newBuilder().addPathSegments(path).build();
    return execute(newRequest(url).post(RequestBody.create(json, JSON)).build());
  }

  private Request.Builder newRequest(HttpUrl url) {
    return new Request.Builder()
        .url(url)
        .header("Accept", "application/json")
        .tag(OkHttpSplitwiseClient.class, this);
  }

  private Map<String, Object> execute(Request request) {
    if (closed.get()) {
      throw new IllegalStateException("Splitwise client is closed");
    }
    String endpoint = request.url().encodedPath();
    log.debug("Splitwise {} {}", request.method(), endpoint);

    try (Response response = httpClient.newCall(request).execute()) {
      ResponseBody body = response.body();
      String text = body == null ? "" : body.string();

      if (response.code() == TOO_MANY_REQUESTS) {
        log.warn("Splitwise rate limit hit on {}", endpoint);
        throw new RateLimitException(text);
      }
      if (!response.isSuccessful()) {
        log.debug("Splitwise {} returned {}: {}", endpoint, response.code(), text);
        throw new BackendApiException(
            "Splitwise API error " + response.code() + " on " + endpoint, response.code(), text);
      }
      if (text.isBlank()) {
        return Map.of();
      }
      return objectMapper.readValue(text, MAP_TYPE);

    } catch (JsonProcessingException e) {
      throw new BackendApiException("Unreadable response from Splitwise on " + endpoint, e);
    } catch (IOException e) {
      throw new BackendApiException("Failed to reach Splitwise on " + endpoint + ": " + e.getMessage(), e);
    }
  }

  /**
   * Splitwise answers some write failures with 200 and a non-empty {@code errors} object.
   */
  private Map<String, Object> failOnReportedErrors(String operation, Map<String, Object> result) {
    Object errors = result.get("errors");
    boolean present;
    if (errors instanceof Map) {
      present = !((Map<?, ?>) errors).isEmpty();
    } else if (errors instanceof Collection) {
      present = !((Collection<?>) errors).isEmpty();
    } else {
      present = errors != null && !String.valueOf(errors).isBlank();
    }
    if (!present) {
      return result;
    }
    String text = describe(errors);
    log.warn("Splitwise {} reported errors: {}", operation, text);
    throw new BackendApiException("Splitwise error: " + text, 200, text);
  }

  private String describe(Object errors) {
    try {
      return objectMapper.writeValueAsString(errors);
    } catch (JsonProcessingException e) {
      return String.valueOf(errors);
    }
  }

  private int cancelOwnCalls(List<Call> calls) {
    int count = 0;
    for (Call call : calls) {
      if (call.request().tag(OkHttpSplitwiseClient.class) == this) {
        call.cancel();
        count++;
      }
    }
    return count;
  }
}
