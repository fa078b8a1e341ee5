package com.example.expensegateway.adapter.splitwise;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.example.expensegateway.adapter.splitwise.dto.ExpenseQuery;
import com.example.expensegateway.exception.BackendApiException;
import com.example.expensegateway.exception.RateLimitException;
import com.example.expensegateway.properties.ApplicationProperties;
import com.example.expensegateway.properties.ApplicationProperties.SplitwiseProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OkHttpSplitwiseClientTest {

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final OkHttpClient sharedClient = new OkHttpClient.Builder()
      .connectTimeout(Duration.ofSeconds(2))
      .readTimeout(Duration.ofSeconds(2))
      .build();
  private MockWebServer server;
  private SplitwiseClient client;

  @BeforeEach
  void setUp() throws IOException {
    server = new MockWebServer();
    server.start();
    client = factoryFor(server.url("/api/v3.0").toString()).create("bearer-A");
  }

  @AfterEach
  void tearDown() throws IOException {
    client.close();
    server.shutdown();
  }

  private OkHttpSplitwiseClientFactory factoryFor(String apiBaseUrl) {
    ApplicationProperties properties = mock(ApplicationProperties.class);
    when(properties.splitwise()).thenReturn(new SplitwiseProperties(
        "client", "secret", "http://localhost/authorize", "http://localhost/token", apiBaseUrl,
        Duration.ofMinutes(10)));
    return new OkHttpSplitwiseClientFactory(sharedClient, objectMapper, properties);
  }

  private static MockResponse json(int status, String body) {
    return new MockResponse().setResponseCode(status).setHeader("Content-Type", "application/json").setBody(body);
  }

  private Map<String, Object> bodyOf(RecordedRequest request) throws IOException {
    return objectMapper.readValue(request.getBody().readUtf8(), new TypeReference<Map<String, Object>>() {});
  }

  @Test
  void getCurrentUser_sendsBearerCredential() throws Exception {
    server.enqueue(json(200, "{\"user\":{\"id\":42,\"first_name\":\"Asha\"}}"));

    Map<String, Object> result = client.getCurrentUser();

    RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
    assertThat(request.getMethod()).isEqualTo("GET");
    assertThat(request.getPath()).isEqualTo("/api/v3.0/get_current_user");
    assertThat(request.getHeader("Authorization")).isEqualTo("Bearer bearer-A");
    assertThat(result).containsKey("user");
  }

  @Test
  void clientsForDifferentCredentials_sendTheirOwnBearer() throws Exception {
    server.enqueue(json(200, "{}"));
    server.enqueue(json(200, "{}"));
    SplitwiseClient other = factoryFor(server.url("/api/v3.0").toString()).create("bearer-B");

    client.getFriends();
    other.getFriends();

    assertThat(server.takeRequest().getHeader("Authorization")).isEqualTo("Bearer bearer-A");
    assertThat(server.takeRequest().getHeader("Authorization")).isEqualTo("Bearer bearer-B");
    other.close();
  }

  @Test
  void getExpenses_sendsOnlyPresentFilters() throws Exception {
    server.enqueue(json(200, "{\"expenses\":[]}"));

    client.getExpenses(new ExpenseQuery(7L, null, "2026-01-01", null, null, null, 5, null));

    assertThat(server.takeRequest().getPath())
        .isEqualTo("/api/v3.0/get_expenses?group_id=7&dated_after=2026-01-01&limit=5&offset=0");
  }

  @Test
  void createExpense_flattensParticipants() throws Exception {
    server.enqueue(json(200, "{\"expenses\":[{\"id\":1}],\"errors\":{}}"));
    Map<String, Object> first = new LinkedHashMap<>();
    first.put("user_id", 1L);
    first.put("email", null);
    first.put("paid_share", "10.00");
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("cost", "10.00");
    payload.put("description", "Taxi");
    payload.put("category_id", null);
    payload.put("users", List.of(first, Map.of("user_id", 2L, "owed_share", "5.00")));

    Map<String, Object> result = client.createExpense(payload);

    RecordedRequest request = server.takeRequest();
    assertThat(request.getPath()).isEqualTo("/api/v3.0/create_expense");
    assertThat(bodyOf(request))
        .containsEntry("cost", "10.00")
        .containsEntry("users__0__user_id", 1)
        .containsEntry("users__0__paid_share", "10.00")
        .containsEntry("users__1__user_id", 2)
        .containsEntry("users__1__owed_share", "5.00")
        .doesNotContainKeys("users", "users__0__email", "category_id");
    assertThat(result).containsKey("expenses");
  }

  @Test
  void createExpense_errorsInSuccessfulResponse_areRaised() {
    server.enqueue(json(200, "{\"expenses\":[],\"errors\":{\"base\":[\"User 2 is not in your friends list\"]}}"));

    assertThatThrownBy(() -> client.createExpense(Map.of("cost", "1.00", "description", "x")))
        .isInstanceOfSatisfying(BackendApiException.class, e -> {
          assertThat(e.getStatusCode()).isEqualTo(200);
          assertThat(e.getErrorText()).contains("not in your friends list");
        });
  }

  @Test
  void tooManyRequests_raisesRateLimit() {
    server.enqueue(json(429, "{\"error\":\"slow down\"}"));

    assertThatThrownBy(() -> client.getGroups())
        .isInstanceOfSatisfying(RateLimitException.class, e -> {
          assertThat(e.getStatusCode()).isEqualTo(429);
          assertThat(e.getResponseBody()).contains("slow down");
        });
  }

  @Test
  void errorStatus_raisesBackendErrorWithBody() {
    server.enqueue(json(404, "{\"errors\":{\"base\":[\"Invalid API Request: record not found\"]}}"));

    assertThatThrownBy(() -> client.getExpense(123))
        .isInstanceOfSatisfying(BackendApiException.class, e -> {
          assertThat(e).isNotInstanceOf(RateLimitException.class);
          assertThat(e.getStatusCode()).isEqualTo(404);
          assertThat(e.getResponseBody()).contains("record not found");
        });
  }

  @Test
  void unreachableBackend_raisesBackendErrorWithoutStatus() throws IOException {
    MockWebServer gone = new MockWebServer();
    gone.start();
    String url = gone.url("/api/v3.0").toString();
    gone.shutdown();
    SplitwiseClient unreachable = factoryFor(url).create("bearer-A");

    assertThatThrownBy(unreachable::getCategories)
        .isInstanceOfSatisfying(BackendApiException.class, e -> assertThat(e.getStatusCode()).isZero());
  }

  @Test
  void emptyBody_isEmptyResult() {
    server.enqueue(new MockResponse().setResponseCode(200));

    assertThat(client.deleteComment(5)).isEmpty();
  }

  @Test
  void closedClient_rejectsCalls() {
    client.close();
    client.close();

    assertThat(((OkHttpSplitwiseClient) client).isClosed()).isTrue();
    assertThatThrownBy(() -> client.getFriends()).isInstanceOf(IllegalStateException.class);
    assertThat(server.getRequestCount()).isZero();
  }

  @Test
  void flatten_dropsNullsAndKeepsScalarLists() {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("name", "Trip");
    payload.put("tags", List.of("a", "b"));
    payload.put("missing", null);

    assertThat(OkHttpSplitwiseClient.flatten(payload))
        .containsOnlyKeys("name", "tags")
        .containsEntry("tags", List.of("a", "b"));
  }
}
