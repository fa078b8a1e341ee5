package com.example.expensegateway.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.mockingDetails;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.example.expensegateway.adapter.splitwise.SplitwiseClient;
import com.example.expensegateway.exception.UnauthenticatedException;
import com.example.expensegateway.security.context.CredentialContext;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SplitwiseClientCacheTest {

  private final Map<String, AtomicInteger> constructions = new ConcurrentHashMap<>();
  private final List<SplitwiseClient> built = new ArrayList<>();
  private SplitwiseClientCache cache;

  @BeforeEach
  void setUp() {
    cache = new SplitwiseClientCache(this::buildClient, Duration.ofHours(24), 1_000, Clock.systemUTC());
  }

  private synchronized SplitwiseClient buildClient(String credential) {
    constructions.computeIfAbsent(credential, key -> new AtomicInteger()).incrementAndGet();
    SplitwiseClient client = mock(SplitwiseClient.class);
    built.add(client);
    return client;
  }

  @Test
  void getOrCreate_sameCredential_returnsSameClient() {
    SplitwiseClient first = cache.getOrCreate("tok-A");
    SplitwiseClient second = cache.getOrCreate("tok-A");

    assertThat(second).isSameAs(first);
    assertThat(constructions.get("tok-A")).hasValue(1);
  }

  @Test
  void getOrCreate_distinctCredentials_returnDistinctClients() {
    assertThat(cache.getOrCreate("tok-A")).isNotSameAs(cache.getOrCreate("tok-B"));
  }

  /**
   * Fifty simultaneous first requests for one credential build exactly one client.
   */
  @Test
  void getOrCreate_concurrentFirstUse_buildsOnce() throws Exception {
    int callers = 50;
    ExecutorService pool = Executors.newFixedThreadPool(callers);
    CyclicBarrier barrier = new CyclicBarrier(callers);
    try {
      List<Callable<SplitwiseClient>> tasks = new ArrayList<>();
      for (int i = 0; i < callers; i++) {
        tasks.add(() -> {
          barrier.await(5, TimeUnit.SECONDS);
          return cache.getOrCreate("tok-A");
        });
      }
      Set<SplitwiseClient> distinct = ConcurrentHashMap.newKeySet();
      for (Future<SplitwiseClient> result : pool.invokeAll(tasks)) {
        distinct.add(result.get());
      }

      assertThat(distinct).hasSize(1);
      assertThat(constructions.get("tok-A")).hasValue(1);
    } finally {
      pool.shutdown();
      pool.awaitTermination(5, TimeUnit.SECONDS);
    }
  }

  @Test
  void getOrCreate_refreshesLastActivity() throws Exception {
    cache.getOrCreate("tok-A");
    CachedClientEntry entry = cache.peek("tok-A").orElseThrow();
    var firstSeen = entry.lastActivity();

    Thread.sleep(5);
    cache.getOrCreate("tok-A");

    assertThat(entry.lastActivity()).isAfter(firstSeen);
  }

  @Test
  void currentClient_usesCredentialFromContext() {
    try (CredentialContext.Scope ignored = CredentialContext.open("tok-A")) {
      assertThat(cache.currentClient()).isSameAs(cache.getOrCreate("tok-A"));
    }
  }

  @Test
  void currentClient_withoutIdentity_isUnauthenticated() {
    assertThatThrownBy(() -> cache.currentClient()).isInstanceOf(UnauthenticatedException.class);
  }

  @Test
  void currentClient_blankCredential_isUnauthenticated() {
    try (CredentialContext.Scope ignored = CredentialContext.open("  ")) {
      assertThatThrownBy(() -> cache.currentClient()).isInstanceOf(UnauthenticatedException.class);
    }
    assertThat(constructions).isEmpty();
  }

  @Test
  void evict_closesClientAndNextCallRebuilds() {
    SplitwiseClient first = cache.getOrCreate("tok-A");

    cache.evict("tok-A");

    verify(first).close();
    assertThat(cache.getOrCreate("tok-A")).isNotSameAs(first);
    assertThat(constructions.get("tok-A")).hasValue(2);
  }

  /**
   * One client failing to close does not stop the rest; a second closeAll is a no-op.
   */
  @Test
  void closeAll_closesEveryClientOnce_despiteFailures() {
    SplitwiseClient a = cache.getOrCreate("tok-A");
    SplitwiseClient b = cache.getOrCreate("tok-B");
    SplitwiseClient c = cache.getOrCreate("tok-C");
    doThrow(new IllegalStateException("socket already gone")).when(b).close();

    cache.closeAll();
    cache.closeAll();

    verify(a, times(1)).close();
    verify(b, times(1)).close();
    verify(c, times(1)).close();
    assertThat(cache.size()).isZero();
  }

  @Test
  void getOrCreate_afterCloseAll_fails() {
    cache.closeAll();

    assertThatThrownBy(() -> cache.getOrCreate("tok-A")).isInstanceOf(IllegalStateException.class);
    assertThat(built).isEmpty();
  }

  /**
   * Idle expiry forgets the entry but leaves the client usable for whoever still holds it.
   */
  @Test
  void idleClients_areDroppedWithoutClosing() throws Exception {
    SplitwiseClientCache shortLived =
        new SplitwiseClientCache(this::buildClient, Duration.ofMillis(20), 1_000, Clock.systemUTC());
    SplitwiseClient client = shortLived.getOrCreate("tok-A");

    Thread.sleep(60);
    shortLived.size();

    verify(client, never()).close();
    assertThat(shortLived.peek("tok-A")).isEmpty();
    assertThat(shortLived.getOrCreate("tok-A")).isNotSameAs(client);
  }

  @Test
  void sizeEviction_doesNotCloseClientsInUse() {
    SplitwiseClientCache tiny = new SplitwiseClientCache(this::buildClient, Duration.ofHours(24), 1, Clock.systemUTC());
    SplitwiseClient a = tiny.getOrCreate("tok-A");
    SplitwiseClient b = tiny.getOrCreate("tok-B");

    assertThat(tiny.size()).isEqualTo(1);
    verify(a, never()).close();
    verify(b, never()).close();
  }

  @Test
  void closeAll_afterEviction_closesOnlyCachedClients() {
    SplitwiseClientCache tiny = new SplitwiseClientCache(this::buildClient, Duration.ofHours(24), 1, Clock.systemUTC());
    tiny.getOrCreate("tok-A");
    tiny.getOrCreate("tok-B");
    tiny.size();

    tiny.closeAll();

    long closed = built.stream()
        .filter(client -> mockingDetails(client).getInvocations().stream()
            .anyMatch(invocation -> invocation.getMethod().getName().equals("close")))
        .count();
    assertThat(closed).isEqualTo(1);
  }

  @Test
  void evict_unknownCredential_doesNothing() {
    SplitwiseClient client = cache.getOrCreate("tok-A");

    cache.evict("tok-Z");
    cache.evict(null);

    verify(client, never()).close();
  }
}
