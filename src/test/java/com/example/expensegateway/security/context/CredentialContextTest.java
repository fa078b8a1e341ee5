package com.example.expensegateway.security.context;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class CredentialContextTest {

  @AfterEach
  void tearDown() {
    while (CredentialContext.get().isPresent()) {
      CredentialContext.clear();
    }
  }

  @Test
  void get_withNothingInstalled_isEmpty() {
    assertThat(CredentialContext.get()).isEmpty();
  }

  @Test
  void setThenClear_restoresEmpty() {
    CredentialContext.set("tok-A");
    assertThat(CredentialContext.get()).contains("tok-A");

    CredentialContext.clear();
    assertThat(CredentialContext.get()).isEmpty();
  }

  /**
   * Clearing an inner install exposes the outer value again, not emptiness.
   */
  @Test
  void nestedInstall_unwindsToOuterValue() {
    CredentialContext.set("tok-A");
    CredentialContext.set("tok-B");
    assertThat(CredentialContext.get()).contains("tok-B");

    CredentialContext.clear();
    assertThat(CredentialContext.get()).contains("tok-A");

    CredentialContext.clear();
    assertThat(CredentialContext.get()).isEmpty();
  }

  @Test
  void open_clearsOnCloseEvenWhenBodyThrows() {
    try (CredentialContext.Scope ignored = CredentialContext.open("tok-A")) {
      throw new IllegalStateException("boom");
    } catch (IllegalStateException expected) {
      assertThat(expected).hasMessage("boom");
    }
    assertThat(CredentialContext.get()).isEmpty();
  }

  @Test
  void scope_closedTwice_clearsOnlyOnce() {
    CredentialContext.set("tok-A");
    CredentialContext.Scope inner = CredentialContext.open("tok-B");

    inner.close();
    inner.close();

    assertThat(CredentialContext.get()).contains("tok-A");
  }

  @Test
  void clear_removesSideTableEntry() {
    int before = CredentialContext.sideTableSize();
    CredentialContext.set("tok-A");
    assertThat(CredentialContext.sideTableSize()).isEqualTo(before + 1);

    CredentialContext.clear();
    assertThat(CredentialContext.sideTableSize()).isEqualTo(before);
  }

  /**
   * Fifty overlapping requests on distinct threads each observe only their own credential.
   */
  @Test
  void concurrentRequests_neverObserveEachOther() throws Exception {
    int requests = 50;
    ExecutorService pool = Executors.newFixedThreadPool(requests);
    CyclicBarrier barrier = new CyclicBarrier(requests);
    try {
      List<Callable<Boolean>> tasks = new ArrayList<>();
      for (int i = 0; i < requests; i++) {
        String credential = "tok-" + i;
        tasks.add(() -> {
          try (CredentialContext.Scope ignored = CredentialContext.open(credential)) {
            barrier.await(5, TimeUnit.SECONDS);
            boolean own = true;
            for (int n = 0; n < 100; n++) {
              own &= CredentialContext.get().equals(Optional.of(credential));
              Thread.yield();
            }
            return own;
          }
        });
      }
      for (Future<Boolean> result : pool.invokeAll(tasks)) {
        assertThat(result.get()).isTrue();
      }
    } finally {
      pool.shutdown();
      pool.awaitTermination(5, TimeUnit.SECONDS);
    }
  }

  /**
   * A pooled thread that served one request must not leak its credential to the next.
   */
  @Test
  void pooledThread_doesNotLeakBetweenTasks() throws Exception {
    ExecutorService pool = Executors.newSingleThreadExecutor();
    try {
      pool.submit(() -> {
        try (CredentialContext.Scope ignored = CredentialContext.open("tok-A")) {
          return CredentialContext.get();
        }
      }).get();

      Optional<String> seenByNextTask = pool.submit(CredentialContext::get).get();
      assertThat(seenByNextTask).isEmpty();
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void wrap_carriesCredentialToAnotherThread() throws Exception {
    ExecutorService pool = Executors.newSingleThreadExecutor();
    try {
      Future<Optional<String>> seen;
      try (CredentialContext.Scope ignored = CredentialContext.open("tok-A")) {
        seen = pool.submit(CredentialContext.wrap((Callable<Optional<String>>) CredentialContext::get));
      }
      assertThat(seen.get()).contains("tok-A");
      assertThat(pool.submit(CredentialContext::get).get()).isEmpty();
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void taskDecorator_propagatesAndCleansUp() throws Exception {
    CredentialContextTaskDecorator decorator = new CredentialContextTaskDecorator();
    List<Optional<String>> seen = new ArrayList<>();
    CountDownLatch done = new CountDownLatch(1);

    Runnable decorated;
    try (CredentialContext.Scope ignored = CredentialContext.open("tok-A")) {
      decorated = decorator.decorate(() -> {
        seen.add(CredentialContext.get());
        done.countDown();
      });
    }

    Thread worker = new Thread(decorated);
    worker.start();
    assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
    worker.join();

    assertThat(seen).containsExactly(Optional.of("tok-A"));
    assertThat(CredentialContext.get()).isEmpty();
  }
}
