package com.example.expensegateway.security.context;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;

/**
 * Holds the bearer credential of the request being served on the current thread.
 *
 * <p>Two channels carry the value. The primary one is a thread-local stack, so nested
 * installs unwind to the previous value. The secondary one is a side table keyed by
 * thread id, read only when the stack is empty. Both are installed by {@link #set} and
 * unwound by {@link #clear}.
 *
 * <p>Work handed to another thread does not inherit the value; use {@link #wrap(Runnable)}
 * or {@link CredentialContextTaskDecorator}.
 */
@Slf4j
public final class CredentialContext {

  private static final ThreadLocal<Deque<String>> SCOPED = ThreadLocal.withInitial(ArrayDeque::new);
  private static final Map<Long, String> SIDE_TABLE = new ConcurrentHashMap<>();

  private CredentialContext() {}

  public static Optional<String> get() {
    String scoped = SCOPED.get().peek();
    if (scoped != null) {
      return Optional.of(scoped);
    }
    return Optional.ofNullable(SIDE_TABLE.get(currentThreadId()));
  }

  public static void set(String bearerCredential) {
    if (bearerCredential == null) {
      throw new IllegalArgumentException("bearerCredential must not be null");
    }
    SCOPED.get().push(bearerCredential);
    SIDE_TABLE.put(currentThreadId(), bearerCredential);
  }

  /**
   * Undoes the most recent {@link #set} on this thread. The side table follows the
   * stack: it is restored to the outer value, or its entry removed once the stack is empty.
   */
  public static void clear() {
    Deque<String> stack = SCOPED.get();
    if (!stack.isEmpty()) {
      stack.pop();
    }
    String outer = stack.peek();
    if (outer != null) {
      SIDE_TABLE.put(currentThreadId(), outer);
    } else {
      SIDE_TABLE.remove(currentThreadId());
      SCOPED.remove();
    }
  }

  /**
   * Installs the value and returns a scope that clears it on close.
   */
  public static Scope open(String bearerCredential) {
    set(bearerCredential);
    return new Scope();
  }

  /**
   * Captures the credential active now and installs it around {@code task} on whichever
   * thread eventually runs it.
   */
  public static Runnable wrap(Runnable task) {
    Optional<String> captured = get();
    if (captured.isEmpty()) {
      return task;
    }
    String value = captured.get();
    return () -> {
      try (Scope ignored = open(value)) {
        task.run();
      }
    };
  }

  public static <V> Callable<V> wrap(Callable<V> task) {
    Optional<String> captured = get();
    if (captured.isEmpty()) {
      return task;
    }
    String value = captured.get();
    return () -> {
      try (Scope ignored = open(value)) {
        return task.call();
      }
    };
  }

  static int sideTableSize() {
    return SIDE_TABLE.size();
  }

  private static long currentThreadId() {
    return Thread.currentThread().getId();
  }

  /**
   * Closing clears exactly one level, once.
   */
  public static final class Scope implements AutoCloseable {

    private boolean closed;

    private Scope() {}

    @Override
    public void close() {
      if (closed) {
        log.trace("Credential scope already closed");
        return;
      }
      closed = true;
      clear();
    }
  }
}
