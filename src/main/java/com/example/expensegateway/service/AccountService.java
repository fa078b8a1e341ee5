package com.example.expensegateway.service;

import com.example.expensegateway.domain.entity.CredentialRecord;
import com.example.expensegateway.domain.entity.UserHandle;
import com.example.expensegateway.exception.UnauthenticatedException;
import com.example.expensegateway.security.context.CredentialContext;
import com.example.expensegateway.store.CredentialStore;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Operations on the caller's own connection.
 */
@Slf4j
@Service
public class AccountService {

  private final CredentialStore credentialStore;
  private final SplitwiseClientCache clientCache;
  private final TaskExecutor taskExecutor;

  public AccountService(
      CredentialStore credentialStore,
      SplitwiseClientCache clientCache,
      @Qualifier("applicationTaskExecutor") TaskExecutor taskExecutor) {
    this.credentialStore = credentialStore;
    this.clientCache = clientCache;
    this.taskExecutor = taskExecutor;
  }

  public CredentialRecord connection(String handle) {
    requireIdentity();
    return credentialStore.find(handle)
        .orElseThrow(() -> new UnauthenticatedException("This connection no longer exists"));
  }

  /**
   * Revokes the handle and closes its cached client. The credential itself stays valid
   * at Splitwise; the user can revoke it there.
   */
  public boolean disconnect(String handle) {
    String credential = requireIdentity();
    boolean revoked = credentialStore.revoke(handle);
    clientCache.evict(credential);
    log.info("Disconnected handle {} (revoked={})", UserHandle.mask(handle), revoked);
    return revoked;
  }

  /**
   * Current user, groups and friends, fetched in parallel on the task executor.
   */
  public Map<String, Object> overview() {
    requireIdentity();
    CompletableFuture<Map<String, Object>> user =
        CompletableFuture.supplyAsync(() -> clientCache.currentClient().getCurrentUser(), taskExecutor);
    CompletableFuture<Map<String, Object>> groups =
        CompletableFuture.supplyAsync(() -> clientCache.currentClient().getGroups(), taskExecutor);
    CompletableFuture<Map<String, Object>> friends =
        CompletableFuture.supplyAsync(() -> clientCache.currentClient().getFriends(), taskExecutor);

    try {
      CompletableFuture.allOf(user, groups, friends).join();
    } catch (CompletionException e) {
      if (e.getCause() instanceof RuntimeException) {
        throw (RuntimeException) e.getCause();
      }
      throw e;
    }

    Map<String, Object> overview = new LinkedHashMap<>();
    overview.put("user", user.join().get("user"));
    overview.put("groups", groups.join().get("groups"));
    overview.put("friends", friends.join().get("friends"));
    return overview;
  }

  private String requireIdentity() {
    return CredentialContext.get()
        .orElseThrow(() -> new UnauthenticatedException("No Splitwise account is connected for this request"));
  }
}
