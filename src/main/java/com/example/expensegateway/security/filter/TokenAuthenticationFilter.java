package com.example.expensegateway.security.filter;

import com.example.expensegateway.domain.entity.UserHandle;
import com.example.expensegateway.exception.CredentialStoreException;
import com.example.expensegateway.properties.ApplicationProperties;
import com.example.expensegateway.security.context.CredentialContext;
import com.example.expensegateway.store.CredentialStore;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.servlet.HandlerExceptionResolver;

/**
 * Resolves the {@code token} query parameter to the user's bearer credential and installs
 * it in {@link CredentialContext} for exactly the duration of the request.
 *
 * <p>Requests without a token, or with one that does not resolve, continue without an
 * identity; endpoints that need one reject them. The root path and the configured public
 * prefixes are never resolved.
 */
@Slf4j
@Component
public class TokenAuthenticationFilter extends OncePerRequestFilter {

  public static final String TOKEN_PARAMETER = "token";
  private static final String ROOT_PATH = "/";

  private final CredentialStore credentialStore;
  private final List<String> publicPaths;
  private final HandlerExceptionResolver exceptionResolver;

  public TokenAuthenticationFilter(
      CredentialStore credentialStore,
      ApplicationProperties properties,
      @Qualifier("handlerExceptionResolver") HandlerExceptionResolver exceptionResolver) {
    this.credentialStore = credentialStore;
    this.publicPaths = List.copyOf(properties.identity().publicPaths());
    this.exceptionResolver = exceptionResolver;
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return isPublicPath(pathOf(request));
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request,
      HttpServletResponse response,
      FilterChain filterChain
                                 ) throws ServletException, IOException {

    String token = request.getParameter(TOKEN_PARAMETER);
    if (token == null || token.isBlank()) {
      filterChain.doFilter(request, response);
      return;
    }

    Optional<String> credential;
    try {
      credential = credentialStore.resolve(token);
    } catch (CredentialStoreException e) {
      log.error("Credential store unavailable while resolving handle {}", UserHandle.mask(token), e);
      exceptionResolver.resolveException(request, response, null, e);
      return;
    }

    if (credential.isEmpty()) {
      log.warn("Unknown user handle {}, continuing without identity", UserHandle.mask(token));
      filterChain.doFilter(request, response);
      return;
    }

    try (CredentialContext.Scope ignored = CredentialContext.open(credential.get())) {
      log.trace("Credential installed for handle {}", UserHandle.mask(token));
      filterChain.doFilter(request, response);
    }
  }

  boolean isPublicPath(String path) {
    if (path == null || path.isEmpty() || ROOT_PATH.equals(path)) {
      return true;
    }
    for (String prefix : publicPaths) {
      if (path.equals(prefix) || path.startsWith(prefix.endsWith("/") ? prefix : prefix + "/")) {
        return true;
      }
    }
    return false;
  }

  private static String pathOf(HttpServletRequest request) {
    String uri = request.getRequestURI();
    String contextPath = request.getContextPath();
    if (uri != null && contextPath != null && !contextPath.isEmpty() && uri.startsWith(contextPath)) {
      return uri.substring(contextPath.length());
    }
    return uri;
  }
}
