package com.example.expensegateway.security.filter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.expensegateway.exception.CredentialStoreException;
import com.example.expensegateway.properties.ApplicationProperties;
import com.example.expensegateway.properties.ApplicationProperties.IdentityProperties;
import com.example.expensegateway.security.context.CredentialContext;
import com.example.expensegateway.store.CredentialStore;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.web.servlet.HandlerExceptionResolver;

class TokenAuthenticationFilterTest {

  private static final String HANDLE = "6f1c2b9e-3a4d-4e5f-8a7b-9c0d1e2f3a4b";

  private CredentialStore store;
  private HandlerExceptionResolver resolver;
  private TokenAuthenticationFilter filter;
  private final List<Optional<String>> seenByChain = new ArrayList<>();
  private final FilterChain recordingChain = (req, res) -> seenByChain.add(CredentialContext.get());

  @BeforeEach
  void setUp() {
    store = mock(CredentialStore.class);
    resolver = mock(HandlerExceptionResolver.class);
    ApplicationProperties properties = mock(ApplicationProperties.class);
    when(properties.identity()).thenReturn(new IdentityProperties(List.of("/authorize", "/callback")));
    filter = new TokenAuthenticationFilter(store, properties, resolver);
  }

  @AfterEach
  void tearDown() {
    while (CredentialContext.get().isPresent()) {
      CredentialContext.clear();
    }
  }

  private static MockHttpServletRequest request(String path, String token) {
    MockHttpServletRequest request = new MockHttpServletRequest("GET", path);
    if (token != null) {
      request.setParameter(TokenAuthenticationFilter.TOKEN_PARAMETER, token);
    }
    return request;
  }

  @Test
  void resolvedToken_isVisibleInsideChainAndClearedAfter() throws Exception {
    when(store.resolve(HANDLE)).thenReturn(Optional.of("bearer-A"));

    filter.doFilter(request("/api/me", HANDLE), new MockHttpServletResponse(), recordingChain);

    assertThat(seenByChain).containsExactly(Optional.of("bearer-A"));
    assertThat(CredentialContext.get()).isEmpty();
  }

  @Test
  void credentialIsClearedWhenChainThrows() {
    when(store.resolve(HANDLE)).thenReturn(Optional.of("bearer-A"));
    FilterChain failing = (req, res) -> {
      throw new ServletException("handler blew up");
    };

    assertThatThrownBy(() -> filter.doFilter(request("/api/me", HANDLE), new MockHttpServletResponse(), failing))
        .isInstanceOf(ServletException.class);
    assertThat(CredentialContext.get()).isEmpty();
  }

  @Test
  void missingToken_continuesWithoutIdentity() throws Exception {
    filter.doFilter(request("/api/me", null), new MockHttpServletResponse(), recordingChain);

    assertThat(seenByChain).containsExactly(Optional.empty());
    verify(store, never()).resolve(anyString());
  }

  @Test
  void blankToken_continuesWithoutIdentity() throws Exception {
    filter.doFilter(request("/api/me", "  "), new MockHttpServletResponse(), recordingChain);

    assertThat(seenByChain).containsExactly(Optional.empty());
    verify(store, never()).resolve(anyString());
  }

  @Test
  void unknownToken_continuesWithoutIdentity() throws Exception {
    when(store.resolve(HANDLE)).thenReturn(Optional.empty());

    filter.doFilter(request("/api/me", HANDLE), new MockHttpServletResponse(), recordingChain);

    assertThat(seenByChain).containsExactly(Optional.empty());
  }

  @Test
  void storeFailure_isHandedToExceptionResolver() throws Exception {
    CredentialStoreException failure = new CredentialStoreException("redis down");
    when(store.resolve(HANDLE)).thenThrow(failure);

    filter.doFilter(request("/api/me", HANDLE), new MockHttpServletResponse(), recordingChain);

    assertThat(seenByChain).isEmpty();
    verify(resolver).resolveException(any(), any(), isNull(), eq(failure));
  }

  @Test
  void publicPaths_areNeverResolved() throws Exception {
    for (String path : List.of("/", "/authorize", "/callback", "/callback/extra")) {
      filter.doFilter(request(path, HANDLE), new MockHttpServletResponse(), recordingChain);
    }

    assertThat(seenByChain).hasSize(4).containsOnly(Optional.empty());
    verify(store, never()).resolve(anyString());
  }

  @Test
  void isPublicPath_matchesWholeSegmentsOnly() {
    assertThat(filter.isPublicPath("")).isTrue();
    assertThat(filter.isPublicPath("/")).isTrue();
    assertThat(filter.isPublicPath("/authorize")).isTrue();
    assertThat(filter.isPublicPath("/authorize/again")).isTrue();
    assertThat(filter.isPublicPath("/authorizes")).isFalse();
    assertThat(filter.isPublicPath("/api")).isFalse();
    assertThat(filter.isPublicPath("/api/callback")).isFalse();
  }
}
