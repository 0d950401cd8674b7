package com.gentoro.gateway.token;

import com.gentoro.gateway.credentials.CredentialStore;
import com.gentoro.gateway.credentials.TenantCredential;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CompletionException;

/**
 * Hands out bearer tokens per tenant, fetching lazily when the cached token is missing or expired.
 *
 * <p>Expiry is recorded {@code safetyMargin} before the upstream-declared lifetime, so a token with
 * {@code expires_in} of 600 seconds and the default 300 second margin is replaced after 300
 * seconds, and one with {@code expires_in} below the margin is never reused.
 *
 * <p>Concurrent misses for the same tenant share one fetch; different tenants never contend.
 */
public class TokenCache {
  private static final org.slf4j.Logger log =
      com.gentoro.gateway.logging.LoggingService.getLogger(TokenCache.class);
  public static final Duration DEFAULT_SAFETY_MARGIN = Duration.ofMinutes(5);

  private final CredentialStore credentials;
  private final TokenFetcher fetcher;
  private final TokenStore store;
  private final Clock clock;
  private final Duration safetyMargin;
  private final Map<String, CompletableFuture<CachedToken>> inFlight = new ConcurrentHashMap<>();

  public TokenCache(
      CredentialStore credentials,
      TokenFetcher fetcher,
      TokenStore store,
      Clock clock,
      Duration safetyMargin) {
    this.credentials = credentials;
    this.fetcher = fetcher;
    this.store = store;
    this.clock = clock;
    this.safetyMargin = safetyMargin;
  }

  public TokenCache(CredentialStore credentials, TokenFetcher fetcher) {
    this(credentials, fetcher, new InMemoryTokenStore(), Clock.systemUTC(), DEFAULT_SAFETY_MARGIN);
  }

  /** Returns a usable bearer token for {@code tenantId}. */
  public String getToken(String tenantId) {
    Optional<CachedToken> cached = store.get(tenantId);
    if (cached.isPresent() && cached.get().isUsableAt(clock.instant())) {
      return cached.get().bearerToken();
    }
    return refresh(credentials.get(tenantId)).bearerToken();
  }

  private CachedToken refresh(TenantCredential credential) {
    String tenantId = credential.tenantId();
    CompletableFuture<CachedToken> mine = new CompletableFuture<>();
    CompletableFuture<CachedToken> running = inFlight.putIfAbsent(tenantId, mine);
    if (running != null) {
      log.trace("Joining in-flight token fetch for tenant {}", tenantId);
      return join(running);
    }
    try {
      // another caller may have stored a fresh token between our lookup and the claim
      Optional<CachedToken> cached = store.get(tenantId);
      CachedToken token;
      if (cached.isPresent() && cached.get().isUsableAt(clock.instant())) {
        token = cached.get();
      } else {
        token = fetch(credential);
        store.put(token);
      }
      mine.complete(token);
      return token;
    } catch (RuntimeException | Error e) {
      // waiters must be released whatever the leader fails with
      mine.completeExceptionally(e);
      throw e;
    } finally {
      inFlight.remove(tenantId, mine);
    }
  }

  private CachedToken fetch(TenantCredential credential) {
    Instant fetchedAt = clock.instant();
    TokenResponse response = fetcher.fetch(credential);
    Instant expiresAt =
        fetchedAt.plusSeconds(response.expiresIn()).minus(safetyMargin);
    log.debug(
        "Fetched token for tenant {} (expires_in={}s, usable until {})",
        credential.tenantId(),
        response.expiresIn(),
        expiresAt);
    return new CachedToken(credential.tenantId(), response.accessToken(), expiresAt);
  }

  private static CachedToken join(CompletableFuture<CachedToken> future) {
    try {
      return future.join();
    } catch (CompletionException e) {
      if (e.getCause() instanceof RuntimeException cause) {
        throw cause;
      }
      if (e.getCause() instanceof Error error) {
        throw error;
      }
      throw e;
    }
  }
}
