package com.gentoro.gateway.token;

import java.time.Instant;

/**
 * Bearer token of one tenant. {@code expiresAt} already includes the safety margin, so the token is
 * usable exactly while {@code now < expiresAt}.
 */
public record CachedToken(String tenantId, String bearerToken, Instant expiresAt) {

  public boolean isUsableAt(Instant now) {
    return now.isBefore(expiresAt);
  }

  @Override
  public String toString() {
    return "CachedToken[tenantId=%s, expiresAt=%s]".formatted(tenantId, expiresAt);
  }
}
