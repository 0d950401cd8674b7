package com.gentoro.gateway.token;

import com.gentoro.gateway.credentials.TenantCredential;

/** Performs the OAuth2 exchange for one tenant. */
@FunctionalInterface
public interface TokenFetcher {

  /**
   * @throws com.gentoro.gateway.exception.UpstreamAuthException on rejection or unreadable body
   */
  TokenResponse fetch(TenantCredential credential);
}
