package com.gentoro.gateway.token;

import java.util.Optional;

/** Key/value storage for bearer tokens, keyed by tenant id. */
public interface TokenStore {
  Optional<CachedToken> get(String tenantId);

  void put(CachedToken token);
}
