package com.gentoro.gateway.token;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/** Process-local {@link TokenStore}: read lock for lookups, write lock for inserts. */
public class InMemoryTokenStore implements TokenStore {
  private final Map<String, CachedToken> tokens = new HashMap<>();
  private final ReadWriteLock lock = new ReentrantReadWriteLock();

  @Override
  public Optional<CachedToken> get(String tenantId) {
    lock.readLock().lock();
    try {
      return Optional.ofNullable(tokens.get(tenantId));
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public void put(CachedToken token) {
    lock.writeLock().lock();
    try {
      tokens.put(token.tenantId(), token);
    } finally {
      lock.writeLock().unlock();
    }
  }
}
