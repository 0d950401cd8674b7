package com.gentoro.gateway.credentials;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.gateway.exception.ConfigMissingException;
import com.gentoro.gateway.exception.CredentialsNotFoundException;
import com.gentoro.gateway.exception.GatewayErrorCode;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class LazyCredentialStoreTest {

  static final String BLOB =
      """
      [
        {"team":"team-x","clientId":"id-x","clientSecret":"s-x","oauthUrl":"https://auth/x",
         "apiUrl":"https://api/x","resourceGroup":"rg-x"},
        {"team":"team-y","clientId":"id-y","clientSecret":"s-y","oauthUrl":"https://auth/y",
         "apiUrl":"https://api/y","resourceGroup":"rg-y"}
      ]
      """;

  @Test
  void loadsOnFirstUseAndKeysByTeam() {
    LazyCredentialStore store = new LazyCredentialStore(() -> BLOB);
    assertEquals(LazyCredentialStore.State.UNINITIALIZED, store.state());

    TenantCredential x = store.get("team-x");

    assertEquals(LazyCredentialStore.State.LOADED, store.state());
    assertEquals("id-x", x.clientId());
    assertEquals("https://auth/x", x.tokenUrl());
    assertEquals("https://api/x", x.apiBaseUrl());
    assertEquals("rg-x", x.resourceGroup());
    assertEquals(Set.of("team-x", "team-y"), store.tenants());
  }

  @Test
  void unknownTenantFailsWithCredentialsNotFound() {
    LazyCredentialStore store = new LazyCredentialStore(() -> BLOB);

    CredentialsNotFoundException ex =
        assertThrows(CredentialsNotFoundException.class, () -> store.get("team-z"));
    assertEquals("team-z", ex.getTenant());
    assertEquals(GatewayErrorCode.TENANT_NOT_FOUND, ex.getCode());
  }

  @Test
  void missingBlobFailsWithConfigMissing() {
    LazyCredentialStore store = new LazyCredentialStore(() -> null);

    ConfigMissingException ex = assertThrows(ConfigMissingException.class, store::tenants);
    assertEquals(GatewayErrorCode.CONFIG_MISSING, ex.getCode());
    assertEquals(LazyCredentialStore.State.FAILED, store.state());
  }

  @Test
  void malformedBlobFailsWithConfigMissing() {
    LazyCredentialStore store = new LazyCredentialStore(() -> "{not json");
    assertThrows(ConfigMissingException.class, () -> store.get("team-x"));
  }

  @Test
  void entryWithoutTeamIsRejected() {
    assertThrows(
        ConfigMissingException.class,
        () -> LazyCredentialStore.parse("[{\"clientId\":\"a\",\"clientSecret\":\"b\"}]"));
  }

  @Test
  void failedLoadIsPermanent() {
    AtomicInteger reads = new AtomicInteger();
    List<String> blobs = new ArrayList<>(List.of("", BLOB));
    LazyCredentialStore store =
        new LazyCredentialStore(
            () -> {
              reads.incrementAndGet();
              return blobs.remove(0);
            });

    ConfigMissingException first = assertThrows(ConfigMissingException.class, store::tenants);
    ConfigMissingException second =
        assertThrows(ConfigMissingException.class, () -> store.get("team-x"));

    // the valid blob is never read: the first outcome sticks
    assertSame(first, second);
    assertEquals(1, reads.get());
  }

  @Test
  void sourceFailureIsCachedAsConfigMissing() {
    LazyCredentialStore store =
        new LazyCredentialStore(
            () -> {
              throw new IllegalStateException("vault down");
            });

    ConfigMissingException ex = assertThrows(ConfigMissingException.class, store::tenants);
    assertInstanceOf(IllegalStateException.class, ex.getCause());
    assertEquals(LazyCredentialStore.State.FAILED, store.state());
  }

  @Test
  void concurrentFirstCallersShareOneLoad() throws Exception {
    AtomicInteger reads = new AtomicInteger();
    CountDownLatch start = new CountDownLatch(1);
    LazyCredentialStore store =
        new LazyCredentialStore(
            () -> {
              reads.incrementAndGet();
              try {
                Thread.sleep(50);
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
              }
              return BLOB;
            });

    ExecutorService pool = Executors.newFixedThreadPool(8);
    try {
      List<Future<TenantCredential>> futures = new ArrayList<>();
      for (int i = 0; i < 16; i++) {
        futures.add(
            pool.submit(
                () -> {
                  start.await();
                  return store.get("team-y");
                }));
      }
      start.countDown();
      for (Future<TenantCredential> future : futures) {
        assertEquals("id-y", future.get(5, TimeUnit.SECONDS).clientId());
      }
    } finally {
      pool.shutdownNow();
    }
    assertEquals(1, reads.get());
  }

  @Test
  void toStringHidesSecret() {
    TenantCredential credential = LazyCredentialStore.parse(BLOB).get("team-x");
    assertFalse(credential.toString().contains("s-x"));
  }
}
