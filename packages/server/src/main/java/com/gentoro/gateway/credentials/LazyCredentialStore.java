package com.gentoro.gateway.credentials;

import com.fasterxml.jackson.core.type.TypeReference;
import com.gentoro.gateway.exception.ConfigMissingException;
import com.gentoro.gateway.exception.CredentialsNotFoundException;
import com.gentoro.gateway.utility.JacksonUtility;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * {@link CredentialStore} that parses the credential blob on first use and keeps the outcome for
 * the lifetime of the process.
 *
 * <p>The first caller performs the load while concurrent callers block on the same monitor; every
 * caller then observes the same result. A failed load is terminal: the {@link State#FAILED} state
 * is never left, so a blob that becomes available after start-up is only picked up by a restart.
 */
public class LazyCredentialStore implements CredentialStore {
  private static final org.slf4j.Logger log =
      com.gentoro.gateway.logging.LoggingService.getLogger(LazyCredentialStore.class);

  enum State {
    UNINITIALIZED,
    LOADED,
    FAILED
  }

  private final CredentialSource source;
  private volatile State state = State.UNINITIALIZED;
  private volatile Map<String, TenantCredential> credentials = Collections.emptyMap();
  private volatile ConfigMissingException failure;

  public LazyCredentialStore(CredentialSource source) {
    this.source = Objects.requireNonNull(source, "source");
  }

  @Override
  public TenantCredential get(String tenantId) {
    TenantCredential credential = load().get(tenantId);
    if (credential == null) {
      throw new CredentialsNotFoundException(tenantId);
    }
    return credential;
  }

  @Override
  public Set<String> tenants() {
    return load().keySet();
  }

  State state() {
    return state;
  }

  /** Loads the credential set at most once and returns it, or rethrows the cached failure. */
  Map<String, TenantCredential> load() {
    if (state == State.UNINITIALIZED) {
      synchronized (this) {
        if (state == State.UNINITIALIZED) {
          try {
            credentials = parse(source.read());
            state = State.LOADED;
            log.info("Loaded credentials for {} tenant(s)", credentials.size());
          } catch (RuntimeException e) {
            failure =
                e instanceof ConfigMissingException missing
                    ? missing
                    : new ConfigMissingException("Failed to read tenant credentials", e);
            state = State.FAILED;
            log.error("Tenant credentials could not be loaded: {}", failure.getMessage());
          }
        }
      }
    }
    if (state == State.FAILED) {
      throw failure;
    }
    return credentials;
  }

  static Map<String, TenantCredential> parse(String blob) {
    if (blob == null || blob.isBlank()) {
      throw new ConfigMissingException("Tenant credentials are not configured");
    }
    List<TenantCredential> list;
    try {
      list =
          JacksonUtility.getJsonMapper()
              .readValue(blob, new TypeReference<List<TenantCredential>>() {});
    } catch (Exception e) {
      throw new ConfigMissingException("Failed to parse tenant credentials", e);
    }
    if (list == null) {
      throw new ConfigMissingException("Tenant credentials must be a JSON array");
    }
    Map<String, TenantCredential> byTenant = new LinkedHashMap<>();
    for (TenantCredential credential : list) {
      if (credential == null || credential.tenantId() == null || credential.tenantId().isBlank()) {
        throw new ConfigMissingException("Tenant credential entry without a team name");
      }
      byTenant.put(credential.tenantId(), credential);
    }
    return Collections.unmodifiableMap(byTenant);
  }
}
