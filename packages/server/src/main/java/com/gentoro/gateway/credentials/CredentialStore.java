package com.gentoro.gateway.credentials;

import java.util.Set;

/** Read access to the per-tenant credential set. */
public interface CredentialStore {

  /**
   * @throws com.gentoro.gateway.exception.CredentialsNotFoundException when the tenant has no
   *     entry
   * @throws com.gentoro.gateway.exception.ConfigMissingException when the set could not be loaded
   */
  TenantCredential get(String tenantId);

  /** Identifiers of every tenant with credentials. */
  Set<String> tenants();
}
