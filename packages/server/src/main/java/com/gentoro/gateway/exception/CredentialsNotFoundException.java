package com.gentoro.gateway.exception;

import java.util.Map;

/** No credential entry exists for the requested tenant. */
public class CredentialsNotFoundException extends TenantNotFoundException {
  private final String tenant;

  public CredentialsNotFoundException(String tenant) {
    super("No credentials found for tenant: " + tenant, Map.of("tenant", String.valueOf(tenant)));
    this.tenant = tenant;
  }

  public String getTenant() {
    return tenant;
  }
}
