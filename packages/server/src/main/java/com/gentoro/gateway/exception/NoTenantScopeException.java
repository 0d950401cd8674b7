package com.gentoro.gateway.exception;

import java.util.Map;

/** The caller identity maps to no tenant at all. */
public class NoTenantScopeException extends GatewayException {
  public NoTenantScopeException(String username) {
    super(
        GatewayErrorCode.NO_TENANT_SCOPE,
        "User is not assigned to any tenant: " + username,
        Map.of("user", String.valueOf(username)));
  }
}
