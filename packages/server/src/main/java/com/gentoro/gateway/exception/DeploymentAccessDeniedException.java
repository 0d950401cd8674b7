package com.gentoro.gateway.exception;

import java.util.Map;

/** The requested tenant exists but is not part of the caller's scope. */
public class DeploymentAccessDeniedException extends GatewayException {
  public DeploymentAccessDeniedException(String user, String tenant) {
    super(
        GatewayErrorCode.DEPLOYMENT_ACCESS_DENIED,
        "User %s is not allowed to act on tenant %s".formatted(user, tenant),
        Map.of("user", String.valueOf(user), "tenant", String.valueOf(tenant)));
  }
}
