package com.gentoro.gateway.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/** The OAuth2 token exchange was rejected or returned an unreadable body. */
public class UpstreamAuthException extends GatewayException {
  public UpstreamAuthException(String tenant, int status, String body) {
    super(
        GatewayErrorCode.UPSTREAM_AUTH_FAILED,
        "Token request for tenant %s failed with status %d: %s".formatted(tenant, status, body),
        context(tenant, status, body));
  }

  public UpstreamAuthException(String tenant, String message, Throwable cause) {
    super(
        GatewayErrorCode.UPSTREAM_AUTH_FAILED,
        message,
        Map.of("tenant", String.valueOf(tenant)),
        cause);
  }

  private static Map<String, Object> context(String tenant, int status, String body) {
    Map<String, Object> context = new LinkedHashMap<>();
    context.put("tenant", String.valueOf(tenant));
    context.put("status", status);
    context.put("body", body == null ? "" : body);
    return context;
  }
}
