package com.gentoro.gateway.exception;

import java.util.Map;

/** A single required tenant could not be resolved for the caller. */
public class TenantNotFoundException extends GatewayException {
  public TenantNotFoundException(String message) {
    super(GatewayErrorCode.TENANT_NOT_FOUND, message);
  }

  public TenantNotFoundException(String message, Map<String, ?> context) {
    super(GatewayErrorCode.TENANT_NOT_FOUND, message, context);
  }

  public TenantNotFoundException(String message, Throwable cause) {
    super(GatewayErrorCode.TENANT_NOT_FOUND, message, cause);
  }
}
