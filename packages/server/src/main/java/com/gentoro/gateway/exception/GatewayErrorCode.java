package com.gentoro.gateway.exception;

/**
 * Canonical error codes for the gateway. Codes are stable and suitable for the routing layer and
 * logs; prefer the most specific code that reflects the failure origin and actionability.
 */
public enum GatewayErrorCode {
  // Generic
  UNKNOWN,
  INVALID_ARGUMENT,
  FAILED_PRECONDITION,

  // I/O and configuration
  CONFIG_MISSING,
  SERIALIZATION_ERROR,
  NETWORK_ERROR,

  // Tenancy
  TENANT_NOT_FOUND,
  NO_TENANT_SCOPE,

  // Upstream
  UPSTREAM_AUTH_FAILED,
  UPSTREAM_REQUEST_FAILED,
  DECODE_FAILED,

  // Deployments
  DEPLOYMENT_NOT_FOUND,
  DEPLOYMENT_ACCESS_DENIED,
}
