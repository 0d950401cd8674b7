package com.gentoro.gateway.credentials;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * OAuth2 client-credential secrets and API coordinates of one tenant. JSON names match the
 * credential blob supplied through configuration.
 */
public record TenantCredential(
    @JsonProperty("team") String tenantId,
    @JsonProperty("clientId") String clientId,
    @JsonProperty("clientSecret") String clientSecret,
    @JsonProperty("oauthUrl") String tokenUrl,
    @JsonProperty("apiUrl") String apiBaseUrl,
    @JsonProperty("resourceGroup") String resourceGroup) {

  @Override
  public String toString() {
    return ("TenantCredential[tenantId=%s, clientId=%s, tokenUrl=%s, apiBaseUrl=%s,"
            + " resourceGroup=%s]")
        .formatted(tenantId, clientId, tokenUrl, apiBaseUrl, resourceGroup);
  }
}
