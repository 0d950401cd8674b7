package com.gentoro.gateway.deployment.model;

import com.gentoro.gateway.exception.ValidationException;

/**
 * Deployment creation: either deploy an existing configuration or create one first. Exactly one
 * of {@code configurationId} and {@code configurationRequest} must be set.
 */
public record DeploymentRequest(
    String configurationId, ConfigurationRequest configurationRequest, String ttl) {

  public static DeploymentRequest ofConfiguration(String configurationId, String ttl) {
    return new DeploymentRequest(configurationId, null, ttl);
  }

  public static DeploymentRequest creatingConfiguration(ConfigurationRequest request, String ttl) {
    return new DeploymentRequest(null, request, ttl);
  }

  public void validate() {
    boolean hasId = configurationId != null && !configurationId.isBlank();
    if (!hasId && configurationRequest == null) {
      throw new ValidationException(
          "Either configurationId or configurationRequest must be provided");
    }
    if (hasId && configurationRequest != null) {
      throw new ValidationException(
          "configurationId and configurationRequest cannot both be provided");
    }
    if (configurationRequest != null) {
      configurationRequest.validate();
    }
  }
}
