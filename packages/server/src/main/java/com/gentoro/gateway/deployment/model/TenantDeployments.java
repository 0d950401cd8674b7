package com.gentoro.gateway.deployment.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Deployments of one tenant; serialized with the tenant under {@code team}. */
public record TenantDeployments(
    @JsonProperty("team") String tenant,
    @JsonProperty("deployments") List<Deployment> deployments) {
  public TenantDeployments {
    deployments = deployments == null ? List.of() : List.copyOf(deployments);
  }
}
