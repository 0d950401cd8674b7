package com.gentoro.gateway.deployment.model;

import java.util.List;
import java.util.Optional;

/**
 * Deployments across a caller's scope, grouped by tenant in scope order. Tenants whose listing
 * failed are absent.
 */
public record DeploymentListing(int count, List<TenantDeployments> deployments) {

  public DeploymentListing {
    deployments = List.copyOf(deployments);
  }

  /** A deployment together with the tenant that owns it. */
  public record Located(String tenant, Deployment deployment) {}

  /** First match in scope order. */
  public Optional<Located> find(String deploymentId) {
    for (TenantDeployments group : deployments) {
      for (Deployment deployment : group.deployments()) {
        if (deployment.id() != null && deployment.id().equals(deploymentId)) {
          return Optional.of(new Located(group.tenant(), deployment));
        }
      }
    }
    return Optional.empty();
  }
}
