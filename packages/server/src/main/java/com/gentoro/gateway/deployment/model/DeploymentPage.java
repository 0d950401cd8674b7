package com.gentoro.gateway.deployment.model;

import java.util.List;

/** Upstream listing envelope of one tenant. */
public record DeploymentPage(int count, List<Deployment> resources) {
  public DeploymentPage {
    resources = resources == null ? List.of() : List.copyOf(resources);
  }
}
