package com.gentoro.gateway.deployment.model;

import java.util.List;

public record Configurations(int count, List<Configuration> resources) {
  public Configurations {
    resources = resources == null ? List.of() : List.copyOf(resources);
  }
}
