package com.gentoro.gateway.deployment.model;

import java.util.List;

public record ScenarioModels(int count, List<ScenarioModel> resources) {
  public ScenarioModels {
    resources = resources == null ? List.of() : List.copyOf(resources);
  }
}
