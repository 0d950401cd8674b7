package com.gentoro.gateway.deployment.model;

import com.gentoro.gateway.exception.ValidationException;
import java.util.List;
import java.util.Map;

/**
 * Body of a configuration creation. {@code parameterBindings} usually carry the model name and
 * version as {@code {key, value}} pairs.
 */
public record ConfigurationRequest(
    String name,
    String executableId,
    String scenarioId,
    List<Map<String, String>> parameterBindings,
    List<Map<String, String>> inputArtifactBindings) {

  public void validate() {
    require(name, "name");
    require(executableId, "executableId");
    require(scenarioId, "scenarioId");
  }

  private static void require(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new ValidationException("Configuration field '%s' is required".formatted(field));
    }
  }
}
