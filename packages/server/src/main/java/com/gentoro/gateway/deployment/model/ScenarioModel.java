package com.gentoro.gateway.deployment.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/** Model offered by a scenario, with its published versions. */
public record ScenarioModel(
    String model,
    String executableId,
    String description,
    String displayName,
    String accessType,
    String provider,
    List<Version> versions,
    @JsonProperty("allowedScenarios") List<JsonNode> allowedScenarios) {

  public record Version(
      String name,
      @JsonProperty("isLatest") boolean latest,
      boolean deprecated,
      String retirementDate,
      int contextLength,
      List<String> inputTypes,
      List<String> capabilities,
      List<JsonNode> metadata,
      List<JsonNode> cost,
      List<String> suggestedReplacements,
      boolean streamingSupported,
      List<String> orchestrationCapabilities) {}
}
