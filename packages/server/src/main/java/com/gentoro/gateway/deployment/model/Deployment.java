package com.gentoro.gateway.deployment.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Optional;

/** One deployment as returned by the deployments listing. */
public record Deployment(
    String id,
    String configurationId,
    String configurationName,
    String scenarioId,
    String status,
    String statusMessage,
    String targetStatus,
    String deploymentUrl,
    String createdAt,
    String modifiedAt,
    JsonNode details) {

  /**
   * Model name from {@code details.resources.backend_details.model.name}, falling back to the
   * camel-case {@code backendDetails} variant.
   */
  public Optional<String> modelName() {
    return modelName(details);
  }

  public static Optional<String> modelName(JsonNode details) {
    if (details == null) return Optional.empty();
    JsonNode resources = details.path("resources");
    for (String key : new String[] {"backend_details", "backendDetails"}) {
      JsonNode name = resources.path(key).path("model").path("name");
      if (name.isTextual() && !name.asText().isBlank()) {
        return Optional.of(name.asText());
      }
    }
    return Optional.empty();
  }
}
