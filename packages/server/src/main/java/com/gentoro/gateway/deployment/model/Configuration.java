package com.gentoro.gateway.deployment.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Map;

public record Configuration(
    String id,
    String name,
    String executableId,
    String scenarioId,
    List<Map<String, String>> parameterBindings,
    List<Map<String, String>> inputArtifactBindings,
    String createdAt,
    JsonNode scenario) {}
