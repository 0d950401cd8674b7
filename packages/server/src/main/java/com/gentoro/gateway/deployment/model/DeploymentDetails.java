package com.gentoro.gateway.deployment.model;

import com.fasterxml.jackson.databind.JsonNode;

/** Full record of a single deployment. */
public record DeploymentDetails(
    String id,
    String deploymentUrl,
    String configurationId,
    String configurationName,
    String executableId,
    String scenarioId,
    String status,
    String statusMessage,
    String targetStatus,
    String lastOperation,
    String latestRunningConfigurationId,
    String ttl,
    JsonNode details,
    String createdAt,
    String modifiedAt,
    String submissionTime,
    String startTime,
    String completionTime,
    JsonNode statusDetails) {}
