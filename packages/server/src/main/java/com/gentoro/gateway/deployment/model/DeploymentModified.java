package com.gentoro.gateway.deployment.model;

public record DeploymentModified(
    String id, String message, String deploymentUrl, String status, String targetStatus) {}
