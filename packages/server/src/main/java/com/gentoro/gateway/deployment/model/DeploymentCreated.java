package com.gentoro.gateway.deployment.model;

public record DeploymentCreated(
    String id, String message, String deploymentUrl, String status, String ttl) {}
