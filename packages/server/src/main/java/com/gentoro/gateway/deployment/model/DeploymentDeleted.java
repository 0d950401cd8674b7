package com.gentoro.gateway.deployment.model;

public record DeploymentDeleted(String id, String message) {}
