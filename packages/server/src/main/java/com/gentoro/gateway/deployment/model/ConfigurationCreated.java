package com.gentoro.gateway.deployment.model;

public record ConfigurationCreated(String id, String message) {}
