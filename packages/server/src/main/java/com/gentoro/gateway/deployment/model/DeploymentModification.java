package com.gentoro.gateway.deployment.model;

/** PATCH body; unset fields are omitted from the wire. */
public record DeploymentModification(String targetStatus, String configurationId) {}
