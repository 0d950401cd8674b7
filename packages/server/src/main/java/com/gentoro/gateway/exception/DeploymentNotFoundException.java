package com.gentoro.gateway.exception;

import java.util.Map;

public class DeploymentNotFoundException extends GatewayException {
  public DeploymentNotFoundException(String deploymentId) {
    super(
        GatewayErrorCode.DEPLOYMENT_NOT_FOUND,
        "Deployment %s not found or not accessible".formatted(deploymentId),
        Map.of("deploymentId", String.valueOf(deploymentId)));
  }
}
