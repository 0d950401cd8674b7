package com.gentoro.gateway.inference.protocol;

import com.gentoro.gateway.deployment.model.Deployment;

/**
 * Where an inference call goes.
 *
 * @param modelName model extracted from the deployment details, or {@code null}
 */
public record InferenceTarget(
    String deploymentId, String deploymentUrl, String scenarioId, String modelName) {

  public static InferenceTarget of(Deployment deployment) {
    return new InferenceTarget(
        deployment.id(),
        deployment.deploymentUrl(),
        deployment.scenarioId(),
        deployment.modelName().orElse(null));
  }

  public String modelNameOrEmpty() {
    return modelName == null ? "" : modelName;
  }
}
