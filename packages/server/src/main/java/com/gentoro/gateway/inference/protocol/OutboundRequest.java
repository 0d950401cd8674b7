package com.gentoro.gateway.inference.protocol;

import com.fasterxml.jackson.databind.node.ObjectNode;

/** Protocol-specific request: a path relative to the deployment URL and a JSON payload. */
public record OutboundRequest(String path, ObjectNode payload) {

  public String url(String deploymentUrl) {
    String base =
        deploymentUrl.endsWith("/")
            ? deploymentUrl.substring(0, deploymentUrl.length() - 1)
            : deploymentUrl;
    return base + path;
  }
}
