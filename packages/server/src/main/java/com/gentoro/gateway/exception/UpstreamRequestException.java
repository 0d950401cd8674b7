package com.gentoro.gateway.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/** A data or inference endpoint answered with a non-2xx status. */
public class UpstreamRequestException extends GatewayException {
  private final int status;
  private final String body;

  public UpstreamRequestException(String operation, int status, String body) {
    super(
        GatewayErrorCode.UPSTREAM_REQUEST_FAILED,
        "%s failed with status %d: %s".formatted(operation, status, body),
        context(operation, status, body));
    this.status = status;
    this.body = body == null ? "" : body;
  }

  public int getStatus() {
    return status;
  }

  public String getBody() {
    return body;
  }

  private static Map<String, Object> context(String operation, int status, String body) {
    Map<String, Object> context = new LinkedHashMap<>();
    context.put("operation", operation);
    context.put("status", status);
    context.put("body", body == null ? "" : body);
    return context;
  }
}
