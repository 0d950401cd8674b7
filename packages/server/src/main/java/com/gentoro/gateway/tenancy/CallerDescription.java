package com.gentoro.gateway.tenancy;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Tenants a caller can actually use, as shown back to the caller. */
public record CallerDescription(
    @JsonProperty("user") String user,
    @JsonProperty("ai_instances") List<String> aiInstances) {

  public CallerDescription {
    aiInstances = List.copyOf(aiInstances);
  }
}
