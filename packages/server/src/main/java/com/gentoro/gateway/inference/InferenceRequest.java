package com.gentoro.gateway.inference;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gentoro.gateway.exception.ValidationException;
import java.util.List;
import java.util.Set;

/**
 * Chat request in the canonical shape. Non-positive numeric parameters count as unset.
 *
 * @param stream informational; streaming is selected by calling the streaming operation
 */
public record InferenceRequest(
    @JsonProperty("deploymentId") String deploymentId,
    @JsonProperty("messages") List<InferenceMessage> messages,
    @JsonProperty("max_tokens") Integer maxTokens,
    @JsonProperty("temperature") Double temperature,
    @JsonProperty("top_p") Double topP,
    @JsonProperty("stream") boolean stream) {
  private static final Set<String> ROLES =
      Set.of(InferenceMessage.SYSTEM, InferenceMessage.USER, InferenceMessage.ASSISTANT);

  public InferenceRequest {
    messages = messages == null ? List.of() : List.copyOf(messages);
  }

  public static InferenceRequest of(String deploymentId, List<InferenceMessage> messages) {
    return new InferenceRequest(deploymentId, messages, null, null, null, false);
  }

  public InferenceRequest withMessages(List<InferenceMessage> replacement) {
    return new InferenceRequest(deploymentId, replacement, maxTokens, temperature, topP, stream);
  }

  public boolean hasMaxTokens() {
    return maxTokens != null && maxTokens > 0;
  }

  public boolean hasTemperature() {
    return temperature != null && temperature > 0;
  }

  public boolean hasTopP() {
    return topP != null && topP > 0;
  }

  public void validate() {
    if (deploymentId == null || deploymentId.isBlank()) {
      throw new ValidationException("deploymentId is required");
    }
    if (messages.isEmpty()) {
      throw new ValidationException("At least one message is required");
    }
    for (InferenceMessage message : messages) {
      if (message == null || !ROLES.contains(message.role())) {
        throw new ValidationException(
            "Message role must be one of system, user, assistant: "
                + (message == null ? null : message.role()));
      }
      if (message.content() == null || message.content().isNull()) {
        throw new ValidationException("Message content is required");
      }
    }
  }
}
