package com.gentoro.gateway.inference;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Chat completion in the OpenAI-compatible shape every protocol is normalized to. */
public record InferenceResponse(
    @JsonProperty("id") String id,
    @JsonProperty("object") String object,
    @JsonProperty("created") long created,
    @JsonProperty("model") String model,
    @JsonProperty("choices") List<Choice> choices,
    @JsonProperty("usage") Usage usage,
    @JsonProperty("system_fingerprint") String systemFingerprint) {
  public static final String OBJECT = "chat.completion";

  public InferenceResponse {
    choices = choices == null ? List.of() : List.copyOf(choices);
    usage = usage == null ? Usage.NONE : usage;
  }

  public record Choice(
      @JsonProperty("index") int index,
      @JsonProperty("message") InferenceMessage message,
      @JsonProperty("finish_reason") String finishReason) {}

  public record Usage(
      @JsonProperty("prompt_tokens") int promptTokens,
      @JsonProperty("completion_tokens") int completionTokens,
      @JsonProperty("total_tokens") int totalTokens) {
    public static final Usage NONE = new Usage(0, 0, 0);
  }
}
