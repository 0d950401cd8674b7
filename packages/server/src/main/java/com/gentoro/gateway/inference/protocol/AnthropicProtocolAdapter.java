package com.gentoro.gateway.inference.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.gateway.inference.InferenceMessage;
import com.gentoro.gateway.inference.InferenceProtocol;
import com.gentoro.gateway.inference.InferenceRequest;
import com.gentoro.gateway.inference.InferenceResponse;
import java.time.Clock;
import java.util.List;
import org.apache.commons.configuration2.Configuration;

/**
 * Anthropic messages over the Bedrock-style {@code /invoke} endpoint. The system prompt travels in
 * {@code system}; other messages are reduced to their text.
 */
public class AnthropicProtocolAdapter extends AbstractProtocolAdapter {
  static final String ANTHROPIC_VERSION = "bedrock-2023-05-31";

  public AnthropicProtocolAdapter(Configuration configuration, Clock clock) {
    super(configuration, clock);
  }

  @Override
  public InferenceProtocol protocol() {
    return InferenceProtocol.ANTHROPIC;
  }

  @Override
  public OutboundRequest build(
      InferenceTarget target, InferenceRequest request, boolean streaming) {
    ObjectNode payload = mapper().createObjectNode();
    payload.put("anthropic_version", ANTHROPIC_VERSION);
    ArrayNode messages = payload.putArray("messages");
    String system = null;
    for (InferenceMessage message : request.messages()) {
      if (message.isSystem()) {
        system = message.text();
      } else {
        messages.addObject().put("role", message.role()).put("content", message.text());
      }
    }
    if (system != null && !system.isEmpty()) {
      payload.put("system", system);
    }
    putSamplingParameters(payload, request);
    if (streaming) {
      return new OutboundRequest("/invoke-with-response-stream", payload);
    }
    if (request.stream()) {
      payload.put("stream", true);
    }
    return new OutboundRequest("/invoke", payload);
  }

  @Override
  public InferenceResponse parse(String body, InferenceTarget target) {
    ObjectNode root = readObject(body);
    JsonNode content = root.path("content");
    String text =
        content.isArray() && !content.isEmpty() ? content.get(0).path("text").asText("") : "";
    int input = root.path("usage").path("input_tokens").asInt(0);
    int output = root.path("usage").path("output_tokens").asInt(0);
    return new InferenceResponse(
        textOrNull(root.path("id")),
        InferenceResponse.OBJECT,
        epochSeconds(),
        textOrNull(root.path("model")),
        List.of(
            new InferenceResponse.Choice(
                0,
                InferenceMessage.of(InferenceMessage.ASSISTANT, text),
                textOrNull(root.path("stop_reason")))),
        new InferenceResponse.Usage(input, output, input + output),
        null);
  }

  private static String textOrNull(JsonNode node) {
    return node.isTextual() ? node.asText() : null;
  }
}
