package com.gentoro.gateway.inference.protocol;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.gateway.exception.DecodeException;
import com.gentoro.gateway.inference.InferenceMessage;
import com.gentoro.gateway.inference.InferenceProtocol;
import com.gentoro.gateway.inference.InferenceRequest;
import com.gentoro.gateway.inference.InferenceResponse;
import java.time.Clock;
import java.util.Locale;
import org.apache.commons.configuration2.Configuration;

/**
 * OpenAI chat completions. Multipart content passes through untouched and the response is already
 * canonical.
 *
 * <p>Reasoning models ({@code o1}, {@code o3-mini}, {@code gpt-5}) use a newer API version and
 * reject sampling parameters, so none are sent for them.
 */
public class GptProtocolAdapter extends AbstractProtocolAdapter {
  static final String API_VERSION = "2023-05-15";
  static final String REASONING_API_VERSION = "2024-12-01-preview";

  public GptProtocolAdapter(Configuration configuration, Clock clock) {
    super(configuration, clock);
  }

  @Override
  public InferenceProtocol protocol() {
    return InferenceProtocol.GPT;
  }

  static boolean isReasoningModel(String modelName) {
    String model = modelName == null ? "" : modelName.toLowerCase(Locale.ROOT);
    return model.contains("o1") || model.contains("o3-mini") || model.contains("gpt-5");
  }

  static String apiVersion(String modelName) {
    return isReasoningModel(modelName) ? REASONING_API_VERSION : API_VERSION;
  }

  @Override
  public OutboundRequest build(
      InferenceTarget target, InferenceRequest request, boolean streaming) {
    ObjectNode payload = mapper().createObjectNode();
    ArrayNode messages = payload.putArray("messages");
    for (InferenceMessage message : request.messages()) {
      messages.addObject().put("role", message.role()).set("content", message.content());
    }
    if (!isReasoningModel(target.modelName())) {
      putSamplingParameters(payload, request);
    }
    if (streaming || request.stream()) {
      payload.put("stream", true);
    }
    return new OutboundRequest(
        "/chat/completions?api-version=" + apiVersion(target.modelName()), payload);
  }

  @Override
  public InferenceResponse parse(String body, InferenceTarget target) {
    readObject(body);
    try {
      return mapper().readValue(body, InferenceResponse.class);
    } catch (Exception e) {
      throw new DecodeException("gpt response", e);
    }
  }
}
