package com.gentoro.gateway.inference.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.gateway.inference.InferenceMessage;
import com.gentoro.gateway.inference.InferenceProtocol;
import com.gentoro.gateway.inference.InferenceRequest;
import com.gentoro.gateway.inference.InferenceResponse;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.configuration2.Configuration;

/**
 * Orchestration service {@code /completion}. Messages go into the templating module unchanged; the
 * service reports no token usage.
 */
public class OrchestrationProtocolAdapter extends AbstractProtocolAdapter {
  static final String DEFAULT_MODEL = "gpt-4o-mini";

  public OrchestrationProtocolAdapter(Configuration configuration, Clock clock) {
    super(configuration, clock);
  }

  @Override
  public InferenceProtocol protocol() {
    return InferenceProtocol.ORCHESTRATION;
  }

  static String modelName(InferenceTarget target) {
    String model = target.modelName();
    return model == null || model.isBlank() ? DEFAULT_MODEL : model;
  }

  @Override
  public OutboundRequest build(
      InferenceTarget target, InferenceRequest request, boolean streaming) {
    ObjectNode payload = mapper().createObjectNode();
    ObjectNode modules =
        payload.putObject("orchestration_config").putObject("module_configurations");
    ArrayNode template = modules.putObject("templating_module_config").putArray("template");
    for (InferenceMessage message : request.messages()) {
      template.addObject().put("role", message.role()).set("content", message.content());
    }
    ObjectNode llm = modules.putObject("llm_module_config");
    llm.put("model_name", modelName(target));
    ObjectNode params = llm.putObject("model_params");
    params.put("max_tokens", maxTokens(request));
    params.put("temperature", temperature(request));
    params.put("frequency_penalty", 0);
    params.put("presence_penalty", 0);
    llm.put("model_version", "latest");
    payload.putObject("input_params");
    if (streaming) {
      payload.put("stream", true);
    }
    return new OutboundRequest("/completion", payload);
  }

  @Override
  public InferenceResponse parse(String body, InferenceTarget target) {
    ObjectNode root = readObject(body);
    List<InferenceResponse.Choice> choices = new ArrayList<>();
    for (JsonNode choice : root.path("orchestration_result").path("choices")) {
      choices.add(
          new InferenceResponse.Choice(
              choice.path("index").asInt(0),
              InferenceMessage.of(
                  InferenceMessage.ASSISTANT, choice.path("message").path("content").asText("")),
              choice.path("finish_reason").isTextual()
                  ? choice.path("finish_reason").asText()
                  : null));
    }
    long now = epochSeconds();
    return new InferenceResponse(
        "orch-" + now,
        InferenceResponse.OBJECT,
        now,
        modelName(target),
        choices,
        InferenceResponse.Usage.NONE,
        null);
  }
}
