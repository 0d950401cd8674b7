package com.gentoro.gateway.inference.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.gateway.exception.DecodeException;
import com.gentoro.gateway.inference.InferenceRequest;
import com.gentoro.gateway.utility.JacksonUtility;
import java.time.Clock;
import org.apache.commons.configuration2.Configuration;

/**
 * Shared plumbing for adapters: parameter defaults and JSON helpers.
 *
 * <ul>
 *   <li>{@code gateway.inference.default-max-tokens} (int, default 1000)
 *   <li>{@code gateway.inference.default-temperature} (double, default 0.7)
 * </ul>
 */
public abstract class AbstractProtocolAdapter implements ProtocolAdapter {
  protected final int defaultMaxTokens;
  protected final double defaultTemperature;
  protected final Clock clock;

  protected AbstractProtocolAdapter(Configuration configuration, Clock clock) {
    this.defaultMaxTokens = configuration.getInt("gateway.inference.default-max-tokens", 1000);
    this.defaultTemperature =
        configuration.getDouble("gateway.inference.default-temperature", 0.7);
    this.clock = clock;
  }

  protected static ObjectMapper mapper() {
    return JacksonUtility.getJsonMapper();
  }

  protected int maxTokens(InferenceRequest request) {
    return request.hasMaxTokens() ? request.maxTokens() : defaultMaxTokens;
  }

  protected double temperature(InferenceRequest request) {
    return request.hasTemperature() ? request.temperature() : defaultTemperature;
  }

  /** Puts max_tokens and temperature (defaulted) and top_p (only when set). */
  protected void putSamplingParameters(ObjectNode target, InferenceRequest request) {
    target.put("max_tokens", maxTokens(request));
    target.put("temperature", temperature(request));
    if (request.hasTopP()) {
      target.put("top_p", request.topP());
    }
  }

  protected long epochSeconds() {
    return clock.instant().getEpochSecond();
  }

  /** Parses {@code body} into an object node or fails with a decode error naming the protocol. */
  protected ObjectNode readObject(String body) {
    JsonNode node;
    try {
      node = mapper().readTree(body);
    } catch (Exception e) {
      throw new DecodeException(protocol().name().toLowerCase() + " response", e);
    }
    if (node instanceof ObjectNode object) {
      return object;
    }
    throw new DecodeException(
        protocol().name().toLowerCase() + " response",
        new IllegalArgumentException("expected a JSON object but got " + describe(node)));
  }

  private static String describe(JsonNode node) {
    return node == null ? "nothing" : node.getNodeType().toString().toLowerCase();
  }
}
