package com.gentoro.gateway.inference.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.gateway.inference.InferenceMessage;
import com.gentoro.gateway.inference.InferenceProtocol;
import com.gentoro.gateway.inference.InferenceRequest;
import com.gentoro.gateway.inference.InferenceResponse;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.apache.commons.configuration2.Configuration;

/**
 * Gemini {@code generateContent}. Gemini has no system role: every message becomes a part of one
 * user content, the system text prefixed with {@code [System]: }. Image parts are sent as {@code
 * fileData}.
 */
public class GeminiProtocolAdapter extends AbstractProtocolAdapter {
  static final String SYSTEM_PREFIX = "[System]: ";
  static final String DEFAULT_IMAGE_MIME = "image/png";

  public GeminiProtocolAdapter(Configuration configuration, Clock clock) {
    super(configuration, clock);
  }

  @Override
  public InferenceProtocol protocol() {
    return InferenceProtocol.GEMINI;
  }

  @Override
  public OutboundRequest build(
      InferenceTarget target, InferenceRequest request, boolean streaming) {
    ObjectNode payload = mapper().createObjectNode();
    ObjectNode contents = payload.putObject("contents");
    contents.put("role", InferenceMessage.USER);
    ArrayNode parts = contents.putArray("parts");
    for (InferenceMessage message : request.messages()) {
      if (message.isSystem()) {
        parts.addObject().put("text", SYSTEM_PREFIX + message.text());
      } else if (message.isMultipart()) {
        addParts(parts, message.content());
      } else {
        parts.addObject().put("text", message.text());
      }
    }
    // sampling parameters are only sent when the caller set them
    if (request.hasMaxTokens() || request.hasTemperature()) {
      ObjectNode generation = payload.putObject("generation_config");
      if (request.hasMaxTokens()) generation.put("maxOutputTokens", request.maxTokens());
      if (request.hasTemperature()) generation.put("temperature", request.temperature());
    }
    String action = streaming ? ":streamGenerateContent" : ":generateContent";
    return new OutboundRequest("/models/" + target.modelNameOrEmpty() + action, payload);
  }

  private static void addParts(ArrayNode parts, JsonNode content) {
    for (JsonNode part : content) {
      String type = part.path("type").asText();
      if ("text".equals(type)) {
        parts.addObject().put("text", part.path("text").asText(""));
      } else if ("image_url".equals(type) && part.path("image_url").isObject()) {
        ObjectNode fileData = parts.addObject().putObject("fileData");
        fileData.put("mimeType", DEFAULT_IMAGE_MIME);
        fileData.put("fileUri", part.path("image_url").path("url").asText(""));
      }
    }
  }

  @Override
  public InferenceResponse parse(String body, InferenceTarget target) {
    ObjectNode root = readObject(body);
    List<InferenceResponse.Choice> choices = new ArrayList<>();
    int index = 0;
    for (JsonNode candidate : root.path("candidates")) {
      StringBuilder text = new StringBuilder();
      for (JsonNode part : candidate.path("content").path("parts")) {
        text.append(part.path("text").asText(""));
      }
      choices.add(
          new InferenceResponse.Choice(
              index++,
              InferenceMessage.of(InferenceMessage.ASSISTANT, text.toString()),
              candidate.path("finishReason").asText("").toLowerCase(Locale.ROOT)));
    }
    JsonNode usage = root.path("usageMetadata");
    long now = epochSeconds();
    return new InferenceResponse(
        "gemini-" + now,
        InferenceResponse.OBJECT,
        now,
        target.modelNameOrEmpty(),
        choices,
        new InferenceResponse.Usage(
            usage.path("promptTokenCount").asInt(0),
            usage.path("candidatesTokenCount").asInt(0),
            usage.path("totalTokenCount").asInt(0)),
        null);
  }

  /** Converts a chunk whose first candidate carries text; anything else is forwarded as is. */
  @Override
  public Optional<JsonNode> convertStreamChunk(JsonNode chunk, InferenceTarget target) {
    JsonNode candidate = chunk.path("candidates").path(0);
    JsonNode text = candidate.path("content").path("parts").path(0).path("text");
    if (!text.isTextual()) {
      return Optional.empty();
    }
    ObjectNode converted = mapper().createObjectNode();
    Instant now = clock.instant();
    converted.put("id", "gemini-" + (now.getEpochSecond() * 1_000_000_000L + now.getNano()));
    converted.put("object", "chat.completion.chunk");
    converted.put("created", now.getEpochSecond());
    converted.put("model", target.modelNameOrEmpty());
    ObjectNode choice = converted.putArray("choices").addObject();
    choice.put("index", 0);
    choice.putObject("delta").put("content", text.asText());
    String finishReason = candidate.path("finishReason").asText("");
    if (finishReason.isEmpty()) {
      choice.putNull("finish_reason");
    } else {
      choice.put("finish_reason", finishReason.toLowerCase(Locale.ROOT));
    }
    return Optional.of(converted);
  }
}
