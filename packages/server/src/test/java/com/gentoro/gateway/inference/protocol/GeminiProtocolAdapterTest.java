package com.gentoro.gateway.inference.protocol;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.gateway.inference.InferenceMessage;
import com.gentoro.gateway.inference.InferenceRequest;
import com.gentoro.gateway.inference.InferenceResponse;
import java.util.List;
import java.util.Optional;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.Test;

class GeminiProtocolAdapterTest {

  private final GeminiProtocolAdapter adapter =
      new GeminiProtocolAdapter(new BaseConfiguration(), AdapterFixtures.CLOCK);
  private final InferenceTarget target =
      new InferenceTarget("d-3", "https://x/d-3", "foundation-models", "gemini-1.5-pro");

  @Test
  void everyMessageBecomesAPartOfOneUserContent() {
    InferenceRequest request =
        InferenceRequest.of(
            "d-3",
            List.of(
                InferenceMessage.of(InferenceMessage.SYSTEM, "rules"),
                new InferenceMessage(
                    InferenceMessage.USER,
                    AdapterFixtures.json(
                        "[{\"type\":\"text\",\"text\":\"what is this\"},"
                            + "{\"type\":\"image_url\",\"image_url\":{\"url\":\"gs://b/i\"}}]")),
                InferenceMessage.of(InferenceMessage.ASSISTANT, "a cat")));

    OutboundRequest outbound = adapter.build(target, request, false);

    ObjectNode payload = outbound.payload();
    assertEquals("/models/gemini-1.5-pro:generateContent", outbound.path());
    JsonNode parts = payload.path("contents").path("parts");
    assertEquals("user", payload.path("contents").path("role").asText());
    assertEquals(4, parts.size());
    assertEquals("[System]: rules", parts.path(0).path("text").asText());
    assertEquals("what is this", parts.path(1).path("text").asText());
    assertEquals("image/png", parts.path(2).path("fileData").path("mimeType").asText());
    assertEquals("gs://b/i", parts.path(2).path("fileData").path("fileUri").asText());
    assertEquals("a cat", parts.path(3).path("text").asText());
    assertFalse(payload.has("generation_config"));
  }

  @Test
  void generationConfigOnlyCarriesSetParameters() {
    InferenceRequest request =
        new InferenceRequest(
            "d-3", List.of(InferenceMessage.of("user", "x")), 99, null, 0.4, false);

    OutboundRequest outbound = adapter.build(target, request, true);

    JsonNode config = outbound.payload().path("generation_config");
    assertEquals("/models/gemini-1.5-pro:streamGenerateContent", outbound.path());
    assertEquals(99, config.path("maxOutputTokens").asInt());
    assertFalse(config.has("temperature"));
  }

  @Test
  void candidatesAreNormalized() {
    InferenceResponse response =
        adapter.parse(
            """
            {"candidates":[{"content":{"parts":[{"text":"Hel"},{"text":"lo"}]},
                            "finishReason":"STOP"}],
             "usageMetadata":{"promptTokenCount":4,"candidatesTokenCount":2,
                              "totalTokenCount":6}}
            """,
            target);

    assertEquals("gemini-1700000000", response.id());
    assertEquals("gemini-1.5-pro", response.model());
    assertEquals("Hello", response.choices().get(0).message().text());
    assertEquals("stop", response.choices().get(0).finishReason());
    assertEquals(new InferenceResponse.Usage(4, 2, 6), response.usage());
  }

  @Test
  void chunkWithoutTextIsForwardedUnchanged() {
    Optional<JsonNode> converted =
        adapter.convertStreamChunk(AdapterFixtures.json("{\"usageMetadata\":{}}"), target);

    assertTrue(converted.isEmpty());
  }

  @Test
  void chunkWithoutFinishReasonHasNullFinish() {
    JsonNode converted =
        adapter
            .convertStreamChunk(
                AdapterFixtures.json(
                    "{\"candidates\":[{\"content\":{\"parts\":[{\"text\":\"x\"}]}}]}"),
                target)
            .orElseThrow();

    assertTrue(converted.path("choices").path(0).path("finish_reason").isNull());
    assertEquals("x", converted.path("choices").path(0).path("delta").path("content").asText());
  }
}
