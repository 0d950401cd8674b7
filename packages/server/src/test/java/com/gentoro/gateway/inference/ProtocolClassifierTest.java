package com.gentoro.gateway.inference;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class ProtocolClassifierTest {

  @Test
  void orchestrationScenarioWinsOverModel() {
    assertEquals(
        InferenceProtocol.ORCHESTRATION,
        ProtocolClassifier.classify("Orchestration", "gemini-pro"));
  }

  @Test
  void modelNameSelectsProtocolCaseInsensitively() {
    assertEquals(
        InferenceProtocol.GEMINI, ProtocolClassifier.classify("foundation-models", "Gemini-1.5"));
    assertEquals(InferenceProtocol.GPT, ProtocolClassifier.classify("foundation-models", "GPT-4o"));
    assertEquals(InferenceProtocol.GPT, ProtocolClassifier.classify(null, "o3-mini"));
    assertEquals(InferenceProtocol.GPT, ProtocolClassifier.classify(null, "azure-openai-x"));
  }

  @Test
  void everythingElseIsAnthropic() {
    assertEquals(
        InferenceProtocol.ANTHROPIC,
        ProtocolClassifier.classify("foundation-models", "anthropic--claude-3.5-sonnet"));
    assertEquals(InferenceProtocol.ANTHROPIC, ProtocolClassifier.classify(null, null));
  }
}
