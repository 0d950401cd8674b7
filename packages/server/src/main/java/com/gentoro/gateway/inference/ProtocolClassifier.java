package com.gentoro.gateway.inference;

import com.gentoro.gateway.deployment.model.Deployment;
import java.util.Locale;

/**
 * Decides which protocol a deployment speaks from its scenario id and model name. Matching is a
 * case-insensitive substring test:
 *
 * <ol>
 *   <li>scenario contains {@code orchestration}: {@link InferenceProtocol#ORCHESTRATION}
 *   <li>model contains {@code gemini}: {@link InferenceProtocol#GEMINI}
 *   <li>model contains {@code gpt}, {@code o1}, {@code o3} or {@code openai}: {@link
 *       InferenceProtocol#GPT}
 *   <li>otherwise {@link InferenceProtocol#ANTHROPIC}
 * </ol>
 */
public final class ProtocolClassifier {
  private ProtocolClassifier() {}

  public static InferenceProtocol classify(Deployment deployment) {
    return classify(deployment.scenarioId(), deployment.modelName().orElse(null));
  }

  public static InferenceProtocol classify(String scenarioId, String modelName) {
    if (lower(scenarioId).contains("orchestration")) {
      return InferenceProtocol.ORCHESTRATION;
    }
    String model = lower(modelName);
    if (model.contains("gemini")) {
      return InferenceProtocol.GEMINI;
    }
    if (model.contains("gpt")
        || model.contains("o1")
        || model.contains("o3")
        || model.contains("openai")) {
      return InferenceProtocol.GPT;
    }
    return InferenceProtocol.ANTHROPIC;
  }

  private static String lower(String value) {
    return value == null ? "" : value.toLowerCase(Locale.ROOT);
  }
}
