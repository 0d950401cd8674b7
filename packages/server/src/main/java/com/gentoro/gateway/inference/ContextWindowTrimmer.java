package com.gentoro.gateway.inference;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Bounds the number of messages sent upstream by a per-model budget. System messages are always
 * kept and come first; of the rest only the most recent ones survive, at least one.
 */
public final class ContextWindowTrimmer {
  private ContextWindowTrimmer() {}

  private record Budget(String fragment, int messages) {}

  // first match wins, so more specific fragments come first
  private static final List<Budget> BUDGETS =
      List.of(
          new Budget("gpt-5", 50),
          new Budget("gpt-4-32k", 40),
          new Budget("gpt-4", 30),
          new Budget("gpt-3.5", 25),
          new Budget("o1", 20),
          new Budget("o3", 20),
          new Budget("claude", 35),
          new Budget("gemini-1.5", 40),
          new Budget("gemini", 30));

  public static final int DEFAULT_BUDGET = 20;

  public static int budget(String modelName) {
    String model = modelName == null ? "" : modelName.toLowerCase(Locale.ROOT);
    for (Budget budget : BUDGETS) {
      if (model.contains(budget.fragment())) {
        return budget.messages();
      }
    }
    return DEFAULT_BUDGET;
  }

  public static List<InferenceMessage> trim(List<InferenceMessage> messages, String modelName) {
    int budget = budget(modelName);
    if (messages.size() <= budget) {
      return messages;
    }
    List<InferenceMessage> system = new ArrayList<>();
    List<InferenceMessage> conversation = new ArrayList<>();
    for (InferenceMessage message : messages) {
      (message.isSystem() ? system : conversation).add(message);
    }
    int slots = Math.max(1, budget - system.size());
    List<InferenceMessage> result = new ArrayList<>(system);
    int from = Math.max(0, conversation.size() - slots);
    result.addAll(conversation.subList(from, conversation.size()));
    return List.copyOf(result);
  }
}
