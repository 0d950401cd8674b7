package com.gentoro.gateway.inference;

/** Upstream wire protocols a deployment can speak. */
public enum InferenceProtocol {
  ANTHROPIC,
  GPT,
  GEMINI,
  ORCHESTRATION
}
