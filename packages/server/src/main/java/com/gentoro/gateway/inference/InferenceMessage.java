package com.gentoro.gateway.inference;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;

/**
 * One chat message. {@code content} is either a JSON string or an array of parts ({@code
 * {type:"text", text}} or {@code {type:"image_url", image_url:{url}}}).
 */
public record InferenceMessage(String role, JsonNode content) {
  public static final String SYSTEM = "system";
  public static final String USER = "user";
  public static final String ASSISTANT = "assistant";

  public static InferenceMessage of(String role, String text) {
    return new InferenceMessage(role, TextNode.valueOf(text));
  }

  public boolean isSystem() {
    return SYSTEM.equals(role);
  }

  public boolean isMultipart() {
    return content != null && content.isArray();
  }

  /** The string content, or the first {@code text} part of multipart content, or "". */
  public String text() {
    if (content == null) return "";
    if (content.isTextual()) return content.asText();
    if (content.isArray()) {
      for (JsonNode part : content) {
        if ("text".equals(part.path("type").asText()) && part.path("text").isTextual()) {
          return part.path("text").asText();
        }
      }
    }
    return "";
  }
}
