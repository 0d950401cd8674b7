package com.gentoro.gateway.inference.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.gateway.inference.InferenceProtocol;
import com.gentoro.gateway.inference.InferenceRequest;
import com.gentoro.gateway.inference.InferenceResponse;
import java.util.Optional;

/**
 * Translates between the canonical chat shape and one upstream protocol.
 *
 * <p>Implementations are stateless and obtained through {@link ProtocolAdapterFactory}.
 */
public interface ProtocolAdapter {

  InferenceProtocol protocol();

  /**
   * Builds the outbound request. Messages are expected to be trimmed already.
   *
   * @param streaming selects the streaming endpoint or flag of the protocol
   */
  OutboundRequest build(InferenceTarget target, InferenceRequest request, boolean streaming);

  /**
   * Normalizes a successful upstream body.
   *
   * @throws com.gentoro.gateway.exception.DecodeException when the body does not match the
   *     protocol
   */
  InferenceResponse parse(String body, InferenceTarget target);

  /**
   * Rewrites one streamed chunk into the {@code chat.completion.chunk} shape. Empty means the chunk
   * is forwarded unchanged.
   */
  default Optional<JsonNode> convertStreamChunk(JsonNode chunk, InferenceTarget target) {
    return Optional.empty();
  }
}
