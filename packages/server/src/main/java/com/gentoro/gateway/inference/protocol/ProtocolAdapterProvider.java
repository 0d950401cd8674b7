package com.gentoro.gateway.inference.protocol;

import com.gentoro.gateway.inference.InferenceProtocol;
import org.apache.commons.configuration2.Configuration;

/**
 * Service Provider Interface for protocol adapters.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader}; register them in {@code
 * META-INF/services/com.gentoro.gateway.inference.protocol.ProtocolAdapterProvider}. Exactly one
 * provider per {@link InferenceProtocol} is expected.
 */
public interface ProtocolAdapterProvider {

  InferenceProtocol protocol();

  /**
   * @param configuration the full application configuration; adapters read {@code
   *     gateway.inference.*}
   */
  ProtocolAdapter create(Configuration configuration);
}
