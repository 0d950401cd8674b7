package com.gentoro.gateway.inference.protocol;

import com.gentoro.gateway.inference.InferenceProtocol;
import java.time.Clock;
import org.apache.commons.configuration2.Configuration;

/** SPI provider for {@link GeminiProtocolAdapter}. */
public final class GeminiProtocolAdapterProvider implements ProtocolAdapterProvider {
  @Override
  public InferenceProtocol protocol() {
    return InferenceProtocol.GEMINI;
  }

  @Override
  public ProtocolAdapter create(Configuration configuration) {
    return new GeminiProtocolAdapter(configuration, Clock.systemUTC());
  }
}
