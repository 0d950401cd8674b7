package com.gentoro.gateway.inference.protocol;

import com.gentoro.gateway.inference.InferenceProtocol;
import java.time.Clock;
import org.apache.commons.configuration2.Configuration;

/** SPI provider for {@link GptProtocolAdapter}. */
public final class GptProtocolAdapterProvider implements ProtocolAdapterProvider {
  @Override
  public InferenceProtocol protocol() {
    return InferenceProtocol.GPT;
  }

  @Override
  public ProtocolAdapter create(Configuration configuration) {
    return new GptProtocolAdapter(configuration, Clock.systemUTC());
  }
}
