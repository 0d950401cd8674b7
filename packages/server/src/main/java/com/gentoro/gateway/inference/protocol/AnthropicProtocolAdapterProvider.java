package com.gentoro.gateway.inference.protocol;

import com.gentoro.gateway.inference.InferenceProtocol;
import java.time.Clock;
import org.apache.commons.configuration2.Configuration;

/** SPI provider for {@link AnthropicProtocolAdapter}. */
public final class AnthropicProtocolAdapterProvider implements ProtocolAdapterProvider {
  @Override
  public InferenceProtocol protocol() {
    return InferenceProtocol.ANTHROPIC;
  }

  @Override
  public ProtocolAdapter create(Configuration configuration) {
    return new AnthropicProtocolAdapter(configuration, Clock.systemUTC());
  }
}
