package com.gentoro.gateway.inference.protocol;

import com.gentoro.gateway.inference.InferenceProtocol;
import java.time.Clock;
import org.apache.commons.configuration2.Configuration;

/** SPI provider for {@link OrchestrationProtocolAdapter}. */
public final class OrchestrationProtocolAdapterProvider implements ProtocolAdapterProvider {
  @Override
  public InferenceProtocol protocol() {
    return InferenceProtocol.ORCHESTRATION;
  }

  @Override
  public ProtocolAdapter create(Configuration configuration) {
    return new OrchestrationProtocolAdapter(configuration, Clock.systemUTC());
  }
}
