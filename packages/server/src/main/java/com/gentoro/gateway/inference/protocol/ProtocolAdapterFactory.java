package com.gentoro.gateway.inference.protocol;

import com.gentoro.gateway.exception.ConfigMissingException;
import com.gentoro.gateway.inference.InferenceProtocol;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.Set;
import org.apache.commons.configuration2.Configuration;

/** Creates one {@link ProtocolAdapter} per protocol from the registered providers. */
public final class ProtocolAdapterFactory {
  private static final org.slf4j.Logger log =
      com.gentoro.gateway.logging.LoggingService.getLogger(ProtocolAdapterFactory.class);

  private ProtocolAdapterFactory() {}

  /**
   * @throws ConfigMissingException if a protocol has no provider on the classpath
   */
  public static Map<InferenceProtocol, ProtocolAdapter> createAll(Configuration configuration) {
    Map<InferenceProtocol, ProtocolAdapter> adapters = new EnumMap<>(InferenceProtocol.class);
    for (ProtocolAdapterProvider provider : ServiceLoader.load(ProtocolAdapterProvider.class)) {
      ProtocolAdapter previous =
          adapters.putIfAbsent(provider.protocol(), provider.create(configuration));
      if (previous != null) {
        log.warn(
            "Ignoring duplicate provider {} for protocol {}",
            provider.getClass().getName(),
            provider.protocol());
      }
    }
    Set<InferenceProtocol> missing = EnumSet.allOf(InferenceProtocol.class);
    missing.removeAll(adapters.keySet());
    if (!missing.isEmpty()) {
      throw new ConfigMissingException("No protocol adapter registered for " + missing);
    }
    log.debug("Registered protocol adapters: {}", adapters.keySet());
    return Collections.unmodifiableMap(adapters);
  }
}
