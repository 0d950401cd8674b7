package com.gentoro.gateway.credentials;

import com.gentoro.gateway.ConfigurationProvider;
import org.apache.commons.configuration2.Configuration;

/**
 * Reads the credential blob from configuration.
 *
 * <ul>
 *   <li>{@code gateway.credentials.inline} (string, optional) wins when present
 *   <li>{@code gateway.credentials.env-variable} (string, default {@code AI_CORE_CREDENTIALS})
 *       names the environment variable read otherwise
 * </ul>
 */
public class ConfigurationCredentialSource implements CredentialSource {
  public static final String DEFAULT_VARIABLE = "AI_CORE_CREDENTIALS";
  private final Configuration configuration;

  public ConfigurationCredentialSource(Configuration configuration) {
    this.configuration = configuration;
  }

  @Override
  public String read() {
    String inline = configuration.getString("gateway.credentials.inline", null);
    if (inline != null && !inline.isBlank()) {
      return inline;
    }
    String variable =
        configuration.getString("gateway.credentials.env-variable", DEFAULT_VARIABLE);
    return ConfigurationProvider.environment(configuration, variable);
  }
}
