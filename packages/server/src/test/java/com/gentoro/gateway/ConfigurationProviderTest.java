package com.gentoro.gateway;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.gateway.credentials.ConfigurationCredentialSource;
import com.gentoro.gateway.exception.ConfigMissingException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigurationProviderTest {

  @Test
  void loadsYamlFromClasspath() {
    Configuration cfg = new ConfigurationProvider("classpath:application-test.yaml").config();

    assertEquals(50, cfg.getInt("gateway.team-limit"));
    assertEquals(256, cfg.getInt("gateway.inference.default-max-tokens"));
    assertTrue(new ConfigurationCredentialSource(cfg).read().contains("team-x"));
  }

  @Test
  void missingClasspathResourceYieldsEmptyConfiguration() {
    Configuration cfg = new ConfigurationProvider("classpath:does-not-exist.yaml").config();

    assertTrue(cfg.isEmpty());
  }

  @Test
  void loadsYamlFromFileAndInterpolatesEnvironment(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("gateway.yaml");
    Files.writeString(
        file,
        """
        gateway:
          team-limit: 7
          missing: ${env:GATEWAY_TEST_SURELY_UNDEFINED_VARIABLE}
        """);

    Configuration cfg = new ConfigurationProvider(file.toString()).config();

    assertEquals(7, cfg.getInt("gateway.team-limit"));
    assertNull(ConfigurationProvider.environment(cfg, "GATEWAY_TEST_SURELY_UNDEFINED_VARIABLE"));
  }

  @Test
  void missingFileIsConfigurationError(@TempDir Path dir) {
    assertThrows(
        ConfigMissingException.class,
        () -> new ConfigurationProvider(dir.resolve("nope/none.yaml").toString()));
  }
}
