package com.lhcz.animaletl.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void fillsDefaultsWhenNothingConfigured() {
    AppConfig config = ConfigLoader.resolve(null, Map.of());

    assertEquals("http://localhost:3123", config.api().baseUrl());
    assertEquals(100, config.pipeline().batchSize().intValue());
    assertEquals(5, config.pipeline().concurrency().intValue());
    assertEquals(10, config.pipeline().detailConcurrency().intValue());
    assertEquals(5, config.retry().maxAttempts().intValue());
    assertEquals(1.0, config.retry().baseDelaySeconds().doubleValue());
    assertEquals(60.0, config.retry().maxDelaySeconds().doubleValue());
    assertEquals(2.0, config.retry().backoffFactor().doubleValue());
    assertTrue(config.retry().jitter().booleanValue());
    assertNull(config.web().port());
    assertEquals("failed_data", config.deadLetter().dir());
  }

  @Test
  void environmentOverridesYaml() throws Exception {
    String yaml = "api:\n  baseUrl: http://yaml:1\npipeline:\n  concurrency: 3\n  batchSize: 20\n";
    AppConfig raw;
    try (InputStream in = new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8))) {
      raw = new ConfigLoader().read(in);
    }

    AppConfig config = ConfigLoader.resolve(raw, Map.of("BASE_URL", "http://env:2", "BACKOFF_FACTOR", "3", "WEB_PORT", "8089"));

    assertEquals("http://env:2", config.api().baseUrl());
    assertEquals(3, config.pipeline().concurrency().intValue());
    assertEquals(20, config.pipeline().batchSize().intValue());
    assertEquals(3.0, config.retry().backoffFactor().doubleValue());
    assertEquals(8089, config.web().port().intValue());
  }

  @Test
  void rejectsInvalidValues() {
    assertThrows(IllegalArgumentException.class, () -> ConfigLoader.resolve(null, Map.of("BATCH_SIZE", "101")));
    assertThrows(IllegalArgumentException.class, () -> ConfigLoader.resolve(null, Map.of("CONCURRENCY", "0")));
    assertThrows(IllegalArgumentException.class, () -> ConfigLoader.resolve(null, Map.of("MAX_ATTEMPTS", "five")));
  }

  @Test
  void bundledDefaultsParse() throws Exception {
    AppConfig raw;
    try (InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream("application.yaml")) {
      raw = new ConfigLoader().read(in);
    }
    AppConfig config = ConfigLoader.resolve(raw, Map.of());

    assertEquals(50, config.pipeline().perPage().intValue());
    assertEquals(20, config.api().maxConnectionsPerHost().intValue());
  }

  @Test
  void readsDotEnvFile() throws Exception {
    Path file = tempDir.resolve(".env");
    Files.writeString(file, String.join("\n",
        "# comment",
        "BASE_URL=http://dotenv:9",
        "export CONCURRENCY=7",
        "MAX_DELAY=\"30\"",
        "BROKEN LINE",
        ""));

    Map<String, String> env = ConfigLoader.readDotEnv(file);

    assertEquals(Map.of("BASE_URL", "http://dotenv:9", "CONCURRENCY", "7", "MAX_DELAY", "30"), env);
    assertEquals(Map.of(), ConfigLoader.readDotEnv(tempDir.resolve("missing.env")));
  }
}
