package ca.gc.cra.soak.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void overridesWinOverYamlAndEmitWarning() {
    Map<String, String> yaml = Map.of("sessionDuration", "PT1H", "snapshotInterval", "PT30S");
    Map<String, String> overrides = Map.of("sessionDuration", "PT2H", "verbose", "true");
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        Optional.of(yaml), overrides, DefaultsForSession.asFlatMap(), warnings::add);

    assertEquals("PT2H", merged.get("sessionDuration"));
    assertEquals("PT30S", merged.get("snapshotInterval"));
    assertEquals("true", merged.get("verbose"));
    assertEquals("otlp", merged.get("metricsExporter"));
    assertEquals(List.of("Override replaces YAML value for key: sessionDuration"), warnings);
  }

  @Test
  void nullOverrideValueKeepsYamlValue() {
    Map<String, String> overrides = new HashMap<>();
    overrides.put("sessionDuration", null);

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        Optional.of(Map.of("sessionDuration", "PT3H")), overrides, DefaultsForSession.asFlatMap(), msg -> {});

    assertEquals("PT3H", merged.get("sessionDuration"));
  }

  @Test
  void unrecognisedKeysAreReported() {
    List<String> warnings = new ArrayList<>();

    ConfigMerger.buildEffectiveConfig(
        Optional.of(Map.of("leak.maxMemoryGrowthMB", "50")), Map.of("snapshotIntervl", "PT5S"),
        DefaultsForSession.asFlatMap(), warnings::add);

    assertEquals(List.of(
        "Unrecognised YAML key: leak.maxMemoryGrowthMB",
        "Unrecognised override key: snapshotIntervl"), warnings);
  }

  @Test
  void invalidEndpointIsRejected() {
    assertThrows(ConfigurationException.class, () -> ConfigMerger.buildEffectiveConfig(
        Optional.of(Map.of("otelEndpoint", "collector:4317")), Map.of(), DefaultsForSession.asFlatMap(),
        msg -> {}));
  }

  @Test
  void unknownExporterIsRejected() {
    assertThrows(ConfigurationException.class, () -> ConfigMerger.buildEffectiveConfig(
        Optional.empty(), Map.of("metricsExporter", "prometheus"), DefaultsForSession.asFlatMap(), msg -> {}));
  }

  @Test
  void invalidSessionSettingIsRejected() {
    ConfigurationException ex = assertThrows(ConfigurationException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            Optional.of(Map.of("healthCheckInterval", "-5")), Map.of(), DefaultsForSession.asFlatMap(),
            msg -> {}));

    assertTrue(ex.getMessage().contains("healthCheckInterval"));
  }
}
