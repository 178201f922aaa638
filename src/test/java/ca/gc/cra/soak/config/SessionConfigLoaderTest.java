package ca.gc.cra.soak.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SessionConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void loadsProfileFromTestResources() throws Exception {
    SessionConfigLoader.LoadedConfig loaded =
        SessionConfigLoader.load(resource("soak-test.yaml"), "smoke", Map.of());

    SessionConfig session = loaded.session();
    assertEquals(Duration.ofMinutes(5), session.sessionDuration());
    assertEquals(Duration.ofSeconds(30), session.snapshotInterval());
    assertEquals(40d, session.leak().maxMemoryGrowthMb());
    assertEquals(12d, session.component().mediumMb());
    assertEquals(Duration.ofMinutes(5), session.healthCheckInterval());
    assertEquals("otlp", loaded.effective().get("metricsExporter"));
  }

  @Test
  void overridesTakePrecedence() throws Exception {
    SessionConfigLoader.LoadedConfig loaded = SessionConfigLoader.load(
        resource("soak-test.yaml"), "smoke", Map.of("leak.maxMemoryGrowthMb", "25", "metricsExporter", "none"));

    assertEquals(25d, loaded.session().leak().maxMemoryGrowthMb());
    assertEquals("none", loaded.effective().get("metricsExporter"));
  }

  @Test
  void missingFileFallsBackToDefaults() throws Exception {
    SessionConfigLoader.LoadedConfig loaded =
        SessionConfigLoader.load(tempDir.resolve("absent.yaml"), "standard", Map.of());

    assertEquals(SessionConfig.defaults(), loaded.session());
  }

  @Test
  void nullPathUsesDefaultsAndOverrides() throws Exception {
    SessionConfigLoader.LoadedConfig loaded =
        SessionConfigLoader.load(null, "standard", Map.of("sessionDuration", "PT1H"));

    assertEquals(Duration.ofHours(1), loaded.session().sessionDuration());
  }

  @Test
  void bundledProfilesLoadFromClasspath() throws Exception {
    SessionConfig extended = SessionConfigLoader.loadBundled("extended", Map.of()).session();
    assertEquals(Duration.ofHours(24), extended.sessionDuration());
    assertEquals(Duration.ofMinutes(2), extended.snapshotInterval());
    assertEquals(150d, extended.leak().maxMemoryGrowthMb());

    SessionConfig smoke = SessionConfigLoader.loadBundled("smoke", Map.of()).session();
    assertEquals(Duration.ofSeconds(10), smoke.componentCheckInterval());
    assertEquals(100d, smoke.leak().maxMemoryGrowthMb());
  }

  @Test
  void invalidMergedConfigurationIsRejected() {
    assertThrows(ConfigurationException.class, () -> SessionConfigLoader.load(
        resource("soak-test.yaml"), "smoke", Map.of("leak.component.mediumMb", "2")));
  }

  private static Path resource(String name) throws URISyntaxException {
    return Path.of(SessionConfigLoaderTest.class.getClassLoader().getResource(name).toURI());
  }
}
