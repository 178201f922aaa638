package ca.gc.cra.soak.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads profile-sectioned YAML into flat dotted-key maps.
 *
 * <p>A document holds a {@code common} section and one section per profile. The selected profile is
 * laid over {@code common}; nested mappings become dotted keys, so
 * {@code leak: {component: {lowMb: 5}}} yields {@code leak.component.lowMb=5}. Section names match
 * case-insensitively.</p>
 *
 * @since SOAK 0.1
 */
public final class YamlConfigLoader {
  static final String COMMON_SECTION = "common";

  private YamlConfigLoader() {}

  /**
   * Loads a YAML file.
   *
   * @param path location of the YAML configuration
   * @param profile session profile, for example {@code smoke}, {@code standard} or {@code extended}
   * @return flat map, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws ConfigurationException when the YAML structure is invalid
   */
  public static Optional<Map<String, String>> load(Path path, String profile) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(profile, "profile");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return Optional.of(parse(reader, path.toString(), profile));
    }
  }

  /**
   * Loads a YAML document bundled on the classpath.
   *
   * @param resource classpath resource name, for example {@code soak.yaml}
   * @param profile session profile
   * @return flat map, or empty when the resource is not on the classpath
   * @throws IOException when the resource cannot be read
   * @throws ConfigurationException when the YAML structure is invalid
   */
  public static Optional<Map<String, String>> loadResource(String resource, String profile)
      throws IOException {
    Objects.requireNonNull(resource, "resource");
    Objects.requireNonNull(profile, "profile");
    ClassLoader loader = Thread.currentThread().getContextClassLoader();
    if (loader == null) {
      loader = YamlConfigLoader.class.getClassLoader();
    }
    InputStream in = loader.getResourceAsStream(resource);
    if (in == null) {
      return Optional.empty();
    }
    try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
      return Optional.of(parse(reader, "classpath:" + resource, profile));
    }
  }

  static Map<String, String> parse(Reader reader, String source, String profile) {
    String wanted = normalize(profile);
    Object document;
    try {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new ConfigurationException("Failed to parse YAML config at " + source, ex);
    }
    if (document == null) {
      return Map.of();
    }
    if (!(document instanceof Map<?, ?> root)) {
      throw new ConfigurationException(source + ": root must be a mapping of profile sections");
    }

    Map<String, String> flat = new LinkedHashMap<>();
    section(root, COMMON_SECTION, source).ifPresent(common -> flattenInto(common, flat));
    if (!COMMON_SECTION.equals(wanted)) {
      section(root, wanted, source).ifPresent(selected -> flattenInto(selected, flat));
    }
    return Map.copyOf(flat);
  }

  private static Optional<Map<?, ?>> section(Map<?, ?> root, String name, String source) {
    for (Map.Entry<?, ?> entry : root.entrySet()) {
      if (entry.getKey() instanceof String key && normalize(key).equals(name)) {
        Object value = entry.getValue();
        if (value == null) {
          return Optional.empty();
        }
        if (value instanceof Map<?, ?> map) {
          return Optional.of(map);
        }
        throw new ConfigurationException(source + ": section " + name + " must be a mapping");
      }
    }
    return Optional.empty();
  }

  private static void flattenInto(Map<?, ?> section, Map<String, String> target) {
    Deque<Map.Entry<String, Map<?, ?>>> pending = new ArrayDeque<>();
    pending.push(Map.entry("", section));
    while (!pending.isEmpty()) {
      Map.Entry<String, Map<?, ?>> next = pending.pop();
      String prefix = next.getKey();
      for (Map.Entry<?, ?> entry : next.getValue().entrySet()) {
        if (!(entry.getKey() instanceof String name) || name.isBlank()) {
          throw new ConfigurationException(
              "YAML keys must be non-blank strings" + (prefix.isEmpty() ? "" : " under " + prefix));
        }
        String key = prefix.isEmpty() ? name.trim() : prefix + '.' + name.trim();
        Object value = entry.getValue();
        if (value instanceof Map<?, ?> nested) {
          pending.push(Map.entry(key, nested));
        } else if (value instanceof Iterable<?>) {
          throw new ConfigurationException("YAML lists are not supported for key " + key);
        } else {
          target.put(key, value == null ? "" : value.toString());
        }
      }
    }
  }

  private static String normalize(String name) {
    return name.trim().toLowerCase(Locale.ROOT);
  }
}
