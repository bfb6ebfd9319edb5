package ca.gc.cra.framescope.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads observer configuration from YAML and merges it with command-line overrides.
 * <p>Nested sections are flattened to dotted keys, so
 * <pre>
 * observability:
 *   enableAudioCapture: true
 * decode:
 *   workers: 2
 * </pre>
 * becomes {@code observability.enableAudioCapture=true} and {@code decode.workers=2}.</p>
 */
public final class ObservabilityConfigLoader {
  private static final List<String> SECTIONS = List.of(ObservabilityConfig.SECTION, DecodeSettings.SECTION);

  private ObservabilityConfigLoader() {}

  /**
   * Loads and flattens a YAML document.
   *
   * @param path location of the YAML configuration
   * @return flat map, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML is malformed or uses unsupported structures
   */
  public static Optional<Map<String, String>> load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      Object document = new Yaml().load(reader);
      if (document == null) {
        return Optional.of(Map.of());
      }
      Map<String, String> flattened = new LinkedHashMap<>();
      flatten(asMap(document, "root"), "", flattened);
      return Optional.of(Map.copyOf(flattened));
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
  }

  /**
   * Merges YAML values with CLI overrides; CLI wins. A bare CLI key such as {@code enableAudioCapture} also
   * replaces the section-qualified YAML key it shadows.
   *
   * @param yaml flattened YAML values, possibly empty
   * @param cli command-line overrides, possibly empty
   * @param warn receives a message for every YAML key a CLI key overrides; may be {@code null}
   * @return immutable merged map
   */
  public static Map<String, String> merge(
      Optional<Map<String, String>> yaml, Map<String, String> cli, Consumer<String> warn) {
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> merged = new LinkedHashMap<>(yaml.orElse(Map.of()));
    Map<String, String> overrides = cli == null ? Map.of() : cli;
    for (Map.Entry<String, String> entry : overrides.entrySet()) {
      String key = entry.getKey();
      if (key == null || entry.getValue() == null) {
        continue;
      }
      boolean shadowed = merged.containsKey(key);
      if (key.indexOf('.') < 0) {
        for (String section : SECTIONS) {
          shadowed |= merged.remove(section + '.' + key) != null;
        }
      }
      if (shadowed && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      merged.put(key, entry.getValue());
    }
    return Map.copyOf(merged);
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " section contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      String key = entry.getKey();
      if (key.isBlank()) {
        throw new IllegalArgumentException("YAML contains blank keys");
      }
      String composite = prefix.isEmpty() ? key : prefix + '.' + key;
      Object value = entry.getValue();
      if (value instanceof Map<?, ?> nested) {
        flatten(asMap(nested, composite), composite, target);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML lists are not supported for key " + composite);
      } else {
        target.put(composite, value == null ? "" : value.toString());
      }
    }
  }
}
