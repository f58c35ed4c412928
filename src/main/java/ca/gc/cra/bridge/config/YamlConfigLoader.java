package ca.gc.cra.bridge.config;

import ca.gc.cra.bridge.application.json.JsonSupport;
import ca.gc.cra.bridge.domain.route.Direction;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads bridge configuration from a YAML document and flattens sections into simple key/value maps.
 *
 * <p>The {@code common} section is merged with the section named after the direction
 * ({@code k2r}, {@code r2k}, {@code s2t} or {@code t2s}). Route tables ({@code mappings} and
 * {@code topicMapping}) may be written as native YAML sequences and mappings; they are rendered to
 * JSON so that they share one parser with the environment variables.</p>
 */
public final class YamlConfigLoader {
  private static final Set<String> STRUCTURED_KEYS = Set.of(ConfigKeys.MAPPINGS, ConfigKeys.TOPIC_MAPPING);

  private YamlConfigLoader() {}

  /**
   * Loads YAML from {@code path} and merges the {@code common} section with the direction section.
   *
   * @param path location of the YAML configuration
   * @param direction replication direction selecting the section
   * @return optional flat map containing merged configuration; empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML structure is invalid
   */
  public static Optional<Map<String, String>> load(Path path, Direction direction) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(direction, "direction");
    if (!Files.exists(path)) {
      return Optional.empty();
    }

    String section = direction.name().toLowerCase(Locale.ROOT);
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      Object document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
      if (document == null) {
        return Optional.of(Map.of());
      }
      Map<String, Object> root = asMap(document, "root");

      Map<String, String> flattened = new LinkedHashMap<>();
      JsonSupport json = new JsonSupport();
      Object commonSection = findSection(root, "common");
      if (commonSection != null) {
        flatten(asMap(commonSection, "common"), "", flattened, json);
      }
      Object directionSection = findSection(root, section);
      if (directionSection instanceof Map<?, ?> directionMap) {
        flatten(asMap(directionMap, section), "", flattened, json);
      }

      return Optional.of(Map.copyOf(flattened));
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
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

  private static Object findSection(Map<String, Object> root, String key) {
    for (Map.Entry<String, Object> entry : root.entrySet()) {
      if (entry.getKey() != null
          && entry.getKey().trim().toLowerCase(Locale.ROOT).equals(key)) {
        return entry.getValue();
      }
    }
    return null;
  }

  private static void flatten(
      Map<String, Object> source, String prefix, Map<String, String> target, JsonSupport json) {
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      String key = entry.getKey();
      if (key == null || key.isBlank()) {
        throw new IllegalArgumentException("YAML contains blank keys");
      }
      String composite = prefix.isEmpty() ? key : prefix + '.' + key;
      Object value = entry.getValue();
      if (value == null) {
        target.put(composite, "");
      } else if (STRUCTURED_KEYS.contains(composite) && (value instanceof Map<?, ?> || value instanceof List<?>)) {
        target.put(composite, json.write(value));
      } else if (value instanceof Map<?, ?> nested) {
        flatten(asMap(nested, composite), composite, target, json);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML arrays are not supported for key " + composite);
      } else {
        target.put(composite, value.toString());
      }
    }
  }
}
