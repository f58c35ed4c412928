package ca.gc.cra.bridge.config;

import ca.gc.cra.bridge.domain.route.Direction;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, environment, YAML, and CLI sources while enforcing precedence and
 * the per-direction required keys.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI > YAML > environment > defaults.
   *
   * @param direction active replication direction
   * @param yaml optional YAML-derived settings for the direction
   * @param environment settings derived from environment variables (may be empty)
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the direction
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when a required key is missing
   */
  public static Map<String, String> buildEffectiveConfig(
      Direction direction,
      Optional<Map<String, String>> yaml,
      Map<String, String> environment,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(direction, "direction");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> environmentCopy = environment == null ? Map.of() : environment;
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    merged.putAll(environmentCopy);
    merged.putAll(yamlCopy);

    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null) {
        continue;
      }
      String value = entry.getValue();
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      if (value != null) {
        merged.put(key, value);
      }
    }

    validate(direction, merged);
    return Map.copyOf(merged);
  }

  private static void validate(Direction direction, Map<String, String> effective) {
    if (direction.isLogToLog()) {
      requireKey(direction, effective, ConfigKeys.SOURCE_BOOTSTRAP, "SOURCE_BOOTSTRAP_SERVERS");
      requireKey(direction, effective, ConfigKeys.TARGET_BOOTSTRAP, "TARGET_BOOTSTRAP_SERVERS");
      requireKey(direction, effective, ConfigKeys.TOPIC_MAPPING, "TOPIC_MAPPING");
    } else {
      requireKey(direction, effective, ConfigKeys.KAFKA_BOOTSTRAP, "KAFKA_BOOTSTRAP_SERVERS");
      requireKey(direction, effective, ConfigKeys.MAPPINGS, "REPLICATION_MAPPINGS");
    }
  }

  private static void requireKey(Direction direction, Map<String, String> effective, String key, String variable) {
    if (trim(effective.get(key)).isEmpty()) {
      throw new IllegalArgumentException(
          key + " is required for " + direction + " (set " + variable + " or pass " + key + "=...)");
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
