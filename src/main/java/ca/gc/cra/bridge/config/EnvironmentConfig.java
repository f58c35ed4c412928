package ca.gc.cra.bridge.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Reads bridge settings from environment variables such as {@code KAFKA_BOOTSTRAP_SERVERS} and
 * {@code REPLICATION_MAPPINGS}.
 */
public final class EnvironmentConfig {
  private EnvironmentConfig() {}

  /**
   * Translates known environment variables into configuration keys; unknown and blank variables
   * are ignored.
   *
   * @param environment environment snapshot, usually {@link System#getenv()}
   * @return flat map keyed by configuration key
   */
  public static Map<String, String> fromEnvironment(Map<String, String> environment) {
    Objects.requireNonNull(environment, "environment");
    Map<String, String> values = new LinkedHashMap<>();
    ConfigKeys.ENVIRONMENT.forEach((variable, key) -> {
      String value = environment.get(variable);
      if (value != null && !value.isBlank()) {
        values.put(key, value.trim());
      }
    });
    return Map.copyOf(values);
  }
}
