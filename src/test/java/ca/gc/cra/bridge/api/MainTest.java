package ca.gc.cra.bridge.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.bridge.config.BridgeConfig;
import ca.gc.cra.bridge.config.BridgeRuntime;
import ca.gc.cra.bridge.domain.route.Direction;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MainTest {
  private static final String MAPPINGS =
      "mappings=[{\"kafkaTopic\":\"orders\",\"rabbitmqExchange\":\"events\",\"rabbitmqRoutingKey\":\"orders.created\"}]";
  private static final Function<BridgeConfig, BridgeRuntime> UNUSED = config -> {
    throw new AssertionError("runtime must not be built");
  };

  private StringWriter output;

  @BeforeEach
  void captureOutput() {
    output = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(output, true));
  }

  @AfterEach
  void restore() {
    CliPrinter.clearTestWriter();
    System.clearProperty("otel.metrics.exporter");
    System.clearProperty("otel.exporter.otlp.endpoint");
    System.clearProperty("otel.resource.attributes");
  }

  @Test
  void helpPrintsUsageAndSucceeds() {
    ExitCode exit = Main.run(new String[] {"--help"}, Map.of(), UNUSED);

    assertEquals(ExitCode.SUCCESS, exit);
    assertTrue(output.toString().contains("Directions (or set DIRECTION):"));
  }

  @Test
  void dryRunPrintsPlanWithoutConnecting() {
    ExitCode exit = Main.run(
        new String[] {"K2R", MAPPINGS, "rabbitPassword=hunter2", "--dry-run"}, Map.of(), UNUSED);

    assertEquals(ExitCode.SUCCESS, exit);
    String printed = output.toString();
    assertTrue(printed.contains("Dry-run: configuration is valid"));
    assertTrue(printed.contains("orders -> exchange:events[orders.created]"));
    assertFalse(printed.contains("hunter2"));
  }

  @Test
  void directionMayComeFromEnvironment() {
    Map<String, String> env = Map.of(
        "DIRECTION", "s2t",
        "SOURCE_BOOTSTRAP_SERVERS", "src:9092",
        "TARGET_BOOTSTRAP_SERVERS", "dr:9092",
        "TOPIC_MAPPING", "{\"orders\":\"orders-dr\"}");

    ExitCode exit = Main.run(new String[] {"--dry-run"}, env, UNUSED);

    assertEquals(ExitCode.SUCCESS, exit);
    assertTrue(output.toString().contains("orders -> topic:orders-dr"));
  }

  @Test
  void missingDirectionIsInvalidArgs() {
    ExitCode exit = Main.run(new String[] {MAPPINGS}, Map.of(), UNUSED);

    assertEquals(ExitCode.INVALID_ARGS, exit);
    assertEquals(1, exit.code());
    assertTrue(output.toString().contains("usage: bridge"));
  }

  @Test
  void malformedArgumentIsInvalidArgs() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"K2R", MAPPINGS, "orphan"}, Map.of(), UNUSED));
  }

  @Test
  void missingRoutesIsConfigError() {
    assertEquals(ExitCode.CONFIG_ERROR, Main.run(new String[] {"R2K", "--dry-run"}, Map.of(), UNUSED));
  }

  @Test
  void invalidMappingJsonIsConfigError() {
    ExitCode exit = Main.run(new String[] {"K2R", "mappings=[{\"kafkaTopic\":", "--dry-run"}, Map.of(), UNUSED);

    assertEquals(ExitCode.CONFIG_ERROR, exit);
  }

  @Test
  void missingConfigFileIsConfigError(@TempDir Path dir) {
    String config = "config=" + dir.resolve("absent.yaml");

    assertEquals(ExitCode.CONFIG_ERROR, Main.run(new String[] {"K2R", MAPPINGS, config}, Map.of(), UNUSED));
  }

  @Test
  void unsupportedExporterIsConfigError() {
    ExitCode exit = Main.run(new String[] {"K2R", MAPPINGS, "metricsExporter=prometheus"}, Map.of(), UNUSED);

    assertEquals(ExitCode.CONFIG_ERROR, exit);
  }

  @Test
  void yamlSectionsFeedTheConfiguration(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("bridge.yaml");
    Files.writeString(file, String.join("\n",
        "common:",
        "  kafkaBootstrap: broker:9093",
        "r2k:",
        "  mappings:",
        "    - rabbitmqQueue: orders.q",
        "      kafkaTopic: orders",
        ""));

    BridgeConfig config = Main.loadConfig(Direction.R2K, Map.of(), Map.of("config", file.toString()));

    assertEquals("broker:9093", config.produceBootstrap());
    assertEquals("orders", config.destinationTopics().get(0));
  }

  @Test
  void explicitConfigPathMustExist(@TempDir Path dir) {
    Map<String, String> env = Map.of("BRIDGE_CONFIG", dir.resolve("missing.yaml").toString());

    assertThrows(IllegalArgumentException.class, () -> Main.loadConfig(Direction.K2R, env, Map.of()));
  }

  @Test
  void runtimeConstructionFailureIsReported() {
    AtomicReference<BridgeConfig> seen = new AtomicReference<>();
    ExitCode exit = Main.run(new String[] {"K2R", MAPPINGS, "healthEnabled=false"}, Map.of(), config -> {
      seen.set(config);
      throw new IllegalStateException("cannot wire adapters");
    });

    assertEquals(ExitCode.RUNTIME_FAILURE, exit);
    assertEquals(Direction.K2R, seen.get().direction());
    assertFalse(seen.get().healthEnabled());
  }
}
