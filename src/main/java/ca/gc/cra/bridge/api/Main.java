package ca.gc.cra.bridge.api;

import ca.gc.cra.bridge.application.port.ConnectionException;
import ca.gc.cra.bridge.config.BridgeConfig;
import ca.gc.cra.bridge.config.BridgeDefaults;
import ca.gc.cra.bridge.config.BridgeRuntime;
import ca.gc.cra.bridge.config.CompositionRoot;
import ca.gc.cra.bridge.config.ConfigKeys;
import ca.gc.cra.bridge.config.ConfigMerger;
import ca.gc.cra.bridge.config.EnvironmentConfig;
import ca.gc.cra.bridge.config.YamlConfigLoader;
import ca.gc.cra.bridge.domain.route.Direction;
import ca.gc.cra.bridge.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bridge entry point: resolves the direction, merges configuration and runs the supervisor until
 * the JVM is asked to shut down.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(30);
  private static final String SUMMARY_USAGE =
      "usage: bridge <K2R|R2K|S2T|T2S> [key=value ...] [--dry-run] [--verbose] [--help]";
  private static final String HELP_TEXT = """
      Kafka / RabbitMQ replication bridge

      Usage:
        bridge <direction> [key=value ...] [flags]

      Directions (or set DIRECTION):
        K2R   Kafka topics to RabbitMQ exchanges
        R2K   RabbitMQ queues to Kafka topics
        S2T   Source Kafka cluster to target Kafka cluster
        T2S   Target Kafka cluster back to source Kafka cluster

      Connections:
        kafkaBootstrap=HOST:PORT[,..]    Kafka cluster for K2R/R2K (KAFKA_BOOTSTRAP_SERVERS)
        sourceBootstrap=HOST:PORT[,..]   Source cluster for S2T/T2S (SOURCE_BOOTSTRAP_SERVERS)
        targetBootstrap=HOST:PORT[,..]   Target cluster for S2T/T2S (TARGET_BOOTSTRAP_SERVERS)
        rabbitHost=HOST rabbitPort=N     RabbitMQ endpoint (RABBITMQ_HOST, RABBITMQ_PORT)
        rabbitUsername=U rabbitPassword=P rabbitVhost=/

      Routes:
        mappings=JSON                    Array of {kafkaTopic, rabbitmqExchange, rabbitmqExchangeType,
                                         rabbitmqQueue, rabbitmqRoutingKey} (REPLICATION_MAPPINGS)
        topicMapping=JSON                Object of source topic to target topic (TOPIC_MAPPING)

      Optional:
        consumerGroup=ID                 Use a Kafka consumer group instead of explicit assignment
        partitionStrategy=ALL|FIRST      Partitions assigned per topic (default ALL)
        startPosition=LATEST|EARLIEST    Where a fresh assignment starts (default LATEST)
        maxPollRecords=1-10000           Records per Kafka poll (default 100)
        prefetch=1-65535                 RabbitMQ prefetch per queue (default 100)
        publisherConfirms=true|false     Wait for RabbitMQ publisher confirms (default true)
        heartbeatIntervalSeconds=N       Heartbeat log interval (default 60)
        emptyPollThreshold=N             Empty polls before a connection probe (default 100)
        deliveryAttempts=1-100           Publish attempts per message (default 3)
        requeueOnFailure=true|false      Requeue RabbitMQ messages that could not be delivered
        healthEnabled=true|false healthPort=0-65535   GET /health endpoint (default 8080)
        config=PATH                      YAML file with common and per-direction sections
        metricsExporter=otlp|none otelEndpoint=URL otelResourceAttributes=K=V,...

      Flags:
        --dry-run   Validate configuration, print the plan and exit
        --verbose   Enable DEBUG logging
        --help      Show this message
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Runs the bridge and returns its exit code without terminating the JVM.
   *
   * @param args raw CLI arguments
   * @return exit code
   */
  static ExitCode run(String[] args) {
    return run(args, System.getenv(), config -> new CompositionRoot(config).build());
  }

  static ExitCode run(
      String[] args, Map<String, String> environment, Function<BridgeConfig, BridgeRuntime> runtimeFactory) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled");
    }

    Direction direction;
    Map<String, String> cli;
    try {
      direction = Direction.parse(input.direction().orElse(environment.get("DIRECTION")));
      cli = CliArgsParser.toMap(input.keyValueArgs());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    LoggingConfigurator.bindDirection(direction.name());

    BridgeConfig config;
    try {
      config = loadConfig(direction, environment, cli);
    } catch (IOException ex) {
      log.error("Unable to read configuration file: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} configuration: {}", direction, ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.CONFIG_ERROR;
    }

    if (input.hasFlag("--dry-run")) {
      CliPrinter.println("Dry-run: configuration is valid; no connection will be opened.");
      CliPrinter.printLines(config.planLines());
      return ExitCode.SUCCESS;
    }

    return runBridge(config, runtimeFactory);
  }

  static BridgeConfig loadConfig(Direction direction, Map<String, String> environment, Map<String, String> cli)
      throws IOException {
    Map<String, String> env = new LinkedHashMap<>(EnvironmentConfig.fromEnvironment(environment));
    Map<String, String> overrides = new LinkedHashMap<>(cli);
    String configPath = Optional.ofNullable(overrides.remove(ConfigKeys.CONFIG))
        .orElse(env.remove(ConfigKeys.CONFIG));

    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null && !configPath.isBlank()) {
      Path path = toPath(configPath.trim());
      if (!Files.exists(path)) {
        throw new IllegalArgumentException("config file not found: " + path);
      }
      yaml = YamlConfigLoader.load(path, direction);
      log.info("Loaded configuration from {}", path);
    }

    Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
        direction, yaml, env, overrides, BridgeDefaults.asFlatMap(direction), log::warn);
    TelemetryConfigurator.configureMetrics(effective);
    return BridgeConfig.fromMap(direction, effective);
  }

  private static ExitCode runBridge(BridgeConfig config, Function<BridgeConfig, BridgeRuntime> runtimeFactory) {
    BridgeRuntime runtime;
    try {
      runtime = runtimeFactory.apply(config);
    } catch (RuntimeException ex) {
      log.error("Unable to initialise {} bridge", config.direction(), ex);
      return ExitCode.RUNTIME_FAILURE;
    }

    CompletableFuture<ExitCode> outcome = new CompletableFuture<>();
    Thread hook = new Thread(
        new ShutdownHook(drainable(runtime), outcome, SHUTDOWN_GRACE, Runtime.getRuntime()::halt),
        "bridge-shutdown");
    Runtime.getRuntime().addShutdownHook(hook);
    ExitCode exit = ExitCode.RUNTIME_FAILURE;
    try {
      log.info("Starting {} bridge ({})", config.direction(), config.direction().description());
      runtime.run();
      log.info("{} bridge stopped", config.direction());
      exit = ExitCode.SUCCESS;
    } catch (ConnectionException ex) {
      log.error("{} bridge stopped: {}", config.direction(), ex.getMessage(), ex);
      exit = ExitCode.CONNECTION_FAILURE;
    } catch (RuntimeException ex) {
      log.error("Unexpected failure in {} bridge", config.direction(), ex);
      exit = ExitCode.RUNTIME_FAILURE;
    } finally {
      runtime.close();
      outcome.complete(exit);
      removeHook(hook);
    }
    return exit;
  }

  private static ShutdownHook.Drainable drainable(BridgeRuntime runtime) {
    return new ShutdownHook.Drainable() {
      @Override
      public void requestStop() {
        runtime.requestStop();
      }

      @Override
      public boolean awaitStopped(Duration timeout) throws InterruptedException {
        return runtime.awaitStopped(timeout);
      }
    };
  }

  private static void removeHook(Thread hook) {
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException ex) {
      log.debug("JVM already shutting down; shutdown hook stays registered");
    }
  }

  private static Path toPath(String raw) {
    try {
      return Path.of(raw);
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException("config must be a valid path (was " + raw + ")", ex);
    }
  }
}
