package ca.gc.cra.bridge.domain.route;

import ca.gc.cra.bridge.domain.message.Destination;
import ca.gc.cra.bridge.validation.Strings;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Immutable route table keyed by source identifier.
 * <p><strong>Why:</strong> Every received message is resolved against this table, so lookups are a
 * single hash probe and the table never changes after startup.</p>
 * <p><strong>Role:</strong> Domain service consulted by the replication pipeline and used by the
 * adapters to decide what to subscribe to.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Select the source identifier for the direction: topic for K2R, queue for R2K, source topic for
 *   S2T, target topic for T2S.</li>
 *   <li>Reject duplicate source identifiers and routes without a destination.</li>
 *   <li>Skip entries that do not name a source for this direction, so one mapping list can be shared by
 *   a K2R and an R2K deployment.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; safe for concurrent reads.</p>
 *
 * @since 0.1.0
 */
public final class MappingTable {
  private static final Logger log = LoggerFactory.getLogger(MappingTable.class);

  private final Direction direction;
  private final Map<String, Route> routes;
  private final List<ReplicationMapping> mappings;

  private MappingTable(Direction direction, Map<String, Route> routes, List<ReplicationMapping> mappings) {
    this.direction = direction;
    this.routes = Collections.unmodifiableMap(routes);
    this.mappings = List.copyOf(mappings);
  }

  /**
   * Builds the table for one direction.
   *
   * @param direction replication direction
   * @param mappings configured mappings
   * @return immutable table with at least one route
   * @throws IllegalArgumentException on duplicates, missing destinations, invalid names or an empty result
   */
  public static MappingTable forDirection(Direction direction, List<ReplicationMapping> mappings) {
    Objects.requireNonNull(direction, "direction");
    Objects.requireNonNull(mappings, "mappings");
    Map<String, Route> routes = new LinkedHashMap<>();
    List<ReplicationMapping> used = new ArrayList<>();
    int index = 0;
    for (ReplicationMapping mapping : mappings) {
      Objects.requireNonNull(mapping, "mapping");
      Optional<String> source = sourceOf(direction, mapping);
      if (source.isEmpty()) {
        log.warn("Skipping mapping #{}: no source for {} ({})", index, direction, mapping);
        index++;
        continue;
      }
      String sourceId = source.get();
      Destination destination = destinationOf(direction, mapping, index);
      Route previous = routes.putIfAbsent(sourceId, new Route(sourceId, destination));
      if (previous != null) {
        throw new IllegalArgumentException(
            "duplicate source '" + sourceId + "' in mapping #" + index + " for " + direction);
      }
      used.add(mapping);
      index++;
    }
    if (routes.isEmpty()) {
      throw new IllegalArgumentException("no replication routes configured for " + direction);
    }
    return new MappingTable(direction, routes, used);
  }

  /**
   * Resolves the route for a source identifier.
   *
   * @param sourceId topic or queue name
   * @return route when configured
   */
  public Optional<Route> resolve(String sourceId) {
    if (sourceId == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(routes.get(sourceId));
  }

  public Direction direction() {
    return direction;
  }

  /** Returns the source identifiers in configuration order. */
  public List<String> sourceIds() {
    return List.copyOf(routes.keySet());
  }

  /** Returns the routes in configuration order. */
  public List<Route> routes() {
    return List.copyOf(routes.values());
  }

  /** Returns the mappings that contributed a route, for topology provisioning. */
  public List<ReplicationMapping> mappings() {
    return mappings;
  }

  public int size() {
    return routes.size();
  }

  private static Optional<String> sourceOf(Direction direction, ReplicationMapping mapping) {
    return switch (direction) {
      case K2R, S2T -> mapping.kafkaTopic().map(topic -> Strings.sanitizeTopic("kafkaTopic", topic));
      case R2K -> mapping.rabbitmqQueue().map(queue -> Strings.sanitizeAmqpName("rabbitmqQueue", queue));
      case T2S -> mapping.targetTopic().map(topic -> Strings.sanitizeTopic("targetTopic", topic));
    };
  }

  private static Destination destinationOf(Direction direction, ReplicationMapping mapping, int index) {
    return switch (direction) {
      case K2R -> exchangeDestination(mapping, index);
      case R2K -> Destination.topic(Strings.sanitizeTopic("kafkaTopic",
          mapping.kafkaTopic().orElseThrow(() -> missing("kafkaTopic", index, direction))));
      case S2T -> Destination.topic(Strings.sanitizeTopic("targetTopic",
          mapping.targetTopic().orElseThrow(() -> missing("targetTopic", index, direction))));
      case T2S -> Destination.topic(Strings.sanitizeTopic("kafkaTopic",
          mapping.kafkaTopic().orElseThrow(() -> missing("kafkaTopic", index, direction))));
    };
  }

  private static Destination exchangeDestination(ReplicationMapping mapping, int index) {
    String routingKey = mapping.rabbitmqRoutingKey()
        .map(key -> Strings.sanitizeAmqpName("rabbitmqRoutingKey", key))
        .orElse("");
    if (mapping.rabbitmqExchange().isPresent()) {
      String exchange = Strings.sanitizeAmqpName("rabbitmqExchange", mapping.rabbitmqExchange().get());
      return Destination.exchange(exchange, routingKey);
    }
    // Without an exchange, publish through the default exchange straight to the queue.
    String queue = mapping.rabbitmqQueue()
        .map(name -> Strings.sanitizeAmqpName("rabbitmqQueue", name))
        .orElseThrow(() -> missing("rabbitmqExchange or rabbitmqQueue", index, Direction.K2R));
    return Destination.exchange("", queue);
  }

  private static IllegalArgumentException missing(String field, int index, Direction direction) {
    return new IllegalArgumentException("mapping #" + index + " requires " + field + " for " + direction);
  }
}
