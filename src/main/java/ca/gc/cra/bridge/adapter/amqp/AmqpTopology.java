package ca.gc.cra.bridge.adapter.amqp;

import ca.gc.cra.bridge.domain.route.ReplicationMapping;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ShutdownSignalException;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Declares the exchanges, queues and bindings named by the route table.
 *
 * <p>Every declaration runs on its own short-lived channel: a failed declaration closes only that
 * channel, is recorded in the {@link TopologyReport}, and the remaining declarations proceed.
 * Exchanges and queues are durable.</p>
 *
 * @since 0.1.0
 */
final class AmqpTopology {
  private static final Logger log = LoggerFactory.getLogger(AmqpTopology.class);

  private AmqpTopology() {}

  /**
   * Provisions exchanges, queues and bindings for a publishing bridge.
   *
   * @param connection open connection
   * @param mappings route entries
   * @return report of declared and failed items
   */
  static TopologyReport declareForPublishing(Connection connection, List<ReplicationMapping> mappings) {
    Objects.requireNonNull(connection, "connection");
    TopologyReport report = new TopologyReport();
    Map<String, String> exchanges = new LinkedHashMap<>();
    Set<QueueBinding> queues = new LinkedHashSet<>();
    for (ReplicationMapping mapping : mappings) {
      mapping.rabbitmqExchange().ifPresent(exchange -> exchanges.putIfAbsent(exchange, mapping.rabbitmqExchangeType()));
      mapping.rabbitmqQueue().ifPresent(queue -> queues.add(new QueueBinding(
          queue,
          mapping.rabbitmqExchange().orElse(""),
          mapping.rabbitmqRoutingKey().orElse(""))));
    }
    exchanges.forEach((exchange, type) -> run(connection, report, "exchange " + exchange + " (" + type + ")",
        channel -> channel.exchangeDeclare(exchange, type, true)));
    for (QueueBinding binding : queues) {
      boolean queueDeclared = run(connection, report, "queue " + binding.queue(),
          channel -> channel.queueDeclare(binding.queue(), true, false, false, null));
      if (queueDeclared && !binding.exchange().isEmpty() && !binding.routingKey().isEmpty()) {
        run(connection, report,
            "binding " + binding.queue() + " <- " + binding.exchange() + " [" + binding.routingKey() + "]",
            channel -> channel.queueBind(binding.queue(), binding.exchange(), binding.routingKey()));
      }
    }
    summarize(report);
    return report;
  }

  /**
   * Declares the queues a consuming bridge reads from.
   *
   * @param connection open connection
   * @param queues queue names
   * @return report of declared and failed items
   */
  static TopologyReport declareQueues(Connection connection, List<String> queues) {
    Objects.requireNonNull(connection, "connection");
    TopologyReport report = new TopologyReport();
    for (String queue : new LinkedHashSet<>(queues)) {
      run(connection, report, "queue " + queue, channel -> channel.queueDeclare(queue, true, false, false, null));
    }
    summarize(report);
    return report;
  }

  private static boolean run(Connection connection, TopologyReport report, String item, Declaration declaration) {
    try (Channel channel = connection.createChannel()) {
      declaration.apply(channel);
      report.declared(item);
      log.info("Declared {}", item);
      return true;
    } catch (IOException | TimeoutException | ShutdownSignalException ex) {
      report.failed(item, ex.getMessage());
      log.error("Failed to declare {}: {}", item, ex.getMessage());
      return false;
    }
  }

  private static void summarize(TopologyReport report) {
    if (report.clean()) {
      log.info("Topology ready: {} declaration(s)", report.declared().size());
    } else {
      log.warn("Topology provisioned with {} failure(s): {}", report.failures().size(), report.failures());
    }
  }

  @FunctionalInterface
  private interface Declaration {
    void apply(Channel channel) throws IOException;
  }

  private record QueueBinding(String queue, String exchange, String routingKey) {}
}
