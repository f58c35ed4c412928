package ca.gc.cra.bridge.adapter.amqp;

import ca.gc.cra.bridge.application.port.ClockPort;
import ca.gc.cra.bridge.infrastructure.exec.ExecutorFactories;
import com.rabbitmq.client.BlockedListener;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens RabbitMQ connections and tracks broker flow control on them.
 *
 * <p>Automatic recovery is disabled: the supervisor decides when to reconnect, and the adapters
 * repeat their setup after each new connection.</p>
 *
 * @since 0.1.0
 */
public final class AmqpConnector {
  private static final Logger log = LoggerFactory.getLogger(AmqpConnector.class);

  private final AmqpSettings settings;
  private final ConnectionFactory factory;
  private final ClockPort clock;
  private final AtomicLong blockedSince = new AtomicLong(-1L);

  public AmqpConnector(AmqpSettings settings) {
    this(settings, new ConnectionFactory(), ClockPort.SYSTEM);
  }

  AmqpConnector(AmqpSettings settings, ConnectionFactory factory, ClockPort clock) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.factory = configure(Objects.requireNonNull(factory, "factory"), settings);
    this.clock = Objects.requireNonNullElse(clock, ClockPort.SYSTEM);
  }

  /**
   * Opens one connection. Callers wrap this in their retry policy.
   *
   * @param connectionName name shown in the broker's management UI
   * @return open connection with a blocked-connection listener attached
   * @throws IOException when the broker refuses the connection
   * @throws TimeoutException when the handshake times out
   */
  public Connection newConnection(String connectionName) throws IOException, TimeoutException {
    Connection connection = factory.newConnection(connectionName);
    blockedSince.set(-1L);
    connection.addBlockedListener(new FlowControlListener());
    log.info("Connected to {}", settings.describe());
    return connection;
  }

  /**
   * Indicates whether the broker has blocked publishing for longer than the configured timeout.
   *
   * @return {@code true} when the connection should be recycled
   */
  public boolean blockedTooLong() {
    long since = blockedSince.get();
    return since >= 0 && clock.nowMillis() - since > settings.blockedTimeout().toMillis();
  }

  public boolean blocked() {
    return blockedSince.get() >= 0;
  }

  public AmqpSettings settings() {
    return settings;
  }

  public String describe() {
    return settings.describe();
  }

  private static ConnectionFactory configure(ConnectionFactory factory, AmqpSettings settings) {
    factory.setHost(settings.host());
    factory.setPort(settings.port());
    factory.setUsername(settings.username());
    factory.setPassword(settings.password());
    factory.setVirtualHost(settings.virtualHost());
    factory.setRequestedHeartbeat((int) settings.heartbeat().toSeconds());
    factory.setConnectionTimeout((int) settings.connectionTimeout().toMillis());
    factory.setAutomaticRecoveryEnabled(false);
    factory.setTopologyRecoveryEnabled(false);
    factory.setThreadFactory(ExecutorFactories.namedThreadFactory("bridge-amqp", true));
    return factory;
  }

  private final class FlowControlListener implements BlockedListener {
    @Override
    public void handleBlocked(String reason) {
      blockedSince.compareAndSet(-1L, clock.nowMillis());
      log.warn("{} blocked by broker flow control: {}", settings.describe(), reason);
    }

    @Override
    public void handleUnblocked() {
      blockedSince.set(-1L);
      log.info("{} unblocked", settings.describe());
    }
  }
}
