package ca.gc.cra.bridge.adapter.amqp;

import ca.gc.cra.bridge.logging.Logs;
import ca.gc.cra.bridge.validation.Net;
import ca.gc.cra.bridge.validation.Numbers;
import ca.gc.cra.bridge.validation.Strings;
import java.time.Duration;
import java.util.Objects;

/**
 * Connection and flow-control settings for the RabbitMQ adapters.
 *
 * @param host broker host name or address
 * @param port AMQP port
 * @param username login user
 * @param password login password; never logged
 * @param virtualHost virtual host, {@code /} by default
 * @param prefetch unacknowledged deliveries allowed per subscription
 * @param publisherConfirms whether publishes wait for broker confirms
 * @param heartbeat requested AMQP heartbeat
 * @param connectionTimeout TCP and handshake timeout
 * @param blockedTimeout how long the broker may block the connection before it is recycled
 * @param confirmTimeout maximum wait for a publisher confirm
 * @since 0.1.0
 */
public record AmqpSettings(
    String host,
    int port,
    String username,
    String password,
    String virtualHost,
    int prefetch,
    boolean publisherConfirms,
    Duration heartbeat,
    Duration connectionTimeout,
    Duration blockedTimeout,
    Duration confirmTimeout) {

  public static final int DEFAULT_PORT = 5672;
  public static final int DEFAULT_PREFETCH = 100;
  public static final Duration DEFAULT_HEARTBEAT = Duration.ofSeconds(600);
  public static final Duration DEFAULT_CONNECTION_TIMEOUT = Duration.ofSeconds(30);
  public static final Duration DEFAULT_BLOCKED_TIMEOUT = Duration.ofSeconds(300);
  public static final Duration DEFAULT_CONFIRM_TIMEOUT = Duration.ofSeconds(30);

  public AmqpSettings {
    host = Net.validateHost("rabbitHost", host);
    Numbers.requireRange("rabbitPort", port, 1, 65_535);
    username = Strings.requireNonBlank("rabbitUsername", username);
    Objects.requireNonNull(password, "rabbitPassword");
    virtualHost = Strings.requireNonBlank("rabbitVhost", virtualHost);
    Numbers.requireRange("prefetch", prefetch, 1, 65_535);
    heartbeat = Objects.requireNonNullElse(heartbeat, DEFAULT_HEARTBEAT);
    connectionTimeout = Objects.requireNonNullElse(connectionTimeout, DEFAULT_CONNECTION_TIMEOUT);
    blockedTimeout = Objects.requireNonNullElse(blockedTimeout, DEFAULT_BLOCKED_TIMEOUT);
    confirmTimeout = Objects.requireNonNullElse(confirmTimeout, DEFAULT_CONFIRM_TIMEOUT);
  }

  /**
   * Settings with default timeouts.
   *
   * @param host broker host
   * @param port AMQP port
   * @param username login user
   * @param password login password
   * @param virtualHost virtual host
   * @param prefetch per-subscription prefetch
   * @param publisherConfirms whether to wait for confirms
   * @return settings
   */
  public static AmqpSettings of(
      String host,
      int port,
      String username,
      String password,
      String virtualHost,
      int prefetch,
      boolean publisherConfirms) {
    return new AmqpSettings(
        host, port, username, password, virtualHost, prefetch, publisherConfirms, null, null, null, null);
  }

  /**
   * Endpoint label for logs.
   *
   * @return e.g. {@code rabbitmq[user@rabbitmq:5672/]}
   */
  public String describe() {
    return "rabbitmq[" + username + '@' + host + ':' + port + virtualHost + ']';
  }

  @Override
  public String toString() {
    return "AmqpSettings{" + describe()
        + ", password=" + Logs.redact(password)
        + ", prefetch=" + prefetch
        + ", publisherConfirms=" + publisherConfirms + '}';
  }
}
