package ca.gc.cra.bridge.adapter.amqp;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import ca.gc.cra.bridge.application.port.ConnectionException;
import ca.gc.cra.bridge.application.port.ConnectionState;
import ca.gc.cra.bridge.application.port.DeliveryException;
import ca.gc.cra.bridge.domain.message.InFlightMessage;
import ca.gc.cra.bridge.domain.message.QueueOrigin;
import ca.gc.cra.bridge.infrastructure.exec.RetryPolicy;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.Consumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.impl.LongStringHelper;
import java.io.IOException;
import java.net.ConnectException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AmqpSourceAdapterTest {
  private static final RetryPolicy NO_WAIT = new RetryPolicy(2, Duration.ZERO, duration -> { });

  private ConnectionFactory factory;
  private Connection connection;
  private Channel channel;
  private final List<Consumer> consumers = new ArrayList<>();

  @BeforeEach
  void setUp() throws Exception {
    factory = mock(ConnectionFactory.class);
    connection = mock(Connection.class);
    channel = mock(Channel.class);
    when(factory.newConnection(anyString())).thenReturn(connection);
    when(connection.createChannel()).thenReturn(channel);
    when(connection.isOpen()).thenReturn(true);
    when(channel.isOpen()).thenReturn(true);
    when(channel.basicConsume(anyString(), eq(false), any(Consumer.class))).thenAnswer(invocation -> {
      consumers.add(invocation.getArgument(2));
      return "ctag-" + consumers.size();
    });
  }

  @Test
  void subscribesEachQueueWithManualAckAndPrefetch() throws Exception {
    AmqpSourceAdapter adapter = adapter(List.of("orders.q", "audit.q"));

    adapter.connect();

    assertEquals(ConnectionState.CONNECTED, adapter.state());
    assertEquals(2, consumers.size());
    verify(channel).queueDeclare("orders.q", true, false, false, null);
    verify(channel).queueDeclare("audit.q", true, false, false, null);
    verify(channel, times(2)).basicQos(25);
    assertFalse(adapter.coordinatesSurviveReconnect());
  }

  @Test
  void deliveriesArePolledWithQueueOriginAndHeaders() throws Exception {
    AmqpSourceAdapter adapter = adapter(List.of("orders.q"));
    adapter.connect();
    AMQP.BasicProperties properties = new AMQP.BasicProperties.Builder()
        .headers(Map.of("kafka_key", LongStringHelper.asLongString("customer-7"), "attempt", 2))
        .build();

    consumers.get(0).handleDelivery(
        "ctag-1", new Envelope(7L, true, "events", "orders.created"), properties, bytes("{\"id\":1}"));
    List<InFlightMessage> batch = adapter.poll(Duration.ofMillis(50));

    assertEquals(1, batch.size());
    InFlightMessage message = batch.get(0);
    assertEquals(new QueueOrigin("orders.q", 7L, "events", "orders.created", true, "ctag-1"), message.origin());
    assertArrayEquals(bytes("{\"id\":1}"), message.payload());
    assertArrayEquals(bytes("customer-7"), message.header("kafka_key").orElseThrow());
    assertArrayEquals(bytes("2"), message.header("attempt").orElseThrow());
    assertEquals(0, adapter.pending());
  }

  @Test
  void emptyPollReturnsNothing() throws Exception {
    AmqpSourceAdapter adapter = adapter(List.of("orders.q"));
    adapter.connect();

    assertTrue(adapter.poll(Duration.ofMillis(5)).isEmpty());
  }

  @Test
  void acknowledgeAndRejectUseTheReceivingChannel() throws Exception {
    AmqpSourceAdapter adapter = adapter(List.of("orders.q"));
    adapter.connect();
    consumers.get(0).handleDelivery("ctag-1", new Envelope(3L, false, "", "orders.q"), null, bytes("a"));
    consumers.get(0).handleDelivery("ctag-1", new Envelope(4L, false, "", "orders.q"), null, bytes("b"));
    List<InFlightMessage> batch = adapter.poll(Duration.ofMillis(50));

    adapter.acknowledge(batch.get(0));
    adapter.reject(batch.get(1), true);

    verify(channel).basicAck(3L, false);
    verify(channel).basicNack(4L, false, true);
  }

  @Test
  void failedAckMarksSourceFailed() throws Exception {
    AmqpSourceAdapter adapter = adapter(List.of("orders.q"));
    adapter.connect();
    consumers.get(0).handleDelivery("ctag-1", new Envelope(3L, false, "", "orders.q"), null, bytes("a"));
    InFlightMessage message = adapter.poll(Duration.ofMillis(50)).get(0);
    doThrow(new IOException("channel closed")).when(channel).basicAck(3L, false);

    assertThrows(DeliveryException.class, () -> adapter.acknowledge(message));
    assertEquals(ConnectionState.FAILED, adapter.state());
  }

  @Test
  void brokerCancellationFailsProbe() throws Exception {
    AmqpSourceAdapter adapter = adapter(List.of("orders.q"));
    adapter.connect();

    consumers.get(0).handleCancel("ctag-1");

    assertFalse(adapter.probe());
  }

  @Test
  void reconnectDiscardsUnacknowledgedDeliveries() throws Exception {
    AmqpSourceAdapter adapter = adapter(List.of("orders.q"));
    adapter.connect();
    consumers.get(0).handleDelivery("ctag-1", new Envelope(1L, false, "", "orders.q"), null, bytes("a"));
    assertEquals(1, adapter.pending());

    adapter.reconnect();

    assertEquals(0, adapter.pending());
    assertEquals(2, consumers.size());
    verify(connection).close(5_000);
  }

  @Test
  void backlogReportsReadyMessagesPerQueue() throws Exception {
    when(channel.messageCount("orders.q")).thenReturn(12L);
    AmqpSourceAdapter adapter = adapter(List.of("orders.q"));
    adapter.connect();

    assertEquals(Map.of("orders.q", 12L), adapter.backlog());
  }

  @Test
  void unreachableBrokerFailsAfterRetries() throws Exception {
    when(factory.newConnection(anyString())).thenThrow(new ConnectException("refused"));
    AmqpSourceAdapter adapter = adapter(List.of("orders.q"));

    assertThrows(ConnectionException.class, adapter::connect);
    assertEquals(ConnectionState.FAILED, adapter.state());
  }

  @Test
  void unknownConsumerTagFallsBackToRoutingKeyOnDefaultExchange() throws Exception {
    AmqpSourceAdapter adapter = adapter(List.of("orders.q"));

    assertEquals("orders.q", adapter.resolveQueue("other", new Envelope(1L, false, "", "orders.q")));
  }

  private AmqpSourceAdapter adapter(List<String> queues) {
    AmqpSettings settings = AmqpSettings.of("rabbitmq", 5672, "guest", "guest", "/", 25, true);
    return new AmqpSourceAdapter(new AmqpConnector(settings, factory, () -> 0L), queues, NO_WAIT, () -> 1_000L);
  }

  private static byte[] bytes(String text) {
    return text.getBytes(StandardCharsets.UTF_8);
  }
}
