package ca.gc.cra.bridge.adapter.amqp;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import ca.gc.cra.bridge.application.port.ConnectionState;
import ca.gc.cra.bridge.application.port.DeliveryException;
import ca.gc.cra.bridge.domain.message.Destination;
import ca.gc.cra.bridge.domain.message.HeaderNames;
import ca.gc.cra.bridge.domain.message.OutboundMessage;
import ca.gc.cra.bridge.domain.route.ReplicationMapping;
import ca.gc.cra.bridge.infrastructure.exec.RetryPolicy;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class AmqpDestinationAdapterTest {
  private static final RetryPolicy NO_WAIT = new RetryPolicy(1, Duration.ZERO, duration -> { });
  private static final List<ReplicationMapping> MAPPINGS =
      List.of(ReplicationMapping.exchangeRoute("orders", "events", "orders.created", "orders.q"));

  private ConnectionFactory factory;
  private Connection connection;
  private Channel channel;

  @BeforeEach
  void setUp() throws Exception {
    factory = mock(ConnectionFactory.class);
    connection = mock(Connection.class);
    channel = mock(Channel.class);
    when(factory.newConnection(anyString())).thenReturn(connection);
    when(connection.createChannel()).thenReturn(channel);
    when(connection.isOpen()).thenReturn(true);
    when(channel.isOpen()).thenReturn(true);
  }

  @Test
  void connectProvisionsTopologyAndEnablesConfirms() throws Exception {
    AmqpDestinationAdapter adapter = adapter(true);

    adapter.connect();

    assertEquals(ConnectionState.CONNECTED, adapter.state());
    assertTrue(adapter.topology().clean());
    verify(channel).exchangeDeclare("events", "topic", true);
    verify(channel).queueDeclare("orders.q", true, false, false, null);
    verify(channel).queueBind("orders.q", "events", "orders.created");
    verify(channel).confirmSelect();
  }

  @Test
  void publishesPersistentMandatoryMessageWithBridgeHeaders() throws Exception {
    AmqpDestinationAdapter adapter = adapter(true);
    adapter.connect();
    Map<String, byte[]> headers = new LinkedHashMap<>();
    headers.put(HeaderNames.KAFKA_TOPIC, bytes("orders"));
    headers.put(HeaderNames.KAFKA_PARTITION, bytes("0"));
    headers.put(HeaderNames.KAFKA_OFFSET, bytes("42"));
    headers.put(HeaderNames.REPLICATOR_ID, bytes("orders-0-42"));

    adapter.publish(new OutboundMessage(
        Destination.exchange("events", "orders.created"), null, bytes("{\"id\":1}"), headers, "orders-0-42"));

    ArgumentCaptor<AMQP.BasicProperties> properties = ArgumentCaptor.forClass(AMQP.BasicProperties.class);
    verify(channel).basicPublish(
        eq("events"), eq("orders.created"), eq(true), properties.capture(), eq(bytes("{\"id\":1}")));
    verify(channel).waitForConfirmsOrDie(AmqpSettings.DEFAULT_CONFIRM_TIMEOUT.toMillis());
    AMQP.BasicProperties sent = properties.getValue();
    assertEquals(2, sent.getDeliveryMode());
    assertEquals("orders-0-42", sent.getMessageId());
    assertEquals("orders-0-42", sent.getHeaders().get(HeaderNames.REPLICATOR_ID));
    assertEquals(0, sent.getHeaders().get(HeaderNames.KAFKA_PARTITION));
    assertEquals(42L, sent.getHeaders().get(HeaderNames.KAFKA_OFFSET));
  }

  @Test
  void confirmsAreSkippedWhenDisabled() throws Exception {
    AmqpDestinationAdapter adapter = adapter(false);
    adapter.connect();

    adapter.publish(message());

    verify(channel, never()).confirmSelect();
    verify(channel, never()).waitForConfirmsOrDie(anyLong());
  }

  @Test
  void missingConfirmIsADeliveryFailure() throws Exception {
    AmqpDestinationAdapter adapter = adapter(true);
    adapter.connect();
    doThrow(new TimeoutException("no confirm")).when(channel).waitForConfirmsOrDie(anyLong());

    DeliveryException ex = assertThrows(DeliveryException.class, () -> adapter.publish(message()));

    assertTrue(ex.getMessage().contains("did not confirm"));
  }

  @Test
  void publishFailureOnClosedChannelMarksAdapterFailed() throws Exception {
    AmqpDestinationAdapter adapter = adapter(true);
    adapter.connect();
    doThrow(new IOException("channel closed"))
        .when(channel).basicPublish(anyString(), anyString(), anyBoolean(), any(AMQP.BasicProperties.class), any());
    when(channel.isOpen()).thenReturn(false);

    assertThrows(DeliveryException.class, () -> adapter.publish(message()));
    assertEquals(ConnectionState.FAILED, adapter.state());
  }

  @Test
  void failedDeclarationIsReportedWithoutStoppingTheRest() throws Exception {
    when(channel.exchangeDeclare("events", "topic", true)).thenThrow(new IOException("access refused"));
    AmqpDestinationAdapter adapter = adapter(true);

    adapter.connect();

    assertFalse(adapter.topology().clean());
    assertEquals(1, adapter.topology().failures().size());
    verify(channel).queueDeclare("orders.q", true, false, false, null);
  }

  @Test
  void closedConnectionFailsProbe() throws Exception {
    AmqpDestinationAdapter adapter = adapter(true);
    adapter.connect();
    assertTrue(adapter.probe());

    when(connection.isOpen()).thenReturn(false);

    assertFalse(adapter.probe());
    assertEquals(ConnectionState.FAILED, adapter.state());
  }

  @Test
  void rejectsTopicDestinations() throws Exception {
    AmqpDestinationAdapter adapter = adapter(true);
    adapter.connect();

    assertThrows(DeliveryException.class, () -> adapter.publish(
        new OutboundMessage(Destination.topic("orders"), null, bytes("x"), Map.of(), "id")));
  }

  private AmqpDestinationAdapter adapter(boolean confirms) {
    AmqpSettings settings = AmqpSettings.of("rabbitmq", 5672, "guest", "guest", "/", 100, confirms);
    return new AmqpDestinationAdapter(new AmqpConnector(settings, factory, () -> 0L), MAPPINGS, NO_WAIT);
  }

  private static OutboundMessage message() {
    return new OutboundMessage(Destination.exchange("events", "orders.created"), null, bytes("x"), Map.of(), "id-1");
  }

  private static byte[] bytes(String text) {
    return text.getBytes(StandardCharsets.UTF_8);
  }
}
