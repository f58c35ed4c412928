package ca.gc.cra.bridge.adapter.amqp;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import ca.gc.cra.bridge.domain.route.ReplicationMapping;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import java.io.IOException;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AmqpTopologyTest {
  private Connection connection;
  private Channel channel;

  @BeforeEach
  void setUp() throws Exception {
    connection = mock(Connection.class);
    channel = mock(Channel.class);
    when(connection.createChannel()).thenReturn(channel);
  }

  @Test
  void sharedExchangeIsDeclaredOnce() throws Exception {
    List<ReplicationMapping> mappings = List.of(
        ReplicationMapping.exchangeRoute("orders", "events", "orders.created", "orders.q"),
        ReplicationMapping.exchangeRoute("refunds", "events", "refunds.created", "refunds.q"));

    TopologyReport report = AmqpTopology.declareForPublishing(connection, mappings);

    assertTrue(report.clean());
    assertEquals(5, report.declared().size());
    verify(channel, times(1)).exchangeDeclare("events", "topic", true);
    verify(channel).queueBind("refunds.q", "events", "refunds.created");
    verify(channel, times(5)).close();
  }

  @Test
  void declaresConfiguredExchangeType() throws Exception {
    ReplicationMapping fanout = new ReplicationMapping(
        Optional.of("audit"), Optional.empty(), Optional.of("audit-x"), "fanout",
        Optional.empty(), Optional.empty());

    AmqpTopology.declareForPublishing(connection, List.of(fanout));

    verify(channel).exchangeDeclare("audit-x", "fanout", true);
    verify(channel, never()).queueDeclare(anyString(), anyBoolean(), anyBoolean(), anyBoolean(), any());
  }

  @Test
  void queueFailureSkipsItsBinding() throws Exception {
    when(channel.queueDeclare("orders.q", true, false, false, null)).thenThrow(new IOException("precondition failed"));

    TopologyReport report = AmqpTopology.declareForPublishing(connection,
        List.of(ReplicationMapping.exchangeRoute("orders", "events", "orders.created", "orders.q")));

    assertEquals(List.of("queue orders.q: precondition failed"), report.failures());
    verify(channel, never()).queueBind(anyString(), anyString(), anyString());
  }

  @Test
  void consumingSideDeclaresEachQueueOnce() throws Exception {
    TopologyReport report = AmqpTopology.declareQueues(connection, List.of("orders.q", "orders.q", "audit.q"));

    assertEquals(List.of("queue orders.q", "queue audit.q"), report.declared());
  }
}
