package ca.gc.cra.bridge.domain.route;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.bridge.domain.message.Destination;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class MappingTableTest {
  private static final List<ReplicationMapping> SHARED = List.of(
      ReplicationMapping.exchangeRoute("orders", "events", "orders.created", "orders.q"),
      ReplicationMapping.queueRoute("returns.q", "returns"));

  @Test
  void k2rRoutesByTopicToExchange() {
    MappingTable table = MappingTable.forDirection(Direction.K2R, SHARED);

    Route route = table.resolve("orders").orElseThrow();
    assertEquals(Destination.exchange("events", "orders.created"), route.destination());
    assertEquals(List.of("orders", "returns"), table.sourceIds());
  }

  @Test
  void r2kRoutesByQueueToTopic() {
    MappingTable table = MappingTable.forDirection(Direction.R2K, SHARED);

    assertEquals(Destination.topic("orders"), table.resolve("orders.q").orElseThrow().destination());
    assertEquals(Destination.topic("returns"), table.resolve("returns.q").orElseThrow().destination());
    assertTrue(table.resolve("orders").isEmpty());
  }

  @Test
  void k2rWithoutExchangePublishesToQueueThroughDefaultExchange() {
    MappingTable table = MappingTable.forDirection(
        Direction.K2R, List.of(ReplicationMapping.exchangeRoute("audit", null, null, "audit.q")));

    Destination destination = table.resolve("audit").orElseThrow().destination();
    assertTrue(destination.isDefaultExchange());
    assertEquals("audit.q", destination.routingKey());
  }

  @Test
  void logToLogDirectionsSwapSourceAndTarget() {
    List<ReplicationMapping> mappings = List.of(ReplicationMapping.topicRoute("orders", "orders-replica"));

    MappingTable forward = MappingTable.forDirection(Direction.S2T, mappings);
    MappingTable back = MappingTable.forDirection(Direction.T2S, mappings);

    assertEquals(Destination.topic("orders-replica"), forward.resolve("orders").orElseThrow().destination());
    assertEquals(Destination.topic("orders"), back.resolve("orders-replica").orElseThrow().destination());
  }

  @Test
  void routingKeysMayUseAnyAmqpCharacters() {
    MappingTable table = MappingTable.forDirection(
        Direction.K2R, List.of(ReplicationMapping.exchangeRoute("orders", "events", "orders+created", null)));

    assertEquals(Destination.exchange("events", "orders+created"), table.resolve("orders").orElseThrow().destination());
  }

  @Test
  void duplicateSourceIsRejected() {
    List<ReplicationMapping> mappings = List.of(
        ReplicationMapping.exchangeRoute("orders", "events", "a", null),
        ReplicationMapping.exchangeRoute("orders", "events", "b", null));

    IllegalArgumentException ex = assertThrows(
        IllegalArgumentException.class, () -> MappingTable.forDirection(Direction.K2R, mappings));
    assertTrue(ex.getMessage().contains("duplicate source 'orders'"));
  }

  @Test
  void missingDestinationIsRejected() {
    ReplicationMapping noTopic = new ReplicationMapping(
        Optional.empty(), Optional.empty(), Optional.empty(), null, Optional.of("orders.q"), Optional.empty());

    assertThrows(IllegalArgumentException.class, () -> MappingTable.forDirection(Direction.R2K, List.of(noTopic)));
  }

  @Test
  void emptyResultIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> MappingTable.forDirection(Direction.T2S, SHARED));
  }

  @Test
  void invalidTopicNameIsRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> MappingTable.forDirection(Direction.K2R, List.of(ReplicationMapping.exchangeRoute("or ders", "e", "k", null))));
  }

  @Test
  void unknownExchangeTypeIsRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new ReplicationMapping(
            Optional.of("orders"), Optional.empty(), Optional.of("events"), "broadcast", Optional.empty(), Optional.empty()));
  }
}
