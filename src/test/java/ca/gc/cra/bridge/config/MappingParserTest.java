package ca.gc.cra.bridge.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.bridge.domain.route.ReplicationMapping;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class MappingParserTest {
  private final MappingParser parser = new MappingParser();

  @Test
  void parsesReplicationMappings() {
    List<ReplicationMapping> mappings = parser.parseMappings("""
        [
          {"kafkaTopic": "orders", "rabbitmqExchange": "events", "rabbitmqExchangeType": "DIRECT",
           "rabbitmqQueue": "orders.q", "rabbitmqRoutingKey": "orders.created"},
          {"kafkaTopic": "audit", "rabbitmqQueue": "audit.q"}
        ]
        """);

    assertEquals(2, mappings.size());
    ReplicationMapping first = mappings.get(0);
    assertEquals(Optional.of("orders"), first.kafkaTopic());
    assertEquals(Optional.of("events"), first.rabbitmqExchange());
    assertEquals("direct", first.rabbitmqExchangeType());
    assertEquals(Optional.of("orders.q"), first.rabbitmqQueue());
    assertEquals(Optional.of("orders.created"), first.rabbitmqRoutingKey());
    ReplicationMapping second = mappings.get(1);
    assertEquals("topic", second.rabbitmqExchangeType());
    assertEquals(Optional.empty(), second.rabbitmqExchange());
  }

  @Test
  void blankFieldsAreTreatedAsAbsent() {
    ReplicationMapping mapping = parser.parseMappings(
        "[{\"kafkaTopic\":\"orders\",\"rabbitmqExchange\":\"\",\"rabbitmqQueue\":\"orders.q\"}]").get(0);

    assertEquals(Optional.empty(), mapping.rabbitmqExchange());
  }

  @Test
  void rejectsNonArrayDocument() {
    assertThrows(IllegalArgumentException.class, () -> parser.parseMappings("{\"kafkaTopic\":\"orders\"}"));
  }

  @Test
  void rejectsNonStringField() {
    assertThrows(IllegalArgumentException.class, () -> parser.parseMappings("[{\"kafkaTopic\":42}]"));
  }

  @Test
  void rejectsMalformedJson() {
    assertThrows(IllegalArgumentException.class, () -> parser.parseMappings("[{\"kafkaTopic\":"));
  }

  @Test
  void parsesTopicMappingInOrder() {
    List<ReplicationMapping> mappings = parser.parseTopicMapping("{\"orders\":\"orders-replica\",\"audit\":\"audit-dr\"}");

    assertEquals(List.of(
        ReplicationMapping.topicRoute("orders", "orders-replica"),
        ReplicationMapping.topicRoute("audit", "audit-dr")), mappings);
  }

  @Test
  void topicMappingMustBeNonEmptyObject() {
    assertThrows(IllegalArgumentException.class, () -> parser.parseTopicMapping("{}"));
    assertThrows(IllegalArgumentException.class, () -> parser.parseTopicMapping("[\"orders\"]"));
    assertThrows(IllegalArgumentException.class, () -> parser.parseTopicMapping("{\"orders\":1}"));
    assertThrows(IllegalArgumentException.class, () -> parser.parseTopicMapping(" "));
  }
}
