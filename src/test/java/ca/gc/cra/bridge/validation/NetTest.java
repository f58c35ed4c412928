package ca.gc.cra.bridge.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NetTest {

  @Test
  void validateHostPortHandlesHostname() {
    assertEquals("kafka:9092", Net.validateHostPort("kafka:9092"));
  }

  @Test
  void validateHostPortHandlesIpv6() {
    assertEquals("[2001:db8::1]:9093", Net.validateHostPort("[2001:db8::1]:9093"));
  }

  @Test
  void validateHostPortRejectsMissingPort() {
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort("kafka"));
  }

  @Test
  void bootstrapListIsNormalized() {
    assertEquals(
        "kafka-0:9092,kafka-1:9092",
        Net.validateBootstrapServers("kafkaBootstrap", " kafka-0:9092 , kafka-1:9092 ,"));
  }

  @Test
  void bootstrapListRejectsBadEntry() {
    IllegalArgumentException ex = assertThrows(
        IllegalArgumentException.class,
        () -> Net.validateBootstrapServers("kafkaBootstrap", "kafka-0:9092,kafka-1:99999"));
    assertEquals(true, ex.getMessage().startsWith("kafkaBootstrap"));
  }

  @Test
  void bootstrapListRejectsOnlySeparators() {
    assertThrows(IllegalArgumentException.class, () -> Net.validateBootstrapServers("kafkaBootstrap", ",,"));
  }

  @Test
  void validateHostAcceptsServiceName() {
    assertEquals("rabbitmq", Net.validateHost("rabbitHost", " rabbitmq "));
  }

  @Test
  void parsePortRejectsOutOfRange() {
    assertThrows(IllegalArgumentException.class, () -> Net.parsePort("rabbitPort", "0"));
    assertThrows(IllegalArgumentException.class, () -> Net.parsePort("rabbitPort", "amqp"));
  }
}
