package ca.gc.cra.bridge.adapter.amqp;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.bridge.domain.message.HeaderNames;
import com.rabbitmq.client.impl.LongStringHelper;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AmqpHeadersTest {

  @Test
  void provenanceNumbersTravelAsNumbers() {
    Map<String, byte[]> headers = new LinkedHashMap<>();
    headers.put(HeaderNames.KAFKA_TOPIC, bytes("orders"));
    headers.put(HeaderNames.KAFKA_PARTITION, bytes("3"));
    headers.put(HeaderNames.KAFKA_OFFSET, bytes("9000000000"));

    Map<String, Object> table = AmqpHeaders.toAmqp(headers);

    assertEquals("orders", table.get(HeaderNames.KAFKA_TOPIC));
    assertEquals(3, table.get(HeaderNames.KAFKA_PARTITION));
    assertEquals(9_000_000_000L, table.get(HeaderNames.KAFKA_OFFSET));
  }

  @Test
  void nonTextValuesStayBinary() {
    byte[] binary = {(byte) 0xC3, (byte) 0x28};

    Map<String, Object> table = AmqpHeaders.toAmqp(Map.of("blob", binary));

    assertTrue(table.get("blob") instanceof byte[]);
    assertArrayEquals(binary, (byte[]) table.get("blob"));
  }

  @Test
  void amqpValuesBecomeBytes() {
    Map<String, Object> table = new LinkedHashMap<>();
    table.put("text", LongStringHelper.asLongString("hello"));
    table.put("count", 5);
    table.put("raw", new byte[] {1, 2});
    table.put("missing", null);

    Map<String, byte[]> headers = AmqpHeaders.fromAmqp(table);

    assertEquals(3, headers.size());
    assertArrayEquals(bytes("hello"), headers.get("text"));
    assertArrayEquals(bytes("5"), headers.get("count"));
    assertArrayEquals(new byte[] {1, 2}, headers.get("raw"));
  }

  @Test
  void absentTableYieldsNoHeaders() {
    assertTrue(AmqpHeaders.fromAmqp(null).isEmpty());
  }

  private static byte[] bytes(String text) {
    return text.getBytes(StandardCharsets.UTF_8);
  }
}
