package ca.gc.cra.bridge.adapter.amqp;

import ca.gc.cra.bridge.domain.message.HeaderNames;
import ca.gc.cra.bridge.domain.message.PayloadText;
import com.rabbitmq.client.LongString;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Converts between the bridge's byte-valued headers and AMQP field tables.
 *
 * <p>Text headers travel as AMQP strings and the Kafka partition and offset as numbers, so that
 * RabbitMQ consumers can read provenance without decoding bytes. Values that are not UTF-8 stay
 * byte arrays.</p>
 */
final class AmqpHeaders {
  private AmqpHeaders() {}

  static Map<String, Object> toAmqp(Map<String, byte[]> headers) {
    Map<String, Object> table = new LinkedHashMap<>();
    headers.forEach((name, value) -> {
      Optional<String> text = PayloadText.decode(value);
      if (text.isEmpty()) {
        table.put(name, value);
      } else if (HeaderNames.KAFKA_PARTITION.equals(name)) {
        table.put(name, parseNumber(text.get(), true));
      } else if (HeaderNames.KAFKA_OFFSET.equals(name)) {
        table.put(name, parseNumber(text.get(), false));
      } else {
        table.put(name, text.get());
      }
    });
    return table;
  }

  static Map<String, byte[]> fromAmqp(Map<String, Object> table) {
    if (table == null || table.isEmpty()) {
      return Map.of();
    }
    Map<String, byte[]> headers = new LinkedHashMap<>();
    table.forEach((name, value) -> {
      if (value instanceof LongString longString) {
        headers.put(name, longString.getBytes());
      } else if (value instanceof byte[] bytes) {
        headers.put(name, bytes);
      } else if (value != null) {
        headers.put(name, PayloadText.encode(String.valueOf(value)));
      }
    });
    return headers;
  }

  private static Object parseNumber(String text, boolean asInt) {
    try {
      return asInt ? (Object) Integer.valueOf(text) : (Object) Long.valueOf(text);
    } catch (NumberFormatException ex) {
      return text;
    }
  }
}
