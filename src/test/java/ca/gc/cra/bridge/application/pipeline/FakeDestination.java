package ca.gc.cra.bridge.application.pipeline;

import ca.gc.cra.bridge.application.port.ConnectionException;
import ca.gc.cra.bridge.application.port.ConnectionState;
import ca.gc.cra.bridge.application.port.DeliveryException;
import ca.gc.cra.bridge.application.port.MessageDestination;
import ca.gc.cra.bridge.domain.message.OutboundMessage;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Destination double that records publishes and can fail a configured number of times.
 */
final class FakeDestination implements MessageDestination {
  final List<OutboundMessage> published = new ArrayList<>();

  ConnectionState state = ConnectionState.DISCONNECTED;
  ConnectionException connectFailure;
  int failuresRemaining;
  boolean failuresAreFatal;
  int attempts;
  int reconnects;
  boolean flushed;
  boolean closed;

  @Override
  public void connect() throws ConnectionException {
    if (connectFailure != null) {
      state = ConnectionState.FAILED;
      throw connectFailure;
    }
    state = ConnectionState.CONNECTED;
  }

  @Override
  public ConnectionState state() {
    return state;
  }

  @Override
  public boolean probe() {
    return state == ConnectionState.CONNECTED;
  }

  @Override
  public void reconnect() throws ConnectionException {
    reconnects++;
    connect();
  }

  @Override
  public String describe() {
    return "fake-destination";
  }

  @Override
  public void publish(OutboundMessage message) throws DeliveryException {
    attempts++;
    if (failuresRemaining > 0) {
      failuresRemaining--;
      if (failuresAreFatal) {
        state = ConnectionState.FAILED;
      }
      throw new DeliveryException("broker unavailable");
    }
    published.add(message);
  }

  @Override
  public void flush(Duration timeout) {
    flushed = true;
  }

  @Override
  public void close() {
    closed = true;
    state = ConnectionState.DISCONNECTED;
  }
}
