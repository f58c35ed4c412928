package ca.gc.cra.bridge.adapter.amqp;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one topology provisioning pass: what was declared and what failed.
 *
 * <p>Failures are logged and skipped so that one bad declaration does not stop the others.</p>
 *
 * @since 0.1.0
 */
public final class TopologyReport {
  private final List<String> declared = new ArrayList<>();
  private final List<String> failures = new ArrayList<>();

  void declared(String item) {
    declared.add(item);
  }

  void failed(String item, String reason) {
    failures.add(item + ": " + reason);
  }

  public List<String> declared() {
    return List.copyOf(declared);
  }

  public List<String> failures() {
    return List.copyOf(failures);
  }

  public boolean clean() {
    return failures.isEmpty();
  }

  @Override
  public String toString() {
    return "TopologyReport{declared=" + declared.size() + ", failures=" + failures + '}';
  }
}
