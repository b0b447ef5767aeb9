package chatcollector.collector;

import java.util.Map;

/**
 * Signals that a collector ended before producing what was awaited: a pending
 * {@link Collector#next()} call, or an {@code awaitMessages} call whose end reason was
 * declared an error.
 *
 * <p>The end reason and the items accepted up to that point are available to the handler.
 */
public class CollectorEndedException extends RuntimeException {
  private final String reason;
  private final transient Map<?, ?> collected;

  public CollectorEndedException(String reason) {
    this(reason, Map.of());
  }

  public CollectorEndedException(String reason, Map<?, ?> collected) {
    super("Collector ended: " + reason);
    this.reason = reason;
    this.collected = collected;
  }

  public String reason() {
    return reason;
  }

  public Map<?, ?> collected() {
    return collected;
  }
}
