package chatcollector.event;

/**
 * Listener for a single {@link GatewayEvent}.
 *
 * <p>Handlers are invoked synchronously on the emitting thread and must not block.
 * Handlers are removed by identity: keep a reference to the handler instance that
 * was passed to {@link EventSource#on} in order to pass the same instance to
 * {@link EventSource#off}.
 *
 * @param <T> the payload type
 */
@FunctionalInterface
public interface EventHandler<T> {

  /**
   * Handles one occurrence of the event.
   *
   * @param payload the event payload
   */
  void handle(T payload);
}
