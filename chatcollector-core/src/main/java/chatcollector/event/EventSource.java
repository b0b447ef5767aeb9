package chatcollector.event;

/**
 * Publish/subscribe bus on which gateway events are delivered.
 *
 * <p>Any number of independent handlers may subscribe to the same event. The source
 * is a shared resource: components that subscribe must unsubscribe exactly the
 * handlers they registered once they are done. The listener counts exist so that
 * callers and tests can verify that nothing leaked.
 *
 * @see DefaultEventSource
 */
public interface EventSource {

  /**
   * Subscribes a handler. Registering the same handler twice delivers each event twice.
   *
   * @param event   the event key
   * @param handler the handler
   * @param <T>     the payload type
   */
  <T> void on(GatewayEvent<T> event, EventHandler<? super T> handler);

  /**
   * Removes one registration of the given handler.
   *
   * @param event   the event key
   * @param handler the handler instance previously passed to {@link #on}
   * @param <T>     the payload type
   * @return {@code true} if a registration was removed
   */
  <T> boolean off(GatewayEvent<T> event, EventHandler<? super T> handler);

  /**
   * Delivers a payload to every handler currently subscribed to {@code event},
   * in registration order, on the calling thread.
   *
   * @param event   the event key
   * @param payload the payload
   * @param <T>     the payload type
   */
  <T> void emit(GatewayEvent<T> event, T payload);

  /**
   * Returns the number of handlers registered for one event.
   *
   * @param event the event key
   * @return the registration count
   */
  int listenerCount(GatewayEvent<?> event);

  /**
   * Returns the number of handlers registered across all events.
   *
   * @return the total registration count
   */
  int listenerCount();
}
