package chatcollector.event;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread-safe in-process {@link EventSource}.
 *
 * <p>Handlers are invoked in registration order. Emission iterates over a snapshot, so
 * a handler may unsubscribe itself (or others) while an event is being delivered; the
 * change takes effect from the next emission. A handler that throws is logged and the
 * remaining handlers still receive the event.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * EventSource events = new DefaultEventSource();
 * EventHandler<Message> handler = message -> index(message);
 * events.on(GatewayEvent.MESSAGE_CREATE, handler);
 * events.emit(GatewayEvent.MESSAGE_CREATE, message);
 * events.off(GatewayEvent.MESSAGE_CREATE, handler);
 * }</pre>
 */
public final class DefaultEventSource implements EventSource {
  private static final Logger logger = Logger.getLogger(DefaultEventSource.class.getName());

  private final Map<GatewayEvent<?>, CopyOnWriteArrayList<EventHandler<?>>> handlers =
      new ConcurrentHashMap<>();

  @Override
  public <T> void on(GatewayEvent<T> event, EventHandler<? super T> handler) {
    Objects.requireNonNull(event, "event");
    Objects.requireNonNull(handler, "handler");
    handlers.computeIfAbsent(event, ignored -> new CopyOnWriteArrayList<>()).add(handler);
  }

  @Override
  public <T> boolean off(GatewayEvent<T> event, EventHandler<? super T> handler) {
    Objects.requireNonNull(event, "event");
    CopyOnWriteArrayList<EventHandler<?>> registered = handlers.get(event);
    if (registered == null || handler == null) {
      return false;
    }
    // identity, not equals(): two lambdas never compare equal anyway
    for (EventHandler<?> candidate : registered) {
      if (candidate == handler) {
        return registered.remove(candidate);
      }
    }
    return false;
  }

  @Override
  @SuppressWarnings("unchecked")
  public <T> void emit(GatewayEvent<T> event, T payload) {
    Objects.requireNonNull(event, "event");
    CopyOnWriteArrayList<EventHandler<?>> registered = handlers.get(event);
    if (registered == null) {
      return;
    }
    for (EventHandler<?> handler : registered) {
      try {
        ((EventHandler<T>) handler).handle(payload);
      } catch (RuntimeException e) {
        logger.log(Level.SEVERE, "Handler for " + event.name() + " failed", e);
      }
    }
  }

  @Override
  public int listenerCount(GatewayEvent<?> event) {
    List<EventHandler<?>> registered = handlers.get(event);
    return registered == null ? 0 : registered.size();
  }

  @Override
  public int listenerCount() {
    int total = 0;
    for (List<EventHandler<?>> registered : handlers.values()) {
      total += registered.size();
    }
    return total;
  }
}
