package chatcollector.event;

import chatcollector.model.Channel;
import chatcollector.model.Guild;
import chatcollector.model.Message;

import java.util.Collection;
import java.util.Objects;

/**
 * Typed key for an event emitted on an {@link EventSource}.
 *
 * <p>The type parameter is the payload type handlers receive. Keys are compared by
 * {@link #name()}, so two keys created with the same name address the same listeners.
 *
 * <pre>{@code
 * events.on(GatewayEvent.MESSAGE_CREATE, message -> log(message.content()));
 * events.emit(GatewayEvent.MESSAGE_CREATE, message);
 * }</pre>
 *
 * @param <T> the payload type
 */
public final class GatewayEvent<T> {

  /** A message was posted. */
  public static final GatewayEvent<Message> MESSAGE_CREATE = of("messageCreate");

  /** A single message was deleted. */
  public static final GatewayEvent<Message> MESSAGE_DELETE = of("messageDelete");

  /** Several messages were deleted atomically. */
  public static final GatewayEvent<Collection<Message>> MESSAGE_BULK_DELETE = of("messageDeleteBulk");

  /** A channel was deleted. */
  public static final GatewayEvent<Channel> CHANNEL_DELETE = of("channelDelete");

  /** A guild was deleted or became unavailable to this client. */
  public static final GatewayEvent<Guild> GUILD_DELETE = of("guildDelete");

  private final String name;

  private GatewayEvent(String name) {
    this.name = name;
  }

  /**
   * Creates an event key with the given name.
   *
   * @param name the event name
   * @param <T>  the payload type
   * @return a new key
   * @throws IllegalArgumentException if {@code name} is empty
   */
  public static <T> GatewayEvent<T> of(String name) {
    Objects.requireNonNull(name, "name");
    if (name.isEmpty()) {
      throw new IllegalArgumentException("name must not be empty");
    }
    return new GatewayEvent<>(name);
  }

  public String name() {
    return name;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof GatewayEvent<?> other)) return false;
    return name.equals(other.name);
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public String toString() {
    return name;
  }
}
