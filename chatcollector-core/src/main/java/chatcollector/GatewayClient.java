package chatcollector;

import chatcollector.collector.CollectorEndedException;
import chatcollector.collector.CollectorOptions;
import chatcollector.collector.EndReasons;
import chatcollector.event.DefaultEventSource;
import chatcollector.event.EventSource;
import chatcollector.message.MessageCollector;
import chatcollector.model.Channel;
import chatcollector.model.Message;
import chatcollector.spi.CollectorMetrics;
import chatcollector.spi.TimerScheduler;
import chatcollector.timer.ExecutorTimerScheduler;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composite entry point that owns the {@link EventSource}, the {@link TimerScheduler}
 * and the {@link CollectorMetrics} shared by every collector created through it.
 *
 * <p>The gateway layer emits parsed events into {@link #events()}; application code
 * creates collectors against channels.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (GatewayClient client = GatewayClient.builder().build()) {
 *   gateway.onDispatch(client.events());
 *
 *   client.awaitMessages(channel,
 *           CollectorOptions.<Message>builder().max(1).time(Duration.ofSeconds(15)).build(),
 *           Set.of(EndReasons.TIME))
 *       .thenAccept(replies -> respond(replies.values()));
 * }
 * }</pre>
 *
 * @see MessageCollector
 */
public final class GatewayClient implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(GatewayClient.class.getName());

  private final EventSource events;
  private final TimerScheduler timers;
  private final boolean ownsTimers;
  private final CollectorMetrics metrics;
  private final CollectorOptions<Message> defaultOptions;

  private GatewayClient(Builder builder) {
    this.events = builder.eventSource != null ? builder.eventSource : new DefaultEventSource();
    this.ownsTimers = builder.timerScheduler == null;
    this.timers = ownsTimers ? new ExecutorTimerScheduler() : builder.timerScheduler;
    this.metrics = builder.metrics != null ? builder.metrics : CollectorMetrics.NOOP;
    this.defaultOptions = builder.defaultOptions != null
        ? builder.defaultOptions : CollectorOptions.unbounded();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the event source collectors subscribe to.
   *
   * @return the event source
   */
  public EventSource events() {
    return events;
  }

  public CollectorOptions<Message> defaultOptions() {
    return defaultOptions;
  }

  /**
   * Starts collecting messages from {@code channel} with the client's default options.
   *
   * @param channel the channel
   * @return the running collector
   */
  public MessageCollector createMessageCollector(Channel channel) {
    return createMessageCollector(channel, defaultOptions);
  }

  /**
   * Starts collecting messages from {@code channel}.
   *
   * @param channel the channel
   * @param options collection options
   * @return the running collector
   */
  public MessageCollector createMessageCollector(Channel channel, CollectorOptions<Message> options) {
    return new MessageCollector(events, channel, options, timers, metrics);
  }

  /**
   * Collects messages from {@code channel} and resolves with them once collection ends.
   *
   * <p>If the end reason is one of {@code errorReasons}, the future fails with a
   * {@link CollectorEndedException} carrying the reason and the messages collected so far.
   * Typical use is {@code Set.of(EndReasons.TIME)} together with {@code max}, so that a
   * timeout is an error while reaching the limit is success. Cancelling the returned
   * future stops the collector with reason {@value EndReasons#CANCELLED}.
   *
   * @param channel      the channel
   * @param options      collection options
   * @param errorReasons end reasons that fail the future
   * @return the collected messages keyed by id, in arrival order
   */
  public CompletableFuture<Map<String, Message>> awaitMessages(Channel channel,
      CollectorOptions<Message> options, Set<String> errorReasons) {
    Objects.requireNonNull(errorReasons, "errorReasons");
    Set<String> errors = Set.copyOf(errorReasons);
    MessageCollector collector = createMessageCollector(channel, options);
    CompletableFuture<Map<String, Message>> messages = collector.completion().thenApply(result -> {
      if (errors.contains(result.reason())) {
        throw new CollectorEndedException(result.reason(), result.collected());
      }
      return result.collected();
    });
    messages.whenComplete((value, error) -> {
      if (error instanceof CancellationException) {
        collector.stop(EndReasons.CANCELLED);
      }
    });
    return messages;
  }

  /**
   * Collects messages until collection ends for any reason.
   *
   * @param channel the channel
   * @param options collection options
   * @return the collected messages keyed by id, in arrival order
   */
  public CompletableFuture<Map<String, Message>> awaitMessages(Channel channel,
      CollectorOptions<Message> options) {
    return awaitMessages(channel, options, Set.of());
  }

  /**
   * Shuts down the timer scheduler if this client created it, then closes the metrics
   * sink if it is {@link AutoCloseable}. Collectors still running will no longer end
   * by time or idle.
   */
  @Override
  public void close() {
    RuntimeException first = null;
    if (ownsTimers && timers instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        first = (e instanceof RuntimeException r) ? r : new IllegalStateException(e);
      }
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new IllegalStateException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
    logger.log(Level.FINE, "GatewayClient closed");
  }

  /** Builder for {@link GatewayClient}. */
  public static final class Builder {
    private EventSource eventSource;
    private TimerScheduler timerScheduler;
    private CollectorMetrics metrics;
    private CollectorOptions<Message> defaultOptions;

    private Builder() {}

    /**
     * Sets the event source. Optional; defaults to a new {@link DefaultEventSource}.
     *
     * @param eventSource the event source
     * @return this builder
     */
    public Builder eventSource(EventSource eventSource) {
      this.eventSource = eventSource;
      return this;
    }

    /**
     * Sets the timer scheduler. Optional; defaults to an {@link ExecutorTimerScheduler}
     * owned and closed by the client. A scheduler passed here is not closed by the client.
     *
     * @param timerScheduler the scheduler
     * @return this builder
     */
    public Builder timerScheduler(TimerScheduler timerScheduler) {
      this.timerScheduler = timerScheduler;
      return this;
    }

    /**
     * Sets the metrics sink. Optional; defaults to {@link CollectorMetrics#NOOP}.
     *
     * @param metrics the metrics sink
     * @return this builder
     */
    public Builder metrics(CollectorMetrics metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the options used by {@link GatewayClient#createMessageCollector(Channel)}.
     * Optional; defaults to {@link CollectorOptions#unbounded()}.
     *
     * @param defaultOptions the default options
     * @return this builder
     */
    public Builder defaultOptions(CollectorOptions<Message> defaultOptions) {
      this.defaultOptions = defaultOptions;
      return this;
    }

    public GatewayClient build() {
      return new GatewayClient(this);
    }
  }
}
