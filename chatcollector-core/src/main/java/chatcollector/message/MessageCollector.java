package chatcollector.message;

import chatcollector.collector.CollectionResult;
import chatcollector.collector.Collector;
import chatcollector.collector.CollectorListener;
import chatcollector.collector.CollectorOptions;
import chatcollector.collector.CollectorPolicy;
import chatcollector.collector.EndReasons;
import chatcollector.event.EventHandler;
import chatcollector.event.EventSource;
import chatcollector.event.GatewayEvent;
import chatcollector.model.Channel;
import chatcollector.model.Guild;
import chatcollector.model.Message;
import chatcollector.spi.CollectorMetrics;
import chatcollector.spi.TimerScheduler;

import java.time.Duration;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Collects the messages posted in one channel.
 *
 * <p>On construction the collector subscribes five handlers to the event source:
 * <ul>
 *   <li>{@link GatewayEvent#MESSAGE_CREATE}: offered for collection</li>
 *   <li>{@link GatewayEvent#MESSAGE_DELETE}: offered for disposal</li>
 *   <li>{@link GatewayEvent#MESSAGE_BULK_DELETE}: each message offered for disposal</li>
 *   <li>{@link GatewayEvent#CHANNEL_DELETE}: stops with {@value EndReasons#CHANNEL_DELETE}
 *       when the target channel is deleted</li>
 *   <li>{@link GatewayEvent#GUILD_DELETE}: stops with {@value EndReasons#GUILD_DELETE}
 *       when the target channel's guild is deleted</li>
 * </ul>
 * All five are removed exactly once, when the collector ends, whatever the reason.
 *
 * <p>Besides the options' {@code time} and {@code idle} windows, the collector ends with
 * {@value EndReasons#LIMIT} once {@code max} messages are held, or with
 * {@value EndReasons#PROCESSED_LIMIT} once exactly {@code maxProcessed} messages from the
 * channel were seen; the former is checked first.
 *
 * <pre>{@code
 * MessageCollector collector = client.createMessageCollector(channel,
 *     CollectorOptions.<Message>builder().max(3).time(Duration.ofSeconds(30)).build());
 * collector.completion().thenAccept(result ->
 *     log.info(result.size() + " messages, ended by " + result.reason()));
 * }</pre>
 *
 * @see chatcollector.GatewayClient#createMessageCollector(Channel, CollectorOptions)
 */
public final class MessageCollector implements CollectorPolicy<String, Message> {

  private final EventSource events;
  private final Channel channel;
  private final Collector<String, Message> collector;
  private final AtomicBoolean subscribed = new AtomicBoolean();

  private final EventHandler<Message> createHandler;
  private final EventHandler<Message> deleteHandler;
  private final EventHandler<Collection<Message>> bulkDeleteHandler;
  private final EventHandler<Channel> channelDeleteHandler;
  private final EventHandler<Guild> guildDeleteHandler;

  /**
   * Creates a running collector subscribed to {@code events}.
   *
   * @param events  the event source to subscribe to
   * @param channel the channel to collect from
   * @param options collection options
   * @param timers  scheduler for the {@code time} and {@code idle} windows
   * @param metrics metrics sink, may be null
   */
  public MessageCollector(EventSource events, Channel channel, CollectorOptions<Message> options,
      TimerScheduler timers, CollectorMetrics metrics) {
    this.events = Objects.requireNonNull(events, "events");
    this.channel = Objects.requireNonNull(channel, "channel");
    this.collector = new Collector<>(this, options, timers, metrics);

    this.createHandler = collector::handleCollect;
    this.deleteHandler = collector::handleDispose;
    this.bulkDeleteHandler = this::handleBulkDelete;
    this.channelDeleteHandler = this::handleChannelDeletion;
    this.guildDeleteHandler = this::handleGuildDeletion;

    subscribe();
    // runs immediately if a timer already ended the collector
    collector.onEnd(result -> unsubscribe());
  }

  private void subscribe() {
    subscribed.set(true);
    events.on(GatewayEvent.MESSAGE_CREATE, createHandler);
    events.on(GatewayEvent.MESSAGE_DELETE, deleteHandler);
    events.on(GatewayEvent.MESSAGE_BULK_DELETE, bulkDeleteHandler);
    events.on(GatewayEvent.CHANNEL_DELETE, channelDeleteHandler);
    events.on(GatewayEvent.GUILD_DELETE, guildDeleteHandler);
  }

  private void unsubscribe() {
    if (!subscribed.compareAndSet(true, false)) {
      return;
    }
    events.off(GatewayEvent.MESSAGE_CREATE, createHandler);
    events.off(GatewayEvent.MESSAGE_DELETE, deleteHandler);
    events.off(GatewayEvent.MESSAGE_BULK_DELETE, bulkDeleteHandler);
    events.off(GatewayEvent.CHANNEL_DELETE, channelDeleteHandler);
    events.off(GatewayEvent.GUILD_DELETE, guildDeleteHandler);
  }

  private void handleBulkDelete(Collection<Message> messages) {
    for (Message message : messages) {
      collector.handleDispose(message);
    }
  }

  private void handleChannelDeletion(Channel deleted) {
    if (deleted.id().equals(channel.id())) {
      collector.stop(EndReasons.CHANNEL_DELETE);
    }
  }

  private void handleGuildDeletion(Guild guild) {
    if (channel.belongsTo(guild)) {
      collector.stop(EndReasons.GUILD_DELETE);
    }
  }

  @Override
  public String collect(Message message) {
    return inChannel(message) ? message.id() : null;
  }

  @Override
  public String dispose(Message message) {
    return inChannel(message) ? message.id() : null;
  }

  private boolean inChannel(Message message) {
    return message != null && channel.id().equals(message.channelId());
  }

  @Override
  public String endReason(Collector<String, Message> collector) {
    CollectorOptions<Message> options = collector.options();
    if (options.max() > 0 && collector.size() >= options.max()) {
      return EndReasons.LIMIT;
    }
    // exact match, see DESIGN.md
    if (options.maxProcessed() > 0 && collector.received() == options.maxProcessed()) {
      return EndReasons.PROCESSED_LIMIT;
    }
    return null;
  }

  public Channel channel() {
    return channel;
  }

  /** @return the underlying engine */
  public Collector<String, Message> collector() {
    return collector;
  }

  /** @return accepted messages keyed by message id, in arrival order */
  public Map<String, Message> collected() {
    return collector.collected();
  }

  /** @return messages from the channel processed so far, accepted or not */
  public int received() {
    return collector.received();
  }

  public boolean isEnded() {
    return collector.isEnded();
  }

  public String endReason() {
    return collector.endReason();
  }

  public boolean stop() {
    return collector.stop();
  }

  public boolean stop(String reason) {
    return collector.stop(reason);
  }

  public void resetTimer(Duration time, Duration idle) {
    collector.resetTimer(time, idle);
  }

  public CompletableFuture<Message> next() {
    return collector.next();
  }

  public CompletableFuture<CollectionResult<String, Message>> completion() {
    return collector.completion();
  }

  public void addListener(CollectorListener<String, Message> listener) {
    collector.addListener(listener);
  }
}
