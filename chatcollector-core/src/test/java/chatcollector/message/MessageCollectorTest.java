package chatcollector.message;

import chatcollector.collector.CollectionResult;
import chatcollector.collector.CollectorListener;
import chatcollector.collector.CollectorOptions;
import chatcollector.collector.EndReasons;
import chatcollector.event.DefaultEventSource;
import chatcollector.event.GatewayEvent;
import chatcollector.model.Channel;
import chatcollector.model.Guild;
import chatcollector.model.Message;
import chatcollector.spi.CollectorMetrics;
import chatcollector.timer.ManualTimerScheduler;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class MessageCollectorTest {

  private final DefaultEventSource events = new DefaultEventSource();
  private final ManualTimerScheduler timers = new ManualTimerScheduler();

  private final Channel channel = Channel.inGuild("c1", "g1");
  private final Channel otherChannel = Channel.inGuild("c2", "g1");

  private int sequence;

  private MessageCollector collect(Channel target, CollectorOptions<Message> options) {
    return new MessageCollector(events, target, options, timers, CollectorMetrics.NOOP);
  }

  private MessageCollector collect(CollectorOptions<Message> options) {
    return collect(channel, options);
  }

  private Message message(Channel in) {
    return new Message("m" + (++sequence), in, "u1", "text " + sequence);
  }

  private Message post(Channel in) {
    Message message = message(in);
    events.emit(GatewayEvent.MESSAGE_CREATE, message);
    return message;
  }

  // ── Subscription lifecycle ───────────────────────────────────────

  @Test
  void subscribesFiveHandlers() {
    collect(CollectorOptions.unbounded());

    assertEquals(1, events.listenerCount(GatewayEvent.MESSAGE_CREATE));
    assertEquals(1, events.listenerCount(GatewayEvent.MESSAGE_DELETE));
    assertEquals(1, events.listenerCount(GatewayEvent.MESSAGE_BULK_DELETE));
    assertEquals(1, events.listenerCount(GatewayEvent.CHANNEL_DELETE));
    assertEquals(1, events.listenerCount(GatewayEvent.GUILD_DELETE));
    assertEquals(5, events.listenerCount());
  }

  @ParameterizedTest
  @ValueSource(strings = {"limit", "processedLimit", "time", "idle", "channelDelete", "guildDelete", "user"})
  void removesEveryHandlerWhateverTheReason(String reason) {
    MessageCollector collector = collect(CollectorOptions.<Message>builder()
        .max(2)
        .maxProcessed(3)
        .time(Duration.ofSeconds(60))
        .idle(Duration.ofSeconds(30))
        .filter(m -> !reason.equals("processedLimit") || m.content().isEmpty())
        .build());

    switch (reason) {
      case "limit" -> {
        post(channel);
        post(channel);
      }
      case "processedLimit" -> {
        post(channel);
        post(channel);
        post(channel);
      }
      case "time" -> {
        collector.resetTimer(null, Duration.ofSeconds(120));
        timers.advance(Duration.ofSeconds(60));
      }
      case "idle" -> timers.advance(Duration.ofSeconds(30));
      case "channelDelete" -> events.emit(GatewayEvent.CHANNEL_DELETE, channel);
      case "guildDelete" -> events.emit(GatewayEvent.GUILD_DELETE, Guild.of("g1"));
      default -> collector.stop();
    }

    assertEquals(reason, collector.endReason());
    assertEquals(0, events.listenerCount());
    assertEquals(0, timers.pending());
  }

  @Test
  void manyShortLivedCollectorsLeaveNoHandlersBehind() {
    for (int i = 0; i < 50; i++) {
      collect(CollectorOptions.<Message>builder().max(1).build());
    }
    assertEquals(250, events.listenerCount());

    post(channel);

    assertEquals(0, events.listenerCount());
  }

  @Test
  void stoppingTwiceUnsubscribesOnce() {
    MessageCollector unrelated = collect(otherChannel, CollectorOptions.unbounded());
    MessageCollector collector = collect(CollectorOptions.unbounded());

    collector.stop("a");
    collector.stop("b");

    assertEquals("a", collector.endReason());
    assertEquals(5, events.listenerCount());
    assertFalse(unrelated.isEnded());
  }

  @Test
  void timerFiringDuringConstructionStillUnsubscribes() {
    MessageCollector collector = new MessageCollector(events, channel,
        CollectorOptions.<Message>builder().time(Duration.ofMillis(1)).build(),
        (task, delay) -> {
          task.run();
          return () -> {};
        },
        CollectorMetrics.NOOP);

    assertEquals(EndReasons.TIME, collector.endReason());
    assertEquals(0, events.listenerCount());
  }

  // ── Channel scoping ──────────────────────────────────────────────

  @Test
  void ignoresMessagesFromOtherChannels() {
    MessageCollector collector = collect(CollectorOptions.unbounded());

    post(otherChannel);
    post(Channel.direct("dm"));

    assertEquals(0, collector.received());
    assertTrue(collector.collected().isEmpty());
  }

  @Test
  void collectsMessagesFromTargetChannelByIdInArrivalOrder() {
    MessageCollector collector = collect(CollectorOptions.unbounded());

    Message first = post(channel);
    post(otherChannel);
    Message second = post(channel);

    assertEquals(List.of(first.id(), second.id()), new ArrayList<>(collector.collected().keySet()));
    assertSame(second, collector.collected().get(second.id()));
    assertEquals(2, collector.received());
  }

  @Test
  void receivedGrowsTwiceAsFastAsCollectedWithAlternatingFilter() {
    AtomicInteger n = new AtomicInteger();
    MessageCollector collector = collect(CollectorOptions.<Message>builder()
        .filter(m -> n.getAndIncrement() % 2 == 0)
        .build());

    for (int i = 0; i < 10; i++) {
      post(channel);
    }

    assertEquals(10, collector.received());
    assertEquals(5, collector.collected().size());
  }

  // ── Limits ───────────────────────────────────────────────────────

  @Test
  void endsWithLimitWhenMaxReached() {
    MessageCollector collector = collect(CollectorOptions.<Message>builder().max(3).build());

    post(channel);
    post(channel);
    assertFalse(collector.isEnded());
    post(channel);

    CollectionResult<String, Message> result = collector.completion().join();
    assertEquals(EndReasons.LIMIT, result.reason());
    assertEquals(3, result.size());
  }

  @Test
  void endsWithProcessedLimitCountingRejectedMessages() {
    MessageCollector collector = collect(CollectorOptions.<Message>builder()
        .maxProcessed(3)
        .filter(m -> false)
        .build());

    post(channel);
    post(otherChannel);
    post(channel);
    assertFalse(collector.isEnded());
    post(channel);

    assertEquals(EndReasons.PROCESSED_LIMIT, collector.endReason());
    assertTrue(collector.collected().isEmpty());
  }

  @Test
  void limitTakesPrecedenceOverProcessedLimit() {
    MessageCollector collector = collect(CollectorOptions.<Message>builder()
        .max(2)
        .maxProcessed(2)
        .build());

    post(channel);
    post(channel);

    assertEquals(EndReasons.LIMIT, collector.endReason());
  }

  @Test
  void processedLimitReachedOnExactCount() {
    MessageCollector collector = collect(CollectorOptions.<Message>builder()
        .maxProcessed(2)
        .build());

    assertNull(collector.endReason(collector.collector()));
    post(channel);
    assertNull(collector.endReason(collector.collector()));
    post(channel);

    assertEquals(EndReasons.PROCESSED_LIMIT, collector.endReason());
    assertEquals(EndReasons.PROCESSED_LIMIT, collector.endReason(collector.collector()));
  }

  @Test
  void disposalBelowMaxDoesNotEndCollector() {
    MessageCollector collector = collect(CollectorOptions.<Message>builder().max(2).build());
    Message first = post(channel);

    events.emit(GatewayEvent.MESSAGE_DELETE, first);
    post(channel);

    assertFalse(collector.isEnded());
    assertEquals(1, collector.collected().size());
    assertEquals(2, collector.received());
  }

  @Test
  void unlimitedCollectorKeepsRunning() {
    MessageCollector collector = collect(CollectorOptions.unbounded());

    for (int i = 0; i < 100; i++) {
      post(channel);
    }
    timers.advance(Duration.ofDays(1));

    assertFalse(collector.isEnded());
    assertFalse(collector.completion().isDone());
  }

  // ── Disposal ─────────────────────────────────────────────────────

  @Test
  void deleteRemovesCollectedMessageAndKeepsReceived() {
    MessageCollector collector = collect(CollectorOptions.unbounded());
    Message first = post(channel);
    Message second = post(channel);

    events.emit(GatewayEvent.MESSAGE_DELETE, first);

    assertEquals(Set.of(second.id()), collector.collected().keySet());
    assertEquals(2, collector.received());
    assertFalse(collector.isEnded());
    assertNull(collector.endReason());
  }

  @Test
  void deleteFromOtherChannelIsIgnored() {
    MessageCollector collector = collect(CollectorOptions.unbounded());
    Message mine = post(channel);

    // same id, different channel
    events.emit(GatewayEvent.MESSAGE_DELETE, new Message(mine.id(), otherChannel, "u1", ""));

    assertEquals(1, collector.collected().size());
  }

  @Test
  void bulkDeleteOfFiveWithThreeInChannelRemovesThree() {
    MessageCollector collector = collect(CollectorOptions.unbounded());
    Message a = post(channel);
    Message b = post(channel);
    Message c = post(channel);
    Message d = message(otherChannel);
    Message e = message(otherChannel);
    MessageCollector other = collect(otherChannel, CollectorOptions.<Message>builder()
        .dispose(false)
        .build());
    events.emit(GatewayEvent.MESSAGE_CREATE, d);
    events.emit(GatewayEvent.MESSAGE_CREATE, e);

    events.emit(GatewayEvent.MESSAGE_BULK_DELETE, List.of(a, d, b, e, c));

    assertTrue(collector.collected().isEmpty());
    assertEquals(3, collector.received());
    assertEquals(Set.of(d.id(), e.id()), other.collected().keySet());
  }

  // ── Cascading termination ────────────────────────────────────────

  @Test
  void channelDeletionStopsCollector() {
    MessageCollector collector = collect(CollectorOptions.unbounded());
    post(channel);

    events.emit(GatewayEvent.CHANNEL_DELETE, otherChannel);
    assertFalse(collector.isEnded());
    events.emit(GatewayEvent.CHANNEL_DELETE, channel);

    CollectionResult<String, Message> result = collector.completion().join();
    assertEquals(EndReasons.CHANNEL_DELETE, result.reason());
    assertEquals(1, result.size());
  }

  @Test
  void guildDeletionStopsOnlyCollectorsInThatGuild() {
    MessageCollector inGuild = collect(CollectorOptions.unbounded());
    MessageCollector elsewhere = collect(Channel.inGuild("c9", "g2"), CollectorOptions.unbounded());

    events.emit(GatewayEvent.GUILD_DELETE, Guild.of("g2"));

    assertFalse(inGuild.isEnded());
    assertEquals(EndReasons.GUILD_DELETE, elsewhere.endReason());

    events.emit(GatewayEvent.GUILD_DELETE, new Guild("g1", "Guild One"));
    assertEquals(EndReasons.GUILD_DELETE, inGuild.endReason());
  }

  @Test
  void guildDeletionNeverStopsDirectMessageCollector() {
    MessageCollector dm = collect(Channel.direct("dm1"), CollectorOptions.unbounded());

    events.emit(GatewayEvent.GUILD_DELETE, Guild.of("g1"));
    events.emit(GatewayEvent.GUILD_DELETE, Guild.of("dm1"));

    assertFalse(dm.isEnded());
  }

  // ── Timers & next ────────────────────────────────────────────────

  @Test
  void timeWindowEndsCollectionWithPartialResult() {
    MessageCollector collector = collect(CollectorOptions.<Message>builder()
        .max(10)
        .time(Duration.ofSeconds(15))
        .build());
    post(channel);
    post(channel);

    timers.advance(Duration.ofSeconds(15));
    post(channel);

    CollectionResult<String, Message> result = collector.completion().join();
    assertEquals(EndReasons.TIME, result.reason());
    assertEquals(2, result.size());
  }

  @Test
  void nextResolvesWithNextMessageInChannel() {
    MessageCollector collector = collect(CollectorOptions.unbounded());
    var next = collector.next();

    post(otherChannel);
    Message mine = post(channel);

    assertSame(mine, next.join());
  }

  @Test
  void collectListenerSeesAcceptedMessages() {
    List<String> seen = new ArrayList<>();
    MessageCollector collector = collect(CollectorOptions.unbounded());
    collector.addListener(new CollectorListener<>() {
      @Override
      public void onCollect(String key, Message item) {
        seen.add(key);
      }
    });

    Message m = post(channel);
    post(otherChannel);

    assertEquals(List.of(m.id()), seen);
    assertSame(channel, collector.channel());
  }
}
