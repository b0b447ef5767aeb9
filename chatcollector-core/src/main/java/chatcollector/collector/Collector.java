package chatcollector.collector;

import chatcollector.spi.CollectorMetrics;
import chatcollector.spi.TimerScheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Generic bounded collector: accumulates the items a {@link CollectorPolicy} deems
 * relevant until one of several independent end conditions holds, then freezes its
 * state and completes exactly once.
 *
 * <h2>Pipeline</h2>
 * <p>{@link #handleCollect(Object)} runs each raw item through
 * {@code policy.collect} (irrelevant items are dropped without touching any counter),
 * increments {@link #received()}, applies the options' filter, stores accepted items,
 * notifies listeners and finally asks the policy for an end reason.
 * {@link #handleDispose(Object)} removes an accepted item again without ever lowering
 * {@code received} or ending the collector.
 *
 * <h2>Termination</h2>
 * <p>The collector ends on the first of: the policy's end reason, the {@code time}
 * window, the {@code idle} window, an explicit {@link #stop(String)}, or cancellation
 * of {@link #completion()}. Ending cancels the timers, notifies {@code onEnd} listeners
 * (where specializations unsubscribe from their event source), fails pending
 * {@link #next()} futures and then completes {@link #completion()}. Items or timers
 * arriving afterwards are ignored.
 *
 * <h2>Thread Safety</h2>
 * <p>All state transitions synchronize on the collector, so events delivered from the
 * gateway thread and timers firing on the scheduler thread are processed one at a
 * time, each pipeline running to completion. The lock is re-entrant: listeners may
 * call back into the collector, including {@link #stop(String)}. Listeners and future
 * dependents registered with non-async stages run while the lock is held.
 *
 * @param <K> the item identity type
 * @param <V> the item type
 * @see CollectorPolicy
 * @see chatcollector.message.MessageCollector
 */
public final class Collector<K, V> {
  private static final Logger logger = Logger.getLogger(Collector.class.getName());

  private final CollectorPolicy<K, V> policy;
  private final CollectorOptions<V> options;
  private final TimerScheduler timers;
  private final CollectorMetrics metrics;

  private final Map<K, V> collected = new LinkedHashMap<>();
  private final List<CollectorListener<K, V>> listeners = new CopyOnWriteArrayList<>();
  private final List<CompletableFuture<V>> pendingNext = new ArrayList<>();
  private final CompletableFuture<CollectionResult<K, V>> completion = new CompletableFuture<>();

  private int received;
  private boolean ended;
  private boolean startReported;
  private CollectionResult<K, V> result;

  private Duration timeWindow;
  private Duration idleWindow;
  private TimerScheduler.Timer timeTimer;
  private TimerScheduler.Timer idleTimer;
  // bumped on every re-arm so a timer that already fired but lost the race is ignored
  private long timeGeneration;
  private long idleGeneration;

  /**
   * Creates a running collector and arms its timers.
   *
   * @param policy  the domain-specific collect/dispose/end-reason callbacks
   * @param options validated options
   * @param timers  scheduler for the {@code time} and {@code idle} windows
   * @param metrics metrics sink, {@link CollectorMetrics#NOOP} to disable
   */
  public Collector(CollectorPolicy<K, V> policy, CollectorOptions<V> options,
      TimerScheduler timers, CollectorMetrics metrics) {
    this.policy = Objects.requireNonNull(policy, "policy");
    this.options = Objects.requireNonNull(options, "options");
    this.timers = Objects.requireNonNull(timers, "timers");
    this.metrics = metrics != null ? metrics : CollectorMetrics.NOOP;

    completion.whenComplete((value, error) -> {
      if (error instanceof CancellationException) {
        stop(EndReasons.CANCELLED);
      }
    });

    synchronized (this) {
      this.timeWindow = options.time();
      this.idleWindow = options.idle();
      try {
        if (timeWindow != null) {
          armTimeTimer();
        }
        if (idleWindow != null) {
          armIdleTimer();
        }
      } catch (RuntimeException e) {
        cancelTimers();
        throw e;
      }
      // a timer may already have ended the collector while being armed
      startReported = true;
      this.metrics.incrementStarted();
      if (ended) {
        this.metrics.incrementEnded(result.reason());
      }
    }
    logger.log(Level.FINE, "Collector started with {0}", options);
  }

  /**
   * Offers a raw item to the collector. No-op once the collector has ended.
   *
   * @param item the candidate item
   */
  public synchronized void handleCollect(V item) {
    if (ended) {
      return;
    }
    K key = policy.collect(item);
    if (key == null) {
      return;
    }
    received++;
    if (accepts(item)) {
      collected.put(key, item);
      metrics.incrementCollected();
      if (idleWindow != null) {
        armIdleTimer();
      }
      for (CollectorListener<K, V> listener : listeners) {
        if (ended) {
          break;
        }
        try {
          listener.onCollect(key, item);
        } catch (RuntimeException e) {
          logger.log(Level.WARNING, "Collector listener onCollect failed", e);
        }
      }
      resolveNext(item);
    }
    checkEnd();
  }

  private boolean accepts(V item) {
    try {
      return options.filter().test(item);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Collector filter failed; item rejected", e);
      return false;
    }
  }

  private void resolveNext(V item) {
    if (pendingNext.isEmpty()) {
      return;
    }
    List<CompletableFuture<V>> waiting = new ArrayList<>(pendingNext);
    pendingNext.clear();
    for (CompletableFuture<V> future : waiting) {
      future.complete(item);
    }
  }

  /**
   * Offers a removed item to the collector. Removes the matching accepted item if there
   * is one. Never lowers {@link #received()} and never ends the collector. No-op once
   * the collector has ended or when disposal is disabled in the options.
   *
   * @param item the removal payload
   */
  public synchronized void handleDispose(V item) {
    if (ended || !options.dispose()) {
      return;
    }
    K key = policy.dispose(item);
    if (key == null || !collected.containsKey(key)) {
      return;
    }
    collected.remove(key);
    metrics.incrementDisposed();
    for (CollectorListener<K, V> listener : listeners) {
      if (ended) {
        break;
      }
      try {
        listener.onDispose(key, item);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Collector listener onDispose failed", e);
      }
    }
  }

  /**
   * Asks the policy whether collection is complete and stops with its reason if so.
   *
   * @return true if this call ended the collector
   */
  public synchronized boolean checkEnd() {
    if (ended) {
      return false;
    }
    String reason = policy.endReason(this);
    return reason != null && stop(reason);
  }

  /**
   * Stops the collector with reason {@value EndReasons#USER}.
   *
   * @return true if this call ended the collector
   */
  public boolean stop() {
    return stop(EndReasons.USER);
  }

  /**
   * Ends the collector. Only the first call has an effect; later calls return false
   * and leave the recorded reason unchanged.
   *
   * @param reason the terminal reason
   * @return true if this call ended the collector
   */
  public synchronized boolean stop(String reason) {
    Objects.requireNonNull(reason, "reason");
    if (ended) {
      return false;
    }
    ended = true;
    cancelTimers();
    result = new CollectionResult<>(collected, reason);
    if (startReported) {
      metrics.incrementEnded(reason);
    }
    logger.log(Level.FINE, "Collector ended: reason={0}, collected={1}, received={2}",
        new Object[]{reason, collected.size(), received});

    for (CollectorListener<K, V> listener : listeners) {
      notifyEnd(listener);
    }
    List<CompletableFuture<V>> waiting = new ArrayList<>(pendingNext);
    pendingNext.clear();
    for (CompletableFuture<V> future : waiting) {
      future.completeExceptionally(new CollectorEndedException(reason, result.collected()));
    }
    completion.complete(result);
    return true;
  }

  private void notifyEnd(CollectorListener<K, V> listener) {
    try {
      listener.onEnd(result);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Collector listener onEnd failed", e);
    }
  }

  /**
   * Replaces the running timers. A null argument re-arms that timer with its current
   * window, or leaves it off if it has none. The new idle window also applies to the
   * re-arm after each subsequently accepted item, and a new time window to later
   * argument-less resets. No-op once ended.
   *
   * @param time new absolute window, or null
   * @param idle new inactivity window, or null
   * @throws IllegalArgumentException if a given duration is not strictly positive
   */
  public synchronized void resetTimer(Duration time, Duration idle) {
    requirePositive(time, "time");
    requirePositive(idle, "idle");
    if (ended) {
      return;
    }
    if (time != null) {
      timeWindow = time;
    }
    if (timeWindow != null) {
      armTimeTimer();
    }
    if (idle != null) {
      idleWindow = idle;
    }
    if (idleWindow != null) {
      armIdleTimer();
    }
  }

  /** Re-arms both timers with their current windows. */
  public void resetTimer() {
    resetTimer(null, null);
  }

  private static void requirePositive(Duration duration, String name) {
    if (duration != null && (duration.isNegative() || duration.isZero())) {
      throw new IllegalArgumentException(name + " must be > 0");
    }
  }

  private void armTimeTimer() {
    if (timeTimer != null) {
      timeTimer.cancel();
    }
    long generation = ++timeGeneration;
    timeTimer = timers.schedule(() -> onTimeout(generation), timeWindow);
  }

  private void armIdleTimer() {
    if (idleTimer != null) {
      idleTimer.cancel();
    }
    long generation = ++idleGeneration;
    idleTimer = timers.schedule(() -> onIdle(generation), idleWindow);
  }

  private synchronized void onTimeout(long generation) {
    if (generation == timeGeneration) {
      stop(EndReasons.TIME);
    }
  }

  private synchronized void onIdle(long generation) {
    if (generation == idleGeneration) {
      stop(EndReasons.IDLE);
    }
  }

  private void cancelTimers() {
    timeGeneration++;
    idleGeneration++;
    if (timeTimer != null) {
      timeTimer.cancel();
      timeTimer = null;
    }
    if (idleTimer != null) {
      idleTimer.cancel();
      idleTimer = null;
    }
  }

  /**
   * Returns a future for the next accepted item. Fails with
   * {@link CollectorEndedException} if the collector ends first, or immediately if it
   * has already ended.
   *
   * @return the next item
   */
  public synchronized CompletableFuture<V> next() {
    CompletableFuture<V> future = new CompletableFuture<>();
    if (ended) {
      future.completeExceptionally(new CollectorEndedException(result.reason(), result.collected()));
    } else {
      pendingNext.add(future);
    }
    return future;
  }

  /**
   * Completes once, with the accepted items and the end reason, when the collector ends.
   * It never completes exceptionally on its own; cancelling it stops the collector with
   * reason {@value EndReasons#CANCELLED}.
   *
   * @return the completion future
   */
  public CompletableFuture<CollectionResult<K, V>> completion() {
    return completion;
  }

  /**
   * Registers a listener. If the collector already ended, only the listener's
   * {@link CollectorListener#onEnd} is invoked, immediately.
   *
   * @param listener the listener
   */
  public synchronized void addListener(CollectorListener<K, V> listener) {
    Objects.requireNonNull(listener, "listener");
    if (ended) {
      notifyEnd(listener);
      return;
    }
    listeners.add(listener);
  }

  public boolean removeListener(CollectorListener<K, V> listener) {
    return listeners.remove(listener);
  }

  /**
   * Runs {@code action} when the collector ends, or immediately if it already has.
   *
   * @param action the end action
   */
  public void onEnd(Consumer<CollectionResult<K, V>> action) {
    Objects.requireNonNull(action, "action");
    addListener(new CollectorListener<>() {
      @Override
      public void onEnd(CollectionResult<K, V> result) {
        action.accept(result);
      }
    });
  }

  /**
   * Snapshot of the accepted items in insertion order.
   *
   * @return unmodifiable copy
   */
  public synchronized Map<K, V> collected() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(collected));
  }

  /** @return the number of items currently held */
  public synchronized int size() {
    return collected.size();
  }

  /** @return relevant items processed so far, accepted or not */
  public synchronized int received() {
    return received;
  }

  public synchronized boolean isEnded() {
    return ended;
  }

  /** @return the terminal reason, or null while still running */
  public synchronized String endReason() {
    return result != null ? result.reason() : null;
  }

  public CollectorOptions<V> options() {
    return options;
  }
}
