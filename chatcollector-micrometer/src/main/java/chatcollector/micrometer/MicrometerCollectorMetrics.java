package chatcollector.micrometer;

import chatcollector.spi.CollectorMetrics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link CollectorMetrics}.
 *
 * <p>Registers counters and a gauge with a {@link MeterRegistry} for export to
 * Prometheus, Grafana, Datadog, and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code chatcollector.collector.started}: collectors started</li>
 *   <li>{@code chatcollector.collector.collected}: items accepted</li>
 *   <li>{@code chatcollector.collector.disposed}: accepted items removed by delete events</li>
 *   <li>{@code chatcollector.collector.ended}: collectors ended, tagged {@code reason}</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code chatcollector.collector.active}: collectors currently running</li>
 * </ul>
 *
 * @see CollectorMetrics
 */
public final class MicrometerCollectorMetrics implements CollectorMetrics, AutoCloseable {

  private final MeterRegistry registry;
  private final String namePrefix;
  private final Counter started;
  private final Counter collected;
  private final Counter disposed;
  private final Gauge activeGauge;
  private final Map<String, Counter> endedByReason = new ConcurrentHashMap<>();

  private final AtomicInteger active = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates metrics with the default name prefix {@code "chatcollector"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerCollectorMetrics(MeterRegistry registry) {
    this(registry, "chatcollector");
  }

  /**
   * Creates metrics with a custom name prefix, for several clients in one registry.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "support.bot"})
   */
  public MicrometerCollectorMetrics(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.namePrefix = namePrefix;
    this.started = Counter.builder(namePrefix + ".collector.started")
        .description("Collectors started")
        .register(registry);
    this.collected = Counter.builder(namePrefix + ".collector.collected")
        .description("Items accepted by collectors")
        .register(registry);
    this.disposed = Counter.builder(namePrefix + ".collector.disposed")
        .description("Accepted items removed by delete events")
        .register(registry);
    this.activeGauge = Gauge.builder(namePrefix + ".collector.active", active, AtomicInteger::get)
        .description("Collectors currently running")
        .register(registry);
  }

  @Override
  public void incrementStarted() {
    if (closed) return;
    started.increment();
    active.incrementAndGet();
  }

  @Override
  public void incrementCollected() {
    if (closed) return;
    collected.increment();
  }

  @Override
  public void incrementDisposed() {
    if (closed) return;
    disposed.increment();
  }

  @Override
  public void incrementEnded(String reason) {
    if (closed) return;
    endedByReason.computeIfAbsent(reason, r -> Counter.builder(namePrefix + ".collector.ended")
        .description("Collectors ended")
        .tag("reason", r)
        .register(registry)).increment();
    active.decrementAndGet();
  }

  /**
   * Removes all meters registered by this instance from the registry.
   *
   * <p>Call this when the metrics are no longer needed (e.g. when the
   * {@link chatcollector.GatewayClient} is closed) to prevent stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>(List.of(started, collected, disposed, activeGauge));
    meters.addAll(endedByReason.values());
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
