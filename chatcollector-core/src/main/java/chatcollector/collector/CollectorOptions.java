package chatcollector.collector;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * Immutable configuration captured when a collector is created.
 *
 * <p>Every limit is optional. A collector configured with none of {@code time},
 * {@code idle}, {@code max} or {@code maxProcessed} runs until it is stopped explicitly
 * or its container is deleted.
 *
 * <pre>{@code
 * CollectorOptions<Message> options = CollectorOptions.<Message>builder()
 *     .filter(message -> !message.content().isBlank())
 *     .max(10)
 *     .time(Duration.ofMinutes(1))
 *     .build();
 * }</pre>
 *
 * @param <V> the item type the filter tests
 */
public final class CollectorOptions<V> {
  private static final CollectorOptions<Object> UNBOUNDED = new Builder<>().build();

  private final Duration time;
  private final Duration idle;
  private final int max;
  private final int maxProcessed;
  private final Predicate<? super V> filter;
  private final boolean dispose;

  private CollectorOptions(Builder<V> builder) {
    if (builder.time != null && (builder.time.isNegative() || builder.time.isZero())) {
      throw new IllegalArgumentException("time must be > 0");
    }
    if (builder.idle != null && (builder.idle.isNegative() || builder.idle.isZero())) {
      throw new IllegalArgumentException("idle must be > 0");
    }
    if (builder.max != null && builder.max <= 0) {
      throw new IllegalArgumentException("max must be > 0");
    }
    if (builder.maxProcessed != null && builder.maxProcessed <= 0) {
      throw new IllegalArgumentException("maxProcessed must be > 0");
    }
    this.time = builder.time;
    this.idle = builder.idle;
    this.max = builder.max != null ? builder.max : 0;
    this.maxProcessed = builder.maxProcessed != null ? builder.maxProcessed : 0;
    this.filter = builder.filter != null ? builder.filter : item -> true;
    this.dispose = builder.dispose;
  }

  public static <V> Builder<V> builder() {
    return new Builder<>();
  }

  /**
   * Options with no limits, no filter and disposal enabled.
   *
   * @param <V> the item type
   * @return the shared unbounded options
   */
  @SuppressWarnings("unchecked")
  public static <V> CollectorOptions<V> unbounded() {
    return (CollectorOptions<V>) UNBOUNDED;
  }

  /** @return the absolute collection window, or null if unbounded */
  public Duration time() {
    return time;
  }

  /** @return the inactivity window, or null if unbounded */
  public Duration idle() {
    return idle;
  }

  /** @return the accepted-item limit, or 0 if unbounded */
  public int max() {
    return max;
  }

  /** @return the processed-item limit, or 0 if unbounded */
  public int maxProcessed() {
    return maxProcessed;
  }

  public Predicate<? super V> filter() {
    return filter;
  }

  /** @return whether delete events remove already accepted items */
  public boolean dispose() {
    return dispose;
  }

  /**
   * Returns a builder pre-populated with these options.
   *
   * @return a new builder
   */
  public Builder<V> toBuilder() {
    Builder<V> builder = new Builder<>();
    builder.time = time;
    builder.idle = idle;
    builder.max = max > 0 ? max : null;
    builder.maxProcessed = maxProcessed > 0 ? maxProcessed : null;
    builder.filter = filter;
    builder.dispose = dispose;
    return builder;
  }

  @Override
  public String toString() {
    return "CollectorOptions{time=" + time + ", idle=" + idle + ", max=" + max
        + ", maxProcessed=" + maxProcessed + ", dispose=" + dispose + '}';
  }

  /** Builder for {@link CollectorOptions}. */
  public static final class Builder<V> {
    private Duration time;
    private Duration idle;
    private Integer max;
    private Integer maxProcessed;
    private Predicate<? super V> filter;
    private boolean dispose = true;

    private Builder() {}

    /**
     * Stops the collector with reason {@code "time"} once this much time has passed.
     *
     * <p>Optional. Must be &gt; 0 when set.
     *
     * @param time the collection window, or null for none
     * @return this builder
     */
    public Builder<V> time(Duration time) {
      this.time = time;
      return this;
    }

    /**
     * Stops the collector with reason {@code "idle"} when no item has been accepted for
     * this long. The window restarts on every accepted item.
     *
     * <p>Optional. Must be &gt; 0 when set.
     *
     * @param idle the inactivity window, or null for none
     * @return this builder
     */
    public Builder<V> idle(Duration idle) {
      this.idle = idle;
      return this;
    }

    /**
     * Stops the collector with reason {@code "limit"} once this many items are held.
     *
     * <p>Optional. Must be &gt; 0 when set.
     *
     * @param max the accepted-item limit
     * @return this builder
     */
    public Builder<V> max(int max) {
      this.max = max;
      return this;
    }

    /**
     * Stops the collector with reason {@code "processedLimit"} once exactly this many
     * relevant items were processed, whether or not the filter accepted them.
     *
     * <p>Optional. Must be &gt; 0 when set.
     *
     * @param maxProcessed the processed-item limit
     * @return this builder
     */
    public Builder<V> maxProcessed(int maxProcessed) {
      this.maxProcessed = maxProcessed;
      return this;
    }

    /**
     * Only items this predicate accepts are collected. Rejected items still count as
     * processed.
     *
     * <p>Optional. Defaults to accepting everything.
     *
     * @param filter the predicate
     * @return this builder
     */
    public Builder<V> filter(Predicate<? super V> filter) {
      this.filter = filter;
      return this;
    }

    /**
     * Whether delete events remove items that were already collected.
     *
     * <p>Optional. Defaults to {@code true}.
     *
     * @param dispose true to honour delete events
     * @return this builder
     */
    public Builder<V> dispose(boolean dispose) {
      this.dispose = dispose;
      return this;
    }

    /**
     * Builds the options.
     *
     * @return the immutable options
     * @throws IllegalArgumentException if a limit that was set is not strictly positive
     */
    public CollectorOptions<V> build() {
      return new CollectorOptions<>(this);
    }
  }
}
