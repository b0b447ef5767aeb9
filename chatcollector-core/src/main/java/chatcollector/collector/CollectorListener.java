package chatcollector.collector;

/**
 * Observer of a {@link Collector}'s notifications. All methods default to no-ops.
 *
 * <p>Notifications are delivered synchronously on the thread that drove the collector,
 * with the collector's lock held. A listener may call back into the collector, including
 * {@link Collector#stop(String)}. Exceptions thrown by a listener are logged and do not
 * affect the collector or other listeners.
 *
 * @param <K> the item identity type
 * @param <V> the item type
 */
public interface CollectorListener<K, V> {

  /**
   * An item was accepted.
   *
   * @param key  the item identity
   * @param item the item
   */
  default void onCollect(K key, V item) {
  }

  /**
   * A previously accepted item was removed.
   *
   * @param key  the item identity
   * @param item the removal payload
   */
  default void onDispose(K key, V item) {
  }

  /**
   * The collector ended. Called exactly once per listener.
   *
   * @param result the final accepted items and the reason
   */
  default void onEnd(CollectionResult<K, V> result) {
  }
}
