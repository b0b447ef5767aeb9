package chatcollector.collector;

/**
 * The domain-specific half of a collector: decides which items are relevant and when
 * the collection is complete. The generic bookkeeping lives in {@link Collector}.
 *
 * <p>All three callbacks are invoked while the collector's lock is held and must not
 * block.
 *
 * @param <K> the item identity type
 * @param <V> the item type
 * @see chatcollector.message.MessageCollector
 */
public interface CollectorPolicy<K, V> {

  /**
   * Maps an incoming item to its identity, or returns {@code null} if the item is not
   * relevant to this collector. Irrelevant items leave every counter untouched.
   *
   * @param item the candidate item
   * @return the identity to collect under, or null to ignore the item
   */
  K collect(V item);

  /**
   * Maps a removed item to the identity to dispose of, or returns {@code null} if the
   * removal does not concern this collector.
   *
   * @param item the removed item
   * @return the identity to remove, or null to ignore the event
   */
  K dispose(V item);

  /**
   * Returns the reason the collector should end with now, or {@code null} to keep
   * collecting. Evaluated after every processed item.
   *
   * @param collector the collector being evaluated
   * @return the end reason, or null
   */
  String endReason(Collector<K, V> collector);
}
