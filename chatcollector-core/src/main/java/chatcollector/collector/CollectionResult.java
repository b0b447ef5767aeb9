package chatcollector.collector;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Terminal value of a collector: the accepted items in insertion order and the reason
 * collection ended.
 *
 * @param collected accepted items keyed by identity (unmodifiable)
 * @param reason    the terminal reason
 * @param <K>       the item identity type
 * @param <V>       the item type
 */
public record CollectionResult<K, V>(Map<K, V> collected, String reason) {
  public CollectionResult {
    Objects.requireNonNull(reason, "reason");
    collected = Collections.unmodifiableMap(new LinkedHashMap<>(collected));
  }

  public int size() {
    return collected.size();
  }
}
