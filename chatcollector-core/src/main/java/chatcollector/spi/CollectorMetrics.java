package chatcollector.spi;

/**
 * Observability hook for exporting collector counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer or another monitoring system.
 */
public interface CollectorMetrics {

    /**
     * No-op instance that discards all metrics.
     */
    CollectorMetrics NOOP = new Noop();

    /**
     * Increments the count of collectors that were started.
     */
    void incrementStarted();

    /**
     * Increments the count of items accepted into a collection.
     */
    void incrementCollected();

    /**
     * Increments the count of items removed from a collection by a delete event.
     */
    void incrementDisposed();

    /**
     * Increments the count of collectors that ended. Every collector reports exactly
     * one end for its one start, so {@code started - ended} is the number running.
     *
     * @param reason the terminal reason, e.g. {@code "limit"} or {@code "time"}
     */
    void incrementEnded(String reason);

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements CollectorMetrics {
        @Override
        public void incrementStarted() {
        }

        @Override
        public void incrementCollected() {
        }

        @Override
        public void incrementDisposed() {
        }

        @Override
        public void incrementEnded(String reason) {
        }
    }
}
