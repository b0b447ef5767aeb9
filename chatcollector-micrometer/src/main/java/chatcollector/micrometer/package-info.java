/**
 * Micrometer bridge for exporting collector metrics to Prometheus, Grafana, and other backends.
 *
 * <p>{@link chatcollector.micrometer.MicrometerCollectorMetrics} implements the
 * {@link chatcollector.spi.CollectorMetrics} SPI using Micrometer counters and a gauge.
 */
package chatcollector.micrometer;
