/**
 * Service provider interfaces: {@link chatcollector.spi.TimerScheduler} for collector
 * timers and {@link chatcollector.spi.CollectorMetrics} for observability.
 */
package chatcollector.spi;
