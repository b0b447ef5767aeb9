/**
 * Default {@link chatcollector.spi.TimerScheduler} implementation.
 */
package chatcollector.timer;
