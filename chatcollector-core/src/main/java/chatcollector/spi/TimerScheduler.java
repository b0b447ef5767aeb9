package chatcollector.spi;

import java.time.Duration;

/**
 * Schedules the one-shot timers collectors use for their {@code time} and {@code idle}
 * windows.
 *
 * <p>Collectors only ever schedule and cancel; they never block on a timer. Tasks may run
 * on any thread. Implementations must tolerate {@link Timer#cancel()} being called after
 * the task already ran.
 *
 * @see chatcollector.timer.ExecutorTimerScheduler
 */
public interface TimerScheduler {

    /**
     * Schedules {@code task} to run once after {@code delay}.
     *
     * @param task  the task
     * @param delay the delay, not negative
     * @return a handle that cancels the task if it has not run yet
     */
    Timer schedule(Runnable task, Duration delay);

    /**
     * Handle for a scheduled task.
     */
    @FunctionalInterface
    interface Timer {

        /**
         * Cancels the task. No-op if it already ran or was cancelled.
         */
        void cancel();
    }
}
