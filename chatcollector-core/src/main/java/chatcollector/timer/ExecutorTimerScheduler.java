package chatcollector.timer;

import chatcollector.spi.TimerScheduler;
import chatcollector.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link TimerScheduler} backed by a single daemon {@link ScheduledExecutorService}.
 *
 * <p>Cancelled timers are removed from the work queue immediately, so many short-lived
 * collectors do not accumulate dead entries. Tasks that throw are logged; the scheduler
 * thread keeps running.
 *
 * <p>Closing the scheduler cancels every pending timer. Scheduling after close is
 * rejected with {@link IllegalStateException}.
 */
public final class ExecutorTimerScheduler implements TimerScheduler, AutoCloseable {
  private static final Logger logger = Logger.getLogger(ExecutorTimerScheduler.class.getName());

  public static final String DEFAULT_THREAD_PREFIX = "chatcollector-timer-";

  private final ScheduledExecutorService executor;
  private volatile boolean closed;

  public ExecutorTimerScheduler() {
    this(DEFAULT_THREAD_PREFIX);
  }

  /**
   * Creates a scheduler whose thread is named {@code <threadPrefix>N}.
   *
   * @param threadPrefix thread name prefix
   */
  public ExecutorTimerScheduler(String threadPrefix) {
    Objects.requireNonNull(threadPrefix, "threadPrefix");
    ScheduledThreadPoolExecutor pool = (ScheduledThreadPoolExecutor)
        Executors.newScheduledThreadPool(1, new DaemonThreadFactory(threadPrefix));
    pool.setRemoveOnCancelPolicy(true);
    this.executor = pool;
  }

  @Override
  public Timer schedule(Runnable task, Duration delay) {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(delay, "delay");
    if (delay.isNegative()) {
      throw new IllegalArgumentException("delay must not be negative");
    }
    if (closed) {
      throw new IllegalStateException("ExecutorTimerScheduler has been closed");
    }
    ScheduledFuture<?> future;
    try {
      future = executor.schedule(() -> runSafely(task), delay.toNanos(), TimeUnit.NANOSECONDS);
    } catch (RejectedExecutionException e) {
      throw new IllegalStateException("ExecutorTimerScheduler has been closed", e);
    }
    return () -> future.cancel(false);
  }

  private static void runSafely(Runnable task) {
    try {
      task.run();
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Timer task failed", t);
    }
  }

  public boolean isClosed() {
    return closed;
  }

  /** Cancels pending timers and stops the scheduler thread. */
  @Override
  public void close() {
    closed = true;
    executor.shutdownNow();
    try {
      executor.awaitTermination(5, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
