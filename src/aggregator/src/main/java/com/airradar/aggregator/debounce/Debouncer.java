package com.airradar.aggregator.debounce;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Coalesces calls sharing a key into one execution.
 *
 * <p>Each call for a pending key restarts the {@code delay} timer. A second timer started by the
 * first call of the window forces execution after {@code maxWait}, so no caller waits longer than
 * that plus the execution itself. Every caller of one window receives the same future, completed
 * by a single run of the most recently supplied task.
 *
 * @param <T> result type shared by every window
 */
public class Debouncer<T> implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(Debouncer.class);

  private final ScheduledExecutorService scheduler;
  private final Executor executor;
  private final Duration delay;
  private final Duration maxWait;
  private final Map<String, Window<T>> pending = new HashMap<>();
  private final Counter coalescedCounter;
  private final Counter executionsCounter;

  /**
   * Creates a debouncer.
   *
   * @param scheduler timer source for delay and max-wait deadlines
   * @param executor executor running the coalesced task
   * @param delay quiet period after the last call before execution
   * @param maxWait upper bound between the first call of a window and execution
   * @param meterRegistry registry for coalescing counters
   */
  public Debouncer(
      ScheduledExecutorService scheduler,
      Executor executor,
      Duration delay,
      Duration maxWait,
      MeterRegistry meterRegistry) {
    this.scheduler = scheduler;
    this.executor = executor;
    this.delay = delay == null || delay.isNegative() ? Duration.ZERO : delay;
    this.maxWait = maxWait == null || maxWait.compareTo(this.delay) < 0 ? this.delay : maxWait;
    this.coalescedCounter = Counter.builder("aggregator.debounce.coalesced.total")
        .description("Calls merged into an already pending debounce window")
        .register(meterRegistry);
    this.executionsCounter = Counter.builder("aggregator.debounce.executions.total")
        .description("Debounced task executions")
        .register(meterRegistry);
  }

  /**
   * Schedules {@code task} under {@code key}, joining the pending window when one exists.
   *
   * @param key coalescing key
   * @param task work to run once the window closes
   * @return future shared by every caller of the window
   */
  public synchronized CompletableFuture<T> debounce(String key, Supplier<T> task) {
    Window<T> window = pending.get(key);
    if (window == null) {
      window = new Window<>(task);
      pending.put(key, window);
      Window<T> created = window;
      window.maxWaitTimer = scheduler.schedule(
          () -> fire(key, created), maxWait.toMillis(), TimeUnit.MILLISECONDS);
    } else {
      coalescedCounter.increment();
      window.task = task;
      window.delayTimer.cancel(false);
    }
    Window<T> current = window;
    window.delayTimer = scheduler.schedule(
        () -> fire(key, current), delay.toMillis(), TimeUnit.MILLISECONDS);
    return window.result;
  }

  /**
   * Number of keys with an open window.
   *
   * @return pending window count
   */
  synchronized int pendingCount() {
    return pending.size();
  }

  /** Cancels every open window; their callers observe a cancelled future. */
  public void cancelAll() {
    List<Window<T>> cancelled;
    synchronized (this) {
      cancelled = new ArrayList<>(pending.values());
      pending.clear();
    }
    for (Window<T> window : cancelled) {
      window.cancelTimers();
      window.result.cancel(false);
    }
  }

  @Override
  public void close() {
    cancelAll();
    scheduler.shutdownNow();
  }

  private void fire(String key, Window<T> window) {
    synchronized (this) {
      if (pending.get(key) != window) {
        return;
      }
      pending.remove(key);
    }
    window.cancelTimers();
    executionsCounter.increment();

    Supplier<T> task = window.task;
    try {
      executor.execute(() -> run(key, task, window.result));
    } catch (RuntimeException ex) {
      log.warn("Debounced task rejected for key={}", key, ex);
      window.result.completeExceptionally(ex);
    }
  }

  private static <R> void run(String key, Supplier<R> task, CompletableFuture<R> result) {
    try {
      result.complete(task.get());
    } catch (RuntimeException ex) {
      log.warn("Debounced task failed for key={}", key, ex);
      result.completeExceptionally(ex);
    }
  }

  private static final class Window<V> {
    private final CompletableFuture<V> result = new CompletableFuture<>();
    private volatile Supplier<V> task;
    private ScheduledFuture<?> delayTimer;
    private ScheduledFuture<?> maxWaitTimer;

    private Window(Supplier<V> task) {
      this.task = task;
    }

    private void cancelTimers() {
      if (delayTimer != null) {
        delayTimer.cancel(false);
      }
      if (maxWaitTimer != null) {
        maxWaitTimer.cancel(false);
      }
    }
  }
}
