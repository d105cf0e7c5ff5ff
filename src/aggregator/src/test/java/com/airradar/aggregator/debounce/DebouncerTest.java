package com.airradar.aggregator.debounce;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DebouncerTest {

  private final List<Scheduled> scheduled = new ArrayList<>();
  private ScheduledExecutorService scheduler;
  private SimpleMeterRegistry meterRegistry;
  private Debouncer<String> debouncer;

  @BeforeEach
  void setUp() {
    scheduler = mock(ScheduledExecutorService.class);
    when(scheduler.schedule(any(Runnable.class), anyLong(), eq(TimeUnit.MILLISECONDS)))
        .thenAnswer(invocation -> {
          scheduled.add(new Scheduled(invocation.getArgument(0), invocation.getArgument(1)));
          return mock(ScheduledFuture.class);
        });
    meterRegistry = new SimpleMeterRegistry();
    debouncer = new Debouncer<>(
        scheduler, Runnable::run, Duration.ofMillis(300), Duration.ofSeconds(2), meterRegistry);
  }

  @Test
  void burstSharesOneFutureAndRunsLatestTaskOnce() {
    AtomicInteger runs = new AtomicInteger();

    CompletableFuture<String> first = debouncer.debounce("k", () -> "first-" + runs.incrementAndGet());
    CompletableFuture<String> second = debouncer.debounce("k", () -> "second-" + runs.incrementAndGet());
    CompletableFuture<String> third = debouncer.debounce("k", () -> "third-" + runs.incrementAndGet());

    assertThat(second).isSameAs(first);
    assertThat(third).isSameAs(first);
    assertThat(scheduled).extracting(Scheduled::delayMs).containsExactly(2000L, 300L, 300L, 300L);

    lastDelayTimer().task().run();

    assertThat(first).isCompletedWithValue("third-1");
    assertThat(runs.get()).isEqualTo(1);
    assertThat(debouncer.pendingCount()).isZero();
    assertThat(meterRegistry.get("aggregator.debounce.coalesced.total").counter().count()).isEqualTo(2.0);
    assertThat(meterRegistry.get("aggregator.debounce.executions.total").counter().count()).isEqualTo(1.0);
  }

  @Test
  void maxWaitForcesExecutionDuringContinuousCalls() {
    CompletableFuture<String> result = debouncer.debounce("k", () -> "a");
    debouncer.debounce("k", () -> "b");

    // First scheduled timer is the max-wait deadline.
    scheduled.get(0).task().run();

    assertThat(result).isCompletedWithValue("b");
  }

  @Test
  void staleTimersAfterExecutionAreIgnored() {
    AtomicInteger runs = new AtomicInteger();
    CompletableFuture<String> result = debouncer.debounce("k", () -> "run-" + runs.incrementAndGet());

    lastDelayTimer().task().run();
    scheduled.get(0).task().run();

    assertThat(result).isCompletedWithValue("run-1");
    assertThat(runs.get()).isEqualTo(1);
  }

  @Test
  void keysAreIndependent() {
    CompletableFuture<String> a = debouncer.debounce("a", () -> "a");
    CompletableFuture<String> b = debouncer.debounce("b", () -> "b");

    assertThat(a).isNotSameAs(b);
    assertThat(debouncer.pendingCount()).isEqualTo(2);
  }

  @Test
  void failingTaskCompletesFutureExceptionally() {
    CompletableFuture<String> result = debouncer.debounce("k", () -> {
      throw new IllegalStateException("upstream exploded");
    });

    lastDelayTimer().task().run();

    assertThat(result).isCompletedExceptionally();
  }

  @Test
  void cancelAllCancelsPendingWindows() {
    CompletableFuture<String> result = debouncer.debounce("k", () -> "never");

    debouncer.cancelAll();

    assertThat(result).isCancelled();
    assertThat(debouncer.pendingCount()).isZero();
  }

  @Test
  void closeShutsDownScheduler() {
    CompletableFuture<String> result = debouncer.debounce("k", () -> "never");

    debouncer.close();

    assertThat(result).isCancelled();
    verify(scheduler).shutdownNow();
  }

  private Scheduled lastDelayTimer() {
    return scheduled.get(scheduled.size() - 1);
  }

  private record Scheduled(Runnable task, long delayMs) {}
}
