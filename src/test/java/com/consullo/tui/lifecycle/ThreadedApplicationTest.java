package com.consullo.tui.lifecycle;

import com.consullo.tui.screen.ScreenUnavailableException;
import com.consullo.tui.worker.WorkerFailedException;
import com.consullo.tui.worker.WorkerState;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.awaitility.Awaitility.await;

/**
 * Tests for the threaded application: worker start/stop, exit signalling across threads and the ordering of
 * on-update and on-exit.
 *
 * @since 1.0
 */
public class ThreadedApplicationTest {

  @Test
  @DisplayName("Should stop promptly after on-update requests the exit on its third call")
  void close_HookRequestsExitOnThirdTick_StopsWithoutFurtherUpdates() throws Exception {
    final RecordingTerminalBackend backend = new RecordingTerminalBackend();
    final AtomicInteger updates = new AtomicInteger();
    final ApplicationHooks hooks = ApplicationHooks.builder()
        .onUpdate((ctx, key) -> {
          if (updates.incrementAndGet() == 3) {
            ctx.requestExit();
          }
        })
        .build();
    final ApplicationConfig config = ApplicationConfig.defaults().withFps(30);

    final ThreadedApplication app = new ThreadedApplication(backend, config, hooks).enter();
    assertThat(app.awaitExitRequest(5, TimeUnit.SECONDS)).isTrue();

    final long start = System.nanoTime();
    app.close();
    final Duration closeTime = Duration.ofNanos(System.nanoTime() - start);

    assertThat(closeTime).isLessThan(Duration.ofMillis(3 * 34 + 200));
    assertThat(updates.get()).isEqualTo(3);
    assertThat(app.workerState()).isEqualTo(WorkerState.STOPPED);
    assertThat(app.state()).isEqualTo(ApplicationState.EXITED);
    assertThat(backend.releaseCount.get()).isEqualTo(1);
  }

  @Test
  @DisplayName("Should return from enter before the first update completes")
  void enter_SlowFirstUpdate_ReturnsImmediately() throws Exception {
    final CountDownLatch release = new CountDownLatch(1);
    final AtomicInteger updates = new AtomicInteger();
    final ApplicationHooks hooks = ApplicationHooks.builder()
        .onUpdate((ctx, key) -> {
          updates.incrementAndGet();
          release.await(5, TimeUnit.SECONDS);
        })
        .build();

    try (ThreadedApplication app = new ThreadedApplication(new RecordingTerminalBackend(),
        ApplicationConfig.defaults(), hooks).enter()) {
      assertThat(app.state()).isIn(ApplicationState.ENTERED, ApplicationState.RUNNING);
      assertThat(app.workerState()).isEqualTo(WorkerState.RUNNING);
      await().atMost(Duration.ofSeconds(5)).until(() -> updates.get() == 1);
      release.countDown();
    }
  }

  @Test
  @DisplayName("Should stop the worker when the controlling thread requests the exit")
  void requestExit_FromControllingThread_StopsWorker() throws Exception {
    final RecordingTerminalBackend backend = new RecordingTerminalBackend();
    final AtomicInteger updates = new AtomicInteger();
    final ApplicationHooks hooks = ApplicationHooks.builder()
        .onUpdate((ctx, key) -> updates.incrementAndGet())
        .build();

    final ThreadedApplication app =
        new ThreadedApplication(backend, ApplicationConfig.defaults().withFps(200), hooks).enter();
    await().atMost(Duration.ofSeconds(5)).until(() -> updates.get() >= 3);

    final int updatesAtRequest = updates.get();
    app.requestExit();
    assertThat(app.workerState()).isIn(WorkerState.STOPPING, WorkerState.STOPPED);
    await().atMost(Duration.ofSeconds(5)).until(() -> app.workerState() == WorkerState.STOPPED);

    // At most the tick already in flight completes after the request.
    assertThat(updates.get()).isLessThanOrEqualTo(updatesAtRequest + 1);

    app.close();

    assertThat(updates.get()).isLessThanOrEqualTo(updatesAtRequest + 1);
    assertThat(backend.releaseCount.get()).isEqualTo(1);
  }

  @Test
  @DisplayName("Should never run on-exit while an on-update call is in progress")
  void close_WhileUpdating_OnExitDoesNotOverlapOnUpdate() throws Exception {
    final List<long[]> updateSpans = new CopyOnWriteArrayList<>();
    final AtomicLong exitStart = new AtomicLong();
    final AtomicLong exitEnd = new AtomicLong();
    final ApplicationHooks hooks = ApplicationHooks.builder()
        .onUpdate((ctx, key) -> {
          final long begin = System.nanoTime();
          Thread.sleep(15L);
          updateSpans.add(new long[] { begin, System.nanoTime() });
        })
        .onExit(ctx -> {
          exitStart.set(System.nanoTime());
          Thread.sleep(5L);
          exitEnd.set(System.nanoTime());
        })
        .build();

    final ThreadedApplication app = new ThreadedApplication(new RecordingTerminalBackend(),
        ApplicationConfig.defaults().withFps(1000), hooks).enter();
    await().atMost(Duration.ofSeconds(5)).until(() -> updateSpans.size() >= 3);
    app.close();

    assertThat(exitStart.get()).isPositive();
    for (long[] span : updateSpans) {
      final boolean overlaps = span[0] < exitEnd.get() && exitStart.get() < span[1];
      assertThat(overlaps).as("update [%d, %d] overlaps exit", span[0], span[1]).isFalse();
      assertThat(span[1]).isLessThanOrEqualTo(exitStart.get());
    }
  }

  @Test
  @DisplayName("Should surface a failed update to the controlling thread and still tear down")
  void close_UpdateFailed_ThrowsWorkerFailure() throws Exception {
    final RecordingTerminalBackend backend = new RecordingTerminalBackend();
    final AtomicInteger exitCalls = new AtomicInteger();
    final ApplicationHooks hooks = ApplicationHooks.builder()
        .onUpdate((ctx, key) -> {
          throw new IOException("render failed");
        })
        .onExit(ctx -> exitCalls.incrementAndGet())
        .build();

    final ThreadedApplication app = new ThreadedApplication(backend, ApplicationConfig.defaults(), hooks).enter();

    // exitOnUpdateFailure (default) wakes the controlling thread.
    assertThat(app.awaitExitRequest(5, TimeUnit.SECONDS)).isTrue();
    final Throwable thrown = catchThrowable(app::close);

    assertThat(thrown).isInstanceOf(WorkerFailedException.class);
    assertThat(thrown.getCause()).isInstanceOf(IOException.class).hasMessage("render failed");
    assertThat(exitCalls.get()).isEqualTo(1);
    assertThat(backend.releaseCount.get()).isEqualTo(1);
    assertThat(app.state()).isEqualTo(ApplicationState.EXITED);
  }

  @Test
  @DisplayName("Should wake the controlling thread when on-update throws an error")
  void updateThrowsError_ExitOnFailure_RequestsExitAndTearsDown() throws Exception {
    final RecordingTerminalBackend backend = new RecordingTerminalBackend();
    final AtomicInteger exitCalls = new AtomicInteger();
    final ApplicationHooks hooks = ApplicationHooks.builder()
        .onUpdate((ctx, key) -> {
          throw new AssertionError("boom");
        })
        .onExit(ctx -> exitCalls.incrementAndGet())
        .build();

    final ThreadedApplication app = new ThreadedApplication(backend, ApplicationConfig.defaults(), hooks).enter();

    assertThat(app.awaitExitRequest(5, TimeUnit.SECONDS)).isTrue();
    await().atMost(Duration.ofSeconds(5)).until(() -> app.workerState() == WorkerState.STOPPED);
    final Throwable thrown = catchThrowable(app::close);

    assertThat(thrown).isInstanceOf(WorkerFailedException.class);
    assertThat(thrown.getCause()).isInstanceOf(AssertionError.class).hasMessage("boom");
    assertThat(exitCalls.get()).isEqualTo(1);
    assertThat(backend.releaseCount.get()).isEqualTo(1);
    assertThat(backend.held.get()).isFalse();
  }

  @Test
  @DisplayName("Should leave the exit unrequested after a failed update when exit-on-failure is off")
  void updateFails_ExitOnFailureDisabled_WorkerStopsWithoutRequest() throws Exception {
    final ApplicationHooks hooks = ApplicationHooks.builder()
        .onUpdate((ctx, key) -> {
          throw new IllegalStateException("bad state");
        })
        .build();

    final ThreadedApplication app = new ThreadedApplication(new RecordingTerminalBackend(),
        ApplicationConfig.defaults().withExitOnUpdateFailure(false), hooks).enter();

    await().atMost(Duration.ofSeconds(5)).until(() -> app.workerState() == WorkerState.STOPPED);
    assertThat(app.isExitRequested()).isFalse();

    assertThat(catchThrowable(app::close)).isInstanceOf(WorkerFailedException.class);
    assertThat(app.isExitRequested()).isTrue();
  }

  @Test
  @DisplayName("Should run on-enter on the controlling thread and on-update on the named worker thread")
  void hooks_ThreadAffinity_MatchesOwnership() throws Exception {
    final AtomicReference<String> enterThread = new AtomicReference<>();
    final AtomicReference<String> updateThread = new AtomicReference<>();
    final AtomicReference<String> exitThread = new AtomicReference<>();
    final ApplicationHooks hooks = ApplicationHooks.builder()
        .onEnter(ctx -> enterThread.set(Thread.currentThread().getName()))
        .onUpdate((ctx, key) -> {
          updateThread.set(Thread.currentThread().getName());
          ctx.requestExit();
        })
        .onExit(ctx -> exitThread.set(Thread.currentThread().getName()))
        .build();

    final String self = Thread.currentThread().getName();
    try (ThreadedApplication app = new ThreadedApplication(new RecordingTerminalBackend(),
        ApplicationConfig.defaults().withWorkerName("render-loop"), hooks).enter()) {
      app.awaitExitRequest(5, TimeUnit.SECONDS);
    }

    assertThat(enterThread.get()).isEqualTo(self);
    assertThat(updateThread.get()).isEqualTo("render-loop");
    assertThat(exitThread.get()).isEqualTo(self);
  }

  @Test
  @DisplayName("Should not start the worker when the screen is unavailable")
  void enter_ScreenUnavailable_WorkerNotStarted() throws Exception {
    final AtomicInteger updates = new AtomicInteger();
    final ThreadedApplication app = new ThreadedApplication(new RecordingTerminalBackend().failAcquire(),
        ApplicationConfig.defaults(), ApplicationHooks.builder()
        .onUpdate((ctx, key) -> updates.incrementAndGet())
        .build());

    assertThat(catchThrowable(app::enter)).isInstanceOf(ScreenUnavailableException.class);
    assertThat(app.workerState()).isEqualTo(WorkerState.NOT_STARTED);

    app.close();
    assertThat(updates.get()).isZero();
    assertThat(app.workerState()).isEqualTo(WorkerState.STOPPED);
  }

  @Test
  @DisplayName("Should restore the interrupt flag when interrupted while joining the worker")
  void close_InterruptedWhileJoining_WaitsAndRestoresFlag() throws Exception {
    final CountDownLatch inUpdate = new CountDownLatch(1);
    final AtomicInteger updates = new AtomicInteger();
    final ApplicationHooks hooks = ApplicationHooks.builder()
        .onUpdate((ctx, key) -> {
          updates.incrementAndGet();
          inUpdate.countDown();
          Thread.sleep(100L);
        })
        .build();

    final ThreadedApplication app = new ThreadedApplication(new RecordingTerminalBackend(),
        ApplicationConfig.defaults(), hooks).enter();
    assertThat(inUpdate.await(5, TimeUnit.SECONDS)).isTrue();

    Thread.currentThread().interrupt();
    try {
      app.close();
      assertThat(Thread.currentThread().isInterrupted()).isTrue();
    } finally {
      Thread.interrupted();
    }
    assertThat(app.workerState()).isEqualTo(WorkerState.STOPPED);
    assertThat(app.state()).isEqualTo(ApplicationState.EXITED);
  }
}
