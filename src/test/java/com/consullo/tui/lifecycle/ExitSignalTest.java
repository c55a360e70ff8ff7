package com.consullo.tui.lifecycle;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the exit-request latch.
 *
 * @since 1.0
 */
public class ExitSignalTest {

  @Test
  @DisplayName("Should start unrequested")
  void isRequested_New_IsFalse() {
    assertThat(new ExitSignal().isRequested()).isFalse();
  }

  @Test
  @DisplayName("Should stay requested after concurrent requests from several threads")
  void requestExit_ConcurrentRequests_StaysRequested() throws Exception {
    final ExitSignal signal = new ExitSignal();
    final CountDownLatch go = new CountDownLatch(1);
    final List<Thread> threads = new ArrayList<>();
    for (int i = 0; i < 8; i++) {
      final Thread t = new Thread(() -> {
        try {
          go.await();
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          return;
        }
        for (int n = 0; n < 1_000; n++) {
          signal.requestExit();
        }
      });
      threads.add(t);
      t.start();
    }

    go.countDown();
    for (Thread t : threads) {
      t.join(5_000L);
    }

    assertThat(signal.isRequested()).isTrue();
    signal.requestExit();
    assertThat(signal.isRequested()).isTrue();
  }

  @Test
  @DisplayName("Should release waiters when the exit is requested from another thread")
  void await_RequestFromOtherThread_Returns() throws Exception {
    final ExitSignal signal = new ExitSignal();

    assertThat(signal.await(10, TimeUnit.MILLISECONDS)).isFalse();

    final Thread requester = new Thread(signal::requestExit);
    requester.start();

    assertThat(signal.await(5, TimeUnit.SECONDS)).isTrue();
    signal.await();
    requester.join();
  }
}
