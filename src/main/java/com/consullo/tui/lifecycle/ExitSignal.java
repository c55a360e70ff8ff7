package com.consullo.tui.lifecycle;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Latch recording that an exit has been requested.
 *
 * <p>
 * Any thread may request the exit any number of times; the first request wins and the latch never resets. Reads
 * are sequentially consistent with requests, so a request that returned before a read began is always observed.
 * </p>
 *
 * @since 1.0
 */
public final class ExitSignal {

  private final AtomicBoolean requested = new AtomicBoolean();
  private final CountDownLatch latch = new CountDownLatch(1);

  /**
   * Requests the exit. Idempotent.
   */
  public void requestExit() {
    if (this.requested.compareAndSet(false, true)) {
      this.latch.countDown();
    }
  }

  public boolean isRequested() {
    return this.requested.get();
  }

  /**
   * Blocks until the exit has been requested.
   *
   * @throws InterruptedException if interrupted while waiting
   */
  public void await() throws InterruptedException {
    this.latch.await();
  }

  /**
   * Blocks until the exit has been requested or the timeout elapses.
   *
   * @param timeout maximum time to wait
   * @param unit unit of the timeout
   * @return true if the exit was requested, false if the timeout elapsed first
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean await(final long timeout, final TimeUnit unit) throws InterruptedException {
    return this.latch.await(timeout, unit);
  }
}
