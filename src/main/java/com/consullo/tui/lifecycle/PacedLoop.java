package com.consullo.tui.lifecycle;

import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a tick repeatedly at a target rate until an exit is requested.
 *
 * <p>
 * Each iteration:
 * <ul>
 * <li>checks the {@link ExitSignal} and stops if it is set,</li>
 * <li>runs the tick to completion,</li>
 * <li>sleeps for the rest of the frame budget, unless the tick requested the exit.</li>
 * </ul>
 * A tick that overruns the budget is followed immediately by the next one. Lost time is not caught up.
 * </p>
 *
 * <p>
 * A running tick is never interrupted: an exit requested during a tick takes effect at the next iteration
 * boundary.
 * </p>
 *
 * @since 1.0
 */
public final class PacedLoop {

  private static final Logger LOGGER = LoggerFactory.getLogger(PacedLoop.class);

  /**
   * One unit of work run per frame.
   */
  @FunctionalInterface
  public interface Tick {

    void run() throws Exception;
  }

  /**
   * Sleeps for the remainder of a frame.
   */
  @FunctionalInterface
  public interface Sleeper {

    void sleepNanos(long nanos) throws InterruptedException;
  }

  private final FrameBudget budget;
  private final ExitSignal exitSignal;
  private final LongSupplier nanoClock;
  private final Sleeper sleeper;

  /**
   * Creates a loop paced by the system clock.
   *
   * @param budget frame budget
   * @param exitSignal signal ending the loop
   */
  public PacedLoop(final FrameBudget budget, final ExitSignal exitSignal) {
    this(budget, exitSignal, System::nanoTime, TimeUnit.NANOSECONDS::sleep);
  }

  /**
   * Creates a loop with an explicit clock and sleeper.
   *
   * @param budget frame budget
   * @param exitSignal signal ending the loop
   * @param nanoClock monotonic clock in nanoseconds
   * @param sleeper sleeper used between frames
   */
  public PacedLoop(final FrameBudget budget, final ExitSignal exitSignal, final LongSupplier nanoClock,
      final Sleeper sleeper) {
    Validate.notNull(budget, "budget must not be null");
    Validate.notNull(exitSignal, "exitSignal must not be null");
    Validate.notNull(nanoClock, "nanoClock must not be null");
    Validate.notNull(sleeper, "sleeper must not be null");
    this.budget = budget;
    this.exitSignal = exitSignal;
    this.nanoClock = nanoClock;
    this.sleeper = sleeper;
  }

  /**
   * Runs the loop on the calling thread until the exit signal is set.
   *
   * @param tick work run once per frame
   * @return number of ticks run
   * @throws InterruptedException if interrupted while sleeping between frames; the interrupt flag is restored
   * @throws Exception the first exception thrown by the tick, which ends the loop
   */
  public long run(final Tick tick) throws Exception {
    Validate.notNull(tick, "tick must not be null");

    final long frameNanos = this.budget.frameNanos();
    long ticks = 0;
    long overruns = 0;

    while (!this.exitSignal.isRequested()) {
      final long start = this.nanoClock.getAsLong();
      tick.run();
      ticks++;

      if (this.exitSignal.isRequested()) {
        break;
      }

      final long remaining = frameNanos - (this.nanoClock.getAsLong() - start);
      if (remaining > 0) {
        try {
          this.sleeper.sleepNanos(remaining);
        } catch (final InterruptedException e) {
          Thread.currentThread().interrupt();
          throw e;
        }
      } else {
        overruns++;
      }
    }

    LOGGER.debug("Paced loop finished after {} ticks ({} over budget of {} ns)", ticks, overruns, frameNanos);
    return ticks;
  }

  public FrameBudget budget() {
    return this.budget;
  }
}
