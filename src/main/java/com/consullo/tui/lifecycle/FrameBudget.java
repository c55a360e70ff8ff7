package com.consullo.tui.lifecycle;

import java.time.Duration;
import org.apache.commons.lang3.Validate;

/**
 * Target wall-clock duration of one update tick, derived from a frame rate.
 *
 * @param fps target frames per second, positive and finite
 * @since 1.0
 */
public record FrameBudget(double fps) {

  public FrameBudget {
    Validate.isTrue(fps > 0 && Double.isFinite(fps), "fps must be positive and finite: %s", fps);
  }

  public static FrameBudget ofFps(final double fps) {
    return new FrameBudget(fps);
  }

  /**
   * Returns the frame duration in seconds, {@code 1 / fps}.
   *
   * @return frame duration in seconds
   */
  public double frameSeconds() {
    return 1.0 / this.fps;
  }

  /**
   * Returns the frame duration in nanoseconds, rounded, at least one.
   *
   * @return frame duration in nanoseconds
   */
  public long frameNanos() {
    return Math.max(1L, Math.round(1_000_000_000.0 / this.fps));
  }

  public Duration frameDuration() {
    return Duration.ofNanos(frameNanos());
  }
}
