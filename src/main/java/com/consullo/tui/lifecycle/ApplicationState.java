package com.consullo.tui.lifecycle;

/**
 * Lifecycle state of an {@link Application}.
 *
 * @since 1.0
 */
public enum ApplicationState {
  /** Constructed; the screen is not acquired. */
  CREATED,
  /** Screen acquired; on-enter is running or has completed and no update has run yet. */
  ENTERED,
  /** At least one update has started. */
  RUNNING,
  /** On-exit ran (if entered) and the screen is released. Terminal. */
  EXITED
}
