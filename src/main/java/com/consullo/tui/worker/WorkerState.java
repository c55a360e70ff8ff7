package com.consullo.tui.worker;

/**
 * Lifecycle state of a {@link Worker}.
 *
 * @since 1.0
 */
public enum WorkerState {
  NOT_STARTED,
  RUNNING,
  /** Stop requested; the task has not returned yet. */
  STOPPING,
  /** The task returned or failed. Terminal. */
  STOPPED
}
