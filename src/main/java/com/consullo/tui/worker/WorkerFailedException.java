package com.consullo.tui.worker;

/**
 * Reports, on the joining thread, that a worker's task ended with an exception. The task's exception is the
 * cause.
 *
 * @since 1.0
 */
public class WorkerFailedException extends Exception {

  private static final long serialVersionUID = 1L;

  private final String workerName;

  public WorkerFailedException(final String workerName, final Throwable cause) {
    super("Worker '" + workerName + "' failed: " + cause, cause);
    this.workerName = workerName;
  }

  public String getWorkerName() {
    return workerName;
  }
}
