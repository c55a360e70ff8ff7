package com.consullo.tui.worker;

import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scoped background thread: started by {@link #start()}, joined by {@link #close()}.
 *
 * <p>
 * The task runs once on a dedicated platform thread. Stopping is cooperative: {@link #close()} invokes the
 * optional stop request (typically raising a flag the task polls) and then waits for the task to return. The
 * thread is never interrupted or killed.
 * </p>
 *
 * <p>
 * A failure of the task is logged on the worker thread, kept, and rethrown from {@link #close()} as a
 * {@link WorkerFailedException}, so a dead worker never goes unnoticed by the thread that owns it.
 * </p>
 *
 * <p>
 * Workers are single-use. Starting a worker twice is an {@link IllegalStateException}.
 * </p>
 *
 * @since 1.0
 */
public final class Worker implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(Worker.class);

  /**
   * Work executed on the worker thread.
   */
  @FunctionalInterface
  public interface Task {

    void run() throws Exception;
  }

  private static final Runnable NO_STOP_REQUEST = () -> { };

  private final String name;
  private final Task task;
  private final Runnable stopRequest;
  private final AtomicReference<WorkerState> state = new AtomicReference<>(WorkerState.NOT_STARTED);
  private final AtomicReference<Throwable> failure = new AtomicReference<>();
  private final AtomicBoolean failureReported = new AtomicBoolean();

  private volatile Thread thread;

  /**
   * Creates a worker without a stop request; {@link #close()} waits for the task to return on its own.
   *
   * @param name thread name
   * @param task task to run
   */
  public Worker(final String name, final Task task) {
    this(name, task, NO_STOP_REQUEST);
  }

  /**
   * Creates a worker.
   *
   * @param name thread name
   * @param task task to run
   * @param stopRequest invoked once when a stop is requested; must not block
   */
  public Worker(final String name, final Task task, final Runnable stopRequest) {
    Validate.notBlank(name, "name must not be blank");
    Validate.notNull(task, "task must not be null");
    Validate.notNull(stopRequest, "stopRequest must not be null");
    this.name = name;
    this.task = task;
    this.stopRequest = stopRequest;
  }

  /**
   * Starts the worker thread. Returns as soon as the thread is started.
   *
   * @return this worker
   * @throws IllegalStateException if the worker was already started or closed
   */
  public Worker start() {
    if (!this.state.compareAndSet(WorkerState.NOT_STARTED, WorkerState.RUNNING)) {
      throw new IllegalStateException(
          String.format("Cannot start worker '%s' as it is in state %s", this.name, this.state.get()));
    }

    final Thread t = new Thread(this::runTask, this.name);
    this.thread = t;
    try {
      t.start();
    } catch (final RuntimeException | Error e) {
      this.state.set(WorkerState.STOPPED);
      throw e;
    }
    LOGGER.debug("Worker '{}' started", this.name);
    return this;
  }

  /**
   * Asks the task to stop by invoking the stop request. Has no effect unless the worker is running.
   */
  public void requestStop() {
    if (this.state.compareAndSet(WorkerState.RUNNING, WorkerState.STOPPING)) {
      LOGGER.debug("Worker '{}' stopping", this.name);
      this.stopRequest.run();
    }
  }

  /**
   * Waits up to the timeout for the task to return. Does not request a stop.
   *
   * @param timeout maximum time to wait
   * @param unit unit of the timeout
   * @return true if the worker has stopped (or was never started)
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean join(final long timeout, final TimeUnit unit) throws InterruptedException {
    final Thread t = this.thread;
    if (t != null) {
      t.join(Math.max(1L, unit.toMillis(timeout)));
      return !t.isAlive();
    }
    return this.state.get() != WorkerState.RUNNING && this.state.get() != WorkerState.STOPPING;
  }

  /**
   * Requests a stop and blocks until the task returned. An interrupt does not shorten the wait; the interrupt
   * flag is restored afterwards. The task's failure is rethrown on the first close only.
   *
   * @throws WorkerFailedException if the task ended with an exception
   * @throws IllegalStateException if called from the worker thread itself
   */
  @Override
  public void close() throws WorkerFailedException {
    if (this.state.compareAndSet(WorkerState.NOT_STARTED, WorkerState.STOPPED)) {
      return;
    }

    final Thread t = this.thread;
    if (t == Thread.currentThread()) {
      throw new IllegalStateException("Worker '" + this.name + "' cannot be closed from its own thread.");
    }

    requestStop();
    if (t != null) {
      joinUninterruptibly(t);
    }

    final Throwable cause = this.failure.get();
    if (cause != null && this.failureReported.compareAndSet(false, true)) {
      throw new WorkerFailedException(this.name, cause);
    }
    LOGGER.debug("Worker '{}' joined", this.name);
  }

  public String name() {
    return this.name;
  }

  public WorkerState state() {
    return this.state.get();
  }

  /**
   * Returns the task's failure once the task has ended with one.
   *
   * @return the failure, or empty
   */
  public Optional<Throwable> failure() {
    return Optional.ofNullable(this.failure.get());
  }

  private void runTask() {
    try {
      this.task.run();
    } catch (final Throwable t) {
      this.failure.set(t);
      LOGGER.error("Worker '{}' stopped with ERROR due to {}", this.name, t.getClass().getSimpleName(), t);
    } finally {
      this.state.set(WorkerState.STOPPED);
    }
  }

  private static void joinUninterruptibly(final Thread t) {
    boolean interrupted = false;
    try {
      while (true) {
        try {
          t.join();
          return;
        } catch (final InterruptedException e) {
          interrupted = true;
        }
      }
    } finally {
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }
  }
}
