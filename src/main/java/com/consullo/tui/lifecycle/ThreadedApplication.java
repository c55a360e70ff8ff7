package com.consullo.tui.lifecycle;

import com.consullo.tui.screen.Screen;
import com.consullo.tui.screen.TerminalBackend;
import com.consullo.tui.worker.Worker;
import com.consullo.tui.worker.WorkerFailedException;
import com.consullo.tui.worker.WorkerState;
import java.util.concurrent.TimeUnit;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Terminal application whose paced update loop runs on a dedicated worker thread.
 *
 * <p>
 * The controlling thread enters and closes the application and is otherwise free: it may poll
 * {@link #isExitRequested()}, block in {@link #awaitExitRequest(long, TimeUnit)} or do unrelated work. It never runs
 * updates itself.
 * </p>
 *
 * <p>
 * Ownership of the screen moves between threads without locks:
 * <ul>
 * <li>controlling thread: acquisition and on-enter, before the worker starts;</li>
 * <li>worker thread: every update, while the worker runs;</li>
 * <li>controlling thread: on-exit and release, after the worker has been joined.</li>
 * </ul>
 * The exit signal is the only state both threads touch while the worker runs.
 * </p>
 *
 * <pre>
 * try (ThreadedApplication app = new ThreadedApplication(backend, config, hooks).enter()) {
 *   while (!app.awaitExitRequest(1, TimeUnit.SECONDS)) {
 *     // unrelated work
 *   }
 * }
 * </pre>
 *
 * @since 1.0
 */
public final class ThreadedApplication implements ApplicationContext, AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(ThreadedApplication.class);

  private final Application application;
  private final Worker worker;

  /**
   * Creates a threaded application. Nothing is acquired or started until {@link #enter()}.
   *
   * @param backend terminal-control backend
   * @param config configuration
   * @param hooks lifecycle hooks; on-update runs on the worker thread
   */
  public ThreadedApplication(final TerminalBackend backend, final ApplicationConfig config,
      final ApplicationHooks hooks) {
    this(new Application(backend, config, hooks));
  }

  ThreadedApplication(final Application application) {
    Validate.notNull(application, "application must not be null");
    this.application = application;

    final PacedLoop loop = new PacedLoop(application.config().frameBudget(), application.exitSignal());
    this.worker = new Worker(application.config().workerName(), () -> loop.run(application::update),
        application::requestExit);
  }

  /**
   * Acquires the screen, runs on-enter, then starts the update worker. Returns once the worker thread has
   * started, without waiting for the first update.
   *
   * @return this application
   * @throws Exception if the screen cannot be acquired, on-enter fails or the worker cannot be started
   */
  public ThreadedApplication enter() throws Exception {
    this.application.enter();
    try {
      this.worker.start();
    } catch (final RuntimeException | Error e) {
      LOGGER.warn("Update worker could not be started: {}", e.getMessage());
      try {
        this.application.close();
      } catch (final Exception closeFailure) {
        e.addSuppressed(closeFailure);
      }
      throw e;
    }
    return this;
  }

  @Override
  public void requestExit() {
    this.application.requestExit();
  }

  @Override
  public boolean isExitRequested() {
    return this.application.isExitRequested();
  }

  /**
   * Blocks until the exit is requested, by either thread, or the timeout elapses.
   *
   * @param timeout maximum time to wait
   * @param unit unit of the timeout
   * @return true if the exit was requested
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean awaitExitRequest(final long timeout, final TimeUnit unit) throws InterruptedException {
    return this.application.awaitExitRequest(timeout, unit);
  }

  /**
   * Returns the screen for use by hooks. The controlling thread must not draw while the worker runs.
   *
   * @return screen
   */
  @Override
  public Screen screen() {
    return this.application.screen();
  }

  public ApplicationState state() {
    return this.application.state();
  }

  /**
   * Returns the worker state; a running worker whose exit was requested reports {@link WorkerState#STOPPING}.
   *
   * @return worker state
   */
  public WorkerState workerState() {
    final WorkerState s = this.worker.state();
    if (s == WorkerState.RUNNING && this.application.isExitRequested()) {
      return WorkerState.STOPPING;
    }
    return s;
  }

  public ApplicationConfig config() {
    return this.application.config();
  }

  /**
   * Requests the exit, waits for the worker to finish its current tick and stop, then runs on-exit and releases
   * the screen. Only the first call has an effect.
   *
   * @throws WorkerFailedException if the update loop ended with an exception; teardown still ran
   * @throws Exception if on-exit fails or the screen cannot be released
   */
  @Override
  public void close() throws Exception {
    requestExit();

    Exception primary = null;
    try {
      this.worker.close();
    } catch (final WorkerFailedException e) {
      primary = e;
    }

    try {
      this.application.close();
    } catch (final Exception e) {
      if (primary == null) {
        throw e;
      }
      primary.addSuppressed(e);
    }

    if (primary != null) {
      throw primary;
    }
  }
}
