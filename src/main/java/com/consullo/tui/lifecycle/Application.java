package com.consullo.tui.lifecycle;

import com.consullo.tui.screen.Screen;
import com.consullo.tui.screen.ScreenSession;
import com.consullo.tui.screen.ScreenUnavailableException;
import com.consullo.tui.screen.TerminalBackend;
import java.util.OptionalInt;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Synchronous terminal application: enter, repeated update, exit, all on the owning thread.
 *
 * <p>
 * Lifecycle:
 * <ul>
 * <li>{@link #enter()} acquires the screen and runs on-enter.</li>
 * <li>{@link #update()} reads one key, runs on-update with it and refreshes the screen. The caller decides the
 * rate, or uses {@link #runLoop()} for a paced loop.</li>
 * <li>{@link #close()} runs on-exit and releases the screen, exactly once, whatever ended the application.</li>
 * </ul>
 * </p>
 *
 * <pre>
 * try (Application app = new Application(backend, ApplicationConfig.defaults(), hooks).enter()) {
 *   app.runLoop();
 * }
 * </pre>
 *
 * @since 1.0
 */
public final class Application implements ApplicationContext, AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(Application.class);

  private final TerminalBackend backend;
  private final ApplicationConfig config;
  private final ApplicationHooks hooks;
  private final ExitSignal exitSignal = new ExitSignal();
  private final AtomicReference<ApplicationState> state = new AtomicReference<>(ApplicationState.CREATED);
  private final AtomicBoolean enterCalled = new AtomicBoolean();
  private final AtomicBoolean closeCalled = new AtomicBoolean();

  private volatile ScreenSession session;

  /**
   * Creates an application. Nothing is acquired until {@link #enter()}.
   *
   * @param backend terminal-control backend
   * @param config configuration
   * @param hooks lifecycle hooks
   */
  public Application(final TerminalBackend backend, final ApplicationConfig config, final ApplicationHooks hooks) {
    Validate.notNull(backend, "backend must not be null");
    Validate.notNull(config, "config must not be null");
    Validate.notNull(hooks, "hooks must not be null");
    this.backend = backend;
    this.config = config;
    this.hooks = hooks;
  }

  /**
   * Acquires the screen and runs on-enter.
   *
   * <p>If acquisition fails, no hook runs. If on-enter fails, the screen is released before the failure
   * propagates and on-exit is not run. Either way the application ends in {@link ApplicationState#EXITED}.
   *
   * @return this application
   * @throws ScreenUnavailableException if the screen cannot be acquired
   * @throws IllegalStateException if the application was already entered
   * @throws Exception if on-enter fails
   */
  public Application enter() throws Exception {
    if (this.state.get() != ApplicationState.CREATED || !this.enterCalled.compareAndSet(false, true)) {
      throw new IllegalStateException("Cannot enter application in state " + this.state.get());
    }

    final ScreenSession opened;
    try {
      opened = ScreenSession.open(this.backend, this.config.keypad());
    } catch (final ScreenUnavailableException | RuntimeException e) {
      this.state.set(ApplicationState.EXITED);
      throw e;
    }
    this.session = opened;
    if (!this.state.compareAndSet(ApplicationState.CREATED, ApplicationState.ENTERED)) {
      final IllegalStateException closed = new IllegalStateException("Application was closed while entering");
      releaseSession(closed);
      throw closed;
    }

    try {
      this.hooks.enter().onEnter(this);
    } catch (final Exception e) {
      LOGGER.debug("on-enter failed, releasing screen: {}", e.getMessage());
      releaseSession(e);
      this.state.set(ApplicationState.EXITED);
      throw e;
    }

    LOGGER.debug("Application entered (fps={}, keypad={})", this.config.fps(), this.config.keypad());
    return this;
  }

  /**
   * Runs one tick: reads a key, runs on-update with it and refreshes the screen.
   *
   * @throws IllegalStateException if the application is not entered or already exited
   * @throws Exception if reading, on-update or refreshing fails
   */
  public void update() throws Exception {
    final ApplicationState current = this.state.get();
    if ((current != ApplicationState.ENTERED && current != ApplicationState.RUNNING) || this.closeCalled.get()) {
      throw new IllegalStateException("Cannot update application in state " + current);
    }
    this.state.compareAndSet(ApplicationState.ENTERED, ApplicationState.RUNNING);

    final ScreenSession s = this.session;
    try {
      final OptionalInt key = s.readKey();
      this.hooks.update().onUpdate(this, key);
      s.refresh();
    } catch (final Exception | Error e) {
      if (this.config.exitOnUpdateFailure()) {
        requestExit();
      }
      throw e;
    }
  }

  /**
   * Runs {@link #update()} at the configured rate on the calling thread until the exit is requested.
   *
   * @return number of ticks run
   * @throws Exception if an update fails or the thread is interrupted between frames
   */
  public long runLoop() throws Exception {
    return new PacedLoop(this.config.frameBudget(), this.exitSignal).run(this::update);
  }

  @Override
  public void requestExit() {
    this.exitSignal.requestExit();
  }

  @Override
  public boolean isExitRequested() {
    return this.exitSignal.isRequested();
  }

  /**
   * Blocks until the exit is requested or the timeout elapses.
   *
   * @param timeout maximum time to wait
   * @param unit unit of the timeout
   * @return true if the exit was requested
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean awaitExitRequest(final long timeout, final TimeUnit unit) throws InterruptedException {
    return this.exitSignal.await(timeout, unit);
  }

  @Override
  public Screen screen() {
    final ScreenSession s = this.session;
    if (s == null) {
      throw new IllegalStateException("Screen is not acquired in state " + this.state.get());
    }
    return s;
  }

  public ApplicationState state() {
    return this.state.get();
  }

  public ApplicationConfig config() {
    return this.config;
  }

  ExitSignal exitSignal() {
    return this.exitSignal;
  }

  /**
   * Runs on-exit and releases the screen, then moves to {@link ApplicationState#EXITED}. Only the first call has
   * an effect; an application that was never entered just moves to {@link ApplicationState#EXITED}.
   *
   * @throws Exception if on-exit fails (the screen is still released) or the screen cannot be released
   */
  @Override
  public void close() throws Exception {
    if (!this.closeCalled.compareAndSet(false, true)) {
      return;
    }
    if (this.state.compareAndSet(ApplicationState.CREATED, ApplicationState.EXITED)) {
      LOGGER.debug("Application closed before it was entered");
      return;
    }
    if (this.state.get() == ApplicationState.EXITED) {
      return;
    }

    try {
      try {
        this.hooks.exit().onExit(this);
      } catch (final Exception e) {
        releaseSession(e);
        throw e;
      }
      releaseSession(null);
    } finally {
      this.state.set(ApplicationState.EXITED);
    }
    LOGGER.debug("Application exited");
  }

  /**
   * Releases the screen. A release failure is attached to {@code primary} when there is one, thrown otherwise.
   */
  private void releaseSession(final Exception primary) throws Exception {
    final ScreenSession s = this.session;
    if (s == null) {
      return;
    }
    try {
      s.close();
    } catch (final Exception e) {
      if (primary == null) {
        throw e;
      }
      primary.addSuppressed(e);
    }
  }
}
