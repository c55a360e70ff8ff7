package com.consullo.tui.screen;

import java.io.IOException;
import java.util.OptionalInt;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scoped ownership of the terminal screen.
 *
 * <p>
 * The screen is acquired by {@link #open(TerminalBackend, boolean)} and released by {@link #close()}. Use it in a
 * try-with-resources block so the terminal is restored on every exit path:
 * </p>
 *
 * <pre>
 * try (ScreenSession session = ScreenSession.open(backend, false)) {
 *   session.drawText(0, 0, "hello", TextStyle.BOLD);
 *   session.refresh();
 * }
 * </pre>
 *
 * @since 1.0
 */
public final class ScreenSession implements Screen, AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(ScreenSession.class);

  private final TerminalBackend backend;
  private final ScreenHandle handle;
  private final AtomicBoolean closed = new AtomicBoolean();

  private ScreenSession(final TerminalBackend backend, final ScreenHandle handle) {
    this.backend = backend;
    this.handle = handle;
  }

  /**
   * Acquires the screen.
   *
   * @param backend terminal-control backend
   * @param keypad if true, extended keys are decoded into single key codes
   * @return open session
   * @throws ScreenUnavailableException if the screen is already held or the terminal cannot be configured
   */
  public static ScreenSession open(final TerminalBackend backend, final boolean keypad)
      throws ScreenUnavailableException {
    Validate.notNull(backend, "backend must not be null");

    final ScreenHandle handle = backend.acquire(keypad);
    if (handle == null) {
      throw new ScreenUnavailableException("Terminal backend returned no screen handle.");
    }
    LOGGER.debug("Screen acquired (keypad={})", keypad);
    return new ScreenSession(backend, handle);
  }

  @Override
  public OptionalInt readKey() throws IOException {
    ensureOpen();
    return this.handle.readKey();
  }

  @Override
  public void drawText(final int row, final int col, final String text, final TextStyle style) throws IOException {
    Validate.isTrue(row >= 0, "row must not be negative");
    Validate.isTrue(col >= 0, "col must not be negative");
    Validate.notNull(text, "text must not be null");
    Validate.notNull(style, "style must not be null");
    ensureOpen();
    this.handle.drawText(row, col, text, style);
  }

  @Override
  public void refresh() throws IOException {
    ensureOpen();
    this.handle.refresh();
  }

  public boolean isOpen() {
    return !this.closed.get();
  }

  /**
   * Releases the screen. Only the first call has an effect.
   *
   * @throws Exception if the terminal cannot be restored
   */
  @Override
  public void close() throws Exception {
    if (!this.closed.compareAndSet(false, true)) {
      return;
    }
    try {
      this.backend.release(this.handle);
      LOGGER.debug("Screen released");
    } catch (final Exception e) {
      LOGGER.warn("Screen release failed: {}", e.getMessage(), e);
      throw e;
    }
  }

  private void ensureOpen() {
    if (this.closed.get()) {
      throw new IllegalStateException("Screen session is closed.");
    }
  }
}
