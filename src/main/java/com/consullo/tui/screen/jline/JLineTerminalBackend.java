package com.consullo.tui.screen.jline;

import com.consullo.tui.screen.ScreenHandle;
import com.consullo.tui.screen.ScreenUnavailableException;
import com.consullo.tui.screen.TerminalBackend;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.commons.lang3.Validate;
import org.jline.terminal.Attributes;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.jline.utils.InfoCmp.Capability;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link TerminalBackend} implemented with JLine.
 *
 * <p>
 * On acquisition the terminal is switched to the alternate screen, cleared, put into raw mode (no echo, no
 * canonical line editing, signals still delivered) and the cursor is hidden. Release undoes these steps in reverse
 * order and closes the terminal.
 * </p>
 *
 * <p>
 * The terminal screen is a process-wide resource: at most one handle exists at a time across all backend
 * instances.
 * </p>
 *
 * @since 1.0
 */
public final class JLineTerminalBackend implements TerminalBackend {

  private static final Logger LOGGER = LoggerFactory.getLogger(JLineTerminalBackend.class);

  private static final AtomicBoolean SCREEN_HELD = new AtomicBoolean();

  /**
   * Creates the terminal for one acquisition.
   */
  @FunctionalInterface
  public interface TerminalFactory {

    Terminal create() throws IOException;
  }

  private final TerminalFactory terminalFactory;

  /**
   * Creates a backend over the process's system terminal.
   */
  public JLineTerminalBackend() {
    this(() -> TerminalBuilder.builder()
        .system(true)
        .build());
  }

  /**
   * Creates a backend over terminals produced by the given factory.
   *
   * @param terminalFactory terminal factory
   */
  public JLineTerminalBackend(final TerminalFactory terminalFactory) {
    Validate.notNull(terminalFactory, "terminalFactory must not be null");
    this.terminalFactory = terminalFactory;
  }

  /**
   * Returns true while some handle holds the screen.
   *
   * @return true if the screen is held
   */
  public static boolean isScreenHeld() {
    return SCREEN_HELD.get();
  }

  @Override
  public ScreenHandle acquire(final boolean keypad) throws ScreenUnavailableException {
    if (!SCREEN_HELD.compareAndSet(false, true)) {
      throw new ScreenUnavailableException("Terminal screen is already held by another session.");
    }

    Terminal terminal = null;
    Attributes saved = null;
    try {
      terminal = this.terminalFactory.create();
      if (terminal == null) {
        throw new ScreenUnavailableException("Terminal factory returned no terminal.");
      }
      if (terminal.getStringCapability(Capability.cursor_address) == null) {
        throw new ScreenUnavailableException(
            "Terminal '" + terminal.getType() + "' does not support cursor addressing.");
      }

      saved = terminal.enterRawMode();
      terminal.puts(Capability.enter_ca_mode);
      terminal.puts(Capability.clear_screen);
      terminal.puts(Capability.cursor_invisible);
      if (keypad) {
        terminal.puts(Capability.keypad_xmit);
      }
      terminal.flush();

      LOGGER.debug("Acquired terminal '{}' (keypad={})", terminal.getType(), keypad);
      return new JLineScreenHandle(terminal, saved, keypad);
    } catch (final ScreenUnavailableException e) {
      abandon(terminal, saved, e);
      throw e;
    } catch (final IOException | RuntimeException e) {
      final ScreenUnavailableException failure =
          new ScreenUnavailableException("Failed to configure terminal: " + e.getMessage(), e);
      abandon(terminal, saved, failure);
      throw failure;
    }
  }

  @Override
  public void release(final ScreenHandle handle) throws Exception {
    Validate.isInstanceOf(JLineScreenHandle.class, handle, "handle was not issued by this backend");

    final JLineScreenHandle jlineHandle = (JLineScreenHandle) handle;
    final Terminal terminal = jlineHandle.terminal();
    try {
      try {
        if (jlineHandle.keypad()) {
          terminal.puts(Capability.keypad_local);
        }
        terminal.puts(Capability.cursor_normal);
        terminal.puts(Capability.exit_ca_mode);
        terminal.flush();
      } finally {
        terminal.setAttributes(jlineHandle.savedAttributes());
      }
      terminal.close();
      LOGGER.debug("Released terminal '{}'", terminal.getType());
    } finally {
      SCREEN_HELD.set(false);
    }
  }

  private static void abandon(final Terminal terminal, final Attributes saved, final Exception cause) {
    try {
      if (terminal != null) {
        if (saved != null) {
          terminal.setAttributes(saved);
        }
        terminal.close();
      }
    } catch (final IOException | RuntimeException e) {
      cause.addSuppressed(e);
    } finally {
      SCREEN_HELD.set(false);
    }
  }
}
