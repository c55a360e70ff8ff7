package com.consullo.tui.screen;

/**
 * Terminal-control collaborator owning the process-wide screen resource.
 *
 * <p>This interface isolates the lifecycle layer from a specific terminal library. The reference implementation
 * uses JLine ({@link com.consullo.tui.screen.jline.JLineTerminalBackend}); tests substitute in-memory backends.
 *
 * @since 1.0
 */
public interface TerminalBackend {

  /**
   * Acquires the screen and puts the terminal into application mode: raw input, no echo, non-blocking key reads
   * and a hidden cursor.
   *
   * @param keypad if true, extended keys (arrows, function keys, ...) are decoded into single key codes
   * @return handle owning the screen until released
   * @throws ScreenUnavailableException if the screen is already held or the terminal cannot be configured
   */
  ScreenHandle acquire(boolean keypad) throws ScreenUnavailableException;

  /**
   * Restores the terminal to the state captured by {@link #acquire(boolean)} and frees the screen.
   *
   * <p>The screen is freed even when restoring the terminal fails; the failure is still thrown.
   *
   * @param handle handle previously returned by {@link #acquire(boolean)}
   * @throws Exception if the terminal cannot be restored
   */
  void release(ScreenHandle handle) throws Exception;
}
