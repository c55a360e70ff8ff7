package com.consullo.tui.screen;

/**
 * Exclusive ownership of the process-wide terminal screen, issued by {@link TerminalBackend#acquire(boolean)} and
 * returned through {@link TerminalBackend#release(ScreenHandle)}.
 *
 * <p>Implementations are not thread-safe. At most one live handle exists per process.
 *
 * @since 1.0
 */
public interface ScreenHandle extends Screen {
}
