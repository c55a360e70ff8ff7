package com.consullo.tui.screen;

/**
 * Thrown when the terminal screen cannot be acquired, either because another session already holds it or because
 * the terminal cannot be placed into the required mode.
 *
 * @since 1.0
 */
public class ScreenUnavailableException extends Exception {

  private static final long serialVersionUID = 1L;

  public ScreenUnavailableException(final String message) {
    super(message);
  }

  public ScreenUnavailableException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
