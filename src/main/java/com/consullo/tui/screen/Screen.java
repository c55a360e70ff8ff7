package com.consullo.tui.screen;

import java.io.IOException;
import java.util.OptionalInt;

/**
 * Drawing and input view over the terminal screen, handed to application hooks.
 *
 * <p>All calls must be made from the thread that currently owns the screen: the controlling thread during
 * on-enter and on-exit, the update thread while the update loop runs.
 *
 * @since 1.0
 */
public interface Screen {

  /**
   * Reads one pending key without blocking.
   *
   * @return key code, or empty when no input is pending
   * @throws IOException if the terminal input cannot be read
   */
  OptionalInt readKey() throws IOException;

  /**
   * Draws text at the given position. The text becomes visible on the next {@link #refresh()}.
   *
   * @param row zero-based row
   * @param col zero-based column
   * @param text text to draw
   * @param style text style
   * @throws IOException if the terminal output cannot be written
   */
  void drawText(int row, int col, String text, TextStyle style) throws IOException;

  /**
   * Draws text in the normal style.
   *
   * @param row zero-based row
   * @param col zero-based column
   * @param text text to draw
   * @throws IOException if the terminal output cannot be written
   */
  default void drawText(final int row, final int col, final String text) throws IOException {
    drawText(row, col, text, TextStyle.NORMAL);
  }

  /**
   * Flushes pending drawing to the terminal.
   *
   * @throws IOException if the terminal output cannot be flushed
   */
  void refresh() throws IOException;
}
