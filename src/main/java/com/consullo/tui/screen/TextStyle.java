package com.consullo.tui.screen;

/**
 * Text attributes passed through to the terminal.
 *
 * @param bold bold attribute
 * @param underline underline attribute
 * @since 1.0
 */
public record TextStyle(
    boolean bold,
    boolean underline) {

  public static final TextStyle NORMAL = new TextStyle(false, false);
  public static final TextStyle BOLD = new TextStyle(true, false);
  public static final TextStyle UNDERLINE = new TextStyle(false, true);
  public static final TextStyle BOLD_UNDERLINE = new TextStyle(true, true);
}
