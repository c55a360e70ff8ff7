package com.consullo.tui.screen;

import org.apache.commons.lang3.Validate;

/**
 * Key codes returned by {@link Screen#readKey()}.
 *
 * <p>Plain characters are returned as their character code. Extended keys, decoded only when keypad mode is
 * enabled, use the curses numbering so that code written against curses key constants keeps working.
 *
 * @since 1.0
 */
public final class Keys {

  public static final int ESCAPE = 27;

  public static final int DOWN = 258;
  public static final int UP = 259;
  public static final int LEFT = 260;
  public static final int RIGHT = 261;
  public static final int HOME = 262;
  public static final int BACKSPACE = 263;
  public static final int F0 = 264;
  public static final int DELETE = 330;
  public static final int INSERT = 331;
  public static final int PAGE_DOWN = 338;
  public static final int PAGE_UP = 339;
  public static final int END = 360;

  private Keys() {
  }

  /**
   * Returns the key code of function key {@code n}.
   *
   * @param n function key number, 0..63
   * @return key code
   */
  public static int function(final int n) {
    Validate.inclusiveBetween(0, 63, n, "function key number must be in 0..63");
    return F0 + n;
  }
}
