package com.consullo.tui.screen.jline;

import com.consullo.tui.screen.ScreenHandle;
import com.consullo.tui.screen.TextStyle;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.OptionalInt;
import org.jline.terminal.Attributes;
import org.jline.terminal.Terminal;
import org.jline.utils.AttributedString;
import org.jline.utils.AttributedStyle;
import org.jline.utils.InfoCmp.Capability;
import org.jline.utils.NonBlockingReader;

/**
 * {@link ScreenHandle} over a JLine {@link Terminal} in raw mode.
 *
 * <p>
 * Drawing is written to the terminal writer and becomes visible on {@link #refresh()}, which flushes it. Key reads
 * use the non-blocking reader with a 1 ms timeout.
 * </p>
 */
final class JLineScreenHandle implements ScreenHandle {

  static final long READ_TIMEOUT_MILLIS = 1L;

  private final Terminal terminal;
  private final Attributes savedAttributes;
  private final boolean keypad;
  private final KeypadDecoder decoder;
  private final Deque<Integer> pending = new ArrayDeque<>();

  JLineScreenHandle(final Terminal terminal, final Attributes savedAttributes, final boolean keypad) {
    this.terminal = terminal;
    this.savedAttributes = savedAttributes;
    this.keypad = keypad;
    this.decoder = keypad ? KeypadDecoder.forTerminal(terminal) : null;
  }

  @Override
  public OptionalInt readKey() throws IOException {
    if (!this.pending.isEmpty()) {
      return OptionalInt.of(this.pending.removeFirst());
    }

    final NonBlockingReader reader = this.terminal.reader();
    final int c = reader.read(READ_TIMEOUT_MILLIS);
    if (c < 0) {
      // READ_EXPIRED or EOF
      return OptionalInt.empty();
    }
    if (this.decoder == null) {
      return OptionalInt.of(c);
    }
    return OptionalInt.of(this.decoder.decode(c, reader::read, this.pending));
  }

  @Override
  public void drawText(final int row, final int col, final String text, final TextStyle style) {
    this.terminal.puts(Capability.cursor_address, row, col);
    this.terminal.writer().write(new AttributedString(text, toAttributedStyle(style)).toAnsi(this.terminal));
  }

  @Override
  public void refresh() {
    this.terminal.flush();
  }

  Terminal terminal() {
    return this.terminal;
  }

  Attributes savedAttributes() {
    return this.savedAttributes;
  }

  boolean keypad() {
    return this.keypad;
  }

  static AttributedStyle toAttributedStyle(final TextStyle style) {
    AttributedStyle s = AttributedStyle.DEFAULT;
    if (style.bold()) {
      s = s.bold();
    }
    if (style.underline()) {
      s = s.underline();
    }
    return s;
  }
}
