package com.consullo.tui.screen.jline;

import com.consullo.tui.screen.Keys;
import java.io.IOException;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.apache.commons.lang3.Validate;
import org.jline.terminal.Terminal;
import org.jline.utils.Curses;
import org.jline.utils.InfoCmp.Capability;

/**
 * Decodes terminal escape sequences of extended keys into single key codes.
 *
 * <p>
 * After the first character of a known sequence arrives, following characters are read with a short timeout
 * while they still extend a known sequence. A complete match yields the mapped {@link Keys} code. Anything else
 * yields the first character, and the remaining characters are queued so the caller returns them one by one.
 * </p>
 *
 * @since 1.0
 */
public final class KeypadDecoder {

  /**
   * Milliseconds to wait for the next character of a started sequence.
   */
  static final long SEQUENCE_TIMEOUT_MILLIS = 25L;

  /**
   * Source of characters; returns a negative value on timeout or end of input.
   */
  @FunctionalInterface
  public interface CharSource {

    int read(long timeoutMillis) throws IOException;
  }

  private final Map<String, Integer> sequences;
  private final Set<String> prefixes = new HashSet<>();

  /**
   * Creates a decoder over the given sequences.
   *
   * @param sequences escape sequence to key code
   */
  public KeypadDecoder(final Map<String, Integer> sequences) {
    Validate.notNull(sequences, "sequences must not be null");
    this.sequences = Collections.unmodifiableMap(new HashMap<>(sequences));
    for (String seq : this.sequences.keySet()) {
      Validate.isTrue(!seq.isEmpty(), "sequences must not contain an empty sequence");
      for (int i = 1; i < seq.length(); i++) {
        this.prefixes.add(seq.substring(0, i));
      }
    }
  }

  /**
   * Creates a decoder for the terminal's key capabilities, completed with the common ANSI/xterm sequences in both
   * normal and application cursor mode.
   *
   * @param terminal terminal
   * @return decoder
   */
  public static KeypadDecoder forTerminal(final Terminal terminal) {
    Validate.notNull(terminal, "terminal must not be null");

    final Map<String, Integer> seqs = new LinkedHashMap<>(64);
    putAnsiDefaults(seqs);

    putCapability(seqs, terminal, Capability.key_up, Keys.UP);
    putCapability(seqs, terminal, Capability.key_down, Keys.DOWN);
    putCapability(seqs, terminal, Capability.key_left, Keys.LEFT);
    putCapability(seqs, terminal, Capability.key_right, Keys.RIGHT);
    putCapability(seqs, terminal, Capability.key_home, Keys.HOME);
    putCapability(seqs, terminal, Capability.key_end, Keys.END);
    putCapability(seqs, terminal, Capability.key_backspace, Keys.BACKSPACE);
    putCapability(seqs, terminal, Capability.key_dc, Keys.DELETE);
    putCapability(seqs, terminal, Capability.key_ic, Keys.INSERT);
    putCapability(seqs, terminal, Capability.key_npage, Keys.PAGE_DOWN);
    putCapability(seqs, terminal, Capability.key_ppage, Keys.PAGE_UP);

    final Capability[] functionKeys = {
        Capability.key_f1, Capability.key_f2, Capability.key_f3, Capability.key_f4,
        Capability.key_f5, Capability.key_f6, Capability.key_f7, Capability.key_f8,
        Capability.key_f9, Capability.key_f10, Capability.key_f11, Capability.key_f12
    };
    for (int i = 0; i < functionKeys.length; i++) {
      putCapability(seqs, terminal, functionKeys[i], Keys.function(i + 1));
    }

    return new KeypadDecoder(seqs);
  }

  /**
   * Decodes the key starting with {@code first}.
   *
   * @param first first character, already read
   * @param source source for the following characters
   * @param pending queue receiving characters read but not consumed by the decoded key
   * @return key code
   * @throws IOException if reading from the source fails
   */
  public int decode(final int first, final CharSource source, final Deque<Integer> pending) throws IOException {
    final StringBuilder seq = new StringBuilder(8);
    seq.append((char) first);

    while (this.prefixes.contains(seq.toString())) {
      final int next = source.read(SEQUENCE_TIMEOUT_MILLIS);
      if (next < 0) {
        break;
      }
      seq.append((char) next);
    }

    final Integer code = this.sequences.get(seq.toString());
    if (code != null) {
      return code;
    }
    for (int i = 1; i < seq.length(); i++) {
      pending.addLast((int) seq.charAt(i));
    }
    return seq.charAt(0);
  }

  int sequenceCount() {
    return this.sequences.size();
  }

  private static void putCapability(final Map<String, Integer> seqs, final Terminal terminal,
      final Capability capability, final int code) {
    final String raw = terminal.getStringCapability(capability);
    if (raw == null) {
      return;
    }
    final String seq = Curses.tputs(raw);
    if (seq != null && !seq.isEmpty()) {
      seqs.put(seq, code);
    }
  }

  private static void putAnsiDefaults(final Map<String, Integer> seqs) {
    // CSI (normal cursor mode) and SS3 (application cursor mode) forms.
    for (String intro : new String[] { "\u001b[", "\u001bO" }) {
      seqs.put(intro + "A", Keys.UP);
      seqs.put(intro + "B", Keys.DOWN);
      seqs.put(intro + "C", Keys.RIGHT);
      seqs.put(intro + "D", Keys.LEFT);
      seqs.put(intro + "H", Keys.HOME);
      seqs.put(intro + "F", Keys.END);
    }
    seqs.put("\u001bOP", Keys.function(1));
    seqs.put("\u001bOQ", Keys.function(2));
    seqs.put("\u001bOR", Keys.function(3));
    seqs.put("\u001bOS", Keys.function(4));
    seqs.put("\u001b[1~", Keys.HOME);
    seqs.put("\u001b[2~", Keys.INSERT);
    seqs.put("\u001b[3~", Keys.DELETE);
    seqs.put("\u001b[4~", Keys.END);
    seqs.put("\u001b[5~", Keys.PAGE_UP);
    seqs.put("\u001b[6~", Keys.PAGE_DOWN);
  }
}
