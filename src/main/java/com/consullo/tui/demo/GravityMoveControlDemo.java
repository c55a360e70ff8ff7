package com.consullo.tui.demo;

import com.consullo.tui.lifecycle.ApplicationConfig;
import com.consullo.tui.lifecycle.ApplicationContext;
import com.consullo.tui.lifecycle.ApplicationHooks;
import com.consullo.tui.lifecycle.ThreadedApplication;
import com.consullo.tui.screen.Keys;
import com.consullo.tui.screen.Screen;
import com.consullo.tui.screen.TextStyle;
import com.consullo.tui.screen.jline.JLineTerminalBackend;
import java.util.OptionalInt;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves a coordinate with W/A/S/D while the main thread pulls it down once per second. Updates run on the worker
 * thread; the position is shared between both threads under a lock. ESC exits.
 *
 * @since 1.0
 */
public final class GravityMoveControlDemo {

  private static final Logger LOGGER = LoggerFactory.getLogger(GravityMoveControlDemo.class);

  private final Object lock = new Object();

  private int x;
  private int y;

  GravityMoveControlDemo() {
  }

  /**
   * Demo entry point.
   *
   * @param args args
   * @throws Exception if the terminal cannot be used or the update loop fails
   */
  public static void main(final String[] args) throws Exception {
    final GravityMoveControlDemo demo = new GravityMoveControlDemo();
    final ApplicationHooks hooks = ApplicationHooks.builder()
        .onEnter(demo::drawLayout)
        .onUpdate(demo::handleKey)
        .build();

    try (ThreadedApplication app =
        new ThreadedApplication(new JLineTerminalBackend(), ApplicationConfig.defaults(), hooks).enter()) {
      while (!app.awaitExitRequest(1, TimeUnit.SECONDS)) {
        demo.fall();
      }
    }
    LOGGER.info("Gravity demo finished");
  }

  void fall() {
    synchronized (this.lock) {
      this.y++;
    }
  }

  void drawLayout(final ApplicationContext ctx) throws Exception {
    final Screen screen = ctx.screen();
    screen.drawText(0, 1, "Movement Control with Gravity", TextStyle.BOLD_UNDERLINE);
    screen.drawText(3, 2, "X coordinate:");
    screen.drawText(4, 2, "Y coordinate:");
    screen.drawText(7, 2, "Keyboard Controls:", TextStyle.BOLD);
    screen.drawText(8, 4, "W/S - Move up/down");
    screen.drawText(9, 4, "A/D - Move left/right");
    screen.drawText(10, 4, "ESC - Exit app", TextStyle.BOLD);
  }

  void handleKey(final ApplicationContext ctx, final OptionalInt key) throws Exception {
    final int shownX;
    final int shownY;
    synchronized (this.lock) {
      if (key.isPresent()) {
        switch (key.getAsInt()) {
          case Keys.ESCAPE:
            ctx.requestExit();
            return;
          case 'w':
          case 'W':
            this.y--;
            break;
          case 's':
          case 'S':
            this.y++;
            break;
          case 'a':
          case 'A':
            this.x--;
            break;
          case 'd':
          case 'D':
            this.x++;
            break;
          default:
            break;
        }
      }
      shownX = this.x;
      shownY = this.y;
    }

    // Redrawn every tick so the controlling thread's moves show up.
    ctx.screen().drawText(3, 16, String.format("%12d", shownX));
    ctx.screen().drawText(4, 16, String.format("%12d", shownY));
  }

  int y() {
    synchronized (this.lock) {
      return this.y;
    }
  }

  int x() {
    synchronized (this.lock) {
      return this.x;
    }
  }
}
