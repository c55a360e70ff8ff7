package com.consullo.tui.demo;

import com.consullo.tui.lifecycle.Application;
import com.consullo.tui.lifecycle.ApplicationConfig;
import com.consullo.tui.lifecycle.ApplicationContext;
import com.consullo.tui.lifecycle.ApplicationHooks;
import com.consullo.tui.screen.Keys;
import com.consullo.tui.screen.Screen;
import com.consullo.tui.screen.TextStyle;
import com.consullo.tui.screen.jline.JLineTerminalBackend;
import java.util.OptionalInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves a coordinate with W/A/S/D or the arrow keys, on the main thread. ESC exits.
 *
 * @since 1.0
 */
public final class MoveControlDemo {

  private static final Logger LOGGER = LoggerFactory.getLogger(MoveControlDemo.class);

  private int x;
  private int y;

  MoveControlDemo() {
  }

  /**
   * Demo entry point.
   *
   * @param args args
   * @throws Exception if the terminal cannot be used
   */
  public static void main(final String[] args) throws Exception {
    final MoveControlDemo demo = new MoveControlDemo();
    final ApplicationHooks hooks = ApplicationHooks.builder()
        .onEnter(demo::drawLayout)
        .onUpdate(demo::handleKey)
        .build();

    final ApplicationConfig config = ApplicationConfig.defaults().withKeypad(true);
    try (Application app = new Application(new JLineTerminalBackend(), config, hooks).enter()) {
      final long ticks = app.runLoop();
      LOGGER.info("Move control demo finished after {} ticks", ticks);
    }
  }

  void drawLayout(final ApplicationContext ctx) throws Exception {
    final Screen screen = ctx.screen();
    screen.drawText(0, 7, "Movement Control", TextStyle.BOLD_UNDERLINE);
    screen.drawText(3, 2, "X coordinate:");
    screen.drawText(4, 2, "Y coordinate:");
    drawCoordinates(screen);
    screen.drawText(7, 2, "Keyboard Controls:", TextStyle.BOLD);
    screen.drawText(8, 4, "W/S - Move up/down");
    screen.drawText(9, 4, "A/D - Move left/right");
    screen.drawText(10, 4, "ESC - Exit app", TextStyle.BOLD);
  }

  void handleKey(final ApplicationContext ctx, final OptionalInt key) throws Exception {
    if (key.isEmpty()) {
      return;
    }
    switch (key.getAsInt()) {
      case Keys.ESCAPE:
        ctx.requestExit();
        return;
      case 'w':
      case 'W':
      case Keys.UP:
        this.y--;
        break;
      case 's':
      case 'S':
      case Keys.DOWN:
        this.y++;
        break;
      case 'a':
      case 'A':
      case Keys.LEFT:
        this.x--;
        break;
      case 'd':
      case 'D':
      case Keys.RIGHT:
        this.x++;
        break;
      default:
        return;
    }
    drawCoordinates(ctx.screen());
  }

  int x() {
    return this.x;
  }

  int y() {
    return this.y;
  }

  private void drawCoordinates(final Screen screen) throws Exception {
    screen.drawText(3, 16, String.format("%12d", this.x));
    screen.drawText(4, 16, String.format("%12d", this.y));
  }
}
