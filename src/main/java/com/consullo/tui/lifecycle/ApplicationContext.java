package com.consullo.tui.lifecycle;

import com.consullo.tui.screen.Screen;

/**
 * What a lifecycle hook can reach: the screen and the exit request.
 *
 * @since 1.0
 */
public interface ApplicationContext {

  Screen screen();

  /**
   * Requests the exit. Safe from any thread, including from inside a hook.
   */
  void requestExit();

  boolean isExitRequested();
}
