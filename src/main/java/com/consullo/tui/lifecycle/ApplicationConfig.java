package com.consullo.tui.lifecycle;

import org.apache.commons.lang3.Validate;

/**
 * Construction-time configuration of an {@link Application} or {@link ThreadedApplication}.
 *
 * @param fps target update rate in frames per second, positive
 * @param keypad if true, extended keys are decoded into single key codes
 * @param exitOnUpdateFailure if true, a failing on-update hook also requests the exit before the failure
 *     propagates, so a controlling thread waiting on the exit request wakes up
 * @param workerName name of the update thread of a {@link ThreadedApplication}
 * @since 1.0
 */
public record ApplicationConfig(
    double fps,
    boolean keypad,
    boolean exitOnUpdateFailure,
    String workerName) {

  public static final double DEFAULT_FPS = 30.0;
  public static final String DEFAULT_WORKER_NAME = "tui-update-worker";

  public ApplicationConfig {
    Validate.isTrue(fps > 0 && Double.isFinite(fps), "fps must be positive and finite: %s", fps);
    Validate.notBlank(workerName, "workerName must not be blank");
  }

  /**
   * Returns the default configuration: 30 fps, keypad off, exit on update failure, default worker name.
   *
   * @return default configuration
   */
  public static ApplicationConfig defaults() {
    return new ApplicationConfig(DEFAULT_FPS, false, true, DEFAULT_WORKER_NAME);
  }

  public ApplicationConfig withFps(final double newFps) {
    return new ApplicationConfig(newFps, this.keypad, this.exitOnUpdateFailure, this.workerName);
  }

  public ApplicationConfig withKeypad(final boolean newKeypad) {
    return new ApplicationConfig(this.fps, newKeypad, this.exitOnUpdateFailure, this.workerName);
  }

  public ApplicationConfig withExitOnUpdateFailure(final boolean newExitOnUpdateFailure) {
    return new ApplicationConfig(this.fps, this.keypad, newExitOnUpdateFailure, this.workerName);
  }

  public ApplicationConfig withWorkerName(final String newWorkerName) {
    return new ApplicationConfig(this.fps, this.keypad, this.exitOnUpdateFailure, newWorkerName);
  }

  public FrameBudget frameBudget() {
    return FrameBudget.ofFps(this.fps);
  }
}
