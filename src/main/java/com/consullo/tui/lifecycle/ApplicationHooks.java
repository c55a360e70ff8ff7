package com.consullo.tui.lifecycle;

import java.util.OptionalInt;

/**
 * Lifecycle hooks of an application. Every hook is optional; an unset hook does nothing.
 *
 * <pre>
 * ApplicationHooks hooks = ApplicationHooks.builder()
 *     .onEnter(ctx -&gt; ctx.screen().drawText(0, 0, "ready"))
 *     .onUpdate((ctx, key) -&gt; {
 *       if (key.isPresent() &amp;&amp; key.getAsInt() == Keys.ESCAPE) {
 *         ctx.requestExit();
 *       }
 *     })
 *     .build();
 * </pre>
 *
 * @since 1.0
 */
public final class ApplicationHooks {

  /**
   * Runs once after the screen is acquired, before the first update.
   */
  @FunctionalInterface
  public interface EnterHook {

    void onEnter(ApplicationContext context) throws Exception;
  }

  /**
   * Runs once per tick with the key read for that tick, or empty if none was pending.
   */
  @FunctionalInterface
  public interface UpdateHook {

    void onUpdate(ApplicationContext context, OptionalInt key) throws Exception;
  }

  /**
   * Runs once before the screen is released.
   */
  @FunctionalInterface
  public interface ExitHook {

    void onExit(ApplicationContext context) throws Exception;
  }

  private static final EnterHook NO_ENTER = context -> { };
  private static final UpdateHook NO_UPDATE = (context, key) -> { };
  private static final ExitHook NO_EXIT = context -> { };

  private static final ApplicationHooks NONE = builder().build();

  private final EnterHook enter;
  private final UpdateHook update;
  private final ExitHook exit;

  private ApplicationHooks(final Builder b) {
    this.enter = b.enter;
    this.update = b.update;
    this.exit = b.exit;
  }

  public static ApplicationHooks none() {
    return NONE;
  }

  public static Builder builder() {
    return new Builder();
  }

  public EnterHook enter() {
    return this.enter;
  }

  public UpdateHook update() {
    return this.update;
  }

  public ExitHook exit() {
    return this.exit;
  }

  public static final class Builder {

    private EnterHook enter = NO_ENTER;
    private UpdateHook update = NO_UPDATE;
    private ExitHook exit = NO_EXIT;

    private Builder() {
    }

    public Builder onEnter(final EnterHook hook) {
      this.enter = hook != null ? hook : NO_ENTER;
      return this;
    }

    public Builder onUpdate(final UpdateHook hook) {
      this.update = hook != null ? hook : NO_UPDATE;
      return this;
    }

    public Builder onExit(final ExitHook hook) {
      this.exit = hook != null ? hook : NO_EXIT;
      return this;
    }

    public ApplicationHooks build() {
      return new ApplicationHooks(this);
    }
  }
}
