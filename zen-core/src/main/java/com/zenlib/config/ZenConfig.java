package com.zenlib.config;

/**
 * Settings for simplification passes.
 *
 * @param largeStack whether to run each pass on a dedicated thread with {@code stackSize} bytes of stack
 * @param stackSize  stack size for the dedicated thread
 * @param logStats   whether to log a summary of each pass at INFO instead of DEBUG
 */
public record ZenConfig(
  boolean largeStack,
  long stackSize,
  boolean logStats
) {

  public static final String DEFAULT_STACK_SIZE = "256m";

  public ZenConfig {
    if (stackSize <= 0) {
      throw new IllegalArgumentException("simplify.stack-size must be positive, got " + stackSize);
    }
  }

  /** Returns the settings used when nothing is configured. */
  public static ZenConfig defaults() {
    return from(Arguments.of().silence());
  }

  /**
   * Returns settings from {@code zen.} JVM properties and {@code ZEN_} environmental variables, falling back to the
   * properties file named by {@code zen.config} or {@code ZEN_CONFIG}.
   */
  public static ZenConfig fromEnvironment() {
    return from(Arguments.fromArgsOrConfigFile());
  }

  public static ZenConfig from(Arguments arguments) {
    return new ZenConfig(
      arguments.getBoolean("simplify.large-stack",
        "run simplification on a thread with a large stack", false),
      arguments.getByteSize("simplify.stack-size", "stack size for large stack simplification", DEFAULT_STACK_SIZE),
      arguments.getBoolean("simplify.log-stats", "log a summary of each simplification pass", false)
    );
  }

  /** Returns a copy of these settings with the large stack enabled or disabled. */
  public ZenConfig withLargeStack(boolean enabled) {
    return new ZenConfig(enabled, stackSize, logStats);
  }
}
