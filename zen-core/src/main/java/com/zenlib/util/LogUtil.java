package com.zenlib.util;

import java.util.function.Supplier;
import org.slf4j.MDC;

/**
 * Wrapper for SLF4j {@link MDC} log utility to prepend {@code [stage]} to log output.
 */
public class LogUtil {

  private LogUtil() {}

  private static final String STAGE_KEY = "stage";

  /** Prepends {@code [stage]} to all subsequent logs from this thread. */
  public static void setStage(String stage) {
    if (stage == null) {
      clearStage();
    } else {
      MDC.put(STAGE_KEY, "[%s] ".formatted(stage));
    }
  }

  /** Removes {@code [stage]} from subsequent logs from this thread. */
  public static void clearStage() {
    MDC.remove(STAGE_KEY);
  }

  /** Returns the current {@code [stage]} value prepended to log for this thread. */
  public static String getStage() {
    // strip out the "[stage] " wrapper
    String stage = MDC.get(STAGE_KEY);
    return stage == null ? null : stage.substring(1, stage.length() - 2);
  }

  /**
   * Runs {@code task} with {@code [parent:stage]} prepended to its logs, then restores the previous stage.
   */
  public static <T> T withStage(String stage, Supplier<T> task) {
    String parent = getStage();
    setStage(parent == null ? stage : parent + ":" + stage);
    try {
      return task.get();
    } finally {
      setStage(parent);
    }
  }
}
