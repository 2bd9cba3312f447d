package com.zenlib.util;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a task to completion on a dedicated thread with a requested stack size, blocking the caller until it finishes.
 * <p>
 * Whatever the task throws is re-thrown on the calling thread with its original type.
 */
public class LargeStack {

  private static final Logger LOGGER = LoggerFactory.getLogger(LargeStack.class);
  private static final AtomicInteger THREAD_COUNT = new AtomicInteger();

  private LargeStack() {}

  /**
   * Returns the result of {@code task} computed on a new thread with {@code stackSize} bytes of stack.
   *
   * @throws IllegalArgumentException if {@code stackSize} is not positive
   */
  public static <T> T run(long stackSize, Supplier<T> task) {
    if (stackSize <= 0) {
      throw new IllegalArgumentException("stack size must be positive, got " + stackSize);
    }
    AtomicReference<T> result = new AtomicReference<>();
    AtomicReference<Throwable> failure = new AtomicReference<>();
    String parentStage = LogUtil.getStage();
    Thread thread = new Thread(null, () -> {
      LogUtil.setStage(parentStage);
      try {
        result.set(task.get());
      } catch (Throwable e) { // NOSONAR - handed back to the caller
        failure.set(e);
      } finally {
        LogUtil.clearStage();
      }
    }, "zen-large-stack-" + THREAD_COUNT.incrementAndGet(), stackSize);
    LOGGER.trace("Starting {} with {} of stack", thread.getName(), Format.defaultInstance().storage(stackSize));
    thread.start();
    try {
      thread.join();
    } catch (InterruptedException e) {
      thread.interrupt();
      return Exceptions.rethrow(e);
    }
    if (failure.get() != null) {
      return Exceptions.rethrow(failure.get());
    }
    return result.get();
  }
}
