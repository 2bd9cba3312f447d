package com.zenlib.util;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Exception-handling utilities.
 */
public class Exceptions {
  private Exceptions() {}

  /**
   * Re-throw an exception caught on another thread, handling interrupts and wrapping checked exceptions so runtime
   * exceptions and errors reach the caller with their original type.
   *
   * @param exception The original exception
   * @param <T>       Return type if caller requires it
   */
  public static <T> T rethrow(Throwable exception) {
    if (exception instanceof InterruptedException) {
      Thread.currentThread().interrupt();
    }
    if (exception instanceof RuntimeException runtimeException) {
      throw runtimeException;
    } else if (exception instanceof IOException ioe) {
      throw new UncheckedIOException(ioe);
    } else if (exception instanceof Error error) {
      throw error;
    }
    throw new IllegalStateException(exception);
  }
}
