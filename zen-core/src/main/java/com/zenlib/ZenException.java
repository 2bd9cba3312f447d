package com.zenlib;

/**
 * Base class of every error raised by the expression library.
 */
public class ZenException extends RuntimeException {

  public ZenException(String message) {
    super(message);
  }

  public ZenException(String message, Throwable cause) {
    super(message, cause);
  }
}
