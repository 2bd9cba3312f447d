package com.zenlib;

/**
 * Thrown when the library reaches a state that its own invariants rule out. Indicates a bug in the library rather
 * than a misuse of its API.
 */
public class InternalInvariantException extends ZenException {

  public InternalInvariantException(String message) {
    super(message);
  }
}
