package com.zenlib.util;

import com.zenlib.ContractViolationException;
import com.zenlib.InternalInvariantException;

/**
 * Argument and state checks that raise the library's own exception types.
 */
public final class Contract {

  private Contract() {}

  /**
   * Returns {@code value} or throws {@link ContractViolationException} naming {@code what} if it is {@code null}.
   */
  public static <T> T notNull(T value, String what) {
    if (value == null) {
      throw new ContractViolationException(what + " must not be null");
    }
    return value;
  }

  /** Throws {@link ContractViolationException} with a formatted message unless {@code condition} holds. */
  public static void check(boolean condition, String format, Object... args) {
    if (!condition) {
      throw new ContractViolationException(format.formatted(args));
    }
  }

  /** Returns the exception to throw when a visitor reaches a state that can not happen. */
  public static InternalInvariantException unreachable(String format, Object... args) {
    return new InternalInvariantException("internal invariant violated: " + format.formatted(args));
  }
}
