package com.zenlib;

/**
 * Thrown when an expression is built from arguments that break the construction contract of its node kind, for
 * example a {@code null} child or operands of mismatched types.
 * <p>
 * Raised eagerly when the node is built. The exception is a list match whose cons case rebuilds the match itself,
 * which is only detected when the match is simplified or evaluated.
 */
public class ContractViolationException extends ZenException {

  public ContractViolationException(String message) {
    super(message);
  }
}
