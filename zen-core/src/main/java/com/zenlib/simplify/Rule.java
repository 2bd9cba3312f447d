package com.zenlib.simplify;

/** Rewrite rules of the {@link Simplifier}, counted in {@link SimplifierStats}. */
public enum Rule {
  /** {@code And(true, x) = x}, {@code And(false, x) = false} in either position. */
  AND_CONSTANT,
  /** {@code And(x, x) = x}. */
  AND_SAME,
  /** {@code Or(true, x) = true}, {@code Or(false, x) = x} in either position. */
  OR_CONSTANT,
  /** {@code Or(x, x) = x}. */
  OR_SAME,
  /** Operands of a commutative operator swapped into ascending id order. */
  COMMUTATIVE_ORDER,
  NOT_CONSTANT,
  /** {@code Not(Not(x)) = x}. */
  NOT_NOT,
  /** {@code If(true, a, b) = a}, {@code If(false, a, b) = b}. */
  IF_CONSTANT,
  /** {@code If(g, a, a) = a} for the same instance {@code a}. */
  IF_SAME_BRANCH,
  EQ_CONSTANT,
  COMPARE_CONSTANT,
  ARITH_CONSTANT,
  /** {@code x+0}, {@code x-0}, {@code x*1} and {@code x*0}. */
  ARITH_IDENTITY,
  BITWISE_CONSTANT,
  /** {@code adapt(A<-B, adapt(B<-A, e)) = e}. */
  ADAPTER_FUSION,
  /** Adapter pushed into both branches of a conditional. */
  ADAPTER_IF,
  /** Field read from an update of the same field. */
  GET_WITH_SAME_FIELD,
  /** Field read skipping an update of another field. */
  GET_WITH_OTHER_FIELD,
  /** Field read pushed into both branches of a conditional. */
  GET_IF,
  /** Field read from an object constructor. */
  GET_CREATE,
  MATCH_EMPTY,
  /** One level of a list match unrolled over a cons cell. */
  MATCH_CONS,
  /** List match pushed into both branches of a conditional. */
  MATCH_IF
}
