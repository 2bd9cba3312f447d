package com.zenlib.type;

import java.math.BigInteger;

/**
 * Static type of an expression, and the Java representation of its concrete values.
 * <p>
 * Types compare structurally, two separately built {@link ObjectType ObjectTypes} with the same name and fields are
 * the same type.
 *
 * @param <T> Java type of concrete values of this type
 */
public interface ExprType<T> {

  ScalarType<Boolean> BOOL = new ScalarType<>("bool", Boolean.class, false, false);
  ScalarType<String> STRING = new ScalarType<>("string", String.class, "", false);
  ScalarType<BigInteger> BIG_INTEGER = new ScalarType<>("bigint", BigInteger.class, BigInteger.ZERO, true);

  IntType INT8 = new IntType("int8", 8, true);
  IntType UINT8 = new IntType("uint8", 8, false);
  IntType INT16 = new IntType("int16", 16, true);
  IntType UINT16 = new IntType("uint16", 16, false);
  IntType INT32 = new IntType("int32", 32, true);
  IntType UINT32 = new IntType("uint32", 32, false);
  IntType INT64 = new IntType("int64", 64, true);
  IntType UINT64 = new IntType("uint64", 64, false);

  /** Returns the name used when printing expressions of this type. */
  String name();

  /** Returns the value an unconstrained expression of this type evaluates to. */
  T defaultValue();

  /**
   * Returns {@code value} as a value of this type.
   *
   * @throws com.zenlib.ContractViolationException if {@code value} is not a valid value of this type
   */
  T checkValue(Object value);

  /** Returns true if sum, difference, product, min, max and ordered comparisons apply to this type. */
  default boolean isArithmetic() {
    return false;
  }

  /** Returns true for fixed-width integers, the only types that support bitwise operations. */
  default boolean isFixedWidth() {
    return false;
  }

  /** Returns a list type whose elements have this type. */
  default ListType<T> list() {
    return new ListType<>(this);
  }
}
