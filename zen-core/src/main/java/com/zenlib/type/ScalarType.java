package com.zenlib.type;

import com.zenlib.ContractViolationException;

/**
 * A type whose values are a single immutable Java object: booleans, strings and arbitrary-precision integers.
 */
public record ScalarType<T>(String name, Class<T> javaType, T defaultValue, boolean isArithmetic)
  implements ExprType<T> {

  @Override
  public T checkValue(Object value) {
    if (!javaType.isInstance(value)) {
      throw new ContractViolationException("expected a %s value but got %s".formatted(name, value));
    }
    return javaType.cast(value);
  }

  @Override
  public String toString() {
    return name;
  }
}
