package com.zenlib.interpret;

import com.zenlib.expression.VariableExpr;
import com.zenlib.util.Contract;
import java.util.HashMap;
import java.util.Map;

/**
 * Immutable assignment of concrete values to variables. Variables are matched by instance, and a variable without a
 * value evaluates to the default value of its type.
 */
public final class Environment {

  private static final Environment EMPTY = new Environment(Map.of());

  private final Map<VariableExpr<?>, Object> values;

  private Environment(Map<VariableExpr<?>, Object> values) {
    this.values = values;
  }

  public static Environment empty() {
    return EMPTY;
  }

  /**
   * Returns a copy of this environment that assigns {@code value} to {@code variable}.
   *
   * @throws com.zenlib.ContractViolationException if {@code value} is not a valid value of the variable's type
   */
  public <T> Environment with(VariableExpr<T> variable, Object value) {
    Contract.notNull(variable, "variable");
    T checked = variable.type().checkValue(value);
    Map<VariableExpr<?>, Object> updated = new HashMap<>(values);
    updated.put(variable, checked);
    return new Environment(Map.copyOf(updated));
  }

  /** Returns the value of {@code variable}, or the default value of its type if it has none. */
  @SuppressWarnings("unchecked")
  public <T> T get(VariableExpr<T> variable) {
    Object value = values.get(variable);
    return value == null ? variable.type().defaultValue() : (T) value;
  }

  public boolean isBound(VariableExpr<?> variable) {
    return values.containsKey(variable);
  }

  @Override
  public String toString() {
    StringBuilder result = new StringBuilder("Environment{");
    values.forEach((variable, value) -> result.append(variable.name()).append('=').append(value).append(", "));
    if (!values.isEmpty()) {
      result.setLength(result.length() - 2);
    }
    return result.append('}').toString();
  }
}
