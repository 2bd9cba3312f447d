package com.zenlib.type;

import com.google.common.collect.ImmutableMap;
import com.zenlib.InvalidFieldException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * A concrete value of an {@link ObjectType}, holding a value for every declared field.
 */
public record ObjectValue(ObjectType type, ImmutableMap<String, Object> values) {

  /**
   * Returns an object of {@code type} with {@code values}, checked against the declared field types.
   *
   * @throws InvalidFieldException                 if a field is missing or not declared
   * @throws com.zenlib.ContractViolationException if a value has the wrong type
   */
  public static ObjectValue of(ObjectType type, Map<String, ?> values) {
    for (String field : values.keySet()) {
      type.fieldType(field);
    }
    ImmutableMap.Builder<String, Object> ordered = ImmutableMap.builder();
    for (var entry : type.fields().entrySet()) {
      if (!values.containsKey(entry.getKey())) {
        throw new InvalidFieldException(type, entry.getKey(), "missing value");
      }
      ordered.put(entry.getKey(), entry.getValue().checkValue(values.get(entry.getKey())));
    }
    return new ObjectValue(type, ordered.build());
  }

  /** Returns the value of {@code field}. */
  public Object get(String field) {
    type.fieldType(field);
    return values.get(field);
  }

  /** Returns a copy of this object with {@code field} set to {@code value}. */
  public ObjectValue with(String field, Object value) {
    type.fieldType(field);
    Map<String, Object> updated = new LinkedHashMap<>(values);
    updated.put(field, value);
    return of(type, updated);
  }

  @Override
  public String toString() {
    return type.name() + values.entrySet().stream()
      .map(e -> e.getKey() + "=" + e.getValue())
      .collect(Collectors.joining(", ", "{", "}"));
  }
}
