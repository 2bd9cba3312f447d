package com.zenlib.type;

import com.google.common.collect.ImmutableMap;
import com.zenlib.ContractViolationException;
import com.zenlib.InvalidFieldException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A record type with a name and an ordered set of named, typed fields.
 * <p>
 * Object types are declared explicitly with {@link #builder(String)}, the declaration order of the fields is the
 * canonical order used when constructing and printing objects.
 */
public record ObjectType(String name, ImmutableMap<String, ExprType<?>> fields) implements ExprType<ObjectValue> {

  public ObjectType {
    if (name == null || name.isBlank()) {
      throw new ContractViolationException("object type needs a name");
    }
    if (fields.isEmpty()) {
      throw new ContractViolationException("object type " + name + " needs at least one field");
    }
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  public boolean hasField(String field) {
    return fields.containsKey(field);
  }

  /**
   * Returns the declared type of {@code field}.
   *
   * @throws InvalidFieldException if this type has no such field
   */
  public ExprType<?> fieldType(String field) {
    ExprType<?> type = fields.get(field);
    if (type == null) {
      throw new InvalidFieldException(this, field, "no such field");
    }
    return type;
  }

  @Override
  public ObjectValue defaultValue() {
    Map<String, Object> values = new LinkedHashMap<>();
    fields.forEach((field, type) -> values.put(field, type.defaultValue()));
    return ObjectValue.of(this, values);
  }

  @Override
  public ObjectValue checkValue(Object value) {
    if (!(value instanceof ObjectValue object) || !object.type().equals(this)) {
      throw new ContractViolationException("expected a %s value but got %s".formatted(name, value));
    }
    return object;
  }

  @Override
  public String toString() {
    return name;
  }

  /** Collects the fields of an {@link ObjectType} in declaration order. */
  public static final class Builder {

    private final String name;
    private final LinkedHashMap<String, ExprType<?>> fields = new LinkedHashMap<>();

    private Builder(String name) {
      this.name = name;
    }

    public Builder field(String field, ExprType<?> type) {
      if (field == null || type == null) {
        throw new ContractViolationException("field name and type must not be null");
      }
      if (fields.putIfAbsent(field, type) != null) {
        throw new ContractViolationException("duplicate field '%s' on %s".formatted(field, name));
      }
      return this;
    }

    public ObjectType build() {
      return new ObjectType(name, ImmutableMap.copyOf(fields));
    }
  }
}
