package com.zenlib;

import com.zenlib.type.ObjectType;

/**
 * Thrown when an object expression refers to a field that its {@link ObjectType} does not declare, or when a
 * constructor misses or repeats a declared field.
 */
public class InvalidFieldException extends ContractViolationException {

  private final transient ObjectType objectType;
  private final String field;

  public InvalidFieldException(ObjectType objectType, String field, String problem) {
    super("%s: field '%s' on %s".formatted(problem, field, objectType));
    this.objectType = objectType;
    this.field = field;
  }

  public ObjectType objectType() {
    return objectType;
  }

  public String field() {
    return field;
  }
}
