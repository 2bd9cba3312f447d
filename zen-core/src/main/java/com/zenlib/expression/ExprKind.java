package com.zenlib.expression;

/**
 * The closed set of expression node kinds. Every {@link ExprVisitor} has exactly one handler per kind.
 */
public enum ExprKind {
  CONSTANT,
  VARIABLE,
  NOT,
  AND,
  OR,
  IF,
  EQ,
  COMPARE,
  ARITH,
  BITWISE,
  BITWISE_NOT,
  CREATE_OBJECT,
  GET_FIELD,
  WITH_FIELD,
  LIST_EMPTY,
  LIST_CONS,
  LIST_MATCH,
  ADAPTER
}
