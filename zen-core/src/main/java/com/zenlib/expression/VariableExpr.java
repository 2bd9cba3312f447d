package com.zenlib.expression;

import com.zenlib.type.ExprType;
import com.zenlib.util.Contract;
import java.util.List;

/**
 * A named symbolic value that a solver or an evaluation environment assigns.
 * <p>
 * Variables are never interned: every call to {@link #create(ExprType, String)} returns a distinct variable, even for
 * the same name and type.
 */
public final class VariableExpr<T> extends Expr<T> {

  private final String name;

  private VariableExpr(ExprType<T> type, String name) {
    super(type);
    this.name = name;
  }

  public static <T> VariableExpr<T> create(ExprType<T> type, String name) {
    return new VariableExpr<>(type, Contract.notNull(name, "variable name"));
  }

  public String name() {
    return name;
  }

  @Override
  public ExprKind kind() {
    return ExprKind.VARIABLE;
  }

  @Override
  public List<Expr<?>> children() {
    return List.of();
  }

  @Override
  public <P, R> R accept(ExprVisitor<P, R> visitor, P parameter) {
    return visitor.visitVariable(this, parameter);
  }

  @Override
  Object payload() {
    return name;
  }
}
