package com.zenlib.expression;

import com.zenlib.expression.intern.InternKey;
import com.zenlib.expression.intern.InternTable;
import com.zenlib.expression.intern.InternTables;
import com.zenlib.type.ExprType;
import java.util.List;

/** Equality of two expressions of the same type. */
public final class EqExpr<T> extends Expr<Boolean> {

  private static final InternTable<EqExpr<?>> TABLE = InternTables.create("eq");

  private final Expr<T> left;
  private final Expr<T> right;

  private EqExpr(Expr<T> left, Expr<T> right) {
    super(ExprType.BOOL);
    this.left = left;
    this.right = right;
  }

  @SuppressWarnings("unchecked")
  public static <T> EqExpr<T> create(Expr<T> left, Expr<T> right) {
    checkSameType(left, right, "eq");
    InternKey key = InternKey.ofChildren(ExprKind.EQ, left, right);
    return (EqExpr<T>) TABLE.getOrCreate(key, () -> new EqExpr<>(left, right)).instance();
  }

  public Expr<T> left() {
    return left;
  }

  public Expr<T> right() {
    return right;
  }

  @Override
  public ExprKind kind() {
    return ExprKind.EQ;
  }

  @Override
  public List<Expr<?>> children() {
    return List.of(left, right);
  }

  @Override
  public <P, R> R accept(ExprVisitor<P, R> visitor, P parameter) {
    return visitor.visitEq(this, parameter);
  }

  @Override
  Object payload() {
    return null;
  }
}
