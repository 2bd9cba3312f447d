package com.zenlib.expression;

import com.zenlib.expression.intern.InternKey;
import com.zenlib.expression.intern.InternTable;
import com.zenlib.expression.intern.InternTables;
import com.zenlib.type.ExprType;
import java.util.List;

/** Binary logical disjunction. */
public final class OrExpr extends Expr<Boolean> {

  private static final InternTable<OrExpr> TABLE = InternTables.create("or");

  private final Expr<Boolean> left;
  private final Expr<Boolean> right;

  private OrExpr(Expr<Boolean> left, Expr<Boolean> right) {
    super(ExprType.BOOL);
    this.left = left;
    this.right = right;
  }

  public static OrExpr create(Expr<Boolean> left, Expr<Boolean> right) {
    checkType(left, ExprType.BOOL, "or operand");
    checkType(right, ExprType.BOOL, "or operand");
    InternKey key = InternKey.ofChildren(ExprKind.OR, left, right);
    return TABLE.getOrCreate(key, () -> new OrExpr(left, right)).instance();
  }

  public Expr<Boolean> left() {
    return left;
  }

  public Expr<Boolean> right() {
    return right;
  }

  @Override
  public ExprKind kind() {
    return ExprKind.OR;
  }

  @Override
  public List<Expr<?>> children() {
    return List.of(left, right);
  }

  @Override
  public <P, R> R accept(ExprVisitor<P, R> visitor, P parameter) {
    return visitor.visitOr(this, parameter);
  }

  @Override
  Object payload() {
    return null;
  }
}
