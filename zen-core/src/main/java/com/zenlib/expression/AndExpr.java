package com.zenlib.expression;

import com.zenlib.expression.intern.InternKey;
import com.zenlib.expression.intern.InternTable;
import com.zenlib.expression.intern.InternTables;
import com.zenlib.type.ExprType;
import java.util.List;

/** Binary logical conjunction. */
public final class AndExpr extends Expr<Boolean> {

  private static final InternTable<AndExpr> TABLE = InternTables.create("and");

  private final Expr<Boolean> left;
  private final Expr<Boolean> right;

  private AndExpr(Expr<Boolean> left, Expr<Boolean> right) {
    super(ExprType.BOOL);
    this.left = left;
    this.right = right;
  }

  public static AndExpr create(Expr<Boolean> left, Expr<Boolean> right) {
    checkType(left, ExprType.BOOL, "and operand");
    checkType(right, ExprType.BOOL, "and operand");
    InternKey key = InternKey.ofChildren(ExprKind.AND, left, right);
    return TABLE.getOrCreate(key, () -> new AndExpr(left, right)).instance();
  }

  public Expr<Boolean> left() {
    return left;
  }

  public Expr<Boolean> right() {
    return right;
  }

  @Override
  public ExprKind kind() {
    return ExprKind.AND;
  }

  @Override
  public List<Expr<?>> children() {
    return List.of(left, right);
  }

  @Override
  public <P, R> R accept(ExprVisitor<P, R> visitor, P parameter) {
    return visitor.visitAnd(this, parameter);
  }

  @Override
  Object payload() {
    return null;
  }
}
