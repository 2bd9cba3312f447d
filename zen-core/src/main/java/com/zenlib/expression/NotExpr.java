package com.zenlib.expression;

import com.zenlib.expression.intern.InternKey;
import com.zenlib.expression.intern.InternTable;
import com.zenlib.expression.intern.InternTables;
import com.zenlib.type.ExprType;
import java.util.List;

/** Logical negation. */
public final class NotExpr extends Expr<Boolean> {

  private static final InternTable<NotExpr> TABLE = InternTables.create("not");

  private final Expr<Boolean> expr;

  private NotExpr(Expr<Boolean> expr) {
    super(ExprType.BOOL);
    this.expr = expr;
  }

  public static NotExpr create(Expr<Boolean> expr) {
    checkType(expr, ExprType.BOOL, "not operand");
    return TABLE.getOrCreate(InternKey.ofChildren(ExprKind.NOT, expr), () -> new NotExpr(expr)).instance();
  }

  public Expr<Boolean> expr() {
    return expr;
  }

  @Override
  public ExprKind kind() {
    return ExprKind.NOT;
  }

  @Override
  public List<Expr<?>> children() {
    return List.of(expr);
  }

  @Override
  public <P, R> R accept(ExprVisitor<P, R> visitor, P parameter) {
    return visitor.visitNot(this, parameter);
  }

  @Override
  Object payload() {
    return null;
  }
}
