package com.zenlib.expression;

import com.zenlib.expression.intern.InternKey;
import com.zenlib.expression.intern.InternTable;
import com.zenlib.expression.intern.InternTables;
import com.zenlib.util.Contract;
import java.util.List;

/** Bitwise complement of a fixed-width integer. */
public final class BitwiseNotExpr extends Expr<Long> {

  private static final InternTable<BitwiseNotExpr> TABLE = InternTables.create("bitwise-not");

  private final Expr<Long> expr;

  private BitwiseNotExpr(Expr<Long> expr) {
    super(expr.type());
    this.expr = expr;
  }

  public static BitwiseNotExpr create(Expr<Long> expr) {
    Contract.notNull(expr, "bitwise not operand");
    Contract.check(expr.type().isFixedWidth(), "BitwiseNot is not defined on %s", expr.type());
    return TABLE.getOrCreate(InternKey.ofChildren(ExprKind.BITWISE_NOT, expr), () -> new BitwiseNotExpr(expr))
      .instance();
  }

  public Expr<Long> expr() {
    return expr;
  }

  @Override
  public ExprKind kind() {
    return ExprKind.BITWISE_NOT;
  }

  @Override
  public List<Expr<?>> children() {
    return List.of(expr);
  }

  @Override
  public <P, R> R accept(ExprVisitor<P, R> visitor, P parameter) {
    return visitor.visitBitwiseNot(this, parameter);
  }

  @Override
  Object payload() {
    return null;
  }
}
