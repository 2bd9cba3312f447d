package com.zenlib.expression;

import com.zenlib.expression.intern.InternKey;
import com.zenlib.expression.intern.InternTable;
import com.zenlib.expression.intern.InternTables;
import com.zenlib.type.ExprType;
import com.zenlib.util.Contract;
import java.util.List;

/** Ordered comparison of two integers of the same type, unsigned for unsigned types. */
public final class CompareExpr<T> extends Expr<Boolean> {

  private static final InternTable<CompareExpr<?>> TABLE = InternTables.create("compare");

  /** The comparison performed. */
  public enum Op {
    LEQ("Leq"),
    GEQ("Geq");

    private final String label;

    Op(String label) {
      this.label = label;
    }

    public String label() {
      return label;
    }
  }

  private final Op op;
  private final Expr<T> left;
  private final Expr<T> right;

  private CompareExpr(Op op, Expr<T> left, Expr<T> right) {
    super(ExprType.BOOL);
    this.op = op;
    this.left = left;
    this.right = right;
  }

  @SuppressWarnings("unchecked")
  public static <T> CompareExpr<T> create(Op op, Expr<T> left, Expr<T> right) {
    Contract.notNull(op, "comparison");
    checkSameType(left, right, op.label());
    Contract.check(left.type().isArithmetic(), "%s is not defined on %s", op.label(), left.type());
    InternKey key = InternKey.of(ExprKind.COMPARE, op, left, right);
    return (CompareExpr<T>) TABLE.getOrCreate(key, () -> new CompareExpr<>(op, left, right)).instance();
  }

  public Op op() {
    return op;
  }

  public Expr<T> left() {
    return left;
  }

  public Expr<T> right() {
    return right;
  }

  @Override
  public ExprKind kind() {
    return ExprKind.COMPARE;
  }

  @Override
  public List<Expr<?>> children() {
    return List.of(left, right);
  }

  @Override
  public <P, R> R accept(ExprVisitor<P, R> visitor, P parameter) {
    return visitor.visitCompare(this, parameter);
  }

  @Override
  Object payload() {
    return op;
  }
}
