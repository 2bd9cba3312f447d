package com.zenlib.expression;

import com.zenlib.expression.intern.InternKey;
import com.zenlib.expression.intern.InternTable;
import com.zenlib.expression.intern.InternTables;
import com.zenlib.util.Contract;
import java.util.List;

/**
 * Binary arithmetic on two integers of the same type. Fixed-width results wrap around.
 */
public final class ArithExpr<T> extends Expr<T> {

  private static final InternTable<ArithExpr<?>> TABLE = InternTables.create("arith");

  /** The arithmetic operation performed. */
  public enum Op {
    SUM("Sum", true),
    DIFFERENCE("Difference", false),
    PRODUCT("Product", true),
    MIN("Min", true),
    MAX("Max", true);

    private final String label;
    private final boolean commutative;

    Op(String label, boolean commutative) {
      this.label = label;
      this.commutative = commutative;
    }

    public String label() {
      return label;
    }

    public boolean isCommutative() {
      return commutative;
    }
  }

  private final Op op;
  private final Expr<T> left;
  private final Expr<T> right;

  private ArithExpr(Op op, Expr<T> left, Expr<T> right) {
    super(left.type());
    this.op = op;
    this.left = left;
    this.right = right;
  }

  @SuppressWarnings("unchecked")
  public static <T> ArithExpr<T> create(Op op, Expr<T> left, Expr<T> right) {
    Contract.notNull(op, "arithmetic operation");
    checkSameType(left, right, op.label());
    Contract.check(left.type().isArithmetic(), "%s is not defined on %s", op.label(), left.type());
    InternKey key = InternKey.of(ExprKind.ARITH, op, left, right);
    return (ArithExpr<T>) TABLE.getOrCreate(key, () -> new ArithExpr<>(op, left, right)).instance();
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
    return ExprKind.ARITH;
  }

  @Override
  public List<Expr<?>> children() {
    return List.of(left, right);
  }

  @Override
  public <P, R> R accept(ExprVisitor<P, R> visitor, P parameter) {
    return visitor.visitArith(this, parameter);
  }

  @Override
  Object payload() {
    return op;
  }
}
