package com.zenlib.expression;

import com.zenlib.expression.intern.InternKey;
import com.zenlib.expression.intern.InternTable;
import com.zenlib.expression.intern.InternTables;
import com.zenlib.util.Contract;
import java.util.List;

/** Bitwise and, or or xor of two fixed-width integers of the same type. */
public final class BitwiseExpr extends Expr<Long> {

  private static final InternTable<BitwiseExpr> TABLE = InternTables.create("bitwise");

  /** The bitwise operation performed, all of them commutative. */
  public enum Op {
    AND("BitwiseAnd"),
    OR("BitwiseOr"),
    XOR("BitwiseXor");

    private final String label;

    Op(String label) {
      this.label = label;
    }

    public String label() {
      return label;
    }
  }

  private final Op op;
  private final Expr<Long> left;
  private final Expr<Long> right;

  private BitwiseExpr(Op op, Expr<Long> left, Expr<Long> right) {
    super(left.type());
    this.op = op;
    this.left = left;
    this.right = right;
  }

  public static BitwiseExpr create(Op op, Expr<Long> left, Expr<Long> right) {
    Contract.notNull(op, "bitwise operation");
    checkSameType(left, right, op.label());
    Contract.check(left.type().isFixedWidth(), "%s is not defined on %s", op.label(), left.type());
    InternKey key = InternKey.of(ExprKind.BITWISE, op, left, right);
    return TABLE.getOrCreate(key, () -> new BitwiseExpr(op, left, right)).instance();
  }

  public Op op() {
    return op;
  }

  public Expr<Long> left() {
    return left;
  }

  public Expr<Long> right() {
    return right;
  }

  @Override
  public ExprKind kind() {
    return ExprKind.BITWISE;
  }

  @Override
  public List<Expr<?>> children() {
    return List.of(left, right);
  }

  @Override
  public <P, R> R accept(ExprVisitor<P, R> visitor, P parameter) {
    return visitor.visitBitwise(this, parameter);
  }

  @Override
  Object payload() {
    return op;
  }
}
