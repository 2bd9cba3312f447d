package com.zenlib.expression;

import com.zenlib.expression.intern.InternKey;
import com.zenlib.expression.intern.InternTable;
import com.zenlib.expression.intern.InternTables;
import com.zenlib.type.ExprType;
import com.zenlib.type.ListType;
import com.zenlib.type.ObjectType;
import com.zenlib.util.Contract;
import java.util.List;

/** A literal value of a scalar type: boolean, fixed-width integer, big integer or string. */
public final class ConstantExpr<T> extends Expr<T> {

  private static final InternTable<ConstantExpr<?>> TABLE = InternTables.create("constant");

  private final T value;

  private ConstantExpr(ExprType<T> type, T value) {
    super(type);
    this.value = value;
  }

  /**
   * Returns the constant {@code value} of {@code type}.
   *
   * @throws com.zenlib.ContractViolationException if {@code type} is a list or object type, or {@code value} is not a
   *                                               valid value of it
   */
  @SuppressWarnings("unchecked")
  public static <T> ConstantExpr<T> create(ExprType<T> type, Object value) {
    Contract.notNull(type, "constant type");
    Contract.check(!(type instanceof ListType<?>) && !(type instanceof ObjectType),
      "%s is not a scalar type, lift list and object values instead", type);
    T checked = type.checkValue(value);
    InternKey key = InternKey.of(ExprKind.CONSTANT, List.of(type, checked));
    return (ConstantExpr<T>) TABLE.getOrCreate(key, () -> new ConstantExpr<>(type, checked)).instance();
  }

  public T value() {
    return value;
  }

  @Override
  public ExprKind kind() {
    return ExprKind.CONSTANT;
  }

  @Override
  public List<Expr<?>> children() {
    return List.of();
  }

  @Override
  public <P, R> R accept(ExprVisitor<P, R> visitor, P parameter) {
    return visitor.visitConstant(this, parameter);
  }

  @Override
  Object payload() {
    return value;
  }
}
