package com.zenlib.expression;

import com.google.common.collect.ImmutableList;
import com.zenlib.expression.intern.InternKey;
import com.zenlib.expression.intern.InternTable;
import com.zenlib.expression.intern.InternTables;
import com.zenlib.type.ExprType;
import com.zenlib.util.Contract;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Exposes an expression of type {@code F} as type {@code T}. Concrete values are converted by applying each converter
 * in order.
 *
 * @param <T> type this expression denotes
 * @param <F> type of the wrapped expression
 */
public final class AdapterExpr<T, F> extends Expr<T> {

  private static final InternTable<AdapterExpr<?, ?>> TABLE = InternTables.create("adapter");

  private final Expr<F> expr;
  private final ImmutableList<Function<Object, Object>> converters;

  private AdapterExpr(ExprType<T> type, Expr<F> expr, ImmutableList<Function<Object, Object>> converters) {
    super(type);
    this.expr = expr;
    this.converters = converters;
  }

  /**
   * Returns {@code expr} exposed as {@code type}. Two adapters are the same node only if their converters are the same
   * function instances.
   */
  @SuppressWarnings("unchecked")
  public static <T, F> AdapterExpr<T, F> create(ExprType<T> type, Expr<F> expr,
    List<? extends Function<?, ?>> converters) {
    Contract.notNull(type, "adapter type");
    Contract.notNull(expr, "adapted expression");
    Contract.notNull(converters, "converters");
    Contract.check(converters.stream().noneMatch(Objects::isNull), "converters must not be null");
    ImmutableList<Function<Object, Object>> list = ImmutableList.copyOf(
      (List<Function<Object, Object>>) (List<?>) converters);
    InternKey key = InternKey.of(ExprKind.ADAPTER, List.of(type, list), expr);
    return (AdapterExpr<T, F>) TABLE.getOrCreate(key, () -> new AdapterExpr<>(type, expr, list)).instance();
  }

  public Expr<F> expr() {
    return expr;
  }

  public ImmutableList<Function<Object, Object>> converters() {
    return converters;
  }

  /** Returns {@code value} run through every converter in order. */
  public Object convert(Object value) {
    Object result = value;
    for (Function<Object, Object> converter : converters) {
      result = converter.apply(result);
    }
    return result;
  }

  @Override
  public ExprKind kind() {
    return ExprKind.ADAPTER;
  }

  @Override
  public List<Expr<?>> children() {
    return List.of(expr);
  }

  @Override
  public <P, R> R accept(ExprVisitor<P, R> visitor, P parameter) {
    return visitor.visitAdapter(this, parameter);
  }

  @Override
  Object payload() {
    return converters;
  }
}
