package com.zenlib.expression;

import com.zenlib.ContractViolationException;
import com.zenlib.expression.intern.InternKey;
import com.zenlib.expression.intern.InternTable;
import com.zenlib.expression.intern.InternTables;
import com.zenlib.type.ListType;
import com.zenlib.util.Contract;
import java.util.List;
import java.util.function.BiFunction;

/**
 * Case split on a list: {@code emptyCase} if the list is empty, otherwise the expression that {@code consCase} builds
 * from the list's head and tail.
 * <p>
 * The cons case is a function so it can recurse on the tail. Two matches are the same node only if they share the
 * same function instance.
 *
 * @param <E> list element type
 * @param <T> result type
 */
public final class ListMatchExpr<E, T> extends Expr<T> {

  private static final InternTable<ListMatchExpr<?, ?>> TABLE = InternTables.create("list-match");

  private final Expr<List<E>> list;
  private final Expr<T> emptyCase;
  private final BiFunction<Expr<E>, Expr<List<E>>, Expr<T>> consCase;

  private ListMatchExpr(Expr<List<E>> list, Expr<T> emptyCase, BiFunction<Expr<E>, Expr<List<E>>, Expr<T>> consCase) {
    super(emptyCase.type());
    this.list = list;
    this.emptyCase = emptyCase;
    this.consCase = consCase;
  }

  @SuppressWarnings("unchecked")
  public static <E, T> ListMatchExpr<E, T> create(Expr<List<E>> list, Expr<T> emptyCase,
    BiFunction<Expr<E>, Expr<List<E>>, Expr<T>> consCase) {
    ListConsExpr.listTypeOf(list);
    Contract.notNull(emptyCase, "empty case");
    Contract.notNull(consCase, "cons case");
    InternKey key = InternKey.of(ExprKind.LIST_MATCH, consCase, list, emptyCase);
    return (ListMatchExpr<E, T>) TABLE.getOrCreate(key, () -> new ListMatchExpr<>(list, emptyCase, consCase))
      .instance();
  }

  public Expr<List<E>> list() {
    return list;
  }

  public ListType<E> listType() {
    return ListConsExpr.listTypeOf(list);
  }

  public Expr<T> emptyCase() {
    return emptyCase;
  }

  public BiFunction<Expr<E>, Expr<List<E>>, Expr<T>> consCase() {
    return consCase;
  }

  /**
   * Returns the cons case built for {@code head} and {@code tail}.
   *
   * @throws ContractViolationException if the function returns {@code null} or an expression of another type
   */
  public Expr<T> applyConsCase(Expr<E> head, Expr<List<E>> tail) {
    Expr<T> result = consCase.apply(head, tail);
    if (result == null || !result.type().equals(type())) {
      throw new ContractViolationException("list match cons case must return a %s expression but returned %s"
        .formatted(type(), result == null ? null : result.type()));
    }
    return result;
  }

  @Override
  public ExprKind kind() {
    return ExprKind.LIST_MATCH;
  }

  @Override
  public List<Expr<?>> children() {
    return List.of(list, emptyCase);
  }

  @Override
  public <P, R> R accept(ExprVisitor<P, R> visitor, P parameter) {
    return visitor.visitListMatch(this, parameter);
  }

  @Override
  Object payload() {
    return consCase;
  }
}
