package com.zenlib.expression;

import com.zenlib.expression.intern.InternKey;
import com.zenlib.expression.intern.InternTable;
import com.zenlib.expression.intern.InternTables;
import com.zenlib.type.ListType;
import com.zenlib.util.Contract;
import java.util.List;

/** The empty list of a given element type. */
public final class ListEmptyExpr<E> extends Expr<List<E>> {

  private static final InternTable<ListEmptyExpr<?>> TABLE = InternTables.create("list-empty");

  private final ListType<E> listType;

  private ListEmptyExpr(ListType<E> listType) {
    super(listType);
    this.listType = listType;
  }

  @SuppressWarnings("unchecked")
  public static <E> ListEmptyExpr<E> create(ListType<E> listType) {
    Contract.notNull(listType, "list type");
    InternKey key = InternKey.of(ExprKind.LIST_EMPTY, listType);
    return (ListEmptyExpr<E>) TABLE.getOrCreate(key, () -> new ListEmptyExpr<>(listType)).instance();
  }

  public ListType<E> listType() {
    return listType;
  }

  @Override
  public ExprKind kind() {
    return ExprKind.LIST_EMPTY;
  }

  @Override
  public List<Expr<?>> children() {
    return List.of();
  }

  @Override
  public <P, R> R accept(ExprVisitor<P, R> visitor, P parameter) {
    return visitor.visitListEmpty(this, parameter);
  }

  @Override
  Object payload() {
    return null;
  }
}
