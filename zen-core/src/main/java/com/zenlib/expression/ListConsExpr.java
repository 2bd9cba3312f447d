package com.zenlib.expression;

import com.zenlib.ContractViolationException;
import com.zenlib.expression.intern.InternKey;
import com.zenlib.expression.intern.InternTable;
import com.zenlib.expression.intern.InternTables;
import com.zenlib.type.ExprType;
import com.zenlib.type.ListType;
import com.zenlib.util.Contract;
import java.util.List;

/** A list made of {@code head} followed by the elements of {@code tail}. */
public final class ListConsExpr<E> extends Expr<List<E>> {

  private static final InternTable<ListConsExpr<?>> TABLE = InternTables.create("list-cons");

  private final Expr<E> head;
  private final Expr<List<E>> tail;

  private ListConsExpr(Expr<E> head, Expr<List<E>> tail) {
    super(tail.type());
    this.head = head;
    this.tail = tail;
  }

  @SuppressWarnings("unchecked")
  public static <E> ListConsExpr<E> create(Expr<E> head, Expr<List<E>> tail) {
    ListType<E> listType = listTypeOf(tail);
    checkType(head, listType.elementType(), "list element");
    InternKey key = InternKey.ofChildren(ExprKind.LIST_CONS, head, tail);
    return (ListConsExpr<E>) TABLE.getOrCreate(key, () -> new ListConsExpr<>(head, tail)).instance();
  }

  @SuppressWarnings("unchecked")
  static <E> ListType<E> listTypeOf(Expr<List<E>> list) {
    Contract.notNull(list, "list expression");
    ExprType<List<E>> type = list.type();
    if (type instanceof ListType<?> listType) {
      return (ListType<E>) listType;
    }
    throw new ContractViolationException("expected a list expression but got " + type);
  }

  public Expr<E> head() {
    return head;
  }

  public Expr<List<E>> tail() {
    return tail;
  }

  @Override
  public ExprKind kind() {
    return ExprKind.LIST_CONS;
  }

  @Override
  public List<Expr<?>> children() {
    return List.of(head, tail);
  }

  @Override
  public <P, R> R accept(ExprVisitor<P, R> visitor, P parameter) {
    return visitor.visitListCons(this, parameter);
  }

  @Override
  Object payload() {
    return null;
  }
}
