package com.zenlib.expression;

import com.zenlib.expression.intern.InternKey;
import com.zenlib.expression.intern.InternTable;
import com.zenlib.expression.intern.InternTables;
import com.zenlib.type.ObjectType;
import com.zenlib.type.ObjectValue;
import com.zenlib.util.Contract;
import java.util.List;

/**
 * An object equal to {@code host} except that {@code field} has {@code value}.
 *
 * @param <F> type of the updated field
 */
public final class WithFieldExpr<F> extends Expr<ObjectValue> {

  private static final InternTable<WithFieldExpr<?>> TABLE = InternTables.create("with-field");

  private final Expr<ObjectValue> host;
  private final String field;
  private final Expr<F> value;

  private WithFieldExpr(ObjectType objectType, Expr<ObjectValue> host, String field, Expr<F> value) {
    super(objectType);
    this.host = host;
    this.field = field;
    this.value = value;
  }

  /**
   * Returns {@code host} with {@code field} replaced by {@code value}.
   *
   * @throws com.zenlib.InvalidFieldException if the object type of {@code host} has no such field
   */
  @SuppressWarnings("unchecked")
  public static <F> WithFieldExpr<F> create(Expr<ObjectValue> host, String field, Expr<F> value) {
    ObjectType objectType = GetFieldExpr.objectTypeOf(host);
    checkType(value, objectType.fieldType(Contract.notNull(field, "field name")), "field " + field);
    InternKey key = InternKey.of(ExprKind.WITH_FIELD, field, host, value);
    return (WithFieldExpr<F>) TABLE.getOrCreate(key, () -> new WithFieldExpr<>(objectType, host, field, value))
      .instance();
  }

  public Expr<ObjectValue> host() {
    return host;
  }

  public String field() {
    return field;
  }

  public Expr<F> value() {
    return value;
  }

  @Override
  public ExprKind kind() {
    return ExprKind.WITH_FIELD;
  }

  @Override
  public List<Expr<?>> children() {
    return List.of(host, value);
  }

  @Override
  public <P, R> R accept(ExprVisitor<P, R> visitor, P parameter) {
    return visitor.visitWithField(this, parameter);
  }

  @Override
  Object payload() {
    return field;
  }
}
