package com.zenlib.expression;

import com.zenlib.ContractViolationException;
import com.zenlib.expression.intern.InternKey;
import com.zenlib.expression.intern.InternTable;
import com.zenlib.expression.intern.InternTables;
import com.zenlib.type.ExprType;
import com.zenlib.type.ObjectType;
import com.zenlib.type.ObjectValue;
import com.zenlib.util.Contract;
import java.util.List;

/** Reads one field of an object. */
public final class GetFieldExpr<T> extends Expr<T> {

  private static final InternTable<GetFieldExpr<?>> TABLE = InternTables.create("get-field");

  private final Expr<ObjectValue> host;
  private final String field;

  private GetFieldExpr(Expr<ObjectValue> host, String field, ExprType<T> fieldType) {
    super(fieldType);
    this.host = host;
    this.field = field;
  }

  /**
   * Returns an expression for {@code field} of {@code host}, typed as the field's declared type.
   *
   * @throws com.zenlib.InvalidFieldException if the object type of {@code host} has no such field
   */
  @SuppressWarnings("unchecked")
  public static <T> GetFieldExpr<T> create(Expr<ObjectValue> host, String field) {
    ObjectType objectType = objectTypeOf(host);
    ExprType<T> fieldType = (ExprType<T>) objectType.fieldType(Contract.notNull(field, "field name"));
    InternKey key = InternKey.of(ExprKind.GET_FIELD, field, host);
    return (GetFieldExpr<T>) TABLE.getOrCreate(key, () -> new GetFieldExpr<>(host, field, fieldType)).instance();
  }

  static ObjectType objectTypeOf(Expr<ObjectValue> host) {
    Contract.notNull(host, "object expression");
    if (host.type() instanceof ObjectType objectType) {
      return objectType;
    }
    throw new ContractViolationException("expected an object expression but got " + host.type());
  }

  public Expr<ObjectValue> host() {
    return host;
  }

  public String field() {
    return field;
  }

  @Override
  public ExprKind kind() {
    return ExprKind.GET_FIELD;
  }

  @Override
  public List<Expr<?>> children() {
    return List.of(host);
  }

  @Override
  public <P, R> R accept(ExprVisitor<P, R> visitor, P parameter) {
    return visitor.visitGetField(this, parameter);
  }

  @Override
  Object payload() {
    return field;
  }
}
