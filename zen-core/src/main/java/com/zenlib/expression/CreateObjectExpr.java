package com.zenlib.expression;

import com.google.common.collect.ImmutableMap;
import com.zenlib.InvalidFieldException;
import com.zenlib.expression.intern.InternKey;
import com.zenlib.expression.intern.InternTable;
import com.zenlib.expression.intern.InternTables;
import com.zenlib.type.ObjectType;
import com.zenlib.type.ObjectValue;
import com.zenlib.util.Contract;
import java.util.List;
import java.util.Map;

/**
 * Builds an object from one expression per declared field. Fields are kept in the declaration order of the type,
 * whatever order they were supplied in.
 */
public final class CreateObjectExpr extends Expr<ObjectValue> {

  private static final InternTable<CreateObjectExpr> TABLE = InternTables.create("create-object");

  private final ObjectType objectType;
  private final ImmutableMap<String, Expr<?>> fields;

  private CreateObjectExpr(ObjectType objectType, ImmutableMap<String, Expr<?>> fields) {
    super(objectType);
    this.objectType = objectType;
    this.fields = fields;
  }

  /**
   * Returns an object of {@code objectType} whose fields have the values of {@code fields}.
   *
   * @throws InvalidFieldException if {@code fields} names an undeclared field or misses a declared one
   */
  public static CreateObjectExpr create(ObjectType objectType, Map<String, ? extends Expr<?>> fields) {
    Contract.notNull(objectType, "object type");
    Contract.notNull(fields, "object fields");
    for (String field : fields.keySet()) {
      objectType.fieldType(field);
    }
    ImmutableMap.Builder<String, Expr<?>> ordered = ImmutableMap.builder();
    Expr<?>[] children = new Expr<?>[objectType.fields().size()];
    int i = 0;
    for (var declared : objectType.fields().entrySet()) {
      Expr<?> value = fields.get(declared.getKey());
      if (value == null) {
        throw new InvalidFieldException(objectType, declared.getKey(), "missing value");
      }
      checkType(value, declared.getValue(), "field " + declared.getKey());
      ordered.put(declared.getKey(), value);
      children[i++] = value;
    }
    ImmutableMap<String, Expr<?>> values = ordered.build();
    InternKey key = InternKey.of(ExprKind.CREATE_OBJECT, objectType, children);
    return TABLE.getOrCreate(key, () -> new CreateObjectExpr(objectType, values)).instance();
  }

  public ObjectType objectType() {
    return objectType;
  }

  /** Field values in declaration order. */
  public ImmutableMap<String, Expr<?>> fields() {
    return fields;
  }

  /** Returns the expression supplied for {@code field}. */
  @SuppressWarnings("unchecked")
  public <F> Expr<F> field(String field) {
    objectType.fieldType(field);
    return (Expr<F>) fields.get(field);
  }

  @Override
  public ExprKind kind() {
    return ExprKind.CREATE_OBJECT;
  }

  @Override
  public List<Expr<?>> children() {
    return fields.values().asList();
  }

  @Override
  public <P, R> R accept(ExprVisitor<P, R> visitor, P parameter) {
    return visitor.visitCreateObject(this, parameter);
  }

  @Override
  Object payload() {
    return objectType;
  }
}
