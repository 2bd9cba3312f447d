package com.zenlib.expression;

import com.zenlib.expression.intern.InternKey;
import com.zenlib.expression.intern.InternTable;
import com.zenlib.expression.intern.InternTables;
import com.zenlib.type.ExprType;
import java.util.List;

/** Conditional: {@code trueCase} when {@code guard} holds, otherwise {@code falseCase}. */
public final class IfExpr<T> extends Expr<T> {

  private static final InternTable<IfExpr<?>> TABLE = InternTables.create("if");

  private final Expr<Boolean> guard;
  private final Expr<T> trueCase;
  private final Expr<T> falseCase;

  private IfExpr(Expr<Boolean> guard, Expr<T> trueCase, Expr<T> falseCase) {
    super(trueCase.type());
    this.guard = guard;
    this.trueCase = trueCase;
    this.falseCase = falseCase;
  }

  @SuppressWarnings("unchecked")
  public static <T> IfExpr<T> create(Expr<Boolean> guard, Expr<T> trueCase, Expr<T> falseCase) {
    checkType(guard, ExprType.BOOL, "if guard");
    checkSameType(trueCase, falseCase, "if branch");
    InternKey key = InternKey.ofChildren(ExprKind.IF, guard, trueCase, falseCase);
    return (IfExpr<T>) TABLE.getOrCreate(key, () -> new IfExpr<>(guard, trueCase, falseCase)).instance();
  }

  public Expr<Boolean> guard() {
    return guard;
  }

  public Expr<T> trueCase() {
    return trueCase;
  }

  public Expr<T> falseCase() {
    return falseCase;
  }

  @Override
  public ExprKind kind() {
    return ExprKind.IF;
  }

  @Override
  public List<Expr<?>> children() {
    return List.of(guard, trueCase, falseCase);
  }

  @Override
  public <P, R> R accept(ExprVisitor<P, R> visitor, P parameter) {
    return visitor.visitIf(this, parameter);
  }

  @Override
  Object payload() {
    return null;
  }
}
