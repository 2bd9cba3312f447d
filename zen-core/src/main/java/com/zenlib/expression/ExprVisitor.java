package com.zenlib.expression;

import com.zenlib.type.ObjectValue;

/**
 * An algorithm over expressions with one handler per {@link ExprKind}, invoked through
 * {@link Expr#accept(ExprVisitor, Object)}.
 * <p>
 * Adding a node kind adds a handler here, so every visitor must handle it before the code compiles.
 *
 * @param <P> type of the parameter threaded through the visit
 * @param <R> result type of every handler
 */
public interface ExprVisitor<P, R> {

  <T> R visitConstant(ConstantExpr<T> expr, P parameter);

  <T> R visitVariable(VariableExpr<T> expr, P parameter);

  R visitNot(NotExpr expr, P parameter);

  R visitAnd(AndExpr expr, P parameter);

  R visitOr(OrExpr expr, P parameter);

  <T> R visitIf(IfExpr<T> expr, P parameter);

  <T> R visitEq(EqExpr<T> expr, P parameter);

  <T> R visitCompare(CompareExpr<T> expr, P parameter);

  <T> R visitArith(ArithExpr<T> expr, P parameter);

  R visitBitwise(BitwiseExpr expr, P parameter);

  R visitBitwiseNot(BitwiseNotExpr expr, P parameter);

  R visitCreateObject(CreateObjectExpr expr, P parameter);

  <T> R visitGetField(GetFieldExpr<T> expr, P parameter);

  /** {@code F} is the type of the updated field, the expression itself denotes an {@link ObjectValue}. */
  <F> R visitWithField(WithFieldExpr<F> expr, P parameter);

  <E> R visitListEmpty(ListEmptyExpr<E> expr, P parameter);

  <E> R visitListCons(ListConsExpr<E> expr, P parameter);

  <E, T> R visitListMatch(ListMatchExpr<E, T> expr, P parameter);

  <T, F> R visitAdapter(AdapterExpr<T, F> expr, P parameter);
}
