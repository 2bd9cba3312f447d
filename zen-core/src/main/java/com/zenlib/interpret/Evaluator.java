package com.zenlib.interpret;

import com.carrotsearch.hppc.LongObjectHashMap;
import com.zenlib.ContractViolationException;
import com.zenlib.expression.AdapterExpr;
import com.zenlib.expression.AndExpr;
import com.zenlib.expression.ArithExpr;
import com.zenlib.expression.BitwiseExpr;
import com.zenlib.expression.BitwiseNotExpr;
import com.zenlib.expression.CompareExpr;
import com.zenlib.expression.ConstantExpr;
import com.zenlib.expression.CreateObjectExpr;
import com.zenlib.expression.EqExpr;
import com.zenlib.expression.Expr;
import com.zenlib.expression.ExprVisitor;
import com.zenlib.expression.GetFieldExpr;
import com.zenlib.expression.IfExpr;
import com.zenlib.expression.ListConsExpr;
import com.zenlib.expression.ListEmptyExpr;
import com.zenlib.expression.ListMatchExpr;
import com.zenlib.expression.NotExpr;
import com.zenlib.expression.OrExpr;
import com.zenlib.expression.VariableExpr;
import com.zenlib.expression.WithFieldExpr;
import com.zenlib.expression.Zen;
import com.zenlib.type.IntType;
import com.zenlib.type.ListType;
import com.zenlib.type.ObjectValue;
import com.zenlib.util.Contract;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * Computes the concrete value of expressions under one {@link Environment}.
 * <p>
 * Values are memoized per node, so evaluating a shared subexpression twice costs nothing. Like simplification,
 * evaluation walks children with an explicit stack. Every child is evaluated, including the branch of a conditional
 * that is not taken. A list match over a non-empty list is evaluated by pushing its unrolled cons case onto the same
 * stack, so long lists do not grow the call stack either.
 */
@NotThreadSafe
public final class Evaluator implements ExprVisitor<Environment, Object> {

  private final Environment environment;
  private final LongObjectHashMap<Object> values = new LongObjectHashMap<>();
  private final LongObjectHashMap<Expr<?>> unrolled = new LongObjectHashMap<>();

  /** Returned by a list match whose unrolled cons case has no value yet. */
  private record Unroll(Expr<?> body) {}

  public Evaluator(Environment environment) {
    this.environment = Contract.notNull(environment, "environment");
  }

  /** Returns the value of {@code expr}. */
  @SuppressWarnings("unchecked")
  public <T> T evaluate(Expr<T> expr) {
    Contract.notNull(expr, "expression");
    Deque<Expr<?>> stack = new ArrayDeque<>();
    stack.push(expr);
    while (!stack.isEmpty()) {
      Expr<?> node = stack.peek();
      if (values.containsKey(node.id())) {
        stack.pop();
        continue;
      }
      boolean ready = true;
      for (Expr<?> child : node.children()) {
        if (!values.containsKey(child.id())) {
          stack.push(child);
          ready = false;
        }
      }
      if (ready) {
        Object value = node.accept(this, environment);
        if (value instanceof Unroll unroll) {
          stack.push(unroll.body());
        } else {
          stack.pop();
          values.put(node.id(), value);
        }
      }
    }
    return (T) values.get(expr.id());
  }

  @SuppressWarnings("unchecked")
  private <T> T value(Expr<T> child) {
    Object value = values.get(child.id());
    if (value == null) {
      throw Contract.unreachable("%s was not evaluated before its parent", child);
    }
    return (T) value;
  }

  @Override
  public <T> Object visitConstant(ConstantExpr<T> expr, Environment env) {
    return expr.value();
  }

  @Override
  public <T> Object visitVariable(VariableExpr<T> expr, Environment env) {
    return env.get(expr);
  }

  @Override
  public Object visitNot(NotExpr expr, Environment env) {
    return !value(expr.expr());
  }

  @Override
  public Object visitAnd(AndExpr expr, Environment env) {
    return value(expr.left()) && value(expr.right());
  }

  @Override
  public Object visitOr(OrExpr expr, Environment env) {
    return value(expr.left()) || value(expr.right());
  }

  @Override
  public <T> Object visitIf(IfExpr<T> expr, Environment env) {
    return Boolean.TRUE.equals(value(expr.guard())) ? value(expr.trueCase()) : value(expr.falseCase());
  }

  @Override
  public <T> Object visitEq(EqExpr<T> expr, Environment env) {
    return Objects.equals(value(expr.left()), value(expr.right()));
  }

  @Override
  public <T> Object visitCompare(CompareExpr<T> expr, Environment env) {
    return Operations.compare(expr.op(), expr.left().type(), value(expr.left()), value(expr.right()));
  }

  @Override
  public <T> Object visitArith(ArithExpr<T> expr, Environment env) {
    return Operations.arith(expr.op(), expr.type(), value(expr.left()), value(expr.right()));
  }

  @Override
  public Object visitBitwise(BitwiseExpr expr, Environment env) {
    return Operations.bitwise(expr.op(), (IntType) expr.type(), value(expr.left()), value(expr.right()));
  }

  @Override
  public Object visitBitwiseNot(BitwiseNotExpr expr, Environment env) {
    return Operations.bitwiseNot((IntType) expr.type(), value(expr.expr()));
  }

  @Override
  public Object visitCreateObject(CreateObjectExpr expr, Environment env) {
    Map<String, Object> fields = new LinkedHashMap<>();
    expr.fields().forEach((field, fieldExpr) -> fields.put(field, value(fieldExpr)));
    return ObjectValue.of(expr.objectType(), fields);
  }

  @Override
  public <T> Object visitGetField(GetFieldExpr<T> expr, Environment env) {
    return value(expr.host()).get(expr.field());
  }

  @Override
  public <F> Object visitWithField(WithFieldExpr<F> expr, Environment env) {
    return value(expr.host()).with(expr.field(), value(expr.value()));
  }

  @Override
  public <E> Object visitListEmpty(ListEmptyExpr<E> expr, Environment env) {
    return List.of();
  }

  @Override
  public <E> Object visitListCons(ListConsExpr<E> expr, Environment env) {
    return new ConsList<E>(value(expr.head()), value(expr.tail()));
  }

  @Override
  @SuppressWarnings("unchecked")
  public <E, T> Object visitListMatch(ListMatchExpr<E, T> expr, Environment env) {
    List<E> list = value(expr.list());
    if (list.isEmpty()) {
      return value(expr.emptyCase());
    }
    Expr<T> body = (Expr<T>) unrolled.get(expr.id());
    if (body == null) {
      body = unroll(expr, list);
      unrolled.put(expr.id(), body);
    } else if (!values.containsKey(body.id())) {
      throw new ContractViolationException("list match depends on itself while being evaluated: " + expr);
    }
    return values.containsKey(body.id()) ? value(body) : new Unroll(body);
  }

  private static <E, T> Expr<T> unroll(ListMatchExpr<E, T> expr, List<E> list) {
    if (expr.list() instanceof ListConsExpr<E> cons) {
      return expr.applyConsCase(cons.head(), cons.tail());
    }
    ListType<E> listType = expr.listType();
    Expr<E> head = Zen.lift(listType.elementType(), list.get(0));
    List<E> rest = list instanceof ConsList<E> cons ? cons.tail() : list.subList(1, list.size());
    Expr<List<E>> tail = Zen.lift(listType, rest);
    return expr.applyConsCase(head, tail);
  }

  @Override
  public <T, F> Object visitAdapter(AdapterExpr<T, F> expr, Environment env) {
    return Contract.notNull(expr.convert(value(expr.expr())), "converted value");
  }
}
