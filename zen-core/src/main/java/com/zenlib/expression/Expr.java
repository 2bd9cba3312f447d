package com.zenlib.expression;

import com.zenlib.type.ExprType;
import com.zenlib.util.Contract;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * An immutable node of a symbolic expression of type {@code T}.
 * <p>
 * Expressions form a directed acyclic graph: a node only refers to nodes built before it, and subexpressions may be
 * shared by any number of parents. Every kind except {@link VariableExpr} is hash-consed, so building the same
 * operator over the same child instances returns the same node, and {@code ==} on those kinds implies structural
 * equality. {@link #equals(Object)} is identity based, use {@link #structurallyEquals(Expr, Expr)} to compare shapes.
 * <p>
 * Build expressions with the factory methods on {@link Zen}.
 *
 * @param <T> Java type of the values this expression denotes
 */
public abstract class Expr<T> {

  private static final AtomicLong NEXT_ID = new AtomicLong();

  private final long id;
  private final ExprType<T> type;

  protected Expr(ExprType<T> type) {
    this.type = Contract.notNull(type, "expression type");
    this.id = NEXT_ID.incrementAndGet();
  }

  /** Process-unique id, strictly increasing in construction order, so children always have smaller ids. */
  public final long id() {
    return id;
  }

  public final ExprType<T> type() {
    return type;
  }

  public abstract ExprKind kind();

  /** Returns the subexpressions of this node in a fixed order. */
  public abstract List<Expr<?>> children();

  /** Calls the handler of {@code visitor} for this node's kind. */
  public abstract <P, R> R accept(ExprVisitor<P, R> visitor, P parameter);

  /** Kind-specific data other than children that distinguishes two nodes of the same kind. */
  abstract Object payload();

  @Override
  public final String toString() {
    return ExprFormatter.format(this);
  }

  /**
   * Returns true if {@code a} and {@code b} have the same shape: same kinds, types, payloads and structurally equal
   * children. Variables compare by name and type.
   */
  public static boolean structurallyEquals(Expr<?> a, Expr<?> b) {
    Deque<Expr<?>> left = new ArrayDeque<>();
    Deque<Expr<?>> right = new ArrayDeque<>();
    Set<Pair> proven = new HashSet<>();
    left.push(a);
    right.push(b);
    while (!left.isEmpty()) {
      Expr<?> x = left.pop();
      Expr<?> y = right.pop();
      if (x == y || !proven.add(new Pair(x.id, y.id))) {
        continue;
      }
      if (x.kind() != y.kind() || !x.type.equals(y.type) || !Objects.equals(x.payload(), y.payload())) {
        return false;
      }
      List<Expr<?>> xs = x.children();
      List<Expr<?>> ys = y.children();
      if (xs.size() != ys.size()) {
        return false;
      }
      for (int i = 0; i < xs.size(); i++) {
        left.push(xs.get(i));
        right.push(ys.get(i));
      }
    }
    return true;
  }

  private record Pair(long a, long b) {}

  static void checkType(Expr<?> expr, ExprType<?> expected, String role) {
    Contract.notNull(expr, role);
    Contract.check(expected.equals(expr.type()), "%s must have type %s but was %s", role, expected, expr.type());
  }

  static void checkSameType(Expr<?> a, Expr<?> b, String operation) {
    Contract.notNull(a, operation + " operand");
    Contract.notNull(b, operation + " operand");
    Contract.check(a.type().equals(b.type()), "%s operands have different types: %s and %s", operation, a.type(),
      b.type());
  }
}
