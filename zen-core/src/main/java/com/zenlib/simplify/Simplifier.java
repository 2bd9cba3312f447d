package com.zenlib.simplify;

import com.zenlib.config.ZenConfig;
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
import com.zenlib.interpret.Operations;
import com.zenlib.stats.Timer;
import com.zenlib.type.IntType;
import com.zenlib.type.ObjectValue;
import com.zenlib.util.Contract;
import com.zenlib.util.LargeStack;
import com.zenlib.util.LogUtil;
import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;
import javax.annotation.concurrent.NotThreadSafe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites expressions into an equivalent normal form: constants folded, dead branches removed, field accesses and
 * adapters fused, list matches over known lists unrolled and commutative operands in ascending id order.
 * <p>
 * Nodes are simplified bottom-up: children first, then the rule set of the node's kind runs on the simplified
 * children. Rules that push an operation into both branches of a conditional, and list match unrolling, build new
 * expressions that have to be simplified before the node's result is known. Those are pushed onto the same explicit
 * work stack as children, and the node is finished once they are, so the depth of the call stack does not grow with
 * the depth of the expression or the length of a list.
 * <p>
 * Each instance is one pass: results are cached by node for the lifetime of the instance, so shared subexpressions
 * are simplified once and stay shared in the result. Simplifying a result again returns the same instance.
 */
@NotThreadSafe
public final class Simplifier implements ExprVisitor<Void, RewriteStep> {

  private static final Logger LOGGER = LoggerFactory.getLogger(Simplifier.class);

  private final RewriteCache cache = new RewriteCache();
  private final SimplifierStats stats = new SimplifierStats();

  /**
   * Simplifies {@code expr} in a new pass configured by {@code config}, and logs a summary of the pass.
   */
  public static <T> Expr<T> run(Expr<T> expr, ZenConfig config) {
    Contract.notNull(expr, "expression");
    Supplier<Expr<T>> pass = () -> LogUtil.withStage("simplify", () -> {
      Simplifier simplifier = new Simplifier();
      Timer timer = Timer.start();
      Expr<T> result = simplifier.simplify(expr);
      simplifier.stats.elapsed(timer.stop().elapsed());
      if (config.logStats()) {
        LOGGER.info("{}", simplifier.stats);
      } else {
        LOGGER.debug("{}", simplifier.stats);
      }
      return result;
    });
    return config.largeStack() ? LargeStack.run(config.stackSize(), pass) : pass.get();
  }

  public SimplifierStats stats() {
    return stats;
  }

  private enum Phase {
    /** Queue the children of a node. */
    EXPAND,
    /** Run the rules of a node whose children are simplified. */
    REWRITE,
    /** Build the result of a node from the simplified inputs its rules asked for. */
    RESUME
  }

  private record Frame(Phase phase, Expr<?> node, RewriteStep step) {}

  /** Returns the simplified form of {@code expr}. */
  public <T> Expr<T> simplify(Expr<T> expr) {
    Expr<T> cached = cache.get(Contract.notNull(expr, "expression"));
    if (cached != null) {
      stats.cacheHit();
      return cached;
    }
    Deque<Frame> stack = new ArrayDeque<>();
    stack.push(new Frame(Phase.EXPAND, expr, null));
    while (!stack.isEmpty()) {
      Frame frame = stack.pop();
      switch (frame.phase()) {
        case EXPAND -> expand(stack, frame.node());
        case REWRITE -> rewrite(stack, frame.node());
        case RESUME -> resume(frame.node(), frame.step());
      }
    }
    return simplified(expr);
  }

  private void expand(Deque<Frame> stack, Expr<?> node) {
    if (cache.contains(node)) {
      stats.cacheHit();
      return;
    }
    cache.checkNotPending(node);
    stack.push(new Frame(Phase.REWRITE, node, null));
    pushAll(stack, node.children());
  }

  private void pushAll(Deque<Frame> stack, List<Expr<?>> nodes) {
    for (int i = nodes.size() - 1; i >= 0; i--) {
      Expr<?> node = nodes.get(i);
      if (cache.contains(node)) {
        stats.cacheHit();
      } else {
        stack.push(new Frame(Phase.EXPAND, node, null));
      }
    }
  }

  private void rewrite(Deque<Frame> stack, Expr<?> node) {
    stats.rewrite();
    RewriteStep step = node.accept(this, null);
    if (step.deferred()) {
      // suspend before queueing inputs so an input that contains the node is detected
      cache.suspend(node);
      stack.push(new Frame(Phase.RESUME, node, step));
      pushAll(stack, step.inputs());
    } else {
      cache.complete(node, step.result());
    }
  }

  private void resume(Expr<?> node, RewriteStep step) {
    List<Expr<?>> results = new ArrayList<>(step.inputs().size());
    for (Expr<?> input : step.inputs()) {
      results.add(simplified(input));
    }
    cache.complete(node, step.finish().apply(results));
  }

  /** Returns the result for a node the walk has already simplified. */
  private <T> Expr<T> simplified(Expr<T> node) {
    Expr<T> result = cache.get(node);
    if (result == null) {
      throw Contract.unreachable("%s was not simplified before its parent", node);
    }
    return result;
  }

  private static RewriteStep done(Expr<?> result) {
    return RewriteStep.done(result);
  }

  private <T> T fire(Rule rule, T result) {
    stats.fired(rule);
    return result;
  }

  /** Orders the operands of a commutative operator by id and builds it. */
  private <T, R> R ordered(Expr<T> left, Expr<T> right, BiFunction<Expr<T>, Expr<T>, R> build) {
    if (left.id() > right.id()) {
      return fire(Rule.COMMUTATIVE_ORDER, build.apply(right, left));
    }
    return build.apply(left, right);
  }

  /** Builds a conditional over branches that are already simplified. */
  private <T> Expr<T> conditional(Expr<Boolean> guard, Expr<T> trueCase, Expr<T> falseCase) {
    if (guard instanceof ConstantExpr<Boolean> constant) {
      return fire(Rule.IF_CONSTANT, constant.value() ? trueCase : falseCase);
    }
    if (trueCase == falseCase) {
      return fire(Rule.IF_SAME_BRANCH, trueCase);
    }
    return IfExpr.create(guard, trueCase, falseCase);
  }

  /**
   * Applies {@code rebuild} to both branches of a simplified conditional, and joins the simplified results under the
   * same guard.
   */
  @SuppressWarnings("unchecked")
  private <S, T> RewriteStep distribute(IfExpr<S> branches, Function<Expr<S>, Expr<T>> rebuild) {
    Expr<Boolean> guard = branches.guard();
    List<Expr<?>> inputs = List.of(rebuild.apply(branches.trueCase()), rebuild.apply(branches.falseCase()));
    return RewriteStep.after(inputs, results -> conditional(guard, (Expr<T>) results.get(0), (Expr<T>) results.get(1)));
  }

  @Override
  public <T> RewriteStep visitConstant(ConstantExpr<T> expr, Void parameter) {
    return done(expr);
  }

  @Override
  public <T> RewriteStep visitVariable(VariableExpr<T> expr, Void parameter) {
    return done(expr);
  }

  @Override
  public RewriteStep visitNot(NotExpr expr, Void parameter) {
    Expr<Boolean> inner = simplified(expr.expr());
    if (inner instanceof ConstantExpr<Boolean> constant) {
      return done(fire(Rule.NOT_CONSTANT, Zen.constant(!constant.value())));
    }
    if (inner instanceof NotExpr not) {
      return done(fire(Rule.NOT_NOT, not.expr()));
    }
    return done(NotExpr.create(inner));
  }

  @Override
  public RewriteStep visitAnd(AndExpr expr, Void parameter) {
    Expr<Boolean> left = simplified(expr.left());
    Expr<Boolean> right = simplified(expr.right());
    if (left instanceof ConstantExpr<Boolean> constant) {
      return done(fire(Rule.AND_CONSTANT, constant.value() ? right : left));
    }
    if (right instanceof ConstantExpr<Boolean> constant) {
      return done(fire(Rule.AND_CONSTANT, constant.value() ? left : right));
    }
    if (left == right) {
      return done(fire(Rule.AND_SAME, left));
    }
    return done(ordered(left, right, AndExpr::create));
  }

  @Override
  public RewriteStep visitOr(OrExpr expr, Void parameter) {
    Expr<Boolean> left = simplified(expr.left());
    Expr<Boolean> right = simplified(expr.right());
    if (left instanceof ConstantExpr<Boolean> constant) {
      return done(fire(Rule.OR_CONSTANT, constant.value() ? left : right));
    }
    if (right instanceof ConstantExpr<Boolean> constant) {
      return done(fire(Rule.OR_CONSTANT, constant.value() ? right : left));
    }
    if (left == right) {
      return done(fire(Rule.OR_SAME, left));
    }
    return done(ordered(left, right, OrExpr::create));
  }

  @Override
  public <T> RewriteStep visitIf(IfExpr<T> expr, Void parameter) {
    return done(conditional(simplified(expr.guard()), simplified(expr.trueCase()), simplified(expr.falseCase())));
  }

  @Override
  public <T> RewriteStep visitEq(EqExpr<T> expr, Void parameter) {
    Expr<T> left = simplified(expr.left());
    Expr<T> right = simplified(expr.right());
    if (left instanceof ConstantExpr<T> a && right instanceof ConstantExpr<T> b) {
      return done(fire(Rule.EQ_CONSTANT, Zen.constant(Objects.equals(a.value(), b.value()))));
    }
    return done(ordered(left, right, EqExpr::create));
  }

  @Override
  public <T> RewriteStep visitCompare(CompareExpr<T> expr, Void parameter) {
    Expr<T> left = simplified(expr.left());
    Expr<T> right = simplified(expr.right());
    if (left instanceof ConstantExpr<T> a && right instanceof ConstantExpr<T> b) {
      boolean result = Operations.compare(expr.op(), left.type(), a.value(), b.value());
      return done(fire(Rule.COMPARE_CONSTANT, Zen.constant(result)));
    }
    return done(CompareExpr.create(expr.op(), left, right));
  }

  @Override
  public <T> RewriteStep visitArith(ArithExpr<T> expr, Void parameter) {
    Expr<T> left = simplified(expr.left());
    Expr<T> right = simplified(expr.right());
    ArithExpr.Op op = expr.op();
    if (left instanceof ConstantExpr<T> a && right instanceof ConstantExpr<T> b) {
      T result = Operations.arith(op, expr.type(), a.value(), b.value());
      return done(fire(Rule.ARITH_CONSTANT, ConstantExpr.create(expr.type(), result)));
    }
    switch (op) {
      case SUM -> {
        if (isConstant(left, 0)) {
          return done(fire(Rule.ARITH_IDENTITY, right));
        } else if (isConstant(right, 0)) {
          return done(fire(Rule.ARITH_IDENTITY, left));
        }
      }
      case DIFFERENCE -> {
        if (isConstant(right, 0)) {
          return done(fire(Rule.ARITH_IDENTITY, left));
        }
      }
      case PRODUCT -> {
        if (isConstant(left, 0) || isConstant(right, 1)) {
          return done(fire(Rule.ARITH_IDENTITY, left));
        } else if (isConstant(right, 0) || isConstant(left, 1)) {
          return done(fire(Rule.ARITH_IDENTITY, right));
        }
      }
      default -> {
        // min and max have no identities without bounds analysis
      }
    }
    if (op.isCommutative()) {
      return done(ordered(left, right, (x, y) -> ArithExpr.create(op, x, y)));
    }
    return done(ArithExpr.create(op, left, right));
  }

  private static boolean isConstant(Expr<?> expr, long value) {
    if (expr instanceof ConstantExpr<?> constant) {
      Object v = constant.value();
      return (v instanceof Long l && l == value) || (v instanceof BigInteger b && b.equals(BigInteger.valueOf(value)));
    }
    return false;
  }

  @Override
  public RewriteStep visitBitwise(BitwiseExpr expr, Void parameter) {
    Expr<Long> left = simplified(expr.left());
    Expr<Long> right = simplified(expr.right());
    if (left instanceof ConstantExpr<Long> a && right instanceof ConstantExpr<Long> b) {
      IntType type = (IntType) expr.type();
      long result = Operations.bitwise(expr.op(), type, a.value(), b.value());
      return done(fire(Rule.BITWISE_CONSTANT, ConstantExpr.create(type, result)));
    }
    return done(ordered(left, right, (x, y) -> BitwiseExpr.create(expr.op(), x, y)));
  }

  @Override
  public RewriteStep visitBitwiseNot(BitwiseNotExpr expr, Void parameter) {
    Expr<Long> inner = simplified(expr.expr());
    if (inner instanceof ConstantExpr<Long> constant) {
      IntType type = (IntType) expr.type();
      long result = Operations.bitwiseNot(type, constant.value());
      return done(fire(Rule.BITWISE_CONSTANT, ConstantExpr.create(type, result)));
    }
    return done(BitwiseNotExpr.create(inner));
  }

  @Override
  public RewriteStep visitCreateObject(CreateObjectExpr expr, Void parameter) {
    Map<String, Expr<?>> fields = new LinkedHashMap<>();
    for (var field : expr.fields().entrySet()) {
      fields.put(field.getKey(), simplified(field.getValue()));
    }
    return done(CreateObjectExpr.create(expr.objectType(), fields));
  }

  @Override
  @SuppressWarnings("unchecked")
  public <T> RewriteStep visitGetField(GetFieldExpr<T> expr, Void parameter) {
    String field = expr.field();
    Expr<ObjectValue> host = simplified(expr.host());
    while (host instanceof WithFieldExpr<?> with) {
      if (with.field().equals(field)) {
        return done(fire(Rule.GET_WITH_SAME_FIELD, (Expr<T>) with.value()));
      }
      host = fire(Rule.GET_WITH_OTHER_FIELD, with.host());
    }
    if (host instanceof IfExpr<ObjectValue> branches) {
      return fire(Rule.GET_IF, distribute(branches, branch -> GetFieldExpr.<T>create(branch, field)));
    }
    if (host instanceof CreateObjectExpr create) {
      return done(fire(Rule.GET_CREATE, create.field(field)));
    }
    return done(GetFieldExpr.create(host, field));
  }

  @Override
  public <F> RewriteStep visitWithField(WithFieldExpr<F> expr, Void parameter) {
    return done(WithFieldExpr.create(simplified(expr.host()), expr.field(), simplified(expr.value())));
  }

  @Override
  public <E> RewriteStep visitListEmpty(ListEmptyExpr<E> expr, Void parameter) {
    return done(expr);
  }

  @Override
  public <E> RewriteStep visitListCons(ListConsExpr<E> expr, Void parameter) {
    return done(ListConsExpr.create(simplified(expr.head()), simplified(expr.tail())));
  }

  @Override
  public <E, T> RewriteStep visitListMatch(ListMatchExpr<E, T> expr, Void parameter) {
    Expr<List<E>> list = simplified(expr.list());
    if (list instanceof ListEmptyExpr<E>) {
      return done(fire(Rule.MATCH_EMPTY, simplified(expr.emptyCase())));
    }
    if (list instanceof ListConsExpr<E> cons) {
      Expr<T> unrolled = expr.applyConsCase(cons.head(), cons.tail());
      return fire(Rule.MATCH_CONS, RewriteStep.after(List.<Expr<?>>of(unrolled), results -> results.get(0)));
    }
    Expr<T> emptyCase = simplified(expr.emptyCase());
    if (list instanceof IfExpr<List<E>> branches) {
      return fire(Rule.MATCH_IF,
        distribute(branches, branch -> ListMatchExpr.create(branch, emptyCase, expr.consCase())));
    }
    return done(ListMatchExpr.create(list, emptyCase, expr.consCase()));
  }

  @Override
  @SuppressWarnings("unchecked")
  public <T, F> RewriteStep visitAdapter(AdapterExpr<T, F> expr, Void parameter) {
    Expr<F> inner = simplified(expr.expr());
    if (inner instanceof AdapterExpr<?, ?> nested && nested.expr().type().equals(expr.type())) {
      return done(fire(Rule.ADAPTER_FUSION, (Expr<T>) nested.expr()));
    }
    if (inner instanceof IfExpr<F> branches) {
      return fire(Rule.ADAPTER_IF,
        distribute(branches, branch -> AdapterExpr.create(expr.type(), branch, expr.converters())));
    }
    return done(AdapterExpr.create(expr.type(), inner, expr.converters()));
  }
}
