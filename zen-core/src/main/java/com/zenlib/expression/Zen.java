package com.zenlib.expression;

import com.google.common.base.Suppliers;
import com.zenlib.config.ZenConfig;
import com.zenlib.interpret.Environment;
import com.zenlib.interpret.Evaluator;
import com.zenlib.simplify.Simplifier;
import com.zenlib.type.ExprType;
import com.zenlib.type.IntType;
import com.zenlib.type.ListType;
import com.zenlib.type.ObjectType;
import com.zenlib.type.ObjectValue;
import com.zenlib.util.Contract;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Static factory methods that build expressions, plus entry points to simplify and evaluate them.
 * <p>
 * Factories only validate and intern, they never rewrite: {@code and(TRUE, x)} is an {@link AndExpr} until it is
 * passed through {@link #simplify(Expr)}.
 * <p>
 * For example:
 *
 * <pre>
 * {@code
 * var x = Zen.symbolic(ExprType.INT32, "x");
 * var e = Zen.ite(Zen.leq(x, Zen.constant(ExprType.INT32, 10)), Zen.plus(x, Zen.constant(ExprType.INT32, 0)), x);
 * Zen.simplify(e); // If(Leq(x, 10), x, x) collapses to x
 * }
 * </pre>
 */
public final class Zen {

  public static final ConstantExpr<Boolean> TRUE = ConstantExpr.create(ExprType.BOOL, true);
  public static final ConstantExpr<Boolean> FALSE = ConstantExpr.create(ExprType.BOOL, false);

  private static final Supplier<ZenConfig> CONFIG = Suppliers.memoize(ZenConfig::fromEnvironment);

  private Zen() {}

  /* Leaves */

  /**
   * Returns a constant of a scalar type.
   *
   * @throws com.zenlib.ContractViolationException if {@code value} is not a valid value of {@code type}
   */
  public static <T> ConstantExpr<T> constant(ExprType<T> type, Object value) {
    return ConstantExpr.create(type, value);
  }

  public static ConstantExpr<Boolean> constant(boolean value) {
    return value ? TRUE : FALSE;
  }

  public static ConstantExpr<String> constant(String value) {
    return ConstantExpr.create(ExprType.STRING, value);
  }

  public static ConstantExpr<BigInteger> constant(BigInteger value) {
    return ConstantExpr.create(ExprType.BIG_INTEGER, value);
  }

  /** Returns a new variable, distinct from every other variable even with the same name. */
  public static <T> VariableExpr<T> symbolic(ExprType<T> type, String name) {
    return VariableExpr.create(type, name);
  }

  /**
   * Returns an expression that denotes {@code value}: scalars become constants, lists become a chain of cons cells and
   * objects become a create-object expression over their lifted fields.
   */
  @SuppressWarnings("unchecked")
  public static <T> Expr<T> lift(ExprType<T> type, Object value) {
    Contract.notNull(type, "type");
    if (type instanceof ListType<?> listType) {
      return (Expr<T>) liftList(listType, value);
    } else if (type instanceof ObjectType objectType) {
      ObjectValue object = objectType.checkValue(value);
      Map<String, Expr<?>> fields = new LinkedHashMap<>();
      objectType.fields().forEach((field, fieldType) -> fields.put(field, lift(fieldType, object.get(field))));
      return (Expr<T>) CreateObjectExpr.create(objectType, fields);
    }
    return constant(type, value);
  }

  private static <E> Expr<List<E>> liftList(ListType<E> type, Object value) {
    List<E> values = type.checkValue(value);
    Expr<List<E>> result = ListEmptyExpr.create(type);
    for (int i = values.size() - 1; i >= 0; i--) {
      result = ListConsExpr.create(lift(type.elementType(), values.get(i)), result);
    }
    return result;
  }

  /* Boolean logic */

  public static Expr<Boolean> not(Expr<Boolean> expr) {
    return NotExpr.create(expr);
  }

  public static Expr<Boolean> and(Expr<Boolean> left, Expr<Boolean> right) {
    return AndExpr.create(left, right);
  }

  /** Returns the right-nested conjunction of {@code exprs}, or {@link #TRUE} if there are none. */
  @SafeVarargs
  public static Expr<Boolean> and(Expr<Boolean>... exprs) {
    if (exprs.length == 0) {
      return TRUE;
    }
    Expr<Boolean> result = exprs[exprs.length - 1];
    for (int i = exprs.length - 2; i >= 0; i--) {
      result = and(exprs[i], result);
    }
    return result;
  }

  public static Expr<Boolean> or(Expr<Boolean> left, Expr<Boolean> right) {
    return OrExpr.create(left, right);
  }

  /** Returns the right-nested disjunction of {@code exprs}, or {@link #FALSE} if there are none. */
  @SafeVarargs
  public static Expr<Boolean> or(Expr<Boolean>... exprs) {
    if (exprs.length == 0) {
      return FALSE;
    }
    Expr<Boolean> result = exprs[exprs.length - 1];
    for (int i = exprs.length - 2; i >= 0; i--) {
      result = or(exprs[i], result);
    }
    return result;
  }

  public static Expr<Boolean> implies(Expr<Boolean> left, Expr<Boolean> right) {
    return or(not(left), right);
  }

  /** If-then-else. */
  public static <T> Expr<T> ite(Expr<Boolean> guard, Expr<T> trueCase, Expr<T> falseCase) {
    return IfExpr.create(guard, trueCase, falseCase);
  }

  /* Comparisons */

  public static <T> Expr<Boolean> eq(Expr<T> left, Expr<T> right) {
    return EqExpr.create(left, right);
  }

  public static <T> Expr<Boolean> leq(Expr<T> left, Expr<T> right) {
    return CompareExpr.create(CompareExpr.Op.LEQ, left, right);
  }

  public static <T> Expr<Boolean> geq(Expr<T> left, Expr<T> right) {
    return CompareExpr.create(CompareExpr.Op.GEQ, left, right);
  }

  public static <T> Expr<Boolean> lt(Expr<T> left, Expr<T> right) {
    return not(geq(left, right));
  }

  public static <T> Expr<Boolean> gt(Expr<T> left, Expr<T> right) {
    return not(leq(left, right));
  }

  /* Arithmetic */

  public static <T> Expr<T> plus(Expr<T> left, Expr<T> right) {
    return ArithExpr.create(ArithExpr.Op.SUM, left, right);
  }

  public static <T> Expr<T> minus(Expr<T> left, Expr<T> right) {
    return ArithExpr.create(ArithExpr.Op.DIFFERENCE, left, right);
  }

  public static <T> Expr<T> multiply(Expr<T> left, Expr<T> right) {
    return ArithExpr.create(ArithExpr.Op.PRODUCT, left, right);
  }

  public static <T> Expr<T> min(Expr<T> left, Expr<T> right) {
    return ArithExpr.create(ArithExpr.Op.MIN, left, right);
  }

  public static <T> Expr<T> max(Expr<T> left, Expr<T> right) {
    return ArithExpr.create(ArithExpr.Op.MAX, left, right);
  }

  public static Expr<Long> bitwiseAnd(Expr<Long> left, Expr<Long> right) {
    return BitwiseExpr.create(BitwiseExpr.Op.AND, left, right);
  }

  public static Expr<Long> bitwiseOr(Expr<Long> left, Expr<Long> right) {
    return BitwiseExpr.create(BitwiseExpr.Op.OR, left, right);
  }

  public static Expr<Long> bitwiseXor(Expr<Long> left, Expr<Long> right) {
    return BitwiseExpr.create(BitwiseExpr.Op.XOR, left, right);
  }

  public static Expr<Long> bitwiseNot(Expr<Long> expr) {
    return BitwiseNotExpr.create(expr);
  }

  /* Objects */

  /** Returns an object of {@code type} built from one expression per declared field. */
  public static Expr<ObjectValue> createObject(ObjectType type, Map<String, ? extends Expr<?>> fields) {
    return CreateObjectExpr.create(type, fields);
  }

  /** Shorthand for {@link #createObject(ObjectType, Map)} from alternating field names and expressions. */
  public static Expr<ObjectValue> createObject(ObjectType type, Object... namesAndValues) {
    Contract.check(namesAndValues.length % 2 == 0, "expected field name and value pairs");
    Map<String, Expr<?>> fields = new LinkedHashMap<>();
    for (int i = 0; i < namesAndValues.length; i += 2) {
      Contract.check(namesAndValues[i] instanceof String && namesAndValues[i + 1] instanceof Expr<?>,
        "expected a field name followed by an expression at position %d", i);
      fields.put((String) namesAndValues[i], (Expr<?>) namesAndValues[i + 1]);
    }
    return createObject(type, fields);
  }

  /** Returns {@code field} of {@code object}, typed as the declared type of the field. */
  public static <T> Expr<T> getField(Expr<ObjectValue> object, String field) {
    return GetFieldExpr.create(object, field);
  }

  /**
   * Returns {@code field} of {@code object}, checking that it is declared with {@code fieldType}.
   *
   * @throws com.zenlib.ContractViolationException if the field has another type
   */
  public static <T> Expr<T> getField(Expr<ObjectValue> object, String field, ExprType<T> fieldType) {
    Expr<T> result = GetFieldExpr.create(object, field);
    Expr.checkType(result, fieldType, "field " + field);
    return result;
  }

  public static <F> Expr<ObjectValue> withField(Expr<ObjectValue> object, String field, Expr<F> value) {
    return WithFieldExpr.create(object, field, value);
  }

  /* Lists */

  public static <E> Expr<List<E>> emptyList(ExprType<E> elementType) {
    return ListEmptyExpr.create(new ListType<>(elementType));
  }

  /** Returns {@code list} with {@code head} added at the front. */
  public static <E> Expr<List<E>> cons(Expr<E> head, Expr<List<E>> list) {
    return ListConsExpr.create(head, list);
  }

  @SafeVarargs
  public static <E> Expr<List<E>> listOf(ExprType<E> elementType, Expr<E>... elements) {
    Expr<List<E>> result = emptyList(elementType);
    for (int i = elements.length - 1; i >= 0; i--) {
      result = cons(elements[i], result);
    }
    return result;
  }

  /**
   * Case split on {@code list}. Reuse the same {@code consCase} instance to build matches that should be shared.
   */
  public static <E, T> Expr<T> match(Expr<List<E>> list, Expr<T> emptyCase,
    BiFunction<Expr<E>, Expr<List<E>>, Expr<T>> consCase) {
    return ListMatchExpr.create(list, emptyCase, consCase);
  }

  /* Adapters */

  public static <T, F> Expr<T> adapt(ExprType<T> type, Expr<F> expr, Function<F, T> converter) {
    return AdapterExpr.create(type, expr, List.of(Contract.notNull(converter, "converter")));
  }

  /** Returns {@code expr} exposed as {@code type}, converting concrete values through {@code converters} in order. */
  public static <T, F> Expr<T> adaptAll(ExprType<T> type, Expr<F> expr, List<? extends Function<?, ?>> converters) {
    return AdapterExpr.create(type, expr, converters);
  }

  /* Passes */

  /**
   * Returns a simplified expression equivalent to {@code expr}, using settings from JVM properties and environmental
   * variables.
   */
  public static <T> Expr<T> simplify(Expr<T> expr) {
    return simplify(expr, CONFIG.get());
  }

  public static <T> Expr<T> simplify(Expr<T> expr, ZenConfig config) {
    return Simplifier.run(expr, config);
  }

  /** Returns the concrete value of {@code expr} when every variable has its type's default value. */
  public static <T> T evaluate(Expr<T> expr) {
    return evaluate(expr, Environment.empty());
  }

  public static <T> T evaluate(Expr<T> expr, Environment environment) {
    return new Evaluator(environment).evaluate(expr);
  }

  /** Returns a constant of {@code type} for a {@code long} value, normalizing it to the width of the type. */
  public static ConstantExpr<Long> wrap(IntType type, long value) {
    return ConstantExpr.create(type, type.normalize(value));
  }
}
